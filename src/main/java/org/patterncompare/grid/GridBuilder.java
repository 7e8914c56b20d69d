package org.patterncompare.grid;

import org.patterncompare.model.AlignedColumn;
import org.patterncompare.model.AlignedRow;
import org.patterncompare.model.AlignedTable;

import java.util.Arrays;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Reshapes aligned rows into dense grids keyed by (a, b).
 *
 * The reconstruction grid defines the canonical coordinates. The reference and error
 * grids are pivoted on their own and then reindexed onto those coordinates, so the
 * three grids can never drift apart in shape or ordering.
 */
public final class GridBuilder {

    /**
     * Pivots with the default columns: reconstruction, reference, absolute error.
     */
    public GridSet toGrids(AlignedTable aligned) {
        return toGrids(aligned, AlignedColumn.RECONSTRUCTION, AlignedColumn.REFERENCE, AlignedColumn.ABS_ERROR);
    }

    public GridSet toGrids(AlignedTable aligned,
                           AlignedColumn reconColumn,
                           AlignedColumn refColumn,
                           AlignedColumn errorColumn) {
        Objects.requireNonNull(aligned, "aligned must not be null");
        Objects.requireNonNull(reconColumn, "reconColumn must not be null");
        Objects.requireNonNull(refColumn, "refColumn must not be null");
        Objects.requireNonNull(errorColumn, "errorColumn must not be null");

        DenseGrid recon = pivot(aligned, reconColumn);
        double[] rowCoords = recon.rowCoordinates();
        double[] colCoords = recon.columnCoordinates();

        DenseGrid ref = reindex(pivot(aligned, refColumn), rowCoords, colCoords);
        DenseGrid error = reindex(pivot(aligned, errorColumn), rowCoords, colCoords);

        return new GridSet(recon, ref, error);
    }

    /**
     * One grid from one column. Rows are the sorted distinct a coordinates, columns the
     * sorted distinct b coordinates; combinations with no aligned row stay NaN.
     */
    public DenseGrid pivot(AlignedTable aligned, AlignedColumn column) {
        Objects.requireNonNull(aligned, "aligned must not be null");
        Objects.requireNonNull(column, "column must not be null");

        TreeSet<Double> as = new TreeSet<>();
        TreeSet<Double> bs = new TreeSet<>();
        for (AlignedRow row : aligned.rows()) {
            as.add(row.key().a());
            bs.add(row.key().b());
        }
        double[] rowCoords = as.stream().mapToDouble(Double::doubleValue).toArray();
        double[] colCoords = bs.stream().mapToDouble(Double::doubleValue).toArray();

        double[][] cells = nanFilled(rowCoords.length, colCoords.length);
        for (AlignedRow row : aligned.rows()) {
            int r = Arrays.binarySearch(rowCoords, row.key().a());
            int c = Arrays.binarySearch(colCoords, row.key().b());
            cells[r][c] = column.valueOf(row);
        }
        return new DenseGrid(rowCoords, colCoords, cells);
    }

    /**
     * Places the grid's cells onto the target coordinates. Target cells the source does
     * not cover become NaN; source cells outside the target are dropped.
     */
    public DenseGrid reindex(DenseGrid grid, double[] rowCoords, double[] colCoords) {
        Objects.requireNonNull(grid, "grid must not be null");
        Objects.requireNonNull(rowCoords, "rowCoords must not be null");
        Objects.requireNonNull(colCoords, "colCoords must not be null");

        double[][] cells = nanFilled(rowCoords.length, colCoords.length);
        for (int r = 0; r < rowCoords.length; r++) {
            int sr = grid.rowIndexOf(rowCoords[r]);
            if (sr < 0) continue;
            for (int c = 0; c < colCoords.length; c++) {
                int sc = grid.columnIndexOf(colCoords[c]);
                if (sc >= 0) {
                    cells[r][c] = grid.get(sr, sc);
                }
            }
        }
        return new DenseGrid(rowCoords, colCoords, cells);
    }

    private static double[][] nanFilled(int rows, int cols) {
        double[][] cells = new double[rows][cols];
        for (double[] row : cells) {
            Arrays.fill(row, Double.NaN);
        }
        return cells;
    }
}
