package org.patterncompare.engine;

import org.patterncompare.align.CoordinateAligner;
import org.patterncompare.grid.GridBuilder;
import org.patterncompare.grid.GridSet;
import org.patterncompare.io.RawTable;
import org.patterncompare.io.TableRole;
import org.patterncompare.metrics.ErrorMetrics;
import org.patterncompare.metrics.ErrorRanking;
import org.patterncompare.metrics.ErrorSummary;
import org.patterncompare.metrics.RankedError;
import org.patterncompare.model.AlignedColumn;
import org.patterncompare.model.AlignedTable;
import org.patterncompare.model.SampleSchema;
import org.patterncompare.model.SampleTable;
import org.patterncompare.model.SampleTableAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Aligner/metrics pipeline: validate, align, then summarize, rank and grid.
 *
 * Every stage is a pure function of its inputs; a failing stage ends the run
 * with a {@link org.patterncompare.exceptions.ComparisonException}.
 */
public final class ComparisonEngine {

    private static final Logger log = LoggerFactory.getLogger(ComparisonEngine.class);

    private final SampleTableAssembler assembler;
    private final CoordinateAligner aligner;
    private final ErrorMetrics metrics;
    private final ErrorRanking ranking;
    private final GridBuilder gridBuilder;

    public ComparisonEngine() {
        this(new SampleTableAssembler(), new CoordinateAligner(), new ErrorMetrics(), new ErrorRanking(), new GridBuilder());
    }

    public ComparisonEngine(SampleTableAssembler assembler,
                            CoordinateAligner aligner,
                            ErrorMetrics metrics,
                            ErrorRanking ranking,
                            GridBuilder gridBuilder) {
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
        this.aligner = Objects.requireNonNull(aligner, "aligner must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.ranking = Objects.requireNonNull(ranking, "ranking must not be null");
        this.gridBuilder = Objects.requireNonNull(gridBuilder, "gridBuilder must not be null");
    }

    /**
     * Runs the whole pipeline on two parsed tables.
     *
     * @param reference      raw table with role {@link TableRole#REFERENCE}
     * @param reconstruction raw table with role {@link TableRole#RECONSTRUCTION}
     * @param schema         coordinate and value field names
     * @param topN           number of largest-error rows to report (>= 1)
     */
    public ComparisonResult compare(RawTable reference, RawTable reconstruction, SampleSchema schema, int topN) {
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(reconstruction, "reconstruction must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        if (topN <= 0) throw new IllegalArgumentException("topN must be >= 1");

        SampleTable ref = assembler.assemble(reference, schema);
        SampleTable recon = assembler.assemble(reconstruction, schema);

        AlignedTable aligned = align(ref, recon, schema);
        ErrorSummary summary = summarize(aligned);
        List<RankedError> top = topErrors(aligned, topN);
        GridSet grids = toGrids(aligned);

        log.info("MSE={} RMSE={} bias={} over {} points", summary.mse(), summary.rmse(), summary.bias(), summary.count());
        log.debug("Grid shape {}x{}", grids.rows(), grids.columns());
        return new ComparisonResult(aligned, summary, top, grids);
    }

    public void validate(RawTable table, List<String> requiredFields) {
        assembler.validate(table, requiredFields);
    }

    public SampleTable assemble(RawTable table, SampleSchema schema) {
        return assembler.assemble(table, schema);
    }

    public AlignedTable align(SampleTable reference, SampleTable reconstruction, SampleSchema schema) {
        return aligner.align(reference, reconstruction, schema);
    }

    public ErrorSummary summarize(AlignedTable aligned) {
        return metrics.summarize(aligned);
    }

    public List<RankedError> topErrors(AlignedTable aligned, int n) {
        return ranking.topErrors(aligned, n);
    }

    public GridSet toGrids(AlignedTable aligned) {
        return gridBuilder.toGrids(aligned);
    }

    public GridSet toGrids(AlignedTable aligned, AlignedColumn recon, AlignedColumn ref, AlignedColumn error) {
        return gridBuilder.toGrids(aligned, recon, ref, error);
    }
}
