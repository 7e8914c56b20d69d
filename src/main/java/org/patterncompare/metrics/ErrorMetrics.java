package org.patterncompare.metrics;

import org.patterncompare.model.AlignedRow;
import org.patterncompare.model.AlignedTable;

import java.util.Objects;

/**
 * Aggregate statistics over an aligned table: MSE, RMSE and mean bias.
 */
public final class ErrorMetrics {

    /**
     * Computes the summary. The aligned table is never empty, so every mean is defined.
     */
    public ErrorSummary summarize(AlignedTable aligned) {
        Objects.requireNonNull(aligned, "aligned must not be null");

        double sumSq = 0.0;
        double sumDiff = 0.0;
        for (AlignedRow row : aligned.rows()) {
            sumSq += row.squaredError();
            sumDiff += row.difference();
        }

        int n = aligned.size();
        double mse = sumSq / n;
        return new ErrorSummary(n, mse, Math.sqrt(mse), sumDiff / n);
    }
}
