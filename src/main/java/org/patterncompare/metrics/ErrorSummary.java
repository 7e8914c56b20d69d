package org.patterncompare.metrics;

/**
 * Aggregate error of one comparison run.
 *
 * @param count number of aligned rows the statistics were computed over
 * @param mse   mean of squared error
 * @param rmse  square root of mse
 * @param bias  mean signed difference (reconstruction - reference)
 */
public record ErrorSummary(int count, double mse, double rmse, double bias) {

    public ErrorSummary {
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1");
        }
        if (!(mse >= 0.0) || !(rmse >= 0.0)) {
            throw new IllegalArgumentException("mse and rmse must be non-negative: mse=" + mse + ", rmse=" + rmse);
        }
    }
}
