package org.patterncompare.ui.console;

import org.patterncompare.app.api.dto.ComparisonReport;
import org.patterncompare.app.api.dto.ErrorRowView;
import org.patterncompare.app.api.dto.SummaryView;

import java.util.Locale;

/**
 * Plain-text rendering of a comparison report: statistics block, then the largest differences.
 */
public final class ConsoleReport {

    private static final String RULE = "-".repeat(40);

    public String format(ComparisonReport report) {
        StringBuilder sb = new StringBuilder();
        SummaryView s = report.summary();

        sb.append(String.format(Locale.ROOT, "Aligned %d data points for comparison.%n", s.alignedCount()));
        sb.append(RULE).append(System.lineSeparator());
        sb.append(String.format(Locale.ROOT, "Mean Squared Error (MSE):       %.6f%n", s.mse()));
        sb.append(String.format(Locale.ROOT, "Root Mean Squared Error (RMSE): %.6f%n", s.rmse()));
        sb.append(String.format(Locale.ROOT, "Mean Bias:                      %.6f (%s)%n", s.bias(), s.direction().label()));
        sb.append(RULE).append(System.lineSeparator());

        sb.append(System.lineSeparator());
        sb.append(String.format(Locale.ROOT, "Top %d Largest Differences:%n", report.topErrors().size()));
        sb.append(String.format(Locale.ROOT, "%4s  %14s  %14s  %14s  %14s  %12s%n",
                "#", clip(report.coordAField()), clip(report.coordBField()), "reference", "reconstruction", "diff"));
        for (ErrorRowView row : report.topErrors()) {
            sb.append(String.format(Locale.ROOT, "%4d  %14.4f  %14.4f  %14.6f  %14.6f  %12.6f%n",
                    row.rank(), row.coordA(), row.coordB(), row.reference(), row.reconstruction(), row.difference()));
        }
        return sb.toString();
    }

    /** One-line statistics used by the viewer's status bar. */
    public static String statisticsLine(SummaryView s) {
        return String.format(Locale.ROOT, "COMPARISON STATISTICS  |  MSE: %.4f  |  RMSE: %.4f  |  Mean Bias: %.4f (%s)",
                s.mse(), s.rmse(), s.bias(), s.direction().label());
    }

    private static String clip(String header) {
        return header.length() <= 14 ? header : header.substring(0, 14);
    }
}
