package org.patterncompare.app.api.dto;

import java.util.List;
import java.util.Objects;

/**
 * UI-safe outcome of one comparison run.
 *
 * @param coordAField name of the row coordinate (e.g. Phi[deg])
 * @param coordBField name of the column coordinate (e.g. Theta[deg])
 * @param valueField  name of the compared value
 */
public record ComparisonReport(String coordAField,
                               String coordBField,
                               String valueField,
                               SummaryView summary,
                               List<ErrorRowView> topErrors,
                               List<HeatmapView> heatmaps) {

    public ComparisonReport {
        Objects.requireNonNull(coordAField, "coordAField must not be null");
        Objects.requireNonNull(coordBField, "coordBField must not be null");
        Objects.requireNonNull(valueField, "valueField must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        Objects.requireNonNull(topErrors, "topErrors must not be null");
        Objects.requireNonNull(heatmaps, "heatmaps must not be null");
        topErrors = List.copyOf(topErrors);
        heatmaps = List.copyOf(heatmaps);
    }
}
