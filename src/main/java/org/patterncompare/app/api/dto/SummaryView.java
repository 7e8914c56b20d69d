package org.patterncompare.app.api.dto;

import java.util.Objects;

/** UI-safe error summary. */
public record SummaryView(int alignedCount, double mse, double rmse, double bias, BiasDirection direction) {
    public SummaryView {
        Objects.requireNonNull(direction, "direction must not be null");
    }
}
