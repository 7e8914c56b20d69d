package org.patterncompare.app.api.dto;

/** UI-safe row of the largest-differences table (no dependency on metrics package). */
public record ErrorRowView(int rank,
                           double coordA,
                           double coordB,
                           double reference,
                           double reconstruction,
                           double difference,
                           double squaredError) {
}
