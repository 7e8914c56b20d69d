package org.patterncompare.engine;

import org.patterncompare.grid.GridSet;
import org.patterncompare.metrics.ErrorSummary;
import org.patterncompare.metrics.RankedError;
import org.patterncompare.model.AlignedTable;
import org.patterncompare.model.SampleSchema;

import java.util.List;
import java.util.Objects;

/**
 * Everything one comparison run produces. Built once, never mutated; presentation
 * reads from it instead of holding its own state.
 */
public record ComparisonResult(AlignedTable aligned,
                               ErrorSummary summary,
                               List<RankedError> topErrors,
                               GridSet grids) {

    public ComparisonResult {
        Objects.requireNonNull(aligned, "aligned must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        Objects.requireNonNull(topErrors, "topErrors must not be null");
        Objects.requireNonNull(grids, "grids must not be null");
        topErrors = List.copyOf(topErrors);
    }

    public SampleSchema schema() {
        return aligned.schema();
    }

    public int alignedCount() {
        return aligned.size();
    }
}
