package org.patterncompare.app.api;

import org.patterncompare.app.api.dto.ComparisonReport;
import org.patterncompare.engine.ComparisonResult;
import org.patterncompare.io.SampleSource;
import org.patterncompare.model.SampleSchema;

/**
 * Application boundary consumed by the console report and the JavaFX viewer.
 * Presentation only reads the returned DTOs.
 */
public interface ComparisonUseCases {

    /**
     * Loads both files named by the config and compares them.
     *
     * @throws org.patterncompare.exceptions.ComparisonException if any stage fails
     */
    ComparisonReport compare(ComparisonConfig config);

    /**
     * Compares two already-configured sources and returns the engine result.
     */
    ComparisonResult run(SampleSource reference, SampleSource reconstruction, SampleSchema schema, int topN);

    /**
     * Maps an engine result to display DTOs.
     */
    ComparisonReport toReport(ComparisonResult result);
}
