package org.patterncompare.app.service;

import org.patterncompare.app.api.ComparisonConfig;
import org.patterncompare.app.api.ComparisonUseCases;
import org.patterncompare.app.api.dto.BiasDirection;
import org.patterncompare.app.api.dto.ComparisonReport;
import org.patterncompare.app.api.dto.ErrorRowView;
import org.patterncompare.app.api.dto.HeatmapKind;
import org.patterncompare.app.api.dto.HeatmapView;
import org.patterncompare.app.api.dto.SummaryView;
import org.patterncompare.engine.ComparisonEngine;
import org.patterncompare.engine.ComparisonResult;
import org.patterncompare.grid.AxisRange;
import org.patterncompare.grid.DenseGrid;
import org.patterncompare.grid.GridSet;
import org.patterncompare.io.SampleSource;
import org.patterncompare.io.TableRole;
import org.patterncompare.io.csv.CsvFormat;
import org.patterncompare.io.csv.CsvSampleSource;
import org.patterncompare.io.json.JsonSampleSource;
import org.patterncompare.metrics.ErrorSummary;
import org.patterncompare.metrics.RankedError;
import org.patterncompare.model.AlignedRow;
import org.patterncompare.model.SampleSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Default application service used by the console and JavaFX entry points. */
public final class ComparisonApplicationService implements ComparisonUseCases {

    private static final Logger log = LoggerFactory.getLogger(ComparisonApplicationService.class);

    private final ComparisonEngine engine;

    public ComparisonApplicationService() {
        this(new ComparisonEngine());
    }

    public ComparisonApplicationService(ComparisonEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    @Override
    public ComparisonReport compare(ComparisonConfig config) {
        Objects.requireNonNull(config, "config must not be null");

        SampleSource reconstruction = sourceFor(TableRole.RECONSTRUCTION, config.reconstructionPath(), config.separator());
        SampleSource reference = sourceFor(TableRole.REFERENCE, config.referencePath(), config.separator());

        return toReport(run(reference, reconstruction, config.schema(), config.topN()));
    }

    @Override
    public ComparisonResult run(SampleSource reference, SampleSource reconstruction, SampleSchema schema, int topN) {
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(reconstruction, "reconstruction must not be null");

        // Same order as the inputs are named on the command line
        var reconTable = reconstruction.load();
        var refTable = reference.load();

        return engine.compare(refTable, reconTable, schema, topN);
    }

    @Override
    public ComparisonReport toReport(ComparisonResult result) {
        Objects.requireNonNull(result, "result must not be null");
        SampleSchema schema = result.schema();

        ErrorSummary s = result.summary();
        SummaryView summary = new SummaryView(s.count(), s.mse(), s.rmse(), s.bias(), BiasDirection.of(s.bias()));

        List<ErrorRowView> rows = result.topErrors().stream().map(ComparisonApplicationService::toRowView).toList();

        GridSet grids = result.grids();
        String unit = unitOf(schema.valueField());
        List<HeatmapView> heatmaps = List.of(
                toHeatmap("Reconstructed Pattern (Interpolated)", valueLabel(schema, unit), HeatmapKind.VALUE, grids.reconstruction()),
                toHeatmap("Actual Pattern (Original)", valueLabel(schema, unit), HeatmapKind.VALUE, grids.reference()),
                toHeatmap("Absolute Error", "Abs Error" + (unit.isEmpty() ? "" : " [" + unit + "]"), HeatmapKind.ERROR, grids.error())
        );

        return new ComparisonReport(schema.coordAField(), schema.coordBField(), schema.valueField(),
                summary, rows, heatmaps);
    }

    /** Picks the reader by file extension: .json is JSON, anything else CSV. */
    SampleSource sourceFor(TableRole role, Path path, char separator) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            log.debug("Reading {} as JSON", path);
            return JsonSampleSource.ofFile(role, path);
        }
        return CsvSampleSource.ofFile(role, path, new CsvFormat(separator));
    }

    private static ErrorRowView toRowView(RankedError e) {
        AlignedRow row = e.row();
        return new ErrorRowView(e.rank(), row.key().a(), row.key().b(),
                row.reference(), row.reconstruction(), row.difference(), row.squaredError());
    }

    private static HeatmapView toHeatmap(String title, String unitLabel, HeatmapKind kind, DenseGrid grid) {
        AxisRange rows = grid.rowRange();
        AxisRange cols = grid.columnRange();
        return new HeatmapView(title, unitLabel, kind, grid.toArray(),
                rows.min(), rows.max(), cols.min(), cols.max(), grid.nanMin(), grid.nanMax());
    }

    /**
     * "dB10normalize(GainTotal)" and "Gain[dB]" both read as dB; otherwise no unit is shown.
     */
    static String unitOf(String valueField) {
        String lower = valueField.toLowerCase(Locale.ROOT);
        int open = valueField.lastIndexOf('[');
        int close = valueField.lastIndexOf(']');
        if (open >= 0 && close > open + 1) {
            return valueField.substring(open + 1, close);
        }
        return lower.startsWith("db") ? "dB" : "";
    }

    private static String valueLabel(SampleSchema schema, String unit) {
        return "dB".equals(unit) ? "Gain [dB]" : schema.valueField();
    }
}
