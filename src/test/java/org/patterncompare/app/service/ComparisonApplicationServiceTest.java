package org.patterncompare.app.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.patterncompare.app.api.ComparisonConfig;
import org.patterncompare.app.api.dto.BiasDirection;
import org.patterncompare.app.api.dto.ComparisonReport;
import org.patterncompare.app.api.dto.ErrorRowView;
import org.patterncompare.app.api.dto.HeatmapKind;
import org.patterncompare.app.api.dto.HeatmapView;
import org.patterncompare.exceptions.EmptyAlignmentException;
import org.patterncompare.exceptions.IngestionException;
import org.patterncompare.exceptions.MissingFieldsException;
import org.patterncompare.io.TableRole;
import org.patterncompare.io.csv.CsvSampleSource;
import org.patterncompare.io.json.JsonSampleSource;
import org.patterncompare.model.SampleSchema;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ComparisonApplicationServiceTest {

    private static final String HEADER = "Phi[deg],Theta[deg],dB10normalize(GainTotal)\n";

    @TempDir
    Path dir;

    private final ComparisonApplicationService service = new ComparisonApplicationService();

    private Path write(String name, String content) throws IOException {
        Path p = dir.resolve(name);
        Files.writeString(p, content, StandardCharsets.UTF_8);
        return p;
    }

    @Test
    void compare_csvFiles_buildsReport() throws IOException {
        Path recon = write("interp.csv", HEADER + "0,0,-1\n0,10,-4\n10,0,-2\n10,10,-9\n");
        Path ref = write("orig.csv", HEADER + "0,0,-2\n0,10,-4\n10,0,-2\n10,10,-6\n");

        ComparisonReport report = service.compare(ComparisonConfig.of(recon, ref));

        assertEquals("Phi[deg]", report.coordAField());
        assertEquals("Theta[deg]", report.coordBField());
        assertEquals(4, report.summary().alignedCount());
        // diffs: 1, 0, 0, -3
        assertEquals(2.5, report.summary().mse(), 1e-12);
        assertEquals(Math.sqrt(2.5), report.summary().rmse(), 1e-12);
        assertEquals(-0.5, report.summary().bias(), 1e-12);
        assertEquals(BiasDirection.CONSERVATIVE, report.summary().direction());

        assertEquals(4, report.topErrors().size());
        ErrorRowView worst = report.topErrors().get(0);
        assertEquals(1, worst.rank());
        assertEquals(10.0, worst.coordA());
        assertEquals(10.0, worst.coordB());
        assertEquals(-3.0, worst.difference(), 1e-12);
        assertEquals(9.0, worst.squaredError(), 1e-12);
    }

    @Test
    void toReport_producesThreeHeatmapsOnSharedGrid() throws IOException {
        Path recon = write("interp.csv", HEADER + "0,0,1\n0,10,2\n10,0,3\n");
        Path ref = write("orig.csv", HEADER + "0,0,1\n0,10,1\n10,0,5\n20,20,9\n");

        ComparisonReport report = service.compare(ComparisonConfig.of(recon, ref));

        assertEquals(3, report.heatmaps().size());
        HeatmapView reconMap = report.heatmaps().get(0);
        HeatmapView refMap = report.heatmaps().get(1);
        HeatmapView errMap = report.heatmaps().get(2);

        assertEquals("Reconstructed Pattern (Interpolated)", reconMap.title());
        assertEquals("Actual Pattern (Original)", refMap.title());
        assertEquals("Absolute Error", errMap.title());
        assertEquals("Gain [dB]", reconMap.unitLabel());
        assertEquals("Abs Error [dB]", errMap.unitLabel());
        assertEquals(HeatmapKind.VALUE, refMap.kind());
        assertEquals(HeatmapKind.ERROR, errMap.kind());

        for (HeatmapView h : report.heatmaps()) {
            assertEquals(2, h.rows());
            assertEquals(2, h.columns());
            assertEquals(0.0, h.rowMin());
            assertEquals(10.0, h.rowMax());
        }
        // (10, 10) was never aligned
        assertTrue(Double.isNaN(reconMap.values()[1][1]));
        assertEquals(2.0, errMap.values()[1][0], 1e-12);
        assertEquals(0.0, errMap.min(), 1e-12);
        assertEquals(2.0, errMap.max(), 1e-12);
    }

    @Test
    void compare_jsonAndCsvMix() throws IOException {
        Path recon = write("interp.json", """
                [{"Phi[deg]": 0, "Theta[deg]": 0, "dB10normalize(GainTotal)": 1.5}]
                """);
        Path ref = write("orig.csv", HEADER + "0,0,1\n");

        ComparisonReport report = service.compare(ComparisonConfig.of(recon, ref));

        assertEquals(0.25, report.summary().mse(), 1e-12);
        assertEquals(BiasDirection.OPTIMISTIC, report.summary().direction());
    }

    @Test
    void compare_missingField_reportsReferenceRole() throws IOException {
        Path recon = write("interp.csv", HEADER + "0,0,1\n");
        Path ref = write("orig.csv", "Phi[deg],Theta[deg],Gain\n0,0,1\n");

        MissingFieldsException ex = assertThrows(MissingFieldsException.class,
                () -> service.compare(ComparisonConfig.of(recon, ref)));
        assertEquals(TableRole.REFERENCE, ex.role());
    }

    @Test
    void compare_conventionMismatch_failsWithEmptyAlignment() throws IOException {
        Path recon = write("interp.csv", HEADER + "180,0,1\n270,0,1\n");
        Path ref = write("orig.csv", HEADER + "-180,0,1\n-90,0,1\n");

        assertThrows(EmptyAlignmentException.class, () -> service.compare(ComparisonConfig.of(recon, ref)));
    }

    @Test
    void compare_missingFile_isIngestionFailure() throws IOException {
        Path ref = write("orig.csv", HEADER + "0,0,1\n");

        assertThrows(IngestionException.class,
                () -> service.compare(ComparisonConfig.of(dir.resolve("nope.csv"), ref)));
    }

    @Test
    void compare_customSchemaAndSeparator() throws IOException {
        Path recon = write("a.tsv", "az\tel\tloss\n1\t2\t3\n");
        Path ref = write("b.tsv", "az\tel\tloss\n1\t2\t5\n");

        ComparisonReport report = service.compare(
                new ComparisonConfig(recon, ref, new SampleSchema("az", "el", "loss"), 3, '\t'));

        assertEquals(4.0, report.summary().mse(), 1e-12);
        assertEquals("loss", report.heatmaps().get(0).unitLabel());
        assertEquals("Abs Error", report.heatmaps().get(2).unitLabel());
    }

    @Test
    void sourceFor_picksReaderByExtension() {
        assertInstanceOf(JsonSampleSource.class,
                service.sourceFor(TableRole.REFERENCE, Path.of("x.JSON"), ','));
        assertInstanceOf(CsvSampleSource.class,
                service.sourceFor(TableRole.REFERENCE, Path.of("x.csv"), ','));
        assertInstanceOf(CsvSampleSource.class,
                service.sourceFor(TableRole.REFERENCE, Path.of("x.txt"), ';'));
    }

    @Test
    void unitOf_readsBracketsOrDbPrefix() {
        assertEquals("dB", ComparisonApplicationService.unitOf("dB10normalize(GainTotal)"));
        assertEquals("dBi", ComparisonApplicationService.unitOf("Gain[dBi]"));
        assertEquals("", ComparisonApplicationService.unitOf("GainTotal"));
        assertEquals("", ComparisonApplicationService.unitOf("Gain[]"));
    }
}
