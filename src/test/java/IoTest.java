import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.patterncompare.io.*;
import org.patterncompare.exceptions.IngestionException;
import org.patterncompare.io.csv.CsvFormat;
import org.patterncompare.io.csv.CsvSampleSource;
import org.patterncompare.io.json.JsonSampleSource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Covers:
 * - TableRole (labels)
 * - RawTable (trimming, shape checks)
 * - CsvSampleSource (parsing, padding, caching, failures)
 * - JsonSampleSource (parsing, column union, failures)
 */
public class IoTest {

    private static InputStreamSupplier text(String content) {
        return () -> new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    // ----------------------------
    // TableRole tests
    // ----------------------------
    @Nested
    class TableRoleTests {

        @Test
        void toString_isLowercaseLabel() {
            assertEquals("reference", TableRole.REFERENCE.toString());
            assertEquals("reconstruction", TableRole.RECONSTRUCTION.toString());
        }

        @Test
        void roleAppearsInRawTableErrors() {
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                    () -> new RawTable(TableRole.RECONSTRUCTION, List.of("a", "b"), List.of(List.of("1"))));
            assertTrue(ex.getMessage().contains("reconstruction table"));
        }
    }

    // ----------------------------
    // RawTable tests
    // ----------------------------
    @Nested
    class RawTableTests {

        @Test
        void trimsColumnNames() {
            RawTable t = new RawTable(TableRole.REFERENCE, List.of(" Phi[deg] ", "Theta[deg]  "), List.of(List.of("0", "0")));

            assertEquals(List.of("Phi[deg]", "Theta[deg]"), t.columns());
            assertTrue(t.hasColumn("Phi[deg]"));
            assertTrue(t.hasColumn("  Theta[deg]"));
            assertEquals(1, t.columnIndex("Theta[deg]").orElseThrow());
        }

        @Test
        void rowWidthMismatch_throws() {
            assertThrows(IllegalArgumentException.class, () ->
                    new RawTable(TableRole.REFERENCE, List.of("a", "b"), List.of(List.of("1"))));
        }

        @Test
        void rows_areImmutable() {
            RawTable t = new RawTable(TableRole.REFERENCE, List.of("a"), List.of(List.of("1")));
            assertThrows(UnsupportedOperationException.class, () -> t.rows().add(List.of("2")));
            assertThrows(UnsupportedOperationException.class, () -> t.rows().get(0).set(0, "9"));
        }
    }

    // ----------------------------
    // CSV tests
    // ----------------------------
    @Nested
    class CsvSampleSourceTests {

        private CsvSampleSource source(String csv) {
            return new CsvSampleSource(TableRole.RECONSTRUCTION, text(csv), CsvFormat.DEFAULT, "test.csv");
        }

        @Test
        void load_parsesHeaderAndRows() {
            RawTable t = source("""
                    Phi[deg], Theta[deg], dB10normalize(GainTotal)
                    0,0,-3.5
                    0,1,-3.25
                    """).load();

            assertEquals(TableRole.RECONSTRUCTION, t.role());
            assertEquals(List.of("Phi[deg]", "Theta[deg]", "dB10normalize(GainTotal)"), t.columns());
            assertEquals(2, t.rowCount());
            assertEquals("-3.25", t.cell(1, 2));
        }

        @Test
        void load_quotedHeaderWithSeparatorInside() {
            RawTable t = source("\"Phi[deg]\",\"Gain, total\"\n1,2\n").load();

            assertEquals(List.of("Phi[deg]", "Gain, total"), t.columns());
        }

        @Test
        void load_skipsEmptyLines_andPadsShortRows() {
            RawTable t = source("a,b,c\n\n1,2\n3,4,5\n").load();

            assertEquals(2, t.rowCount());
            assertEquals("", t.cell(0, 2));
            assertEquals("5", t.cell(1, 2));
        }

        @Test
        void load_acceptsTrailingSeparator() {
            RawTable t = source("a,b\n1,2,\n").load();
            assertEquals(List.of("1", "2"), t.rows().get(0));
        }

        @Test
        void load_rowLongerThanHeader_throws() {
            IngestionException ex = assertThrows(IngestionException.class, () -> source("a,b\n1,2,3\n").load());
            assertTrue(ex.getMessage().contains("Row 1"));
        }

        @Test
        void load_stripsByteOrderMark() {
            RawTable t = source("\uFEFFa,b\n1,2\n").load();
            assertEquals("a", t.columns().get(0));
        }

        @Test
        void load_customSeparator() {
            CsvSampleSource src = new CsvSampleSource(TableRole.REFERENCE, text("a;b\n1;2\n"), new CsvFormat(';'), "semi.csv");
            assertEquals(List.of("a", "b"), src.load().columns());
        }

        @Test
        void load_empty_throws() {
            assertThrows(IngestionException.class, () -> source("").load());
        }

        @Test
        void load_headerOnly_throws() {
            IngestionException ex = assertThrows(IngestionException.class, () -> source("a,b\n").load());
            assertTrue(ex.getMessage().contains("no data rows"));
        }

        @Test
        void load_isCached_streamOpenedOnce() {
            AtomicInteger opens = new AtomicInteger();
            CsvSampleSource src = new CsvSampleSource(TableRole.REFERENCE, () -> {
                opens.incrementAndGet();
                return new ByteArrayInputStream("a\n1\n".getBytes(StandardCharsets.UTF_8));
            }, CsvFormat.DEFAULT, "cached.csv");

            RawTable first = src.load();
            RawTable second = src.load();

            assertSame(first, second);
            assertEquals(1, opens.get());
        }

        @Test
        void load_ioFailure_isWrapped() {
            CsvSampleSource src = new CsvSampleSource(TableRole.REFERENCE, () -> {
                throw new IOException("disk gone");
            }, CsvFormat.DEFAULT, "broken.csv");

            IngestionException ex = assertThrows(IngestionException.class, src::load);
            assertInstanceOf(IOException.class, ex.getCause());
        }

        @Test
        void ofFile_missingFile_reportsNotFound(@TempDir Path dir) {
            CsvSampleSource src = CsvSampleSource.ofFile(TableRole.REFERENCE, dir.resolve("nope.csv"), CsvFormat.DEFAULT);

            IngestionException ex = assertThrows(IngestionException.class, src::load);
            assertTrue(ex.getMessage().startsWith("File not found"));
        }

        @Test
        void ofFile_readsFromDisk(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("pattern.csv");
            Files.writeString(file, "x,y,v\n1,2,3\n");

            RawTable t = CsvSampleSource.ofFile(TableRole.REFERENCE, file, CsvFormat.DEFAULT).load();
            assertEquals(List.of("1", "2", "3"), t.rows().get(0));
        }

        @Test
        void csvFormat_rejectsQuoteSeparator() {
            assertThrows(IllegalArgumentException.class, () -> new CsvFormat('"'));
        }
    }

    // ----------------------------
    // JSON tests
    // ----------------------------
    @Nested
    class JsonSampleSourceTests {

        private JsonSampleSource source(String json) {
            return new JsonSampleSource(TableRole.REFERENCE, text(json), "test.json");
        }

        @Test
        void load_arrayOfObjects() {
            RawTable t = source("""
                    [
                      { "Phi[deg]": 0, "Theta[deg]": 90, "gain": -1.5 },
                      { "Phi[deg]": 1, "Theta[deg]": 90, "gain": -2 }
                    ]
                    """).load();

            assertEquals(List.of("Phi[deg]", "Theta[deg]", "gain"), t.columns());
            assertEquals("90", t.cell(0, 1));
            assertEquals("-2", t.cell(1, 2));
        }

        @Test
        void load_columnUnion_fillsMissingWithBlank() {
            RawTable t = source("[ {\"a\": 1}, {\"b\": 2, \"a\": null} ]").load();

            assertEquals(List.of("a", "b"), t.columns());
            assertEquals(List.of("1", ""), t.rows().get(0));
            assertEquals(List.of("", "2"), t.rows().get(1));
        }

        @Test
        void load_notAnArray_throws() {
            assertThrows(IngestionException.class, () -> source("{\"a\": 1}").load());
        }

        @Test
        void load_nestedValue_throws() {
            assertThrows(IngestionException.class, () -> source("[ {\"a\": [1, 2]} ]").load());
        }

        @Test
        void load_emptyArray_throws() {
            assertThrows(IngestionException.class, () -> source("[]").load());
        }

        @Test
        void load_malformedJson_isWrapped() {
            IngestionException ex = assertThrows(IngestionException.class, () -> source("[ {\"a\": 1 ").load());
            assertNotNull(ex.getCause());
        }
    }
}
