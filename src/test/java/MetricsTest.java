import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.patterncompare.metrics.*;
import org.patterncompare.model.AlignedRow;
import org.patterncompare.model.AlignedTable;
import org.patterncompare.model.CoordinateKey;
import org.patterncompare.model.SampleSchema;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full test suite for:
 * - ErrorSummary
 * - ErrorMetrics
 * - ErrorRanking
 */
public class MetricsTest {

    private static final SampleSchema SCHEMA = new SampleSchema("phi", "theta", "gain");

    /** Rows (i, 0) with the given reference/reconstruction pairs. */
    private static AlignedTable table(double[]... refRecon) {
        List<AlignedRow> rows = new ArrayList<>();
        for (int i = 0; i < refRecon.length; i++) {
            rows.add(new AlignedRow(new CoordinateKey(i, 0), refRecon[i][0], refRecon[i][1]));
        }
        return new AlignedTable(SCHEMA, rows, rows.size(), rows.size());
    }

    private static double[] p(double ref, double recon) {
        return new double[]{ref, recon};
    }

    @Nested
    @DisplayName("ErrorMetrics")
    class SummaryTests {

        private final ErrorMetrics metrics = new ErrorMetrics();

        @Test
        void singleRow_optimisticScenario() {
            ErrorSummary s = metrics.summarize(table(p(10.0, 12.0)));

            assertEquals(1, s.count());
            assertEquals(4.0, s.mse(), 1e-12);
            assertEquals(2.0, s.rmse(), 1e-12);
            assertEquals(2.0, s.bias(), 1e-12);
        }

        @Test
        void identicalValues_giveZeroEverywhere() {
            ErrorSummary s = metrics.summarize(table(p(1, 1), p(-3.5, -3.5), p(7, 7)));

            assertEquals(0.0, s.mse());
            assertEquals(0.0, s.rmse());
            assertEquals(0.0, s.bias());
        }

        @Test
        void signedErrorsCancelInBias_butNotInMse() {
            ErrorSummary s = metrics.summarize(table(p(0, 1), p(0, -1)));

            assertEquals(0.0, s.bias(), 1e-12);
            assertEquals(1.0, s.mse(), 1e-12);
        }

        @Test
        void rmseIsSqrtOfMse_onRandomData() {
            Random rnd = new Random(42);
            double[][] rows = new double[200][];
            for (int i = 0; i < rows.length; i++) {
                rows[i] = p(rnd.nextGaussian() * 5, rnd.nextGaussian() * 5);
            }

            ErrorSummary s = metrics.summarize(table(rows));
            assertEquals(Math.sqrt(s.mse()), s.rmse(), 1e-12);
        }

        @Test
        void summary_rejectsEmptyCount() {
            assertThrows(IllegalArgumentException.class, () -> new ErrorSummary(0, 0, 0, 0));
        }
    }

    @Nested
    @DisplayName("ErrorRanking")
    class RankingTests {

        private final ErrorRanking ranking = new ErrorRanking();

        private void assertNonIncreasing(List<RankedError> ranked) {
            for (int i = 1; i < ranked.size(); i++) {
                assertTrue(ranked.get(i - 1).squaredError() >= ranked.get(i).squaredError(),
                        "Ranked errors not in descending order");
            }
        }

        @Test
        void returnsLargestFirst() {
            AlignedTable t = table(p(0, 1), p(0, 5), p(0, -3), p(0, 2), p(0, 0), p(0, 4));

            List<RankedError> top = ranking.topErrors(t, 3);

            assertEquals(List.of(1, 5, 2), top.stream().map(RankedError::position).toList());
            assertEquals(List.of(1, 2, 3), top.stream().map(RankedError::rank).toList());
            assertEquals(25.0, top.get(0).squaredError(), 1e-12);
            assertNonIncreasing(top);
        }

        @Test
        void ties_keepTableOrder() {
            AlignedTable t = table(p(0, 1), p(0, -2), p(0, 2), p(0, 1), p(0, -2));

            List<RankedError> top = ranking.topErrors(t, 4);

            assertEquals(List.of(1, 2, 4, 0), top.stream().map(RankedError::position).toList());
        }

        @Test
        void fewerRowsThanN_returnsAll() {
            AlignedTable t = table(p(0, 1), p(0, 3));

            List<RankedError> top = ranking.topErrors(t, 5);

            assertEquals(2, top.size());
            assertEquals(1, top.get(0).position());
        }

        @Test
        void defaultIsFive() {
            AlignedTable t = table(p(0, 1), p(0, 2), p(0, 3), p(0, 4), p(0, 5), p(0, 6), p(0, 7));

            List<RankedError> top = ranking.topErrors(t);

            assertEquals(5, top.size());
            assertEquals(6, top.get(0).position());
            assertEquals(2, top.get(4).position());
        }

        @Test
        void randomData_lengthAndOrder() {
            Random rnd = new Random(7);
            double[][] rows = new double[100][];
            for (int i = 0; i < rows.length; i++) {
                rows[i] = p(rnd.nextInt(5), rnd.nextInt(5));
            }
            AlignedTable t = table(rows);

            for (int n : new int[]{1, 5, 50, 100, 150}) {
                List<RankedError> top = ranking.topErrors(t, n);
                assertEquals(Math.min(n, t.size()), top.size());
                assertNonIncreasing(top);
            }
        }

        @Test
        void nonPositiveN_throws() {
            AlignedTable t = table(p(0, 1));
            assertThrows(IllegalArgumentException.class, () -> ranking.topErrors(t, 0));
        }

        @Test
        void result_isImmutable() {
            List<RankedError> top = ranking.topErrors(table(p(0, 1)), 1);
            assertThrows(UnsupportedOperationException.class, () -> top.remove(0));
        }
    }
}
