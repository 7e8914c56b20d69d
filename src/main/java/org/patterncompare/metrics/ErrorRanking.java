package org.patterncompare.metrics;

import org.patterncompare.model.AlignedTable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Finds the rows with the largest squared error by scanning the aligned table
 * and keeping the top-N using a bounded min-heap.
 *
 * Ties are resolved by table position: the earlier row ranks higher.
 *
 * Complexity:
 * - Time: O(R log N) where R = aligned rows
 * - Space: O(N)
 */
public final class ErrorRanking {

    public static final int DEFAULT_TOP_N = 5;

    /** Orders "worse first": larger error, then earlier position. */
    private static final Comparator<Candidate> WORST_FIRST =
            Comparator.comparingDouble(Candidate::squaredError).reversed()
                    .thenComparingInt(Candidate::position);

    /**
     * @param aligned aligned table (non-null)
     * @param n number of rows to return (must be >= 1)
     * @return up to n rows sorted by descending squared error
     */
    public List<RankedError> topErrors(AlignedTable aligned, int n) {
        Objects.requireNonNull(aligned, "aligned must not be null");
        if (n <= 0) throw new IllegalArgumentException("n must be >= 1");

        // Min-heap in ranking order: the best-ranked loser is evicted first.
        PriorityQueue<Candidate> heap = new PriorityQueue<>(WORST_FIRST.reversed());

        for (int i = 0; i < aligned.size(); i++) {
            Candidate candidate = new Candidate(i, aligned.row(i).squaredError());

            if (heap.size() < n) {
                heap.add(candidate);
            } else if (WORST_FIRST.compare(candidate, heap.peek()) < 0) {
                heap.poll();
                heap.add(candidate);
            }
        }

        List<Candidate> sorted = new ArrayList<>(heap);
        sorted.sort(WORST_FIRST);

        List<RankedError> result = new ArrayList<>(sorted.size());
        for (int r = 0; r < sorted.size(); r++) {
            int position = sorted.get(r).position();
            result.add(new RankedError(r + 1, position, aligned.row(position)));
        }
        return List.copyOf(result);
    }

    public List<RankedError> topErrors(AlignedTable aligned) {
        return topErrors(aligned, DEFAULT_TOP_N);
    }

    private record Candidate(int position, double squaredError) { }
}
