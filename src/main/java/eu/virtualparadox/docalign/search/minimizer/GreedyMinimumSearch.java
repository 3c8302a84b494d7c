package eu.virtualparadox.docalign.search.minimizer;

import java.util.Objects;
import java.util.function.IntFunction;

/**
 * Bisecting search for the position with the lowest cost in a closed integer range.
 *
 * <h2>Assumption</h2>
 * The cost function is expected to be unimodal over the range (decreasing then increasing,
 * or monotone). Under that assumption the minimum is found with a logarithmic number of
 * evaluations. If the landscape has several local minima the search may settle on a
 * non-global one; callers accept that for speed.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Evaluate both boundaries {@code a} and {@code b}.</li>
 *   <li>If {@code b == a + 1}, return the cheaper one; on equal cost {@code b} wins.</li>
 *   <li>Otherwise move the boundary opposite to the strictly cheaper one to the midpoint
 *       (on equal cost, {@code a} moves) and repeat. The retained boundary keeps its
 *       evaluation, so no position is computed twice.</li>
 * </ol>
 */
public final class GreedyMinimumSearch {

    private GreedyMinimumSearch() {
        // prevent instantiation
    }

    /**
     * Finds the evaluation with minimal cost in {@code [a, b]}. Bounds may be given in
     * either order.
     *
     * @param a       one end of the range (inclusive)
     * @param b       other end of the range (inclusive)
     * @param compute cost function, called at most once per position
     * @param <T>     payload type
     * @return the winning evaluation (never {@code null} unless {@code compute} returns it)
     */
    public static <T> Evaluation<T> search(final int a,
                                           final int b,
                                           final IntFunction<Evaluation<T>> compute) {
        Objects.requireNonNull(compute, "compute must not be null");

        int low = Math.min(a, b);
        int high = Math.max(a, b);
        if (low == high) {
            return compute.apply(low);
        }

        Evaluation<T> atLow = null;
        Evaluation<T> atHigh = null;
        while (true) {
            if (atLow == null) {
                atLow = compute.apply(low);
            }
            if (atHigh == null) {
                atHigh = compute.apply(high);
            }
            if (high == low + 1) {
                return atLow.cost() < atHigh.cost() ? atLow : atHigh;
            }

            final int middle = Math.floorDiv(low + high, 2);
            if (atLow.cost() < atHigh.cost()) {
                high = middle;
                atHigh = null;
            } else {
                low = middle;
                atLow = null;
            }
        }
    }
}
