package eu.virtualparadox.docalign.search.minimizer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GreedyMinimumSearchTest {

    private static Evaluation<Integer> parabola(int p) {
        return new Evaluation<>((p - 37) * (p - 37), p);
    }

    @Test
    void testFindsMinimumOfUnimodalFunction() {
        final List<Integer> calls = new ArrayList<>();
        final Evaluation<Integer> best = GreedyMinimumSearch.search(0, 100, p -> {
            calls.add(p);
            return parabola(p);
        });

        assertThat(best.payload()).isEqualTo(37);
        assertThat(best.cost()).isZero();
        assertThat(calls).hasSize(9);
    }

    @Test
    @DisplayName("No position is evaluated twice")
    void testBoundariesAreNotRecomputed() {
        final List<Integer> calls = new ArrayList<>();
        GreedyMinimumSearch.search(-500, 1500, p -> {
            calls.add(p);
            return parabola(p);
        });
        assertThat(new HashSet<>(calls)).hasSameSizeAs(calls);
    }

    @Test
    void testReversedBoundsAreSwapped() {
        assertThat(GreedyMinimumSearch.search(100, 0, GreedyMinimumSearchTest::parabola).payload()).isEqualTo(37);
    }

    @Test
    void testMonotoneFunctions() {
        assertThat(GreedyMinimumSearch.search(0, 50, p -> new Evaluation<>(100 - p, p)).payload()).isEqualTo(50);
        assertThat(GreedyMinimumSearch.search(0, 50, p -> new Evaluation<>(p, p)).payload()).isZero();
    }

    @Test
    void testSinglePositionRange() {
        final List<Integer> calls = new ArrayList<>();
        final Evaluation<String> best = GreedyMinimumSearch.search(5, 5, p -> {
            calls.add(p);
            return new Evaluation<>(3, "only");
        });
        assertThat(best.payload()).isEqualTo("only");
        assertThat(calls).containsExactly(5);
    }

    @Test
    @DisplayName("Equal cost on adjacent positions favors the upper bound")
    void testTieOnAdjacentPositions() {
        assertThat(GreedyMinimumSearch.search(3, 4, p -> new Evaluation<>(1, p)).payload()).isEqualTo(4);
    }

    @Test
    @DisplayName("Multi-modal costs may lead to a local minimum")
    void testHeuristicMissesHiddenMinimum() {
        final int[] costs = {4, 9, 9, 9, 9, 0, 9, 9, 5};
        final List<Integer> calls = new ArrayList<>();
        final Evaluation<Integer> best = GreedyMinimumSearch.search(0, 8, p -> {
            calls.add(p);
            return new Evaluation<>(costs[p], p);
        });

        assertThat(best.payload()).isZero();
        assertThat(best.cost()).isEqualTo(4);
        assertThat(calls).containsExactly(0, 8, 4, 2, 1);
    }
}
