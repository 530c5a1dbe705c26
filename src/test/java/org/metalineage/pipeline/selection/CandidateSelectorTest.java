package org.metalineage.pipeline.selection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.metalineage.pipeline.api.errors.DegradedModeWarning;
import org.metalineage.pipeline.api.errors.InputException;
import org.metalineage.pipeline.api.model.CandidateGenome;
import org.metalineage.pipeline.api.model.ScreenHit;
import org.metalineage.pipeline.selection.CandidateSelector.DatabaseScreen;
import org.metalineage.pipeline.selection.CandidateSelector.SelectionResult;

@Tag("unit")
class CandidateSelectorTest {

    private List<DegradedModeWarning> warnings;
    private CandidateSelector selector;

    @BeforeEach
    void setUp() {
        warnings = new ArrayList<>();
        selector = new CandidateSelector(SelectionSettings.DEFAULTS, warnings::add);
    }

    private static List<ScreenHit> hits(double... scores) {
        List<ScreenHit> hits = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            hits.add(new ScreenHit("G" + i, scores[i]));
        }
        return hits;
    }

    private static List<ScreenHit> named(String... ids) {
        return Stream.of(ids).map(id -> new ScreenHit(id, 0.95)).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Threshold search")
    class ThresholdSearch {

        @Test
        void stopsAtFirstThresholdReachingMinimum() {
            ThresholdSearchResult result = selector.searchThreshold(hits(0.95, 0.93, 0.91, 0.85), 3);

            assertThat(result.threshold()).isEqualByComparingTo("0.90");
            assertThat(result.candidateCount()).isEqualTo(3);
            assertThat(result.iterations()).isEqualTo(1);
            assertThat(result.degraded()).isFalse();
            assertThat(warnings).isEmpty();
        }

        @Test
        void lowersThresholdInExactSteps() {
            ThresholdSearchResult result = selector.searchThreshold(hits(0.95, 0.93, 0.91, 0.85), 4);

            assertThat(result.threshold()).isEqualByComparingTo("0.84");
            assertThat(result.iterations()).isEqualTo(4);
            assertThat(result.candidateCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("Hits equal to the threshold are not counted")
        void countsStrictlyAbove() {
            ThresholdSearchResult result = selector.searchThreshold(hits(0.90, 0.90, 0.89), 2);

            assertThat(result.threshold()).isEqualByComparingTo("0.88");
            assertThat(result.candidateCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("Exhausted search applies the fallback and emits a warning")
        void fallsBackWhenExhausted() {
            ThresholdSearchResult result = selector.searchThreshold(hits(0.95, 0.72, 0.705), 5);

            assertThat(result.degraded()).isTrue();
            assertThat(result.threshold()).isEqualByComparingTo("0.71");
            assertThat(result.candidateCount()).isEqualTo(2);
            assertThat(result.iterations()).isEqualTo(11);
            assertThat(warnings).singleElement()
                    .extracting(DegradedModeWarning::code)
                    .isEqualTo(DegradedModeWarning.Code.THRESHOLD_FALLBACK);
        }

        @Test
        void emptyTableTerminatesWithFallback() {
            ThresholdSearchResult result = selector.searchThreshold(List.of(), 1);

            assertThat(result.degraded()).isTrue();
            assertThat(result.candidateCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Union across databases")
    class Union {

        @Test
        @DisplayName("Union is sorted and deduplicated regardless of database order")
        void unionIsOrderIndependent() {
            DatabaseScreen first = new DatabaseScreen("refseq", null, named("C", "A", "B"));
            DatabaseScreen second = new DatabaseScreen("gtdb", null, named("B", "D"));
            DatabaseScreen third = new DatabaseScreen("custom", null, List.of());

            SelectionResult forward = selector.select(List.of(first, second, third), 1);
            SelectionResult reversed = selector.select(List.of(third, second, first), 1);

            assertThat(forward.candidateIds()).containsExactly("A", "B", "C", "D");
            assertThat(reversed.candidateIds()).containsExactly("A", "B", "C", "D");
            assertThat(forward.perDatabase()).hasSize(3);
        }

        @Test
        void keepsBestScoreAcrossDatabases() {
            DatabaseScreen low = new DatabaseScreen("b-db", null, List.of(new ScreenHit("X", 0.92)));
            DatabaseScreen high = new DatabaseScreen("a-db", null, List.of(new ScreenHit("X", 0.97)));

            SelectionResult result = selector.select(List.of(low, high), 1);

            assertThat(result.candidates()).singleElement()
                    .satisfies(c -> {
                        assertThat(c.bestScore()).isEqualTo(0.97);
                        assertThat(c.sourceDb()).isEqualTo("a-db");
                    });
        }

        @Test
        void tiedScoresKeepSmallestDatabaseName() {
            DatabaseScreen zeta = new DatabaseScreen("zeta", null, List.of(new ScreenHit("X", 0.95)));
            DatabaseScreen alpha = new DatabaseScreen("alpha", null, List.of(new ScreenHit("X", 0.95)));

            assertThat(selector.select(List.of(zeta, alpha), 1).candidates())
                    .extracting(CandidateGenome::sourceDb).containsExactly("alpha");
        }

        @Test
        void databaseSpecificInitialThresholdIsHonoured() {
            SelectionSettings settings = new SelectionSettings(new BigDecimal("0.90"), new BigDecimal("0.70"),
                    new BigDecimal("0.02"), new BigDecimal("0.71"), 1.0, 1);
            CandidateSelector strict = new CandidateSelector(settings, warnings::add);
            DatabaseScreen screen = new DatabaseScreen("db", new BigDecimal("0.80"),
                    List.of(new ScreenHit("A", 0.85), new ScreenHit("B", 0.79)));

            SelectionResult result = strict.select(List.of(screen), 1);

            assertThat(result.perDatabase().get(0).search().threshold()).isEqualByComparingTo("0.80");
            assertThat(result.candidateIds()).containsExactly("A");
        }

        @Test
        void failsWhenNoDatabaseYieldsCandidates() {
            DatabaseScreen empty = new DatabaseScreen("db", null, hits(0.5));

            assertThatThrownBy(() -> selector.select(List.of(empty), 1))
                    .isInstanceOf(InputException.class);
        }
    }

    @Test
    void minimumCandidateCountScalesWithInputs() {
        assertThat(SelectionSettings.DEFAULTS.minCandidates(1)).isEqualTo(5);
        assertThat(SelectionSettings.DEFAULTS.minCandidates(2)).isEqualTo(7);
        assertThat(SelectionSettings.DEFAULTS.minCandidates(10)).isEqualTo(33);
    }
}
