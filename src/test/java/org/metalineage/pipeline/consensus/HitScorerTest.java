package org.metalineage.pipeline.consensus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.metalineage.pipeline.api.model.AlignmentRecord;
import org.metalineage.pipeline.api.model.AlignmentRecord.Strand;

@Tag("unit")
class HitScorerTest {

    private final HitScorer scorer = new HitScorer(ConsensusSettings.DEFAULTS);

    private static AlignmentRecord record(int queryLen, int matches, int blockLen, int mapq) {
        return new AlignmentRecord("q", queryLen, 0, blockLen, Strand.FORWARD, "t", 10_000, 0, blockLen,
                matches, blockLen, mapq);
    }

    @Test
    void mapqWeightRisesLinearlyToCap() {
        assertThat(scorer.mapqWeight(0)).isEqualTo(0.5);
        assertThat(scorer.mapqWeight(30)).isCloseTo(0.75, within(1e-12));
        assertThat(scorer.mapqWeight(60)).isEqualTo(1.0);
        assertThat(scorer.mapqWeight(100)).isEqualTo(1.0);
        assertThat(scorer.mapqWeight(AlignmentRecord.MAPQ_UNAVAILABLE)).isEqualTo(1.0);
    }

    @Test
    void scoreMultipliesIdentityCoverageAndWeight() {
        assertThat(scorer.score(record(1000, 900, 1000, 60))).isCloseTo(0.9, within(1e-12));
        assertThat(scorer.score(record(2000, 900, 1000, 0))).isCloseTo(0.9 * 0.5 * 0.5, within(1e-12));
    }

    @Test
    void coverageIsCappedAtOne() {
        assertThat(scorer.score(record(500, 1000, 1000, 60))).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void emptyBlockScoresZero() {
        assertThat(scorer.score(record(1000, 0, 0, 60))).isZero();
    }
}
