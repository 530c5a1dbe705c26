package org.metalineage.pipeline.consensus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.metalineage.pipeline.api.model.AlignmentRecord;
import org.metalineage.pipeline.api.model.AlignmentRecord.Strand;

@Tag("unit")
class QueryAccumulatorTest {

    private static AlignmentRecord to(String target) {
        return new AlignmentRecord("q", 1000, 0, 1000, Strand.FORWARD, target, 10_000, 0, 1000, 900, 1000, 60);
    }

    @Test
    void keepsBestHitPerTaxonAndFirstRecord() {
        QueryAccumulator acc = new QueryAccumulator("q");

        acc.add(to("unmapped"), 0.99, 0);
        acc.add(to("b"), 0.80, 562);
        acc.add(to("a"), 0.90, 562);
        acc.add(to("c"), 0.90, 562);
        acc.add(to("d"), 0.70, 1423);

        assertThat(acc.getState()).isEqualTo(QueryState.COLLECTING);
        assertThat(acc.getRecordCount()).isEqualTo(5);
        assertThat(acc.getUnmappedCount()).isEqualTo(1);
        assertThat(acc.getFirstRecord().targetAccession()).isEqualTo("unmapped");
        assertThat(acc.getFirstScore()).isEqualTo(0.99);
        assertThat(acc.beginResolution()).containsExactlyInAnyOrder(
                new TaxonHit(562, 0.90, "a"),
                new TaxonHit(1423, 0.70, "d"));
        assertThat(acc.getState()).isEqualTo(QueryState.RESOLVING);
    }

    @Test
    void rejectsRecordsAfterResolutionStarted() {
        QueryAccumulator acc = new QueryAccumulator("q");
        acc.beginResolution();

        assertThatThrownBy(() -> acc.add(to("a"), 0.5, 1)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(acc::beginResolution).isInstanceOf(IllegalStateException.class);

        acc.finish(false);
        assertThat(acc.getState()).isEqualTo(QueryState.UNRESOLVED);
    }
}
