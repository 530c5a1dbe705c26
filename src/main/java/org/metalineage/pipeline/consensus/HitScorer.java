package org.metalineage.pipeline.consensus;

import org.metalineage.pipeline.api.model.AlignmentRecord;

/**
 * Scores one alignment as {@code identity × coverage × mapqWeight}.
 * <p>
 * The weight rises linearly from the floor at MAPQ 0 to 1 at the cap; an unavailable
 * MAPQ (255) counts as fully trusted.
 */
public final class HitScorer {

    private final double floor;
    private final int cap;

    public HitScorer(ConsensusSettings settings) {
        this.floor = settings.mapqFloor();
        this.cap = settings.mapqCap();
    }

    public double score(AlignmentRecord record) {
        return record.identity() * record.coverage() * mapqWeight(record.mapq());
    }

    double mapqWeight(int mapq) {
        if (mapq == AlignmentRecord.MAPQ_UNAVAILABLE) {
            return 1.0;
        }
        int bounded = Math.max(0, Math.min(mapq, cap));
        return floor + (1.0 - floor) * bounded / cap;
    }
}
