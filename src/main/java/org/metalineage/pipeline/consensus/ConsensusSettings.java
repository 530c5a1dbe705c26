package org.metalineage.pipeline.consensus;

import org.metalineage.pipeline.api.errors.ConfigurationException;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Tunables of the lineage consensus.
 *
 * @param margin        relative score margin separating a clear winner from a conflict
 * @param mapqFloor     weight given to a hit with mapping quality 0
 * @param mapqCap       mapping quality at which the weight reaches 1
 * @param workers       threads resolving queries, the calling thread included
 * @param queueCapacity record batches buffered between parser and accumulator
 * @param batchSize     records per batch
 */
public record ConsensusSettings(
        double margin,
        double mapqFloor,
        int mapqCap,
        int workers,
        int queueCapacity,
        int batchSize) {

    public static final ConsensusSettings DEFAULTS = new ConsensusSettings(0.10, 0.5, 60, 1, 64, 1024);

    public ConsensusSettings {
        if (margin < 0 || Double.isNaN(margin)) {
            throw new ConfigurationException("Consensus margin must be >= 0, got " + margin);
        }
        if (mapqFloor < 0 || mapqFloor > 1) {
            throw new ConfigurationException("MAPQ weight floor must be in [0,1], got " + mapqFloor);
        }
        if (mapqCap < 1) {
            throw new ConfigurationException("MAPQ cap must be >= 1, got " + mapqCap);
        }
        if (workers < 1) {
            throw new ConfigurationException("Worker count must be >= 1, got " + workers);
        }
        if (queueCapacity < 1 || batchSize < 1) {
            throw new ConfigurationException("Queue capacity and batch size must be >= 1");
        }
    }

    /**
     * Reads the {@code metalineage.consensus} block.
     */
    public static ConsensusSettings fromConfig(Config consensus) {
        try {
            return new ConsensusSettings(
                    consensus.getDouble("margin"),
                    consensus.getDouble("mapq-weight-floor"),
                    consensus.getInt("mapq-cap"),
                    consensus.getInt("workers"),
                    consensus.getInt("queue-capacity"),
                    consensus.getInt("batch-size"));
        } catch (ConfigException e) {
            throw new ConfigurationException("Invalid consensus settings: " + e.getMessage(), e);
        }
    }

    public ConsensusSettings withWorkers(int count) {
        return new ConsensusSettings(margin, mapqFloor, mapqCap, count, queueCapacity, batchSize);
    }
}
