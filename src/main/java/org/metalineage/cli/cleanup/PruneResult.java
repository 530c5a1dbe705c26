package org.metalineage.cli.cleanup;

/**
 * Outcome of a cache pruning pass.
 *
 * @param kept       entries left in place
 * @param deleted    entries deleted, or selected for deletion in a dry run
 * @param bytesFreed size of the deleted entries
 * @param failed     entries whose deletion failed
 */
public record PruneResult(int kept, int deleted, long bytesFreed, int failed) {}
