package com.e2eq.lexikon.graph.backend;

/**
 * @param copied rows written to the target
 * @param skipped rows left alone because the target already held them, only in {@code importMissing}
 * @param lastId cursor of the last copied relation; pass it back to resume an interrupted migration
 * @param error message of the failure that stopped the migration, null on success
 */
public record MigrationReport(long copied, long skipped, String lastId, boolean completed, long sourceCount, long targetCount,
                              String error) {
}
