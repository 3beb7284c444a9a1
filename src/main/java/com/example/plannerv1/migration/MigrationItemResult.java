package com.example.plannerv1.migration;

/**
 * 1件分の移行結果。alreadyMigrated が true のときは何もしていない。
 */
public record MigrationItemResult(
        Long legacyTaskId,
        Long patternId,
        boolean patternCreated,
        int instancesCreated,
        int instancesRepointed,
        boolean alreadyMigrated,
        boolean dryRun
) {
    static MigrationItemResult alreadyMigrated(Long legacyTaskId, Long patternId) {
        return new MigrationItemResult(legacyTaskId, patternId, false, 0, 0, true, false);
    }
}
