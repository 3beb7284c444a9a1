package com.example.plannerv1.migration;

import java.util.List;

/**
 * 旧形式移行の結果。1件ごとの失敗は errors に集め、処理は続ける。
 */
public record MigrationResult(
        int itemsProcessed,
        int patternsCreated,
        int instancesCreated,
        int instancesRepointed,
        List<String> errors,
        boolean dryRun
) {
    public MigrationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
