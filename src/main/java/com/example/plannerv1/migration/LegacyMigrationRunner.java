package com.example.plannerv1.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * 起動時に旧形式の移行を1回だけ実行する（planner.migration.run-on-startup=true のとき）。
 * owner-id が空なら旧形式タスクを持つ全オーナーが対象。
 */
@Component
public class LegacyMigrationRunner implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(LegacyMigrationRunner.class);

    private final LegacyMigrator legacyMigrator;
    private final boolean runOnStartup;
    private final boolean dryRun;
    private final String ownerId;

    public LegacyMigrationRunner(LegacyMigrator legacyMigrator,
                                 @Value("${planner.migration.run-on-startup:false}") boolean runOnStartup,
                                 @Value("${planner.migration.dry-run:false}") boolean dryRun,
                                 @Value("${planner.migration.owner-id:}") String ownerId) {
        this.legacyMigrator = legacyMigrator;
        this.runOnStartup = runOnStartup;
        this.dryRun = dryRun;
        this.ownerId = ownerId;
    }

    @Override
    public void run(String... args) throws Exception {
        if (!runOnStartup) {
            return;
        }
        logger.info("起動時の旧形式移行を開始します: owner={}, dryRun={}", ownerId.isBlank() ? "(all)" : ownerId, dryRun);
        MigrationResult result = legacyMigrator.migrateAllLegacyItems(ownerId, dryRun);
        if (!result.errors().isEmpty()) {
            result.errors().forEach(e -> logger.warn("  - {}", e));
        }
        logger.info("起動時の旧形式移行が終了しました: processed={}, patterns={}, errors={}",
                result.itemsProcessed(), result.patternsCreated(), result.errors().size());
    }
}
