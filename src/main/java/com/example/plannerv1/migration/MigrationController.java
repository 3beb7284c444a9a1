package com.example.plannerv1.migration;

import com.example.plannerv1.common.ApiResponse;
import com.example.plannerv1.pattern.PatternLookup;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/migration/legacy")
public class MigrationController {

    private final LegacyMigrator legacyMigrator;
    private final MigrationJobStatusService jobStatusService;

    public MigrationController(LegacyMigrator legacyMigrator, MigrationJobStatusService jobStatusService) {
        this.legacyMigrator = legacyMigrator;
        this.jobStatusService = jobStatusService;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<MigrationResult>> migrateAll(@RequestHeader("X-Owner-Id") String ownerId,
                                                                   @RequestParam(name = "dryRun", defaultValue = "false") boolean dryRun) {
        MigrationResult result = legacyMigrator.migrateAllLegacyItems(ownerId, dryRun);
        return ResponseEntity.ok(ApiResponse.success("旧形式の移行を実行しました", result));
    }

    @PostMapping("/{taskId}")
    public ResponseEntity<ApiResponse<MigrationItemResult>> migrateOne(@RequestHeader("X-Owner-Id") String ownerId,
                                                                       @PathVariable Long taskId,
                                                                       @RequestParam(name = "dryRun", defaultValue = "false") boolean dryRun) {
        return ResponseEntity.ok(ApiResponse.success(legacyMigrator.migrateLegacyItem(ownerId, taskId, dryRun)));
    }

    @PostMapping("/async")
    public ResponseEntity<ApiResponse<Map<String, Object>>> migrateAllAsync(@RequestHeader("X-Owner-Id") String ownerId,
                                                                            @RequestParam(name = "dryRun", defaultValue = "false") boolean dryRun) {
        PatternLookup.requireValidOwnerId(ownerId);
        if (!jobStatusService.tryStart(ownerId)) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(ApiResponse.failure("JOB_RUNNING", "移行ジョブは実行中です"));
        }
        try {
            legacyMigrator.migrateAllLegacyItemsAsync(ownerId, dryRun);
        } catch (RuntimeException e) {
            // 実行キューに入らなかった場合は実行中のまま残さない
            jobStatusService.finish(ownerId, 0, 0);
            throw e;
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.success("移行ジョブを開始しました", Map.of("ownerId", ownerId, "dryRun", dryRun)));
    }

    /**
     * all=true なら全オーナー対象の実行（起動時の移行など）の状況を返す
     */
    @GetMapping("/status")
    public ResponseEntity<ApiResponse<Map<String, Object>>> status(@RequestHeader(name = "X-Owner-Id", required = false) String ownerId,
                                                                   @RequestParam(name = "all", defaultValue = "false") boolean all) {
        if (!all) {
            PatternLookup.requireValidOwnerId(ownerId);
        }
        var s = jobStatusService.get(all ? null : ownerId);
        Map<String, Object> data = new HashMap<>();
        data.put("target", all ? "(all)" : ownerId);
        data.put("running", s.running);
        data.put("done", s.done);
        data.put("processed", s.processedCount);
        data.put("errors", s.errorCount);
        data.put("startedAt", s.startedAt);
        data.put("finishedAt", s.finishedAt);
        return ResponseEntity.ok(ApiResponse.success("ジョブ状況", data));
    }
}
