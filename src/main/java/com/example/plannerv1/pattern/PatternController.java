package com.example.plannerv1.pattern;

import com.example.plannerv1.common.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/patterns")
public class PatternController {

    static final String OWNER_HEADER = "X-Owner-Id";

    private final PatternService patternService;
    private final GenerationWindowManager windowManager;
    private final CompletionChainer completionChainer;
    private final Clock clock;

    public PatternController(PatternService patternService,
                             GenerationWindowManager windowManager,
                             CompletionChainer completionChainer,
                             Clock clock) {
        this.patternService = patternService;
        this.windowManager = windowManager;
        this.completionChainer = completionChainer;
        this.clock = clock;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<PatternDto>> create(@RequestHeader(OWNER_HEADER) String ownerId,
                                                          @Valid @RequestBody PatternRequest request) {
        RecurringPattern created = patternService.createPattern(ownerId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("パターンを作成しました", PatternDto.from(created)));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<PatternDto>>> list(@RequestHeader(OWNER_HEADER) String ownerId) {
        List<PatternDto> data = patternService.listPatterns(ownerId).stream().map(PatternDto::from).toList();
        return ResponseEntity.ok(ApiResponse.success("パターン一覧を取得しました", data));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<PatternDto>> get(@RequestHeader(OWNER_HEADER) String ownerId,
                                                       @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(PatternDto.from(patternService.getPattern(ownerId, id))));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<PatternDto>> update(@RequestHeader(OWNER_HEADER) String ownerId,
                                                          @PathVariable Long id,
                                                          @RequestParam(name = "regenerateFutureInstances", defaultValue = "false") boolean regenerate,
                                                          @Valid @RequestBody PatternUpdateRequest request) {
        RecurringPattern updated = patternService.updatePattern(ownerId, id, request, regenerate);
        return ResponseEntity.ok(ApiResponse.success("パターンを更新しました", PatternDto.from(updated)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> delete(@RequestHeader(OWNER_HEADER) String ownerId,
                                                                   @PathVariable Long id,
                                                                   @RequestParam(name = "cascadeInstances", defaultValue = "false") boolean cascade) {
        int deleted = patternService.deletePattern(ownerId, id, cascade);
        return ResponseEntity.ok(ApiResponse.success("パターンを削除しました",
                Map.of("patternId", id, "deletedInstances", deleted)));
    }

    @PostMapping("/{id}/ensure")
    public ResponseEntity<ApiResponse<EnsureResult>> ensure(@RequestHeader(OWNER_HEADER) String ownerId,
                                                            @PathVariable Long id,
                                                            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        EnsureResult result = windowManager.ensureInstancesForDate(ownerId, id, date);
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    @GetMapping("/{id}/preview")
    public ResponseEntity<ApiResponse<List<LocalDate>>> preview(@RequestHeader(OWNER_HEADER) String ownerId,
                                                                @PathVariable Long id,
                                                                @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                                                @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(ApiResponse.success(patternService.previewOccurrences(ownerId, id, from, to)));
    }

    @GetMapping("/{id}/instances")
    public ResponseEntity<ApiResponse<List<TaskInstanceDto>>> instances(@RequestHeader(OWNER_HEADER) String ownerId,
                                                                        @PathVariable Long id) {
        List<TaskInstanceDto> data = patternService.listInstances(ownerId, id).stream().map(TaskInstanceDto::from).toList();
        return ResponseEntity.ok(ApiResponse.success(data));
    }

    /**
     * 完了後繰り返しの連鎖フック。date 省略時は今日。
     */
    @PostMapping("/{id}/instances/{taskId}/completed")
    public ResponseEntity<ApiResponse<TaskInstanceDto>> completed(@RequestHeader(OWNER_HEADER) String ownerId,
                                                                  @PathVariable Long id,
                                                                  @PathVariable Long taskId,
                                                                  @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate completionDate = date != null ? date : LocalDate.now(clock);
        return completionChainer.onInstanceCompleted(ownerId, id, taskId, completionDate)
                .map(next -> ResponseEntity.ok(ApiResponse.success("次のインスタンスを作成しました", TaskInstanceDto.from(next))))
                .orElseGet(() -> ResponseEntity.ok(ApiResponse.<TaskInstanceDto>success("次のインスタンスは作成されませんでした", null)));
    }
}
