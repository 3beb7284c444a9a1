package com.example.plannerv1.migration;

import com.example.plannerv1.batch.ChunkedBatchWriter;
import com.example.plannerv1.common.error.ErrorLogBuffer;
import com.example.plannerv1.config.RecurrenceSettings;
import com.example.plannerv1.exception.MigrationJobRunningException;
import com.example.plannerv1.exception.PatternAccessDeniedException;
import com.example.plannerv1.exception.PatternNotFoundException;
import com.example.plannerv1.exception.PatternValidationException;
import com.example.plannerv1.pattern.InstanceMaterializer;
import com.example.plannerv1.pattern.PatternLookup;
import com.example.plannerv1.pattern.RecurringPattern;
import com.example.plannerv1.pattern.RecurringPatternRepository;
import com.example.plannerv1.recurrence.EndCondition;
import com.example.plannerv1.recurrence.OccurrenceGenerator;
import com.example.plannerv1.recurrence.RecurrenceRule;
import com.example.plannerv1.recurrence.RecurrenceSpec;
import com.example.plannerv1.task.Task;
import com.example.plannerv1.task.TaskRepository;
import com.example.plannerv1.task.TaskStatus;
import com.example.plannerv1.task.TemplateFields;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 旧形式（タスクに繰り返し設定を埋め込み、表示時にだけ仮想インスタンスを展開する方式）から
 * パターン + 作成済みインスタンスへの移行。
 *
 * 1件ごとに: パターン作成 → 既存の子インスタンスをパターンへ付け替え → 先行日数分の不足を生成
 * → 元のタスクを論理削除して移行先パターンIDを残す。
 * 移行済み（migratedToPatternId あり）のタスクに対しては何もしない。
 */
@Service
public class LegacyMigrator {

    private static final Logger logger = LoggerFactory.getLogger(LegacyMigrator.class);

    private final TaskRepository taskRepository;
    private final RecurringPatternRepository patternRepository;
    private final InstanceMaterializer materializer;
    private final ChunkedBatchWriter batchWriter;
    private final RecurrenceSettings settings;
    private final MigrationJobStatusService jobStatusService;
    private final ErrorLogBuffer errorLogBuffer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public LegacyMigrator(TaskRepository taskRepository,
                          RecurringPatternRepository patternRepository,
                          InstanceMaterializer materializer,
                          ChunkedBatchWriter batchWriter,
                          RecurrenceSettings settings,
                          MigrationJobStatusService jobStatusService,
                          ErrorLogBuffer errorLogBuffer,
                          ObjectMapper objectMapper,
                          Clock clock) {
        this.taskRepository = taskRepository;
        this.patternRepository = patternRepository;
        this.materializer = materializer;
        this.batchWriter = batchWriter;
        this.settings = settings;
        this.jobStatusService = jobStatusService;
        this.errorLogBuffer = errorLogBuffer;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public MigrationItemResult migrateLegacyItem(String ownerId, Long taskId, boolean dryRun) {
        PatternLookup.requireValidOwnerId(ownerId);
        Task legacy = taskRepository.findById(taskId)
                .orElseThrow(() -> new PatternNotFoundException("タスク", taskId));
        if (!legacy.getOwnerId().equals(ownerId)) {
            throw new PatternAccessDeniedException("タスク", taskId);
        }
        if (legacy.getMigratedToPatternId() != null) {
            logger.debug("移行済みのためスキップします: taskId={}, patternId={}", taskId, legacy.getMigratedToPatternId());
            return MigrationItemResult.alreadyMigrated(taskId, legacy.getMigratedToPatternId());
        }
        if (legacy.isDeleted() || legacy.getRecurrenceJson() == null
                || legacy.isRecurringInstance() || legacy.getRecurringParentId() != null) {
            throw new PatternValidationException("taskId", "旧形式の繰り返しタスクではありません: " + taskId);
        }

        LocalDate today = LocalDate.now(clock);
        LegacyRecurrence recurrence = parse(legacy);
        LocalDate startDate = legacy.getScheduledDate() != null ? legacy.getScheduledDate() : today;
        RecurrenceRule rule = recurrence.toRule(startDate);
        EndCondition end = recurrence.toEndCondition();
        Set<LocalDate> exceptions = recurrence.exceptionDates();
        TemplateFields template = templateOf(legacy);

        List<Task> children = taskRepository.findByRecurringParentIdAndDeletedAtIsNullOrderByScheduledDateAsc(legacy.getId());
        Set<LocalDate> childDates = children.stream()
                .map(Task::getScheduledDate)
                .filter(d -> d != null)
                .collect(Collectors.toSet());
        LocalDate from = startDate.isAfter(today) ? startDate : today;
        LocalDate watermark = watermark(from, end);

        if (dryRun) {
            int wouldCreate;
            if (rule instanceof RecurrenceRule.AfterCompletion) {
                wouldCreate = children.stream().anyMatch(c -> c.getStatus() == TaskStatus.IN_PROGRESS) ? 0 : 1;
            } else {
                wouldCreate = (int) OccurrenceGenerator
                        .generateOccurrenceDates(new RecurrenceSpec(rule, startDate, end, exceptions), from, watermark)
                        .stream().filter(d -> !childDates.contains(d)).count();
            }
            logger.info("[DRY RUN] 移行予定: taskId={}, type={}, repoint={}, create={}",
                    taskId, rule.type(), children.size(), wouldCreate);
            return new MigrationItemResult(taskId, null, true, wouldCreate, children.size(), false, true);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        // 前回途中で失敗していればそのパターンを使って続きから処理する
        Optional<RecurringPattern> resumed = patternRepository.findFirstByMigratedFromTaskIdAndDeletedAtIsNull(taskId);
        RecurringPattern pattern = resumed.orElseGet(() -> {
            RecurringPattern p = new RecurringPattern(ownerId, template, rule, startDate, end);
            p.setExceptionDates(exceptions);
            p.setMigratedFromTaskId(taskId);
            p.moveWatermark(watermark);
            return patternRepository.save(p);
        });

        List<Long> childIds = children.stream().map(Task::getId).toList();
        int repointed = batchWriter.write("repointLegacyInstances", childIds,
                chunk -> taskRepository.repointToPattern(chunk, pattern.getId(), now));

        int created;
        if (pattern.isAfterCompletion()) {
            created = startChain(pattern, children, from);
        } else {
            Set<LocalDate> existing = resumed.isPresent()
                    ? existingDates(ownerId, pattern.getId())
                    : childDates;
            created = materializer.materialize(pattern, from, pattern.getGeneratedUntil(), existing).size();
        }

        legacy.setMigratedToPatternId(pattern.getId());
        legacy.setDeletedAt(now);
        taskRepository.save(legacy);
        logger.info("旧形式タスクを移行しました: taskId={}, patternId={}, repointed={}, created={}",
                taskId, pattern.getId(), repointed, created);
        return new MigrationItemResult(taskId, pattern.getId(), resumed.isEmpty(), created, repointed, false, false);
    }

    /**
     * 対象オーナー（空なら全オーナー）の旧形式タスクを1件ずつ順に移行する。
     * 1件の失敗で中断せず、エラーを結果に集める。
     *
     * @throws MigrationJobRunningException 同じ対象の移行がすでに実行中の場合
     */
    public MigrationResult migrateAllLegacyItems(String ownerId, boolean dryRun) {
        requireValidTarget(ownerId);
        if (!jobStatusService.tryStart(ownerId)) {
            throw new MigrationJobRunningException(ownerId);
        }
        return runMigration(ownerId, dryRun);
    }

    /**
     * 呼び出し側で {@link MigrationJobStatusService#tryStart} に成功していること。
     * 終了時にジョブ状況を完了にする。
     */
    @Async("migrationExecutor")
    public void migrateAllLegacyItemsAsync(String ownerId, boolean dryRun) {
        runMigration(ownerId, dryRun);
    }

    /**
     * オーナーIDが空（全オーナー）か有効な形式であることを確認する
     */
    public static void requireValidTarget(String ownerId) {
        if (ownerId != null && !ownerId.isBlank()) {
            PatternLookup.requireValidOwnerId(ownerId);
        }
    }

    private MigrationResult runMigration(String ownerId, boolean dryRun) {
        int processed = 0;
        int patterns = 0;
        int instances = 0;
        int repointed = 0;
        List<String> errors = new ArrayList<>();
        try {
            boolean allOwners = ownerId == null || ownerId.isBlank();
            List<String> owners = allOwners ? taskRepository.findLegacyOwnerIds() : List.of(ownerId);
            for (String owner : owners) {
                List<Task> legacyItems = taskRepository.findLegacyRecurringItems(owner);
                logger.info("旧形式の繰り返しタスク: owner={}, count={}, dryRun={}", owner, legacyItems.size(), dryRun);
                for (Task item : legacyItems) {
                    processed++;
                    try {
                        MigrationItemResult r = migrateLegacyItem(owner, item.getId(), dryRun);
                        if (r.patternCreated()) {
                            patterns++;
                        }
                        instances += r.instancesCreated();
                        repointed += r.instancesRepointed();
                    } catch (RuntimeException e) {
                        String message = "タスク " + item.getId() + " の移行に失敗しました: " + e.getMessage();
                        errors.add(message);
                        logger.warn(message, e);
                        errorLogBuffer.addError("migrate taskId=" + item.getId(), e);
                    }
                    jobStatusService.updateCount(ownerId, processed, errors.size());
                }
            }
        } finally {
            jobStatusService.finish(ownerId, processed, errors.size());
        }

        MigrationResult result = new MigrationResult(processed, patterns, instances, repointed, errors, dryRun);
        logger.info("旧形式の移行が完了しました: processed={}, patterns={}, created={}, repointed={}, errors={}, dryRun={}",
                processed, patterns, instances, repointed, errors.size(), dryRun);
        return result;
    }

    private int startChain(RecurringPattern pattern, List<Task> children, LocalDate from) {
        if (pattern.getActiveInstanceId() != null) {
            return 0;
        }
        Optional<Task> open = children.stream()
                .filter(c -> c.getStatus() == TaskStatus.IN_PROGRESS)
                .reduce((a, b) -> b);
        int created = 0;
        Long activeId;
        if (open.isPresent()) {
            activeId = open.get().getId();
        } else {
            activeId = materializer.materializeSingle(pattern, from).getId();
            created = 1;
        }
        pattern.setActiveInstanceId(activeId);
        patternRepository.save(pattern);
        return created;
    }

    private Set<LocalDate> existingDates(String ownerId, Long patternId) {
        return taskRepository.findByOwnerIdAndRecurringPatternIdAndDeletedAtIsNullOrderByScheduledDateAsc(ownerId, patternId)
                .stream().map(Task::getScheduledDate).collect(Collectors.toSet());
    }

    private LocalDate watermark(LocalDate from, EndCondition end) {
        LocalDate watermark = from.plusDays(settings.getLookaheadDays());
        Optional<LocalDate> endDate = end.lastAllowedDate();
        if (endDate.isPresent() && endDate.get().isBefore(watermark)) {
            watermark = endDate.get();
        }
        return watermark;
    }

    private LegacyRecurrence parse(Task legacy) {
        try {
            return objectMapper.readValue(legacy.getRecurrenceJson(), LegacyRecurrence.class);
        } catch (JsonProcessingException e) {
            throw new PatternValidationException("recurrence", "繰り返し設定を読み取れません: taskId=" + legacy.getId());
        }
    }

    private static TemplateFields templateOf(Task legacy) {
        LocalTime startTime = legacy.getStartTime();
        if (startTime == null && legacy.getScheduledTime() != null && !legacy.getScheduledTime().isBlank()) {
            try {
                startTime = LocalTime.parse(legacy.getScheduledTime());
            } catch (DateTimeParseException e) {
                logger.warn("開始時刻を読み取れないため無視します: taskId={}, scheduledTime={}",
                        legacy.getId(), legacy.getScheduledTime());
            }
        }
        return new TemplateFields(legacy.getTitle(), legacy.getDescription(), legacy.getCategoryId(),
                legacy.getPriorityLetter(), legacy.getPriorityNumber(), startTime, legacy.getDurationMinutes());
    }
}
