package com.example.plannerv1.pattern;

import com.example.plannerv1.config.RecurrenceSettings;
import com.example.plannerv1.exception.PatternValidationException;
import com.example.plannerv1.recurrence.EndCondition;
import com.example.plannerv1.recurrence.OccurrenceGenerator;
import com.example.plannerv1.recurrence.RecurrenceRule;
import com.example.plannerv1.task.InstanceFilter;
import com.example.plannerv1.task.Task;
import com.example.plannerv1.task.TemplateFields;
import com.example.plannerv1.task.WorkItemGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 繰り返しパターンの作成・取得・更新・削除。
 * 入力検証と所有者チェックは書き込みより前に行う。
 */
@Service
public class PatternService {

    private static final Logger logger = LoggerFactory.getLogger(PatternService.class);

    /** プレビューで一度に展開できる最大日数 */
    static final int MAX_PREVIEW_DAYS = 366 * 2;

    private final RecurringPatternRepository patternRepository;
    private final PatternLookup patternLookup;
    private final InstanceMaterializer materializer;
    private final PatternReconciler reconciler;
    private final WorkItemGateway workItemGateway;
    private final RecurrenceSettings settings;
    private final Clock clock;

    public PatternService(RecurringPatternRepository patternRepository,
                          PatternLookup patternLookup,
                          InstanceMaterializer materializer,
                          PatternReconciler reconciler,
                          WorkItemGateway workItemGateway,
                          RecurrenceSettings settings,
                          Clock clock) {
        this.patternRepository = patternRepository;
        this.patternLookup = patternLookup;
        this.materializer = materializer;
        this.reconciler = reconciler;
        this.workItemGateway = workItemGateway;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * パターンを作成し、開始日から先行日数分のインスタンスを生成する。
     * 完了後繰り返しは開始日に1件だけ作成し、それをアクティブにする。
     */
    public RecurringPattern createPattern(String ownerId, PatternRequest request) {
        PatternLookup.requireValidOwnerId(ownerId);
        TemplateFields template = requireTemplate(request.template());
        RecurrenceRule rule = request.rule();
        EndCondition end = request.toEndCondition();
        validateRange(request.startDate(), end);

        RecurringPattern pattern = new RecurringPattern(ownerId, template, rule, request.startDate(), end);
        pattern.setExceptionDates(request.exceptionDateSet());
        return createWithInitialWindow(pattern);
    }

    private RecurringPattern createWithInitialWindow(RecurringPattern pattern) {
        pattern.moveWatermark(initialWatermark(pattern));
        RecurringPattern saved = patternRepository.save(pattern);

        if (saved.isAfterCompletion()) {
            Task first = materializer.materializeSingle(saved, saved.getStartDate());
            saved.setActiveInstanceId(first.getId());
            saved = patternRepository.save(saved);
            logger.info("パターンを作成しました: id={}, type={}, activeInstanceId={}",
                    saved.getId(), saved.getRecurrenceType(), first.getId());
            return saved;
        }

        List<Task> created = materializer.materialize(saved, saved.getStartDate(), saved.getGeneratedUntil());
        logger.info("パターンを作成しました: id={}, type={}, generatedUntil={}, created={}",
                saved.getId(), saved.getRecurrenceType(), saved.getGeneratedUntil(), created.size());
        return saved;
    }

    public RecurringPattern getPattern(String ownerId, Long patternId) {
        return patternLookup.requireOwned(ownerId, patternId);
    }

    public List<RecurringPattern> listPatterns(String ownerId) {
        PatternLookup.requireValidOwnerId(ownerId);
        return patternRepository.findByOwnerIdAndDeletedAtIsNullOrderByIdAsc(ownerId);
    }

    /**
     * null の項目は変更しない。新しい値はすべて検証してから書き込む。
     *
     * @param regenerateFutureInstances true なら今日以降の未編集インスタンスを現在のルールで作り直す
     */
    public RecurringPattern updatePattern(String ownerId, Long patternId, PatternUpdateRequest request,
                                          boolean regenerateFutureInstances) {
        RecurringPattern pattern = patternLookup.requireOwned(ownerId, patternId);

        TemplateFields previousTemplate = pattern.templateFields();
        EndCondition previousEnd = pattern.endCondition();
        LocalDate previousStart = pattern.getStartDate();

        TemplateFields template = requireTemplate(request.mergeTemplate(previousTemplate));
        RecurrenceRule rule = request.replacesRule() ? request.rule() : pattern.rule();
        EndCondition end = request.endCondition() != null
                ? request.endCondition().toEndCondition() : previousEnd;
        LocalDate startDate = request.startDate() != null ? request.startDate() : pattern.getStartDate();
        Set<LocalDate> exceptions = request.exceptionDates() != null
                ? new TreeSet<>(request.exceptionDates()) : pattern.exceptionDates();
        validateRange(startDate, end);

        pattern.applyTemplate(template);
        pattern.setRule(rule);
        if (!pattern.isAfterCompletion()) {
            pattern.setActiveInstanceId(null);
        }
        pattern.setStartDate(startDate);
        pattern.moveWatermark(pattern.getGeneratedUntil()); // keep generatedUntil >= startDate
        pattern.setEndCondition(end);
        pattern.setExceptionDates(exceptions);
        pattern = patternRepository.save(pattern);
        logger.info("パターンを更新しました: id={}, regenerate={}", pattern.getId(), regenerateFutureInstances);

        reconciler.reconcileEndCondition(pattern, previousEnd, !regenerateFutureInstances);
        reconciler.reconcileStartDate(pattern, previousStart, previousTemplate);
        if (regenerateFutureInstances) {
            reconciler.regenerate(pattern, previousTemplate);
        }
        return patternRepository.findById(pattern.getId()).orElse(pattern);
    }

    /**
     * パターンを論理削除する。cascadeInstances が true なら有効なインスタンスもすべて論理削除する。
     *
     * @return 論理削除したインスタンス数
     */
    public int deletePattern(String ownerId, Long patternId, boolean cascadeInstances) {
        RecurringPattern pattern = patternLookup.requireOwned(ownerId, patternId);
        pattern.setDeletedAt(LocalDateTime.now(clock));
        patternRepository.save(pattern);

        int deleted = 0;
        if (cascadeInstances) {
            deleted = workItemGateway.softDeleteInstances(ownerId, patternId, InstanceFilter.all());
        }
        logger.info("パターンを削除しました: id={}, cascade={}, deletedInstances={}", patternId, cascadeInstances, deleted);
        return deleted;
    }

    /**
     * 表示用の展開。何も保存しない。
     */
    public List<LocalDate> previewOccurrences(String ownerId, Long patternId, LocalDate from, LocalDate to) {
        RecurringPattern pattern = patternLookup.requireOwned(ownerId, patternId);
        if (from == null || to == null) {
            throw new PatternValidationException("from", "期間の指定は必須です");
        }
        if (ChronoUnit.DAYS.between(from, to) > MAX_PREVIEW_DAYS) {
            throw new PatternValidationException("to", "プレビュー期間は" + MAX_PREVIEW_DAYS + "日以内で指定してください");
        }
        return OccurrenceGenerator.generateOccurrenceDates(pattern.toSpec(), from, to);
    }

    public List<Task> listInstances(String ownerId, Long patternId) {
        patternLookup.requireOwned(ownerId, patternId);
        return workItemGateway.instancesWhere(ownerId, patternId, InstanceFilter.all());
    }

    private LocalDate initialWatermark(RecurringPattern pattern) {
        LocalDate watermark = pattern.getStartDate().plusDays(settings.getLookaheadDays());
        LocalDate endDate = pattern.endCondition().lastAllowedDate().orElse(null);
        if (endDate != null && endDate.isBefore(watermark)) {
            watermark = endDate;
        }
        return watermark;
    }

    private static TemplateFields requireTemplate(TemplateFields template) {
        if (template.title() == null || template.title().isBlank()) {
            throw new PatternValidationException("title", "タイトルは必須です");
        }
        return template;
    }

    private static void validateRange(LocalDate startDate, EndCondition end) {
        if (startDate == null) {
            throw new PatternValidationException("startDate", "開始日は必須です");
        }
        if (end.type() == EndCondition.Type.ON_DATE && end.endDate().isBefore(startDate)) {
            throw new PatternValidationException("endCondition.endDate", "終了日は開始日以降で指定してください");
        }
    }
}
