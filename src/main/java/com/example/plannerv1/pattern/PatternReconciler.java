package com.example.plannerv1.pattern;

import com.example.plannerv1.config.RecurrenceSettings;
import com.example.plannerv1.recurrence.EndCondition;
import com.example.plannerv1.recurrence.OccurrenceGenerator;
import com.example.plannerv1.task.InstanceFilter;
import com.example.plannerv1.task.Task;
import com.example.plannerv1.task.TemplateFields;
import com.example.plannerv1.task.WorkItemGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * パターン更新後に、作成済みインスタンスを新しい設定へ合わせる。
 *
 * <ul>
 *   <li>終了条件が延びた: 今日以降の不足分を生成して watermark を進める
 *   <li>終了日が早まった: 新しい終了日より後の有効なインスタンスを論理削除する
 *   <li>再生成: 今日以降の未着手・未編集インスタンスだけを削除し、現在のルールで作り直す
 * </ul>
 * 論理削除は一括書き込み（チャンク単位のコミット）で行う。
 */
@Service
public class PatternReconciler {

    private static final Logger logger = LoggerFactory.getLogger(PatternReconciler.class);

    private final RecurringPatternRepository patternRepository;
    private final InstanceMaterializer materializer;
    private final WorkItemGateway workItemGateway;
    private final RecurrenceSettings settings;
    private final Clock clock;

    public PatternReconciler(RecurringPatternRepository patternRepository,
                             InstanceMaterializer materializer,
                             WorkItemGateway workItemGateway,
                             RecurrenceSettings settings,
                             Clock clock) {
        this.patternRepository = patternRepository;
        this.materializer = materializer;
        this.workItemGateway = workItemGateway;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * 終了条件の変更を反映する。pattern は新しい終了条件で保存済みであること。
     *
     * @param extend 延長を反映するか（再生成する場合は false にして二重生成を避ける）
     */
    public ReconcileResult reconcileEndCondition(RecurringPattern pattern, EndCondition previous, boolean extend) {
        EndCondition next = pattern.endCondition();
        if (next.endsBefore(previous)) {
            return shorten(pattern, next.endDate());
        }
        if (extend && next.extendsBeyond(previous)) {
            return extend(pattern);
        }
        return ReconcileResult.none();
    }

    ReconcileResult extend(RecurringPattern pattern) {
        if (pattern.isAfterCompletion()) {
            return ReconcileResult.none();
        }
        LocalDate today = LocalDate.now(clock);
        LocalDate current = pattern.getGeneratedUntil();
        LocalDate lower = current.isAfter(today) ? current : today;
        LocalDate upper = freshWatermark(pattern, today);
        if (!upper.isAfter(lower)) {
            return ReconcileResult.none();
        }

        Set<LocalDate> existing = existingDates(pattern, InstanceFilter.scheduledAfter(lower));
        List<Task> created = materializer.materialize(pattern, lower.plusDays(1), upper, existing);
        if (upper.isAfter(current)) {
            pattern.moveWatermark(upper);
        }
        patternRepository.save(pattern);
        logger.info("終了条件の延長を反映しました: patternId={}, range=({}, {}], created={}",
                pattern.getId(), lower, upper, created.size());
        return new ReconcileResult(created.size(), 0);
    }

    ReconcileResult shorten(RecurringPattern pattern, LocalDate newEndDate) {
        int deleted = workItemGateway.softDeleteInstances(pattern.getOwnerId(), pattern.getId(),
                InstanceFilter.scheduledAfter(newEndDate));
        boolean changed = false;
        if (pattern.getGeneratedUntil().isAfter(newEndDate)) {
            pattern.moveWatermark(newEndDate);
            changed = true;
        }
        if (pattern.getActiveInstanceId() != null
                && workItemGateway.findInstance(pattern.getOwnerId(), pattern.getActiveInstanceId()).isEmpty()) {
            pattern.setActiveInstanceId(null);
            changed = true;
        }
        if (changed) {
            patternRepository.save(pattern);
        }
        logger.info("終了日の短縮を反映しました: patternId={}, endDate={}, deleted={}", pattern.getId(), newEndDate, deleted);
        return new ReconcileResult(0, deleted);
    }

    /**
     * 開始日の変更を反映する。pattern は新しい開始日で保存済みであること。
     * 新しい発生日に当たらない未編集インスタンス（新しい開始日より前のものを含む）を論理削除し、
     * [新しい開始日, watermark] の不足分を生成する。開始日が watermark より先へ移った場合は
     * 新しい開始日から先行日数分を生成範囲とする。
     *
     * @param previousTemplate 更新前のテンプレート（未編集の判定に使う）
     */
    public ReconcileResult reconcileStartDate(RecurringPattern pattern, LocalDate previousStart,
                                              TemplateFields previousTemplate) {
        LocalDate newStart = pattern.getStartDate();
        if (newStart.equals(previousStart)) {
            return ReconcileResult.none();
        }
        if (pattern.isAfterCompletion()) {
            return moveChainStart(pattern, previousTemplate);
        }

        LocalDate watermark = pattern.getGeneratedUntil();
        LocalDate initial = newStart.plusDays(settings.getLookaheadDays());
        Optional<LocalDate> endDate = pattern.endCondition().lastAllowedDate();
        if (endDate.isPresent() && endDate.get().isBefore(initial)) {
            initial = endDate.get();
        }
        if (initial.isAfter(watermark)) {
            watermark = initial;
        }

        Set<LocalDate> occurrences = new HashSet<>(
                OccurrenceGenerator.generateOccurrenceDates(pattern.toSpec(), newStart, watermark));
        int deleted = workItemGateway.softDeleteInstances(pattern.getOwnerId(), pattern.getId(),
                InstanceFilter.all().and(t -> t.isPristine(previousTemplate)
                        && !occurrences.contains(t.getScheduledDate())));

        Set<LocalDate> existing = existingDates(pattern, InstanceFilter.all());
        List<Task> created = materializer.materialize(pattern, newStart, watermark, existing);
        pattern.moveWatermark(watermark);
        patternRepository.save(pattern);
        logger.info("開始日の変更を反映しました: patternId={}, {} -> {}, deleted={}, created={}, generatedUntil={}",
                pattern.getId(), previousStart, newStart, deleted, created.size(), pattern.getGeneratedUntil());
        return new ReconcileResult(created.size(), deleted);
    }

    /**
     * 完了後繰り返しで開始日が動いた場合、未編集のアクティブなインスタンスが新しい開始日より前にあれば
     * 新しい開始日（今日の方が後なら今日）へ作り直す。
     */
    private ReconcileResult moveChainStart(RecurringPattern pattern, TemplateFields previousTemplate) {
        Long activeId = pattern.getActiveInstanceId();
        if (activeId == null) {
            return ReconcileResult.none();
        }
        Optional<Task> active = workItemGateway.findInstance(pattern.getOwnerId(), activeId);
        if (active.isEmpty() || !active.get().isPristine(previousTemplate)
                || !active.get().getScheduledDate().isBefore(pattern.getStartDate())) {
            return ReconcileResult.none();
        }
        int deleted = workItemGateway.softDeleteInstances(pattern.getOwnerId(), pattern.getId(),
                InstanceFilter.all().and(t -> t.getId().equals(activeId)));
        pattern.setActiveInstanceId(null);
        ReconcileResult started = startChain(pattern, previousTemplate, LocalDate.now(clock));
        return new ReconcileResult(started.created(), deleted + started.deleted());
    }

    /**
     * 今日以降の未着手かつテンプレートから変更されていないインスタンスを削除し、現在のルールで作り直す。
     * 完了済み・編集済みのインスタンスには触れない。
     *
     * @param previousTemplate 更新前のテンプレート（未編集の判定に使う）
     */
    public ReconcileResult regenerate(RecurringPattern pattern, TemplateFields previousTemplate) {
        LocalDate today = LocalDate.now(clock);
        if (pattern.isAfterCompletion()) {
            return regenerateActiveInstance(pattern, previousTemplate, today);
        }

        int deleted = workItemGateway.softDeleteInstances(pattern.getOwnerId(), pattern.getId(),
                InstanceFilter.scheduledOnOrAfter(today).and(t -> t.isPristine(previousTemplate)));

        LocalDate fresh = freshWatermark(pattern, today);
        Set<LocalDate> kept = existingDates(pattern, InstanceFilter.all());
        List<Task> created = materializer.materialize(pattern, today, fresh, kept);
        pattern.moveWatermark(fresh);
        patternRepository.save(pattern);
        logger.info("将来のインスタンスを再生成しました: patternId={}, deleted={}, created={}, generatedUntil={}",
                pattern.getId(), deleted, created.size(), pattern.getGeneratedUntil());
        return new ReconcileResult(created.size(), deleted);
    }

    private ReconcileResult regenerateActiveInstance(RecurringPattern pattern, TemplateFields previousTemplate, LocalDate today) {
        Long activeId = pattern.getActiveInstanceId();
        if (activeId == null) {
            return startChain(pattern, previousTemplate, today);
        }
        Optional<Task> active = workItemGateway.findInstance(pattern.getOwnerId(), activeId);
        if (active.isEmpty() || !active.get().isPristine(previousTemplate)) {
            return ReconcileResult.none();
        }
        Task old = active.get();
        LocalDate date = old.getScheduledDate() != null ? old.getScheduledDate() : today;
        int deleted = workItemGateway.softDeleteInstances(pattern.getOwnerId(), pattern.getId(),
                InstanceFilter.all().and(t -> t.getId().equals(activeId)));
        Task replacement = materializer.materializeSingle(pattern, date);
        pattern.setActiveInstanceId(replacement.getId());
        patternRepository.save(pattern);
        logger.info("アクティブなインスタンスを作り直しました: patternId={}, {} -> {}", pattern.getId(), activeId, replacement.getId());
        return new ReconcileResult(1, deleted);
    }

    /**
     * アクティブなインスタンスがない場合（他の種類から切り替えた直後など）、
     * 残っている未編集の将来インスタンスを削除して、今日（開始日が先ならその日）に1件作る。
     */
    private ReconcileResult startChain(RecurringPattern pattern, TemplateFields previousTemplate, LocalDate today) {
        int deleted = workItemGateway.softDeleteInstances(pattern.getOwnerId(), pattern.getId(),
                InstanceFilter.scheduledOnOrAfter(today).and(t -> t.isPristine(previousTemplate)));
        LocalDate date = pattern.getStartDate().isAfter(today) ? pattern.getStartDate() : today;
        Optional<LocalDate> endDate = pattern.endCondition().lastAllowedDate();
        if (endDate.isPresent() && date.isAfter(endDate.get())) {
            return new ReconcileResult(0, deleted);
        }
        Task first = materializer.materializeSingle(pattern, date);
        pattern.setActiveInstanceId(first.getId());
        if (date.isAfter(pattern.getGeneratedUntil())) {
            pattern.moveWatermark(date);
        }
        patternRepository.save(pattern);
        logger.info("完了後繰り返しの連鎖を開始しました: patternId={}, activeInstanceId={}", pattern.getId(), first.getId());
        return new ReconcileResult(1, deleted);
    }

    private LocalDate freshWatermark(RecurringPattern pattern, LocalDate today) {
        LocalDate upper = today.plusDays(settings.getLookaheadDays());
        Optional<LocalDate> endDate = pattern.endCondition().lastAllowedDate();
        if (endDate.isPresent() && endDate.get().isBefore(upper)) {
            upper = endDate.get();
        }
        return upper;
    }

    private Set<LocalDate> existingDates(RecurringPattern pattern, InstanceFilter filter) {
        return workItemGateway.occupiedDates(pattern.getOwnerId(), pattern.getId(), filter);
    }

    public record ReconcileResult(int created, int deleted) {
        static ReconcileResult none() {
            return new ReconcileResult(0, 0);
        }
    }
}
