package com.example.plannerv1.pattern;

import com.example.plannerv1.config.RecurrenceSettings;
import com.example.plannerv1.task.InstanceFilter;
import com.example.plannerv1.task.Task;
import com.example.plannerv1.task.WorkItemGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * パターンごとの生成済み範囲（generatedUntil）を管理し、必要に応じて先へ延ばす。
 *
 * 同じパターンに対する同時呼び出しは排他しない。範囲が重なって同じ日付が二重に作成されることは
 * まれに起こり得るものとして許容している。
 */
@Service
public class GenerationWindowManager {

    private static final Logger logger = LoggerFactory.getLogger(GenerationWindowManager.class);

    private final PatternLookup patternLookup;
    private final RecurringPatternRepository patternRepository;
    private final InstanceMaterializer materializer;
    private final WorkItemGateway workItemGateway;
    private final RecurrenceSettings settings;

    public GenerationWindowManager(PatternLookup patternLookup,
                                   RecurringPatternRepository patternRepository,
                                   InstanceMaterializer materializer,
                                   WorkItemGateway workItemGateway,
                                   RecurrenceSettings settings) {
        this.patternLookup = patternLookup;
        this.patternRepository = patternRepository;
        this.materializer = materializer;
        this.workItemGateway = workItemGateway;
        this.settings = settings;
    }

    /**
     * targetDate が生成済み範囲外なら targetDate + 先行日数 まで生成する。
     * 生成済み範囲内なら何もしない（作成も保存もしない）。
     */
    public EnsureResult ensureInstancesForDate(String ownerId, Long patternId, LocalDate targetDate) {
        RecurringPattern pattern = patternLookup.requireOwned(ownerId, patternId);
        return extendTo(pattern, targetDate);
    }

    EnsureResult extendTo(RecurringPattern pattern, LocalDate targetDate) {
        LocalDate current = pattern.getGeneratedUntil();
        if (!targetDate.isAfter(current)) {
            return new EnsureResult(pattern.getId(), current, current, 0);
        }
        if (pattern.isAfterCompletion()) {
            // 完了連鎖でのみ進める
            return new EnsureResult(pattern.getId(), current, current, 0);
        }

        LocalDate newWatermark = targetDate.plusDays(settings.getLookaheadDays());
        LocalDate endDate = pattern.endCondition().lastAllowedDate().orElse(null);
        if (endDate != null && endDate.isBefore(newWatermark)) {
            newWatermark = endDate;
        }
        if (!newWatermark.isAfter(current)) {
            return new EnsureResult(pattern.getId(), current, current, 0);
        }

        LocalDate from = current.plusDays(1);
        Set<LocalDate> existing = workItemGateway
                .occupiedDates(pattern.getOwnerId(), pattern.getId(), InstanceFilter.scheduledAfter(current));
        List<Task> created = materializer.materialize(pattern, from, newWatermark, existing);

        // 一部失敗しても watermark は進める（同じ範囲の再試行を繰り返さないため）
        pattern.moveWatermark(newWatermark);
        patternRepository.save(pattern);
        logger.info("生成範囲を延長しました: patternId={}, {} -> {}, created={}",
                pattern.getId(), current, newWatermark, created.size());
        return new EnsureResult(pattern.getId(), current, newWatermark, created.size());
    }
}
