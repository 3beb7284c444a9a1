package com.example.plannerv1.pattern;

import com.example.plannerv1.exception.PatternNotFoundException;
import com.example.plannerv1.exception.RecurrenceConfigurationException;
import com.example.plannerv1.recurrence.EndCondition;
import com.example.plannerv1.task.InstanceFilter;
import com.example.plannerv1.task.Task;
import com.example.plannerv1.task.WorkItemGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * 完了後繰り返しパターンの連鎖。アクティブなインスタンスが完了したら
 * 完了日 + daysAfterCompletion に次のインスタンスを1件だけ作り、新しいアクティブにする。
 */
@Service
public class CompletionChainer {

    private static final Logger logger = LoggerFactory.getLogger(CompletionChainer.class);

    private final PatternLookup patternLookup;
    private final RecurringPatternRepository patternRepository;
    private final InstanceMaterializer materializer;
    private final WorkItemGateway workItemGateway;

    public CompletionChainer(PatternLookup patternLookup,
                             RecurringPatternRepository patternRepository,
                             InstanceMaterializer materializer,
                             WorkItemGateway workItemGateway) {
        this.patternLookup = patternLookup;
        this.patternRepository = patternRepository;
        this.materializer = materializer;
        this.workItemGateway = workItemGateway;
    }

    /**
     * @return 作成した次のインスタンス。連鎖の対象外・終了条件に達した場合は空
     * @throws RecurrenceConfigurationException daysAfterCompletion が未設定の場合
     */
    public Optional<Task> onInstanceCompleted(String ownerId, Long patternId, Long taskId, LocalDate completionDate) {
        RecurringPattern pattern = patternLookup.requireOwned(ownerId, patternId);
        if (!pattern.isAfterCompletion()) {
            logger.warn("完了後繰り返しではないため連鎖しません: patternId={}, type={}", patternId, pattern.getRecurrenceType());
            return Optional.empty();
        }
        Integer days = pattern.getDaysAfterCompletion();
        if (days == null) {
            throw new RecurrenceConfigurationException(
                    "完了後の日数が設定されていないため次のインスタンスを作成できません: patternId=" + patternId,
                    "daysAfterCompletion", null);
        }

        Task completed = workItemGateway.findInstance(ownerId, taskId)
                .filter(t -> Objects.equals(t.getRecurringPatternId(), patternId))
                .orElseThrow(() -> new PatternNotFoundException("インスタンス", taskId));
        Long activeId = pattern.getActiveInstanceId();
        if (activeId != null && !activeId.equals(completed.getId())) {
            logger.warn("アクティブなインスタンスではないため連鎖しません: patternId={}, taskId={}, activeInstanceId={}",
                    patternId, taskId, activeId);
            return Optional.empty();
        }

        LocalDate nextDate = completionDate.plusDays(days);
        if (reachedEnd(pattern, nextDate)) {
            pattern.setActiveInstanceId(null);
            patternRepository.save(pattern);
            logger.info("終了条件に達したため連鎖を終了しました: patternId={}, nextDate={}", patternId, nextDate);
            return Optional.empty();
        }

        Task next = materializer.materializeSingle(pattern, nextDate);
        pattern.setActiveInstanceId(next.getId());
        if (nextDate.isAfter(pattern.getGeneratedUntil())) {
            pattern.moveWatermark(nextDate);
        }
        patternRepository.save(pattern);
        logger.info("次のインスタンスを作成しました: patternId={}, completed={}, next={} ({})",
                patternId, taskId, next.getId(), nextDate);
        return Optional.of(next);
    }

    private boolean reachedEnd(RecurringPattern pattern, LocalDate nextDate) {
        EndCondition end = pattern.endCondition();
        if (end.type() == EndCondition.Type.ON_DATE) {
            return nextDate.isAfter(end.endDate());
        }
        if (end.type() == EndCondition.Type.AFTER_OCCURRENCES) {
            int existing = workItemGateway.instancesWhere(pattern.getOwnerId(), pattern.getId(), InstanceFilter.all()).size();
            return existing >= end.maxOccurrences();
        }
        return false;
    }
}
