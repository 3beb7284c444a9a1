package com.example.plannerv1.pattern;

import com.example.plannerv1.common.error.ErrorLogBuffer;
import com.example.plannerv1.recurrence.OccurrenceGenerator;
import com.example.plannerv1.task.Task;
import com.example.plannerv1.task.TemplateFields;
import com.example.plannerv1.task.WorkItemGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 発生日ごとにタスクを作成する。
 * 1件の作成失敗で範囲全体を中断せず、ログとエラーバッファに記録して残りを続ける。
 * 失敗した日は自動で再試行しない（次回の ensureInstancesForDate などで呼び出し側が再実行する）。
 */
@Component
public class InstanceMaterializer {

    private static final Logger logger = LoggerFactory.getLogger(InstanceMaterializer.class);

    private final WorkItemGateway workItemGateway;
    private final ErrorLogBuffer errorLogBuffer;

    public InstanceMaterializer(WorkItemGateway workItemGateway, ErrorLogBuffer errorLogBuffer) {
        this.workItemGateway = workItemGateway;
        this.errorLogBuffer = errorLogBuffer;
    }

    public List<Task> materialize(RecurringPattern pattern, LocalDate from, LocalDate to) {
        return materialize(pattern, from, to, Set.of());
    }

    /**
     * [from, to] の発生日にインスタンスを作成し、作成できたものを返す。
     * 完了後繰り返しは範囲に関係なく1件だけ作成する。
     *
     * @param skipDates 既にインスタンスがある日付（作成しない）
     */
    public List<Task> materialize(RecurringPattern pattern, LocalDate from, LocalDate to, Set<LocalDate> skipDates) {
        if (pattern.isAfterCompletion()) {
            LocalDate date = from.isAfter(pattern.getStartDate()) ? from : pattern.getStartDate();
            return List.of(materializeSingle(pattern, date));
        }

        List<LocalDate> dates = OccurrenceGenerator.generateOccurrenceDates(pattern.toSpec(), from, to);
        TemplateFields template = pattern.templateFields();
        List<Task> created = new ArrayList<>(dates.size());
        int failed = 0;
        for (LocalDate date : dates) {
            if (skipDates.contains(date)) {
                continue;
            }
            try {
                created.add(workItemGateway.createInstance(pattern.getOwnerId(), template, date, pattern.getId()));
            } catch (RuntimeException e) {
                failed++;
                logger.warn("インスタンスの作成に失敗しました: patternId={}, date={}", pattern.getId(), date, e);
                errorLogBuffer.addError("materialize patternId=" + pattern.getId() + " date=" + date, e);
            }
        }
        if (failed > 0) {
            logger.warn("一部のインスタンスを作成できませんでした: patternId={}, range={}..{}, created={}, failed={}",
                    pattern.getId(), from, to, created.size(), failed);
        } else {
            logger.debug("インスタンス作成: patternId={}, range={}..{}, created={}", pattern.getId(), from, to, created.size());
        }
        return created;
    }

    /**
     * 指定日に1件作成する。失敗は呼び出し側へ送出する。
     */
    public Task materializeSingle(RecurringPattern pattern, LocalDate date) {
        return workItemGateway.createInstance(pattern.getOwnerId(), pattern.templateFields(), date, pattern.getId());
    }
}
