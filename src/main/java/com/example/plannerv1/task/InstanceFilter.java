package com.example.plannerv1.task;

import java.time.LocalDate;
import java.util.function.Predicate;

/**
 * インスタンス検索・一括論理削除の条件。
 * 日付条件はクエリで、predicate は取得後のメモリ上で評価する。
 *
 * @param scheduledAfter  この日より後（含まない）。null なら条件なし
 * @param scheduledFrom   この日以降（含む）。null なら条件なし
 * @param predicate       追加条件
 */
public record InstanceFilter(LocalDate scheduledAfter, LocalDate scheduledFrom, Predicate<Task> predicate) {

    public InstanceFilter {
        if (scheduledAfter != null && scheduledFrom != null) {
            throw new IllegalArgumentException("scheduledAfter と scheduledFrom は同時に指定できません");
        }
        predicate = predicate == null ? t -> true : predicate;
    }

    public static InstanceFilter all() {
        return new InstanceFilter(null, null, null);
    }

    public static InstanceFilter scheduledAfter(LocalDate date) {
        return new InstanceFilter(date, null, null);
    }

    public static InstanceFilter scheduledOnOrAfter(LocalDate date) {
        return new InstanceFilter(null, date, null);
    }

    public InstanceFilter and(Predicate<Task> more) {
        return new InstanceFilter(scheduledAfter, scheduledFrom, predicate.and(more));
    }
}
