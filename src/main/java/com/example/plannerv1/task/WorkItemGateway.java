package com.example.plannerv1.task;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 作業項目ストアへの窓口。繰り返しエンジンはタスクをこのインターフェース経由でのみ操作する。
 */
public interface WorkItemGateway {

    /**
     * テンプレートから1件のインスタンスを作成する。失敗時は例外をそのまま送出する。
     */
    Task createInstance(String ownerId, TemplateFields template, LocalDate scheduledDate, Long patternId);

    /**
     * 条件に合う有効なインスタンスを論理削除し、削除件数を返す。
     * 書き込みはチャンク単位でコミットされ、途中で失敗した場合それ以前のチャンクは残る。
     */
    int softDeleteInstances(String ownerId, Long patternId, InstanceFilter filter);

    /**
     * 条件に合う有効なインスタンスを日付順で返す
     */
    List<Task> instancesWhere(String ownerId, Long patternId, InstanceFilter filter);

    Optional<Task> findInstance(String ownerId, Long taskId);

    /**
     * 条件に合う有効なインスタンスが受け持っている発生日。
     * 日付を動かしたインスタンスは移動先ではなく生成時の発生日を受け持つ（元の日に作り直さないため）。
     */
    default Set<LocalDate> occupiedDates(String ownerId, Long patternId, InstanceFilter filter) {
        Set<LocalDate> dates = new HashSet<>();
        for (Task task : instancesWhere(ownerId, patternId, filter)) {
            LocalDate date = task.getInstanceDate() != null ? task.getInstanceDate() : task.getScheduledDate();
            if (date != null) {
                dates.add(date);
            }
        }
        return dates;
    }
}
