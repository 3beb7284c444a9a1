package com.example.plannerv1.task;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface TaskRepository extends JpaRepository<Task, Long> {

    Optional<Task> findByIdAndOwnerId(Long id, String ownerId);

    /**
     * パターンの有効なインスタンスを日付順で取得
     */
    List<Task> findByOwnerIdAndRecurringPatternIdAndDeletedAtIsNullOrderByScheduledDateAsc(
            String ownerId, Long recurringPatternId);

    /**
     * 指定日より後（指定日を含まない）の有効なインスタンス
     */
    List<Task> findByOwnerIdAndRecurringPatternIdAndDeletedAtIsNullAndScheduledDateGreaterThanOrderByScheduledDateAsc(
            String ownerId, Long recurringPatternId, LocalDate scheduledDate);

    /**
     * 指定日以降（指定日を含む）の有効なインスタンス
     */
    List<Task> findByOwnerIdAndRecurringPatternIdAndDeletedAtIsNullAndScheduledDateGreaterThanEqualOrderByScheduledDateAsc(
            String ownerId, Long recurringPatternId, LocalDate scheduledDate);

    @Modifying
    @Query("UPDATE Task t SET t.deletedAt = :now, t.updatedAt = :now WHERE t.id IN :ids AND t.deletedAt IS NULL")
    int softDeleteByIdIn(@Param("ids") Collection<Long> ids, @Param("now") LocalDateTime now);

    /**
     * 旧形式の仮想インスタンスを通常のインスタンスとしてパターンに付け替える
     */
    @Modifying
    @Query("UPDATE Task t SET t.recurringPatternId = :patternId, t.recurringParentId = NULL, " +
           "t.instanceDate = COALESCE(t.instanceDate, t.scheduledDate), " +
           "t.recurringInstance = false, t.updatedAt = :now WHERE t.id IN :ids")
    int repointToPattern(@Param("ids") Collection<Long> ids,
                         @Param("patternId") Long patternId,
                         @Param("now") LocalDateTime now);

    // ---- 旧形式（埋め込み繰り返し）----

    @Query("SELECT t FROM Task t WHERE t.ownerId = :ownerId AND t.deletedAt IS NULL " +
           "AND t.recurrenceJson IS NOT NULL AND t.recurringInstance = false " +
           "AND t.recurringParentId IS NULL ORDER BY t.id")
    List<Task> findLegacyRecurringItems(@Param("ownerId") String ownerId);

    @Query("SELECT DISTINCT t.ownerId FROM Task t WHERE t.deletedAt IS NULL " +
           "AND t.recurrenceJson IS NOT NULL AND t.recurringInstance = false " +
           "AND t.recurringParentId IS NULL ORDER BY t.ownerId")
    List<String> findLegacyOwnerIds();

    List<Task> findByRecurringParentIdAndDeletedAtIsNullOrderByScheduledDateAsc(Long recurringParentId);
}
