package com.example.plannerv1.pattern;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RecurringPatternRepository extends JpaRepository<RecurringPattern, Long> {

    List<RecurringPattern> findByOwnerIdAndDeletedAtIsNullOrderByIdAsc(String ownerId);

    Optional<RecurringPattern> findFirstByMigratedFromTaskIdAndDeletedAtIsNull(Long migratedFromTaskId);
}
