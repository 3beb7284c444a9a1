package com.example.plannerv1.migration;

import com.example.plannerv1.exception.PatternValidationException;
import com.example.plannerv1.pattern.RecurringPattern;
import com.example.plannerv1.pattern.RecurringPatternRepository;
import com.example.plannerv1.recurrence.RecurrenceRule;
import com.example.plannerv1.recurrence.RecurrenceType;
import com.example.plannerv1.support.MutableClock;
import com.example.plannerv1.support.TestClockConfig;
import com.example.plannerv1.task.Task;
import com.example.plannerv1.task.TaskRepository;
import com.example.plannerv1.task.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;

import static com.example.plannerv1.support.PatternFixtures.OWNER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Import(TestClockConfig.class)
class LegacyMigratorTest {

    private static final LocalDate JAN_1 = LocalDate.of(2026, 1, 1);
    private static final LocalDate DEC_1 = LocalDate.of(2025, 12, 1);

    @Autowired
    private LegacyMigrator legacyMigrator;

    @Autowired
    private RecurringPatternRepository patternRepository;

    @Autowired
    private TaskRepository taskRepository;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        taskRepository.deleteAll();
        patternRepository.deleteAll();
        clock.setToday(JAN_1);
    }

    private Task legacyItem(String title, LocalDate date, String json) {
        Task task = new Task(OWNER, title);
        task.setScheduledDate(date);
        task.setScheduledTime("07:30");
        task.setRecurrenceJson(json);
        return taskRepository.save(task);
    }

    private Task legacyChild(Task parent, LocalDate date, TaskStatus status) {
        Task child = new Task(OWNER, parent.getTitle());
        child.setScheduledDate(date);
        child.setStatus(status);
        child.setRecurringParentId(parent.getId());
        child.setRecurringInstance(true);
        return taskRepository.save(child);
    }

    /** 2025-12-01 開始・毎週月曜。子は 12/1（完了）, 12/8（完了）, 1/5（未完了） */
    private Task weeklyMondayWithChildren() {
        Task parent = legacyItem("週次レビュー", DEC_1, "{\"type\":\"weekly\",\"interval\":1,\"daysOfWeek\":[1]}");
        legacyChild(parent, DEC_1, TaskStatus.COMPLETE);
        legacyChild(parent, LocalDate.of(2025, 12, 8), TaskStatus.COMPLETE);
        legacyChild(parent, LocalDate.of(2026, 1, 5), TaskStatus.IN_PROGRESS);
        return parent;
    }

    @Test
    void migrateLegacyItem_createsPattern_repointsChildren_andRetiresLegacyItem() {
        Task parent = weeklyMondayWithChildren();

        MigrationItemResult result = legacyMigrator.migrateLegacyItem(OWNER, parent.getId(), false);

        assertThat(result.patternCreated()).isTrue();
        assertThat(result.instancesRepointed()).isEqualTo(3);
        // 1/1..4/1 の月曜は13日、うち 1/5 は既存
        assertThat(result.instancesCreated()).isEqualTo(12);

        RecurringPattern pattern = patternRepository.findById(result.patternId()).orElseThrow();
        assertThat(pattern.getRecurrenceType()).isEqualTo(RecurrenceType.WEEKLY);
        assertThat(pattern.rule()).isEqualTo(new RecurrenceRule.Weekly(1, EnumSet.of(DayOfWeek.MONDAY)));
        assertThat(pattern.getStartDate()).isEqualTo(DEC_1);
        assertThat(pattern.getGeneratedUntil()).isEqualTo(LocalDate.of(2026, 4, 1));
        assertThat(pattern.getMigratedFromTaskId()).isEqualTo(parent.getId());
        assertThat(pattern.getStartTime()).hasToString("07:30");

        List<Task> instances = taskRepository
                .findByOwnerIdAndRecurringPatternIdAndDeletedAtIsNullOrderByScheduledDateAsc(OWNER, pattern.getId());
        assertThat(instances).hasSize(15);
        assertThat(instances).allMatch(t -> t.getRecurringParentId() == null && !t.isRecurringInstance());
        assertThat(instances).filteredOn(t -> t.getScheduledDate().equals(LocalDate.of(2026, 1, 5))).hasSize(1);

        Task retired = taskRepository.findById(parent.getId()).orElseThrow();
        assertThat(retired.isDeleted()).isTrue();
        assertThat(retired.getMigratedToPatternId()).isEqualTo(pattern.getId());
    }

    @Test
    void migrateLegacyItem_secondRun_isNoOp() {
        Task parent = weeklyMondayWithChildren();
        MigrationItemResult first = legacyMigrator.migrateLegacyItem(OWNER, parent.getId(), false);
        long tasksAfterFirst = taskRepository.count();

        MigrationItemResult second = legacyMigrator.migrateLegacyItem(OWNER, parent.getId(), false);

        assertThat(second.alreadyMigrated()).isTrue();
        assertThat(second.patternId()).isEqualTo(first.patternId());
        assertThat(patternRepository.count()).isEqualTo(1);
        assertThat(taskRepository.count()).isEqualTo(tasksAfterFirst);
    }

    @Test
    void dryRun_reportsCountsWithoutWriting() {
        Task parent = weeklyMondayWithChildren();
        long tasksBefore = taskRepository.count();

        MigrationItemResult result = legacyMigrator.migrateLegacyItem(OWNER, parent.getId(), true);

        assertThat(result.dryRun()).isTrue();
        assertThat(result.instancesCreated()).isEqualTo(12);
        assertThat(result.instancesRepointed()).isEqualTo(3);
        assertThat(patternRepository.count()).isZero();
        assertThat(taskRepository.count()).isEqualTo(tasksBefore);
        assertThat(taskRepository.findById(parent.getId()).orElseThrow().isDeleted()).isFalse();
    }

    @Test
    void afterCompletion_usesOpenChildAsActiveInstance() {
        Task parent = legacyItem("水やり", DEC_1, "{\"type\":\"afterCompletion\",\"daysAfterCompletion\":3}");
        legacyChild(parent, DEC_1, TaskStatus.COMPLETE);
        Task open = legacyChild(parent, LocalDate.of(2025, 12, 4), TaskStatus.IN_PROGRESS);

        MigrationItemResult result = legacyMigrator.migrateLegacyItem(OWNER, parent.getId(), false);

        RecurringPattern pattern = patternRepository.findById(result.patternId()).orElseThrow();
        assertThat(result.instancesCreated()).isZero();
        assertThat(pattern.getActiveInstanceId()).isEqualTo(open.getId());
        assertThat(pattern.getDaysAfterCompletion()).isEqualTo(3);
    }

    @Test
    void nonLegacyTask_isRejected() {
        Task plain = taskRepository.save(new Task(OWNER, "普通のタスク"));

        assertThatThrownBy(() -> legacyMigrator.migrateLegacyItem(OWNER, plain.getId(), false))
                .isInstanceOf(PatternValidationException.class);
    }

    @Test
    void migrateAll_collectsErrorsAndContinues() {
        Task custom = legacyItem("独自ルール", DEC_1, "{\"type\":\"custom\"}");
        weeklyMondayWithChildren();

        MigrationResult result = legacyMigrator.migrateAllLegacyItems(OWNER, false);

        assertThat(result.itemsProcessed()).isEqualTo(2);
        assertThat(result.patternsCreated()).isEqualTo(1);
        assertThat(result.instancesRepointed()).isEqualTo(3);
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0)).contains(String.valueOf(custom.getId()));
        assertThat(taskRepository.findById(custom.getId()).orElseThrow().isDeleted()).isFalse();

        MigrationResult again = legacyMigrator.migrateAllLegacyItems(OWNER, false);
        assertThat(again.itemsProcessed()).isEqualTo(1);
        assertThat(again.patternsCreated()).isZero();
        assertThat(again.errors()).hasSize(1);
    }

    @Test
    void legacyJson_dateEndConditionAndExceptions_areCarriedOver() {
        Task parent = legacyItem("朝会", JAN_1, "{\"type\":\"daily\",\"interval\":1,"
                + "\"endCondition\":{\"type\":\"date\",\"endDate\":\"2026-01-10T00:00:00.000Z\"},"
                + "\"exceptions\":[\"2026-01-03\"],\"unknownField\":true}");

        MigrationItemResult result = legacyMigrator.migrateLegacyItem(OWNER, parent.getId(), false);

        RecurringPattern pattern = patternRepository.findById(result.patternId()).orElseThrow();
        assertThat(pattern.getGeneratedUntil()).isEqualTo(LocalDate.of(2026, 1, 10));
        assertThat(pattern.exceptionDates()).containsExactly(LocalDate.of(2026, 1, 3));
        assertThat(result.instancesCreated()).isEqualTo(9);
    }
}
