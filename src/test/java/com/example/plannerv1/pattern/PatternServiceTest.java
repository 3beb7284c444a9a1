package com.example.plannerv1.pattern;

import com.example.plannerv1.exception.PatternAccessDeniedException;
import com.example.plannerv1.exception.PatternNotFoundException;
import com.example.plannerv1.exception.PatternValidationException;
import com.example.plannerv1.recurrence.EndCondition;
import com.example.plannerv1.support.MutableClock;
import com.example.plannerv1.support.TestClockConfig;
import com.example.plannerv1.task.Task;
import com.example.plannerv1.task.TaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

import static com.example.plannerv1.support.PatternFixtures.OTHER_OWNER;
import static com.example.plannerv1.support.PatternFixtures.OWNER;
import static com.example.plannerv1.support.PatternFixtures.afterCompletion;
import static com.example.plannerv1.support.PatternFixtures.daily;
import static com.example.plannerv1.support.PatternFixtures.weekly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Import(TestClockConfig.class)
class PatternServiceTest {

    private static final LocalDate JAN_1 = LocalDate.of(2026, 1, 1);

    @Autowired
    private PatternService patternService;

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

    private List<Task> instances(Long patternId) {
        return taskRepository.findByOwnerIdAndRecurringPatternIdAndDeletedAtIsNullOrderByScheduledDateAsc(OWNER, patternId);
    }

    @Test
    void createPattern_daily_materializesLookaheadWindowFromStartDate() {
        RecurringPattern pattern = patternService.createPattern(OWNER, daily("ビタミンを飲む", JAN_1, EndCondition.never()));

        List<Task> created = instances(pattern.getId());
        assertThat(pattern.getGeneratedUntil()).isEqualTo(LocalDate.of(2026, 4, 1));
        assertThat(created).hasSize(91);
        assertThat(created.get(0).getScheduledDate()).isEqualTo(JAN_1);
        assertThat(created.get(90).getScheduledDate()).isEqualTo(LocalDate.of(2026, 4, 1));
        assertThat(created).allMatch(t -> t.getTitle().equals("ビタミンを飲む"));
    }

    @Test
    void createPattern_withEndDate_capsWatermark() {
        RecurringPattern pattern = patternService.createPattern(OWNER,
                daily("短期", JAN_1, EndCondition.onDate(LocalDate.of(2026, 1, 10))));

        assertThat(pattern.getGeneratedUntil()).isEqualTo(LocalDate.of(2026, 1, 10));
        assertThat(instances(pattern.getId())).hasSize(10);
    }

    @Test
    void createPattern_weekly_createsOnlySelectedWeekdays() {
        RecurringPattern pattern = patternService.createPattern(OWNER,
                weekly("ジム", LocalDate.of(2026, 1, 5), 1, List.of(DayOfWeek.MONDAY, DayOfWeek.THURSDAY)));

        assertThat(instances(pattern.getId()))
                .isNotEmpty()
                .allMatch(t -> t.getScheduledDate().getDayOfWeek() == DayOfWeek.MONDAY
                        || t.getScheduledDate().getDayOfWeek() == DayOfWeek.THURSDAY);
    }

    @Test
    void createPattern_afterCompletion_createsSingleActiveInstance() {
        RecurringPattern pattern = patternService.createPattern(OWNER, afterCompletion("散髪", JAN_1, 42, null));

        List<Task> created = instances(pattern.getId());
        assertThat(created).hasSize(1);
        assertThat(pattern.getActiveInstanceId()).isEqualTo(created.get(0).getId());
        assertThat(created.get(0).getScheduledDate()).isEqualTo(JAN_1);
    }

    @Test
    void createPattern_invalidInput_writesNothing() {
        assertThatThrownBy(() -> patternService.createPattern(" ", daily("x", JAN_1, null)))
                .isInstanceOf(PatternValidationException.class)
                .extracting("field").isEqualTo("ownerId");
        assertThatThrownBy(() -> patternService.createPattern(OWNER, afterCompletion("x", JAN_1, null, null)))
                .isInstanceOf(PatternValidationException.class)
                .extracting("field").isEqualTo("daysAfterCompletion");
        assertThatThrownBy(() -> patternService.createPattern(OWNER, weekly("x", JAN_1, 1, List.of())))
                .isInstanceOf(PatternValidationException.class);
        assertThatThrownBy(() -> patternService.createPattern(OWNER,
                daily("x", JAN_1, EndCondition.onDate(LocalDate.of(2025, 12, 31)))))
                .isInstanceOf(PatternValidationException.class);

        assertThat(patternRepository.count()).isZero();
        assertThat(taskRepository.count()).isZero();
    }

    @Test
    void getPattern_ownedByAnotherUser_isRejected() {
        RecurringPattern pattern = patternService.createPattern(OWNER, daily("x", JAN_1, null));

        assertThatThrownBy(() -> patternService.getPattern(OTHER_OWNER, pattern.getId()))
                .isInstanceOf(PatternAccessDeniedException.class);
        assertThatThrownBy(() -> patternService.getPattern(OWNER, 999_999L))
                .isInstanceOf(PatternNotFoundException.class);
    }

    @Test
    void deletePattern_withCascade_softDeletesInstances() {
        RecurringPattern keep = patternService.createPattern(OWNER, daily("残す", JAN_1, EndCondition.onDate(LocalDate.of(2026, 1, 5))));
        RecurringPattern drop = patternService.createPattern(OWNER, daily("消す", JAN_1, EndCondition.onDate(LocalDate.of(2026, 1, 5))));

        int deleted = patternService.deletePattern(OWNER, drop.getId(), true);

        assertThat(deleted).isEqualTo(5);
        assertThat(instances(drop.getId())).isEmpty();
        assertThat(instances(keep.getId())).hasSize(5);
        assertThat(patternService.listPatterns(OWNER)).extracting(RecurringPattern::getId).containsExactly(keep.getId());
        assertThatThrownBy(() -> patternService.getPattern(OWNER, drop.getId()))
                .isInstanceOf(PatternNotFoundException.class);
        // 論理削除のみ
        assertThat(patternRepository.findById(drop.getId())).isPresent();
        assertThat(taskRepository.count()).isEqualTo(10);
    }

    @Test
    void deletePattern_withoutCascade_keepsInstances() {
        RecurringPattern pattern = patternService.createPattern(OWNER, daily("x", JAN_1, EndCondition.onDate(LocalDate.of(2026, 1, 3))));

        assertThat(patternService.deletePattern(OWNER, pattern.getId(), false)).isZero();
        assertThat(instances(pattern.getId())).hasSize(3);
    }

    @Test
    void previewOccurrences_doesNotPersist() {
        RecurringPattern pattern = patternService.createPattern(OWNER, daily("x", JAN_1, EndCondition.onDate(LocalDate.of(2026, 1, 3))));
        long before = taskRepository.count();

        List<LocalDate> preview = patternService.previewOccurrences(OWNER, pattern.getId(), JAN_1, LocalDate.of(2026, 12, 31));

        assertThat(preview).containsExactly(JAN_1, LocalDate.of(2026, 1, 2), LocalDate.of(2026, 1, 3));
        assertThat(taskRepository.count()).isEqualTo(before);
    }

    @Test
    void listInstances_returnsLiveInstancesInDateOrder() {
        RecurringPattern pattern = patternService.createPattern(OWNER, daily("x", JAN_1, EndCondition.onDate(LocalDate.of(2026, 1, 4))));

        assertThat(patternService.listInstances(OWNER, pattern.getId()))
                .extracting(Task::getScheduledDate)
                .containsExactly(JAN_1, LocalDate.of(2026, 1, 2), LocalDate.of(2026, 1, 3), LocalDate.of(2026, 1, 4));
    }
}
