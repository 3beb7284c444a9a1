package com.example.plannerv1.pattern;

import com.example.plannerv1.common.error.ErrorLogBuffer;
import com.example.plannerv1.recurrence.EndCondition;
import com.example.plannerv1.recurrence.RecurrenceRule;
import com.example.plannerv1.support.MutableClock;
import com.example.plannerv1.support.TestClockConfig;
import com.example.plannerv1.task.Task;
import com.example.plannerv1.task.TaskRepository;
import com.example.plannerv1.task.WorkItemGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.context.annotation.Import;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static com.example.plannerv1.support.PatternFixtures.OWNER;
import static com.example.plannerv1.support.PatternFixtures.template;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.verify;

@SpringBootTest
@Import(TestClockConfig.class)
class InstanceMaterializerTest {

    private static final LocalDate JAN_1 = LocalDate.of(2026, 1, 1);
    private static final LocalDate JAN_3 = LocalDate.of(2026, 1, 3);

    @Autowired
    private InstanceMaterializer materializer;

    @Autowired
    private GenerationWindowManager windowManager;

    @SpyBean
    private WorkItemGateway workItemGateway;

    @Autowired
    private RecurringPatternRepository patternRepository;

    @Autowired
    private TaskRepository taskRepository;

    @Autowired
    private ErrorLogBuffer errorLogBuffer;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        reset(workItemGateway);
        taskRepository.deleteAll();
        patternRepository.deleteAll();
        errorLogBuffer.clear();
        clock.setToday(JAN_1);
    }

    private RecurringPattern savedDaily(EndCondition end) {
        RecurringPattern pattern = new RecurringPattern(OWNER, template("日課"), new RecurrenceRule.Daily(1), JAN_1, end);
        return patternRepository.save(pattern);
    }

    @Test
    void materialize_singleFailure_skipsDateAndContinues() {
        RecurringPattern pattern = savedDaily(EndCondition.never());
        doThrow(new IllegalStateException("store unavailable"))
                .when(workItemGateway).createInstance(anyString(), any(), eq(JAN_3), anyLong());

        List<Task> created = materializer.materialize(pattern, JAN_1, LocalDate.of(2026, 1, 5));

        assertThat(created).extracting(Task::getScheduledDate)
                .containsExactly(JAN_1, LocalDate.of(2026, 1, 2), LocalDate.of(2026, 1, 4), LocalDate.of(2026, 1, 5));
        assertThat(errorLogBuffer.recent()).hasSize(1);
        assertThat(errorLogBuffer.recent().get(0).message()).contains("date=2026-01-03");
    }

    @Test
    void ensure_partialFailure_stillAdvancesWatermark() {
        RecurringPattern pattern = savedDaily(EndCondition.never());
        LocalDate failing = LocalDate.of(2026, 1, 10);
        doThrow(new IllegalStateException("store unavailable"))
                .when(workItemGateway).createInstance(anyString(), any(), eq(failing), anyLong());

        EnsureResult result = windowManager.ensureInstancesForDate(OWNER, pattern.getId(), LocalDate.of(2026, 1, 2));

        assertThat(result.generatedUntil()).isEqualTo(LocalDate.of(2026, 4, 2));
        assertThat(patternRepository.findById(pattern.getId()).orElseThrow().getGeneratedUntil())
                .isEqualTo(LocalDate.of(2026, 4, 2));
        assertThat(taskRepository.findByOwnerIdAndRecurringPatternIdAndDeletedAtIsNullOrderByScheduledDateAsc(OWNER, pattern.getId()))
                .extracting(Task::getScheduledDate)
                .doesNotContain(failing)
                .hasSize(90);
    }

    @Test
    void materialize_skipDates_areNotCreated() {
        RecurringPattern pattern = savedDaily(EndCondition.never());

        List<Task> created = materializer.materialize(pattern, JAN_1, JAN_3, Set.of(JAN_1));

        assertThat(created).extracting(Task::getScheduledDate).containsExactly(LocalDate.of(2026, 1, 2), JAN_3);
        verify(workItemGateway, never()).createInstance(anyString(), any(), eq(JAN_1), anyLong());
    }

    @Test
    void materialize_afterCompletion_createsExactlyOneRegardlessOfRange() {
        RecurringPattern pattern = patternRepository.save(new RecurringPattern(OWNER, template("散髪"),
                new RecurrenceRule.AfterCompletion(42), JAN_1, EndCondition.never()));

        List<Task> created = materializer.materialize(pattern, LocalDate.of(2026, 2, 1), LocalDate.of(2026, 12, 31));

        assertThat(created).hasSize(1);
        assertThat(created.get(0).getScheduledDate()).isEqualTo(LocalDate.of(2026, 2, 1));
    }
}
