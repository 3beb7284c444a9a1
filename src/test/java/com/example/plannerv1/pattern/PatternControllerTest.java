package com.example.plannerv1.pattern;

import com.example.plannerv1.recurrence.EndCondition;
import com.example.plannerv1.recurrence.RecurrenceRule;
import com.example.plannerv1.support.MutableClock;
import com.example.plannerv1.support.TestClockConfig;
import com.example.plannerv1.task.Task;
import com.example.plannerv1.task.TaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;

import static com.example.plannerv1.support.PatternFixtures.OTHER_OWNER;
import static com.example.plannerv1.support.PatternFixtures.OWNER;
import static com.example.plannerv1.support.PatternFixtures.daily;
import static com.example.plannerv1.support.PatternFixtures.template;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestClockConfig.class)
class PatternControllerTest {

    private static final LocalDate JAN_1 = LocalDate.of(2026, 1, 1);

    @Autowired
    private MockMvc mockMvc;

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

    @Test
    void createPattern_returnsCreatedWithWatermark() throws Exception {
        String payload = """
            {
              "title": "ストレッチ",
              "priorityLetter": "A",
              "priorityNumber": 2,
              "startTime": "07:00",
              "durationMinutes": 15,
              "recurrenceType": "WEEKLY",
              "interval": 1,
              "daysOfWeek": ["MONDAY", "THURSDAY"],
              "endCondition": {"type": "ON_DATE", "endDate": "2026-01-31"},
              "startDate": "2026-01-01",
              "exceptionDates": ["2026-01-15"]
            }
            """;

        mockMvc.perform(post("/api/patterns")
                .header("X-Owner-Id", OWNER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.title").value("ストレッチ"))
            .andExpect(jsonPath("$.data.recurrenceType").value("WEEKLY"))
            .andExpect(jsonPath("$.data.generatedUntil").value("2026-01-31"))
            .andExpect(jsonPath("$.data.endCondition.type").value("ON_DATE"));

        RecurringPattern saved = patternRepository.findByOwnerIdAndDeletedAtIsNullOrderByIdAsc(OWNER).get(0);
        // 1月の月・木は9日、1/15 は除外
        assertThat(taskRepository.findByOwnerIdAndRecurringPatternIdAndDeletedAtIsNullOrderByScheduledDateAsc(OWNER, saved.getId()))
                .hasSize(8);
    }

    @Test
    void createPattern_withoutTitle_isValidationError() throws Exception {
        String payload = """
            {"recurrenceType": "DAILY", "startDate": "2026-01-01"}
            """;

        mockMvc.perform(post("/api/patterns")
                .header("X-Owner-Id", OWNER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.details.title").exists());
        assertThat(patternRepository.count()).isZero();
    }

    @Test
    void createAfterCompletion_withoutDays_isRejected() throws Exception {
        String payload = """
            {"title": "散髪", "recurrenceType": "AFTER_COMPLETION", "startDate": "2026-01-01"}
            """;

        mockMvc.perform(post("/api/patterns")
                .header("X-Owner-Id", OWNER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.daysAfterCompletion").exists());
        assertThat(patternRepository.count()).isZero();
        assertThat(taskRepository.count()).isZero();
    }

    @Test
    void missingOwnerHeader_isBadRequest() throws Exception {
        mockMvc.perform(get("/api/patterns"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details['X-Owner-Id']").value("required"));
    }

    @Test
    void otherOwnersPattern_isForbidden() throws Exception {
        RecurringPattern pattern = patternService.createPattern(OWNER, daily("日課", JAN_1, EndCondition.onDate(JAN_1)));

        mockMvc.perform(get("/api/patterns/" + pattern.getId()).header("X-Owner-Id", OTHER_OWNER))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
        mockMvc.perform(delete("/api/patterns/" + pattern.getId()).header("X-Owner-Id", OTHER_OWNER))
            .andExpect(status().isForbidden());
        assertThat(patternRepository.findById(pattern.getId()).orElseThrow().isDeleted()).isFalse();
    }

    @Test
    void unknownPattern_isNotFound() throws Exception {
        mockMvc.perform(post("/api/patterns/999999/ensure")
                .header("X-Owner-Id", OWNER)
                .param("date", "2026-05-01"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void ensure_extendsWatermark() throws Exception {
        RecurringPattern pattern = patternService.createPattern(OWNER, daily("日課", JAN_1, EndCondition.never()));

        mockMvc.perform(post("/api/patterns/" + pattern.getId() + "/ensure")
                .header("X-Owner-Id", OWNER)
                .param("date", "2026-05-01"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.previousGeneratedUntil").value("2026-04-01"))
            .andExpect(jsonPath("$.data.generatedUntil").value("2026-07-30"))
            .andExpect(jsonPath("$.data.createdCount").value(120));
    }

    @Test
    void updateAndDelete_roundThroughApi() throws Exception {
        RecurringPattern pattern = patternService.createPattern(OWNER, daily("日課", JAN_1, EndCondition.never()));

        mockMvc.perform(put("/api/patterns/" + pattern.getId())
                .header("X-Owner-Id", OWNER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"endCondition": {"type": "ON_DATE", "endDate": "2026-01-10"}}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.generatedUntil").value("2026-01-10"));

        mockMvc.perform(delete("/api/patterns/" + pattern.getId())
                .header("X-Owner-Id", OWNER)
                .param("cascadeInstances", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.deletedInstances").value(10));
    }

    @Test
    void preview_returnsDatesWithoutWriting() throws Exception {
        RecurringPattern pattern = patternService.createPattern(OWNER, daily("日課", JAN_1, EndCondition.onDate(JAN_1)));
        long before = taskRepository.count();

        mockMvc.perform(get("/api/patterns/" + pattern.getId() + "/preview")
                .header("X-Owner-Id", OWNER)
                .param("from", "2025-12-30")
                .param("to", "2026-01-05"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(1))
            .andExpect(jsonPath("$.data[0]").value("2026-01-01"));
        assertThat(taskRepository.count()).isEqualTo(before);
    }

    @Test
    void completionHook_withoutConfiguredDays_isUnprocessable() throws Exception {
        RecurringPattern pattern = patternRepository.save(new RecurringPattern(OWNER, template("設定漏れ"),
                new RecurrenceRule.AfterCompletion(null), JAN_1, EndCondition.never()));
        Task instance = taskRepository.save(Task.instanceOf(OWNER, template("設定漏れ"), JAN_1, pattern.getId()));

        mockMvc.perform(post("/api/patterns/" + pattern.getId() + "/instances/" + instance.getId() + "/completed")
                .header("X-Owner-Id", OWNER))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("CONFIGURATION_ERROR"));
    }
}
