package com.example.plannerv1.pattern;

import com.example.plannerv1.recurrence.EndCondition;
import com.example.plannerv1.recurrence.RecurrenceRule;
import com.example.plannerv1.recurrence.RecurrenceSpec;
import com.example.plannerv1.recurrence.RecurrenceType;
import com.example.plannerv1.task.PriorityLetter;
import com.example.plannerv1.task.TemplateFields;
import jakarta.persistence.*;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 繰り返しパターン。生成されるタスクのテンプレートと繰り返しルール、生成済み範囲（generatedUntil）を持つ。
 * ルールはフラットな列で保存し、種類ごとの解釈は {@link RecurrenceRules} に閉じ込める。
 */
@Entity
@Table(name = "recurring_patterns", indexes = {
        @Index(name = "idx_patterns_owner", columnList = "owner_id, deleted_at")
})
public class RecurringPattern {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false, length = 128)
    private String ownerId;

    // テンプレート
    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Column(name = "description", length = 5000)
    private String description = "";

    @Column(name = "category_id", length = 64)
    private String categoryId;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority_letter", nullable = false, length = 1)
    private PriorityLetter priorityLetter = PriorityLetter.B;

    @Column(name = "priority_number", nullable = false)
    private Integer priorityNumber = 1;

    @Column(name = "start_time")
    private LocalTime startTime;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    // ルール
    @Enumerated(EnumType.STRING)
    @Column(name = "recurrence_type", nullable = false, length = 32)
    private RecurrenceType recurrenceType;

    @Column(name = "recur_interval", nullable = false)
    private Integer interval = 1;

    @Column(name = "days_of_week_csv", length = 80)
    private String daysOfWeekCsv; // e.g. MONDAY,WEDNESDAY

    @Column(name = "day_of_month")
    private Integer dayOfMonth;

    @Column(name = "month_of_year")
    private Integer monthOfYear;

    @Column(name = "nth_ordinal")
    private Integer nthOrdinal; // 1..5, -1=last

    @Enumerated(EnumType.STRING)
    @Column(name = "nth_weekday", length = 10)
    private DayOfWeek nthWeekday;

    @Column(name = "specific_dates_csv", length = 100)
    private String specificDatesCsv; // e.g. 1,15

    @Column(name = "days_after_completion")
    private Integer daysAfterCompletion;

    // 終了条件
    @Enumerated(EnumType.STRING)
    @Column(name = "end_type", nullable = false, length = 20)
    private EndCondition.Type endType = EndCondition.Type.NEVER;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(name = "max_occurrences")
    private Integer maxOccurrences;

    @Lob
    @Column(name = "exception_dates_csv")
    private String exceptionDatesCsv; // ISO dates

    // 生成状態
    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "generated_until", nullable = false)
    private LocalDate generatedUntil;

    @Column(name = "active_instance_id")
    private Long activeInstanceId; // after-completion only

    @Column(name = "migrated_from_task_id")
    private Long migratedFromTaskId;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    protected RecurringPattern() {}

    public RecurringPattern(String ownerId, TemplateFields template, RecurrenceRule rule,
                            LocalDate startDate, EndCondition endCondition) {
        this.ownerId = ownerId;
        applyTemplate(template);
        setRule(rule);
        this.startDate = startDate;
        setEndCondition(endCondition);
        this.generatedUntil = startDate;
    }

    @PrePersist
    protected void onCreate() { this.createdAt = LocalDateTime.now(); this.updatedAt = LocalDateTime.now(); }
    @PreUpdate
    protected void onUpdate() { this.updatedAt = LocalDateTime.now(); }

    public TemplateFields templateFields() {
        return new TemplateFields(title, description, categoryId, priorityLetter, priorityNumber, startTime, durationMinutes);
    }

    public void applyTemplate(TemplateFields template) {
        this.title = template.title();
        this.description = template.description();
        this.categoryId = template.categoryId();
        this.priorityLetter = template.priorityLetter();
        this.priorityNumber = template.priorityNumber();
        this.startTime = template.startTime();
        this.durationMinutes = template.durationMinutes();
    }

    public RecurrenceRule rule() {
        return RecurrenceRules.fromPattern(this);
    }

    public void setRule(RecurrenceRule rule) {
        RecurrenceRules.applyTo(rule, this);
    }

    public EndCondition endCondition() {
        return new EndCondition(endType, endDate, maxOccurrences);
    }

    public void setEndCondition(EndCondition endCondition) {
        EndCondition ec = endCondition == null ? EndCondition.never() : endCondition;
        this.endType = ec.type();
        this.endDate = ec.endDate();
        this.maxOccurrences = ec.maxOccurrences();
    }

    public Set<LocalDate> exceptionDates() {
        if (exceptionDatesCsv == null || exceptionDatesCsv.isBlank()) {
            return new TreeSet<>();
        }
        return Arrays.stream(exceptionDatesCsv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(LocalDate::parse)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public void setExceptionDates(Set<LocalDate> dates) {
        if (dates == null || dates.isEmpty()) {
            this.exceptionDatesCsv = null;
            return;
        }
        this.exceptionDatesCsv = new TreeSet<>(dates).stream().map(LocalDate::toString).collect(Collectors.joining(","));
    }

    public RecurrenceSpec toSpec() {
        return new RecurrenceSpec(rule(), startDate, endCondition(), exceptionDates());
    }

    public boolean isAfterCompletion() { return recurrenceType == RecurrenceType.AFTER_COMPLETION; }

    public boolean isDeleted() { return deletedAt != null; }

    /**
     * generatedUntil を更新する。開始日より前にはしない。
     */
    public void moveWatermark(LocalDate date) {
        this.generatedUntil = date.isBefore(startDate) ? startDate : date;
    }

    public Long getId() { return id; }
    public String getOwnerId() { return ownerId; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public String getCategoryId() { return categoryId; }
    public PriorityLetter getPriorityLetter() { return priorityLetter; }
    public Integer getPriorityNumber() { return priorityNumber; }
    public LocalTime getStartTime() { return startTime; }
    public Integer getDurationMinutes() { return durationMinutes; }
    public RecurrenceType getRecurrenceType() { return recurrenceType; }
    void setRecurrenceType(RecurrenceType recurrenceType) { this.recurrenceType = recurrenceType; }
    public Integer getInterval() { return interval; }
    void setInterval(Integer interval) { this.interval = interval; }
    public String getDaysOfWeekCsv() { return daysOfWeekCsv; }
    void setDaysOfWeekCsv(String daysOfWeekCsv) { this.daysOfWeekCsv = daysOfWeekCsv; }
    public Integer getDayOfMonth() { return dayOfMonth; }
    void setDayOfMonth(Integer dayOfMonth) { this.dayOfMonth = dayOfMonth; }
    public Integer getMonthOfYear() { return monthOfYear; }
    void setMonthOfYear(Integer monthOfYear) { this.monthOfYear = monthOfYear; }
    public Integer getNthOrdinal() { return nthOrdinal; }
    void setNthOrdinal(Integer nthOrdinal) { this.nthOrdinal = nthOrdinal; }
    public DayOfWeek getNthWeekday() { return nthWeekday; }
    void setNthWeekday(DayOfWeek nthWeekday) { this.nthWeekday = nthWeekday; }
    public String getSpecificDatesCsv() { return specificDatesCsv; }
    void setSpecificDatesCsv(String specificDatesCsv) { this.specificDatesCsv = specificDatesCsv; }
    public Integer getDaysAfterCompletion() { return daysAfterCompletion; }
    void setDaysAfterCompletion(Integer daysAfterCompletion) { this.daysAfterCompletion = daysAfterCompletion; }
    public LocalDate getStartDate() { return startDate; }
    public void setStartDate(LocalDate startDate) { this.startDate = startDate; }
    public LocalDate getGeneratedUntil() { return generatedUntil; }
    public Long getActiveInstanceId() { return activeInstanceId; }
    public void setActiveInstanceId(Long activeInstanceId) { this.activeInstanceId = activeInstanceId; }
    public Long getMigratedFromTaskId() { return migratedFromTaskId; }
    public void setMigratedFromTaskId(Long migratedFromTaskId) { this.migratedFromTaskId = migratedFromTaskId; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public LocalDateTime getDeletedAt() { return deletedAt; }
    public void setDeletedAt(LocalDateTime deletedAt) { this.deletedAt = deletedAt; }
}
