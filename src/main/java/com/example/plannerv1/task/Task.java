package com.example.plannerv1.task;

import jakarta.persistence.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 作業項目（タスク）。このエンジンが読み書きする項目のみを持つ。
 * recurringPatternId が設定されていればパターンから生成されたインスタンス。
 * recurrenceJson 以下は旧形式（タスク自身に繰り返し設定を埋め込む方式）の項目で、移行でのみ参照する。
 */
@Entity
@Table(name = "tasks", indexes = {
        @Index(name = "idx_tasks_owner_pattern_date", columnList = "owner_id, recurring_pattern_id, scheduled_date"),
        @Index(name = "idx_tasks_recurring_parent", columnList = "recurring_parent_id")
})
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false, length = 128)
    private String ownerId;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Column(name = "description", length = 5000)
    private String description;

    @Column(name = "category_id", length = 64)
    private String categoryId;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority_letter", nullable = false, length = 1)
    private PriorityLetter priorityLetter = PriorityLetter.B;

    @Column(name = "priority_number", nullable = false)
    private Integer priorityNumber = 1;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TaskStatus status = TaskStatus.IN_PROGRESS;

    @Column(name = "scheduled_date")
    private LocalDate scheduledDate;

    @Column(name = "start_time")
    private LocalTime startTime;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    @Column(name = "recurring_pattern_id")
    private Long recurringPatternId;

    /** パターンから生成されたときの発生日。scheduledDate と異なれば利用者が日付を動かしている */
    @Column(name = "instance_date")
    private LocalDate instanceDate;

    // legacy
    @Lob
    @Column(name = "recurrence_json")
    private String recurrenceJson;

    @Column(name = "scheduled_time", length = 5)
    private String scheduledTime;

    @Column(name = "recurring_parent_id")
    private Long recurringParentId;

    @Column(name = "recurring_instance", nullable = false)
    private boolean recurringInstance;

    @Column(name = "migrated_to_pattern_id")
    private Long migratedToPatternId;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    protected Task() {}

    public Task(String ownerId, String title) {
        this.ownerId = ownerId;
        this.title = title;
    }

    /**
     * パターンのテンプレートから新しいインスタンスを作る
     */
    public static Task instanceOf(String ownerId, TemplateFields template, LocalDate scheduledDate, Long patternId) {
        Task task = new Task(ownerId, template.title());
        task.applyTemplate(template);
        task.scheduledDate = scheduledDate;
        task.instanceDate = scheduledDate;
        task.recurringPatternId = patternId;
        task.status = TaskStatus.IN_PROGRESS;
        return task;
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

    public TemplateFields templateFields() {
        return new TemplateFields(title, description, categoryId, priorityLetter, priorityNumber, startTime, durationMinutes);
    }

    /** 未着手で、生成時の日付のままテンプレートからも変更されていない */
    public boolean isPristine(TemplateFields template) {
        return status == TaskStatus.IN_PROGRESS
                && instanceDate != null
                && instanceDate.equals(scheduledDate)
                && template.sameAs(templateFields());
    }

    public boolean isDeleted() { return deletedAt != null; }

    @PrePersist
    protected void onCreate() { this.createdAt = LocalDateTime.now(); this.updatedAt = LocalDateTime.now(); }
    @PreUpdate
    protected void onUpdate() { this.updatedAt = LocalDateTime.now(); }

    public Long getId() { return id; }
    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getCategoryId() { return categoryId; }
    public void setCategoryId(String categoryId) { this.categoryId = categoryId; }
    public PriorityLetter getPriorityLetter() { return priorityLetter; }
    public void setPriorityLetter(PriorityLetter priorityLetter) { this.priorityLetter = priorityLetter; }
    public Integer getPriorityNumber() { return priorityNumber; }
    public void setPriorityNumber(Integer priorityNumber) { this.priorityNumber = priorityNumber; }
    public TaskStatus getStatus() { return status; }
    public void setStatus(TaskStatus status) { this.status = status; }
    public LocalDate getScheduledDate() { return scheduledDate; }
    public void setScheduledDate(LocalDate scheduledDate) { this.scheduledDate = scheduledDate; }
    public LocalTime getStartTime() { return startTime; }
    public void setStartTime(LocalTime startTime) { this.startTime = startTime; }
    public Integer getDurationMinutes() { return durationMinutes; }
    public void setDurationMinutes(Integer durationMinutes) { this.durationMinutes = durationMinutes; }
    public Long getRecurringPatternId() { return recurringPatternId; }
    public void setRecurringPatternId(Long recurringPatternId) { this.recurringPatternId = recurringPatternId; }
    public LocalDate getInstanceDate() { return instanceDate; }
    public String getRecurrenceJson() { return recurrenceJson; }
    public void setRecurrenceJson(String recurrenceJson) { this.recurrenceJson = recurrenceJson; }
    public String getScheduledTime() { return scheduledTime; }
    public void setScheduledTime(String scheduledTime) { this.scheduledTime = scheduledTime; }
    public Long getRecurringParentId() { return recurringParentId; }
    public void setRecurringParentId(Long recurringParentId) { this.recurringParentId = recurringParentId; }
    public boolean isRecurringInstance() { return recurringInstance; }
    public void setRecurringInstance(boolean recurringInstance) { this.recurringInstance = recurringInstance; }
    public Long getMigratedToPatternId() { return migratedToPatternId; }
    public void setMigratedToPatternId(Long migratedToPatternId) { this.migratedToPatternId = migratedToPatternId; }
    public LocalDateTime getCompletedAt() { return completedAt; }
    public void setCompletedAt(LocalDateTime completedAt) { this.completedAt = completedAt; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public LocalDateTime getDeletedAt() { return deletedAt; }
    public void setDeletedAt(LocalDateTime deletedAt) { this.deletedAt = deletedAt; }
}
