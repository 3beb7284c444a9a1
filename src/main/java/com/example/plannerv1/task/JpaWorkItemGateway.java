package com.example.plannerv1.task;

import com.example.plannerv1.batch.ChunkedBatchWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Service
public class JpaWorkItemGateway implements WorkItemGateway {

    private static final Logger logger = LoggerFactory.getLogger(JpaWorkItemGateway.class);

    private final TaskRepository taskRepository;
    private final ChunkedBatchWriter batchWriter;
    private final Clock clock;

    public JpaWorkItemGateway(TaskRepository taskRepository, ChunkedBatchWriter batchWriter, Clock clock) {
        this.taskRepository = taskRepository;
        this.batchWriter = batchWriter;
        this.clock = clock;
    }

    @Override
    public Task createInstance(String ownerId, TemplateFields template, LocalDate scheduledDate, Long patternId) {
        return taskRepository.save(Task.instanceOf(ownerId, template, scheduledDate, patternId));
    }

    @Override
    public int softDeleteInstances(String ownerId, Long patternId, InstanceFilter filter) {
        List<Long> ids = instancesWhere(ownerId, patternId, filter).stream().map(Task::getId).toList();
        if (ids.isEmpty()) {
            return 0;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        int deleted = batchWriter.write("softDeleteInstances", ids,
                chunk -> taskRepository.softDeleteByIdIn(chunk, now));
        logger.info("インスタンスを論理削除しました: patternId={}, count={}", patternId, deleted);
        return deleted;
    }

    @Override
    public List<Task> instancesWhere(String ownerId, Long patternId, InstanceFilter filter) {
        List<Task> candidates;
        if (filter.scheduledAfter() != null) {
            candidates = taskRepository
                    .findByOwnerIdAndRecurringPatternIdAndDeletedAtIsNullAndScheduledDateGreaterThanOrderByScheduledDateAsc(
                            ownerId, patternId, filter.scheduledAfter());
        } else if (filter.scheduledFrom() != null) {
            candidates = taskRepository
                    .findByOwnerIdAndRecurringPatternIdAndDeletedAtIsNullAndScheduledDateGreaterThanEqualOrderByScheduledDateAsc(
                            ownerId, patternId, filter.scheduledFrom());
        } else {
            candidates = taskRepository
                    .findByOwnerIdAndRecurringPatternIdAndDeletedAtIsNullOrderByScheduledDateAsc(ownerId, patternId);
        }
        return candidates.stream().filter(filter.predicate()).toList();
    }

    @Override
    public Optional<Task> findInstance(String ownerId, Long taskId) {
        return taskRepository.findByIdAndOwnerId(taskId, ownerId).filter(t -> !t.isDeleted());
    }
}
