package com.example.plannerv1.migration;

import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 非同期移行ジョブの進捗（オーナー単位）。全オーナー対象の実行は "*" をキーにする。
 */
@Component
public class MigrationJobStatusService {
    public static class Status {
        public volatile boolean running;
        public volatile boolean done;
        public volatile long processedCount;
        public volatile long errorCount;
        public volatile LocalDateTime startedAt;
        public volatile LocalDateTime finishedAt;
    }

    static final String ALL_OWNERS = "*";

    private final Map<String, Status> jobs = new ConcurrentHashMap<>();

    private String key(String ownerId) {
        return ownerId == null || ownerId.isBlank() ? ALL_OWNERS : ownerId;
    }

    /**
     * 実行中でなければ実行中にして true を返す。判定と更新は同じキーに対して不可分に行う。
     */
    public boolean tryStart(String ownerId) {
        boolean[] started = {false};
        jobs.compute(key(ownerId), (k, current) -> {
            if (current != null && current.running) {
                return current;
            }
            Status s = new Status();
            s.running = true;
            s.startedAt = LocalDateTime.now();
            started[0] = true;
            return s;
        });
        return started[0];
    }

    public void updateCount(String ownerId, long processed, long errors) {
        Status s = jobs.computeIfAbsent(key(ownerId), k -> new Status());
        s.processedCount = Math.max(0, processed);
        s.errorCount = Math.max(0, errors);
    }

    public void finish(String ownerId, long processed, long errors) {
        Status s = jobs.computeIfAbsent(key(ownerId), k -> new Status());
        s.processedCount = Math.max(0, processed);
        s.errorCount = Math.max(0, errors);
        s.running = false;
        s.done = true;
        s.finishedAt = LocalDateTime.now();
    }

    public boolean isRunning(String ownerId) {
        Status s = jobs.get(key(ownerId));
        return s != null && s.running;
    }

    public Status get(String ownerId) {
        return jobs.getOrDefault(key(ownerId), new Status());
    }
}
