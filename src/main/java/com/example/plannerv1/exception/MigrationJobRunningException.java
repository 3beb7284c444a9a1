package com.example.plannerv1.exception;

public class MigrationJobRunningException extends BusinessException {

    public MigrationJobRunningException(String ownerId) {
        super("JOB_RUNNING", "移行ジョブは実行中です: owner=" + (ownerId == null || ownerId.isBlank() ? "(all)" : ownerId), ownerId);
    }
}
