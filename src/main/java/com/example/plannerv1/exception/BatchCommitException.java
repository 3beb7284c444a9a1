package com.example.plannerv1.exception;

/**
 * 一括書き込みのチャンクがコミットに失敗した。
 * それ以前のチャンクはコミット済みのまま残る（ロールバックしない）。
 */
public class BatchCommitException extends BusinessException {

    private final String operation;
    private final int chunkIndex;
    private final int committedCount;

    public BatchCommitException(String operation, int chunkIndex, int committedCount, Throwable cause) {
        super("BATCH_COMMIT_ERROR",
                "一括更新に失敗しました: operation=" + operation + ", chunk=" + chunkIndex + ", committed=" + committedCount,
                cause, operation, chunkIndex, committedCount);
        this.operation = operation;
        this.chunkIndex = chunkIndex;
        this.committedCount = committedCount;
    }

    public String getOperation() {
        return operation;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }

    public int getCommittedCount() {
        return committedCount;
    }
}
