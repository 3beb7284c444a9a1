package com.example.plannerv1.batch;

import com.example.plannerv1.common.error.ErrorLogBuffer;
import com.example.plannerv1.config.RecurrenceSettings;
import com.example.plannerv1.exception.BatchCommitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.function.ToIntFunction;

/**
 * 一括書き込みを最大件数ごとのチャンクに分け、チャンクごとに独立したトランザクションで順にコミットする。
 * チャンクをまたいだロールバックは行わない。失敗したチャンクで処理を止め、
 * それまでにコミットした件数とともに {@link BatchCommitException} を送出する。
 */
@Component
public class ChunkedBatchWriter {

    private static final Logger logger = LoggerFactory.getLogger(ChunkedBatchWriter.class);

    private final TransactionTemplate transactionTemplate;
    private final RecurrenceSettings settings;
    private final ErrorLogBuffer errorLogBuffer;

    public ChunkedBatchWriter(PlatformTransactionManager transactionManager,
                              RecurrenceSettings settings,
                              ErrorLogBuffer errorLogBuffer) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.settings = settings;
        this.errorLogBuffer = errorLogBuffer;
    }

    /**
     * @param operation ログ・例外に出す処理名
     * @param items     対象（空なら何もしない）
     * @param chunk     1チャンク分を書き込み、反映件数を返す
     * @return 全チャンクの反映件数の合計
     */
    public <T> int write(String operation, List<T> items, ToIntFunction<List<T>> chunk) {
        if (items == null || items.isEmpty()) {
            return 0;
        }
        int size = settings.getMaxBatchSize();
        int committed = 0;
        int chunkIndex = 0;
        for (int from = 0; from < items.size(); from += size, chunkIndex++) {
            List<T> part = items.subList(from, Math.min(from + size, items.size()));
            try {
                Integer applied = transactionTemplate.execute(status -> chunk.applyAsInt(part));
                committed += applied == null ? 0 : applied;
            } catch (RuntimeException e) {
                logger.error("一括更新のコミットに失敗しました: operation={}, chunk={}, committed={}",
                        operation, chunkIndex, committed, e);
                errorLogBuffer.addError("batch " + operation + " chunk=" + chunkIndex + " failed", e);
                throw new BatchCommitException(operation, chunkIndex, committed, e);
            }
        }
        if (chunkIndex > 1) {
            logger.debug("一括更新完了: operation={}, chunks={}, applied={}", operation, chunkIndex, committed);
        }
        return committed;
    }
}
