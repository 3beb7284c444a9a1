package com.example.plannerv1.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 繰り返しタスク生成の設定値。
 * lookaheadDays: 初回生成・先行生成・再生成で確保する日数
 * maxBatchSize: 一括書き込み1コミットあたりの最大件数
 */
@Component
public class RecurrenceSettings {
    private int lookaheadDays;
    private int maxBatchSize;

    public RecurrenceSettings(
            @Value("${planner.recurrence.lookahead-days:90}") int lookaheadDays,
            @Value("${planner.recurrence.max-batch-size:500}") int maxBatchSize) {
        if (lookaheadDays < 1) {
            throw new IllegalArgumentException("planner.recurrence.lookahead-days は1以上である必要があります: " + lookaheadDays);
        }
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("planner.recurrence.max-batch-size は1以上である必要があります: " + maxBatchSize);
        }
        this.lookaheadDays = lookaheadDays;
        this.maxBatchSize = maxBatchSize;
    }

    public int getLookaheadDays() { return lookaheadDays; }
    public int getMaxBatchSize() { return maxBatchSize; }

    public void setLookaheadDays(int lookaheadDays) { this.lookaheadDays = lookaheadDays; }
    public void setMaxBatchSize(int maxBatchSize) { this.maxBatchSize = maxBatchSize; }
}
