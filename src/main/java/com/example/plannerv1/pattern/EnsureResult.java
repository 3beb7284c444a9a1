package com.example.plannerv1.pattern;

import java.time.LocalDate;

/**
 * 生成範囲の延長結果。createdCount=0 かつ watermark 不変なら何もしていない。
 */
public record EnsureResult(Long patternId, LocalDate previousGeneratedUntil, LocalDate generatedUntil, int createdCount) {

    public boolean extended() {
        return !generatedUntil.equals(previousGeneratedUntil);
    }
}
