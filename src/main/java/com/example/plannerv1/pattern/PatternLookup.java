package com.example.plannerv1.pattern;

import com.example.plannerv1.exception.PatternAccessDeniedException;
import com.example.plannerv1.exception.PatternNotFoundException;
import com.example.plannerv1.exception.PatternValidationException;
import org.springframework.stereotype.Component;

/**
 * オーナーIDの検証と、所有者チェック付きのパターン取得。いずれも書き込み前に行う。
 */
@Component
public class PatternLookup {

    static final int MAX_OWNER_ID_LENGTH = 128;

    private final RecurringPatternRepository patternRepository;

    public PatternLookup(RecurringPatternRepository patternRepository) {
        this.patternRepository = patternRepository;
    }

    public static String requireValidOwnerId(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new PatternValidationException("ownerId", "オーナーIDは必須です");
        }
        if (ownerId.length() > MAX_OWNER_ID_LENGTH || !ownerId.strip().equals(ownerId)) {
            throw new PatternValidationException("ownerId", "オーナーIDの形式が不正です");
        }
        return ownerId;
    }

    /**
     * 存在しない・削除済みなら NOT_FOUND、他人のものなら UNAUTHORIZED
     */
    public RecurringPattern requireOwned(String ownerId, Long patternId) {
        requireValidOwnerId(ownerId);
        if (patternId == null) {
            throw new PatternValidationException("patternId", "パターンIDは必須です");
        }
        RecurringPattern pattern = patternRepository.findById(patternId)
                .filter(p -> !p.isDeleted())
                .orElseThrow(() -> new PatternNotFoundException("パターン", patternId));
        if (!pattern.getOwnerId().equals(ownerId)) {
            throw new PatternAccessDeniedException("パターン", patternId);
        }
        return pattern;
    }
}
