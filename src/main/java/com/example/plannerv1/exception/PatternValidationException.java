package com.example.plannerv1.exception;

/**
 * 書き込み前に検出した入力不備（オーナーIDの形式、ルールの必須項目など）。
 */
public class PatternValidationException extends BusinessException {

    private final String field;

    public PatternValidationException(String field, String message) {
        super("VALIDATION_ERROR", message, field);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
