package com.example.plannerv1.exception;

public class PatternAccessDeniedException extends BusinessException {

    public PatternAccessDeniedException(String resource, Object id) {
        super("UNAUTHORIZED", resource + "へのアクセス権がありません: " + id, resource, id);
    }
}
