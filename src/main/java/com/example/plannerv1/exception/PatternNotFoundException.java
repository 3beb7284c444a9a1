package com.example.plannerv1.exception;

public class PatternNotFoundException extends BusinessException {

    public PatternNotFoundException(String resource, Object id) {
        super("NOT_FOUND", resource + "が見つかりません: " + id, resource, id);
    }
}
