package com.example.plannerv1.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = error instanceof FieldError fe ? fe.getField() : error.getObjectName();
            String errorMessage = error.getDefaultMessage();
            errors.put(fieldName, errorMessage);
        });

        ErrorResponse errorResponse = new ErrorResponse(
                "VALIDATION_ERROR",
                "入力データに問題があります",
                errors,
                LocalDateTime.now()
        );

        logger.warn("バリデーションエラーが発生しました: {}", errors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "VALIDATION_ERROR",
                "ヘッダーが不足しています: " + ex.getHeaderName(),
                Map.of(ex.getHeaderName(), "required"),
                LocalDateTime.now()
        );
        logger.warn("必須ヘッダーがありません: {}", ex.getHeaderName());
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception ex) {
        logger.warn("リクエストを解釈できません: {}", ex.getMessage());
        ErrorResponse errorResponse = new ErrorResponse(
                "VALIDATION_ERROR",
                "リクエストの形式が不正です",
                null,
                LocalDateTime.now()
        );
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(PatternValidationException.class)
    public ResponseEntity<ErrorResponse> handlePatternValidation(PatternValidationException ex) {
        logger.warn("入力エラーが発生しました: field={}, message={}", ex.getField(), ex.getMessage());
        return ResponseEntity.badRequest().body(of(ex, Map.of(ex.getField(), ex.getMessage())));
    }

    @ExceptionHandler(PatternNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(PatternNotFoundException ex) {
        logger.warn("対象が見つかりません: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(of(ex, null));
    }

    @ExceptionHandler(PatternAccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(PatternAccessDeniedException ex) {
        logger.warn("アクセスが拒否されました: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(of(ex, null));
    }

    @ExceptionHandler(RecurrenceConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(RecurrenceConfigurationException ex) {
        logger.warn("繰り返し設定エラー: {}={}", ex.getSettingName(), ex.getSettingValue());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(of(ex, null));
    }

    @ExceptionHandler(MigrationJobRunningException.class)
    public ResponseEntity<ErrorResponse> handleJobRunning(MigrationJobRunningException ex) {
        logger.warn("移行ジョブの重複起動を拒否しました: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(of(ex, null));
    }

    @ExceptionHandler(BatchCommitException.class)
    public ResponseEntity<ErrorResponse> handleBatchCommit(BatchCommitException ex) {
        logger.error("一括更新エラー: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(of(ex, Map.of(
                "operation", ex.getOperation(),
                "chunkIndex", String.valueOf(ex.getChunkIndex()),
                "committedCount", String.valueOf(ex.getCommittedCount()))));
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException ex) {
        logger.error("ビジネスロジックエラーが発生しました: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(of(ex, null));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "VALIDATION_ERROR",
                ex.getMessage(),
                null,
                LocalDateTime.now()
        );

        logger.warn("引数エラーが発生しました: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "INTERNAL_ERROR",
                "予期しないエラーが発生しました",
                null,
                LocalDateTime.now()
        );

        logger.error("予期しないエラーが発生しました", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private ErrorResponse of(BusinessException ex, Map<String, String> details) {
        return new ErrorResponse(ex.getErrorCode(), ex.getMessage(), details, LocalDateTime.now());
    }

    public record ErrorResponse(
            String error,
            String message,
            Map<String, String> details,
            LocalDateTime timestamp
    ) {}
}
