package com.calai.goals.common.web;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.DateTimeException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 全站兜底：把常見例外轉成可預期的狀態碼與錯誤格式。
 * - 400：參數格式錯 / JSON 讀不懂 / Bean Validation / IllegalArgument
 * - 500：其他未預期錯誤
 * ✅ 領域錯誤（UNKNOWN_ALGORITHM 等）由 GoalsExceptionAdvice 先處理
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    // ===== 400 Bad Request =====

    @ExceptionHandler({DateTimeException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(err("BAD_REQUEST", ex.getMessage()));
    }

    /**
     * Bean Validation（@Valid）失敗：同一欄位只留第一個訊息
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError fe : e.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(fe.getField(), fe.getDefaultMessage());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", "VALIDATION_FAILED");
        body.put("message", "Validation failed");
        body.put("fields", fields);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(err("BAD_REQUEST", e.getMessage()));
    }

    // ===== 500 Fallback =====

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknown(Exception ex) {
        log.error("unhandled_exception type={}", ex.getClass().getSimpleName(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(err("INTERNAL_ERROR", ex.getMessage()));
    }

    private static Map<String, Object> err(String code, String message) {
        Map<String, Object> m = new HashMap<>();
        m.put("code", code);
        if (message != null && !message.isBlank()) m.put("message", message);
        return m;
    }
}
