package com.calai.goals.plan.web;

import com.calai.goals.adjustment.common.ConfigOutOfRangeException;
import com.calai.goals.algorithm.UnknownAlgorithmException;
import com.calai.goals.common.InvariantViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ✅ 目標計算專屬的領域錯誤；其他例外交給全站 ApiExceptionHandler。
 */
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice(basePackages = "com.calai.goals.plan")
public class GoalsExceptionAdvice {

    @ExceptionHandler(UnknownAlgorithmException.class)
    public ResponseEntity<Map<String, Object>> handleUnknownAlgorithm(UnknownAlgorithmException e) {
        log.warn("unknown_algorithm category={} identifier={}", e.getCategory(), e.getIdentifier());
        Map<String, Object> body = err("UNKNOWN_ALGORITHM", e.getMessage());
        body.put("category", e.getCategory().name());
        body.put("identifier", e.getIdentifier());
        return ResponseEntity.badRequest().body(body);
    }

    /** 演算法算出超出上限的值：是程式 bug，不是使用者輸入錯 */
    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<Map<String, Object>> handleInvariant(InvariantViolationException e) {
        log.error("invariant_violation message={}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(err("INVARIANT_VIOLATION", e.getMessage()));
    }

    @ExceptionHandler(ConfigOutOfRangeException.class)
    public ResponseEntity<Map<String, Object>> handleConfigOutOfRange(ConfigOutOfRangeException e) {
        Map<String, Object> body = err("CONFIG_OUT_OF_RANGE", e.getMessage());
        body.put("field", e.getField());
        return ResponseEntity.badRequest().body(body);
    }

    private static Map<String, Object> err(String code, String message) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("code", code);
        if (message != null && !message.isBlank()) m.put("message", message);
        return m;
    }
}
