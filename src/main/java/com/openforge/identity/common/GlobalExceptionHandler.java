package com.openforge.identity.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Renders every failure as {@code {"code": ..., "message": ..., ...details}}.
 *
 *   - IdentityException: its own status, reason and details
 *   - malformed input: 400 VALIDATION_FAILED
 *   - storage failure: 500 STORAGE_ERROR
 *   - anything else: 500 INTERNAL_ERROR with a request id; the stack trace is logged only
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IdentityException.class)
    public ResponseEntity<Map<String, Object>> handleIdentity(IdentityException e) {
        if (e.status().is5xxServerError()) {
            log.error("[Error] {}: {}", e.reason(), e.getMessage(), e.getCause());
        } else {
            log.debug("[Error] {} {}: {}", e.status().value(), e.reason(), e.getMessage());
        }
        Map<String, Object> body = err(e.reason(), e.getMessage());
        body.putAll(e.details());
        return ResponseEntity.status(e.status()).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().isEmpty()
                ? "Invalid request"
                : e.getBindingResult().getFieldErrors().get(0).getField()
                  + " " + e.getBindingResult().getFieldErrors().get(0).getDefaultMessage();
        return ResponseEntity.badRequest().body(err("VALIDATION_FAILED", msg));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest().body(err("VALIDATION_FAILED", "Malformed request"));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNoResource(NoResourceFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(err("NOT_FOUND", "Not found"));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(DataAccessException e) {
        String requestId = UUID.randomUUID().toString();
        log.error("[Error] Storage failure requestId={}", requestId, e);
        Map<String, Object> body = err("STORAGE_ERROR", "A storage error occurred, please try again");
        body.put("request_id", requestId);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknown(Exception e) {
        String requestId = UUID.randomUUID().toString();
        log.error("[Error] Unhandled exception requestId={}", requestId, e);
        Map<String, Object> body = err("INTERNAL_ERROR", "Unexpected error");
        body.put("request_id", requestId);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private static Map<String, Object> err(String code, String message) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("code", code);
        m.put("message", message);
        return m;
    }
}
