package com.realtime.connect.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class ApiExceptionAdvice {

    @ExceptionHandler(ConnectException.class)
    public ResponseEntity<Map<String, Object>> handle(ConnectException e) {
        if (e.getCode() == ErrorCode.TRANSIENT) {
            log.warn("transient failure: {}", e.getReason(), e.getCause());
        }
        return body(e.getStatusCode(), e.getCode(), e.getReason());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handle(ResponseStatusException e) {
        return body(e.getStatusCode(), null, e.getReason());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<?> handle(MethodArgumentNotValidException e) {
        var errors = e.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(f -> f.getField(), f -> String.valueOf(f.getDefaultMessage()), (a, b) -> a));
        return ResponseEntity.badRequest().body(Map.of(
                "code", ErrorCode.BAD_REQUEST.name(),
                "message", "validation failed",
                "errors", errors));
    }

    @ExceptionHandler({IllegalArgumentException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadInput(Exception e) {
        return body(HttpStatus.BAD_REQUEST, ErrorCode.BAD_REQUEST, "잘못된 요청입니다.");
    }

    // 멱등 처리를 우회한 동시 삽입: canonical pair 유니크 제약
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(DataIntegrityViolationException e) {
        log.warn("constraint violation: {}", e.getMostSpecificCause().getMessage());
        return body(ErrorCode.CONFLICT.getStatus(), ErrorCode.CONFLICT, "이미 처리된 요청입니다.");
    }

    @ExceptionHandler({TransientDataAccessException.class, DataAccessResourceFailureException.class})
    public ResponseEntity<Map<String, Object>> handleTransient(Exception e) {
        log.warn("storage unavailable: {}", e.getMessage());
        return body(ErrorCode.TRANSIENT.getStatus(), ErrorCode.TRANSIENT, "일시적인 오류입니다. 다시 시도해 주세요.");
    }

    @ExceptionHandler({org.springframework.security.access.AccessDeniedException.class})
    public ResponseEntity<Map<String, Object>> handleDenied(Exception e) {
        return body(HttpStatus.FORBIDDEN, ErrorCode.FORBIDDEN, "접근 권한이 없습니다.");
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatusCode status, ErrorCode code, String message) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("timestamp", Instant.now().toString());
        m.put("status", status.value());
        HttpStatus resolved = HttpStatus.resolve(status.value());
        m.put("error", resolved != null ? resolved.getReasonPhrase() : String.valueOf(status.value()));
        if (code != null) m.put("code", code.name());
        m.put("message", message == null ? "" : message);
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(m);
    }
}
