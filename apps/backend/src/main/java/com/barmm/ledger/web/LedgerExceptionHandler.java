package com.barmm.ledger.web;

import com.barmm.ledger.error.DuplicateRecordException;
import com.barmm.ledger.error.LedgerException;
import com.barmm.ledger.error.ScopeNotFoundException;
import com.barmm.ledger.error.StorageException;
import com.barmm.ledger.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 账本异常 -> HTTP 状态码，响应体统一为 {error, message}。
 */
@Slf4j
@RestControllerAdvice
public class LedgerExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<Map<String, Object>> onLedger(LedgerException e) {
        HttpStatus status = statusOf(e);
        if (status.is5xxServerError()) {
            log.error("Ledger request failed code={} msg={}", e.code(), e.getMessage(), e);
        } else {
            log.debug("Ledger request rejected code={} status={} msg={}", e.code(), status.value(), e.getMessage());
        }
        return ResponseEntity.status(status).body(body(e.code(), e.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> onBind(WebExchangeBindException e) {
        String msg = e.getFieldErrors().stream()
                .map(LedgerExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(body("validation_error", msg.isEmpty() ? e.getReason() : msg));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> onInput(ServerWebInputException e) {
        return ResponseEntity.badRequest().body(body("validation_error", e.getReason()));
    }

    static HttpStatus statusOf(LedgerException e) {
        if (e instanceof ValidationException) return HttpStatus.BAD_REQUEST;
        if (e instanceof ScopeNotFoundException) return HttpStatus.NOT_FOUND;
        if (e instanceof DuplicateRecordException) return HttpStatus.CONFLICT;
        if (e instanceof StorageException) return HttpStatus.SERVICE_UNAVAILABLE;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static String describe(FieldError fe) {
        return fe.getField() + " " + fe.getDefaultMessage();
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("error", error);
        m.put("message", message);
        return m;
    }
}
