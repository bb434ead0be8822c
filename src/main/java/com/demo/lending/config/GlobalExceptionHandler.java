package com.demo.lending.config;

import com.demo.lending.exception.EscrowNotFoundException;
import com.demo.lending.exception.InvalidStateException;
import com.demo.lending.exception.LedgerTransferException;
import com.demo.lending.exception.LendingException;
import com.demo.lending.exception.NotRollableException;
import com.demo.lending.exception.PolicyViolationException;
import com.demo.lending.exception.TemporalViolationException;
import com.demo.lending.exception.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(LendingException.class)
    public ResponseEntity<Map<String, Object>> handleLending(LendingException ex, HttpServletRequest req) {
        HttpStatus status = statusOf(ex);
        log.warn("Rejected {} {}: {}", req.getMethod(), req.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(status).body(body(status, kindOf(ex), ex.getMessage(), req));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        return body(HttpStatus.BAD_REQUEST, "Validation", ex.getMessage(), req);
    }

    @ExceptionHandler(ServletRequestBindingException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBinding(ServletRequestBindingException ex, HttpServletRequest req) {
        return body(HttpStatus.BAD_REQUEST, "Request", ex.getMessage(), req);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException ex, HttpServletRequest req) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return ResponseEntity.status(status).body(body(status, "Request", ex.getReason(), req));
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleAny(Exception ex, HttpServletRequest req) {
        log.error("Unhandled error on {} {}", req.getMethod(), req.getRequestURI(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal", ex.getMessage(), req);
    }

    static HttpStatus statusOf(LendingException ex) {
        if (ex instanceof UnauthorizedException) {
            return HttpStatus.FORBIDDEN;
        }
        if (ex instanceof EscrowNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof InvalidStateException
                || ex instanceof TemporalViolationException
                || ex instanceof NotRollableException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof PolicyViolationException || ex instanceof LedgerTransferException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        return HttpStatus.BAD_REQUEST;
    }

    private static String kindOf(LendingException ex) {
        if (ex instanceof TemporalViolationException) {
            return "TemporalViolation:" + ((TemporalViolationException) ex).getReason();
        }
        if (ex instanceof PolicyViolationException) {
            return "PolicyViolation:" + ((PolicyViolationException) ex).getPolicy();
        }
        String name = ex.getClass().getSimpleName();
        return name.endsWith("Exception") ? name.substring(0, name.length() - "Exception".length()) : name;
    }

    private static Map<String, Object> body(HttpStatus status, String kind, String message, HttpServletRequest req) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("kind", kind);
        body.put("message", message);
        body.put("path", req.getRequestURI());
        return body;
    }
}
