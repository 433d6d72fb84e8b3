package dao.fhe.stocksim.controller;

import dao.fhe.stocksim.exception.ErrorCategory;
import dao.fhe.stocksim.exception.ErrorKind;
import dao.fhe.stocksim.exception.SimulationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps failures to {status, error, category, message}. Nothing else is returned: no retry
 * hints, no remediation data.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(SimulationException.class)
    public ResponseEntity<Map<String, Object>> handleSimulation(SimulationException e) {
        if (e.getCategory() == ErrorCategory.PROTOCOL_INTEGRITY) {
            log.warn("Protocol integrity failure: {}", e.getMessage());
        } else {
            log.debug("Operation rejected: {}", e.getMessage());
        }
        return ResponseEntity.status(statusOf(e.getKind()))
                .body(body(e.getKind().name(), e.getCategory().name(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest()
                .body(body(ErrorKind.INVALID_ARGUMENT.name(), ErrorCategory.VALIDATION.name(), message));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, Object>> handleMissingHeader(MissingRequestHeaderException e) {
        return ResponseEntity.badRequest()
                .body(body(ErrorKind.INVALID_ARGUMENT.name(), ErrorCategory.VALIDATION.name(), e.getMessage()));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        if (kind == ErrorKind.UNKNOWN_REQUEST) {
            return HttpStatus.NOT_FOUND;
        }
        switch (kind.getCategory()) {
            case AUTHORIZATION:
                return HttpStatus.FORBIDDEN;
            case AVAILABILITY:
                return HttpStatus.CONFLICT;
            case RATE_LIMIT:
                return HttpStatus.TOO_MANY_REQUESTS;
            case PROTOCOL_INTEGRITY:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            default:
                return HttpStatus.BAD_REQUEST;
        }
    }

    private static Map<String, Object> body(String error, String category, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ERROR");
        body.put("error", error);
        body.put("category", category);
        body.put("message", message);
        return body;
    }
}
