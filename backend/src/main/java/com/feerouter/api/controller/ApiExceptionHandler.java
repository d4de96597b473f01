package com.feerouter.api.controller;

import com.feerouter.api.dto.ErrorBody;
import com.feerouter.error.ConcurrentCrankException;
import com.feerouter.error.ConfigurationException;
import com.feerouter.error.ErrorCodes;
import com.feerouter.error.FeeRouterException;
import com.feerouter.error.IntegrationException;
import com.feerouter.error.NotFoundException;
import com.feerouter.error.SafetyViolationException;
import com.feerouter.error.SequenceViolationException;
import com.feerouter.error.WindowViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Set;

/**
 * Maps the exception taxonomy to HTTP statuses with ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";

    private static final Set<String> CONFLICT_CODES = Set.of(
            ErrorCodes.POLICY_ALREADY_EXISTS, ErrorCodes.POSITION_ALREADY_EXISTS, ErrorCodes.ROSTER_LOCKED);

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(VALIDATION_ERROR, message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleUnreadable(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(VALIDATION_ERROR, ex.getReason()));
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorBody> handleConfiguration(ConfigurationException ex) {
        HttpStatus status = CONFLICT_CODES.contains(ex.getErrorCode()) ? HttpStatus.CONFLICT : HttpStatus.BAD_REQUEST;
        return body(status, ex);
    }

    @ExceptionHandler(SafetyViolationException.class)
    public ResponseEntity<ErrorBody> handleSafety(SafetyViolationException ex) {
        return body(HttpStatus.UNPROCESSABLE_ENTITY, ex);
    }

    @ExceptionHandler({SequenceViolationException.class, ConcurrentCrankException.class})
    public ResponseEntity<ErrorBody> handleSequence(FeeRouterException ex) {
        return body(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(WindowViolationException.class)
    public ResponseEntity<ErrorBody> handleWindow(WindowViolationException ex) {
        return body(HttpStatus.TOO_EARLY, ex);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorBody> handleNotFound(NotFoundException ex) {
        return body(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(IntegrationException.class)
    public ResponseEntity<ErrorBody> handleIntegration(IntegrationException ex) {
        log.warn("External call failed: {}", ex.getMessage());
        return body(HttpStatus.BAD_GATEWAY, ex);
    }

    /** Write conflicts surfaced at commit time. */
    @ExceptionHandler(TransientDataAccessException.class)
    public ResponseEntity<ErrorBody> handleTransient(TransientDataAccessException ex) {
        log.warn("Concurrent write rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorBody.of(ErrorCodes.CONCURRENT_CRANK, "Concurrent update; re-read the cursor and retry"));
    }

    @ExceptionHandler(ArithmeticException.class)
    public ResponseEntity<ErrorBody> handleOverflow(ArithmeticException ex) {
        log.error("Arithmetic overflow: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ErrorBody.of(ErrorCodes.MATH_OVERFLOW, ex.getMessage()));
    }

    private static ResponseEntity<ErrorBody> body(HttpStatus status, FeeRouterException ex) {
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }
}
