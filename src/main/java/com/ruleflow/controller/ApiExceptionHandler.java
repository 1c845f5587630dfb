package com.ruleflow.controller;

import com.ruleflow.dto.ErrorResponse;
import com.ruleflow.exception.AssignmentException;
import com.ruleflow.exception.CompileException;
import com.ruleflow.exception.ConflictException;
import com.ruleflow.exception.InvalidWorkflowException;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions to a uniform {@link ErrorResponse}.
 *
 *   CompileException, InvalidWorkflowException, bad input → 400
 *   EntityNotFoundException                              → 404
 *   ConflictException, optimistic lock, unique key       → 409
 *   AssignmentException                                  → 422
 *   other DataAccessException                            → 503
 *   anything else                                        → 500
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(CompileException.class)
    public ResponseEntity<ErrorResponse> handleCompile(CompileException e) {
        log.warn("Compilation failed: {}", e.getMessage());
        ErrorResponse body = error(HttpStatus.BAD_REQUEST, e.getMessage());
        if (e.getPosition() >= 0) {
            body.setPosition(e.getPosition());
        }
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(InvalidWorkflowException.class)
    public ResponseEntity<ErrorResponse> handleInvalidWorkflow(InvalidWorkflowException e) {
        log.warn("Invalid workflow: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        ErrorResponse body = error(HttpStatus.BAD_REQUEST, "Validation failed");
        body.setFieldErrors(fieldErrors);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadInput(Exception e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(EntityNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ConflictException e) {
        log.info("Conflict: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLock(ObjectOptimisticLockingFailureException e) {
        log.info("Concurrent modification: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "The resource was modified concurrently; re-read and retry");
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleIntegrity(DataIntegrityViolationException e) {
        log.warn("Integrity violation: {}", e.getMostSpecificCause().getMessage());
        return respond(HttpStatus.CONFLICT, "The request conflicts with existing data");
    }

    @ExceptionHandler(AssignmentException.class)
    public ResponseEntity<ErrorResponse> handleAssignment(AssignmentException e) {
        log.warn("Assignment failed: {}", e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException e) {
        log.error("Storage unavailable: {}", e.getMessage(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Storage is temporarily unavailable");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected failure: ", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(error(status, message));
    }

    private static ErrorResponse error(HttpStatus status, String message) {
        return ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .build();
    }
}
