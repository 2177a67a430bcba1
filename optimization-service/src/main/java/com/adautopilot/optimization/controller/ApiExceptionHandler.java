package com.adautopilot.optimization.controller;

import com.adautopilot.common.exception.DuplicateActionException;
import com.adautopilot.common.exception.InvalidStateException;
import com.adautopilot.common.exception.NotFoundException;
import com.adautopilot.common.exception.ValidationException;
import com.adautopilot.optimization.dto.ApiError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain exceptions to HTTP: validation 400, not found 404, invalid state and
 * duplicate action 409.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> validation(ValidationException e) {
        log.info("Request rejected. reason={}", e.getMessage());
        return ResponseEntity.badRequest().body(ApiError.of("validation_error", e.getMessage()));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> notFound(NotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiError.of("not_found", e.getMessage()));
    }

    @ExceptionHandler(DuplicateActionException.class)
    public ResponseEntity<ApiError> duplicate(DuplicateActionException e) {
        log.info("Enqueue rejected. targetId={} type={}", e.getTargetId(), e.getActionType().wireName());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiError.of("duplicate_action", e.getMessage()));
    }

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<ApiError> invalidState(InvalidStateException e) {
        log.info("Transition conflict. actionId={} currentStatus={}", e.getActionId(), e.getCurrentStatus());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(new ApiError("invalid_state", e.getMessage(),
            e.getActionId(), e.getCurrentStatus() == null ? null : e.getCurrentStatus().name()));
    }
}
