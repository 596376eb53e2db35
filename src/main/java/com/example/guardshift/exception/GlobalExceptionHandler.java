package com.example.guardshift.exception;

import com.example.guardshift.schedule.ScheduleGenerationResponse;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ScheduleGenerationResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        logger.warn("Request validation failed: {}", errors);
        return ResponseEntity.badRequest().body(ScheduleGenerationResponse.failure(
                ScheduleErrorCode.INVALID_REQUEST, "Validation error: " + summarize(errors), errors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ScheduleGenerationResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        String message;
        Throwable cause = ex.getMostSpecificCause();
        if (cause instanceof UnrecognizedPropertyException unrecognized) {
            message = "Unrecognized field: " + unrecognized.getPropertyName();
        } else if (cause instanceof JsonMappingException mapping && !mapping.getPath().isEmpty()) {
            message = "Invalid value for field: " + mapping.getPath().stream()
                    .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : String.valueOf(ref.getIndex()))
                    .collect(Collectors.joining("."));
        } else {
            message = "Malformed request body";
        }

        logger.warn("Unreadable request body: {}", cause.getMessage());
        return ResponseEntity.badRequest().body(ScheduleGenerationResponse.failure(
                ScheduleErrorCode.INVALID_REQUEST, "Validation error: " + message, Map.of()));
    }

    @ExceptionHandler(ScheduleGenerationException.class)
    public ResponseEntity<ScheduleGenerationResponse> handleScheduleGenerationException(ScheduleGenerationException ex) {
        ScheduleGenerationResponse body = ScheduleGenerationResponse.failure(ex.getCode(), ex.getMessage(), Map.of());
        if (ex.getCode() == ScheduleErrorCode.INVALID_REQUEST) {
            logger.warn("Rejected schedule request: {} {}", ex.getMessage(), ex.describeParameters());
            return ResponseEntity.badRequest().body(body);
        }
        logger.warn("Schedule request failed [{}]: {} {}", ex.getCode(), ex.getMessage(), ex.describeParameters());
        return ResponseEntity.ok(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ScheduleGenerationResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        logger.warn("Invalid argument: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ScheduleGenerationResponse.failure(
                ScheduleErrorCode.INVALID_REQUEST, "Validation error: " + ex.getMessage(), Map.of()));
    }

    @ExceptionHandler({NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ScheduleGenerationResponse> handleWebRequestException(Exception ex) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        if (ex instanceof ErrorResponse errorResponse) {
            status = HttpStatus.valueOf(errorResponse.getStatusCode().value());
        }
        logger.debug("Request rejected with {}: {}", status, ex.getMessage());
        return ResponseEntity.status(status).body(ScheduleGenerationResponse.failure(ex.getMessage(), Map.of()));
    }

    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<ScheduleGenerationResponse> handleTaskRejectedException(TaskRejectedException ex) {
        logger.warn("Schedule executor saturated: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ScheduleGenerationResponse.failure(
                "Scheduler is busy, retry later", Map.of()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ScheduleGenerationResponse> handleGenericException(Exception ex) {
        logger.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ScheduleGenerationResponse.failure(
                "Unexpected error generating schedule", Map.of()));
    }

    private static String summarize(Map<String, String> errors) {
        return errors.entrySet().stream()
                .map(e -> e.getKey() + " " + e.getValue())
                .collect(Collectors.joining("; "));
    }
}
