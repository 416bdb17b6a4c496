package com.eventspotter.catalog.infrastructure.web;

import com.eventspotter.catalog.domain.exception.CatalogCapacityExceededException;
import com.eventspotter.catalog.domain.exception.EventAccessDeniedException;
import com.eventspotter.catalog.domain.exception.EventNotFoundException;
import com.eventspotter.catalog.domain.exception.InvalidEventQueryException;
import com.eventspotter.catalog.domain.exception.UserConflictException;
import com.eventspotter.catalog.domain.exception.UserNotFoundException;
import com.eventspotter.catalog.infrastructure.web.dto.MessageResponse;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps catalog failures onto HTTP statuses with a {@code {message, errors}} body.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String VALIDATION_ERROR = "Validation error";

    @ExceptionHandler({EventNotFoundException.class, UserNotFoundException.class})
    public ResponseEntity<MessageResponse> handleNotFound(RuntimeException e) {
        return respond(HttpStatus.NOT_FOUND, MessageResponse.of(e.getMessage()));
    }

    @ExceptionHandler(EventAccessDeniedException.class)
    public ResponseEntity<MessageResponse> handleAccessDenied(EventAccessDeniedException e) {
        logger.warn("Rejected write: {}", e.getMessage());
        return respond(HttpStatus.FORBIDDEN, MessageResponse.of(e.getMessage()));
    }

    @ExceptionHandler(UserConflictException.class)
    public ResponseEntity<MessageResponse> handleUserConflict(UserConflictException e) {
        return respond(HttpStatus.CONFLICT, MessageResponse.of(e.getMessage()));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<MessageResponse> handleRateLimited(RateLimitExceededException e) {
        return respond(HttpStatus.TOO_MANY_REQUESTS, MessageResponse.of(e.getMessage()));
    }

    @ExceptionHandler(CatalogCapacityExceededException.class)
    public ResponseEntity<MessageResponse> handleCapacityExceeded(CatalogCapacityExceededException e) {
        logger.warn("Catalog capacity reached: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, MessageResponse.of(e.getMessage()));
    }

    @ExceptionHandler(InvalidEventQueryException.class)
    public ResponseEntity<MessageResponse> handleInvalidQuery(InvalidEventQueryException e) {
        return respond(HttpStatus.BAD_REQUEST, MessageResponse.of(e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<MessageResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            errors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        return respond(HttpStatus.BAD_REQUEST, new MessageResponse(VALIDATION_ERROR, errors));
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<MessageResponse> handleInvalidParameters(HandlerMethodValidationException e) {
        Map<String, String> errors = new LinkedHashMap<>();
        e.getAllValidationResults().forEach(result -> {
            String name = result.getMethodParameter().getParameterName();
            result.getResolvableErrors().stream()
                    .map(MessageSourceResolvable::getDefaultMessage)
                    .findFirst()
                    .ifPresent(message -> errors.putIfAbsent(name != null ? name : "parameter", message));
        });
        return respond(HttpStatus.BAD_REQUEST, new MessageResponse(VALIDATION_ERROR, errors));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<MessageResponse> handleConstraintViolation(ConstraintViolationException e) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (ConstraintViolation<?> violation : e.getConstraintViolations()) {
            errors.putIfAbsent(violation.getPropertyPath().toString(), violation.getMessage());
        }
        return respond(HttpStatus.BAD_REQUEST, new MessageResponse(VALIDATION_ERROR, errors));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<MessageResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return respond(HttpStatus.BAD_REQUEST,
                MessageResponse.of("Invalid value for parameter '" + e.getName() + "'"));
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MissingRequestHeaderException.class
    })
    public ResponseEntity<MessageResponse> handleMissingInput(Exception e) {
        return respond(HttpStatus.BAD_REQUEST, MessageResponse.of(e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<MessageResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        logger.debug("Unreadable request body", e);
        return respond(HttpStatus.BAD_REQUEST, MessageResponse.of("Malformed request body"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<MessageResponse> handleUnexpected(Exception e) {
        if (e instanceof ErrorResponse errorResponse && !errorResponse.getStatusCode().is5xxServerError()) {
            return ResponseEntity.status(errorResponse.getStatusCode())
                    .body(MessageResponse.of(e.getMessage()));
        }
        logger.error("Unhandled error while serving request", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
                MessageResponse.of("An unexpected error occurred. Please try again later."));
    }

    private static ResponseEntity<MessageResponse> respond(HttpStatus status, MessageResponse body) {
        return ResponseEntity.status(status).body(body);
    }
}
