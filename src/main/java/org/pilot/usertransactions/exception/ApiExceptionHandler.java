package org.pilot.usertransactions.exception;

import org.pilot.usertransactions.dto.ErrorResponse;
import org.pilot.usertransactions.dto.ValidationErrorResponse;
import org.pilot.usertransactions.validation.FieldRule;
import org.pilot.usertransactions.validation.RequestValidationException;
import org.pilot.usertransactions.validation.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.util.List;

/**
 * Maps failures to the API's error bodies: {@code {"errors": [...]}} for bad input,
 * {@code {"error": "..."}} for everything else. Framework exceptions (unknown route,
 * wrong method, unsupported media type) keep the statuses the base class assigns.
 */
@RestControllerAdvice
public class ApiExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RequestValidationException.class)
    public ResponseEntity<ValidationErrorResponse> handleValidation(RequestValidationException ex) {
        return ResponseEntity.badRequest().body(new ValidationErrorResponse(ex.getErrors()));
    }

    @ExceptionHandler(UserNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleUserNotFound(UserNotFoundException ex) {
        log.debug("User {} not found", ex.getUserId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(TransactionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleTransactionNotFound(TransactionNotFoundException ex) {
        log.debug("Transaction {} not found", ex.getTransactionId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, WebRequest request) {
        log.error("Unexpected error handling {}", request.getDescription(false), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse("Internal server error"));
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(HttpMessageNotReadableException ex, HttpHeaders headers,
                                                                  HttpStatusCode status, WebRequest request) {
        log.debug("Unreadable request body for {}: {}", request.getDescription(false), ex.getMessage());
        ValidationError error = new ValidationError(null, "Request body must be valid JSON", null, FieldRule.BODY);
        return ResponseEntity.badRequest().body(new ValidationErrorResponse(List.of(error)));
    }
}
