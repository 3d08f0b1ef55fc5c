package com.example.activities.controller;

import com.example.activities.domain.exception.ActivityException;
import com.example.activities.domain.exception.ActivityFullException;
import com.example.activities.domain.exception.ActivityNotFoundException;
import com.example.activities.domain.exception.ParticipantNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps rejected requests to status codes with an {@code {"error": "..."}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ActivityException.class)
    public ResponseEntity<Map<String, String>> handleActivityException(ActivityException e) {
        HttpStatus status = statusFor(e);
        logger.warn("Rejected request for activity '{}' with {}: {}", e.getActivityName(), status.value(), e.getMessage());
        return error(status, e.getMessage());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, String>> handleMissingParameter(MissingServletRequestParameterException e) {
        logger.warn("Missing request parameter: {}", e.getParameterName());
        return error(HttpStatus.BAD_REQUEST, "Missing request parameter: " + e.getParameterName());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadableBody(HttpMessageNotReadableException e) {
        logger.warn("Unreadable request body: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(Exception e) {
        // unknown routes, unsupported methods and the like keep their framework status
        if (e instanceof ErrorResponse && ((ErrorResponse) e).getStatusCode().is4xxClientError()) {
            ErrorResponse errorResponse = (ErrorResponse) e;
            logger.warn("Client error {}: {}", errorResponse.getStatusCode().value(), e.getMessage());
            Map<String, String> body = new HashMap<>();
            body.put("error", errorResponse.getBody().getDetail());
            return ResponseEntity.status(errorResponse.getStatusCode())
                    .headers(errorResponse.getHeaders())
                    .body(body);
        }
        logger.error("Unexpected error while handling request", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    static HttpStatus statusFor(ActivityException e) {
        if (e instanceof ActivityNotFoundException || e instanceof ParticipantNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof ActivityFullException) {
            return HttpStatus.CONFLICT;
        }
        return HttpStatus.BAD_REQUEST;
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatusCode status, String message) {
        Map<String, String> errorResponse = new HashMap<>();
        errorResponse.put("error", message);
        return ResponseEntity.status(status).body(errorResponse);
    }
}
