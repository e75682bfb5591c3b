package com.engagesphere.booster.infrastructure.web;

import com.engagesphere.booster.domain.exception.AdminRequiredException;
import com.engagesphere.booster.domain.exception.AlreadyRegisteredException;
import com.engagesphere.booster.domain.exception.AuthenticationRequiredException;
import com.engagesphere.booster.domain.exception.EmailAlreadyRegisteredException;
import com.engagesphere.booster.domain.exception.EngagementException;
import com.engagesphere.booster.domain.exception.EventNotFoundException;
import com.engagesphere.booster.domain.exception.UserNotFoundException;
import com.engagesphere.booster.infrastructure.web.dto.ApiError;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(EngagementException.class)
    public ResponseEntity<ApiError> handleEngagementException(EngagementException ex) {
        HttpStatus status = statusFor(ex);
        logger.warn("Request rejected with {}: {}", ex.getCode(), ex.getMessage());
        return ResponseEntity.status(status).body(ApiError.of(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(ApiError.of("VALIDATION_FAILED", message));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        return ResponseEntity.badRequest().body(ApiError.of("BAD_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex) {
        logger.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiError.of("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    private static HttpStatus statusFor(EngagementException ex) {
        if (ex instanceof EventNotFoundException || ex instanceof UserNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof AlreadyRegisteredException || ex instanceof EmailAlreadyRegisteredException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof AdminRequiredException) {
            return HttpStatus.FORBIDDEN;
        }
        if (ex instanceof AuthenticationRequiredException) {
            return HttpStatus.UNAUTHORIZED;
        }
        return HttpStatus.BAD_REQUEST;
    }
}
