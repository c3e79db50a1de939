package com.demo.trends.config;

import com.demo.trends.service.InvalidRequestException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({InvalidRequestException.class, ConstraintViolationException.class,
            MissingServletRequestParameterException.class, HandlerMethodValidationException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalid(Exception ex, HttpServletRequest req) {
        return body(400, "Bad Request", ex.getMessage(), req);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest req) {
        return body(400, "Bad Request",
                "invalid value for parameter '" + ex.getName() + "': " + ex.getValue(), req);
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleAny(Exception ex, HttpServletRequest req) {
        log.error("Unhandled error on {}", req.getRequestURI(), ex);
        return body(500, "Internal Server Error", ex.getMessage(), req);
    }

    private static Map<String, Object> body(int status, String error, String message, HttpServletRequest req) {
        return Map.of(
                "timestamp", Instant.now(),
                "status", status,
                "error", error,
                "message", message == null ? "" : message,
                "path", req.getRequestURI()
        );
    }
}
