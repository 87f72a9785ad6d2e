package org.learningjava.scalarstore.infrastructure.adapter.in.web;

import org.learningjava.scalarstore.domain.error.BackendUnavailableException;
import org.learningjava.scalarstore.domain.error.InvalidIdentifierException;
import org.learningjava.scalarstore.domain.error.ScalarsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidIdentifierException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidIdentifier(InvalidIdentifierException e) {
        return body("INVALID_IDENTIFIER", e.getMessage());
    }

    @ExceptionHandler(BackendUnavailableException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleBackendUnavailable(BackendUnavailableException e) {
        log.error("Backend unavailable", e);
        return body("BACKEND_UNAVAILABLE", e.getMessage());
    }

    @ExceptionHandler(ScalarsException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleScalars(ScalarsException e) {
        log.error("Scalars engine failure", e);
        return body("INTERNAL_ERROR", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(IllegalArgumentException e) {
        return body("BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalid(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return body("BAD_REQUEST", message);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadable(Exception e) {
        return body("BAD_REQUEST", "Malformed request");
    }

    private static Map<String, Object> body(String error, String message) {
        return Map.of(
                "error", error,
                "message", message == null ? "" : message
        );
    }
}
