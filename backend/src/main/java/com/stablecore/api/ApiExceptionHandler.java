package com.stablecore.api;

import com.stablecore.error.CoreException;
import com.stablecore.error.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * Maps core failures to {@code {"error": code, "message": text}} with the code's HTTP status.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(CoreException.class)
    public ResponseEntity<Map<String, String>> handleCore(CoreException e) {
        return body(e.getCode(), e.getMessage());
    }

    /** Failures of joined futures arrive wrapped. */
    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<Map<String, String>> handleCompletion(CompletionException e) {
        CoreException core = CoreException.unwrap(e);
        if (core.getCode() == ErrorCode.EXTERNAL_CALL_FAILED && core.getCause() == e) {
            log.error("[api] unexpected async failure", e);
        }
        return body(core.getCode(), core.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return body(ErrorCode.INVALID_REQUEST, message);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<Map<String, String>> handleBadInput(Exception e) {
        return body(ErrorCode.INVALID_REQUEST, e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> body(ErrorCode code, String message) {
        Map<String, String> error = new LinkedHashMap<>();
        error.put("error", code.name());
        error.put("message", message);
        return ResponseEntity.status(code.status()).body(error);
    }
}
