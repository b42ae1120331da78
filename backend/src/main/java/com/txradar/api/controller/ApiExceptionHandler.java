package com.txradar.api.controller;

import com.txradar.api.dto.ErrorBody;
import com.txradar.ingestion.SourceUnavailableException;
import com.txradar.pipeline.PipelineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.time.Clock;
import java.util.Optional;

/**
 * Maps request validation to 400, fatal pipeline errors to 422 and an unreachable source to 502, all with
 * ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class ApiExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = userFacingMessage(error, ex);
        return ResponseEntity.badRequest().body(errorBody(error, message));
    }

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<ErrorBody> handlePipeline(PipelineException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(errorBody(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(SourceUnavailableException.class)
    public ResponseEntity<ErrorBody> handleSource(SourceUnavailableException ex) {
        log.warn("Source unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(errorBody(SourceUnavailableException.ERROR_CODE, ex.getMessage()));
    }

    private ErrorBody errorBody(String error, String message) {
        return new ErrorBody(error, message, clock.instant());
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_COUNTRY_CODE" -> "countryCode must be an ISO 3166-1 alpha-2 code";
            case "INVALID_CURRENCY" -> "targetCurrency must be an ISO 4217 code";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
