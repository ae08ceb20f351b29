package com.learnguard.api.exception;

import com.learnguard.api.dto.response.ErrorResponse;
import com.learnguard.core.escalation.EscalationNotFoundException;
import com.learnguard.core.escalation.EscalationUnauthorizedException;
import com.learnguard.llm.multimodal.MediaProcessingException;
import com.learnguard.llm.router.NoProviderAvailableException;
import com.learnguard.llm.router.ProviderOrchestrator.ProviderFailoverException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.time.Instant;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(
            MethodArgumentNotValidException ex,
            WebRequest request
    ) {
        StringBuilder errors = new StringBuilder();
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = ((FieldError) error).getField();
            String errorMessage = error.getDefaultMessage();
            errors.append(fieldName).append(": ").append(errorMessage).append("; ");
        });
        return build(HttpStatus.BAD_REQUEST, "Validation failed", errors.toString(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed request body", ex.getMostSpecificCause().getMessage(), request);
    }

    @ExceptionHandler({IllegalArgumentException.class, MediaProcessingException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Invalid request", ex.getMessage(), request);
    }

    @ExceptionHandler(EscalationUnauthorizedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(EscalationUnauthorizedException ex, WebRequest request) {
        log.warn("Escalation resolution refused: {}", ex.getMessage());
        return build(HttpStatus.FORBIDDEN, "Not authorized", ex.getMessage(), request);
    }

    @ExceptionHandler(EscalationNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(EscalationNotFoundException ex, WebRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not found", ex.getMessage(), request);
    }

    @ExceptionHandler(ProviderFailoverException.class)
    public ResponseEntity<ErrorResponse> handleFailover(ProviderFailoverException ex, WebRequest request) {
        log.error("All LLM providers failed: {}", ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, "AI service temporarily unavailable", ex.getMessage(), request);
    }

    @ExceptionHandler(NoProviderAvailableException.class)
    public ResponseEntity<ErrorResponse> handleNoProvider(NoProviderAvailableException ex, WebRequest request) {
        log.error("No LLM provider configured: {}", ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "AI service not configured", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request
    ) {
        log.error("Unexpected error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", ex.getMessage(), request);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String message, String error, WebRequest request) {
        ErrorResponse errorResponse = ErrorResponse.builder()
            .message(message)
            .error(error)
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getDescription(false).replace("uri=", ""))
            .build();
        return ResponseEntity.status(status).body(errorResponse);
    }
}
