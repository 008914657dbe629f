package com.dedupstore.api.exception;

import com.dedupstore.api.dto.response.ErrorResponse;
import com.dedupstore.common.util.FileUtils;
import com.dedupstore.core.exception.NotFoundException;
import com.dedupstore.core.exception.QuotaExceededException;
import com.dedupstore.core.exception.StorageIOException;
import com.dedupstore.core.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {
    
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex, WebRequest request) {
        log.debug("Validation failed: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Validation failed", ex.getMessage(), request);
    }
    
    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException ex, WebRequest request) {
        log.debug("Missing request part: {} | contentType={}", ex.getRequestPartName(), request.getHeader("Content-Type"));
        
        String helpfulMessage = String.format(
            "Required part '%s' is not present. Send the request as multipart/form-data with a file part named '%s'.",
            ex.getRequestPartName(),
            ex.getRequestPartName()
        );
        return build(HttpStatus.BAD_REQUEST, "File upload error", helpfulMessage, request);
    }
    
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex, WebRequest request) {
        String message = String.format("Invalid value '%s' for parameter '%s'", ex.getValue(), ex.getName());
        return build(HttpStatus.BAD_REQUEST, "Validation failed", message, request);
    }
    
    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex, WebRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not found", ex.getMessage(), request);
    }
    
    @ExceptionHandler(QuotaExceededException.class)
    public ResponseEntity<ErrorResponse> handleQuotaExceeded(QuotaExceededException ex, WebRequest request) {
        log.info("Quota exceeded | userId={} | requested={} | used={} | quota={}",
            ex.getUserId(), ex.getRequestedBytes(), ex.getUsedBytes(), ex.getQuotaBytes());
        ErrorResponse errorResponse = errorBody(HttpStatus.PAYLOAD_TOO_LARGE, "Storage quota exceeded", ex.getMessage(), request);
        errorResponse.setDetails(Map.of(
            "requestedBytes", ex.getRequestedBytes(),
            "usedBytes", ex.getUsedBytes(),
            "quotaBytes", ex.getQuotaBytes()
        ));
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(errorResponse);
    }
    
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxUploadSize(MaxUploadSizeExceededException ex, WebRequest request) {
        String message = ex.getMaxUploadSize() > 0
            ? "File size exceeds maximum allowed size of " + FileUtils.formatFileSize(ex.getMaxUploadSize())
            : "File size exceeds maximum allowed size";
        return build(HttpStatus.PAYLOAD_TOO_LARGE, "File too large", message, request);
    }
    
    @ExceptionHandler(StorageIOException.class)
    public ResponseEntity<ErrorResponse> handleStorage(StorageIOException ex, WebRequest request) {
        log.error("Storage error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Storage error", ex.getMessage(), request);
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, WebRequest request) {
        log.error("Unexpected error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", ex.getMessage(), request);
    }
    
    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message, WebRequest request) {
        return ResponseEntity.status(status).body(errorBody(status, error, message, request));
    }
    
    private ErrorResponse errorBody(HttpStatus status, String error, String message, WebRequest request) {
        return ErrorResponse.builder()
            .error(error)
            .message(message)
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getDescription(false).replace("uri=", ""))
            .build();
    }
}
