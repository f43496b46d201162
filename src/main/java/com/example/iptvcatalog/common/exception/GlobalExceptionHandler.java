package com.example.iptvcatalog.common.exception;

import com.example.iptvcatalog.api.response.ApiResponse;
import java.util.stream.Collectors;
import javax.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures to the {@link ApiResponse} envelope with a matching HTTP status.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusinessException(BusinessException e) {
        log.info("API_REJECTED code={} message={}", e.getCode(), e.getMessage());
        return ResponseEntity.status(e.getStatus()).body(ApiResponse.fail(e));
    }

    // MethodArgumentNotValidException extends BindException
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ApiResponse<Void>> handleBindException(BindException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(this::describe)
                .collect(Collectors.joining("; "));
        return badRequest(detail.isEmpty() ? "Invalid request parameters" : detail);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleConstraintViolation(ConstraintViolationException e) {
        return badRequest(e.getMessage());
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public ResponseEntity<ApiResponse<Void>> handleDuplicateKeyException(DuplicateKeyException e) {
        log.warn("API_DUPLICATE_KEY reason={}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiResponse.fail("409", "Catalog row already exists", "Retry once the running sync finishes"));
    }

    @ExceptionHandler(PlaylistDownloadException.class)
    public ResponseEntity<ApiResponse<Void>> handlePlaylistDownloadException(PlaylistDownloadException e) {
        log.warn("API_PLAYLIST_UNREACHABLE url={} attempts={}", e.getUrl(), e.getAttempts());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ApiResponse.fail("502", e.getMessage(), "Check that the playlist URL is reachable"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e) {
        log.error("API_UNHANDLED_EXCEPTION", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.fail("500", "Internal server error"));
    }

    private ResponseEntity<ApiResponse<Void>> badRequest(String message) {
        log.debug("API_INVALID_REQUEST reason={}", message);
        return ResponseEntity.badRequest().body(ApiResponse.fail("400", message));
    }

    private String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
