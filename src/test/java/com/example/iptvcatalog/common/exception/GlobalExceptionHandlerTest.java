package com.example.iptvcatalog.common.exception;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.example.iptvcatalog.api.request.CreateM3uSourceRequest;
import com.example.iptvcatalog.api.response.ApiResponse;
import com.example.iptvcatalog.common.logging.RequestTraceFilter;
import java.io.IOException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void notFoundShouldCarryStatusAndTraceId() {
        MDC.put(RequestTraceFilter.MDC_REQUEST_ID, "req-1");

        ResponseEntity<ApiResponse<Void>> response =
                handler.handleBusinessException(BusinessException.notFound("Source 9 not found"));

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("404", response.getBody().getCode());
        assertEquals("Source 9 not found", response.getBody().getMessage());
        assertEquals("req-1", response.getBody().getTraceId());
        assertNull(response.getBody().getData());
    }

    @Test
    void conflictShouldKeepUserAction() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleBusinessException(
                BusinessException.conflict("Sync already running for source 3", "Wait for the current sync to finish"));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("Wait for the current sync to finish", response.getBody().getUserAction());
    }

    @Test
    void saturatedExecutorShouldAnswerServiceUnavailable() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleBusinessException(
                BusinessException.unavailable("SYNC_EXECUTOR_REJECTED", "Sync could not be scheduled", "Retry later"));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals("SYNC_EXECUTOR_REJECTED", response.getBody().getCode());
    }

    @Test
    void nonNumericCodeShouldDefaultToBadRequest() {
        assertEquals(HttpStatus.BAD_REQUEST, new BusinessException("PREVIEW_EMPTY", "No URLs").getStatus());
    }

    @Test
    void fieldErrorsShouldBeListedInMessage() {
        BeanPropertyBindingResult result = new BeanPropertyBindingResult(new CreateM3uSourceRequest(), "request");
        result.addError(new FieldError("request", "url", "url must be an http(s) address"));

        ResponseEntity<ApiResponse<Void>> response = handler.handleBindException(new BindException(result));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("url: url must be an http(s) address", response.getBody().getMessage());
    }

    @Test
    void duplicateKeyShouldMapToConflict() {
        ResponseEntity<ApiResponse<Void>> response =
                handler.handleDuplicateKeyException(new DuplicateKeyException("uk_series_name_profile"));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("409", response.getBody().getCode());
    }

    @Test
    void unreachablePlaylistShouldMapToBadGateway() {
        PlaylistDownloadException error = new PlaylistDownloadException(
                "Failed to download playlist after 3 attempts: HTTP 404", "http://lists.example/a.m3u", 3,
                new IOException("HTTP 404"));

        ResponseEntity<ApiResponse<Void>> response = handler.handlePlaylistDownloadException(error);

        assertEquals(HttpStatus.BAD_GATEWAY, response.getStatusCode());
        assertEquals("Failed to download playlist after 3 attempts: HTTP 404", response.getBody().getMessage());
    }

    @Test
    void unexpectedFailureShouldHideDetails() {
        ResponseEntity<ApiResponse<Void>> response = handler.handleException(new IllegalStateException("secret"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("Internal server error", response.getBody().getMessage());
    }
}
