package com.example.iptvcatalog.api.response;

import com.example.iptvcatalog.common.exception.BusinessException;
import com.example.iptvcatalog.common.logging.RequestTraceFilter;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.slf4j.MDC;

/**
 * Envelope of every {@code /api} reply. {@code traceId} is the request id also sent as {@code X-Request-Id}.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    public static final String SUCCESS_CODE = "0";

    private final String code;
    private final String message;
    private final T data;
    private final String userAction;
    private final String traceId;

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(SUCCESS_CODE, "OK", data, null, MDC.get(RequestTraceFilter.MDC_REQUEST_ID));
    }

    public static <T> ApiResponse<T> fail(String code, String message) {
        return fail(code, message, null);
    }

    public static <T> ApiResponse<T> fail(String code, String message, String userAction) {
        return new ApiResponse<>(code, message, null, userAction, MDC.get(RequestTraceFilter.MDC_REQUEST_ID));
    }

    public static <T> ApiResponse<T> fail(BusinessException e) {
        return fail(e.getCode(), e.getMessage(), e.getUserAction());
    }
}
