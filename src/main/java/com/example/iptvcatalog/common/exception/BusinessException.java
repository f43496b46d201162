package com.example.iptvcatalog.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Error raised at the API boundary. {@code code} is echoed in the response envelope and {@code status} becomes
 * the HTTP status of the reply.
 */
public class BusinessException extends RuntimeException {

    private final String code;
    private final String userAction;
    private final HttpStatus status;

    public BusinessException(String code, String message) {
        this(code, message, null);
    }

    public BusinessException(String code, String message, String userAction) {
        this(code, message, userAction, statusOf(code));
    }

    private BusinessException(String code, String message, String userAction, HttpStatus status) {
        super(message);
        this.code = code;
        this.userAction = userAction;
        this.status = status;
    }

    public static BusinessException notFound(String message) {
        return new BusinessException("404", message);
    }

    public static BusinessException conflict(String message, String userAction) {
        return new BusinessException("409", message, userAction);
    }

    public static BusinessException unavailable(String code, String message, String userAction) {
        return new BusinessException(code, message, userAction, HttpStatus.SERVICE_UNAVAILABLE);
    }

    public String getCode() {
        return code;
    }

    public String getUserAction() {
        return userAction;
    }

    public HttpStatus getStatus() {
        return status;
    }

    private static HttpStatus statusOf(String code) {
        if (code != null && code.matches("\\d{3}")) {
            HttpStatus resolved = HttpStatus.resolve(Integer.parseInt(code));
            if (resolved != null) {
                return resolved;
            }
        }
        return HttpStatus.BAD_REQUEST;
    }
}
