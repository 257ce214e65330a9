package com.mtbridge.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public abstract class GatewayException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected GatewayException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    protected GatewayException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, Map.of(), cause);
    }

    protected GatewayException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }
}
