package com.mtbridge.exception;

import java.util.Map;

/**
 * Raised by {@code connect()} when a FULL-mode session never became ready.
 *
 * <p>The message is fixed so callers can match on it to decide between "reconnect"
 * and "check credentials". Diagnostic context goes into {@link #getDetails()}.
 */
public class ConnectException extends GatewayException {

    public static final String MESSAGE = "Please call connect method first";

    public ConnectException() {
        super(ErrorCode.CONNECTION_FAILED, MESSAGE);
    }

    public ConnectException(Map<String, Object> details) {
        super(ErrorCode.CONNECTION_FAILED, MESSAGE, details, null);
    }

    public ConnectException(Map<String, Object> details, Throwable cause) {
        super(ErrorCode.CONNECTION_FAILED, MESSAGE, details, cause);
    }
}
