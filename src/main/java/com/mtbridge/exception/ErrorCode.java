package com.mtbridge.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    CONNECTION_FAILED("CONNECTION_FAILED", true),
    NOT_CONNECTED("NOT_CONNECTED", true),
    RPC_ERROR("RPC_ERROR", true),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", false);

    private final String code;

    /** Whether a caller may reasonably retry after a fresh connect. */
    private final boolean retryable;
}
