package com.mtbridge.exception;

import io.grpc.Status;
import java.util.Map;

public class RpcCallException extends GatewayException {

    private final Status.Code statusCode;

    public RpcCallException(String service, String method, Status status, Throwable cause) {
        super(
                ErrorCode.RPC_ERROR,
                service + "/" + method + " failed: " + status.getCode()
                        + (status.getDescription() != null ? " (" + status.getDescription() + ")" : ""),
                Map.of("service", service, "method", method, "status", status.getCode().name()),
                cause);
        this.statusCode = status.getCode();
    }

    public Status.Code getStatusCode() {
        return statusCode;
    }
}
