package com.mtbridge.exception;

/**
 * Thrown when a gateway operation is attempted while no session is READY.
 *
 * <p>Collaborators that need a live channel call
 * {@link com.mtbridge.session.SessionGuard#requireReady()} first.
 */
public class NotConnectedException extends GatewayException {

    public NotConnectedException(String message) {
        super(ErrorCode.NOT_CONNECTED, message);
    }
}
