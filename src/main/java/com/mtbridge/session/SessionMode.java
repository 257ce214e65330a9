package com.mtbridge.session;

/**
 * Deployment profile detected once per connection attempt.
 *
 * <p>FULL deployments ship both the session and terminal services and get a
 * handshake plus strict readiness; LITE deployments lack either and get a single
 * ping plus relaxed readiness.
 */
public enum SessionMode {
    FULL,
    LITE
}
