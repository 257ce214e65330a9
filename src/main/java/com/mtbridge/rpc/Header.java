package com.mtbridge.rpc;

import java.util.Objects;

/** One metadata pair attached to every outbound call. */
public record Header(String key, String value) {

    public Header {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }
}
