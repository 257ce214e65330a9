package com.mtbridge.session;

import io.grpc.Channel;
import java.util.Objects;

/** A transport channel together with the location it was found at. */
public record AttachedChannel(Channel channel, String origin) {

    public AttachedChannel {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(origin, "origin");
    }
}
