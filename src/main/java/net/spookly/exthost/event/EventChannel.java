package net.spookly.exthost.event;

import io.grpc.Context;
import net.spookly.exthost.protocol.Payload;

/**
 * Outbound side of an extension's event stream.
 */
@FunctionalInterface
public interface EventChannel {
    void send(Context context, Payload payload);
}
