package net.spookly.exthost.broker;

import io.grpc.Context;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.exthost.protocol.ProviderMessages;
import net.spookly.exthost.protocol.StreamMessage;

/**
 * Per-message view handed to a {@link MessageHandler}.
 */
@Getter
@Accessors(fluent = true)
public final class HandlerContext {
    /** Id of the message being handled, may be {@code null}. */
    private final String requestId;
    private final Context context;
    private final MessageBroker broker;

    HandlerContext(String requestId, Context context, MessageBroker broker) {
        this.requestId = requestId;
        this.context = context;
        this.broker = broker;
    }

    /**
     * Report intermediate progress for the message being handled.
     * Ignored when the message carried no request id.
     */
    public void progress(String message) {
        if (requestId == null || message == null || message.isEmpty()) {
            return;
        }
        broker.write(StreamMessage.of(requestId, new ProviderMessages.ProgressMessage(message)));
    }
}
