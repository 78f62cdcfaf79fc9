package net.spookly.exthost.broker;

import net.spookly.exthost.protocol.Payload;

/**
 * Handles one inbound payload type on a {@link MessageBroker}.
 *
 * @param <P> payload type handled
 */
@FunctionalInterface
public interface MessageHandler<P extends Payload> {
    /**
     * @return the response payload to send back with the request's id, or {@code null} for none
     * @throws Exception any failure, reported to the peer as an error envelope
     */
    Payload handle(HandlerContext context, P request) throws Exception;
}
