package net.spookly.exthost.protocol;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Envelope carried in both directions on every bidirectional host stream.
 * <p>
 * {@code requestId} pairs a request with its response; a reply echoes the id of the message it
 * answers. Exactly one of {@code payload} and {@code error} is normally set.
 */
@Getter
@Accessors(fluent = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StreamMessage {
    private String requestId;
    private ErrorDetail error;
    private Payload payload;

    public static StreamMessage of(Payload payload) {
        return new StreamMessage(null, null, payload);
    }

    public static StreamMessage of(String requestId, Payload payload) {
        return new StreamMessage(requestId, null, payload);
    }

    public static StreamMessage error(String requestId, String message) {
        return new StreamMessage(requestId, new ErrorDetail(message), null);
    }

    public boolean hasError() {
        return error != null;
    }

    @Override
    public String toString() {
        String type = payload == null ? "none" : payload.getClass().getSimpleName();
        return "StreamMessage{requestId=" + requestId + ", payload=" + type
                + (error == null ? "" : ", error=" + error.message()) + "}";
    }
}
