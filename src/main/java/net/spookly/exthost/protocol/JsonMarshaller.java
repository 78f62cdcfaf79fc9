package net.spookly.exthost.protocol;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.grpc.MethodDescriptor;
import io.grpc.Status;

/**
 * gRPC marshaller writing messages as UTF-8 JSON.
 */
public final class JsonMarshaller<T> implements MethodDescriptor.Marshaller<T> {
    static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
            .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);

    private final Class<T> type;

    private JsonMarshaller(Class<T> type) {
        this.type = type;
    }

    public static <T> JsonMarshaller<T> of(Class<T> type) {
        return new JsonMarshaller<>(type);
    }

    @Override
    public InputStream stream(T value) {
        try {
            return new ByteArrayInputStream(MAPPER.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw Status.INTERNAL
                    .withDescription("failed to encode " + type.getSimpleName())
                    .withCause(e)
                    .asRuntimeException();
        }
    }

    @Override
    public T parse(InputStream stream) {
        try (InputStream in = stream) {
            return MAPPER.readValue(in, type);
        } catch (IOException e) {
            throw Status.INTERNAL
                    .withDescription("failed to decode " + type.getSimpleName() + ": " + e.getMessage())
                    .withCause(e)
                    .asRuntimeException();
        }
    }
}
