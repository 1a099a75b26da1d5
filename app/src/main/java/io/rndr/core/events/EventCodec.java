package io.rndr.core.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

public final class EventCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private EventCodec(){}

    public static byte[] toBytes(LedgerEvent event) {
        try {
            return MAPPER.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + event, e);
        }
    }

    public static LedgerEvent fromBytes(byte[] bytes) {
        try {
            return MAPPER.readValue(bytes, LedgerEvent.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed event bytes", e);
        }
    }

    /** Sequence keys sort lexicographically in the same order as numerically. */
    public static String sequenceKey(long sequence) {
        return String.format("%020d", sequence);
    }
}
