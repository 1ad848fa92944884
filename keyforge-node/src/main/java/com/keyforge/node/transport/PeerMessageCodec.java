package com.keyforge.node.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.keyforge.core.error.KeyforgeException;
import com.keyforge.core.spi.PeerMessage;
import com.keyforge.core.spi.PeerMessageType;

/**
 * JSON encoding of peer message payloads.
 */
public class PeerMessageCodec {

    private final ObjectMapper mapper;

    public PeerMessageCodec() {
        this.mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public PeerMessage encode(PeerMessageType type, String senderId, String resourceId, Object payload) {
        try {
            return PeerMessage.of(type, senderId, resourceId, mapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new KeyforgeException("Cannot encode " + type + " payload: " + e.getOriginalMessage(), e);
        }
    }

    public <T> T decode(PeerMessage message, Class<T> payloadType) {
        if (message.payload() == null) {
            throw new KeyforgeException(message.type() + " message " + message.messageId() + " has no payload");
        }
        try {
            return mapper.readValue(message.payload(), payloadType);
        } catch (JsonProcessingException e) {
            throw new KeyforgeException("Malformed " + message.type() + " payload: " + e.getOriginalMessage(), e);
        }
    }
}
