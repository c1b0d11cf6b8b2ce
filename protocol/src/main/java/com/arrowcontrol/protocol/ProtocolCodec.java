package com.arrowcontrol.protocol;

import com.arrowcontrol.protocol.model.ProtocolMessage;
import com.arrowcontrol.protocol.model.Sender;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Optional;

/**
 * JSON codec for protocol envelopes. One envelope per text frame or datagram.
 *
 * <p>Decoding validates structure before anything is bound; payloads are bound lazily with
 * {@link #payload(ProtocolMessage, Class)} once the message kind is known.
 */
@Slf4j
public class ProtocolCodec {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ProtocolCodec() {
        this(new ObjectMapper(), Clock.systemUTC());
    }

    public ProtocolCodec(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);
        this.clock = clock;
    }

    // ==================== Decoding ====================

    public DecodeResult decode(String text) {
        JsonNode node;
        try {
            node = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("⚠️ Unparseable frame: {}", e.getOriginalMessage());
            return DecodeResult.rejected("Invalid JSON");
        }

        Optional<String> violation = MessageValidator.validate(node);
        if (violation.isPresent()) {
            return DecodeResult.rejected(violation.get());
        }

        try {
            return DecodeResult.accepted(objectMapper.treeToValue(node, ProtocolMessage.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return DecodeResult.rejected("Invalid message format");
        }
    }

    /**
     * Binds the {@code data} block of a message to its payload type.
     *
     * @throws ProtocolException when the data is missing or does not fit the payload shape
     */
    public <T> T payload(ProtocolMessage message, Class<T> payloadType) {
        JsonNode data = message.data();
        if (data == null || data.isNull() || !data.isObject()) {
            throw new ProtocolException("Message '" + message.type() + "' has no data");
        }
        try {
            return objectMapper.treeToValue(data, payloadType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProtocolException("Invalid " + message.type() + " payload: " + rootMessage(e), e);
        }
    }

    // ==================== Encoding ====================

    /**
     * Builds an envelope stamped with the current protocol version and time.
     */
    public ProtocolMessage message(MessageType type, Sender sender, Object payload) {
        JsonNode data = payload == null
                ? objectMapper.createObjectNode()
                : objectMapper.valueToTree(payload);
        return new ProtocolMessage(type.wireName(), ProtocolConstants.PROTOCOL_VERSION, clock.millis(), sender,
                data == null ? NullNode.getInstance() : data);
    }

    public String encode(ProtocolMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Failed to encode " + message.type() + " message", e);
        }
    }

    public String encode(MessageType type, Sender sender, Object payload) {
        return encode(message(type, sender, payload));
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
