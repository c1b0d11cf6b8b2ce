package com.arrowcontrol.protocol;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MessageValidatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private ObjectNode message;

    @BeforeEach
    void setUp() {
        message = mapper.createObjectNode();
        message.put("type", "heartbeat");
        message.put("version", "1.0.0");
        message.put("timestamp", 1_700_000_000_000L);
        ObjectNode sender = message.putObject("sender");
        sender.put("id", "t1");
        sender.put("type", "target");
        message.putObject("data");
    }

    @Test
    void acceptsCompleteEnvelope() {
        assertThat(MessageValidator.validate(message)).isEmpty();
    }

    @Test
    void rejectsNonObject() {
        assertThat(MessageValidator.validate(mapper.createArrayNode()))
                .contains("Message must be an object");
    }

    @Test
    void reportsFirstMissingFieldInOrder() {
        message.remove("version");
        message.remove("sender");

        assertThat(MessageValidator.validate(message))
                .contains("Message missing required field: version");
    }

    @Test
    void rejectsNonNumericTimestamp() {
        message.put("timestamp", "yesterday");

        assertThat(MessageValidator.validate(message))
                .contains("Message missing required field: timestamp");
    }

    @Test
    void rejectsSenderWithoutId() {
        ((ObjectNode) message.get("sender")).remove("id");

        assertThat(MessageValidator.validate(message))
                .contains("Sender missing required field: id");
    }

    @Test
    void rejectsUnknownSenderType() {
        ((ObjectNode) message.get("sender")).put("type", "printer");

        assertThat(MessageValidator.validate(message)).contains("Invalid sender type");
    }
}
