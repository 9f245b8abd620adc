package com.myorg.eventbus.kafka;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.eventbus.contracts.core.envelope.ErrorInfo;
import com.myorg.eventbus.contracts.core.envelope.EventEnvelope;
import com.myorg.eventbus.kafka.exception.ConsumeParseException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvelopeCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final EnvelopeCodec codec = new EnvelopeCodec(mapper);

    @Test
    void decode_rejectsNonObjectValues() {
        assertThatThrownBy(() -> codec.decode(null, true)).isInstanceOf(ConsumeParseException.class);
        assertThatThrownBy(() -> codec.decode("", true)).isInstanceOf(ConsumeParseException.class);
        assertThatThrownBy(() -> codec.decode("[1,2]", false)).isInstanceOf(ConsumeParseException.class);
        assertThatThrownBy(() -> codec.decode("\"text\"", false)).isInstanceOf(ConsumeParseException.class);
    }

    @Test
    void strictDecode_namesMissingFields() {
        assertThatThrownBy(() -> codec.decode("{\"type\":\"tenant.created\"}", true))
                .isInstanceOf(ConsumeParseException.class)
                .hasMessageContaining("id")
                .hasMessageContaining("time")
                .hasMessageContaining("source");
    }

    @Test
    void decode_ignoresUnknownFields() {
        EventEnvelope env = codec.decode("""
                {"id":"e1","type":"tenant.created","source":"tenant-service","time":"2024-01-01T00:00:00Z",
                 "schemaHint":"v2","data":{"tenantId":"t1"}}""", true);

        assertThat(env.getId()).isEqualTo("e1");
        assertThat(env.getData().get("tenantId").asText()).isEqualTo("t1");
    }

    @Test
    void deadLetterBody_ofNonObjectJson_isWrapped() throws Exception {
        String body = codec.deadLetterBody("[1,2,3]", ErrorInfo.builder().message("bad").build(), "svc", "orders");

        JsonNode node = mapper.readTree(body);
        assertThat(node.get("rawValue").asText()).isEqualTo("[1,2,3]");
        assertThat(node.get("originalTopic").asText()).isEqualTo("orders");
        assertThat(node.get("error").get("message").asText()).isEqualTo("bad");
    }
}
