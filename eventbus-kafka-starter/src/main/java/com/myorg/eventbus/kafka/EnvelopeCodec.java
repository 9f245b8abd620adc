package com.myorg.eventbus.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.eventbus.contracts.core.envelope.ErrorInfo;
import com.myorg.eventbus.contracts.core.envelope.EventEnvelope;
import com.myorg.eventbus.kafka.exception.ConsumeParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON wire format for envelopes. Record values are plain UTF-8 JSON strings, keys are plain strings.
 */
@Slf4j
@RequiredArgsConstructor
public class EnvelopeCodec {

    private final ObjectMapper mapper;

    public String encode(EventEnvelope envelope) {
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize envelope id=" + envelope.getId(), e);
        }
    }

    /**
     * @param strict require {@code id}, {@code type}, {@code time} and {@code source};
     *               lenient decoding only needs a JSON object
     */
    public EventEnvelope decode(String value, boolean strict) {
        if (value == null) {
            throw new ConsumeParseException("Message has no value");
        }
        JsonNode node;
        try {
            node = mapper.readTree(value);
        } catch (JsonProcessingException e) {
            throw new ConsumeParseException("Message value is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new ConsumeParseException("Message value is not a JSON object");
        }

        EventEnvelope envelope;
        try {
            envelope = mapper.treeToValue(node, EventEnvelope.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ConsumeParseException("Message value does not match the envelope shape: " + e.getMessage(), e);
        }

        if (strict) {
            List<String> missing = new ArrayList<>();
            if (isBlank(envelope.getId())) missing.add("id");
            if (isBlank(envelope.getType())) missing.add("type");
            if (isBlank(envelope.getTime())) missing.add("time");
            if (isBlank(envelope.getSource())) missing.add("source");
            if (!missing.isEmpty()) {
                throw new ConsumeParseException("Envelope is missing required fields " + missing);
            }
        }
        return envelope;
    }

    /**
     * Original body plus {@code error}, {@code processingService} and {@code originalTopic}.
     * A value that is not a JSON object is kept verbatim under {@code rawValue}.
     */
    public String deadLetterBody(String rawValue, ErrorInfo error, String processingService, String originalTopic) {
        ObjectNode body = null;
        if (rawValue != null) {
            try {
                JsonNode original = mapper.readTree(rawValue);
                if (original instanceof ObjectNode) {
                    body = (ObjectNode) original;
                }
            } catch (JsonProcessingException e) {
                log.debug("Dead letter value is not JSON, keeping it as rawValue: {}", e.getOriginalMessage());
            }
        }
        if (body == null) {
            body = mapper.createObjectNode();
            if (rawValue != null) body.put("rawValue", rawValue);
        }
        body.set("error", mapper.valueToTree(error));
        body.put("processingService", processingService);
        body.put("originalTopic", originalTopic);
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize dead letter for topic " + originalTopic, e);
        }
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
