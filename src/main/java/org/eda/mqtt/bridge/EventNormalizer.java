/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eda.mqtt.bridge.model.MqttMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns an inbound message into the event handed to the rule engine.
 *
 * <p>A payload holding a JSON object becomes that object. Anything else (malformed JSON, plain text, an empty
 * payload, or JSON that is not an object) is wrapped as {@code {"payload": raw}}, where raw is the payload text
 * when it is valid UTF-8 and the payload bytes otherwise. Normalization never fails.
 */
public class EventNormalizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(EventNormalizer.class);

    public static final String PAYLOAD_KEY = "payload";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final TypeReference<LinkedHashMap<String, Object>> EVENT_TYPE =
            new TypeReference<LinkedHashMap<String, Object>>() {
            };

    /**
     * Normalize one message. The returned map is new and not retained.
     *
     * @param message inbound message
     * @return normalized event
     */
    public Map<String, Object> normalize(MqttMessage message) {
        byte[] payload = message.getPayload() == null ? new byte[0] : message.getPayload();

        JsonNode node = null;
        try {
            node = OBJECT_MAPPER.readTree(payload);
        } catch (IOException e) {
            LOGGER.atDebug().addKeyValue("topic", message.getTopic()).addKeyValue("reason", e.getMessage())
                    .log("Payload is not valid JSON, wrapping raw payload");
        }
        if (node != null && node.isObject()) {
            return OBJECT_MAPPER.convertValue(node, EVENT_TYPE);
        }
        if (node != null && !node.isMissingNode()) {
            LOGGER.atDebug().addKeyValue("topic", message.getTopic()).addKeyValue("nodeType", node.getNodeType())
                    .log("Payload is not a JSON object, wrapping raw payload");
        }

        Map<String, Object> event = new LinkedHashMap<>();
        event.put(PAYLOAD_KEY, rawPayload(payload));
        return event;
    }

    private static Object rawPayload(byte[] payload) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(payload))
                    .toString();
        } catch (CharacterCodingException e) {
            return payload.clone();
        }
    }
}
