/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A message received on the subscribed topic. Lives only for the duration of one dispatch.
 */
@Value
@Builder
public class MqttMessage {
    String topic;
    byte[] payload;
    int qos;
    boolean retain;

    /**
     * Convert PAHO MQTT3 message to an MqttMessage.
     *
     * @param topic   mqtt topic
     * @param message paho mqtt3 message
     * @return mqtt message
     */
    public static MqttMessage fromPahoMQTT3(@NonNull String topic,
                                            @NonNull org.eclipse.paho.client.mqttv3.MqttMessage message) {
        return MqttMessage.builder()
                .topic(topic)
                .payload(message.getPayload())
                .qos(message.getQos())
                .retain(message.isRetained())
                .build();
    }
}
