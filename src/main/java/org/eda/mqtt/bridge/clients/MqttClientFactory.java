/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge.clients;

import org.eclipse.paho.client.mqttv3.IMqttClient;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;

@FunctionalInterface
public interface MqttClientFactory {
    MqttClientFactory PAHO = (serverUri, clientId) -> new MqttClient(serverUri, clientId, new MemoryPersistence());

    IMqttClient create(String serverUri, String clientId) throws MqttException;
}
