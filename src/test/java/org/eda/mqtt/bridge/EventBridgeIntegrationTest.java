/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge;

import io.moquette.broker.Server;
import io.moquette.broker.config.IConfig;
import io.moquette.broker.config.MemoryConfig;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.eda.mqtt.bridge.util.TestUtils.waitFor;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;

/**
 * Runs the event source against an embedded Moquette broker.
 */
class EventBridgeIntegrationTest {

    private static final String TOPIC = "sensors/#";

    @TempDir
    Path tempDir;

    private Server broker;
    private boolean brokerRunning;
    private int brokerPort;
    private MqttClient publisher;
    private EventSourceService service;
    private final List<Map<String, Object>> received = new CopyOnWriteArrayList<>();

    @BeforeEach
    void startBroker() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            brokerPort = socket.getLocalPort();
        }
        IConfig brokerConf = new MemoryConfig(new Properties());
        brokerConf.setProperty("port", String.valueOf(brokerPort));
        brokerConf.setProperty("host", "127.0.0.1");
        brokerConf.setProperty("websocket_port", "disabled");
        brokerConf.setProperty("persistence_enabled", "false");
        brokerConf.setProperty("data_path", tempDir.toString());
        broker = new Server();
        broker.startServer(brokerConf);
        brokerRunning = true;
    }

    @AfterEach
    void tearDown() throws Exception {
        if (service != null) {
            service.shutdown();
        }
        if (publisher != null) {
            if (publisher.isConnected()) {
                publisher.disconnect();
            }
            publisher.close();
        }
        if (brokerRunning) {
            broker.stopServer();
        }
    }

    private Map<String, Object> sourceArguments() {
        Map<String, Object> arguments = new HashMap<>();
        arguments.put(BridgeConfig.KEY_HOST, "127.0.0.1");
        arguments.put(BridgeConfig.KEY_PORT, brokerPort);
        arguments.put(BridgeConfig.KEY_TOPIC, TOPIC);
        arguments.put("qos", 1);
        arguments.put("connection_timeout", 5);
        return arguments;
    }

    private void connectPublisher() throws Exception {
        publisher = new MqttClient("tcp://127.0.0.1:" + brokerPort, "eda-it-publisher", new MemoryPersistence());
        MqttConnectOptions options = new MqttConnectOptions();
        options.setCleanSession(true);
        publisher.connect(options);
    }

    private void publish(String topic, String payload) throws Exception {
        publisher.publish(topic, payload.getBytes(StandardCharsets.UTF_8), 1, false);
    }

    private static Map<String, Object> eventOf(String key, Object value) {
        return Collections.singletonMap(key, value);
    }

    @Test
    void GIVEN_runningEventSource_WHEN_messagesPublished_THEN_normalizedEventsDeliveredInOrder() throws Exception {
        service = EventSourceService.fromArguments(sourceArguments(), received::add);
        service.startup();
        connectPublisher();

        publish("sensors/a/temp", "{\"temp\": 21.5, \"unit\": \"C\"}");
        publish("sensors/a/status", "ERROR: sensor offline");
        publish("sensors/a/status", "");
        publish("other/topic", "{\"ignored\": true}");
        publish("sensors/b/temp", "{\"temp\": 19}");

        waitFor(() -> received.size() >= 4, 10_000);
        Map<String, Object> first = new HashMap<>();
        first.put("temp", 21.5);
        first.put("unit", "C");
        assertThat(received.get(0), equalTo(first));
        assertThat(received.get(1), equalTo(eventOf("payload", "ERROR: sensor offline")));
        assertThat(received.get(2), equalTo(eventOf("payload", "")));
        assertThat(received.get(3), equalTo(eventOf("temp", 19)));

        service.shutdown();
        publish("sensors/a/temp", "{\"temp\": 30}");
        Thread.sleep(200);
        assertThat(received.size(), is(4));
    }

    @Test
    void GIVEN_runningEventSource_WHEN_brokerGoesAway_THEN_serviceTerminatesWithTransportError() throws Exception {
        service = EventSourceService.fromArguments(sourceArguments(), received::add);
        service.startup();

        broker.stopServer();
        brokerRunning = false;

        assertThat(service.awaitTermination(10, TimeUnit.SECONDS), is(true));
        assertThat(service.getFatalError().isPresent(), is(true));
        assertThat(service.getFatalError().get(), instanceOf(BridgeTransportException.class));
    }

    @Test
    void GIVEN_stoppedEventSource_WHEN_startedAgainWithSameClientId_THEN_eventsFlow() throws Exception {
        Map<String, Object> arguments = sourceArguments();
        arguments.put(BridgeConfig.KEY_CLIENT_ID, "eda-it-restart");
        service = EventSourceService.fromArguments(arguments, received::add);
        service.startup();
        service.shutdown();

        service = EventSourceService.fromArguments(arguments, received::add);
        service.startup();
        connectPublisher();
        publish("sensors/a", "{\"round\": 2}");

        waitFor(() -> received.size() == 1, 10_000);
        assertThat(received.get(0), equalTo(eventOf("round", 2)));
    }
}
