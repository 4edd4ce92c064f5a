/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge.clients;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Value;
import org.eclipse.paho.client.mqttv3.IMqttClient;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eda.mqtt.bridge.BridgeConfig;
import org.eda.mqtt.bridge.auth.MQTTClientKeyStore;
import org.eda.mqtt.bridge.model.Credentials;
import org.eda.mqtt.bridge.model.InvalidConfigurationException;
import org.eda.mqtt.bridge.model.MqttMessage;
import org.eda.mqtt.bridge.model.TlsSettings;
import org.eda.mqtt.bridge.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.security.KeyStoreException;
import java.util.function.Consumer;

/**
 * Owns one Paho connection handle for the lifetime of a single connect/close cycle.
 * Connects and subscribes synchronously and never reconnects on its own.
 */
public class MQTTClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(MQTTClient.class);

    public static final String TOPIC = "topic";
    private static final long DISCONNECT_QUIESCE_TIMEOUT_MS = 1000L;
    private static final int MAX_INFLIGHT = 1000;

    @Getter
    private final Config config;
    private final MQTTClientKeyStore mqttClientKeyStore;
    private final MqttClientFactory clientFactory;
    @Getter(AccessLevel.PACKAGE) // for testing
    private volatile IMqttClient mqttClientInternal;
    private String subscribedTopic;

    @Value
    @Builder(toBuilder = true)
    public static class Config {
        URI brokerUri;
        String clientId;
        int keepAliveSeconds;
        int connectionTimeoutSeconds;
        Credentials credentials;
        TlsSettings tls;

        /**
         * Map from bridge configuration to client configuration.
         *
         * @param bridgeConfig source configuration
         * @return client configuration
         * @throws InvalidConfigurationException if the broker URI cannot be formed
         */
        public static Config fromBridgeConfig(BridgeConfig bridgeConfig) throws InvalidConfigurationException {
            return Config.builder()
                    .brokerUri(bridgeConfig.getBrokerUri())
                    .clientId(bridgeConfig.getClientId())
                    .keepAliveSeconds(bridgeConfig.getKeepAliveSeconds())
                    .connectionTimeoutSeconds(bridgeConfig.getConnectionTimeoutSeconds())
                    .credentials(bridgeConfig.getCredentials())
                    .tls(bridgeConfig.getTls())
                    .build();
        }

        public boolean isSSL() {
            return "ssl".equalsIgnoreCase(brokerUri.getScheme());
        }
    }

    /**
     * Construct an MQTTClient.
     *
     * @param config             client configuration
     * @param mqttClientKeyStore TLS material, used only for ssl brokers
     * @param clientFactory      creates the underlying Paho client
     */
    public MQTTClient(@NonNull Config config,
                      @NonNull MQTTClientKeyStore mqttClientKeyStore,
                      @NonNull MqttClientFactory clientFactory) {
        this.config = config;
        this.mqttClientKeyStore = mqttClientKeyStore;
        this.clientFactory = clientFactory;
    }

    /**
     * Create the connection handle and connect to the broker.
     *
     * @param messageHandler        called on the transport thread for every message, in receipt order
     * @param connectionLostHandler called on the transport thread when an established connection drops
     * @throws MQTTClientException if the broker cannot be reached or rejects the connection.
     *                             The handle is released before this is thrown.
     */
    @SuppressWarnings("PMD.CloseResource")
    public void connect(@NonNull Consumer<MqttMessage> messageHandler,
                        @NonNull Consumer<Throwable> connectionLostHandler) throws MQTTClientException {
        if (mqttClientInternal != null) {
            throw new IllegalStateException("Client already connected");
        }
        IMqttClient client;
        try {
            client = clientFactory.create(config.getBrokerUri().toString(), config.getClientId());
        } catch (MqttException e) {
            throw new MQTTClientException("Unable to create MQTT client", e);
        }
        client.setCallback(new MqttCallback() {
            @Override
            public void connectionLost(Throwable cause) {
                LOGGER.atWarn().setCause(cause)
                        .addKeyValue(BridgeConfig.KEY_BROKER_URI, config.getBrokerUri())
                        .log("MQTT connection lost");
                connectionLostHandler.accept(cause);
            }

            @Override
            public void messageArrived(String topic, org.eclipse.paho.client.mqttv3.MqttMessage message) {
                LOGGER.atTrace().addKeyValue(TOPIC, topic).log("Received MQTT message");
                messageHandler.accept(MqttMessage.fromPahoMQTT3(topic, message));
            }

            @Override
            public void deliveryComplete(IMqttDeliveryToken token) {
            }
        });
        mqttClientInternal = client;

        LOGGER.atInfo()
                .addKeyValue(BridgeConfig.KEY_BROKER_URI, config.getBrokerUri())
                .addKeyValue(BridgeConfig.KEY_CLIENT_ID, config.getClientId())
                .log("Connecting to broker");
        try {
            client.connect(getConnectionOptions());
        } catch (MqttException e) {
            close();
            if (Utils.getUltimateCause(e) instanceof InterruptedException) {
                // paho doesn't reset the interrupt flag
                Thread.currentThread().interrupt();
            }
            throw new MQTTClientException("Unable to connect to broker " + config.getBrokerUri()
                    + " (reason code " + e.getReasonCode() + ")", e);
        } catch (KeyStoreException e) {
            close();
            throw new MQTTClientException("Unable to set up TLS for broker " + config.getBrokerUri(), e);
        }
        LOGGER.atInfo()
                .addKeyValue(BridgeConfig.KEY_BROKER_URI, config.getBrokerUri())
                .addKeyValue(BridgeConfig.KEY_CLIENT_ID, config.getClientId())
                .log("Connected to broker");
    }

    /**
     * Subscribe to a single topic filter.
     *
     * @param topic topic filter
     * @param qos   requested quality of service
     * @throws MQTTClientException if the broker rejects the subscription
     */
    public void subscribe(@NonNull String topic, int qos) throws MQTTClientException {
        IMqttClient client = mqttClientInternal;
        if (client == null) {
            throw new MQTTClientException("Unable to subscribe, client not connected");
        }
        try {
            client.subscribe(topic, qos);
        } catch (MqttException e) {
            throw new MQTTClientException("Unable to subscribe to " + topic
                    + " (reason code " + e.getReasonCode() + ")", e);
        }
        subscribedTopic = topic;
        LOGGER.atInfo().addKeyValue(TOPIC, topic).addKeyValue("qos", qos).log("Subscribed to topic");
    }

    public boolean isConnected() {
        IMqttClient client = mqttClientInternal;
        return client != null && client.isConnected();
    }

    /**
     * Unsubscribe, disconnect and release the connection handle. Safe to call repeatedly.
     */
    @SuppressWarnings("PMD.CloseResource")
    public void close() {
        IMqttClient client = mqttClientInternal;
        if (client == null) {
            return;
        }
        mqttClientInternal = null;
        // clear callbacks so nothing is delivered while disconnecting
        client.setCallback(null);

        if (client.isConnected()) {
            String topic = subscribedTopic;
            if (topic != null) {
                try {
                    client.unsubscribe(topic);
                    LOGGER.atDebug().addKeyValue(TOPIC, topic).log("Unsubscribed from topic");
                } catch (MqttException e) {
                    LOGGER.atWarn().setCause(e).addKeyValue(TOPIC, topic).log("Unable to unsubscribe");
                }
            }
            try {
                client.disconnect(DISCONNECT_QUIESCE_TIMEOUT_MS);
            } catch (MqttException e) {
                if (MqttException.REASON_CODE_CLIENT_ALREADY_DISCONNECTED != e.getReasonCode()
                        && MqttException.REASON_CODE_CLIENT_CLOSED != e.getReasonCode()) {
                    LOGGER.atWarn().setCause(e).log("Unable to disconnect, forcing disconnect");
                    disconnectForcibly(client);
                }
            }
        }
        subscribedTopic = null;

        try {
            client.close();
        } catch (MqttException e) {
            LOGGER.atWarn().setCause(e).log("Unable to close MQTT client");
        }
        LOGGER.atDebug().addKeyValue(BridgeConfig.KEY_BROKER_URI, config.getBrokerUri())
                .log("MQTT client closed");
    }

    private void disconnectForcibly(IMqttClient client) {
        try {
            // 0ms quiescence time, don't wait for DISCONNECT
            client.disconnectForcibly(0, 1L);
        } catch (MqttException e) {
            LOGGER.atWarn().setCause(e).log("Unable to disconnect forcibly");
        }
    }

    private MqttConnectOptions getConnectionOptions() throws KeyStoreException {
        MqttConnectOptions connOpts = new MqttConnectOptions();
        connOpts.setCleanSession(true);
        connOpts.setAutomaticReconnect(false);
        connOpts.setMaxInflight(MAX_INFLIGHT);
        connOpts.setKeepAliveInterval(config.getKeepAliveSeconds());
        connOpts.setConnectionTimeout(config.getConnectionTimeoutSeconds());

        Credentials credentials = config.getCredentials();
        if (credentials != null) {
            connOpts.setUserName(credentials.getUsername());
            connOpts.setPassword(credentials.passwordChars());
        }

        if (config.isSSL()) {
            TlsSettings tls = config.getTls();
            boolean validateCerts = tls == null || tls.isValidateCerts();
            connOpts.setSocketFactory(mqttClientKeyStore.getSSLSocketFactory(validateCerts));
            connOpts.setHttpsHostnameVerificationEnabled(validateCerts);
        }

        return connOpts;
    }
}
