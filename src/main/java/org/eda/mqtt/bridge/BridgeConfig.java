/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.eclipse.paho.client.mqttv3.MqttTopic;
import org.eda.mqtt.bridge.model.Credentials;
import org.eda.mqtt.bridge.model.InvalidConfigurationException;
import org.eda.mqtt.bridge.model.TlsSettings;
import org.eda.mqtt.bridge.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Connection configuration of one MQTT event source, as written in the source arguments of a rulebook.
 * Immutable once built.
 */
@Getter
@ToString
@EqualsAndHashCode
@Builder(toBuilder = true)
@RequiredArgsConstructor
public final class BridgeConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(BridgeConfig.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final String INVALID_CONFIG_LOG_FORMAT_STRING = "Provided {} out of range. Defaulting to {}";

    public static final String KEY_HOST = "host";
    public static final String KEY_PORT = "port";
    public static final String KEY_TOPIC = "topic";
    public static final String KEY_CLIENT_ID = "client_id";
    public static final String KEY_BROKER_URI = "broker_uri";
    static final String KEY_USERNAME = "username";
    static final String KEY_PASSWORD = "password";
    static final String KEY_QOS = "qos";
    static final String KEY_KEEP_ALIVE = "keep_alive";
    static final String KEY_CONNECTION_TIMEOUT = "connection_timeout";
    static final String KEY_TLS = "tls";
    static final String KEY_CA_CERTS = "ca_certs";
    static final String KEY_CERTFILE = "certfile";
    static final String KEY_KEYFILE = "keyfile";
    static final String KEY_KEYFILE_PASSWORD = "keyfile_password";
    static final String KEY_VALIDATE_CERTS = "validate_certs";

    private static final int MIN_PORT = 1;
    private static final int MAX_PORT = 65_535;
    private static final int MIN_QOS = 0;
    private static final int MAX_QOS = 2;

    static final int DEFAULT_PORT = 1883;
    static final int DEFAULT_QOS = 0;
    static final int DEFAULT_KEEP_ALIVE_SECONDS = 60;
    static final int DEFAULT_CONNECTION_TIMEOUT_SECONDS = 30;
    static final String DEFAULT_CLIENT_ID_PREFIX = "eda-mqtt-";

    private final String host;
    private final int port;
    private final String topic;
    private final String clientId;
    private final int qos;
    private final int keepAliveSeconds;
    private final int connectionTimeoutSeconds;
    private final Credentials credentials;
    private final TlsSettings tls;

    /**
     * Create a BridgeConfig from the source arguments of a rulebook.
     *
     * @param arguments source arguments
     * @return validated bridge config
     * @throws InvalidConfigurationException if a required key is missing or a value is out of range
     */
    public static BridgeConfig fromArguments(Map<String, Object> arguments) throws InvalidConfigurationException {
        BridgeConfig config = BridgeConfig.builder()
                .host(getString(arguments, KEY_HOST))
                .port(getInt(arguments, KEY_PORT, DEFAULT_PORT))
                .topic(getString(arguments, KEY_TOPIC))
                .clientId(getClientId(arguments))
                .qos(getInt(arguments, KEY_QOS, DEFAULT_QOS))
                .keepAliveSeconds(getNonNegative(arguments, KEY_KEEP_ALIVE, DEFAULT_KEEP_ALIVE_SECONDS))
                .connectionTimeoutSeconds(
                        getNonNegative(arguments, KEY_CONNECTION_TIMEOUT, DEFAULT_CONNECTION_TIMEOUT_SECONDS))
                .credentials(getCredentials(arguments))
                .tls(getTlsSettings(arguments))
                .build();
        config.validate();
        return config;
    }

    /**
     * Check the constraints a connection attempt relies on.
     *
     * @throws InvalidConfigurationException naming the first invalid field
     */
    public void validate() throws InvalidConfigurationException {
        if (Utils.isEmpty(host)) {
            throw new InvalidConfigurationException(KEY_HOST, KEY_HOST + " must not be empty");
        }
        if (port < MIN_PORT || port > MAX_PORT) {
            throw new InvalidConfigurationException(KEY_PORT,
                    String.format("%s must be between %d and %d, got %d", KEY_PORT, MIN_PORT, MAX_PORT, port));
        }
        if (Utils.isEmpty(topic)) {
            throw new InvalidConfigurationException(KEY_TOPIC, KEY_TOPIC + " must not be empty");
        }
        try {
            MqttTopic.validate(topic, true);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(KEY_TOPIC, "Malformed " + KEY_TOPIC + ": " + topic, e);
        }
        if (qos < MIN_QOS || qos > MAX_QOS) {
            throw new InvalidConfigurationException(KEY_QOS,
                    String.format("%s must be between %d and %d, got %d", KEY_QOS, MIN_QOS, MAX_QOS, qos));
        }
        if (Utils.isEmpty(clientId)) {
            throw new InvalidConfigurationException(KEY_CLIENT_ID, KEY_CLIENT_ID + " must not be empty");
        }
        getBrokerUri();
    }

    /**
     * Broker URI derived from host, port and whether TLS is configured.
     *
     * @return {@code ssl://host:port} or {@code tcp://host:port}
     * @throws InvalidConfigurationException if the host cannot form a URI
     */
    public URI getBrokerUri() throws InvalidConfigurationException {
        String scheme = isTls() ? "ssl" : "tcp";
        try {
            return new URI(scheme, null, host, port, null, null, null);
        } catch (URISyntaxException e) {
            throw new InvalidConfigurationException(KEY_HOST, "Malformed " + KEY_HOST + ": " + host, e);
        }
    }

    public boolean isTls() {
        return tls != null;
    }

    private static String getString(Map<String, Object> arguments, String key) throws InvalidConfigurationException {
        Object value = arguments.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Map || value instanceof Iterable) {
            throw new InvalidConfigurationException(key, "Malformed " + key + ", expected a string");
        }
        return String.valueOf(value);
    }

    private static int getInt(Map<String, Object> arguments, String key, int dflt)
            throws InvalidConfigurationException {
        Object value = arguments.get(key);
        if (value == null) {
            return dflt;
        }
        return convert(key, value, Integer.class);
    }

    private static int getNonNegative(Map<String, Object> arguments, String key, int dflt)
            throws InvalidConfigurationException {
        int value = getInt(arguments, key, dflt);
        if (value < 0) {
            LOGGER.atWarn().addKeyValue(key, value).log(INVALID_CONFIG_LOG_FORMAT_STRING, key, dflt);
            return dflt;
        }
        return value;
    }

    private static boolean getBoolean(Map<String, Object> arguments, String key, boolean dflt)
            throws InvalidConfigurationException {
        Object value = arguments.get(key);
        if (value == null) {
            return dflt;
        }
        return convert(key, value, Boolean.class);
    }

    private static <T> T convert(String key, Object value, Class<T> type) throws InvalidConfigurationException {
        T converted;
        try {
            converted = OBJECT_MAPPER.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(key, "Malformed " + key + ": " + value, e);
        }
        // jackson maps blank strings to null
        if (converted == null) {
            throw new InvalidConfigurationException(key, "Malformed " + key + ": " + value);
        }
        return converted;
    }

    private static Path getPath(Map<String, Object> arguments, String key) throws InvalidConfigurationException {
        String value = getString(arguments, key);
        if (Utils.isEmpty(value)) {
            return null;
        }
        try {
            return Paths.get(value);
        } catch (InvalidPathException e) {
            throw new InvalidConfigurationException(key, "Malformed " + key + ": " + value, e);
        }
    }

    private static String getClientId(Map<String, Object> arguments) throws InvalidConfigurationException {
        String clientId = getString(arguments, KEY_CLIENT_ID);
        if (clientId == null) {
            return DEFAULT_CLIENT_ID_PREFIX + Utils.generateRandomString(11);
        }
        return clientId;
    }

    private static Credentials getCredentials(Map<String, Object> arguments) throws InvalidConfigurationException {
        String username = getString(arguments, KEY_USERNAME);
        String password = getString(arguments, KEY_PASSWORD);
        if (Utils.isEmpty(username)) {
            if (password != null) {
                throw new InvalidConfigurationException(KEY_USERNAME,
                        KEY_PASSWORD + " is set but " + KEY_USERNAME + " is missing");
            }
            return null;
        }
        return Credentials.builder().username(username).password(password).build();
    }

    private static TlsSettings getTlsSettings(Map<String, Object> arguments) throws InvalidConfigurationException {
        Path caCerts = getPath(arguments, KEY_CA_CERTS);
        Path certFile = getPath(arguments, KEY_CERTFILE);
        Path keyFile = getPath(arguments, KEY_KEYFILE);
        boolean tls = getBoolean(arguments, KEY_TLS, caCerts != null || certFile != null || keyFile != null);
        if (!tls) {
            return null;
        }
        if (certFile != null && keyFile == null) {
            throw new InvalidConfigurationException(KEY_KEYFILE,
                    KEY_CERTFILE + " is set but " + KEY_KEYFILE + " is missing");
        }
        if (keyFile != null && certFile == null) {
            throw new InvalidConfigurationException(KEY_CERTFILE,
                    KEY_KEYFILE + " is set but " + KEY_CERTFILE + " is missing");
        }
        return TlsSettings.builder()
                .caCertsFile(caCerts)
                .certFile(certFile)
                .keyFile(keyFile)
                .keyPassword(getString(arguments, KEY_KEYFILE_PASSWORD))
                .validateCerts(getBoolean(arguments, KEY_VALIDATE_CERTS, true))
                .build();
    }
}
