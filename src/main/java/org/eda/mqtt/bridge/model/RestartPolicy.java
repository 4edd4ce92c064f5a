/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * How a host restarts the bridge after the broker connection drops. Disabled unless configured.
 */
@Value
@Builder(toBuilder = true)
public class RestartPolicy {
    private static final Logger LOGGER = LoggerFactory.getLogger(RestartPolicy.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final String INVALID_CONFIG_LOG_FORMAT_STRING = "Provided {} out of range. Defaulting to {}";

    public static final String KEY_RESTART = "restart";
    static final String KEY_ENABLED = "enabled";
    static final String KEY_MIN_DELAY_MS = "min_delay_ms";
    static final String KEY_MAX_DELAY_MS = "max_delay_ms";
    static final String KEY_MAX_ATTEMPTS = "max_attempts";

    private static final long DEFAULT_MIN_DELAY_MS = Duration.ofSeconds(1).toMillis();
    private static final long DEFAULT_MAX_DELAY_MS = Duration.ofSeconds(30).toMillis();
    private static final int UNLIMITED_ATTEMPTS = Integer.MAX_VALUE;

    public static final RestartPolicy DISABLED = RestartPolicy.builder().build();

    boolean enabled;
    @Builder.Default
    long minDelayMs = DEFAULT_MIN_DELAY_MS;
    @Builder.Default
    long maxDelayMs = DEFAULT_MAX_DELAY_MS;
    @Builder.Default
    int maxAttempts = UNLIMITED_ATTEMPTS;

    /**
     * Delay before the given restart attempt, doubling from the minimum up to the maximum delay.
     *
     * @param attempt zero-based attempt number
     * @return delay in milliseconds
     */
    public long delayBeforeAttempt(int attempt) {
        long delay = minDelayMs;
        for (int i = 0; i < attempt && delay > 0 && delay < maxDelayMs; i++) {
            delay *= 2;
        }
        return Math.min(delay, maxDelayMs);
    }

    /**
     * Read the restart policy from the {@code restart} section of the source arguments.
     *
     * @param arguments source arguments
     * @return restart policy, {@link #DISABLED} when the section is absent
     * @throws InvalidConfigurationException if the section is malformed
     */
    @SuppressWarnings("unchecked")
    public static RestartPolicy fromArguments(Map<String, Object> arguments) throws InvalidConfigurationException {
        Object section = arguments.get(KEY_RESTART);
        if (section == null) {
            return DISABLED;
        }
        if (!(section instanceof Map)) {
            throw new InvalidConfigurationException(KEY_RESTART, "Malformed " + KEY_RESTART + ", expected a mapping");
        }
        Map<String, Object> restart = (Map<String, Object>) section;

        long minDelayMs = getDelay(restart, KEY_MIN_DELAY_MS, DEFAULT_MIN_DELAY_MS);
        long maxDelayMs = getDelay(restart, KEY_MAX_DELAY_MS, DEFAULT_MAX_DELAY_MS);
        if (maxDelayMs < minDelayMs) {
            throw new InvalidConfigurationException(KEY_MAX_DELAY_MS,
                    KEY_MAX_DELAY_MS + " must be greater than or equal to " + KEY_MIN_DELAY_MS);
        }
        int maxAttempts = convert(restart, KEY_MAX_ATTEMPTS, Integer.class, UNLIMITED_ATTEMPTS);
        if (maxAttempts <= 0) {
            maxAttempts = UNLIMITED_ATTEMPTS;
        }

        return RestartPolicy.builder()
                .enabled(convert(restart, KEY_ENABLED, Boolean.class, Boolean.TRUE))
                .minDelayMs(minDelayMs)
                .maxDelayMs(maxDelayMs)
                .maxAttempts(maxAttempts)
                .build();
    }

    private static long getDelay(Map<String, Object> restart, String key, long dflt)
            throws InvalidConfigurationException {
        long delay = convert(restart, key, Long.class, dflt);
        if (delay < 0) {
            LOGGER.atWarn().addKeyValue(key, delay).log(INVALID_CONFIG_LOG_FORMAT_STRING, key, dflt);
            return dflt;
        }
        return delay;
    }

    private static <T> T convert(Map<String, Object> section, String key, Class<T> type, T dflt)
            throws InvalidConfigurationException {
        Object value = section.getOrDefault(key, dflt);
        if (value == null) {
            return dflt;
        }
        T converted;
        try {
            converted = OBJECT_MAPPER.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(key, "Malformed " + KEY_RESTART + "." + key + ": " + value, e);
        }
        // jackson maps blank strings to null
        if (converted == null) {
            throw new InvalidConfigurationException(key, "Malformed " + KEY_RESTART + "." + key + ": " + value);
        }
        return converted;
    }
}
