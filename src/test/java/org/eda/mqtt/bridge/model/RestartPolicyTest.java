/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RestartPolicyTest {

    private static Map<String, Object> withRestart(Map<String, Object> section) {
        return Collections.singletonMap(RestartPolicy.KEY_RESTART, section);
    }

    @Test
    void GIVEN_noRestartSection_WHEN_fromArguments_THEN_disabled() throws InvalidConfigurationException {
        RestartPolicy policy = RestartPolicy.fromArguments(Collections.emptyMap());

        assertThat(policy, is(sameInstance(RestartPolicy.DISABLED)));
        assertThat(policy.isEnabled(), is(false));
    }

    @Test
    void GIVEN_emptyRestartSection_WHEN_fromArguments_THEN_enabledWithDefaults() throws InvalidConfigurationException {
        RestartPolicy policy = RestartPolicy.fromArguments(withRestart(new HashMap<>()));

        assertThat(policy.isEnabled(), is(true));
        assertEquals(1000L, policy.getMinDelayMs());
        assertEquals(30_000L, policy.getMaxDelayMs());
        assertEquals(Integer.MAX_VALUE, policy.getMaxAttempts());
    }

    @Test
    void GIVEN_fullRestartSection_WHEN_fromArguments_THEN_valuesUsed() throws InvalidConfigurationException {
        Map<String, Object> section = new HashMap<>();
        section.put(RestartPolicy.KEY_ENABLED, false);
        section.put(RestartPolicy.KEY_MIN_DELAY_MS, 200);
        section.put(RestartPolicy.KEY_MAX_DELAY_MS, 5000);
        section.put(RestartPolicy.KEY_MAX_ATTEMPTS, 3);

        RestartPolicy policy = RestartPolicy.fromArguments(withRestart(section));

        assertThat(policy.isEnabled(), is(false));
        assertEquals(200L, policy.getMinDelayMs());
        assertEquals(5000L, policy.getMaxDelayMs());
        assertEquals(3, policy.getMaxAttempts());
    }

    @Test
    void GIVEN_negativeDelay_WHEN_fromArguments_THEN_defaultUsed() throws InvalidConfigurationException {
        Map<String, Object> section = new HashMap<>();
        section.put(RestartPolicy.KEY_MIN_DELAY_MS, -10);

        RestartPolicy policy = RestartPolicy.fromArguments(withRestart(section));

        assertEquals(1000L, policy.getMinDelayMs());
    }

    @Test
    void GIVEN_maxDelayBelowMinDelay_WHEN_fromArguments_THEN_rejected() {
        Map<String, Object> section = new HashMap<>();
        section.put(RestartPolicy.KEY_MIN_DELAY_MS, 5000);
        section.put(RestartPolicy.KEY_MAX_DELAY_MS, 1000);

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
                () -> RestartPolicy.fromArguments(withRestart(section)));
        assertEquals(RestartPolicy.KEY_MAX_DELAY_MS, e.getField());
    }

    @Test
    void GIVEN_nonPositiveMaxAttempts_WHEN_fromArguments_THEN_unlimited() throws InvalidConfigurationException {
        Map<String, Object> section = new HashMap<>();
        section.put(RestartPolicy.KEY_MAX_ATTEMPTS, 0);

        RestartPolicy policy = RestartPolicy.fromArguments(withRestart(section));

        assertEquals(Integer.MAX_VALUE, policy.getMaxAttempts());
    }

    @Test
    void GIVEN_restartNotAMapping_WHEN_fromArguments_THEN_rejected() {
        Map<String, Object> arguments = Collections.singletonMap(RestartPolicy.KEY_RESTART, "always");

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
                () -> RestartPolicy.fromArguments(arguments));
        assertEquals(RestartPolicy.KEY_RESTART, e.getField());
    }

    @Test
    void GIVEN_malformedValue_WHEN_fromArguments_THEN_keyNamed() {
        Map<String, Object> section = new HashMap<>();
        section.put(RestartPolicy.KEY_MAX_ATTEMPTS, "many");

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
                () -> RestartPolicy.fromArguments(withRestart(section)));
        assertEquals(RestartPolicy.KEY_MAX_ATTEMPTS, e.getField());
    }

    @ParameterizedTest
    @ValueSource(strings = {RestartPolicy.KEY_ENABLED, RestartPolicy.KEY_MIN_DELAY_MS, RestartPolicy.KEY_MAX_DELAY_MS,
            RestartPolicy.KEY_MAX_ATTEMPTS})
    void GIVEN_blankValue_WHEN_fromArguments_THEN_keyNamed(String key) {
        Map<String, Object> section = new HashMap<>();
        section.put(key, "");

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
                () -> RestartPolicy.fromArguments(withRestart(section)));
        assertEquals(key, e.getField());
    }

    @Test
    void GIVEN_policy_WHEN_delayBeforeAttempt_THEN_doublesUpToMaximum() {
        RestartPolicy policy = RestartPolicy.builder().enabled(true).minDelayMs(100).maxDelayMs(1000).build();

        assertEquals(100L, policy.delayBeforeAttempt(0));
        assertEquals(200L, policy.delayBeforeAttempt(1));
        assertEquals(400L, policy.delayBeforeAttempt(2));
        assertEquals(800L, policy.delayBeforeAttempt(3));
        assertEquals(1000L, policy.delayBeforeAttempt(4));
        assertEquals(1000L, policy.delayBeforeAttempt(Integer.MAX_VALUE));
    }
}
