/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Username and password passed through to the broker on connect.
 */
@Value
@Builder
public class Credentials {
    @NonNull
    String username;
    @ToString.Exclude
    String password;

    public char[] passwordChars() {
        return password == null ? new char[0] : password.toCharArray();
    }
}
