/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge;

/**
 * The bridge could not be started: invalid configuration, or the broker refused the connection or subscription.
 * Never retried by the bridge itself.
 */
public class BridgeStartupException extends Exception {
    private static final long serialVersionUID = -6141259781409626243L;

    public BridgeStartupException(String message) {
        super(message);
    }

    public BridgeStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
