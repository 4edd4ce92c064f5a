/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge;

/**
 * The broker connection was lost after a successful start. The bridge has already stopped when this is reported.
 */
public class BridgeTransportException extends Exception {
    private static final long serialVersionUID = 2381744912066043391L;

    public BridgeTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
