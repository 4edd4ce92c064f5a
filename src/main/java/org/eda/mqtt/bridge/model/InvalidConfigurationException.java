/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge.model;

import lombok.Getter;
import org.eda.mqtt.bridge.BridgeStartupException;

public class InvalidConfigurationException extends BridgeStartupException {
    private static final long serialVersionUID = 7493287445180371012L;

    /**
     * Name of the offending configuration key.
     */
    @Getter
    private final String field;

    public InvalidConfigurationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public InvalidConfigurationException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }
}
