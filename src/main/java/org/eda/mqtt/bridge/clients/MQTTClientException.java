/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge.clients;

import org.eclipse.paho.client.mqttv3.MqttException;
import org.eda.mqtt.bridge.BridgeStartupException;

public class MQTTClientException extends BridgeStartupException {
    private static final long serialVersionUID = -4212393716418291536L;

    public MQTTClientException(String message) {
        super(message);
    }

    public MQTTClientException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether the broker rejected the credentials or the client identity.
     *
     * @return true on an authentication or authorization failure
     */
    public boolean isAuthenticationFailure() {
        if (!(getCause() instanceof MqttException)) {
            return false;
        }
        int reasonCode = ((MqttException) getCause()).getReasonCode();
        return reasonCode == MqttException.REASON_CODE_FAILED_AUTHENTICATION
                || reasonCode == MqttException.REASON_CODE_NOT_AUTHORIZED;
    }
}
