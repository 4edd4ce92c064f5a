/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.nio.file.Path;

/**
 * TLS material for the broker connection. All files are PEM encoded.
 */
@Value
@Builder(toBuilder = true)
public class TlsSettings {
    /**
     * CA certificate(s) used to verify the broker. When absent the JVM default trust store is used.
     */
    Path caCertsFile;
    Path certFile;
    Path keyFile;
    @ToString.Exclude
    String keyPassword;
    @Builder.Default
    boolean validateCerts = true;

    public boolean hasClientCertificate() {
        return certFile != null && keyFile != null;
    }
}
