/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge.util;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Hands a terminal error from a long-running component to whoever owns it.
 */
public class FatalErrorHandler {

    private final AtomicReference<Exception> fatalError = new AtomicReference<>();
    private volatile Consumer<Exception> callback;

    public void initialize(Consumer<Exception> callback) {
        this.fatalError.set(null);
        this.callback = callback;
    }

    public Optional<Exception> getFatalError() {
        return Optional.ofNullable(fatalError.get());
    }

    /**
     * Record the error and notify the owner, if one is registered.
     *
     * @param e terminal error
     */
    public void fatalError(Exception e) {
        fatalError.set(e);
        Consumer<Exception> callback = this.callback;
        if (callback != null) {
            callback.accept(e);
        }
    }
}
