/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge;

import java.util.Map;

/**
 * Receives normalized events from the bridge, one call per inbound message, in receipt order.
 *
 * <p>{@link #emit} is called on the transport's delivery thread and the next message is not processed until it
 * returns, so a sink that blocks applies backpressure to the broker. Ownership of the event passes to the sink.
 * A sink must not drop events. A runtime exception thrown by the sink drops the broker connection, which the
 * host then sees as a transport failure.
 */
@FunctionalInterface
public interface EventSink {

    /**
     * Accept one event, blocking until it has been taken over.
     *
     * @param event normalized event
     * @throws InterruptedException if interrupted while waiting; the event was not accepted
     */
    void emit(Map<String, Object> event) throws InterruptedException;
}
