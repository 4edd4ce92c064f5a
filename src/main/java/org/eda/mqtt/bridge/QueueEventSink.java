/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge;

import lombok.Getter;
import lombok.NonNull;

import java.util.Map;
import java.util.concurrent.BlockingQueue;

/**
 * Producer end of a host queue. Blocks while a bounded queue is full.
 */
public class QueueEventSink implements EventSink {
    @Getter
    private final BlockingQueue<Map<String, Object>> queue;

    public QueueEventSink(@NonNull BlockingQueue<Map<String, Object>> queue) {
        this.queue = queue;
    }

    @Override
    public void emit(Map<String, Object> event) throws InterruptedException {
        queue.put(event);
    }
}
