/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.NonNull;
import org.eda.mqtt.bridge.clients.MqttClientFactory;
import org.eda.mqtt.bridge.model.InvalidConfigurationException;
import org.eda.mqtt.bridge.model.RestartPolicy;
import org.eda.mqtt.bridge.util.FatalErrorHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Hosts one MQTT event source: a supervised bridge feeding a bounded queue, and a dispatcher thread handing queued
 * events, in order, to the downstream rule engine.
 */
public class EventSourceService {
    private static final Logger LOGGER = LoggerFactory.getLogger(EventSourceService.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public static final String KEY_QUEUE_CAPACITY = "queue_capacity";
    public static final int DEFAULT_QUEUE_CAPACITY = 1024;
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10L;

    @Getter
    private final BridgeConfig bridgeConfig;
    private final RestartPolicy restartPolicy;
    private final Consumer<Map<String, Object>> downstream;
    private final MqttClientFactory clientFactory;
    private final BlockingQueue<Map<String, Object>> queue;
    private final FatalErrorHandler hostErrors = new FatalErrorHandler();
    private final CountDownLatch terminated = new CountDownLatch(1);

    private ScheduledExecutorService ses;
    private BridgeSupervisor supervisor;
    private Thread dispatcher;

    /**
     * Construct an EventSourceService.
     *
     * @param bridgeConfig  connection configuration
     * @param restartPolicy restart policy after a lost connection
     * @param queueCapacity capacity of the event queue; a full queue blocks the bridge
     * @param downstream    receives every event, on the dispatcher thread
     * @param clientFactory creates broker connections
     */
    public EventSourceService(@NonNull BridgeConfig bridgeConfig,
                              @NonNull RestartPolicy restartPolicy,
                              int queueCapacity,
                              @NonNull Consumer<Map<String, Object>> downstream,
                              @NonNull MqttClientFactory clientFactory) {
        this.bridgeConfig = bridgeConfig;
        this.restartPolicy = restartPolicy;
        this.downstream = downstream;
        this.clientFactory = clientFactory;
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
    }

    /**
     * Build a service from rulebook source arguments.
     *
     * @param arguments  source arguments
     * @param downstream receives every event
     * @return service, not yet started
     * @throws InvalidConfigurationException if the arguments are invalid
     */
    public static EventSourceService fromArguments(Map<String, Object> arguments,
                                                   Consumer<Map<String, Object>> downstream)
            throws InvalidConfigurationException {
        return new EventSourceService(
                BridgeConfig.fromArguments(arguments),
                RestartPolicy.fromArguments(arguments),
                getQueueCapacity(arguments),
                downstream,
                MqttClientFactory.PAHO);
    }

    private static int getQueueCapacity(Map<String, Object> arguments) throws InvalidConfigurationException {
        Object value = arguments.get(KEY_QUEUE_CAPACITY);
        if (value == null) {
            return DEFAULT_QUEUE_CAPACITY;
        }
        Integer capacity;
        try {
            capacity = OBJECT_MAPPER.convertValue(value, Integer.class);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(KEY_QUEUE_CAPACITY,
                    "Malformed " + KEY_QUEUE_CAPACITY + ": " + value, e);
        }
        if (capacity == null) {
            throw new InvalidConfigurationException(KEY_QUEUE_CAPACITY,
                    "Malformed " + KEY_QUEUE_CAPACITY + ": " + value);
        }
        if (capacity < 1) {
            throw new InvalidConfigurationException(KEY_QUEUE_CAPACITY,
                    KEY_QUEUE_CAPACITY + " must be at least 1, got " + capacity);
        }
        return capacity;
    }

    /**
     * Start dispatching and start the bridge.
     *
     * @throws BridgeStartupException if the bridge fails to start; the service is shut down again
     */
    public synchronized void startup() throws BridgeStartupException {
        if (supervisor != null) {
            throw new IllegalStateException("Event source already started");
        }
        ses = Executors.newScheduledThreadPool(1);
        FatalErrorHandler bridgeErrors = new FatalErrorHandler();
        EventBridge bridge = new EventBridge(ses, bridgeErrors, clientFactory);
        supervisor = new BridgeSupervisor(bridge, bridgeErrors, hostErrors, restartPolicy, ses);
        hostErrors.initialize(this::onFatalError);

        dispatcher = new Thread(this::dispatch, "eda-mqtt-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();

        boolean started = false;
        try {
            supervisor.start(bridgeConfig, new QueueEventSink(queue));
            started = true;
        } catch (BridgeStartupException e) {
            LOGGER.atError().setCause(e).addKeyValue(BridgeConfig.KEY_HOST, bridgeConfig.getHost())
                    .addKeyValue(BridgeConfig.KEY_PORT, bridgeConfig.getPort())
                    .log("Unable to start event source");
            throw e;
        } finally {
            if (!started) {
                shutdown();
            }
        }
    }

    /**
     * Stop the bridge, deliver events already queued, and release threads. Idempotent.
     */
    public synchronized void shutdown() {
        if (supervisor != null) {
            supervisor.stop();
        }
        if (dispatcher != null) {
            dispatcher.interrupt();
            try {
                dispatcher.join(TimeUnit.SECONDS.toMillis(SHUTDOWN_TIMEOUT_SECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            dispatcher = null;
        }
        if (ses != null) {
            ses.shutdownNow();
        }
        terminated.countDown();
    }

    /**
     * Block until the service shuts down or the bridge fails for good.
     *
     * @param timeout timeout
     * @param unit    timeout unit
     * @return true if terminated before the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }

    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    public Optional<Exception> getFatalError() {
        return hostErrors.getFatalError();
    }

    private void onFatalError(Exception e) {
        LOGGER.atError().setCause(e).log("Event source stopped");
        terminated.countDown();
    }

    private void dispatch() {
        while (!Thread.currentThread().isInterrupted()) {
            Map<String, Object> event;
            try {
                event = queue.take();
            } catch (InterruptedException e) {
                break;
            }
            deliver(event);
        }
        List<Map<String, Object>> remaining = new ArrayList<>();
        queue.drainTo(remaining);
        remaining.forEach(this::deliver);
    }

    @SuppressWarnings("PMD.AvoidCatchingGenericException")
    private void deliver(Map<String, Object> event) {
        try {
            downstream.accept(event);
        } catch (RuntimeException e) {
            LOGGER.atError().setCause(e).log("Downstream failed to process event");
        }
    }
}
