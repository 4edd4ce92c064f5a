/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge;

import lombok.NonNull;
import org.eda.mqtt.bridge.auth.MQTTClientKeyStore;
import org.eda.mqtt.bridge.clients.MQTTClient;
import org.eda.mqtt.bridge.clients.MQTTClientException;
import org.eda.mqtt.bridge.clients.MqttClientFactory;
import org.eda.mqtt.bridge.model.MqttMessage;
import org.eda.mqtt.bridge.util.FatalErrorHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.KeyStoreException;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Subscribes to one MQTT topic and emits one normalized event per inbound message, in receipt order.
 *
 * <p>Lifecycle: {@code IDLE -> CONNECTING -> SUBSCRIBED -> STOPPING -> IDLE}. A failed start goes straight back to
 * {@code IDLE}. A connection lost after start tears the bridge down to {@code IDLE} and is then reported through
 * the {@link FatalErrorHandler}; the bridge does not reconnect. A stopped bridge may be started again.
 */
public class EventBridge {
    private static final Logger LOGGER = LoggerFactory.getLogger(EventBridge.class);
    private static final String KV_TOPIC = "topic";
    static final long EMIT_DRAIN_TIMEOUT_MS = TimeUnit.SECONDS.toMillis(5);

    public enum State {
        /**
         * Not started, or fully stopped. No connection is held.
         */
        IDLE,
        /**
         * Connection and subscription in progress.
         */
        CONNECTING,
        /**
         * Subscribed and emitting events.
         */
        SUBSCRIBED,
        /**
         * Releasing the connection. No further events are emitted.
         */
        STOPPING
    }

    private final Executor executor;
    private final FatalErrorHandler fatalErrorHandler;
    private final MqttClientFactory clientFactory;
    private final EventNormalizer normalizer = new EventNormalizer();
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final Object lifecycleLock = new Object();
    private final Object emitLock = new Object();

    // guarded by lifecycleLock
    private MQTTClient client;
    private volatile BridgeConfig config;
    private volatile EventSink sink;
    // guarded by emitLock
    private Thread emittingThread;

    /**
     * Construct an EventBridge backed by Paho.
     *
     * @param executor          runs teardown after a lost connection, off the transport thread
     * @param fatalErrorHandler receives transport failures after start
     */
    public EventBridge(Executor executor, FatalErrorHandler fatalErrorHandler) {
        this(executor, fatalErrorHandler, MqttClientFactory.PAHO);
    }

    /**
     * Construct an EventBridge.
     *
     * @param executor          runs teardown after a lost connection, off the transport thread
     * @param fatalErrorHandler receives transport failures after start
     * @param clientFactory     creates the connection handle on every start
     */
    public EventBridge(@NonNull Executor executor,
                       @NonNull FatalErrorHandler fatalErrorHandler,
                       @NonNull MqttClientFactory clientFactory) {
        this.executor = executor;
        this.fatalErrorHandler = fatalErrorHandler;
        this.clientFactory = clientFactory;
    }

    public State getState() {
        return state.get();
    }

    public BridgeConfig getConfig() {
        return config;
    }

    /**
     * Connect, subscribe to the configured topic, and start emitting events to the sink.
     * Returns once subscribed; events are delivered on the transport thread until {@link #stop()}.
     *
     * @param config connection configuration
     * @param sink   receives every normalized event
     * @throws BridgeStartupException if the configuration is invalid (checked before any connection attempt),
     *                                or the broker cannot be reached, rejects the credentials or the subscription
     * @throws IllegalStateException  if the bridge is not idle
     */
    public void start(@NonNull BridgeConfig config, @NonNull EventSink sink) throws BridgeStartupException {
        config.validate();

        synchronized (lifecycleLock) {
            if (!state.compareAndSet(State.IDLE, State.CONNECTING)) {
                throw new IllegalStateException("Event bridge already started, state is " + state.get());
            }
            this.config = config;
            this.sink = sink;

            MQTTClient newClient = null;
            boolean started = false;
            try {
                newClient = new MQTTClient(MQTTClient.Config.fromBridgeConfig(config), loadKeyStore(config),
                        clientFactory);
                MQTTClient connecting = newClient;
                newClient.connect(this::onMessage, cause -> onConnectionLost(connecting, cause));
                client = newClient;
                newClient.subscribe(config.getTopic(), config.getQos());
                state.set(State.SUBSCRIBED);
                started = true;
            } finally {
                if (!started) {
                    if (newClient != null) {
                        newClient.close();
                    }
                    client = null;
                    this.sink = null;
                    state.set(State.IDLE);
                }
            }
        }
        LOGGER.atInfo().addKeyValue(KV_TOPIC, config.getTopic())
                .addKeyValue(BridgeConfig.KEY_CLIENT_ID, config.getClientId())
                .log("Event bridge started");
    }

    /**
     * Unsubscribe and release the connection. No event is emitted after this returns.
     * Safe to call when not started or already stopped.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!state.compareAndSet(State.SUBSCRIBED, State.STOPPING)) {
                return;
            }
            LOGGER.atInfo().addKeyValue(KV_TOPIC, config.getTopic()).log("Stopping event bridge");
            teardown();
        }
        LOGGER.atInfo().log("Event bridge stopped");
    }

    private static MQTTClientKeyStore loadKeyStore(BridgeConfig config) throws MQTTClientException {
        MQTTClientKeyStore keyStore = new MQTTClientKeyStore();
        if (!config.isTls()) {
            return keyStore;
        }
        try {
            keyStore.init(config.getTls());
        } catch (KeyStoreException e) {
            throw new MQTTClientException("Unable to load TLS material", e);
        }
        return keyStore;
    }

    private boolean isAcceptingMessages() {
        State current = state.get();
        return current == State.CONNECTING || current == State.SUBSCRIBED;
    }

    private void onMessage(MqttMessage message) {
        Map<String, Object> event = normalizer.normalize(message);

        EventSink target;
        synchronized (emitLock) {
            if (!isAcceptingMessages()) {
                LOGGER.atDebug().addKeyValue(KV_TOPIC, message.getTopic())
                        .log("Event bridge is stopping, message not emitted");
                return;
            }
            target = sink;
            emittingThread = Thread.currentThread();
        }
        try {
            target.emit(event);
        } catch (InterruptedException e) {
            LOGGER.atDebug().addKeyValue(KV_TOPIC, message.getTopic())
                    .log("Interrupted while emitting event, event bridge is stopping");
            Thread.currentThread().interrupt();
        } finally {
            synchronized (emitLock) {
                emittingThread = null;
                emitLock.notifyAll();
            }
        }
    }

    private void onConnectionLost(MQTTClient lostClient, Throwable cause) {
        try {
            executor.execute(() -> handleConnectionLost(lostClient, cause));
        } catch (RejectedExecutionException e) {
            LOGGER.atWarn().setCause(e).log("Unable to schedule teardown after connection loss");
        }
    }

    private void handleConnectionLost(MQTTClient lostClient, Throwable cause) {
        BridgeConfig lostConfig;
        synchronized (lifecycleLock) {
            // a stop, or a stop and restart, may have happened since the loss was reported
            if (client != lostClient || !state.compareAndSet(State.SUBSCRIBED, State.STOPPING)) {
                return;
            }
            lostConfig = config;
            teardown();
        }
        LOGGER.atWarn().addKeyValue(KV_TOPIC, lostConfig.getTopic())
                .log("Event bridge stopped after losing the broker connection");
        fatalErrorHandler.fatalError(new BridgeTransportException(
                "Connection to broker " + lostConfig.getHost() + ":" + lostConfig.getPort() + " lost", cause));
    }

    // caller holds lifecycleLock and has moved the state to STOPPING
    private void teardown() {
        awaitInFlightEmit();
        if (client != null) {
            client.close();
            client = null;
        }
        sink = null;
        state.set(State.IDLE);
    }

    private void awaitInFlightEmit() {
        boolean interrupted = false;
        synchronized (emitLock) {
            Thread emitter = emittingThread;
            if (emitter == null || emitter == Thread.currentThread()) {
                return;
            }
            emitter.interrupt();

            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(EMIT_DRAIN_TIMEOUT_MS);
            while (emittingThread != null) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    LOGGER.atWarn().addKeyValue("timeoutMs", EMIT_DRAIN_TIMEOUT_MS)
                            .log("Event sink did not return in time, releasing connection anyway");
                    break;
                }
                try {
                    TimeUnit.NANOSECONDS.timedWait(emitLock, remaining);
                } catch (InterruptedException e) {
                    interrupted = true;
                    break;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
