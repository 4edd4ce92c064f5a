/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge;

import lombok.NonNull;
import org.eda.mqtt.bridge.model.RestartPolicy;
import org.eda.mqtt.bridge.util.FatalErrorHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Restarts an {@link EventBridge} after its broker connection drops, following a {@link RestartPolicy}.
 *
 * <p>The first start is never retried: a startup failure goes straight back to the caller. Transport failures
 * the policy does not cover (policy disabled, attempts exhausted) are passed on to the host's
 * {@link FatalErrorHandler}.
 */
public class BridgeSupervisor {
    private static final Logger LOGGER = LoggerFactory.getLogger(BridgeSupervisor.class);

    private final EventBridge bridge;
    private final FatalErrorHandler bridgeErrors;
    private final FatalErrorHandler hostErrors;
    private final RestartPolicy policy;
    private final ScheduledExecutorService scheduler;

    // guarded by this
    private BridgeConfig config;
    private EventSink sink;
    private boolean running;
    private int failedAttempts;
    private Future<?> restartFuture;

    /**
     * Construct a BridgeSupervisor.
     *
     * @param bridge       supervised bridge
     * @param bridgeErrors the fatal error handler the bridge reports transport failures to
     * @param hostErrors   receives failures the policy gives up on
     * @param policy       restart policy
     * @param scheduler    schedules delayed restarts
     */
    public BridgeSupervisor(@NonNull EventBridge bridge,
                            @NonNull FatalErrorHandler bridgeErrors,
                            @NonNull FatalErrorHandler hostErrors,
                            @NonNull RestartPolicy policy,
                            @NonNull ScheduledExecutorService scheduler) {
        this.bridge = bridge;
        this.bridgeErrors = bridgeErrors;
        this.hostErrors = hostErrors;
        this.policy = policy;
        this.scheduler = scheduler;
    }

    /**
     * Start the bridge.
     *
     * @param config connection configuration
     * @param sink   event sink
     * @throws BridgeStartupException if the bridge fails to start
     */
    public synchronized void start(@NonNull BridgeConfig config, @NonNull EventSink sink)
            throws BridgeStartupException {
        if (running) {
            throw new IllegalStateException("Supervisor already running");
        }
        this.config = config;
        this.sink = sink;
        this.failedAttempts = 0;
        bridgeErrors.initialize(this::onTransportError);
        bridge.start(config, sink);
        running = true;
    }

    /**
     * Cancel any pending restart and stop the bridge. Idempotent.
     */
    public synchronized void stop() {
        running = false;
        if (restartFuture != null) {
            restartFuture.cancel(false);
            restartFuture = null;
        }
        bridge.stop();
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public synchronized int getFailedAttempts() {
        return failedAttempts;
    }

    private synchronized void onTransportError(Exception error) {
        if (!running) {
            return;
        }
        if (!policy.isEnabled()) {
            giveUp(error);
            return;
        }
        scheduleRestart(error);
    }

    private void scheduleRestart(Exception error) {
        if (failedAttempts >= policy.getMaxAttempts()) {
            LOGGER.atError().addKeyValue("attempts", failedAttempts).log("Giving up restarting event bridge");
            giveUp(error);
            return;
        }
        long delayMs = policy.delayBeforeAttempt(failedAttempts);
        LOGGER.atInfo().addKeyValue("delayMs", delayMs).addKeyValue("attempt", failedAttempts + 1)
                .log("Restarting event bridge");
        try {
            restartFuture = scheduler.schedule(this::restart, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            giveUp(error);
        }
    }

    private synchronized void restart() {
        restartFuture = null;
        if (!running) {
            return;
        }
        try {
            bridge.start(config, sink);
            failedAttempts = 0;
            LOGGER.atInfo().log("Event bridge restarted");
        } catch (BridgeStartupException e) {
            failedAttempts++;
            LOGGER.atWarn().setCause(e).addKeyValue("attempt", failedAttempts).log("Unable to restart event bridge");
            scheduleRestart(new BridgeTransportException("Unable to restart event bridge", e));
        }
    }

    private void giveUp(Exception error) {
        running = false;
        hostErrors.fatalError(error);
    }
}
