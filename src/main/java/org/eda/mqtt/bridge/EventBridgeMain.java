/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.eda.mqtt.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.eda.mqtt.bridge.model.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Runs one MQTT event source from a YAML file of source arguments and prints every event as a JSON line.
 *
 * <p>Usage: {@code EventBridgeMain <source.yaml>}
 */
public final class EventBridgeMain {
    private static final Logger LOGGER = LoggerFactory.getLogger(EventBridgeMain.class);
    private static final ObjectMapper YAML_MAPPER = new YAMLMapper();
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    static final int EXIT_OK = 0;
    static final int EXIT_STARTUP_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private EventBridgeMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Load the source arguments, start the event source and block until it terminates.
     *
     * @param args command line arguments
     * @param out  receives one JSON line per event
     * @param err  receives usage text
     * @return process exit code
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length != 1) {
            err.println("Usage: EventBridgeMain <source.yaml>");
            return EXIT_USAGE;
        }

        Map<String, Object> arguments;
        try {
            arguments = loadArguments(Paths.get(args[0]));
        } catch (IOException e) {
            LOGGER.atError().setCause(e).addKeyValue("file", args[0]).log("Unable to read source arguments");
            return EXIT_USAGE;
        }

        EventSourceService service;
        try {
            service = EventSourceService.fromArguments(arguments, event -> printEvent(out, event));
        } catch (InvalidConfigurationException e) {
            LOGGER.atError().addKeyValue("field", e.getField()).log("Invalid source arguments: {}", e.getMessage());
            return EXIT_STARTUP_FAILED;
        }

        Thread shutdownHook = new Thread(service::shutdown, "eda-mqtt-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            service.startup();
            service.awaitTermination();
        } catch (BridgeStartupException e) {
            return EXIT_STARTUP_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            service.shutdown();
            removeShutdownHook(shutdownHook);
        }
        return service.getFatalError().isPresent() ? EXIT_STARTUP_FAILED : EXIT_OK;
    }

    static Map<String, Object> loadArguments(Path file) throws IOException {
        Map<String, Object> arguments = YAML_MAPPER.readValue(file.toFile(),
                new TypeReference<Map<String, Object>>() {
                });
        if (arguments == null) {
            throw new IOException("Source arguments file is empty: " + file);
        }
        return arguments;
    }

    private static void printEvent(PrintStream out, Map<String, Object> event) {
        try {
            out.println(JSON_MAPPER.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            LOGGER.atWarn().setCause(e).log("Unable to serialize event");
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LOGGER.atDebug().log("JVM is already shutting down");
        }
    }
}
