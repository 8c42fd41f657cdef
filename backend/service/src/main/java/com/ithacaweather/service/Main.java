package com.ithacaweather.service;

import com.ithacaweather.service.config.ConfigException;
import com.ithacaweather.service.config.ConfigLoader;
import com.ithacaweather.service.config.PipelineConfig;
import com.ithacaweather.service.runtime.IngestionRuntime;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIG_ERROR = 2;
    static final int EXIT_STORE_INIT_FAILURE = 3;

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        int exitCode = run(System.getenv(), new CountDownLatch(1));
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /**
     * Loads config, builds the pipeline and blocks on {@code shutdownLatch}, which the JVM
     * shutdown hook releases after draining.
     */
    static int run(Map<String, String> environment, CountDownLatch shutdownLatch) throws InterruptedException {
        Path configDir = ConfigLoader.configDir(environment);
        PipelineConfig config;
        try {
            config = ConfigLoader.load(configDir, environment);
        } catch (ConfigException e) {
            LOGGER.severe("Configuration error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        IngestionRuntime runtime;
        try {
            runtime = IngestionRuntime.create(config, environment, Clock.systemUTC());
        } catch (ConfigException e) {
            LOGGER.severe("Configuration error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        } catch (IllegalStateException e) {
            LOGGER.log(Level.SEVERE, "Failed initializing storage", e);
            return EXIT_STORE_INIT_FAILURE;
        }

        LOGGER.info("Starting ingestion for " + config.locations().size() + " locations every "
                + config.pollInterval());
        runtime.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            runtime.close();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
        return EXIT_OK;
    }
}
