package com.ithacaweather.service.config;

import com.ithacaweather.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;

public final class ConfigLoader {
    public static final String API_KEY_ENV = "OPENWEATHER_API_KEY";
    public static final String CONFIG_DIR_ENV = "INGEST_CONFIG_DIR";

    private ConfigLoader() {
    }

    public static Path configDir(Map<String, String> env) {
        String dir = env.get(CONFIG_DIR_ENV);
        return Path.of(dir == null || dir.isBlank() ? "config" : dir);
    }

    /**
     * Reads {@code pipeline.json}, overlays the API key from the environment and validates.
     */
    public static PipelineConfig load(Path configDir, Map<String, String> env) {
        PipelineConfig fromFile = read(configDir.resolve("pipeline.json"));
        String envKey = env.get(API_KEY_ENV);
        PipelineConfig config = envKey == null || envKey.isBlank() ? fromFile : fromFile.withApiKey(envKey.trim());
        return config.validate();
    }

    private static PipelineConfig read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            PipelineConfig config = JsonUtils.objectMapper().readValue(in, PipelineConfig.class);
            if (config == null) {
                throw new ConfigException("Config file is empty: " + path);
            }
            return config;
        } catch (NoSuchFileException e) {
            throw new ConfigException("Config file not found: " + path, e);
        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigException("Failed loading config from " + path, e);
        }
    }
}
