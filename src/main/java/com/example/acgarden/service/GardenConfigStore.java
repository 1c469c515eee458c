package com.example.acgarden.service;

import com.example.acgarden.exception.ConfigException;
import com.example.acgarden.model.GardenConfig;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Creates and reads the settings record, by default ~/.ac-garden/config.json.
 */
@Slf4j
@Service
public class GardenConfigStore {

    public static final String APP_DIR = ".ac-garden";
    public static final String CONFIG_FILE_NAME = "config.json";

    private final ObjectMapper objectMapper;
    private final Path configFile;

    public GardenConfigStore(ObjectMapper objectMapper,
                             @Value("${acgarden.config-path:}") String configPath) {
        this.objectMapper = objectMapper;
        this.configFile = (configPath == null || configPath.isBlank())
                ? defaultConfigFile()
                : Paths.get(configPath);
    }

    public static Path defaultConfigFile() {
        String home = System.getProperty("user.home");
        if (home == null || home.isBlank()) {
            throw new ConfigException("Failed to get home directory");
        }
        return Paths.get(home, APP_DIR, CONFIG_FILE_NAME);
    }

    public Path configFile() {
        return configFile;
    }

    /**
     * Write an empty config unless one exists; {@code force} overwrites it.
     *
     * @return the config file location
     */
    public Path init(boolean force) {
        log.info("Initialize your config...");
        try {
            Path dir = configFile.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            if (force || !Files.isRegularFile(configFile)) {
                String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(GardenConfig.empty());
                Files.writeString(configFile, json, StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new ConfigException("Failed to create config file " + configFile + ": " + e.getMessage(), e);
        }
        log.info("Initialized your config at {}", configFile);
        return configFile;
    }

    public GardenConfig load() {
        if (!Files.isRegularFile(configFile)) {
            throw new ConfigException("Config file " + configFile + " not found, run 'init' first");
        }
        try {
            GardenConfig config = objectMapper.readValue(Files.readString(configFile, StandardCharsets.UTF_8), GardenConfig.class);
            if (config == null) {
                throw new ConfigException("Config file " + configFile + " is empty");
            }
            return config;
        } catch (JacksonException e) {
            throw new ConfigException("Failed to parse config " + configFile + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config file " + configFile + ": " + e.getMessage(), e);
        }
    }
}
