package com.bookshelf.core.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.Map;

public class ConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);

    private final File configFile;
    private final Map<String, String> environment;
    private final Gson gson;
    private Configuration configuration;
    // file-side values of fields replaced by environment overrides, keyed by JSON field name
    private final Map<String, JsonElement> fileValues = new HashMap<>();

    public ConfigManager(File configFile) {
        this(configFile, System.getenv());
    }

    /**
     * @param configFile  JSON config file, created with defaults if missing
     * @param environment Environment variables used for overrides (LIBRARY_DIR, PAGE_SIZE, PORT, ADMIN_TOKEN)
     */
    public ConfigManager(File configFile, Map<String, String> environment) {
        this.configFile = configFile;
        this.environment = environment;
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        load();
        applyEnvironment();
    }

    public Configuration getConfig() {
        return configuration;
    }

    public synchronized void saveConfig() {
        File parent = configFile.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists())
            parent.mkdirs();

        JsonObject json = gson.toJsonTree(this.configuration).getAsJsonObject();
        for (Map.Entry<String, JsonElement> entry : fileValues.entrySet()) {
            if (entry.getValue() == null) {
                json.remove(entry.getKey());
            } else {
                json.add(entry.getKey(), entry.getValue());
            }
        }

        try (Writer writer = Files.newBufferedWriter(configFile.toPath(), StandardCharsets.UTF_8)) {
            gson.toJson(json, writer);
            logger.info("Configuration saved to {}", configFile);
        } catch (IOException e) {
            logger.error("Failed to save config", e);
        }
    }

    private void load() {
        if (!configFile.exists()) {
            configuration = new Configuration();
            logger.info("No config file found at {}. Created default configuration.", configFile);
            saveConfig();
            return;
        }

        try (Reader r = new FileReader(configFile, StandardCharsets.UTF_8)) {
            configuration = gson.fromJson(r, Configuration.class);
            if (configuration == null)
                configuration = new Configuration();
            logger.info("Configuration loaded from {}", configFile);
        } catch (IOException | JsonParseException e) {
            logger.error("Failed to load configuration, using defaults", e);
            configuration = new Configuration();
        }
    }

    /**
     * Environment overrides apply to the running configuration only; {@link #saveConfig()}
     * writes back the values the file had.
     */
    private void applyEnvironment() {
        String libraryDir = environment.get("LIBRARY_DIR");
        if (libraryDir != null && !libraryDir.isBlank()) {
            rememberFileValue("libraryDir");
            configuration.libraryDir = libraryDir;
        }

        int pageSize = intFromEnv("PAGE_SIZE", configuration.pageSize);
        if (pageSize != configuration.pageSize) {
            rememberFileValue("pageSize");
            configuration.pageSize = pageSize;
        }

        int port = intFromEnv("PORT", configuration.port);
        if (port != configuration.port) {
            rememberFileValue("port");
            configuration.port = port;
        }

        String adminToken = environment.get("ADMIN_TOKEN");
        if (adminToken != null) {
            rememberFileValue("adminToken");
            configuration.adminToken = adminToken;
        }
    }

    private void rememberFileValue(String field) {
        fileValues.put(field, gson.toJsonTree(configuration).getAsJsonObject().get(field));
    }

    private int intFromEnv(String key, int current) {
        String value = environment.get(key);
        if (value == null || value.isBlank())
            return current;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid {}='{}', keeping {}", key, value, current);
            return current;
        }
    }
}
