package com.fluxreader.core.config;

import com.fluxreader.common.util.FileUtils;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

public class ConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);

    private final File configFile;
    private final Gson gson;
    private Configuration configuration;

    public ConfigManager(File dataDir) {
        this.configFile = new File(dataDir, "config.json");
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        load();
    }

    public Configuration getConfig() {
        return configuration;
    }

    public File getConfigFile() {
        return configFile;
    }

    public synchronized boolean save() {
        try {
            FileUtils.writeAtomically(configFile.toPath(), gson.toJson(configuration));
            logger.debug("Configuration saved to {}", configFile.getAbsolutePath());
            return true;
        } catch (IOException e) {
            logger.error("Failed to save configuration", e);
            return false;
        }
    }

    private void load() {
        if (!configFile.exists()) {
            configuration = new Configuration();
            logger.info("No config file at {}, writing defaults", configFile.getAbsolutePath());
            save();
            return;
        }

        try (Reader r = Files.newBufferedReader(configFile.toPath(), StandardCharsets.UTF_8)) {
            configuration = gson.fromJson(r, Configuration.class);
            if (configuration == null) configuration = new Configuration();
            logger.info("Configuration loaded from {}", configFile.getAbsolutePath());
        } catch (IOException | JsonParseException e) {
            logger.error("Unreadable config file {}, using defaults", configFile.getAbsolutePath(), e);
            configuration = new Configuration();
        }
    }

    public void updateConfig(Configuration newConfig) {
        this.configuration = newConfig;
        save();
    }
}
