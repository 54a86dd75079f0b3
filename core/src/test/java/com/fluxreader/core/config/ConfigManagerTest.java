package com.fluxreader.core.config;

import com.fluxreader.test.TestBase;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigManager
 */
class ConfigManagerTest extends TestBase {

    @Test
    void testDefaultsWrittenOnFirstLoad() throws IOException {
        ConfigManager manager = new ConfigManager(dataDir);

        File file = new File(dataDir, "config.json");
        assertTrue(file.exists(), "Default config should be written");
        String json = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        assertTrue(json.contains("\"limit\": 100"), "Pretty printed defaults: " + json);
        assertEquals("published_at", manager.getConfig().order);
        assertFalse(manager.getConfig().isConfigured());
    }

    @Test
    void testSaveAndReload() {
        ConfigManager manager = new ConfigManager(dataDir);
        Configuration config = manager.getConfig();
        config.serverAddress = "https://rss.example.org";
        config.apiToken = "secret";
        config.prefetchCount = 5;
        assertTrue(manager.save());

        Configuration reloaded = new ConfigManager(dataDir).getConfig();

        assertEquals("https://rss.example.org", reloaded.serverAddress);
        assertEquals(5, reloaded.prefetchCount);
        assertTrue(reloaded.isConfigured());
    }

    @Test
    void testMissingKeysKeepDefaults() throws IOException {
        Files.writeString(new File(dataDir, "config.json").toPath(), "{\"includeImages\": false}");

        Configuration config = new ConfigManager(dataDir).getConfig();

        assertFalse(config.includeImages);
        assertEquals(100, config.limit, "Unset keys should keep their default");
        assertEquals("desc", config.direction);
    }

    @Test
    void testCorruptFileFallsBackToDefaults() throws IOException {
        Files.writeString(new File(dataDir, "config.json").toPath(), "{ not json");

        Configuration config = new ConfigManager(dataDir).getConfig();

        assertNotNull(config, "Configuration should not be null");
        assertEquals(100, config.limit);
    }

    @Test
    void testUpdateConfig() {
        ConfigManager manager = new ConfigManager(dataDir);
        Configuration replacement = new Configuration();
        replacement.direction = "asc";

        manager.updateConfig(replacement);

        assertSame(replacement, manager.getConfig());
        assertEquals("asc", new ConfigManager(dataDir).getConfig().direction);
    }

    @Test
    void testDownloadDirResolution() {
        Configuration config = new Configuration();
        assertEquals(new File(dataDir, "miniflux"), config.resolveDownloadDir(dataDir));

        config.downloadDir = new File(dataDir, "elsewhere").getAbsolutePath();
        assertEquals(new File(dataDir, "elsewhere").getAbsoluteFile(), config.resolveDownloadDir(dataDir));
    }
}
