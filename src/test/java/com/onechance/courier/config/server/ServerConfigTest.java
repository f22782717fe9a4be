package com.onechance.courier.config.server;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @TempDir
    Path dir;

    @Test
    void testLoadsSectionsFromSiblingFiles() throws IOException {
        ServerConfig config = new ServerConfig("src/test/resources/cfg/server.json5");

        assertEquals("courier-test", config.getName());
        assertEquals(3, config.getQueue().getMaxAttempts());
        assertEquals(Duration.ofMillis(2000), config.getQueue().getPollInterval());
        assertEquals(Duration.ZERO, config.getQueue().getAttemptDelay());
        assertEquals(Duration.ofMillis(1500), config.getQueue().getSendTimeout());
        assertTrue(config.getQueue().getFile().getBooleanProperty("enabled"));

        assertEquals(List.of("http://127.0.0.1:9/ping"), config.getNetwork().getEndpoints());
        assertTrue(config.getNetwork().isInitiallyOnline());
        assertEquals(Duration.ofSeconds(2), config.getNetwork().getProbeTimeout());

        assertEquals("SG.test", config.getSendGrid().getApiKey());
        assertEquals("Courier Test", config.getSendGrid().getFromName());
        assertEquals("AC123", config.getTwilio().getAccountSid());
        assertEquals(Duration.ZERO, config.getTwilio().getMediaDelay());
        assertEquals(0, config.getApi().getPort(8090));
    }

    @Test
    void testDefaultsWhenSectionsMissing() throws IOException {
        Path server = dir.resolve("server.json5");
        Files.writeString(server, "{ /* empty */ }");

        ServerConfig config = new ServerConfig(server.toString());

        assertEquals("courier", config.getName());
        assertEquals(5, config.getQueue().getMaxAttempts());
        assertEquals(Duration.ofSeconds(5), config.getQueue().getPollInterval());
        assertEquals(Duration.ofMillis(500), config.getQueue().getAttemptDelay());
        assertEquals(Duration.ofSeconds(30), config.getQueue().getSendTimeout());
        assertEquals(NetworkConfig.DEFAULT_ENDPOINTS, config.getNetwork().getEndpoints());
        assertEquals(Duration.ofSeconds(10), config.getNetwork().getCheckInterval());
        assertFalse(config.getNetwork().isInitiallyOnline());
        assertFalse(config.getSendGrid().isEnabled());
        assertEquals("https://api.sendgrid.com", config.getSendGrid().getBaseUrl());
        assertEquals("sharing@onechancemedia.com", config.getSendGrid().getFromEmail());
        assertFalse(config.getTwilio().isEnabled());
        assertEquals("Here's your image!", config.getTwilio().getDefaultMediaBody());
        assertEquals(Duration.ofSeconds(1), config.getTwilio().getMediaDelay());
        assertTrue(config.getApi().isEnabled());
        assertEquals(8090, config.getApi().getPort(8090));
        assertEquals("127.0.0.1", config.getApi().getBind());
    }

    @Test
    void testInlineSectionWins() throws IOException {
        Path server = dir.resolve("server.json5");
        Files.writeString(server, "{ queue: { maxAttempts: 9 } }");
        Files.writeString(dir.resolve("queue.json5"), "{ maxAttempts: 2 }");

        assertEquals(9, new ServerConfig(server.toString()).getQueue().getMaxAttempts());
    }

    @Test
    void testMapConstructor() {
        ServerConfig config = new ServerConfig(Map.of("dataDir", "/data", "api", Map.of("port", 9001)));

        assertNull(config.getConfigDir());
        assertEquals("/data", config.getDataDir());
        assertEquals(9001, config.getApi().getPort(8090));
        assertEquals(5, config.getQueue().getMaxAttempts());
    }

    @Test
    void testInvalidFile() throws IOException {
        Path server = dir.resolve("server.json5");
        Files.writeString(server, "{ name: ");

        assertThrows(IOException.class, () -> new ServerConfig(server.toString()));
    }
}
