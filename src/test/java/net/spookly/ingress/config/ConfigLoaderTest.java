package net.spookly.ingress.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import net.spookly.ingress.hosts.Hosts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {
    @Test
    void createsDefaultConfigWhenMissing(@TempDir Path tempDir) throws IOException {
        Path configPath = tempDir.resolve("conf").resolve("ingress.yaml");

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));

        assertTrue(Files.exists(configPath));
        String content = Files.readString(configPath, StandardCharsets.UTF_8);
        assertTrue(content.contains("hosts:"));
        assertTrue(exception.getMessage().contains("generated default"));
    }

    @Test
    void loadsGeneratedDefault(@TempDir Path tempDir) throws IOException {
        Path configPath = tempDir.resolve("ingress.yaml");
        Files.writeString(configPath, ConfigDefaults.defaultYaml(), StandardCharsets.UTF_8);

        IngressConfig config = ConfigLoader.load(configPath);

        assertEquals(Hosts.DEFAULT_HOSTNAME, config.hosts.defaultHostname);
        assertEquals(Boolean.FALSE, config.observability.logging.auditChanges);
        assertEquals(Hosts.DEFAULT_HOSTNAME, Hosts.fromConfig(config).defaultHostname());
    }

    @Test
    void rejectsUnknownKeys(@TempDir Path tempDir) throws IOException {
        Path configPath = tempDir.resolve("ingress.yaml");
        Files.writeString(configPath, "hosts:\n  defaultHost: x\n", StandardCharsets.UTF_8);

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));

        assertTrue(exception.getMessage().contains("Failed to parse config"));
    }

    @Test
    void rejectsEmptyFile(@TempDir Path tempDir) throws IOException {
        Path configPath = tempDir.resolve("ingress.yaml");
        Files.writeString(configPath, "", StandardCharsets.UTF_8);

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));

        assertTrue(exception.getMessage().contains("empty"));
    }

    @Test
    void validatesLoadedConfig(@TempDir Path tempDir) throws IOException {
        Path configPath = tempDir.resolve("ingress.yaml");
        Files.writeString(configPath, "hosts:\n  defaultHostname: \"  \"\n", StandardCharsets.UTF_8);

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));

        assertTrue(exception.getMessage().contains("hosts.defaultHostname"));
    }

    @Test
    void requiresPath() {
        assertThrows(ConfigException.class, () -> ConfigLoader.load(null));
    }
}
