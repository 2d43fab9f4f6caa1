package org.spinflip.cli.config;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ConfigLoader}: file lookup and the precedence of system
 * properties over the configuration file over {@code reference.conf}.
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("spinflip.simulation.memory");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile layers the file over reference.conf")
    void loadFromFile_shouldLayerFileOverDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals("file-nested", config.getString("test.nested.setting"));
        assertEquals(3, config.getInt("spinflip.simulation.memory"));
        assertEquals(2, config.getConfigList("spinflip.simulation.schedule").size());
    }

    @Test
    @DisplayName("System property overrides the file")
    void loadFromFile_systemPropertyShouldOverrideFile() {
        System.setProperty("test.value", "system-value");
        System.setProperty("spinflip.simulation.memory", "9");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("system-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
        assertEquals(9, config.getInt("spinflip.simulation.memory"));
    }

    @Test
    @DisplayName("loadDefaults contains the reference schedule")
    void loadDefaults_shouldContainReferenceSchedule() {
        Config config = ConfigLoader.loadDefaults();

        assertEquals(0, config.getInt("spinflip.simulation.memory"));
        assertFalse(config.hasPath("spinflip.simulation.seed"));
        assertEquals(5, config.getConfigList("spinflip.simulation.schedule").size());
        assertEquals("INFO", config.getString("logging.levels.ROOT"));
    }

    @Test
    @DisplayName("resolve reports the explicitly named file")
    void resolve_shouldUseExplicitFile() {
        List<String> messages = new ArrayList<>();
        File file = testResource("test-config.conf");

        Config config = ConfigLoader.resolve(file, (level, message) -> messages.add(level + " " + message));

        assertEquals(7L, config.getLong("spinflip.simulation.seed"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO Using configuration file"));
    }

    @Test
    @DisplayName("resolve fails for a missing explicit file")
    void resolve_shouldRejectMissingExplicitFile() {
        File missing = new File("does-not-exist/spinflip.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, (level, message) -> { }));
        assertTrue(e.getMessage().contains("--config"));
    }

    private File testResource(String name) {
        URL url = getClass().getClassLoader().getResource(name);
        if (url == null) {
            throw new IllegalStateException("Test resource not found: " + name);
        }
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
