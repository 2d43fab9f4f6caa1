package org.spinflip.cli.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LoggingConfiguratorTest {

    private static final String LOGGER_NAME = "org.spinflip.cli.config.sample";

    @AfterEach
    void tearDown() {
        ((Logger) LoggerFactory.getLogger(LOGGER_NAME)).setLevel(null);
        ((Logger) LoggerFactory.getLogger("org")).setLevel(null);
    }

    @Test
    void testAppliesConfiguredLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
            "logging.levels { \"" + LOGGER_NAME + "\" = DEBUG }"));

        assertThat(((Logger) LoggerFactory.getLogger(LOGGER_NAME)).getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void testMissingBlockIsIgnored() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertThat(((Logger) LoggerFactory.getLogger(LOGGER_NAME)).getLevel()).isNull();
    }

    @Test
    void testUnquotedDottedKeyNamesTheFullLogger() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
            "logging.levels { " + LOGGER_NAME + " = DEBUG }"));

        assertThat(((Logger) LoggerFactory.getLogger(LOGGER_NAME)).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(((Logger) LoggerFactory.getLogger("org")).getLevel()).isNull();
    }

    @Test
    void testInvalidLevelValuesAreSkipped() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
            "logging.levels { \"" + LOGGER_NAME + "\" = 42, org = NOT_A_LEVEL }"));

        assertThat(((Logger) LoggerFactory.getLogger(LOGGER_NAME)).getLevel()).isNull();
        assertThat(((Logger) LoggerFactory.getLogger("org")).getLevel()).isNull();
    }
}
