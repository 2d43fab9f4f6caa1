package org.spinflip.cli.config;

import java.util.List;

import org.spinflip.runtime.SchedulePhase;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SimulationSettingsTest {

    @Test
    void testParsesScheduleMemoryAndSeed() {
        Config config = ConfigFactory.parseString("""
            memory = 4
            seed = 12
            schedule = [
              { temperature = 2.5, sweeps = 3 }
              { temperature = 0, sweeps = 7 }
            ]
            """);

        SimulationSettings settings = SimulationSettings.fromConfig(config);

        assertThat(settings.getMemory()).isEqualTo(4);
        assertThat(settings.getSeed()).hasValue(12L);
        assertThat(settings.getSchedule()).containsExactly(SchedulePhase.of(2.5, 3), SchedulePhase.of(0.0, 7));
        assertThat(settings.totalSweeps()).isEqualTo(10);
    }

    @Test
    void testDefaultsWhenKeysAreMissing() {
        SimulationSettings settings = SimulationSettings.fromConfig(ConfigFactory.empty());

        assertThat(settings.getMemory()).isZero();
        assertThat(settings.getSeed()).isEmpty();
        assertThat(settings.getSchedule()).isEmpty();
    }

    @Test
    void testReferenceConfigurationIsValid() {
        Config reference = ConfigFactory.defaultReference().getConfig("spinflip.simulation");

        SimulationSettings settings = SimulationSettings.fromConfig(reference);

        assertThat(settings.getSchedule()).hasSize(5);
        assertThat(settings.getSchedule().get(4).temperature()).isZero();
    }

    @Test
    void testNegativeTemperatureIsBadValue() {
        Config config = ConfigFactory.parseString("schedule = [ { temperature = -0.5, sweeps = 1 } ]");

        assertThatThrownBy(() -> SimulationSettings.fromConfig(config))
            .isInstanceOf(ConfigException.BadValue.class)
            .hasMessageContaining("schedule[0]");
    }

    @Test
    void testNegativeSweepsIsBadValue() {
        Config config = ConfigFactory.parseString("schedule = [ { temperature = 1, sweeps = -2 } ]");

        assertThatThrownBy(() -> SimulationSettings.fromConfig(config))
            .isInstanceOf(ConfigException.BadValue.class);
    }

    @Test
    void testOverrides() {
        SimulationSettings settings = new SimulationSettings(0, null, List.of(SchedulePhase.of(1.0, 1)));

        assertThat(settings.withSeed(3L).getSeed()).hasValue(3L);
        assertThat(settings.withMemory(5).getMemory()).isEqualTo(5);
        assertThat(settings.getSeed()).isEmpty();
        assertThatThrownBy(() -> settings.withMemory(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
