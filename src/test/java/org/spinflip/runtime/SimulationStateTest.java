package org.spinflip.runtime;

import java.util.List;
import java.util.Map;

import org.spinflip.model.VariableDomain;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

@Tag("unit")
class SimulationStateTest {

    private final VariableIndex<String> variables = new VariableIndex<>(List.of("x", "y", "z"));

    @Test
    void testVariableIndexAssignsPositionsInOrder() {
        assertThat(variables.size()).isEqualTo(3);
        assertThat(variables.indexOf("y")).isEqualTo(1);
        assertThat(variables.label(2)).isEqualTo("z");
        assertThat(variables.indexOf("w")).isEqualTo(-1);
        assertThat(variables.contains("w")).isFalse();
    }

    @Test
    void testAllUp() {
        SimulationState<String> state = SimulationState.allUp(variables);

        assertThat(state.copySpins()).containsExactly(1, 1, 1);
        assertThat(state.toMap(VariableDomain.BOOLEAN)).containsExactly(entry("x", 0), entry("y", 0), entry("z", 0));
    }

    @Test
    void testBooleanAssignmentIsStoredAsSpins() {
        SimulationState<String> state = SimulationState.of(variables, Map.of("x", 1, "y", 0, "z", 1, "extra", 0),
                VariableDomain.BOOLEAN);

        assertThat(state.copySpins()).containsExactly(-1, 1, -1);
        assertThat(state.spin("y")).isEqualTo(1);
        assertThat(state.toMap(VariableDomain.SPIN)).containsExactly(entry("x", -1), entry("y", 1), entry("z", -1));
    }

    @Test
    void testMissingVariableIsRejected() {
        assertThatThrownBy(() -> SimulationState.of(variables, Map.of("x", 1, "y", 1), VariableDomain.SPIN))
            .isInstanceOf(InvalidStateValueException.class)
            .hasMessageContaining("'z'");
    }

    @Test
    void testValueOutsideDomainIsRejected() {
        assertThatThrownBy(() -> SimulationState.of(variables, Map.of("x", 1, "y", 0, "z", 1), VariableDomain.SPIN))
            .isInstanceOf(InvalidStateValueException.class)
            .hasMessageContaining("SPIN");
        assertThatThrownBy(() -> SimulationState.of(variables, Map.of("x", 1, "y", -1, "z", 1),
                VariableDomain.BOOLEAN))
            .isInstanceOf(InvalidStateValueException.class);
    }

    @Test
    void testFlipAndSnapshot() {
        SimulationState<String> state = SimulationState.allUp(variables);
        SimulationState<String> snapshot = state.snapshot();

        state.flip("z");
        state.flip(0);

        assertThat(state.copySpins()).containsExactly(-1, 1, -1);
        assertThat(snapshot.copySpins()).containsExactly(1, 1, 1);
        assertThat(state).isNotEqualTo(snapshot);
        state.flip("z");
        state.flip("x");
        assertThat(state).isEqualTo(snapshot);
    }

    @Test
    void testUnknownLabelIsRejected() {
        SimulationState<String> state = SimulationState.allUp(variables);

        assertThatThrownBy(() -> state.flip("w")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> state.spin("w")).isInstanceOf(IllegalArgumentException.class);
    }
}
