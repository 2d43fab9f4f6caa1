package org.spinflip.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class VariableDomainTest {

    @Test
    void testSpinDomain() {
        assertThat(VariableDomain.SPIN.isValid(1)).isTrue();
        assertThat(VariableDomain.SPIN.isValid(-1)).isTrue();
        assertThat(VariableDomain.SPIN.isValid(0)).isFalse();
        assertThat(VariableDomain.SPIN.toSpin(-1)).isEqualTo(-1);
    }

    @Test
    void testBooleanDomainMapsZeroToSpinUp() {
        assertThat(VariableDomain.BOOLEAN.isValid(0)).isTrue();
        assertThat(VariableDomain.BOOLEAN.isValid(1)).isTrue();
        assertThat(VariableDomain.BOOLEAN.isValid(-1)).isFalse();
        assertThat(VariableDomain.BOOLEAN.toSpin(0)).isEqualTo(1);
        assertThat(VariableDomain.BOOLEAN.toSpin(1)).isEqualTo(-1);
        assertThat(VariableDomain.BOOLEAN.fromSpin(-1)).isEqualTo(1);
        assertThat(VariableDomain.BOOLEAN.fromSpin(1)).isEqualTo(0);
    }
}
