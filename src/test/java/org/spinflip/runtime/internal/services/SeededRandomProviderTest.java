package org.spinflip.runtime.internal.services;

import java.lang.reflect.Method;

import org.spinflip.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SeededRandomProviderTest {

    @Test
    void testSameSeedProducesSameStream() {
        SeededRandomProvider first = new SeededRandomProvider(42L);
        SeededRandomProvider second = new SeededRandomProvider(42L);

        for (int i = 0; i < 100; i++) {
            assertThat(first.nextInt(1000)).isEqualTo(second.nextInt(1000));
            assertThat(first.nextDouble()).isEqualTo(second.nextDouble());
        }
    }

    @Test
    void testReseedRestartsStream() {
        SeededRandomProvider provider = new SeededRandomProvider(1L);
        provider.nextDouble();

        provider.reseed(7L);
        double afterReseed = provider.nextDouble();

        assertThat(afterReseed).isEqualTo(new SeededRandomProvider(7L).nextDouble());
        assertThat(provider.getSeed()).isEqualTo(7L);
    }

    @Test
    void testProviderContractIsDrawAndReseedOnly() {
        assertThat(IRandomProvider.class.getInterfaces()).isEmpty();
        assertThat(IRandomProvider.class.getDeclaredMethods())
                .extracting(Method::getName)
                .containsExactlyInAnyOrder("nextInt", "nextDouble", "reseed");
    }
}
