package org.resilience.runtime.internal.services;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.resilience.runtime.spi.IRandomProvider;

@Tag("unit")
class SeededRandomProviderTest {

    private static int[] draw(IRandomProvider random, int n) {
        int[] values = new int[n];
        for (int i = 0; i < n; i++) {
            values[i] = random.nextInt(1000);
        }
        return values;
    }

    @Test
    void sameSeedGivesTheSameStream() {
        assertThat(draw(new SeededRandomProvider(42L), 50)).containsExactly(draw(new SeededRandomProvider(42L), 50));
        assertThat(draw(new SeededRandomProvider(42L), 50)).isNotEqualTo(draw(new SeededRandomProvider(43L), 50));
    }

    @Test
    void javaRandomViewSharesTheStream() {
        SeededRandomProvider a = new SeededRandomProvider(5L);
        SeededRandomProvider b = new SeededRandomProvider(5L);

        a.asJavaRandom().nextInt(10);
        b.nextInt(10);

        assertThat(a.nextDouble()).isEqualTo(b.nextDouble());
        assertThat(a.getSeed()).isEqualTo(5L);
    }

    @Test
    void derivedProvidersAreStableAndIndependent() {
        SeededRandomProvider root = new SeededRandomProvider(42L);

        assertThat(draw(root.deriveFor("seeding", 1L), 20)).containsExactly(draw(root.deriveFor("seeding", 1L), 20));
        assertThat(draw(root.deriveFor("seeding", 1L), 20)).isNotEqualTo(draw(root.deriveFor("seeding", 2L), 20));
        assertThat(draw(root.deriveFor("seeding", 1L), 20)).isNotEqualTo(draw(root.deriveFor("movement", 1L), 20));
    }
}
