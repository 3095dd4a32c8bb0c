package com.bucketretry.core.backoff;

import com.bucketretry.core.spi.BackoffPolicy;
import com.bucketretry.model.BackoffConfiguration;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BackoffRegistryTest {

    private final BackoffConfiguration cfg = BackoffConfiguration.builder().jitterFraction(0.0).build();

    @Test
    void resolvesBuiltins() {
        BackoffRegistry registry = new BackoffRegistry(cfg, null);

        assertInstanceOf(ExponentialJitterBackoffPolicy.class, registry.resolve("exponential"));
        assertInstanceOf(FixedBackoffPolicy.class, registry.resolve("FIXED"));
        assertTrue(registry.names().containsAll(List.of("exponential", "fixed")));
    }

    @Test
    void unknownOrBlankFallsBackToExponential() {
        BackoffRegistry registry = new BackoffRegistry(cfg, null);

        assertEquals("exponential", registry.resolve("nope").name());
        assertEquals("exponential", registry.resolve(" ").name());
        assertEquals("exponential", registry.resolve(null).name());
    }

    @Test
    void resolvesDiscoveredPolicyWithSpiPrefix() {
        BackoffPolicy constant = new BackoffPolicy() {
            @Override
            public String name() {
                return "Constant";
            }

            @Override
            public Duration backoff(int attempt) {
                return Duration.ofSeconds(1);
            }
        };
        BackoffRegistry registry = new BackoffRegistry(cfg, List.of(constant));

        assertSame(constant, registry.resolve("spi:constant"));
        assertSame(constant, registry.resolve("constant"));
    }

    @Test
    void fixedPolicyIgnoresAttempt() {
        FixedBackoffPolicy fixed = new FixedBackoffPolicy(cfg);
        assertEquals(Duration.ofMillis(10), fixed.backoff(0));
        assertEquals(Duration.ofMillis(10), fixed.backoff(7));
    }
}
