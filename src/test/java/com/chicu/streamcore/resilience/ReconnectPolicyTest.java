package com.chicu.streamcore.resilience;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ReconnectPolicyTest {

    private static ReconnectPolicy policy(double jitter, int maxAttempts, double random) {
        return new ReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), jitter, maxAttempts, () -> random);
    }

    @Test
    void ceiling_shouldDoubleAndCapAtMax() {
        ReconnectPolicy p = policy(0.0, 100, 0.5);

        assertEquals(Duration.ofSeconds(1), p.ceiling(0));
        assertEquals(Duration.ofSeconds(2), p.ceiling(1));
        assertEquals(Duration.ofSeconds(4), p.ceiling(2));
        assertEquals(Duration.ofSeconds(32), p.ceiling(5));
        assertEquals(Duration.ofSeconds(60), p.ceiling(6), "64s упирается в max");
        assertEquals(Duration.ofSeconds(60), p.ceiling(500), "без переполнения на больших номерах");
    }

    @Test
    void ceiling_shouldBeMonotonic() {
        ReconnectPolicy p = policy(0.0, 100, 0.5);
        Duration prev = Duration.ZERO;
        for (int i = 0; i < 100; i++) {
            Duration d = p.ceiling(i);
            assertTrue(d.compareTo(prev) >= 0, "attempt " + i);
            prev = d;
        }
    }

    @Test
    void nextDelay_shouldStayWithinJitterBounds() {
        ReconnectPolicy low = policy(0.2, 100, 0.0);
        ReconnectPolicy high = policy(0.2, 100, 0.999999);
        ReconnectPolicy mid = policy(0.2, 100, 0.5);

        assertEquals(800, low.nextDelay(0).toMillis(), "1s * (1 - 0.2)");
        assertTrue(high.nextDelay(0).toMillis() <= 1200);
        assertTrue(high.nextDelay(0).toMillis() >= 1199);
        assertEquals(4000, mid.nextDelay(2).toMillis(), "r=0.5: без сдвига");
        assertEquals(48_000, low.nextDelay(10).toMillis(), "60s * 0.8");
    }

    @Test
    void nextDelay_shouldCountAttempts_andResetToBase() {
        ReconnectPolicy p = policy(0.0, 100, 0.5);

        assertEquals(Duration.ofSeconds(1), p.nextDelay());
        assertEquals(Duration.ofSeconds(2), p.nextDelay());
        assertEquals(Duration.ofSeconds(4), p.nextDelay());
        assertEquals(3, p.attempts());

        p.reset();

        assertEquals(0, p.attempts());
        assertEquals(Duration.ofSeconds(1), p.nextDelay(), "после reset снова base");
    }

    @Test
    void nextDelay_shouldThrowPermanentFailure_afterMaxAttempts() {
        ReconnectPolicy p = policy(0.0, 3, 0.5);
        p.nextDelay();
        p.nextDelay();
        p.nextDelay();

        assertTrue(p.exhausted());
        PermanentFailureException ex = assertThrows(PermanentFailureException.class, p::nextDelay);
        assertEquals(3, ex.getAttempts());
    }

    @Test
    void constructor_shouldRejectBadArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ZERO, Duration.ofSeconds(1), 0.1, 1, () -> 0.5));
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1), 0.1, 1, () -> 0.5));
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(2), 1.0, 1, () -> 0.5));
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(2), 0.1, 0, () -> 0.5));
    }
}
