package io.admission.breaker;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CircuitBreakerTest {

    @Test
    void rejectsNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreaker(0, Duration.ofSeconds(1)));
    }

    @Test
    void rejectsNegativeCooldown() {
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreaker(3, Duration.ofMillis(-1)));
    }

    @Test
    void tripsWhenFailuresReachThreshold() {
        CircuitBreaker breaker = new CircuitBreaker(3, Duration.ofSeconds(1));

        assertFalse(breaker.onFailure(100));
        assertFalse(breaker.onFailure(200));
        assertTrue(breaker.onFailure(300));

        BreakerState state = breaker.state();
        assertTrue(state.isOpen());
        assertEquals(3, state.failureCount());
        assertEquals(300, state.lastFailureTime());
        assertEquals(300, state.openedAt());
    }

    @Test
    void outcomesWhileOpenAreIgnored() {
        CircuitBreaker breaker = new CircuitBreaker(1, Duration.ofSeconds(1));
        breaker.onFailure(100);

        assertFalse(breaker.onFailure(500));
        assertFalse(breaker.onSuccess());

        BreakerState state = breaker.state();
        assertEquals(1, state.failureCount());
        assertEquals(0, state.successCount());
        assertEquals(100, state.lastFailureTime());
    }

    @Test
    void closesOnlyAfterCooldownStrictlyElapsed() {
        CircuitBreaker breaker = new CircuitBreaker(1, Duration.ofMillis(1000));
        breaker.onFailure(10_000);

        assertFalse(breaker.tryClose(10_500));
        assertFalse(breaker.tryClose(11_000));
        assertTrue(breaker.tryClose(11_001));

        BreakerState state = breaker.state();
        assertFalse(state.isOpen());
        assertEquals(0, state.failureCount());
        assertEquals(0, state.successCount());
    }

    @Test
    void tryCloseOnClosedBreakerIsNoop() {
        CircuitBreaker breaker = new CircuitBreaker(2, Duration.ZERO);
        assertFalse(breaker.tryClose(1));
    }

    @Test
    void remainingCooldownCountsDownToZero() {
        CircuitBreaker breaker = new CircuitBreaker(1, Duration.ofMillis(1000));
        assertEquals(0, breaker.remainingCooldownMs(0));

        breaker.onFailure(5_000);

        assertEquals(1001, breaker.remainingCooldownMs(5_000));
        assertEquals(1, breaker.remainingCooldownMs(6_000));
        assertEquals(0, breaker.remainingCooldownMs(7_000));
    }

    @Test
    void fiveSuccessesHealFailureCount() {
        CircuitBreaker breaker = new CircuitBreaker(10, Duration.ofSeconds(30));
        breaker.onFailure(1);
        breaker.onFailure(2);

        for (int i = 0; i < CircuitBreaker.HEALING_SUCCESSES - 1; i++) {
            assertFalse(breaker.onSuccess());
        }
        assertEquals(2, breaker.state().failureCount());

        assertTrue(breaker.onSuccess());
        assertEquals(0, breaker.state().failureCount());
        assertEquals(0, breaker.state().successCount());
    }

    @Test
    void successesDoNotResetFailuresBeforeHealing() {
        CircuitBreaker breaker = new CircuitBreaker(3, Duration.ofSeconds(30));
        breaker.onFailure(1);
        breaker.onSuccess();
        breaker.onFailure(2);
        breaker.onSuccess();

        assertTrue(breaker.onFailure(3));
    }
}
