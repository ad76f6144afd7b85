package org.qwed.resilience;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerTest {

    private static final long COOL_DOWN = 30_000L;

    private AtomicLong now;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        now = new AtomicLong(1_000L);
        breaker = new CircuitBreaker("logic", 20, 10, 0.5, COOL_DOWN, now::get);
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            breaker.onFailure(breaker.tryAcquire().orElseThrow());
        }
    }

    private void succeed(int times) {
        for (int i = 0; i < times; i++) {
            breaker.onSuccess(breaker.tryAcquire().orElseThrow());
        }
    }

    @Nested
    @DisplayName("CLOSED → OPEN")
    class TripTests {

        @Test
        @DisplayName("连续 10 次失败后打开，之后的申请被短路")
        void testTrip_AfterTenFailures() {
            fail(9);
            assertEquals(CircuitState.CLOSED, breaker.getState(), "9 次失败不足最小调用数");

            fail(1);
            CircuitBreakerState snapshot = breaker.snapshot();
            assertAll("10 failures",
                    () -> assertEquals(CircuitState.OPEN, snapshot.getState()),
                    () -> assertEquals(10, snapshot.getConsecutiveFailures()),
                    () -> assertEquals(1.0, snapshot.getWindowFailureRate()),
                    () -> assertEquals(1_000L, snapshot.getOpenedAt().orElseThrow()),
                    () -> assertTrue(breaker.tryAcquire().isEmpty(), "冷却期内应短路")
            );
        }

        @Test
        @DisplayName("失败率恰好等于阈值时不打开")
        void testTrip_ExactlyAtThreshold() {
            succeed(10);
            fail(10);

            assertAll(
                    () -> assertEquals(CircuitState.CLOSED, breaker.getState()),
                    () -> assertEquals(0.5, breaker.snapshot().getWindowFailureRate()),
                    () -> assertEquals(20, breaker.snapshot().getWindowSize())
            );
        }

        @Test
        @DisplayName("被取消的调用不计入窗口")
        void testCancelled_NotCounted() {
            for (int i = 0; i < 15; i++) {
                breaker.onCancelled(breaker.tryAcquire().orElseThrow());
            }

            assertAll(
                    () -> assertEquals(CircuitState.CLOSED, breaker.getState()),
                    () -> assertEquals(0, breaker.snapshot().getWindowSize())
            );
        }
    }

    @Nested
    @DisplayName("OPEN → HALF_OPEN → CLOSED / OPEN")
    class ProbeTests {

        @BeforeEach
        void trip() {
            fail(10);
        }

        @Test
        @DisplayName("冷却期结束后恰好放行一次探测")
        void testProbe_ExactlyOne() {
            now.addAndGet(COOL_DOWN - 1);
            assertTrue(breaker.tryAcquire().isEmpty(), "冷却尚未结束");

            now.addAndGet(1);
            Optional<CallPermit> probe = breaker.tryAcquire();
            Optional<CallPermit> second = breaker.tryAcquire();

            assertAll(
                    () -> assertTrue(probe.isPresent()),
                    () -> assertTrue(probe.orElseThrow().isProbe()),
                    () -> assertEquals(CircuitState.HALF_OPEN, breaker.getState()),
                    () -> assertTrue(second.isEmpty(), "探测进行中不再放行")
            );
        }

        @Test
        @DisplayName("探测成功：CLOSED 并清空窗口")
        void testProbe_Success() {
            now.addAndGet(COOL_DOWN);
            breaker.onSuccess(breaker.tryAcquire().orElseThrow());

            CircuitBreakerState snapshot = breaker.snapshot();
            assertAll(
                    () -> assertEquals(CircuitState.CLOSED, snapshot.getState()),
                    () -> assertEquals(0, snapshot.getWindowSize()),
                    () -> assertEquals(0, snapshot.getConsecutiveFailures())
            );
        }

        @Test
        @DisplayName("探测失败：重新 OPEN 并重新计时")
        void testProbe_Failure() {
            now.addAndGet(COOL_DOWN);
            breaker.onFailure(breaker.tryAcquire().orElseThrow());

            assertAll(
                    () -> assertEquals(CircuitState.OPEN, breaker.getState()),
                    () -> assertEquals(1_000L + COOL_DOWN, breaker.snapshot().getOpenedAt().orElseThrow()),
                    () -> assertTrue(breaker.tryAcquire().isEmpty())
            );
        }

        @Test
        @DisplayName("探测被取消：归还许可，状态不变")
        void testProbe_Cancelled() {
            now.addAndGet(COOL_DOWN);
            breaker.onCancelled(breaker.tryAcquire().orElseThrow());

            assertAll(
                    () -> assertEquals(CircuitState.HALF_OPEN, breaker.getState()),
                    () -> assertTrue(breaker.tryAcquire().isPresent(), "许可已归还，可以再次探测")
            );
        }
    }

    @Test
    @DisplayName("状态切换之前发出的许可迟到汇报时被忽略")
    void testStalePermit_Ignored() {
        CallPermit early = breaker.tryAcquire().orElseThrow();
        fail(10);
        now.addAndGet(COOL_DOWN);
        breaker.onSuccess(breaker.tryAcquire().orElseThrow());

        breaker.onFailure(early);

        assertAll(
                () -> assertEquals(CircuitState.CLOSED, breaker.getState()),
                () -> assertEquals(0, breaker.snapshot().getWindowSize())
        );
    }

    @Test
    @DisplayName("非法参数")
    void testConstructor_InvalidArguments() {
        assertAll(
                () -> assertThrows(IllegalArgumentException.class,
                        () -> new CircuitBreaker("x", 5, 10, 0.5, 0, now::get)),
                () -> assertThrows(IllegalArgumentException.class,
                        () -> new CircuitBreaker("x", 20, 10, 1.5, 0, now::get)),
                () -> assertThrows(IllegalArgumentException.class,
                        () -> new CircuitBreaker("x", 20, 10, 0.5, -1, now::get))
        );
    }
}
