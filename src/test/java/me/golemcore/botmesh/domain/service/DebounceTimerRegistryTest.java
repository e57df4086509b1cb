package me.golemcore.botmesh.domain.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DebounceTimerRegistryTest {

    private DebounceTimerRegistry timers;

    @BeforeEach
    void setUp() {
        timers = new DebounceTimerRegistry();
    }

    @AfterEach
    void tearDown() {
        timers.shutdown();
    }

    @Test
    void shouldRunTaskAfterDelay() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);

        timers.schedule("s-1", Duration.ofMillis(50), fired::countDown);

        assertTrue(timers.isPending("s-1"));
        assertTrue(fired.await(2, TimeUnit.SECONDS));
        assertFalse(timers.isPending("s-1"));
    }

    @Test
    void shouldReplacePendingTimerForSameKey() throws InterruptedException {
        List<String> runs = new CopyOnWriteArrayList<>();
        CountDownLatch fired = new CountDownLatch(1);

        timers.schedule("s-1", Duration.ofMillis(100), () -> runs.add("first"));
        timers.schedule("s-1", Duration.ofMillis(150), () -> {
            runs.add("second");
            fired.countDown();
        });

        assertTrue(fired.await(2, TimeUnit.SECONDS));
        Thread.sleep(100);
        assertEquals(List.of("second"), runs);
        assertEquals(0, timers.size());
    }

    @Test
    void shouldFireAllPendingTimersOnCallingThread() {
        AtomicInteger runs = new AtomicInteger();
        Thread caller = Thread.currentThread();
        List<Thread> runners = new CopyOnWriteArrayList<>();

        timers.schedule("s-1", Duration.ofMinutes(5), () -> {
            runs.incrementAndGet();
            runners.add(Thread.currentThread());
        });
        timers.schedule("s-2", Duration.ofMinutes(5), runs::incrementAndGet);

        assertEquals(2, timers.fireAll());
        assertEquals(2, runs.get());
        assertEquals(List.of(caller), runners);
        assertTrue(timers.pendingKeys().isEmpty());
    }

    @Test
    void shouldCancelPendingTimer() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();
        timers.schedule("s-1", Duration.ofMillis(50), runs::incrementAndGet);

        assertTrue(timers.cancel("s-1"));
        assertFalse(timers.cancel("s-1"));
        Thread.sleep(150);

        assertEquals(0, runs.get());
    }

    @Test
    void shouldContainFailingTask() {
        timers.schedule("s-1", Duration.ofMinutes(1), () -> {
            throw new IllegalStateException("boom");
        });

        assertDoesNotThrow(() -> timers.fireAll());
    }
}
