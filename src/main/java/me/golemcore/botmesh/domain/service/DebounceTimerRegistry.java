package me.golemcore.botmesh.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Process-local table of debounce timers keyed by session id. At most one
 * timer is pending per key; scheduling again replaces the previous timer.
 *
 * <p>
 * A timer is only a wake-up signal. The work it runs must tolerate having
 * nothing left to do.
 */
@Component
@Slf4j
public class DebounceTimerRegistry {

    private final Map<String, PendingTimer> timers = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;

    public DebounceTimerRegistry() {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "debounce-timer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Schedules {@code task} to run after {@code delay}, cancelling any timer
     * pending for the same key.
     */
    public void schedule(String key, Duration delay, Runnable task) {
        PendingTimer timer = new PendingTimer(task);
        PendingTimer previous = timers.put(key, timer);
        if (previous != null) {
            previous.cancel();
        }
        timer.future = scheduler.schedule(() -> fire(key, timer), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean cancel(String key) {
        PendingTimer timer = timers.remove(key);
        if (timer == null) {
            return false;
        }
        timer.cancel();
        return true;
    }

    public boolean isPending(String key) {
        return timers.containsKey(key);
    }

    public Set<String> pendingKeys() {
        return Set.copyOf(timers.keySet());
    }

    public int size() {
        return timers.size();
    }

    /**
     * Runs every pending task now on the calling thread and clears the table.
     *
     * @return number of tasks run
     */
    public int fireAll() {
        List<String> keys = new ArrayList<>(timers.keySet());
        int fired = 0;
        for (String key : keys) {
            PendingTimer timer = timers.get(key);
            if (timer != null && timers.remove(key, timer)) {
                timer.cancel();
                run(key, timer);
                fired++;
            }
        }
        return fired;
    }

    @PreDestroy
    public void shutdown() {
        timers.values().forEach(PendingTimer::cancel);
        timers.clear();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void fire(String key, PendingTimer timer) {
        // A replaced timer that already started firing must not run.
        if (timers.remove(key, timer)) {
            run(key, timer);
        }
    }

    private void run(String key, PendingTimer timer) {
        try {
            timer.task.run();
        } catch (RuntimeException e) {
            log.error("[Debounce] timer task failed: key={}", key, e);
        }
    }

    private static final class PendingTimer {

        private final Runnable task;
        private volatile ScheduledFuture<?> future;

        private PendingTimer(Runnable task) {
            this.task = task;
        }

        private void cancel() {
            ScheduledFuture<?> scheduled = future;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }
}
