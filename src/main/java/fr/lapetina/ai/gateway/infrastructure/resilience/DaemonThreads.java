package fr.lapetina.ai.gateway.infrastructure.resilience;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the daemon schedulers backing timers and backoff sleeps.
 */
final class DaemonThreads {

    private DaemonThreads() {
    }

    static ScheduledExecutorService scheduler(String name) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
