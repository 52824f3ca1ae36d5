package org.holdem.service.poker.util;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.*;

@Slf4j
@Component
public class Timeouts {
    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(3, r -> {
        Thread th = new Thread(r, "table-timer");
        th.setDaemon(true);
        return th;
    });

    /** Runs {@code task} once after {@code delayMs}; the returned handle cancels it. */
    public ScheduledFuture<?> schedule(String tableId, String name, long delayMs, Runnable task) {
        log.debug("Timer {} armed for table {} ({} ms)", name, tableId, delayMs);
        return scheduler.schedule(task, delayMs, TimeUnit.MILLISECONDS);
    }

    /** @return false if the task already started or was cancelled before */
    public boolean cancel(ScheduledFuture<?> handle) {
        return handle != null && handle.cancel(false);
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }
}
