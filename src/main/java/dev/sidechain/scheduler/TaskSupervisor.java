package dev.sidechain.scheduler;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns every timer and periodic job of the realtime subsystem: presence debounce
 * timers, the presence timeout checker and the reconciliation sweep.
 * <p>
 * Tasks are registered under a name. Scheduling a name that is already registered
 * replaces the previous task, which is how a reconnect cancels a pending
 * offline transition. A failing task is logged and never stops its schedule.
 * On shutdown every task is cancelled and the pool is awaited.
 * </p>
 */
@Component
@Slf4j
public class TaskSupervisor {

    private final ThreadPoolTaskScheduler scheduler;
    private final Map<String, SupervisedTask> tasks = new ConcurrentHashMap<>();
    private volatile boolean shuttingDown;

    public TaskSupervisor(
            @Value("${supervisor.pool-size:4}") int poolSize,
            @Value("${supervisor.shutdown-await-seconds:10}") int shutdownAwaitSeconds) {
        this.scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("sidechain-supervisor-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(shutdownAwaitSeconds);
        scheduler.initialize();
        log.info("Task supervisor started (poolSize={}, shutdownAwait={}s)", poolSize, shutdownAwaitSeconds);
    }

    /**
     * Runs {@code task} once after {@code delay}, replacing any task registered under {@code name}.
     *
     * @return false if the supervisor is shutting down and the task was not scheduled
     */
    public boolean scheduleOnce(String name, Duration delay, Runnable task) {
        if (shuttingDown) {
            log.debug("Supervisor shutting down, not scheduling '{}'", name);
            return false;
        }
        SupervisedTask entry = new SupervisedTask(name, false);
        replace(name, entry);
        entry.future = scheduler.schedule(() -> {
            try {
                entry.runIfActive(task);
            } finally {
                tasks.remove(name, entry);
            }
        }, Instant.now().plus(delay));
        log.debug("Scheduled one-shot task '{}' in {}ms", name, delay.toMillis());
        return true;
    }

    /**
     * Runs {@code task} every {@code period} after {@code initialDelay}, replacing any task
     * registered under {@code name}.
     */
    public boolean scheduleAtFixedRate(String name, Duration initialDelay, Duration period, Runnable task) {
        if (shuttingDown) {
            log.debug("Supervisor shutting down, not scheduling '{}'", name);
            return false;
        }
        SupervisedTask entry = new SupervisedTask(name, true);
        replace(name, entry);
        entry.future = scheduler.scheduleAtFixedRate(() -> entry.runIfActive(task),
                Instant.now().plus(initialDelay), period);
        log.info("Scheduled periodic task '{}' every {}s (initial delay {}s)",
                name, period.toSeconds(), initialDelay.toSeconds());
        return true;
    }

    /**
     * @return true if a task was registered under {@code name} and is now cancelled
     */
    public boolean cancel(String name) {
        SupervisedTask entry = tasks.remove(name);
        if (entry == null) {
            return false;
        }
        entry.cancel();
        log.debug("Cancelled task '{}'", name);
        return true;
    }

    public boolean isScheduled(String name) {
        SupervisedTask entry = tasks.get(name);
        return entry != null && !entry.cancelled;
    }

    public Set<String> activeTaskNames() {
        return new TreeSet<>(tasks.keySet());
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        int count = tasks.size();
        tasks.values().forEach(SupervisedTask::cancel);
        tasks.clear();
        log.info("Task supervisor stopping, cancelled {} task(s)", count);
        scheduler.shutdown();
    }

    private void replace(String name, SupervisedTask entry) {
        SupervisedTask previous = tasks.put(name, entry);
        if (previous != null) {
            previous.cancel();
            log.debug("Replaced existing task '{}'", name);
        }
    }

    private static final class SupervisedTask {
        private final String name;
        private final boolean periodic;
        private volatile boolean cancelled;
        private volatile ScheduledFuture<?> future;

        private SupervisedTask(String name, boolean periodic) {
            this.name = name;
            this.periodic = periodic;
        }

        private void runIfActive(Runnable task) {
            if (cancelled) {
                return;
            }
            try {
                task.run();
            } catch (RuntimeException e) {
                // periodic tasks must survive a failing tick
                log.error("Supervised {} task '{}' failed: {}",
                        periodic ? "periodic" : "one-shot", name, e.getMessage(), e);
            }
        }

        private void cancel() {
            cancelled = true;
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
