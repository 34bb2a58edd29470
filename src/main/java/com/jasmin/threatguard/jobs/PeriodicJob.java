package com.jasmin.threatguard.jobs;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A fixed-rate background task. A run that is still in progress makes the next tick a no-op, so runs never
 * overlap. Failures are logged and the schedule continues.
 */
@Slf4j
public abstract class PeriodicJob {

    @Getter
    private final String name;
    @Getter
    private final Duration interval;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledFuture<?> future;

    protected PeriodicJob(String name, Duration interval) {
        this.name = name;
        this.interval = interval;
    }

    protected abstract void execute();

    public synchronized void start(TaskScheduler scheduler) {
        if (future != null) {
            return;
        }
        future = scheduler.scheduleAtFixedRate(this::runOnce, interval);
        log.info("Job scheduled: name={} interval={}", name, interval);
    }

    public synchronized void stop() {
        if (future != null) {
            future.cancel(false);
            future = null;
            log.info("Job stopped: name={}", name);
        }
    }

    public synchronized boolean isScheduled() {
        return future != null;
    }

    /** Runs the job now unless a run is already in progress. Returns whether it ran. */
    public boolean runOnce() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Job still running, skipping tick: name={}", name);
            return false;
        }
        long started = System.currentTimeMillis();
        try {
            execute();
            log.debug("Job finished: name={} durationMs={}", name, System.currentTimeMillis() - started);
        } catch (Exception e) {
            log.error("Job failed: name={}", name, e);
        } finally {
            running.set(false);
        }
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }
}
