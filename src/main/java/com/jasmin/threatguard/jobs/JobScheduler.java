package com.jasmin.threatguard.jobs;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Starts every {@link PeriodicJob} with the application context and stops them on shutdown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobScheduler implements SmartLifecycle {

    private final List<PeriodicJob> jobs;
    private final TaskScheduler jobTaskScheduler;
    private final JobsProperties props;
    private volatile boolean running;

    @Override
    public void start() {
        if (!props.isEnabled()) {
            log.info("Background jobs disabled");
            running = true;
            return;
        }
        jobs.forEach(job -> job.start(jobTaskScheduler));
        running = true;
    }

    @Override
    public void stop() {
        jobs.forEach(PeriodicJob::stop);
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
