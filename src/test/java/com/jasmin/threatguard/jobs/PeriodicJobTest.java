package com.jasmin.threatguard.jobs;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PeriodicJobTest {

    @Mock
    private TaskScheduler scheduler;
    @Mock
    private ScheduledFuture<Object> future;

    private static class CountingJob extends PeriodicJob {
        final AtomicInteger runs = new AtomicInteger();
        Runnable body = () -> { };

        CountingJob() {
            super("counting", Duration.ofSeconds(60));
        }

        @Override
        protected void execute() {
            runs.incrementAndGet();
            body.run();
        }
    }

    @Test
    void runOnceExecutesTheJob() {
        CountingJob job = new CountingJob();

        assertThat(job.runOnce()).isTrue();
        assertThat(job.runs.get()).isEqualTo(1);
        assertThat(job.isRunning()).isFalse();
    }

    @Test
    void overlappingTickIsSkipped() {
        CountingJob job = new CountingJob();
        boolean[] nested = new boolean[1];
        job.body = () -> nested[0] = job.runOnce();

        assertThat(job.runOnce()).isTrue();

        assertThat(nested[0]).isFalse();
        assertThat(job.runs.get()).isEqualTo(1);
    }

    @Test
    void failureIsContainedAndTheNextRunProceeds() {
        CountingJob job = new CountingJob();
        job.body = () -> {
            throw new IllegalStateException("db down");
        };

        assertThat(job.runOnce()).isTrue();
        assertThat(job.isRunning()).isFalse();
        assertThat(job.runOnce()).isTrue();
        assertThat(job.runs.get()).isEqualTo(2);
    }

    @Test
    void startSchedulesOnceAndStopCancels() {
        CountingJob job = new CountingJob();
        doReturn(future).when(scheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofSeconds(60)));

        job.start(scheduler);
        job.start(scheduler);
        assertThat(job.isScheduled()).isTrue();

        job.stop();

        verify(scheduler, times(1)).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofSeconds(60)));
        verify(future).cancel(false);
        assertThat(job.isScheduled()).isFalse();
    }
}
