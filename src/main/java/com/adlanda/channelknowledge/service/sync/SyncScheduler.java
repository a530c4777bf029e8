package com.adlanda.channelknowledge.service.sync;

import com.adlanda.channelknowledge.config.PipelineProperties;
import com.adlanda.channelknowledge.health.PipelineHealthIndicator;
import com.adlanda.channelknowledge.model.TickReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@link SyncOrchestrator#tick()} on a single thread with a fixed delay between ticks.
 *
 * Ticks never overlap. A failing tick is logged and the loop carries on; only an
 * unreachable relational store stops it. On shutdown the current tick gets
 * {@code pipeline.scheduler.shutdown-grace} to finish before it is interrupted.
 */
@Component
public class SyncScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

    private final SyncOrchestrator orchestrator;
    private final PipelineHealthIndicator health;
    private final PipelineProperties.Scheduler settings;

    private ScheduledExecutorService loop;
    private ScheduledFuture<?> schedule;
    private volatile boolean running;

    public SyncScheduler(SyncOrchestrator orchestrator, PipelineHealthIndicator health, PipelineProperties properties) {
        this.orchestrator = orchestrator;
        this.health = health;
        this.settings = properties.getScheduler();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (!settings.isEnabled()) {
            log.info("Sync loop disabled (pipeline.scheduler.enabled=false)");
            return;
        }
        loop = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("sync-loop-"));
        schedule = loop.scheduleWithFixedDelay(this::runTick,
                settings.getInitialDelay().toMillis(), settings.getTickInterval().toMillis(), TimeUnit.MILLISECONDS);
        running = true;
        log.info("Sync loop started: tick every {}, housekeeping every {} ticks",
                settings.getTickInterval(), settings.getHousekeepingEveryTicks());
    }

    @Override
    public synchronized void stop() {
        if (loop == null) {
            running = false;
            return;
        }
        log.info("Stopping sync loop");
        if (schedule != null) {
            schedule.cancel(false);
        }
        loop.shutdown();
        Duration grace = settings.getShutdownGrace();
        try {
            if (!loop.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Tick still running after {}, interrupting", grace);
                loop.shutdownNow();
            }
        } catch (InterruptedException e) {
            loop.shutdownNow();
            Thread.currentThread().interrupt();
        }
        loop = null;
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    void runTick() {
        try {
            TickReport report = orchestrator.tick();
            health.recordTick(report);
        } catch (DataAccessResourceFailureException e) {
            log.error("Relational store unavailable, stopping sync loop", e);
            health.recordHalt(e.getMessage());
            if (schedule != null) {
                schedule.cancel(false);
            }
        } catch (RuntimeException e) {
            log.error("Sync tick failed", e);
            health.recordTickFailure();
        }
    }
}
