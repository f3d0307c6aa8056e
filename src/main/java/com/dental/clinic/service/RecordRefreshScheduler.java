package com.dental.clinic.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.concurrent.ScheduledFuture;

/**
 * Checks for today's appointments on a fixed interval and tells listeners the store was
 * polled. Read-only; cancelled when the application shuts down.
 */
@Component
public class RecordRefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(RecordRefreshScheduler.class);

    private final PatientRecordService records;
    private final TaskScheduler taskScheduler;
    private final ApplicationEventPublisher events;
    private final Clock clock;
    private final Duration interval;
    private final boolean enabled;

    private ScheduledFuture<?> task;

    public RecordRefreshScheduler(PatientRecordService records,
                                  TaskScheduler taskScheduler,
                                  ApplicationEventPublisher events,
                                  Clock clock,
                                  @Value("${clinic.refresh.interval:60s}") Duration interval,
                                  @Value("${clinic.refresh.enabled:true}") boolean enabled) {
        this.records = records;
        this.taskScheduler = taskScheduler;
        this.events = events;
        this.clock = clock;
        this.interval = interval;
        this.enabled = enabled;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!enabled) {
            log.info("Records refresh disabled");
            return;
        }
        start();
    }

    public synchronized void start() {
        if (task != null && !task.isDone()) {
            return;
        }
        task = taskScheduler.scheduleAtFixedRate(this::refresh, interval);
        log.info("Records refresh every {}s", interval.getSeconds());
    }

    @PreDestroy
    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
            log.info("Records refresh stopped");
        }
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isDone();
    }

    /**
     * One tick. Failures are logged so the next tick still runs.
     */
    public void refresh() {
        try {
            LocalDate today = LocalDate.now(clock);
            long dueToday = records.countAppointmentsOn(today);
            if (dueToday > 0) {
                log.info("There are {} appointment(s) scheduled for today.", dueToday);
            }
            events.publishEvent(new RecordsRefreshedEvent(today, dueToday));
        } catch (Exception e) {
            log.error("Records refresh failed", e);
        }
    }
}
