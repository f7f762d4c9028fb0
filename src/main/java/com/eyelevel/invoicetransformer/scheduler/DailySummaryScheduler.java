package com.eyelevel.invoicetransformer.scheduler;

import com.eyelevel.invoicetransformer.config.NotificationConfig;
import com.eyelevel.invoicetransformer.service.notification.NotificationDispatcher;
import com.eyelevel.invoicetransformer.service.notification.ProcessingMetrics;
import com.eyelevel.invoicetransformer.service.notification.event.DailySummaryNotification;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Emits the daily summary once the configured time of day has passed, then resets the tallies.
 * <p>
 * The check runs independently of file processing. A due summary with no activity since the last one
 * is skipped but still counts as sent for that day.
 */
@Slf4j
@Component
public class DailySummaryScheduler {

    private final NotificationConfig config;
    private final ProcessingMetrics metrics;
    private final NotificationDispatcher notifications;
    private final Clock clock;

    private LocalDateTime lastSummaryAt;

    public DailySummaryScheduler(final NotificationConfig config, final ProcessingMetrics metrics,
                                 final NotificationDispatcher notifications, final Clock clock) {
        this.config = config;
        this.metrics = metrics;
        this.notifications = notifications;
        this.clock = clock;
        this.lastSummaryAt = LocalDateTime.now(clock);
    }

    @Scheduled(fixedDelayString = "${app.notification.summary-check-interval-ms:60000}")
    public void checkDailySummary() {
        try {
            sendIfDue();
        } catch (Exception e) {
            log.error("Daily summary check failed. It will run again on the next cycle.", e);
        }
    }

    /**
     * @return {@code true} if a summary was emitted.
     */
    synchronized boolean sendIfDue() {
        if (!config.isSendDailySummary()) {
            return false;
        }
        final LocalDateTime now = LocalDateTime.now(clock);
        final LocalDateTime due = mostRecentSummaryTime(now);
        if (!lastSummaryAt.isBefore(due)) {
            return false;
        }
        lastSummaryAt = now;
        if (!metrics.hasActivity()) {
            log.debug("Daily summary due at {} skipped: no files processed since the last one", due);
            return false;
        }
        emit(now.toLocalDate());
        return true;
    }

    /**
     * Emits a final summary on shutdown if anything happened since the last one.
     */
    @PreDestroy
    public synchronized void flushOnShutdown() {
        if (config.isFlushSummaryOnShutdown() && metrics.hasActivity()) {
            log.info("Flushing daily summary on shutdown");
            emit(LocalDate.now(clock));
        }
    }

    private void emit(final LocalDate date) {
        final ProcessingMetrics.Snapshot totals = metrics.snapshotAndReset();
        log.info("Daily summary for {}: {} successful, {} failed", date, totals.successCount(), totals.errorCount());
        notifications.publishDailySummary(
                new DailySummaryNotification(date, totals.successCount(), totals.errorCount(), totals.errors()));
    }

    private LocalDateTime mostRecentSummaryTime(final LocalDateTime now) {
        final LocalDateTime today = now.toLocalDate().atTime(config.dailySummaryLocalTime());
        return now.isBefore(today) ? today.minusDays(1) : today;
    }
}
