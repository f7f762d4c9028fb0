package com.eyelevel.invoicetransformer.scheduler;

import com.eyelevel.invoicetransformer.config.NotificationConfig;
import com.eyelevel.invoicetransformer.service.notification.NotificationDispatcher;
import com.eyelevel.invoicetransformer.service.notification.NotificationSender;
import com.eyelevel.invoicetransformer.service.notification.ProcessingMetrics;
import com.eyelevel.invoicetransformer.service.notification.event.DailySummaryNotification;
import com.eyelevel.invoicetransformer.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.support.TaskExecutorAdapter;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class DailySummarySchedulerTest {

    private static final LocalDate DAY = LocalDate.of(2024, 6, 1);

    @Mock
    NotificationSender sender;

    private final NotificationConfig config = new NotificationConfig();
    private final ProcessingMetrics metrics = new ProcessingMetrics();
    private MutableClock clock;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        config.setEnabled(true);
        config.setDailySummaryTime("17:00");
        clock = new MutableClock(DAY.atTime(9, 0));
        dispatcher = new NotificationDispatcher(sender, new TaskExecutorAdapter(Runnable::run), config);
    }

    @Test
    @DisplayName("Emits once after the configured time and resets the tallies")
    void emitsOncePerDay() {
        final DailySummaryScheduler scheduler = new DailySummaryScheduler(config, metrics, dispatcher, clock);
        metrics.recordSuccess();
        metrics.recordError(DAY.atTime(10, 0), "INV200.xml", "bad root");

        clock.set(DAY.atTime(16, 59));
        assertThat(scheduler.sendIfDue()).isFalse();

        clock.set(DAY.atTime(17, 1));
        assertThat(scheduler.sendIfDue()).isTrue();

        final ArgumentCaptor<DailySummaryNotification> summary =
                ArgumentCaptor.forClass(DailySummaryNotification.class);
        verify(sender).onDailySummary(summary.capture());
        assertThat(summary.getValue().date()).isEqualTo(DAY);
        assertThat(summary.getValue().successCount()).isEqualTo(1);
        assertThat(summary.getValue().errorCount()).isEqualTo(1);
        assertThat(summary.getValue().totalProcessed()).isEqualTo(2);
        assertThat(summary.getValue().errors()).hasSize(1);
        assertThat(metrics.hasActivity()).isFalse();

        metrics.recordSuccess();
        clock.set(DAY.atTime(23, 0));
        assertThat(scheduler.sendIfDue()).isFalse();

        clock.set(DAY.plusDays(1).atTime(17, 0));
        assertThat(scheduler.sendIfDue()).isTrue();
    }

    @Test
    @DisplayName("Skips a day with no activity but still counts it as sent")
    void skipsQuietDay() {
        final DailySummaryScheduler scheduler = new DailySummaryScheduler(config, metrics, dispatcher, clock);

        clock.set(DAY.atTime(17, 5));
        assertThat(scheduler.sendIfDue()).isFalse();

        metrics.recordSuccess();
        clock.set(DAY.atTime(18, 0));
        assertThat(scheduler.sendIfDue()).isFalse();
        verify(sender, never()).onDailySummary(any());

        clock.set(DAY.plusDays(1).atTime(17, 5));
        assertThat(scheduler.sendIfDue()).isTrue();
    }

    @Test
    @DisplayName("A start after today's summary time waits for tomorrow")
    void startAfterSummaryTimeWaitsForTomorrow() {
        clock.set(DAY.atTime(18, 0));
        final DailySummaryScheduler scheduler = new DailySummaryScheduler(config, metrics, dispatcher, clock);
        metrics.recordSuccess();

        clock.set(DAY.atTime(18, 1));
        assertThat(scheduler.sendIfDue()).isFalse();

        clock.set(DAY.plusDays(1).atTime(9, 0));
        assertThat(scheduler.sendIfDue()).isFalse();

        clock.set(DAY.plusDays(1).atTime(17, 0));
        assertThat(scheduler.sendIfDue()).isTrue();
    }

    @Test
    void doesNothingWhenSummariesAreOff() {
        config.setSendDailySummary(false);
        final DailySummaryScheduler scheduler = new DailySummaryScheduler(config, metrics, dispatcher, clock);
        metrics.recordSuccess();

        clock.set(LocalDateTime.of(DAY.plusDays(2), config.dailySummaryLocalTime()));
        assertThat(scheduler.sendIfDue()).isFalse();
        assertThat(metrics.hasActivity()).isTrue();
    }

    @Test
    void flushesPendingTotalsOnShutdown() {
        final DailySummaryScheduler scheduler = new DailySummaryScheduler(config, metrics, dispatcher, clock);
        scheduler.flushOnShutdown();
        verify(sender, never()).onDailySummary(any());

        metrics.recordSuccess();
        scheduler.flushOnShutdown();

        verify(sender).onDailySummary(new DailySummaryNotification(DAY, 1, 0, java.util.List.of()));
        assertThat(metrics.hasActivity()).isFalse();
    }
}
