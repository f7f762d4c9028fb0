package com.eyelevel.invoicetransformer.service.notification;

import com.eyelevel.invoicetransformer.config.NotificationConfig;
import com.eyelevel.invoicetransformer.config.TaskExecutorConfig;
import com.eyelevel.invoicetransformer.service.notification.event.DailySummaryNotification;
import com.eyelevel.invoicetransformer.service.notification.event.ErrorNotification;
import com.eyelevel.invoicetransformer.service.notification.event.SuccessNotification;
import com.eyelevel.invoicetransformer.support.Polling;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;

class NotificationDispatcherTest {

    private static final LocalDateTime AT = LocalDateTime.of(2024, 6, 1, 9, 30);

    private final RecordingSender sender = new RecordingSender();
    private final NotificationConfig config = new NotificationConfig();
    private AsyncTaskExecutor executor;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        config.setEnabled(true);
        executor = new TaskExecutorConfig().notificationTaskExecutor();
        dispatcher = new NotificationDispatcher(sender, executor, config);
    }

    @AfterEach
    void tearDown() {
        ((ThreadPoolTaskExecutor) executor).shutdown();
    }

    @Test
    @DisplayName("Delivers events in publication order off the calling thread")
    void deliversInOrder() throws Exception {
        dispatcher.publishSuccess(new SuccessNotification("A.xml", "A_Transformed.xml", AT));
        dispatcher.publishError(new ErrorNotification("B.xml", "bad root", "trace", AT));
        dispatcher.publishDailySummary(new DailySummaryNotification(LocalDate.of(2024, 6, 1), 1, 1, List.of()));

        Polling.waitUntil(Duration.ofSeconds(5), () -> sender.delivered.size() == 3);
        assertThat(sender.delivered).containsExactly("success:A.xml", "error:B.xml", "summary:2");
        assertThat(sender.threads).allMatch(name -> name.startsWith("notify-"));
    }

    @Test
    @DisplayName("Drops events while notifications are disabled")
    void dropsWhenDisabled() throws Exception {
        config.setEnabled(false);

        dispatcher.publishSuccess(new SuccessNotification("A.xml", "A_Transformed.xml", AT));
        Thread.sleep(200);

        assertThat(sender.delivered).isEmpty();
    }

    @Test
    @DisplayName("A failing delivery neither reaches the publisher nor blocks later events")
    void survivesSenderFailure() throws Exception {
        sender.failNext = true;

        assertThatNoException().isThrownBy(
                () -> dispatcher.publishError(new ErrorNotification("A.xml", "first", "trace", AT)));
        dispatcher.publishError(new ErrorNotification("B.xml", "second", "trace", AT));

        Polling.waitUntil(Duration.ofSeconds(5), () -> sender.delivered.contains("error:B.xml"));
        assertThat(sender.delivered).containsExactly("error:B.xml");
    }

    private static final class RecordingSender implements NotificationSender {
        private final List<String> delivered = new CopyOnWriteArrayList<>();
        private final List<String> threads = new CopyOnWriteArrayList<>();
        private volatile boolean failNext;

        @Override
        public void onSuccess(final SuccessNotification notification) {
            record("success:" + notification.fileName());
        }

        @Override
        public void onError(final ErrorNotification notification) {
            record("error:" + notification.fileName());
        }

        @Override
        public void onDailySummary(final DailySummaryNotification notification) {
            record("summary:" + notification.totalProcessed());
        }

        private void record(final String event) {
            if (failNext) {
                failNext = false;
                throw new IllegalStateException("mail relay unavailable");
            }
            delivered.add(event);
            threads.add(Thread.currentThread().getName());
        }
    }
}
