package com.eyelevel.invoicetransformer.service.notification;

import com.eyelevel.invoicetransformer.config.NotificationConfig;
import com.eyelevel.invoicetransformer.service.notification.event.DailySummaryNotification;
import com.eyelevel.invoicetransformer.service.notification.event.ErrorNotification;
import com.eyelevel.invoicetransformer.service.notification.event.SuccessNotification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * The outbound channel between the file pipeline and the {@link NotificationSender}. Events are queued
 * on the {@code notificationTaskExecutor} and delivered in order on its single thread.
 * <p>
 * Publishing never blocks and never throws: a full queue, a disabled channel or a failing sender only
 * produces a log line.
 */
@Slf4j
@Service
public class NotificationDispatcher {

    private final NotificationSender sender;
    private final AsyncTaskExecutor taskExecutor;
    private final NotificationConfig config;

    public NotificationDispatcher(final NotificationSender sender,
                                  @Qualifier("notificationTaskExecutor") final AsyncTaskExecutor taskExecutor,
                                  final NotificationConfig config) {
        this.sender = sender;
        this.taskExecutor = taskExecutor;
        this.config = config;
    }

    public void publishSuccess(final SuccessNotification notification) {
        dispatch("success for " + notification.fileName(), () -> sender.onSuccess(notification));
    }

    public void publishError(final ErrorNotification notification) {
        dispatch("error for " + notification.fileName(), () -> sender.onError(notification));
    }

    public void publishDailySummary(final DailySummaryNotification notification) {
        dispatch("daily summary for " + notification.date(), () -> sender.onDailySummary(notification));
    }

    private void dispatch(final String description, final Runnable delivery) {
        if (!config.isEnabled()) {
            log.trace("Notifications disabled; dropping {}", description);
            return;
        }
        try {
            taskExecutor.execute(() -> {
                try {
                    delivery.run();
                } catch (Exception e) {
                    log.warn("Notification delivery failed ({}). Processing is unaffected.", description, e);
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("Notification queue rejected {}: {}", description, e.getMessage());
        }
    }
}
