package com.eyelevel.invoicetransformer.service.notification;

import com.eyelevel.invoicetransformer.service.notification.event.DailySummaryNotification;
import com.eyelevel.invoicetransformer.service.notification.event.ErrorNotification;
import com.eyelevel.invoicetransformer.service.notification.event.ProcessingError;
import com.eyelevel.invoicetransformer.service.notification.event.SuccessNotification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * The default {@link NotificationSender}: writes each event to the application log.
 */
@Slf4j
@Component
public class LoggingNotificationSender implements NotificationSender {

    @Override
    public void onSuccess(final SuccessNotification notification) {
        log.info("[notify] ✅ {} -> {}", notification.fileName(), notification.outputFileName());
    }

    @Override
    public void onError(final ErrorNotification notification) {
        log.warn("[notify] ❌ {} failed at {}: {}", notification.fileName(), notification.occurredAt(),
                 notification.message());
    }

    @Override
    public void onDailySummary(final DailySummaryNotification notification) {
        log.info("[notify] 📊 Daily summary for {}: {} successful, {} failed, {} total", notification.date(),
                 notification.successCount(), notification.errorCount(), notification.totalProcessed());
        for (final ProcessingError error : notification.errors()) {
            log.info("[notify]    {} {} - {}", error.timestamp(), error.fileName(), error.message());
        }
    }
}
