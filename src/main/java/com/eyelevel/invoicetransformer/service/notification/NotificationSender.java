package com.eyelevel.invoicetransformer.service.notification;

import com.eyelevel.invoicetransformer.service.notification.event.DailySummaryNotification;
import com.eyelevel.invoicetransformer.service.notification.event.ErrorNotification;
import com.eyelevel.invoicetransformer.service.notification.event.SuccessNotification;

/**
 * Defines the contract for delivering processing events to people (e-mail, chat, ...).
 * <p>
 * Implementations are always invoked from the notification thread, never from the file pipeline, and
 * may block or throw without affecting file outcomes.
 */
public interface NotificationSender {

    void onSuccess(SuccessNotification notification);

    void onError(ErrorNotification notification);

    void onDailySummary(DailySummaryNotification notification);
}
