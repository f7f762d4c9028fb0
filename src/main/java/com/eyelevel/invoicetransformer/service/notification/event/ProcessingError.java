package com.eyelevel.invoicetransformer.service.notification.event;

import java.time.LocalDateTime;

/**
 * A failure recorded for the daily summary.
 */
public record ProcessingError(LocalDateTime timestamp, String fileName, String message) {
}
