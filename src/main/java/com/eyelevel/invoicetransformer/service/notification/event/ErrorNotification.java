package com.eyelevel.invoicetransformer.service.notification.event;

import java.time.LocalDateTime;

/**
 * Emitted after an input file failed and was quarantined.
 *
 * @param fileName   The input file name.
 * @param message    The failure message, as written to the sidecar file.
 * @param detail     Exception type and stack trace; may be {@code null}.
 * @param occurredAt When the failure was handled.
 */
public record ErrorNotification(String fileName, String message, String detail, LocalDateTime occurredAt) {
}
