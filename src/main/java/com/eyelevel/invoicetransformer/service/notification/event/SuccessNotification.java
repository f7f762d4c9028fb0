package com.eyelevel.invoicetransformer.service.notification.event;

import java.time.LocalDateTime;

/**
 * Emitted after an input file was transformed and its source routed.
 *
 * @param fileName       The input file name.
 * @param outputFileName The name of the document written to the output folder.
 * @param processedAt    When processing finished.
 */
public record SuccessNotification(String fileName, String outputFileName, LocalDateTime processedAt) {
}
