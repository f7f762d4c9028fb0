package com.eyelevel.invoicetransformer.service.notification.event;

import java.time.LocalDate;
import java.util.List;

/**
 * Totals since the previous summary.
 */
public record DailySummaryNotification(LocalDate date, int successCount, int errorCount,
                                       List<ProcessingError> errors) {

    public int totalProcessed() {
        return successCount + errorCount;
    }
}
