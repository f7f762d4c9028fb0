package com.eyelevel.invoicetransformer.service.notification;

import com.eyelevel.invoicetransformer.service.notification.event.ProcessingError;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Success and error tallies since the last daily summary. Written by the file worker, read and reset by
 * the summary check; all access is synchronized so a reset cannot lose an update.
 */
@Component
public class ProcessingMetrics {

    /**
     * How many error details are kept between resets; older ones are dropped, the count stays exact.
     */
    public static final int MAX_ERROR_DETAILS = 500;

    private int successCount;
    private int errorCount;
    private final Deque<ProcessingError> errors = new ArrayDeque<>();

    public synchronized void recordSuccess() {
        successCount++;
    }

    public synchronized void recordError(final LocalDateTime timestamp, final String fileName, final String message) {
        errorCount++;
        if (errors.size() == MAX_ERROR_DETAILS) {
            errors.removeFirst();
        }
        errors.addLast(new ProcessingError(timestamp, fileName, message));
    }

    public synchronized boolean hasActivity() {
        return successCount > 0 || errorCount > 0;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(successCount, errorCount, List.copyOf(errors));
    }

    /**
     * Returns the current tallies and sets them back to zero in one step.
     */
    public synchronized Snapshot snapshotAndReset() {
        final Snapshot snapshot = snapshot();
        successCount = 0;
        errorCount = 0;
        errors.clear();
        return snapshot;
    }

    public record Snapshot(int successCount, int errorCount, List<ProcessingError> errors) {
    }
}
