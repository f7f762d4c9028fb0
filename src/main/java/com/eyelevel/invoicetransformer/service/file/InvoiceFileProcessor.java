package com.eyelevel.invoicetransformer.service.file;

import com.eyelevel.invoicetransformer.common.xml.XmlParser;
import com.eyelevel.invoicetransformer.exception.FileRoutingException;
import com.eyelevel.invoicetransformer.exception.InvoiceFormatException;
import com.eyelevel.invoicetransformer.model.FileProcessingStatus;
import com.eyelevel.invoicetransformer.model.TargetDocument;
import com.eyelevel.invoicetransformer.service.normalizer.InvoiceRecordNormalizer;
import com.eyelevel.invoicetransformer.service.notification.NotificationDispatcher;
import com.eyelevel.invoicetransformer.service.notification.ProcessingMetrics;
import com.eyelevel.invoicetransformer.service.notification.event.ErrorNotification;
import com.eyelevel.invoicetransformer.service.notification.event.SuccessNotification;
import com.eyelevel.invoicetransformer.service.transform.InvoiceTransformer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs one claimed input file through its lifecycle: lock check, normalize, transform, write the
 * output and route the source. Every failure is handled here and turned into a quarantined file, so a
 * bad file never stops the files behind it.
 * <p>
 * A file that cannot even be quarantined stays in the input folder and fails again on every poll cycle.
 * Its failure is counted and published once; the repeats are only logged until the file leaves the
 * input folder.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InvoiceFileProcessor {

    private final FileLockChecker fileLockChecker;
    private final XmlParser xmlParser;
    private final InvoiceRecordNormalizer normalizer;
    private final InvoiceTransformer transformer;
    private final InvoiceFileRouter router;
    private final ProcessingMetrics metrics;
    private final NotificationDispatcher notifications;
    private final Clock clock;

    private final Set<Path> unquarantined = ConcurrentHashMap.newKeySet();

    /**
     * Processes a single input file.
     *
     * @param file The claimed input file.
     *
     * @return The terminal state: {@code SUCCESS}, {@code FAILURE}, {@code ABANDONED} (still locked, left
     * in place) or {@code SKIPPED} (no longer there).
     */
    public FileProcessingStatus process(final Path file) {
        final String fileName = file.getFileName().toString();

        if (!Files.isRegularFile(file)) {
            log.debug("'{}' is no longer in the input folder; skipping", fileName);
            unquarantined.remove(key(file));
            return FileProcessingStatus.SKIPPED;
        }

        final FileProcessingStatus lockStatus = fileLockChecker.awaitUnlocked(file);
        if (lockStatus != FileProcessingStatus.PROCESSING) {
            return lockStatus;
        }

        final LocalDateTime startedAt = LocalDateTime.now(clock);
        final String timestamp = InvoiceFileNames.timestamp(startedAt);
        log.info("Processing: {}", fileName);

        try {
            final TargetDocument target = transformer.transform(normalizer.normalize(read(file, fileName)));
            final Path output = router.writeOutput(target, fileName, timestamp);
            try {
                router.routeProcessedSource(file, timestamp);
            } catch (FileRoutingException e) {
                router.discardOutput(output);
                throw e;
            }

            unquarantined.remove(key(file));
            metrics.recordSuccess();
            log.info("✓ Successfully transformed: {} -> {}", fileName, output.getFileName());
            logRunningTotals();
            notifications.publishSuccess(
                    new SuccessNotification(fileName, output.getFileName().toString(), LocalDateTime.now(clock)));
            return FileProcessingStatus.SUCCESS;
        } catch (RuntimeException e) {
            handleFailure(file, fileName, timestamp, e);
            return FileProcessingStatus.FAILURE;
        }
    }

    private Document read(final Path file, final String fileName) {
        try (InputStream in = Files.newInputStream(file)) {
            return xmlParser.parse(in, fileName);
        } catch (IOException e) {
            throw new InvoiceFormatException("Failed to read " + fileName + ": " + e.getMessage(), e);
        }
    }

    private void handleFailure(final Path file, final String fileName, final String timestamp,
                               final RuntimeException failure) {
        final LocalDateTime failedAt = LocalDateTime.now(clock);
        final String message = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName();
        final boolean repeated = unquarantined.contains(key(file));

        if (repeated) {
            log.warn("✗ Failed again: {} ({})", fileName, message);
        } else {
            log.error("✗ Failed to process: {}", fileName, failure);
        }

        try {
            router.quarantine(file, timestamp, failedAt, message);
            unquarantined.remove(key(file));
        } catch (FileRoutingException e) {
            if (unquarantined.add(key(file))) {
                log.error("Could not quarantine '{}'; it stays in the input folder and will be retried.", fileName, e);
            } else {
                log.warn("Still cannot quarantine '{}': {}", fileName, e.getMessage());
            }
        }

        if (repeated) {
            return;
        }
        metrics.recordError(failedAt, fileName, message);
        logRunningTotals();
        notifications.publishError(new ErrorNotification(fileName, message, describe(failure), failedAt));
    }

    private void logRunningTotals() {
        final ProcessingMetrics.Snapshot totals = metrics.snapshot();
        log.info("Running totals - Success: {}, Errors: {}", totals.successCount(), totals.errorCount());
    }

    private static Path key(final Path file) {
        return file.toAbsolutePath().normalize();
    }

    private static String describe(final Throwable failure) {
        final StringWriter trace = new StringWriter();
        failure.printStackTrace(new PrintWriter(trace));
        return trace.toString();
    }
}
