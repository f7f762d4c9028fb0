package com.eyelevel.invoicetransformer.service.queue;

import com.eyelevel.invoicetransformer.model.FileProcessingStatus;
import com.eyelevel.invoicetransformer.service.file.InvoiceFileProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Drains the {@link InvoiceWorkQueue} on one dedicated thread, so files are processed one at a time in
 * discovery order.
 * <p>
 * On shutdown the worker stops taking new files but always finishes the one in hand, so a source file is
 * never left between "output written" and "source routed".
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InvoiceQueueWorker implements SmartLifecycle {

    private static final long POLL_TIMEOUT_MS = 500;
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final InvoiceWorkQueue workQueue;
    private final InvoiceFileProcessor fileProcessor;

    private volatile boolean running;
    private ExecutorService executor;

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        executor = Executors.newSingleThreadExecutor(runnable -> {
            final Thread thread = new Thread(runnable, "invoice-worker");
            thread.setDaemon(false);
            return thread;
        });
        executor.execute(this::drain);
        log.info("Invoice worker started");
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Invoice worker did not finish within {}s", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the invoice worker to finish");
        }
        log.info("Invoice worker stopped with {} file(s) still queued", workQueue.pending());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Stops after the discovery triggers, which run in a higher phase.
     */
    @Override
    public int getPhase() {
        return 0;
    }

    private void drain() {
        while (running) {
            final Path file;
            try {
                file = workQueue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (file != null) {
                processClaimed(file);
            }
        }
    }

    /**
     * Processes one claimed file and releases its claim.
     */
    FileProcessingStatus processClaimed(final Path file) {
        try {
            final FileProcessingStatus status = fileProcessor.process(file);
            log.debug("'{}' finished as {}", file.getFileName(), status);
            return status;
        } catch (RuntimeException e) {
            log.error("Unexpected error while processing '{}'. It will be picked up again by the next poll.",
                      file.getFileName(), e);
            return FileProcessingStatus.ABANDONED;
        } finally {
            workQueue.release(file);
        }
    }
}
