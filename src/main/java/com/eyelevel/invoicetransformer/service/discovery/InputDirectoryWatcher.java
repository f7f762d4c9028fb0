package com.eyelevel.invoicetransformer.service.discovery;

import com.eyelevel.invoicetransformer.config.InvoiceProcessingConfig;
import com.eyelevel.invoicetransformer.model.DiscoveryTrigger;
import com.eyelevel.invoicetransformer.service.file.WorkingFolders;
import com.eyelevel.invoicetransformer.service.queue.InvoiceWorkQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Live trigger: watches the input folder for files created in or renamed into it and queues them after a
 * short debounce, giving the writer time to finish. Repeated events for the same file restart its
 * debounce.
 * <p>
 * An overflow of the watch queue falls back to a full folder scan.
 */
@Slf4j
@Component
public class InputDirectoryWatcher implements SmartLifecycle {

    private final WorkingFolders folders;
    private final InvoiceProcessingConfig config;
    private final InputDirectoryScanner scanner;
    private final InvoiceWorkQueue workQueue;

    private final Map<Path, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    private volatile boolean running;
    private WatchService watchService;
    private Thread watchThread;
    private ScheduledExecutorService debouncer;

    public InputDirectoryWatcher(final WorkingFolders folders, final InvoiceProcessingConfig config,
                                 final InputDirectoryScanner scanner, final InvoiceWorkQueue workQueue) {
        this.folders = folders;
        this.config = config;
        this.scanner = scanner;
        this.workQueue = workQueue;
    }

    @Override
    public synchronized void start() {
        if (running || !config.getWatch().isEnabled()) {
            return;
        }
        final Path input = folders.getInput();
        try {
            watchService = input.getFileSystem().newWatchService();
            input.register(watchService, StandardWatchEventKinds.ENTRY_CREATE, StandardWatchEventKinds.ENTRY_MODIFY);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to watch input folder " + input, e);
        }

        debouncer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            final Thread thread = new Thread(runnable, "input-debounce");
            thread.setDaemon(true);
            return thread;
        });
        watchThread = new Thread(this::watch, "input-watcher");
        watchThread.setDaemon(true);
        running = true;
        watchThread.start();
        log.info("Watching {} (debounce {} ms)", input, config.getWatch().getDebounceMs());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("Error closing the input folder watch service", e);
        }
        debouncer.shutdownNow();
        pending.clear();
        log.info("Stopped watching {}", folders.getInput());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return 100;
    }

    private void watch() {
        while (running) {
            final WatchKey key;
            try {
                key = watchService.take();
            } catch (ClosedWatchServiceException e) {
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }

            for (final WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    log.warn("Watch event overflow; rescanning the input folder");
                    scanner.scan(DiscoveryTrigger.WATCH);
                    continue;
                }
                final Path file = folders.getInput().resolve((Path) event.context());
                debounce(file);
            }

            if (!key.reset()) {
                log.error("Input folder {} is no longer accessible; live watch stopped. The poll cycle continues.",
                          folders.getInput());
                running = false;
                return;
            }
        }
    }

    /**
     * (Re)starts the debounce timer for a file. The file is queued only if it still looks like a
     * candidate when the timer fires.
     */
    void debounce(final Path file) {
        pending.compute(file, (path, previous) -> {
            if (previous != null) {
                previous.cancel(false);
            }
            return debouncer.schedule(() -> fire(path), config.getWatch().getDebounceMs(), TimeUnit.MILLISECONDS);
        });
    }

    private void fire(final Path file) {
        pending.remove(file);
        if (scanner.isCandidate(file)) {
            workQueue.submit(file, DiscoveryTrigger.WATCH);
        }
    }
}
