package com.eyelevel.invoicetransformer.service.queue;

import com.eyelevel.invoicetransformer.model.DiscoveryTrigger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * The single hand-off point between the discovery triggers and the worker.
 * <p>
 * A path is claimed when it is submitted and stays claimed until the worker releases it, so a file seen
 * by the startup scan, the watcher and the poll cycle at the same time is queued exactly once.
 */
@Slf4j
@Component
public class InvoiceWorkQueue {

    private final BlockingQueue<Path> queue = new LinkedBlockingQueue<>();
    private final Set<Path> claimed = ConcurrentHashMap.newKeySet();

    /**
     * Claims and enqueues a candidate file.
     *
     * @return {@code true} if the file was queued, {@code false} if it is already queued or in progress.
     */
    public boolean submit(final Path file, final DiscoveryTrigger trigger) {
        final Path key = canonical(file);
        if (!claimed.add(key)) {
            log.trace("{} ignored '{}': already claimed", trigger, key.getFileName());
            return false;
        }
        queue.add(key);
        log.debug("{} queued '{}'", trigger, key.getFileName());
        return true;
    }

    /**
     * Waits up to the timeout for the next claimed file.
     *
     * @return The next file, or {@code null} on timeout.
     */
    public Path poll(final long timeout, final TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * Drops the claim once the worker is done with the file, whatever the outcome.
     */
    public void release(final Path file) {
        claimed.remove(canonical(file));
    }

    public boolean isClaimed(final Path file) {
        return claimed.contains(canonical(file));
    }

    public int pending() {
        return queue.size();
    }

    private static Path canonical(final Path file) {
        return file.toAbsolutePath().normalize();
    }
}
