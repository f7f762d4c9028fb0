package com.eyelevel.invoicetransformer.scheduler;

import com.eyelevel.invoicetransformer.model.DiscoveryTrigger;
import com.eyelevel.invoicetransformer.service.discovery.InputDirectoryScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Safety net behind the live watcher: rescans the input folder on a fixed delay. It also picks up files
 * that were left in place because they were still locked on an earlier attempt.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InputDirectoryPollScheduler {

    private final InputDirectoryScanner scanner;

    @Scheduled(fixedDelayString = "${app.processing.polling-interval-seconds:5}",
               initialDelayString = "${app.processing.polling-interval-seconds:5}",
               timeUnit = TimeUnit.SECONDS)
    public void poll() {
        try {
            scanner.scan(DiscoveryTrigger.POLL);
        } catch (Exception e) {
            log.error("Input folder poll failed. It will run again on the next cycle.", e);
        }
    }
}
