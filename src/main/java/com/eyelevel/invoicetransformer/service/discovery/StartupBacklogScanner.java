package com.eyelevel.invoicetransformer.service.discovery;

import com.eyelevel.invoicetransformer.config.InvoiceProcessingConfig;
import com.eyelevel.invoicetransformer.model.DiscoveryTrigger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Queues the files that were already waiting in the input folder when the application started.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupBacklogScanner {

    private final InputDirectoryScanner scanner;
    private final InvoiceProcessingConfig config;

    @EventListener(ApplicationReadyEvent.class)
    public void scanBacklog() {
        if (!config.getStartupScan().isEnabled()) {
            log.info("Startup backlog scan disabled");
            return;
        }
        final int queued = scanner.scan(DiscoveryTrigger.STARTUP_SCAN);
        log.info("Startup backlog scan queued {} file(s)", queued);
    }
}
