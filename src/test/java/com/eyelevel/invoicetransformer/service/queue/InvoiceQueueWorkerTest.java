package com.eyelevel.invoicetransformer.service.queue;

import com.eyelevel.invoicetransformer.model.DiscoveryTrigger;
import com.eyelevel.invoicetransformer.model.FileProcessingStatus;
import com.eyelevel.invoicetransformer.service.file.InvoiceFileProcessor;
import com.eyelevel.invoicetransformer.support.Polling;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InvoiceQueueWorkerTest {

    @Mock
    InvoiceFileProcessor processor;

    private final InvoiceWorkQueue queue = new InvoiceWorkQueue();
    private InvoiceQueueWorker worker;

    @AfterEach
    void tearDown() {
        if (worker != null) {
            worker.stop();
        }
    }

    @Test
    void releasesClaimWhateverTheOutcome() {
        final Path file = Paths.get("INV001.xml").toAbsolutePath();
        when(processor.process(file)).thenThrow(new IllegalStateException("boom"));
        worker = new InvoiceQueueWorker(queue, processor);
        queue.submit(file, DiscoveryTrigger.POLL);

        assertThat(worker.processClaimed(file)).isEqualTo(FileProcessingStatus.ABANDONED);
        assertThat(queue.isClaimed(file)).isFalse();
    }

    @Test
    void drainsQueueOnItsOwnThread() throws Exception {
        final Path file = Paths.get("INV002.xml").toAbsolutePath();
        when(processor.process(file)).thenReturn(FileProcessingStatus.SUCCESS);
        worker = new InvoiceQueueWorker(queue, processor);
        worker.start();

        queue.submit(file, DiscoveryTrigger.WATCH);

        Polling.waitUntil(Duration.ofSeconds(5), () -> !queue.isClaimed(file));
        verify(processor).process(file);
        assertThat(worker.isRunning()).isTrue();
    }
}
