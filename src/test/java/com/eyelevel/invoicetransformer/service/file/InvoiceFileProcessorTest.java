package com.eyelevel.invoicetransformer.service.file;

import com.eyelevel.invoicetransformer.model.FileProcessingStatus;
import com.eyelevel.invoicetransformer.service.notification.NotificationSender;
import com.eyelevel.invoicetransformer.service.notification.ProcessingMetrics;
import com.eyelevel.invoicetransformer.service.notification.event.ErrorNotification;
import com.eyelevel.invoicetransformer.service.notification.event.SuccessNotification;
import com.eyelevel.invoicetransformer.support.InvoiceFixtures;
import com.eyelevel.invoicetransformer.support.TestPipeline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;

import static com.eyelevel.invoicetransformer.support.InvoiceFixtures.TIMESTAMP;
import static com.eyelevel.invoicetransformer.support.TestPipeline.fileNames;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class InvoiceFileProcessorTest {

    @TempDir
    Path root;

    @Mock
    NotificationSender sender;

    @Test
    @DisplayName("Transforms a valid invoice and archives the source")
    void transformsAndArchives() throws Exception {
        final TestPipeline pipeline = TestPipeline.create(root, true, sender);
        final Path source = InvoiceFixtures.copy(InvoiceFixtures.SALES_INVOICE, pipeline.input, "INV001.xml");

        assertThat(pipeline.processor.process(source)).isEqualTo(FileProcessingStatus.SUCCESS);

        final String outputName = "INV001_Transformed_" + TIMESTAMP + ".xml";
        assertThat(fileNames(pipeline.output)).containsExactly(outputName);
        assertThat(fileNames(pipeline.archive)).containsExactly("INV001_" + TIMESTAMP + ".xml");
        assertThat(fileNames(pipeline.input)).isEmpty();
        assertThat(fileNames(pipeline.error)).isEmpty();
        assertThat(Files.readString(pipeline.output.resolve(outputName)))
                .contains("<Checksum>25510</Checksum>")
                .contains("<SuppliersInvoiceNumber>004512</SuppliersInvoiceNumber>");

        final ProcessingMetrics.Snapshot totals = pipeline.metrics.snapshot();
        assertThat(totals.successCount()).isEqualTo(1);
        assertThat(totals.errorCount()).isZero();
        verify(sender).onSuccess(new SuccessNotification("INV001.xml", outputName,
                                                         LocalDateTime.of(2024, 6, 1, 9, 30)));
    }

    @Test
    @DisplayName("Deletes the source when archiving is off")
    void deletesSourceWhenNotArchiving() {
        final TestPipeline pipeline = TestPipeline.create(root, false, sender);
        final Path source = InvoiceFixtures.copy(InvoiceFixtures.MINIMAL_INVOICE, pipeline.input, "INV100.XML");

        assertThat(pipeline.processor.process(source)).isEqualTo(FileProcessingStatus.SUCCESS);

        assertThat(fileNames(pipeline.output)).containsExactly("INV100_Transformed_" + TIMESTAMP + ".xml");
        assertThat(fileNames(pipeline.archive)).isEmpty();
        assertThat(fileNames(pipeline.input)).isEmpty();
    }

    @Test
    @DisplayName("Succeeds even when the notification sender fails")
    void ignoresNotificationFailure() {
        doThrow(new IllegalStateException("SMTP down")).when(sender).onSuccess(any());
        final TestPipeline pipeline = TestPipeline.create(root, true, sender);
        final Path source = InvoiceFixtures.copy(InvoiceFixtures.MINIMAL_INVOICE, pipeline.input, "INV100.xml");

        assertThat(pipeline.processor.process(source)).isEqualTo(FileProcessingStatus.SUCCESS);
        assertThat(pipeline.metrics.snapshot().successCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Quarantines a wrong root element with a diagnostic sidecar")
    void quarantinesWrongRoot() throws Exception {
        final TestPipeline pipeline = TestPipeline.create(root, true, sender);
        final Path source = InvoiceFixtures.copy(InvoiceFixtures.WRONG_ROOT, pipeline.input, "INV200.xml");

        assertThat(pipeline.processor.process(source)).isEqualTo(FileProcessingStatus.FAILURE);

        final String errorName = "INV200_" + TIMESTAMP + "_ERROR";
        assertThat(fileNames(pipeline.error)).containsExactly(errorName + ".txt", errorName + ".xml");
        assertThat(fileNames(pipeline.output)).isEmpty();
        assertThat(fileNames(pipeline.archive)).isEmpty();
        assertThat(fileNames(pipeline.input)).isEmpty();
        assertThat(Files.readString(pipeline.error.resolve(errorName + ".txt"))).isEqualTo(
                "Error processing file: INV200.xml\n" +
                "Timestamp: 2024-06-01 09:30:00\n" +
                "Error: Unexpected root element 'PurchaseOrderPrint'. Expected 'SalesInvoicePrint'.\n");

        final ProcessingMetrics.Snapshot totals = pipeline.metrics.snapshot();
        assertThat(totals.successCount()).isZero();
        assertThat(totals.errorCount()).isEqualTo(1);
        assertThat(totals.errors().get(0).fileName()).isEqualTo("INV200.xml");

        final ArgumentCaptor<ErrorNotification> error = ArgumentCaptor.forClass(ErrorNotification.class);
        verify(sender).onError(error.capture());
        assertThat(error.getValue().fileName()).isEqualTo("INV200.xml");
        assertThat(error.getValue().message()).contains("Unexpected root element");
        assertThat(error.getValue().detail()).contains("InvoiceFormatException");
        verify(sender, never()).onSuccess(any());
    }

    @Test
    @DisplayName("Quarantines a file that is not well-formed XML")
    void quarantinesMalformedXml() throws Exception {
        final TestPipeline pipeline = TestPipeline.create(root, true, sender);
        final Path source = Files.writeString(pipeline.input.resolve("broken.xml"),
                                              "<SalesInvoicePrint><Invoice>");

        assertThat(pipeline.processor.process(source)).isEqualTo(FileProcessingStatus.FAILURE);

        assertThat(fileNames(pipeline.error))
                .containsExactly("broken_" + TIMESTAMP + "_ERROR.txt", "broken_" + TIMESTAMP + "_ERROR.xml");
        assertThat(Files.readString(pipeline.error.resolve("broken_" + TIMESTAMP + "_ERROR.txt")))
                .contains("Error: Failed to parse XML");
    }

    @Test
    @DisplayName("Keeps going with the next file after a failure")
    void nextFileStillProcessed() {
        final TestPipeline pipeline = TestPipeline.create(root, true, sender);
        final Path bad = InvoiceFixtures.copy(InvoiceFixtures.WRONG_ROOT, pipeline.input, "A.xml");
        final Path good = InvoiceFixtures.copy(InvoiceFixtures.SALES_INVOICE, pipeline.input, "B.xml");

        assertThat(pipeline.processor.process(bad)).isEqualTo(FileProcessingStatus.FAILURE);
        assertThat(pipeline.processor.process(good)).isEqualTo(FileProcessingStatus.SUCCESS);

        final ProcessingMetrics.Snapshot totals = pipeline.metrics.snapshot();
        assertThat(totals.successCount()).isEqualTo(1);
        assertThat(totals.errorCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Rolls back the output when the source cannot be archived")
    void rollsBackOutputWhenRoutingFails() throws Exception {
        final TestPipeline pipeline = TestPipeline.create(root, true, sender);
        final Path source = InvoiceFixtures.copy(InvoiceFixtures.SALES_INVOICE, pipeline.input, "INV001.xml");
        final Path clash = Files.writeString(pipeline.archive.resolve("INV001_" + TIMESTAMP + ".xml"), "older");

        assertThat(pipeline.processor.process(source)).isEqualTo(FileProcessingStatus.FAILURE);

        assertThat(fileNames(pipeline.output)).isEmpty();
        assertThat(fileNames(pipeline.archive)).containsExactly(clash.getFileName().toString());
        assertThat(Files.readString(clash)).isEqualTo("older");
        assertThat(fileNames(pipeline.error))
                .containsExactly("INV001_" + TIMESTAMP + "_ERROR.txt", "INV001_" + TIMESTAMP + "_ERROR.xml");
        assertThat(pipeline.metrics.snapshot().successCount()).isZero();
        assertThat(pipeline.metrics.snapshot().errorCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Reports a file that cannot be quarantined once, however often it fails")
    void reportsUnquarantinableFileOnce() throws Exception {
        final TestPipeline pipeline = TestPipeline.create(root, true, sender);
        final Path source = InvoiceFixtures.copy(InvoiceFixtures.WRONG_ROOT, pipeline.input, "INV200.xml");
        final Path clash = Files.writeString(pipeline.error.resolve("INV200_" + TIMESTAMP + "_ERROR.xml"), "older");

        assertThat(pipeline.processor.process(source)).isEqualTo(FileProcessingStatus.FAILURE);
        assertThat(pipeline.processor.process(source)).isEqualTo(FileProcessingStatus.FAILURE);
        assertThat(pipeline.processor.process(source)).isEqualTo(FileProcessingStatus.FAILURE);

        assertThat(fileNames(pipeline.input)).containsExactly("INV200.xml");
        assertThat(pipeline.metrics.snapshot().errorCount()).isEqualTo(1);
        verify(sender, times(1)).onError(any());

        Files.delete(clash);
        assertThat(pipeline.processor.process(source)).isEqualTo(FileProcessingStatus.FAILURE);

        assertThat(fileNames(pipeline.input)).isEmpty();
        assertThat(fileNames(pipeline.error))
                .containsExactly("INV200_" + TIMESTAMP + "_ERROR.txt", "INV200_" + TIMESTAMP + "_ERROR.xml");
        assertThat(pipeline.metrics.snapshot().errorCount()).isEqualTo(1);
        verify(sender, times(1)).onError(any());
    }

    @Test
    @DisplayName("Processes and archives a read-only source")
    void processesReadOnlySource() {
        final TestPipeline pipeline = TestPipeline.create(root, true, sender);
        final Path source = InvoiceFixtures.copy(InvoiceFixtures.SALES_INVOICE, pipeline.input, "INV005.xml");
        assertThat(source.toFile().setReadOnly()).isTrue();

        assertThat(pipeline.processor.process(source)).isEqualTo(FileProcessingStatus.SUCCESS);

        assertThat(fileNames(pipeline.input)).isEmpty();
        assertThat(fileNames(pipeline.archive)).containsExactly("INV005_" + TIMESTAMP + ".xml");
    }

    @Test
    @DisplayName("Leaves a locked file in place and processes it once released")
    void leavesLockedFileForNextCycle() throws Exception {
        final TestPipeline pipeline = TestPipeline.create(root, true, sender);
        final Path source = InvoiceFixtures.copy(InvoiceFixtures.SALES_INVOICE, pipeline.input, "INV002.xml");

        try (FileChannel writer = FileChannel.open(source, StandardOpenOption.WRITE);
             FileLock ignored = writer.lock()) {
            assertThat(pipeline.processor.process(source)).isEqualTo(FileProcessingStatus.ABANDONED);
        }

        assertThat(fileNames(pipeline.input)).containsExactly("INV002.xml");
        assertThat(fileNames(pipeline.output)).isEmpty();
        assertThat(fileNames(pipeline.error)).isEmpty();
        assertThat(pipeline.metrics.hasActivity()).isFalse();
        verifyNoInteractions(sender);

        assertThat(pipeline.processor.process(source)).isEqualTo(FileProcessingStatus.SUCCESS);
        assertThat(fileNames(pipeline.output)).hasSize(1);
    }

    @Test
    @DisplayName("Skips a file that vanished before processing")
    void skipsMissingFile() {
        final TestPipeline pipeline = TestPipeline.create(root, true, sender);

        assertThat(pipeline.processor.process(pipeline.input.resolve("gone.xml")))
                .isEqualTo(FileProcessingStatus.SKIPPED);
        assertThat(pipeline.metrics.hasActivity()).isFalse();
    }
}
