package com.eyelevel.invoicetransformer.service.file;

import com.eyelevel.invoicetransformer.common.xml.XmlSerializer;
import com.eyelevel.invoicetransformer.config.InvoiceProcessingConfig;
import com.eyelevel.invoicetransformer.exception.FileRoutingException;
import com.eyelevel.invoicetransformer.model.TargetDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Moves files between the working folders: writes output documents, archives or deletes processed
 * sources, and quarantines failed ones with a diagnostic sidecar.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InvoiceFileRouter {

    private static final DateTimeFormatter SIDECAR_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final WorkingFolders folders;
    private final InvoiceProcessingConfig config;
    private final XmlSerializer xmlSerializer;

    /**
     * Writes the document to a {@code .part} file in the output folder and promotes it to its final
     * name with a single rename, so the output folder never shows a partial document.
     *
     * @return The path of the promoted output file.
     *
     * @throws FileRoutingException if the document cannot be written or promoted.
     */
    public Path writeOutput(final TargetDocument target, final String sourceFileName, final String timestamp) {
        final Path output = folders.getOutput().resolve(InvoiceFileNames.outputName(sourceFileName, timestamp));
        final Path part = output.resolveSibling(output.getFileName() + InvoiceFileNames.PART_SUFFIX);
        try {
            try (OutputStream out = Files.newOutputStream(part)) {
                xmlSerializer.write(target.getDocument(), out);
            }
            move(part, output);
            return output;
        } catch (IOException e) {
            deleteQuietly(part);
            throw new FileRoutingException("Failed to write output " + output.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Archives the processed source under {@code {base}_{timestamp}{ext}}, or deletes it when archiving
     * is turned off.
     *
     * @throws FileRoutingException if the source cannot be moved or deleted.
     */
    public void routeProcessedSource(final Path source, final String timestamp) {
        final String fileName = source.getFileName().toString();
        try {
            if (config.isArchiveProcessedFiles()) {
                final Path archived = folders.getArchive().resolve(InvoiceFileNames.archiveName(fileName, timestamp));
                move(source, archived);
                log.debug("Archived original file to: {}", archived);
            } else {
                Files.delete(source);
                log.debug("Deleted original file: {}", fileName);
            }
        } catch (IOException e) {
            throw new FileRoutingException("Could not archive/delete original file " + fileName + ": " +
                                           e.getMessage(), e);
        }
    }

    /**
     * Removes an output that was promoted for a source which then could not be routed. The source is
     * quarantined instead, so the invoice ends up in exactly one place.
     */
    public void discardOutput(final Path output) {
        try {
            Files.deleteIfExists(output);
            log.info("Rolled back output '{}'", output.getFileName());
        } catch (IOException e) {
            log.error("Could not roll back output '{}'. It must be removed manually.", output, e);
        }
    }

    /**
     * Moves a failed source to the error folder as {@code {base}_{timestamp}_ERROR{ext}} and writes a
     * {@code .txt} sidecar with the failure message next to it.
     *
     * @return The quarantined file.
     *
     * @throws FileRoutingException if the source cannot be moved. A sidecar that cannot be written is
     *                              only logged, since the source is already safely quarantined.
     */
    public Path quarantine(final Path source, final String timestamp, final LocalDateTime failedAt,
                           final String message) {
        final String fileName = source.getFileName().toString();
        final String errorFileName = InvoiceFileNames.errorName(fileName, timestamp);
        final Path quarantined = folders.getError().resolve(errorFileName);
        try {
            move(source, quarantined);
        } catch (IOException e) {
            throw new FileRoutingException("Could not move " + fileName + " to the error folder: " + e.getMessage(), e);
        }

        final Path sidecar = folders.getError().resolve(InvoiceFileNames.sidecarName(errorFileName));
        final String details = "Error processing file: " + fileName + "\n" +
                               "Timestamp: " + SIDECAR_TIMESTAMP.format(failedAt) + "\n" +
                               "Error: " + message + "\n";
        try {
            Files.writeString(sidecar, details, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not write error details for '{}'", errorFileName, e);
        }
        log.info("Moved failed file to error folder: {}", errorFileName);
        return quarantined;
    }

    private static void move(final Path from, final Path to) throws IOException {
        // An atomic rename silently replaces the target on POSIX file systems.
        if (Files.exists(to)) {
            throw new FileAlreadyExistsException(to.toString());
        }
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported from {} to {}; falling back to a plain move", from, to);
            Files.move(from, to);
        }
    }

    private static void deleteQuietly(final Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}", path, e);
        }
    }
}
