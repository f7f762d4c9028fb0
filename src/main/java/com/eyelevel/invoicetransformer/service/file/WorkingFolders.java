package com.eyelevel.invoicetransformer.service.file;

import com.eyelevel.invoicetransformer.config.InvoiceProcessingConfig;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves the configured folders and makes sure they exist before any trigger starts.
 */
@Slf4j
@Getter
@Component
public class WorkingFolders {

    private final Path input;
    private final Path output;
    private final Path archive;
    private final Path error;

    public WorkingFolders(final InvoiceProcessingConfig config) {
        this.input = Paths.get(config.getInputFolder()).toAbsolutePath().normalize();
        this.output = Paths.get(config.getOutputFolder()).toAbsolutePath().normalize();
        this.archive = Paths.get(config.getArchiveFolder()).toAbsolutePath().normalize();
        this.error = Paths.get(config.getErrorFolder()).toAbsolutePath().normalize();
        if (StringUtils.hasText(config.getLogFolder())) {
            createDirectory(Paths.get(config.getLogFolder()));
        }
    }

    /**
     * Creates any missing folder and clears output documents left half-written by an earlier run.
     *
     * @throws UncheckedIOException if a folder cannot be created; the application does not start.
     */
    @PostConstruct
    public void initialize() {
        for (final Path folder : new Path[]{input, output, archive, error}) {
            createDirectory(folder);
        }
        removeStalePartFiles();
    }

    private void createDirectory(final Path folder) {
        try {
            Files.createDirectories(folder);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to create folder " + folder, e);
        }
    }

    private void removeStalePartFiles() {
        try (DirectoryStream<Path> parts = Files.newDirectoryStream(output, "*" + InvoiceFileNames.PART_SUFFIX)) {
            for (final Path part : parts) {
                Files.deleteIfExists(part);
                log.warn("Removed incomplete output '{}' left by a previous run", part.getFileName());
            }
        } catch (IOException e) {
            log.warn("Could not clean incomplete outputs in {}", output, e);
        }
    }
}
