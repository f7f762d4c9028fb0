package com.eyelevel.invoicetransformer.service.discovery;

import com.eyelevel.invoicetransformer.config.InvoiceProcessingConfig;
import com.eyelevel.invoicetransformer.model.DiscoveryTrigger;
import com.eyelevel.invoicetransformer.service.file.InvoiceFileNames;
import com.eyelevel.invoicetransformer.service.file.WorkingFolders;
import com.eyelevel.invoicetransformer.service.queue.InvoiceWorkQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists candidate files in the input folder and submits them to the work queue, oldest first.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InputDirectoryScanner {

    private final WorkingFolders folders;
    private final InvoiceProcessingConfig config;
    private final InvoiceWorkQueue workQueue;

    /**
     * Scans the input folder once.
     *
     * @return The number of files newly queued by this scan.
     */
    public int scan(final DiscoveryTrigger trigger) {
        final List<Path> candidates;
        try (Stream<Path> files = Files.list(folders.getInput())) {
            candidates = files.filter(this::isCandidate)
                              .sorted(Comparator.comparing(InputDirectoryScanner::lastModified)
                                                .thenComparing(Path::getFileName))
                              .collect(Collectors.toList());
        } catch (IOException e) {
            log.error("{}: unable to list input folder {}", trigger, folders.getInput(), e);
            return 0;
        }

        int queued = 0;
        for (final Path candidate : candidates) {
            if (workQueue.submit(candidate, trigger)) {
                queued++;
            }
        }
        if (queued > 0) {
            log.info("{} found {} new file(s) to process", trigger, queued);
        }
        return queued;
    }

    /**
     * A regular, visible file with the configured extension (case-insensitive).
     */
    public boolean isCandidate(final Path file) {
        final String fileName = file.getFileName().toString();
        if (fileName.startsWith(".") || fileName.endsWith(InvoiceFileNames.PART_SUFFIX)) {
            return false;
        }
        return FilenameUtils.getExtension(fileName).equalsIgnoreCase(config.getFileExtension())
               && Files.isRegularFile(file);
    }

    private static FileTime lastModified(final Path file) {
        try {
            return Files.getLastModifiedTime(file);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }
}
