package com.eyelevel.invoicetransformer.service.file;

import com.eyelevel.invoicetransformer.exception.FileLockedException;
import com.eyelevel.invoicetransformer.model.FileProcessingStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Decides whether an input file is free to be processed, i.e. that no writer still holds it.
 * <p>
 * Each check opens the file for writing and takes an exclusive lock, releasing it straight away. A file
 * that may only be read gets a shared lock instead, which still fails while a writer holds it. A
 * locked file is retried through the {@code fileLockRetryTemplate} with a linearly growing delay.
 */
@Slf4j
@Component
public class FileLockChecker {

    private final RetryTemplate retryTemplate;

    public FileLockChecker(@Qualifier("fileLockRetryTemplate") final RetryTemplate retryTemplate) {
        this.retryTemplate = retryTemplate;
    }

    /**
     * Waits until the file can be opened exclusively.
     *
     * @param file The input file.
     *
     * @return {@link FileProcessingStatus#PROCESSING} once the file is free,
     * {@link FileProcessingStatus#SKIPPED} if it disappeared, or {@link FileProcessingStatus#ABANDONED} if
     * it was still locked after the last attempt.
     */
    public FileProcessingStatus awaitUnlocked(final Path file) {
        final String fileName = file.getFileName().toString();
        return retryTemplate.execute(context -> {
            context.setAttribute(FileLockRetryListener.FILE_NAME_ATTRIBUTE, fileName);
            if (!Files.exists(file)) {
                return FileProcessingStatus.SKIPPED;
            }
            checkUnlocked(file);
            return FileProcessingStatus.PROCESSING;
        }, context -> {
            log.warn("File '{}' is still in use after {} attempts. Leaving it for the next poll cycle.",
                     fileName, context.getRetryCount());
            return FileProcessingStatus.ABANDONED;
        });
    }

    /**
     * A single, non-retrying exclusive-open check.
     *
     * @throws FileLockedException if another process or channel holds the file.
     */
    void checkUnlocked(final Path file) {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            final FileLock lock = channel.tryLock();
            if (lock == null) {
                throw new FileLockedException("File is locked by another process: " + file.getFileName());
            }
            lock.release();
        } catch (AccessDeniedException e) {
            checkNotWriteLocked(file);
        } catch (OverlappingFileLockException e) {
            throw new FileLockedException("File is locked within this process: " + file.getFileName(), e);
        } catch (NoSuchFileException e) {
            // Vanished between the existence check and the open; the next attempt reports SKIPPED.
            throw new FileLockedException("File disappeared during lock check: " + file.getFileName(), e);
        } catch (IOException e) {
            throw new FileLockedException("File cannot be opened exclusively: " + file.getFileName() + " (" +
                                          e.getMessage() + ")", e);
        }
    }

    /**
     * The check for files this process may read but not write, e.g. read-only sources.
     *
     * @throws FileLockedException if a writer holds an exclusive lock on the file.
     */
    void checkNotWriteLocked(final Path file) {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            final FileLock lock = channel.tryLock(0, Long.MAX_VALUE, true);
            if (lock == null) {
                throw new FileLockedException("File is locked by another process: " + file.getFileName());
            }
            lock.release();
        } catch (OverlappingFileLockException e) {
            throw new FileLockedException("File is locked within this process: " + file.getFileName(), e);
        } catch (IOException e) {
            throw new FileLockedException("File cannot be opened for reading: " + file.getFileName() + " (" +
                                          e.getMessage() + ")", e);
        }
    }
}
