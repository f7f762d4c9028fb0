package com.eyelevel.invoicetransformer.model;

/**
 * The states an input file passes through between discovery and routing.
 */
public enum FileProcessingStatus {
    /**
     * The file was seen by the startup scan, the watcher or the poll cycle and is claimed.
     */
    DISCOVERED,
    /**
     * Checking that no other process still holds the file open.
     */
    LOCK_CHECK,
    /**
     * The file was locked; waiting before the next lock check.
     */
    RETRYING,
    /**
     * The lock retry budget ran out. The file is left in place for the next poll cycle.
     */
    ABANDONED,
    /**
     * Normalizing and transforming the file.
     */
    PROCESSING,
    /**
     * Output written and the source archived or deleted.
     */
    SUCCESS,
    /**
     * The source was moved to the error folder with a diagnostic sidecar.
     */
    FAILURE,
    /**
     * The file vanished before it could be claimed, normally because another trigger already handled it.
     */
    SKIPPED
}
