package com.eyelevel.invoicetransformer.model;

/**
 * Which discovery path observed an input file.
 */
public enum DiscoveryTrigger {
    STARTUP_SCAN,
    WATCH,
    POLL
}
