package com.eyelevel.invoicetransformer.exception;

import java.io.Serial;

/**
 * Thrown when an input file is still held open by another process. This is transient and retried.
 */
public class FileLockedException extends InvoiceProcessingException {
    @Serial
    private static final long serialVersionUID = 8421137719043625501L;

    public FileLockedException(String message) {
        super(message);
    }

    public FileLockedException(String message, Throwable cause) {
        super(message, cause);
    }
}
