package com.eyelevel.invoicetransformer.exception;

import java.io.Serial;

/**
 * Thrown when the output document cannot be written or the source file cannot be archived, deleted or quarantined.
 */
public class FileRoutingException extends InvoiceProcessingException {
    @Serial
    private static final long serialVersionUID = 5513290846672213940L;

    public FileRoutingException(String message) {
        super(message);
    }

    public FileRoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
