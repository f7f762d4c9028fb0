package com.eyelevel.invoicetransformer.exception;

import java.io.Serial;

/**
 * A base exception for errors that occur while processing a single invoice file.
 */
public class InvoiceProcessingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 3815529310274856113L;

    public InvoiceProcessingException(String message) {
        super(message);
    }

    public InvoiceProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
