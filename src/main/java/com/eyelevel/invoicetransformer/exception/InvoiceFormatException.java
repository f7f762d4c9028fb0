package com.eyelevel.invoicetransformer.exception;

import java.io.Serial;

/**
 * Thrown when an input file is not well-formed XML or its root element is not the expected source tag.
 * The file is quarantined without retry.
 */
public class InvoiceFormatException extends InvoiceProcessingException {
    @Serial
    private static final long serialVersionUID = 6710082231458390117L;

    public InvoiceFormatException(String message) {
        super(message);
    }

    public InvoiceFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
