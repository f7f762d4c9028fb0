package com.eyelevel.invoicetransformer.exception;

import java.io.Serial;

/**
 * Thrown when a normalized invoice cannot be mapped to, or serialized as, the target document.
 */
public class InvoiceTransformationException extends InvoiceProcessingException {
    @Serial
    private static final long serialVersionUID = 2290741603385717642L;

    public InvoiceTransformationException(String message) {
        super(message);
    }

    public InvoiceTransformationException(String message, Throwable cause) {
        super(message, cause);
    }
}
