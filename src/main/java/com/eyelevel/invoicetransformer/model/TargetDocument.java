package com.eyelevel.invoicetransformer.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.w3c.dom.Document;

/**
 * A mapped commercial invoice ready to be serialized to the output folder.
 */
@Getter
@RequiredArgsConstructor
public class TargetDocument {
    private final Document document;
    private final String invoiceNumber;
    private final int lineCount;
}
