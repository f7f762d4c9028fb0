package com.eyelevel.invoicetransformer.common.xml;

import org.w3c.dom.Document;

import java.io.OutputStream;

/**
 * Defines the contract for writing a DOM tree as UTF-8 XML with an XML declaration.
 */
public interface XmlSerializer {

    /**
     * Serializes the document to the stream. The stream is flushed but not closed.
     *
     * @throws com.eyelevel.invoicetransformer.exception.InvoiceTransformationException if the
     *                                                                                  document cannot be
     *                                                                                  serialized.
     */
    void write(Document document, OutputStream outputStream);

    /**
     * Serializes the document to a byte array.
     */
    byte[] toBytes(Document document);
}
