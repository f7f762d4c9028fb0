package com.eyelevel.invoicetransformer.common.xml;

import org.w3c.dom.Document;

import java.io.InputStream;

/**
 * Defines the contract for reading XML into a DOM tree.
 *
 * <p>Implementations must be namespace-aware and must refuse DOCTYPE declarations, since input
 * files arrive from outside the system.
 */
public interface XmlParser {

    /**
     * Parses a stream into a DOM document.
     *
     * @param inputStream The XML content. Not closed by this method.
     * @param sourceName  A name for the content used in error messages (usually the file name).
     *
     * @return The parsed document.
     *
     * @throws com.eyelevel.invoicetransformer.exception.InvoiceFormatException if the content is not
     *                                                                          well-formed XML.
     */
    Document parse(InputStream inputStream, String sourceName);

    /**
     * Creates an empty, namespace-aware document for building output trees.
     */
    Document newDocument();
}
