package com.eyelevel.invoicetransformer.common.xml.dom;

import com.eyelevel.invoicetransformer.common.xml.XmlParser;
import com.eyelevel.invoicetransformer.exception.InvoiceFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;

/**
 * A JAXP DOM implementation of the {@link XmlParser}.
 */
@Slf4j
@Component
public class DomXmlParser implements XmlParser {

    private final DocumentBuilderFactory factory;

    public DomXmlParser() {
        this.factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setIgnoringComments(true);
        factory.setCoalescing(true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    @Override
    public Document parse(final InputStream inputStream, final String sourceName) {
        try {
            return newBuilder().parse(inputStream);
        } catch (SAXException e) {
            log.debug("'{}' is not well-formed XML: {}", sourceName, e.getMessage());
            throw new InvoiceFormatException("Failed to parse XML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new InvoiceFormatException("Failed to read XML from " + sourceName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Document newDocument() {
        return newBuilder().newDocument();
    }

    private DocumentBuilder newBuilder() {
        try {
            final DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(final SAXParseException exception) {
                    log.debug("XML parser warning: {}", exception.getMessage());
                }

                @Override
                public void error(final SAXParseException exception) throws SAXException {
                    throw exception;
                }

                @Override
                public void fatalError(final SAXParseException exception) throws SAXException {
                    throw exception;
                }
            });
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Unable to create an XML document builder", e);
        }
    }
}
