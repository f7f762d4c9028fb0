package com.eyelevel.invoicetransformer.common.xml.dom;

import com.eyelevel.invoicetransformer.common.xml.XmlSerializer;
import com.eyelevel.invoicetransformer.exception.InvoiceTransformationException;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;

import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Writes DOM documents through a JAXP identity transformer, indented by two spaces.
 */
@Component
public class DomXmlSerializer implements XmlSerializer {

    private final TransformerFactory transformerFactory = TransformerFactory.newInstance();

    @Override
    public void write(final Document document, final OutputStream outputStream) {
        try {
            final Transformer transformer = transformerFactory.newTransformer();
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            document.setXmlStandalone(true);

            final Writer writer = new OutputStreamWriter(outputStream, StandardCharsets.UTF_8);
            transformer.transform(new DOMSource(document), new StreamResult(writer));
            writer.flush();
        } catch (TransformerException | IOException e) {
            throw new InvoiceTransformationException("Failed to serialize XML document: " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] toBytes(final Document document) {
        final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        write(document, buffer);
        return buffer.toByteArray();
    }
}
