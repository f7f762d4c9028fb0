package com.eyelevel.invoicetransformer.service.transform;

import com.eyelevel.invoicetransformer.common.xml.XmlParser;
import com.eyelevel.invoicetransformer.exception.InvoiceTransformationException;
import com.eyelevel.invoicetransformer.model.AddressInfo;
import com.eyelevel.invoicetransformer.model.InvoiceRecord;
import com.eyelevel.invoicetransformer.model.LineItem;
import com.eyelevel.invoicetransformer.model.TargetDocument;
import com.eyelevel.invoicetransformer.model.VatGroup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.w3c.dom.DOMException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

import static com.eyelevel.invoicetransformer.service.transform.FixedDecimal.format;
import static com.eyelevel.invoicetransformer.service.transform.TargetSchema.*;

/**
 * Maps an {@link InvoiceRecord} onto the BASDA commercial invoice layout.
 * <p>
 * The output sections always appear in this order: head, references, additional references,
 * additional dates, invoice date, supplier, buyer, invoice-to, one line per item, settlement, one tax
 * sub-total per VAT group and the invoice total. The mapping is a pure function of the record.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InvoiceTransformer {

    private final XmlParser xmlParser;

    /**
     * Builds the target document for one invoice.
     *
     * @param record The normalized invoice.
     *
     * @return The mapped document.
     *
     * @throws InvoiceTransformationException if the DOM rejects a generated node.
     */
    public TargetDocument transform(final InvoiceRecord record) {
        try {
            final Document document = xmlParser.newDocument();
            final Element invoice = document.createElementNS(NAMESPACE, ROOT_ELEMENT);
            invoice.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, XMLConstants.XMLNS_ATTRIBUTE, NAMESPACE);
            invoice.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI,
                                   XMLConstants.XMLNS_ATTRIBUTE + ":" + EXTENSION_PREFIX, EXTENSION_NAMESPACE);
            document.appendChild(invoice);

            final Builder out = new Builder(document);
            appendHead(out, invoice, record);
            appendReferences(out, invoice, record);
            appendAdditionalReferences(out, invoice, record);
            appendAdditionalDates(out, invoice, record);
            out.add(invoice, "InvoiceDate", isoDate(record.getInvoiceDate()));
            appendSupplier(out, invoice, record);
            appendBuyer(out, invoice, record);
            appendInvoiceTo(out, invoice, record);

            final List<LineItem> lineItems = record.getLineItems();
            for (int i = 0; i < lineItems.size(); i++) {
                appendLine(out, invoice, lineItems.get(i), i + 1);
            }

            appendSettlement(out, invoice, record);
            for (final VatGroup vatGroup : record.getVatGroups()) {
                appendTaxSubTotal(out, invoice, vatGroup, record);
            }
            appendInvoiceTotal(out, invoice, record);

            log.debug("Mapped invoice '{}' with {} lines and {} tax rates", record.getInvoiceNumber(),
                      lineItems.size(), record.getVatGroups().size());
            return new TargetDocument(document, record.getInvoiceNumber(), lineItems.size());
        } catch (DOMException e) {
            throw new InvoiceTransformationException(
                    "Failed to build target document for invoice '" + record.getInvoiceNumber() + "': " +
                    e.getMessage(), e);
        }
    }

    /**
     * The head checksum for a record, see {@link InvoiceChecksum}.
     */
    public static int checksum(final InvoiceRecord record) {
        return InvoiceChecksum.of(record.getInvoiceNumber(), record.getGrossTotal().toPlainString());
    }

    private void appendHead(final Builder out, final Element invoice, final InvoiceRecord record) {
        final Element head = out.add(invoice, "InvoiceHead");

        out.add(out.add(head, "Schema"), "Version", SCHEMA_VERSION);

        final Element parameters = out.add(head, "Parameters");
        out.add(parameters, "Language", LANGUAGE);
        out.add(parameters, "DecimalSeparator", DECIMAL_SEPARATOR);
        out.add(parameters, "Precision", PRECISION);

        out.add(head, "InvoiceType", INVOICE_TYPE_NAME).setAttribute("Code", INVOICE_TYPE_CODE);
        appendCurrency(out, out.add(head, "InvoiceCurrency"), record);
        out.add(head, "Checksum", String.valueOf(checksum(record)));
    }

    private void appendReferences(final Builder out, final Element invoice, final InvoiceRecord record) {
        final Element references = out.add(invoice, "InvoiceReferences");
        out.add(references, "BuyersOrderNumber", record.getCustomerOrderNumber());
        out.add(references, "SuppliersInvoiceNumber", record.getInvoiceNumber());
        out.add(references, "DeliveryNoteNumber", record.getDespatchNumber());
    }

    private void appendAdditionalReferences(final Builder out, final Element invoice, final InvoiceRecord record) {
        final Element references = out.addExtension(invoice, "AdditionalInvoiceReferences");
        final Element reference = out.addExtension(references, "InvoiceReference");
        reference.setAttribute("ReferenceType", SALES_ORDER_REFERENCE_TYPE);
        out.addExtension(reference, "Reference", record.getSalesOrderNumber());
    }

    private void appendAdditionalDates(final Builder out, final Element invoice, final InvoiceRecord record) {
        final Element dates = out.addExtension(invoice, "AdditionalInvoiceDates");

        final Element orderDate = out.addExtension(dates, "InvoiceDateTime", isoDate(record.getOrderDate()));
        orderDate.setAttribute("DateTimeType", ORDER_DATE_TYPE);
        orderDate.setAttribute("DateTimeDesc", ORDER_DATE_DESC);

        final Element deliveryDate = out.addExtension(dates, "InvoiceDateTime", isoDate(record.getDespatchDate()));
        deliveryDate.setAttribute("DateTimeType", DELIVERY_DATE_TYPE);
        deliveryDate.setAttribute("DateTimeDesc", DELIVERY_DATE_DESC);
    }

    private void appendSupplier(final Builder out, final Element invoice, final InvoiceRecord record) {
        final Element supplier = out.add(invoice, "Supplier");
        final Element references = out.add(supplier, "SupplierReferences");
        out.add(references, "TaxNumber", record.getVatRegistrationNo());
        out.add(references, "GLN", record.getCompanyRegistrationNo());
        out.add(supplier, "Party", record.getCompanyName());
        appendAddress(out, supplier, record.getCompanyAddress());
    }

    private void appendBuyer(final Builder out, final Element invoice, final InvoiceRecord record) {
        final Element buyer = out.add(invoice, "Buyer");
        out.add(out.add(buyer, "BuyerReferences"), "SuppliersCodeForBuyer", record.getCustomerAccount());
        out.add(buyer, "Party", record.getCustomerName());
        appendAddress(out, buyer, record.getInvoiceToAddress());
    }

    private void appendInvoiceTo(final Builder out, final Element invoice, final InvoiceRecord record) {
        out.add(out.add(invoice, "InvoiceTo"), "Party", record.getInvoiceToName());
    }

    private void appendAddress(final Builder out, final Element party, final AddressInfo address) {
        final Element element = out.add(party, "Address");
        for (final String line : address.getLines()) {
            if (StringUtils.hasText(line)) {
                out.add(element, "AddressLine", line);
            }
        }
        if (StringUtils.hasText(address.getPostCode())) {
            out.add(element, "PostCode", address.getPostCode());
        }
    }

    private void appendLine(final Builder out, final Element invoice, final LineItem item, final int lineNumber) {
        final Element line = out.add(invoice, "InvoiceLine");
        out.add(line, "LineNumber", String.valueOf(lineNumber));

        final Element references = out.add(line, "InvoiceLineReferences");
        out.add(references, "OrderLineNumber", item.getItemNumber());
        out.add(references, "BuyersOrderLineReference", item.getItemNumber() + " " + item.getProductCode());

        final Element extension = out.addExtension(line, "AdditionalInvoiceLineReferences");
        final Element flag = out.addExtension(extension, "InvoiceLineReference");
        flag.setAttribute("ReferenceType", SETTLEMENT_FLAG_TYPE);
        flag.setAttribute("ReferenceDesc", SETTLEMENT_FLAG_DESC);
        out.addExtension(flag, "Reference", SETTLEMENT_FLAG_VALUE);

        final Element product = out.add(line, "Product");
        out.add(product, "SuppliersProductCode", item.getProductCode());
        out.add(product, "Description", item.getDescription());

        final Element quantity = out.add(line, "Quantity");
        out.add(quantity, "Packsize", PACK_SIZE);
        out.add(quantity, "Amount", format(item.getQuantity(), 0));

        out.add(out.add(line, "Price"), "UnitPrice", format(item.getUnitPrice(), 3));

        out.add(out.add(line, "LineTax"), "TaxRate", format(item.getVatRate(), 2))
           .setAttribute("Code", TAX_RATE_CODE);

        out.add(line, "LineTotal", format(item.getLineTotal(), 3));
    }

    private void appendSettlement(final Builder out, final Element invoice, final InvoiceRecord record) {
        final Element settlement = out.add(invoice, "Settlement");
        out.add(out.add(settlement, "SettlementTerms"), "DaysFromInvoice", String.valueOf(record.getPaymentDays()));

        final Element discount = out.add(settlement, "SettlementDiscount");
        out.add(out.add(discount, "PercentDiscount"), "Percentage",
                format(record.getEarlyPaymentDiscountPercent(), 2));
        out.add(out.add(discount, "AmountDiscount"), "Amount", ZERO_AMOUNT_DISCOUNT);
    }

    private void appendTaxSubTotal(final Builder out, final Element invoice, final VatGroup vatGroup,
                                   final InvoiceRecord record) {
        final Element subTotal = out.add(invoice, "TaxSubTotal");
        out.add(subTotal, "TaxRate", format(vatGroup.getRate(), 2)).setAttribute("Code", TAX_RATE_CODE);
        out.add(subTotal, "NumberOfLinesAtRate", String.valueOf(record.getLineItems().size()));
        out.add(subTotal, "TotalValueAtRate", format(vatGroup.getPrincipalValue(), 3));
        out.add(subTotal, "TaxableValueAtRate", format(vatGroup.getPrincipalValue(), 1));
        out.add(subTotal, "TaxAtRate", format(vatGroup.getVatValue(), 2));
        out.add(subTotal, "NetPaymentAtRate", format(vatGroup.getPrincipalValue(), 3));
        out.add(subTotal, "GrossPaymentAtRate", format(vatGroup.getPrincipalValue().add(vatGroup.getVatValue()), 3));
        appendCurrency(out, out.add(subTotal, "TaxCurrency"), record);
    }

    private void appendInvoiceTotal(final Builder out, final Element invoice, final InvoiceRecord record) {
        final Element total = out.add(invoice, "InvoiceTotal");
        out.add(total, "NumberOfLines", String.valueOf(record.getLineItems().size()));
        out.add(total, "NumberOfTaxRates", String.valueOf(record.getVatGroups().size()));
        out.add(total, "LineValueTotal", format(record.getNetTotal(), 3));
        out.add(total, "TaxableTotal", format(record.getNetTotal(), 2));
        out.add(total, "TaxTotal", format(record.getVatTotal(), 2));
        out.add(total, "NetPaymentTotal", format(record.getGrossTotal(), 2));
        out.add(total, "GrossPaymentTotal", format(record.getGrossTotal(), 2));
    }

    private void appendCurrency(final Builder out, final Element parent, final InvoiceRecord record) {
        out.add(parent, "Currency", record.getCurrencyName()).setAttribute("Code", record.getCurrencyCode());
    }

    private static String isoDate(final LocalDate date) {
        return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
    }

    /**
     * Appends namespaced child elements.
     */
    private static final class Builder {
        private final Document document;

        private Builder(final Document document) {
            this.document = document;
        }

        Element add(final Element parent, final String name) {
            final Element element = document.createElementNS(NAMESPACE, name);
            parent.appendChild(element);
            return element;
        }

        Element add(final Element parent, final String name, final String text) {
            final Element element = add(parent, name);
            element.setTextContent(text);
            return element;
        }

        Element addExtension(final Element parent, final String name) {
            final Element element = document.createElementNS(EXTENSION_NAMESPACE, EXTENSION_PREFIX + ":" + name);
            parent.appendChild(element);
            return element;
        }

        Element addExtension(final Element parent, final String name, final String text) {
            final Element element = addExtension(parent, name);
            element.setTextContent(text);
            return element;
        }
    }
}
