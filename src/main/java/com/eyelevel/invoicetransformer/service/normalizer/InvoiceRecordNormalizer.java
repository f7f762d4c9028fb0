package com.eyelevel.invoicetransformer.service.normalizer;

import com.eyelevel.invoicetransformer.exception.InvoiceFormatException;
import com.eyelevel.invoicetransformer.model.AddressInfo;
import com.eyelevel.invoicetransformer.model.InvoiceRecord;
import com.eyelevel.invoicetransformer.model.LineItem;
import com.eyelevel.invoicetransformer.model.VatGroup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static com.eyelevel.invoicetransformer.common.xml.XmlElements.attribute;
import static com.eyelevel.invoicetransformer.common.xml.XmlElements.child;
import static com.eyelevel.invoicetransformer.common.xml.XmlElements.children;
import static com.eyelevel.invoicetransformer.common.xml.XmlElements.localName;
import static com.eyelevel.invoicetransformer.common.xml.XmlElements.path;

/**
 * Turns a parsed SalesInvoicePrint document into a fully-defaulted {@link InvoiceRecord}.
 * <p>
 * Only the root element name is checked. Everything below it is read leniently: a missing element or
 * attribute becomes an empty string, zero or the processing date, and never raises.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InvoiceRecordNormalizer {

    public static final String SOURCE_ROOT_ELEMENT = "SalesInvoicePrint";

    private static final String CHARGE_ITEM_PREFIX = "C";

    private final SourceValueParser values;

    /**
     * Normalizes one source document.
     *
     * @param document The parsed input file.
     *
     * @return The normalized record.
     *
     * @throws InvoiceFormatException if the root element is not {@value #SOURCE_ROOT_ELEMENT}.
     */
    public InvoiceRecord normalize(final Document document) {
        final Element root = document.getDocumentElement();
        final String rootName = root == null ? null : localName(root);
        if (!SOURCE_ROOT_ELEMENT.equals(rootName)) {
            throw new InvoiceFormatException(
                    String.format("Unexpected root element '%s'. Expected '%s'.", rootName, SOURCE_ROOT_ELEMENT));
        }

        final InvoiceRecord.InvoiceRecordBuilder record = InvoiceRecord.builder();
        readCompany(root, record);
        readInvoice(root, record);
        readCustomer(root, record);
        readPricing(root, record);
        readDespatches(root, record);
        readVatDetails(root, record);
        return record.build();
    }

    private void readCompany(final Element root, final InvoiceRecord.InvoiceRecordBuilder record) {
        final Optional<Element> company = child(root, "CompanyDetails");
        record.companyName(text(company, "Name"))
              .vatRegistrationNo(text(company, "VATRegistrationNo"))
              .companyRegistrationNo(text(company, "CoRegistrationNo"))
              .companyAddress(address(company.flatMap(c -> child(c, "Address"))));
    }

    private void readInvoice(final Element root, final InvoiceRecord.InvoiceRecordBuilder record) {
        final Optional<Element> invoice = child(root, "Invoice");
        record.invoiceNumber(values.digitsOnly(attribute(invoice, "Number")))
              .customerOrderNumber(text(invoice, "OurReference"))
              .yourReference(text(invoice, "YourReference"));

        final Optional<Element> dates = invoice.flatMap(i -> child(i, "Dates"));
        final String invoiceDate = attribute(dates.flatMap(d -> child(d, "InvoiceDate")), "Date");
        final String dueDate = attribute(dates.flatMap(d -> child(d, "PaymentDueDate")), "Date");
        record.invoiceDate(values.isoDate(invoiceDate))
              .paymentDays(values.daysBetween(invoiceDate, dueDate, InvoiceRecord.DEFAULT_PAYMENT_DAYS));

        record.earlyPaymentDiscountPercent(values.decimal(
                attribute(invoice.flatMap(i -> path(i, "PricingDetails", "PaymentTerms")), "EarlyPercent")));
    }

    private void readCustomer(final Element root, final InvoiceRecord.InvoiceRecordBuilder record) {
        final Optional<Element> details = path(root, "Invoice", "CustomerDetails");

        final Optional<Element> customer = details.flatMap(d -> child(d, "Customer"));
        final String customerName = text(customer, "Name");
        record.customerAccount(text(customer, "Account"))
              .customerName(customerName)
              .invoiceToName(customerName);

        details.flatMap(d -> child(d, "DeliverTo")).ifPresent(deliverTo -> record.deliverToAddress(
                address(child(deliverTo, "Address")).toBuilder().contactName(text(deliverTo, "Name")).build()));

        details.flatMap(d -> child(d, "InvoiceTo")).ifPresent(invoiceTo -> {
            final String invoiceToName = attribute(child(invoiceTo, "Customer"), "Name");
            if (invoiceToName != null) {
                record.invoiceToName(invoiceToName);
            }
            record.invoiceToAddress(address(child(invoiceTo, "Address")));
        });
    }

    private void readPricing(final Element root, final InvoiceRecord.InvoiceRecordBuilder record) {
        final Optional<Element> pricing = path(root, "Invoice", "PricingDetails");

        final String currencyCode = attribute(pricing.flatMap(p -> child(p, "DocumentCurrency")),
                                              "DocumentCurrencyCode");
        final String code = StringUtils.hasText(currencyCode) ? currencyCode : InvoiceRecord.DEFAULT_CURRENCY_CODE;
        record.currencyCode(code)
              .currencyName(values.currencyName(code))
              .netTotal(values.decimal(attribute(pricing.flatMap(p -> child(p, "Value")), "DocumentValue")))
              .vatTotal(values.decimal(attribute(pricing.flatMap(p -> path(p, "VAT", "Value")), "DocumentValue")));
    }

    private void readDespatches(final Element root, final InvoiceRecord.InvoiceRecordBuilder record) {
        final List<Element> despatches = child(root, "Despatches")
                .map(d -> children(d, "Despatch"))
                .orElse(List.of());

        String despatchNumber = "";
        String despatchDate = null;
        String salesOrderNumber = "";
        String orderDate = null;
        int chargeSequence = 0;

        for (int i = 0; i < despatches.size(); i++) {
            final Element despatch = despatches.get(i);

            if (i == 0) {
                final Optional<Element> despatchDetails = child(despatch, "DespatchDetails");
                despatchNumber = text(despatchDetails, "DespatchNumber");
                despatchDate = attribute(despatchDetails.flatMap(d -> path(d, "Dates", "DespatchDate")), "Date");
            }

            for (final Element salesOrder : child(despatch, "SalesOrders").map(s -> children(s, "SalesOrder"))
                                                                           .orElse(List.of())) {
                final Optional<Element> orderDetails = child(salesOrder, "SalesOrderDetails");
                if (orderDetails.isPresent()) {
                    salesOrderNumber = text(orderDetails, "SalesOrderNumber");
                    orderDate = attribute(orderDetails.flatMap(d -> path(d, "Dates", "Document")), "Date");
                }
                for (final Element item : child(salesOrder, "Items").map(s -> children(s, "Item"))
                                                                     .orElse(List.of())) {
                    record.lineItem(lineItem(item));
                }
            }

            for (final Element charge : child(despatch, "Charges").map(c -> children(c, "Charge"))
                                                                   .orElse(List.of())) {
                final BigDecimal chargeValue = values.decimal(
                        attribute(child(charge, "ChargeValue"), "DocumentValue"));
                if (chargeValue.signum() <= 0) {
                    log.debug("Dropping charge with non-positive value {}", chargeValue);
                    continue;
                }
                chargeSequence++;
                record.lineItem(chargeLine(charge, chargeValue, CHARGE_ITEM_PREFIX + chargeSequence));
            }
        }

        record.despatchNumber(despatchNumber)
              .despatchDate(values.isoDate(despatchDate))
              .salesOrderNumber(salesOrderNumber)
              .orderDate(values.isoDate(orderDate));
    }

    private LineItem lineItem(final Element item) {
        final Optional<Element> product = child(item, "Product");
        final Optional<Element> quantity = path(item, "Quantities", "OrderQuantity");
        final Optional<Element> vat = child(item, "VAT");

        return LineItem.builder()
                       .itemNumber(textOr(Optional.of(item), "ItemNumber", LineItem.DEFAULT_ITEM_NUMBER))
                       .productCode(text(product, "Code"))
                       .description(text(product, "Description1"))
                       .quantity(values.decimal(attribute(quantity, "Quantity")))
                       .unitOfMeasure(textOr(quantity, "UOM", LineItem.DEFAULT_UNIT_OF_MEASURE))
                       .unitPrice(values.decimal(attribute(path(item, "Prices", "UnitPrice"), "DocumentPrice")))
                       .lineTotal(values.decimal(
                               attribute(path(item, "LineValues", "NetLineValue"), "DocumentValue")))
                       .vatCode(textOr(vat, "Code", LineItem.DEFAULT_VAT_CODE))
                       .vatRate(values.decimal(attribute(vat, "Rate")))
                       .vatValue(values.decimal(attribute(vat.flatMap(v -> child(v, "VATValue")), "DocumentValue")))
                       .build();
    }

    private LineItem chargeLine(final Element charge, final BigDecimal chargeValue, final String itemNumber) {
        final Optional<Element> chargeCode = child(charge, "ChargeCode");
        final Optional<Element> vat = child(charge, "VAT");

        return LineItem.builder()
                       .itemNumber(itemNumber)
                       .productCode(textOr(chargeCode, "Code", "CHARGE"))
                       .description(textOr(chargeCode, "Description", "Charge"))
                       .quantity(BigDecimal.ONE)
                       .unitPrice(chargeValue)
                       .lineTotal(chargeValue)
                       .vatCode(textOr(vat, "Code", LineItem.DEFAULT_VAT_CODE))
                       .vatRate(values.decimal(attribute(vat, "Rate")))
                       .vatValue(values.decimal(attribute(vat.flatMap(v -> child(v, "VATValue")), "DocumentValue")))
                       .charge(true)
                       .build();
    }

    private void readVatDetails(final Element root, final InvoiceRecord.InvoiceRecordBuilder record) {
        for (final Element vat : child(root, "VATDetails").map(v -> children(v, "VAT")).orElse(List.of())) {
            record.vatGroup(VatGroup.builder()
                                    .code(text(Optional.of(vat), "Code"))
                                    .description(text(Optional.of(vat), "Description"))
                                    .rate(values.decimal(attribute(vat, "Rate")))
                                    .principalValue(values.decimal(
                                            attribute(child(vat, "VATPrinciple"), "DocumentValue")))
                                    .vatValue(values.decimal(attribute(child(vat, "VATValue"), "DocumentValue")))
                                    .build());
        }
    }

    private AddressInfo address(final Optional<Element> addressElement) {
        if (addressElement.isEmpty()) {
            return AddressInfo.EMPTY;
        }
        final AddressInfo.AddressInfoBuilder address = AddressInfo.builder();
        for (int i = 1; i <= AddressInfo.MAX_LINES; i++) {
            final String line = attribute(addressElement, "Line" + i);
            if (StringUtils.hasText(line)) {
                address.line(line);
            }
        }
        return address.postCode(text(addressElement, "Postcode"))
                      .countryCode(text(addressElement, "CountryCode"))
                      .country(text(addressElement, "Country"))
                      .build();
    }

    private static String text(final Optional<Element> element, final String attributeName) {
        return textOr(element, attributeName, "");
    }

    private static String text(final Element element, final String attributeName) {
        return textOr(Optional.ofNullable(element), attributeName, "");
    }

    private static String textOr(final Optional<Element> element, final String attributeName, final String fallback) {
        final String value = attribute(element, attributeName);
        return value != null ? value : fallback;
    }
}
