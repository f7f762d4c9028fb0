package com.eyelevel.invoicetransformer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * The fully-defaulted intermediate form of one source invoice. Every field is present; anything the
 * source left out has already been replaced by an empty string, zero or the processing date.
 * <p>
 * Built once per input file and discarded after the target document is produced.
 */
@Value
@Builder
public class InvoiceRecord {

    public static final String DEFAULT_CURRENCY_CODE = "GBP";
    public static final int DEFAULT_PAYMENT_DAYS = 30;

    // Company
    @Builder.Default
    String companyName = "";
    @Builder.Default
    String vatRegistrationNo = "";
    @Builder.Default
    String companyRegistrationNo = "";
    @Builder.Default
    AddressInfo companyAddress = AddressInfo.EMPTY;

    // Invoice identifiers and dates
    @Builder.Default
    String invoiceNumber = "";
    @Builder.Default
    String customerOrderNumber = "";
    @Builder.Default
    String yourReference = "";
    @Builder.Default
    String despatchNumber = "";
    @Builder.Default
    String salesOrderNumber = "";
    @NonNull
    LocalDate invoiceDate;
    @NonNull
    LocalDate orderDate;
    @NonNull
    LocalDate despatchDate;

    // Customer
    @Builder.Default
    String customerAccount = "";
    @Builder.Default
    String customerName = "";
    @Builder.Default
    String invoiceToName = "";
    @Builder.Default
    AddressInfo deliverToAddress = AddressInfo.EMPTY;
    @Builder.Default
    AddressInfo invoiceToAddress = AddressInfo.EMPTY;

    // Currency and terms
    @Builder.Default
    String currencyCode = DEFAULT_CURRENCY_CODE;
    @Builder.Default
    String currencyName = "Sterling";
    @Builder.Default
    int paymentDays = DEFAULT_PAYMENT_DAYS;
    @Builder.Default
    BigDecimal earlyPaymentDiscountPercent = BigDecimal.ZERO;

    // Totals
    @Builder.Default
    BigDecimal netTotal = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal vatTotal = BigDecimal.ZERO;

    @Singular
    List<LineItem> lineItems;
    @Singular
    List<VatGroup> vatGroups;

    /**
     * Always {@code netTotal + vatTotal}; never read from the source.
     */
    public BigDecimal getGrossTotal() {
        return netTotal.add(vatTotal);
    }
}
