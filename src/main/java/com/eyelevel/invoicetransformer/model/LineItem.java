package com.eyelevel.invoicetransformer.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One invoiced line. Charges from the source charge section are folded in as lines with
 * {@code charge = true} and item numbers {@code C1}, {@code C2}, ...
 */
@Value
@Builder
public class LineItem {

    public static final String DEFAULT_ITEM_NUMBER = "1";
    public static final String DEFAULT_UNIT_OF_MEASURE = "EACH";
    public static final String DEFAULT_VAT_CODE = "ASTD";

    @Builder.Default
    String itemNumber = DEFAULT_ITEM_NUMBER;
    @Builder.Default
    String productCode = "";
    @Builder.Default
    String description = "";
    @Builder.Default
    BigDecimal quantity = BigDecimal.ZERO;
    @Builder.Default
    String unitOfMeasure = DEFAULT_UNIT_OF_MEASURE;
    @Builder.Default
    BigDecimal unitPrice = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal lineTotal = BigDecimal.ZERO;
    @Builder.Default
    String vatCode = DEFAULT_VAT_CODE;
    @Builder.Default
    BigDecimal vatRate = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal vatValue = BigDecimal.ZERO;
    boolean charge;
}
