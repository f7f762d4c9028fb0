package com.eyelevel.invoicetransformer.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One VAT rate bracket from the source VAT summary.
 */
@Value
@Builder
public class VatGroup {

    @Builder.Default
    String code = "";
    @Builder.Default
    String description = "";
    @Builder.Default
    BigDecimal rate = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal principalValue = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal vatValue = BigDecimal.ZERO;
}
