package com.eyelevel.invoicetransformer.service.transform;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point rendering of amounts. Downstream consumers compare these strings exactly, so every
 * field has its own scale and rounding is always half-up.
 */
public final class FixedDecimal {

    private FixedDecimal() {
    }

    public static String format(final BigDecimal value, final int scale) {
        return value.setScale(scale, RoundingMode.HALF_UP).toPlainString();
    }
}
