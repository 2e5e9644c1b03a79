package com.partfinder.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class PriceEstimate {
    BigDecimal amount;
    String currency;
    BigDecimal rangeLow;
    BigDecimal rangeHigh;

    public String getFormatted() {
        return "$" + amount.toPlainString();
    }

    public String getRangeFormatted() {
        return "$" + rangeLow.toPlainString() + "-$" + rangeHigh.toPlainString();
    }
}
