package com.collabim.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * 报价内容。currency 为空时按 USD 处理。
 */
public record OfferDetails(
        BigDecimal amount,
        String currency,
        String description,
        LocalDateTime deadline
) {

    public static final String DEFAULT_CURRENCY = "USD";

    public OfferDetails {
        if (currency == null || currency.isBlank()) {
            currency = DEFAULT_CURRENCY;
        } else {
            currency = currency.trim().toUpperCase(Locale.ROOT);
        }
    }
}
