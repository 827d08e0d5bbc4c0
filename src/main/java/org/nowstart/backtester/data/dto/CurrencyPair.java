package org.nowstart.backtester.data.dto;

import java.util.Locale;

public record CurrencyPair(String base, String quote) {

    public CurrencyPair {
        if (base == null || base.isBlank() || quote == null || quote.isBlank()) {
            throw new IllegalArgumentException("base and quote are required");
        }
        base = base.trim().toUpperCase(Locale.ROOT);
        quote = quote.trim().toUpperCase(Locale.ROOT);
    }

    public static CurrencyPair of(String base, String quote) {
        return new CurrencyPair(base, quote);
    }

    @Override
    public String toString() {
        return base + "/" + quote;
    }
}
