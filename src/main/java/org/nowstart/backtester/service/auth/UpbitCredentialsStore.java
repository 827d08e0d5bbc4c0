package org.nowstart.backtester.service.auth;

import java.util.concurrent.atomic.AtomicReference;
import org.nowstart.backtester.data.dto.ExchangeCredentials;
import org.nowstart.backtester.data.property.BacktestProperties;
import org.springframework.stereotype.Component;

/**
 * Current Upbit credentials. Seeded from properties, replaced by live-data overrides.
 */
@Component
public class UpbitCredentialsStore {

    private final AtomicReference<ExchangeCredentials> current;

    public UpbitCredentialsStore(BacktestProperties backtestProperties) {
        this.current = new AtomicReference<>(new ExchangeCredentials(
                backtestProperties.upbitAccessKey(),
                backtestProperties.upbitSecretKey(),
                "",
                "",
                ""
        ));
    }

    public ExchangeCredentials get() {
        return current.get();
    }

    public void set(ExchangeCredentials credentials) {
        current.set(credentials == null ? ExchangeCredentials.EMPTY : credentials);
    }
}
