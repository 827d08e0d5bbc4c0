package org.nowstart.backtester.exchange;

import jakarta.annotation.PostConstruct;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class ExchangeRegistryHostEngine implements HostEngine {

    private final List<ExchangeAdapter> adapters;
    private Map<String, ExchangeAdapter> adaptersByName = Map.of();

    @PostConstruct
    void init() {
        Map<String, ExchangeAdapter> byName = new HashMap<>();
        for (ExchangeAdapter adapter : adapters) {
            String name = normalize(adapter.name());
            ExchangeAdapter previous = byName.put(name, adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate exchange adapter registered for name=" + name);
            }
        }
        adaptersByName = Map.copyOf(byName);
        log.info("event=exchange_registry_ready exchanges={}", adaptersByName.keySet());
    }

    @Override
    public Optional<ExchangeAdapter> getExchangeByName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(adaptersByName.get(normalize(name)));
    }

    private String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
