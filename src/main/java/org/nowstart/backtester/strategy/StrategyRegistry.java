package org.nowstart.backtester.strategy;

import jakarta.annotation.PostConstruct;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class StrategyRegistry {

    private final List<StrategyFactory> factories;
    private Map<String, StrategyFactory> factoriesByName = Map.of();

    @PostConstruct
    public void init() {
        Map<String, StrategyFactory> byName = new HashMap<>();
        for (StrategyFactory factory : factories) {
            String name = normalize(factory.name());
            StrategyFactory previous = byName.put(name, factory);
            if (previous != null) {
                throw new IllegalStateException("Duplicate strategy registered for name=" + name);
            }
        }
        factoriesByName = Map.copyOf(byName);
    }

    public Strategy loadStrategyByName(String name, boolean simultaneousProcessing) {
        StrategyFactory factory = name == null || name.isBlank() ? null : factoriesByName.get(normalize(name));
        if (factory == null) {
            throw new BacktestException(ErrorCode.STRATEGY_NOT_FOUND, "strategy not found: " + name);
        }
        Strategy strategy = factory.create();
        if (simultaneousProcessing) {
            if (!strategy.supportsSimultaneousProcessing()) {
                throw new BacktestException(ErrorCode.MULTI_CURRENCY_UNSUPPORTED,
                        strategy.name() + " " + ErrorCode.MULTI_CURRENCY_UNSUPPORTED.getDefaultMessage());
            }
            strategy.setSimultaneousProcessing(true);
        }
        return strategy;
    }

    public boolean isRegistered(String name) {
        return name != null && !name.isBlank() && factoriesByName.containsKey(normalize(name));
    }

    public Set<String> names() {
        return factoriesByName.keySet();
    }

    private String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
