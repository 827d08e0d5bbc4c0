package org.nowstart.backtester.config;

import org.nowstart.backtester.strategy.StrategyFactory;
import org.nowstart.backtester.strategy.dca.DollarCostAverageStrategy;
import org.nowstart.backtester.strategy.rsi.RsiStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StrategyConfig {

    @Bean
    public StrategyFactory dollarCostAverageStrategyFactory() {
        return new StrategyFactory(DollarCostAverageStrategy.NAME, DollarCostAverageStrategy::new);
    }

    @Bean
    public StrategyFactory rsiStrategyFactory() {
        return new StrategyFactory(RsiStrategy.NAME, RsiStrategy::new);
    }
}
