package org.nowstart.backtester.data.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One backtest run as read from its JSON config file.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BacktestConfig {

    private String nickname;
    private String goal;
    private StrategySettings strategySettings;
    @Builder.Default
    private List<CurrencySettings> currencySettings = new ArrayList<>();
    private PortfolioSettings portfolioSettings;
    private DataSettings dataSettings;
    private StatisticSettings statisticSettings;
}
