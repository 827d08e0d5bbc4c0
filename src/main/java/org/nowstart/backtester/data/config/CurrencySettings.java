package org.nowstart.backtester.data.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.backtester.data.dto.ExecutionSettings;
import org.nowstart.backtester.data.dto.MinMax;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CurrencySettings {

    private String exchangeName;
    private String asset;
    private String base;
    private String quote;
    private double initialFunds;
    // 지정가 주문 수수료율
    private double makerFee;
    // 시장가 주문 수수료율
    private double takerFee;
    private MinMax buySide;
    private MinMax sellSide;
    // 0이면 포트폴리오 기본값 사용
    private double maximumHoldingsRatio;

    public ExecutionSettings toExecutionSettings() {
        return new ExecutionSettings(makerFee, takerFee, buySide, sellSide, maximumHoldingsRatio);
    }
}
