package org.nowstart.backtester.data.dto;

/**
 * Read-only per-pair trading rules shared by the portfolio and the exchange simulator.
 */
public record ExecutionSettings(
        double makerFee,
        double takerFee,
        MinMax buySide,
        MinMax sellSide,
        double maximumHoldingsRatio
) {

    public static final ExecutionSettings DEFAULT = new ExecutionSettings(0, 0, MinMax.NONE, MinMax.NONE, 0);

    public ExecutionSettings {
        buySide = buySide == null ? MinMax.NONE : buySide;
        sellSide = sellSide == null ? MinMax.NONE : sellSide;
    }
}
