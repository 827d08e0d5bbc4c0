package org.nowstart.backtester.portfolio.risk;

public record RiskDecision(boolean approved, String reason) {

    public static final String REASON_NO_HOLDINGS = "no holdings to sell";
    public static final String REASON_SELL_EXCEEDS_HOLDINGS = "sell amount exceeds holdings";
    public static final String REASON_INSUFFICIENT_FUNDS = "insufficient funds";
    public static final String REASON_EXPOSURE_LIMIT = "exposure exceeds maximum holdings ratio";

    public static RiskDecision approve() {
        return new RiskDecision(true, "");
    }

    public static RiskDecision reject(String reason) {
        return new RiskDecision(false, reason);
    }
}
