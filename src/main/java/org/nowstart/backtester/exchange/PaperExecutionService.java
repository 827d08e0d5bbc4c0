package org.nowstart.backtester.exchange;

import java.util.HashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.backtester.data.dto.ExecutionSettings;
import org.nowstart.backtester.data.dto.PairKey;
import org.nowstart.backtester.data.type.Direction;
import org.nowstart.backtester.data.type.OrderType;
import org.nowstart.backtester.event.DataEvent;
import org.nowstart.backtester.event.FillEvent;
import org.nowstart.backtester.event.OrderEvent;

/**
 * Simulated venue. Orders fill in full at the candle close; unreachable limits are rejected.
 */
@Slf4j
public class PaperExecutionService {

    public static final String REASON_LIMIT_NOT_REACHED = "limit price not reached";
    public static final String REASON_NO_PRICE = "no market price";

    private final Map<PairKey, ExecutionSettings> settings = new HashMap<>();

    public void setCurrencySettings(PairKey key, ExecutionSettings executionSettings) {
        settings.put(key, executionSettings == null ? ExecutionSettings.DEFAULT : executionSettings);
    }

    public ExecutionSettings getCurrencySettings(PairKey key) {
        return settings.getOrDefault(key, ExecutionSettings.DEFAULT);
    }

    public FillEvent executeOrder(OrderEvent order, DataEvent data) {
        double execPrice = data.closePrice();
        if (!(execPrice > 0)) {
            return FillEvent.rejected(order, REASON_NO_PRICE);
        }

        if (order.orderType() == OrderType.LIMIT && !isLimitReachable(order, execPrice)) {
            log.info("event=paper_fill_rejected key={} ts={} direction={} limit={} close={} reason={}",
                    order.key(), order.timestamp(), order.direction(), order.limitPrice(), execPrice,
                    REASON_LIMIT_NOT_REACHED);
            return FillEvent.rejected(order, REASON_LIMIT_NOT_REACHED);
        }

        ExecutionSettings pairSettings = getCurrencySettings(order.key());
        double feeRate = order.orderType() == OrderType.LIMIT ? pairSettings.makerFee() : pairSettings.takerFee();
        double fee = execPrice * order.amount() * feeRate;

        log.info(
                "Paper execution completed. key={}, ts={}, side={}, executedQty={}, executedPrice={}, fee={}",
                order.key(),
                order.timestamp(),
                order.direction(),
                order.amount(),
                execPrice,
                fee
        );
        return FillEvent.filled(order, execPrice, fee);
    }

    private boolean isLimitReachable(OrderEvent order, double execPrice) {
        if (order.direction() == Direction.BUY) {
            return execPrice <= order.limitPrice();
        }
        return execPrice >= order.limitPrice();
    }
}
