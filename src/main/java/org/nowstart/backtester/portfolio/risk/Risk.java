package org.nowstart.backtester.portfolio.risk;

import org.nowstart.backtester.data.dto.ExecutionSettings;
import org.nowstart.backtester.event.OrderEvent;
import org.nowstart.backtester.portfolio.Holdings;

public interface Risk {

    RiskDecision evaluate(OrderEvent order, Holdings holdings, ExecutionSettings settings);
}
