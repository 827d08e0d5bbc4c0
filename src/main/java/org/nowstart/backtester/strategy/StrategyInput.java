package org.nowstart.backtester.strategy;

import org.nowstart.backtester.datahandler.DataHandler;
import org.nowstart.backtester.portfolio.Holdings;

public record StrategyInput(DataHandler data, Holdings holdings) {
}
