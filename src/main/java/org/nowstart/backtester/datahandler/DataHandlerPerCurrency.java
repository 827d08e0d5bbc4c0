package org.nowstart.backtester.datahandler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.nowstart.backtester.data.dto.CurrencyPair;
import org.nowstart.backtester.data.dto.PairKey;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.nowstart.backtester.data.type.AssetType;

/**
 * Data handlers keyed by pair, iterated in registration order.
 */
public class DataHandlerPerCurrency {

    private final Map<PairKey, DataHandler> handlers = new LinkedHashMap<>();

    public void setDataForCurrency(String exchange, AssetType asset, CurrencyPair pair, DataHandler handler) {
        setDataForCurrency(PairKey.of(exchange, asset, pair), handler);
    }

    public void setDataForCurrency(PairKey key, DataHandler handler) {
        if (key == null || handler == null) {
            throw new BacktestException(ErrorCode.NIL_ARGUMENTS, "key and handler are required");
        }
        handlers.put(key, handler);
    }

    public DataHandler getDataForCurrency(PairKey key) {
        DataHandler handler = handlers.get(key);
        if (handler == null) {
            throw new BacktestException(ErrorCode.DATA_UNAVAILABLE, "no data handler registered for " + key);
        }
        return handler;
    }

    public DataHandler getDataForCurrency(String exchange, AssetType asset, CurrencyPair pair) {
        return getDataForCurrency(PairKey.of(exchange, asset, pair));
    }

    public List<DataHandler> handlers() {
        return List.copyOf(handlers.values());
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    public int size() {
        return handlers.size();
    }

    public boolean allExhausted() {
        return handlers.values().stream().allMatch(DataHandler::isExhausted);
    }

    /**
     * Closes handlers in reverse registration order.
     */
    public void closeAll() {
        List<DataHandler> registered = handlers();
        for (int i = registered.size() - 1; i >= 0; i--) {
            registered.get(i).close();
        }
    }
}
