package org.nowstart.backtester.data.type;

import java.util.Locale;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;

public enum DataType {
    CANDLE,
    TRADE;

    public static DataType parse(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            if ("candle".equals(normalized)) {
                return CANDLE;
            }
            if ("trade".equals(normalized)) {
                return TRADE;
            }
        }
        throw new BacktestException(ErrorCode.UNRECOGNISED_DATA_TYPE, "unrecognised dataType: " + raw);
    }
}
