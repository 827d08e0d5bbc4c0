package org.nowstart.backtester.data.type;

import java.util.Locale;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;

public enum AssetType {
    SPOT,
    MARGIN,
    FUTURES,
    PERPETUAL_SWAP;

    public static AssetType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new BacktestException(ErrorCode.UNSET_ASSET, "asset type unset");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (AssetType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new BacktestException(ErrorCode.UNSET_ASSET, "unsupported asset type: " + raw);
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
