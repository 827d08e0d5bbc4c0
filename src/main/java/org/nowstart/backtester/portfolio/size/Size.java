package org.nowstart.backtester.portfolio.size;

import org.nowstart.backtester.data.dto.ExecutionSettings;
import org.nowstart.backtester.data.dto.MinMax;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;
import org.nowstart.backtester.event.SignalEvent;
import org.nowstart.backtester.portfolio.Holdings;

/**
 * Converts a signal into an order amount. Portfolio-wide bounds apply first, then the pair's own.
 */
public class Size {

    private final MinMax buySide;
    private final MinMax sellSide;

    public Size(MinMax buySide, MinMax sellSide) {
        this.buySide = buySide == null ? MinMax.NONE : buySide;
        this.sellSide = sellSide == null ? MinMax.NONE : sellSide;
    }

    public static Size unbounded() {
        return new Size(MinMax.NONE, MinMax.NONE);
    }

    public double sizeOrder(SignalEvent signal, double price, Holdings holdings, ExecutionSettings settings) {
        if (!(price > 0)) {
            throw new BacktestException(ErrorCode.AMOUNT_BELOW_MINIMUM, "cannot size order at price=" + price);
        }
        double feeRate = signal.limitPrice() != null ? settings.makerFee() : settings.takerFee();
        return switch (signal.direction()) {
            case BUY -> sizeBuy(signal, price, feeRate, holdings, settings.buySide());
            case SELL -> sizeSell(signal, price, holdings, settings.sellSide());
            case HOLD -> throw new IllegalArgumentException("HOLD signals are not sized");
        };
    }

    private double sizeBuy(SignalEvent signal, double price, double feeRate, Holdings holdings, MinMax pairBounds) {
        if (holdings.remainingFunds() <= 0) {
            throw new BacktestException(ErrorCode.NO_FUNDS, "no funds available for " + holdings.key());
        }
        double amount = signal.amount() > 0
                ? signal.amount()
                : holdings.remainingFunds() * (1 - feeRate) / price;
        amount = clamp(clamp(amount, price, buySide), price, pairBounds);
        if (!(amount > 0)) {
            throw new BacktestException(ErrorCode.AMOUNT_BELOW_MINIMUM,
                    "sized buy amount must be positive. amount=" + amount + ", feeRate=" + feeRate);
        }
        requireMinimum(amount, buySide);
        requireMinimum(amount, pairBounds);
        return amount;
    }

    private double sizeSell(SignalEvent signal, double price, Holdings holdings, MinMax pairBounds) {
        double held = holdings.quantity();
        if (held <= 0) {
            return 0;
        }
        double amount = signal.amount() > 0 ? Math.min(signal.amount(), held) : held;
        amount = clamp(clamp(amount, price, sellSide), price, pairBounds);
        requireMinimum(amount, sellSide);
        requireMinimum(amount, pairBounds);
        return amount;
    }

    private static double clamp(double amount, double price, MinMax bounds) {
        double result = amount;
        if (bounds.maximumSize() > 0 && result > bounds.maximumSize()) {
            result = bounds.maximumSize();
        }
        if (bounds.maximumTotal() > 0 && result * price > bounds.maximumTotal()) {
            result = bounds.maximumTotal() / price;
        }
        return result;
    }

    private static void requireMinimum(double amount, MinMax bounds) {
        if (bounds.minimumSize() > 0 && amount < bounds.minimumSize()) {
            throw new BacktestException(ErrorCode.AMOUNT_BELOW_MINIMUM,
                    "sized amount " + amount + " below minimum " + bounds.minimumSize());
        }
    }
}
