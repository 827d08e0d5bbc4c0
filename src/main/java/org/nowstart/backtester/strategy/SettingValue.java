package org.nowstart.backtester.strategy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;

/**
 * Custom strategy setting. Holds exactly one of text, number or flag as given in the run config.
 */
public record SettingValue(Kind kind, String text, double number, boolean flag) {

    public enum Kind {
        TEXT,
        NUMBER,
        FLAG
    }

    public static SettingValue of(String text) {
        return new SettingValue(Kind.TEXT, text, 0, false);
    }

    public static SettingValue of(double number) {
        return new SettingValue(Kind.NUMBER, null, number, false);
    }

    public static SettingValue of(boolean flag) {
        return new SettingValue(Kind.FLAG, null, 0, flag);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static SettingValue from(Object raw) {
        if (raw instanceof String text) {
            return of(text);
        }
        if (raw instanceof Number number) {
            return of(number.doubleValue());
        }
        if (raw instanceof Boolean flag) {
            return of(flag.booleanValue());
        }
        throw new BacktestException(ErrorCode.INVALID_STRATEGY_SETTINGS,
                "setting value must be a string, number or boolean. actual=" + raw);
    }

    @JsonValue
    public Object raw() {
        return switch (kind) {
            case TEXT -> text;
            case NUMBER -> number;
            case FLAG -> flag;
        };
    }

    public double asDouble(String name) {
        if (kind == Kind.NUMBER) {
            return number;
        }
        if (kind == Kind.TEXT) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new BacktestException(ErrorCode.INVALID_STRATEGY_SETTINGS,
                        "setting " + name + " must be numeric. actual=" + text, e);
            }
        }
        throw new BacktestException(ErrorCode.INVALID_STRATEGY_SETTINGS, "setting " + name + " must be numeric");
    }

    public int asInt(String name) {
        double value = asDouble(name);
        if (value != Math.rint(value)) {
            throw new BacktestException(ErrorCode.INVALID_STRATEGY_SETTINGS,
                    "setting " + name + " must be a whole number. actual=" + value);
        }
        return (int) value;
    }

    public boolean asBoolean(String name) {
        if (kind == Kind.FLAG) {
            return flag;
        }
        if (kind == Kind.TEXT && ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text))) {
            return Boolean.parseBoolean(text);
        }
        throw new BacktestException(ErrorCode.INVALID_STRATEGY_SETTINGS, "setting " + name + " must be boolean");
    }

    @Override
    public String toString() {
        return String.valueOf(raw());
    }
}
