package org.nowstart.backtester.data.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // 설정 검증 (newFromConfig 검증 순서와 동일)
    NIL_CONFIG("nil config received"),
    NIL_HOST_ENGINE("nil host engine received"),
    NO_CURRENCY_SETTINGS("no currency settings set in config"),
    BAD_INITIAL_FUNDS("initial funds must be greater than zero"),
    UNSET_ASSET("asset type unset or unsupported"),
    EXCHANGE_NOT_FOUND("exchange not found"),
    NO_DATA_SOURCE("no data source set in config"),
    UNRECOGNISED_DATA_TYPE("unrecognised dataType"),
    START_END_UNSET("start and end dates must be set and start must precede end"),
    INTERVAL_UNSET("candle interval unset or unsupported"),
    STRATEGY_NOT_FOUND("strategy not found"),
    MULTI_CURRENCY_UNSUPPORTED("strategy does not support simultaneous signal processing"),
    INVALID_CURRENCY_SETTINGS("invalid currency settings"),
    INVALID_STRATEGY_SETTINGS("invalid strategy settings"),
    CUSTOM_SETTINGS_UNSUPPORTED("strategy does not support custom settings"),
    NIL_ARGUMENTS("received nil arguments"),

    // 포트폴리오
    CURRENCY_SETTINGS_NOT_FOUND("currency settings not found"),
    AMOUNT_BELOW_MINIMUM("sized amount below minimum"),
    NO_FUNDS("no funds available"),

    // 데이터 적재
    DATABASE_DISABLED("database support is disabled"),
    DATA_UNAVAILABLE("unable to retrieve data"),

    // 실행 중 치명 오류
    OUT_OF_ORDER_EVENT("event timestamp precedes last recorded timestamp"),
    NEGATIVE_HOLDINGS("holdings would become negative"),
    INVALID_SIGNAL("strategy produced an invalid signal"),
    RUN_FAILED("backtest run failed");

    private final String defaultMessage;
}
