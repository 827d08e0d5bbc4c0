package org.nowstart.backtester.data.exception;

import lombok.Getter;

@Getter
public class BacktestException extends RuntimeException {

    private final ErrorCode code;

    public BacktestException(ErrorCode code) {
        this(code, code.getDefaultMessage());
    }

    public BacktestException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public BacktestException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

}
