package com.pulse.exception;

/**
 * 通话相关异常的基类
 */
public class CallException extends RuntimeException {

    public CallException(String message) {
        super(message);
    }

    public CallException(String message, Throwable cause) {
        super(message, cause);
    }
}
