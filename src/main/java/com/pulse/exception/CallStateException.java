package com.pulse.exception;

/**
 * 当前状态不允许该操作，例如没有待接听的来电时调用answer
 */
public class CallStateException extends CallException {

    public CallStateException(String message) {
        super(message);
    }
}
