package com.pulse.exception;

/**
 * 本地采集设备不可用或被拒绝，对当前操作是致命的
 */
public class MediaUnavailableException extends CallException {

    public MediaUnavailableException(String message) {
        super(message);
    }

    public MediaUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
