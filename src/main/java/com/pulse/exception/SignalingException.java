package com.pulse.exception;

/**
 * 信令存储读写失败，一般可以恢复
 */
public class SignalingException extends CallException {

    public SignalingException(String message) {
        super(message);
    }

    public SignalingException(String message, Throwable cause) {
        super(message, cause);
    }
}
