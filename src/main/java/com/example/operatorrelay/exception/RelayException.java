package com.example.operatorrelay.exception;

/**
 * 转发链路异常基类
 */
public class RelayException extends RuntimeException {

    public RelayException(String message) {
        super(message);
    }

    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
