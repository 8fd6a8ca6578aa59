package com.example.operatorrelay.exception;

/**
 * 传输层发送、转发或删除失败
 */
public class TransportException extends RelayException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
