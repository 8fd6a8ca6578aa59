package com.example.operatorrelay.exception;

/**
 * 同一转发消息ID被重复记录，属于逻辑错误，不应重试
 */
public class DuplicateCorrelationException extends RelayException {

    private final String relayedMessageId;

    public DuplicateCorrelationException(String relayedMessageId) {
        super("转发记录已存在: " + relayedMessageId);
        this.relayedMessageId = relayedMessageId;
    }

    public String getRelayedMessageId() {
        return relayedMessageId;
    }
}
