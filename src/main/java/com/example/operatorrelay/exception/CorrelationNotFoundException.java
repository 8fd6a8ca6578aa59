package com.example.operatorrelay.exception;

/**
 * 被回复的消息没有对应的转发记录（过期、被清理，或不是转发副本）
 */
public class CorrelationNotFoundException extends RelayException {

    private final String relayedMessageId;

    public CorrelationNotFoundException(String relayedMessageId) {
        super("转发记录不存在: " + relayedMessageId);
        this.relayedMessageId = relayedMessageId;
    }

    public String getRelayedMessageId() {
        return relayedMessageId;
    }
}
