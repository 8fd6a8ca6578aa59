package com.example.operatorrelay.model;

import java.io.Serializable;

/**
 * 转发记录模型类，记录一条转发副本与来源会话的对应关系
 * 每条成功转发的用户消息对应一条记录，创建后只读
 */
public class RelayRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    // 运营者侧传输层分配给转发副本的消息ID
    private String relayedMessageId;

    // 来源会话ID
    private String originConversationId;

    // 记录创建时间（毫秒），用于过期清理
    private long createdTime;

    // 构造函数
    public RelayRecord() {
        this.createdTime = System.currentTimeMillis();
    }

    public RelayRecord(String relayedMessageId, String originConversationId) {
        this();
        this.relayedMessageId = relayedMessageId;
        this.originConversationId = originConversationId;
    }

    // getter和setter方法
    public String getRelayedMessageId() {
        return relayedMessageId;
    }

    public void setRelayedMessageId(String relayedMessageId) {
        this.relayedMessageId = relayedMessageId;
    }

    public String getOriginConversationId() {
        return originConversationId;
    }

    public void setOriginConversationId(String originConversationId) {
        this.originConversationId = originConversationId;
    }

    public long getCreatedTime() {
        return createdTime;
    }

    public void setCreatedTime(long createdTime) {
        this.createdTime = createdTime;
    }

    @Override
    public String toString() {
        return "RelayRecord{" +
                "relayedMessageId='" + relayedMessageId + '\'' +
                ", originConversationId='" + originConversationId + '\'' +
                ", createdTime=" + createdTime +
                '}';
    }
}
