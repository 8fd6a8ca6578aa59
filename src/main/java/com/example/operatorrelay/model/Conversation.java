package com.example.operatorrelay.model;

import java.io.Serializable;

/**
 * 会话模型类，对应一个终端用户的聊天
 * 会话ID即用户ID，首次收到该用户消息时创建，之后原地更新，不会被显式删除
 */
public class Conversation implements Serializable {

    private static final long serialVersionUID = 1L;

    // 会话ID（用户ID）
    private String conversationId;

    // 用户显示名称，用于欢迎语
    private String displayName;

    // 最后一条被放行消息的时间（毫秒），0表示尚未收到消息
    private long lastMessageTime;

    // 是否已经展示过首次忙碌提示
    private boolean firstContactShown;

    // 会话创建时间（毫秒）
    private long createdTime;

    // 构造函数
    public Conversation() {
        this.createdTime = System.currentTimeMillis();
    }

    public Conversation(String conversationId) {
        this();
        this.conversationId = conversationId;
    }

    // 拷贝构造，用于在锁外写回Redis
    public Conversation(Conversation other) {
        this.conversationId = other.conversationId;
        this.displayName = other.displayName;
        this.lastMessageTime = other.lastMessageTime;
        this.firstContactShown = other.firstContactShown;
        this.createdTime = other.createdTime;
    }

    // getter和setter方法
    public String getConversationId() {
        return conversationId;
    }

    public void setConversationId(String conversationId) {
        this.conversationId = conversationId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public long getLastMessageTime() {
        return lastMessageTime;
    }

    public void setLastMessageTime(long lastMessageTime) {
        this.lastMessageTime = lastMessageTime;
    }

    public boolean isFirstContactShown() {
        return firstContactShown;
    }

    public void setFirstContactShown(boolean firstContactShown) {
        this.firstContactShown = firstContactShown;
    }

    public long getCreatedTime() {
        return createdTime;
    }

    public void setCreatedTime(long createdTime) {
        this.createdTime = createdTime;
    }

    @Override
    public String toString() {
        return "Conversation{" +
                "conversationId='" + conversationId + '\'' +
                ", displayName='" + displayName + '\'' +
                ", lastMessageTime=" + lastMessageTime +
                ", firstContactShown=" + firstContactShown +
                ", createdTime=" + createdTime +
                '}';
    }
}
