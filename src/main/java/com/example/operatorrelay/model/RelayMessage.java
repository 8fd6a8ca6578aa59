package com.example.operatorrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.Locale;

/**
 * WebSocket消息帧模型类
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RelayMessage implements Serializable {

    // 客户端上行消息类型
    public static final String TYPE_CHAT = "CHAT";          // 文本消息（以/开头的文本视为命令）
    public static final String TYPE_MEDIA = "MEDIA";        // 媒体消息，content为说明文字

    // 服务端下行消息类型
    public static final String TYPE_FORWARD = "FORWARD";    // 转发给运营者的用户消息副本
    public static final String TYPE_DELETE = "DELETE";      // 删除客户端已显示的消息
    public static final String TYPE_TYPING = "TYPING";      // 正在输入提示
    public static final String TYPE_SYSTEM = "SYSTEM";      // 连接层系统消息
    public static final String TYPE_ERROR = "ERROR";        // 帧格式错误

    public static final String COMMAND_PREFIX = "/";

    private static final long serialVersionUID = 1L;

    // 消息类型
    private String type;

    // 服务端分配的消息ID
    private String messageId;

    // 发送者ID
    private String senderId;

    // 接收者ID
    private String receiverId;

    // 文本内容或媒体说明
    private String content;

    // 所回复消息的ID
    private String replyToMessageId;

    // DELETE消息要删除的消息ID
    private String targetMessageId;

    // 媒体附件
    private MediaAttachment media;

    // 转发副本的原始发送者
    private String forwardedFrom;

    private String forwardedFromName;

    // 消息时间戳
    private long timestamp;

    // 构造函数
    public RelayMessage() {
        this.timestamp = System.currentTimeMillis();
    }

    public RelayMessage(String type, String content, String senderId, String receiverId) {
        this.type = type;
        this.content = content;
        this.senderId = senderId;
        this.receiverId = receiverId;
        this.timestamp = System.currentTimeMillis();
    }

    /**
     * 是否为命令，如 /available
     */
    @JsonIgnore
    public boolean isCommand() {
        return TYPE_CHAT.equals(type) && content != null && content.trim().startsWith(COMMAND_PREFIX);
    }

    /**
     * 命令名（去掉前缀、参数和@后缀，小写），非命令返回null
     */
    @JsonIgnore
    public String getCommandName() {
        if (!isCommand()) {
            return null;
        }
        String token = content.trim().substring(COMMAND_PREFIX.length()).split("\\s+", 2)[0];
        int at = token.indexOf('@');
        if (at >= 0) {
            token = token.substring(0, at);
        }
        return token.toLowerCase(Locale.ROOT);
    }

    @JsonIgnore
    public boolean isReply() {
        return replyToMessageId != null && !replyToMessageId.isEmpty();
    }

    @JsonIgnore
    public boolean hasMedia() {
        return media != null && media.getUrl() != null;
    }

    // getter和setter方法
    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getMessageId() {
        return messageId;
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
    }

    public String getSenderId() {
        return senderId;
    }

    public void setSenderId(String senderId) {
        this.senderId = senderId;
    }

    public String getReceiverId() {
        return receiverId;
    }

    public void setReceiverId(String receiverId) {
        this.receiverId = receiverId;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public String getReplyToMessageId() {
        return replyToMessageId;
    }

    public void setReplyToMessageId(String replyToMessageId) {
        this.replyToMessageId = replyToMessageId;
    }

    public String getTargetMessageId() {
        return targetMessageId;
    }

    public void setTargetMessageId(String targetMessageId) {
        this.targetMessageId = targetMessageId;
    }

    public MediaAttachment getMedia() {
        return media;
    }

    public void setMedia(MediaAttachment media) {
        this.media = media;
    }

    public String getForwardedFrom() {
        return forwardedFrom;
    }

    public void setForwardedFrom(String forwardedFrom) {
        this.forwardedFrom = forwardedFrom;
    }

    public String getForwardedFromName() {
        return forwardedFromName;
    }

    public void setForwardedFromName(String forwardedFromName) {
        this.forwardedFromName = forwardedFromName;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return "RelayMessage{" +
                "type='" + type + '\'' +
                ", messageId='" + messageId + '\'' +
                ", senderId='" + senderId + '\'' +
                ", receiverId='" + receiverId + '\'' +
                ", content='" + content + '\'' +
                ", replyToMessageId='" + replyToMessageId + '\'' +
                ", media=" + media +
                ", forwardedFrom='" + forwardedFrom + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
