package com.example.operatorrelay.transport;

import com.example.operatorrelay.exception.TransportException;
import com.example.operatorrelay.manager.WebSocketConnectionManager;
import com.example.operatorrelay.model.MediaAttachment;
import com.example.operatorrelay.model.RelayMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * 基于WebSocket连接的传输层实现
 * 每条下行消息由服务端分配UUID作为消息ID，客户端回复和删除都以该ID引用消息
 */
@Component
public class WebSocketRelayTransport implements RelayTransport {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketRelayTransport.class);

    public static final String SERVER_SENDER_ID = "server";

    @Autowired
    private WebSocketConnectionManager connectionManager;

    @Autowired
    private ObjectMapper objectMapper;

    @Override
    public String forward(String destinationId, RelayMessage source) {
        RelayMessage copy = newMessage(RelayMessage.TYPE_FORWARD, source.getContent(), destinationId);
        copy.setMedia(source.getMedia());
        copy.setForwardedFrom(source.getSenderId());
        copy.setForwardedFromName(source.getForwardedFromName());
        return deliver(copy);
    }

    @Override
    public String sendText(String destinationId, String text) {
        return deliver(newMessage(RelayMessage.TYPE_CHAT, text, destinationId));
    }

    @Override
    public String sendMedia(String destinationId, MediaAttachment media, String caption) {
        RelayMessage message = newMessage(RelayMessage.TYPE_MEDIA, caption, destinationId);
        message.setMedia(media);
        return deliver(message);
    }

    @Override
    public void delete(String destinationId, String messageId) {
        RelayMessage message = newMessage(RelayMessage.TYPE_DELETE, null, destinationId);
        message.setTargetMessageId(messageId);
        deliver(message);
    }

    @Override
    public void showTypingIndicator(String destinationId) {
        deliver(newMessage(RelayMessage.TYPE_TYPING, null, destinationId));
    }

    private RelayMessage newMessage(String type, String content, String destinationId) {
        RelayMessage message = new RelayMessage(type, content, SERVER_SENDER_ID, destinationId);
        message.setMessageId(UUID.randomUUID().toString());
        return message;
    }

    private String deliver(RelayMessage message) {
        String json;
        try {
            json = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new TransportException("消息序列化失败", e);
        }
        if (!connectionManager.sendMessage(message.getReceiverId(), json)) {
            throw new TransportException("接收者不在线: " + message.getReceiverId());
        }
        logger.debug("已发送 {} 消息 {} 给 {}", message.getType(), message.getMessageId(), message.getReceiverId());
        return message.getMessageId();
    }
}
