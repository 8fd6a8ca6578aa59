package com.example.operatorrelay.transport;

import com.example.operatorrelay.exception.TransportException;
import com.example.operatorrelay.model.MediaAttachment;
import com.example.operatorrelay.model.RelayMessage;

/**
 * 聊天传输层接口
 * 发送类操作返回传输层为新消息分配的ID，失败时抛出TransportException
 */
public interface RelayTransport {

    /**
     * 将一条入站消息转发给目标
     * @param destinationId 目标ID
     * @param source 原始消息
     * @return 转发副本的消息ID
     */
    String forward(String destinationId, RelayMessage source) throws TransportException;

    /**
     * 发送文本
     * @return 消息ID
     */
    String sendText(String destinationId, String text) throws TransportException;

    /**
     * 发送媒体
     * @param caption 说明文字，可为null
     * @return 消息ID
     */
    String sendMedia(String destinationId, MediaAttachment media, String caption) throws TransportException;

    /**
     * 删除已发送的消息
     */
    void delete(String destinationId, String messageId) throws TransportException;

    /**
     * 显示正在输入提示，尽力而为
     */
    void showTypingIndicator(String destinationId) throws TransportException;
}
