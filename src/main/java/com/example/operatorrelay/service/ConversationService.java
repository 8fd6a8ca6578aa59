package com.example.operatorrelay.service;

import com.example.operatorrelay.model.Conversation;

import java.util.function.Function;

/**
 * 会话存储服务接口
 * 业务系统可以实现此接口来自定义会话的存储方式
 */
public interface ConversationService {

    /**
     * 根据会话ID获取会话信息
     * @param conversationId 会话ID
     * @return 会话信息，不存在时返回null
     */
    Conversation getConversation(String conversationId);

    /**
     * 在同一会话的排他区内读取并修改会话，会话不存在时先创建
     * 不同会话之间互不阻塞；action内不应执行网络I/O
     * @param conversationId 会话ID
     * @param action 对会话的读取或修改
     * @param <T> 返回值类型
     * @return action的返回值
     */
    <T> T updateConversation(String conversationId, Function<Conversation, T> action);

    /**
     * 获取已知会话数量
     * @return 会话数
     */
    int getConversationCount();
}
