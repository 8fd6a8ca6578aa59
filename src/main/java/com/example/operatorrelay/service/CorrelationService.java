package com.example.operatorrelay.service;

import com.example.operatorrelay.exception.CorrelationNotFoundException;
import com.example.operatorrelay.exception.DuplicateCorrelationException;

/**
 * 转发关联服务接口
 * 记录转发副本的消息ID与来源会话的对应关系，使运营者的回复可以回到原会话
 */
public interface CorrelationService {

    /**
     * 记录一条转发关联
     * @param relayedMessageId 转发副本的消息ID
     * @param originConversationId 来源会话ID
     * @throws DuplicateCorrelationException 消息ID已存在
     */
    void record(String relayedMessageId, String originConversationId);

    /**
     * 查找转发副本的来源会话
     * @param relayedMessageId 转发副本的消息ID
     * @return 来源会话ID
     * @throws CorrelationNotFoundException 没有对应记录
     */
    String resolve(String relayedMessageId);

    /**
     * 清理超过保留期限的记录
     * @return 清理的条数
     */
    int purgeExpired();

    /**
     * 本地保存的记录数
     */
    int size();
}
