package com.example.operatorrelay.service;

import com.example.operatorrelay.model.Conversation;
import com.example.operatorrelay.util.RedisUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * 基于Redis的会话存储实现
 * 本地内存作为主存储，修改在ConcurrentHashMap.compute内完成，锁外写回Redis；进程重启后按需从Redis加载
 */
@Service
public class RedisConversationServiceImpl implements ConversationService {

    private static final Logger logger = LoggerFactory.getLogger(RedisConversationServiceImpl.class);

    // Redis key前缀
    private static final String CONVERSATION_KEY = "relay:conversation:";

    @Autowired(required = false)
    private RedisUtil redisUtil;

    @Autowired
    private ObjectMapper objectMapper;

    // 本地内存存储
    private final Map<String, Conversation> localConversations = new ConcurrentHashMap<>();

    @Override
    public Conversation getConversation(String conversationId) {
        Conversation conversation = localConversations.get(conversationId);
        if (conversation == null) {
            conversation = loadFromRedis(conversationId);
        }
        return conversation;
    }

    @Override
    public <T> T updateConversation(String conversationId, Function<Conversation, T> action) {
        // 先在锁外从Redis加载，compute内只做内存修改
        if (!localConversations.containsKey(conversationId)) {
            Conversation stored = loadFromRedis(conversationId);
            if (stored != null) {
                localConversations.putIfAbsent(conversationId, stored);
            }
        }

        AtomicReference<T> result = new AtomicReference<>();
        AtomicReference<Conversation> snapshot = new AtomicReference<>();
        localConversations.compute(conversationId, (id, existing) -> {
            Conversation conversation = existing;
            if (conversation == null) {
                conversation = new Conversation(id);
                logger.info("创建新会话: {}", id);
            }
            result.set(action.apply(conversation));
            snapshot.set(new Conversation(conversation));
            return conversation;
        });

        // 同一会话的消息由ConversationDispatcher串行处理，写回顺序与修改顺序一致
        saveToRedis(snapshot.get());
        return result.get();
    }

    @Override
    public int getConversationCount() {
        return localConversations.size();
    }

    private Conversation loadFromRedis(String conversationId) {
        if (redisUtil == null) {
            return null;
        }
        String json = redisUtil.get(CONVERSATION_KEY + conversationId, String.class);
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, Conversation.class);
        } catch (JsonProcessingException e) {
            logger.error("解析Redis中的会话失败: {}", conversationId, e);
            return null;
        }
    }

    private void saveToRedis(Conversation conversation) {
        if (redisUtil == null) {
            return;
        }
        try {
            if (!redisUtil.set(CONVERSATION_KEY + conversation.getConversationId(),
                    objectMapper.writeValueAsString(conversation))) {
                logger.debug("会话 {} 未能写入Redis，仅保存在本地内存", conversation.getConversationId());
            }
        } catch (JsonProcessingException e) {
            logger.error("序列化会话失败: {}", conversation.getConversationId(), e);
        }
    }
}
