package com.example.operatorrelay.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 按会话的消息频率限制
 * 距上一条放行消息不足最小间隔的消息被拒绝，拒绝时不修改会话状态
 */
@Component
public class RateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    @Autowired
    private ConversationService conversationService;

    // 同一会话两条消息的最小间隔（毫秒）
    @Value("${relay.rate-limit.min-interval-ms:1200}")
    private long minIntervalMillis = 1200;

    /**
     * 判断消息是否放行
     * @param conversationId 会话ID
     * @param now 消息到达时间（毫秒）
     * @return 是否放行
     */
    public boolean allow(String conversationId, long now) {
        boolean allowed = conversationService.updateConversation(conversationId, conversation -> {
            long last = conversation.getLastMessageTime();
            if (last > 0 && now - last < minIntervalMillis) {
                return false;
            }
            conversation.setLastMessageTime(now);
            return true;
        });
        if (!allowed) {
            logger.debug("会话 {} 消息过于频繁，已丢弃", conversationId);
        }
        return allowed;
    }

    public long getMinIntervalMillis() {
        return minIntervalMillis;
    }

    public void setMinIntervalMillis(long minIntervalMillis) {
        this.minIntervalMillis = minIntervalMillis;
    }
}
