package com.example.operatorrelay.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * 按会话串行执行入站消息处理
 * 同一会话的任务按提交顺序依次执行，不同会话之间互不等待
 */
@Component
public class ConversationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(ConversationDispatcher.class);

    private final Executor executor;

    // 每个会话最后提交的任务，执行完且没有后续任务时移除
    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    @Autowired
    public ConversationDispatcher(@Qualifier("relayWorkers") Executor executor) {
        this.executor = executor;
    }

    /**
     * 提交会话任务
     * @param conversationId 会话ID
     * @param task 处理任务，异常只记录日志
     * @return 任务执行完成后结束的Future
     */
    public CompletableFuture<Void> dispatch(String conversationId, Runnable task) {
        CompletableFuture<Void> next = tails.compute(conversationId, (id, tail) -> {
            CompletableFuture<Void> previous = tail == null ? CompletableFuture.completedFuture(null) : tail;
            return previous.handleAsync((ignored, error) -> {
                runQuietly(id, task);
                return null;
            }, executor);
        });
        next.whenComplete((ignored, error) -> {
            if (error != null) {
                logger.warn("会话 {} 的任务未能执行: {}", conversationId, error.getMessage());
            }
            tails.remove(conversationId, next);
        });
        return next;
    }

    /**
     * 有未完成任务的会话数
     */
    public int getPendingCount() {
        return tails.size();
    }

    private static void runQuietly(String conversationId, Runnable task) {
        try {
            task.run();
        } catch (Exception e) {
            logger.error("会话 {} 的任务执行失败", conversationId, e);
        }
    }
}
