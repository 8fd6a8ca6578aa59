package com.example.operatorrelay.service;

import com.example.operatorrelay.exception.TransportException;
import com.example.operatorrelay.transport.RelayTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 临时提示服务：发送一条消息，延迟后删除
 * 删除失败只记录日志，不影响调用方
 */
@Service
public class EphemeralNoticeService {

    private static final Logger logger = LoggerFactory.getLogger(EphemeralNoticeService.class);

    public static final String TYPING_TEXT = "💬 Bot is typing…";

    @Autowired
    private RelayTransport transport;

    @Autowired
    @Qualifier("ephemeralScheduler")
    private ScheduledExecutorService scheduler;

    /**
     * 同步展示临时提示，阻塞当前线程delayMillis毫秒
     * 线程被中断时也会删除消息
     */
    public void showEphemeral(String destinationId, String text, long delayMillis) {
        String messageId;
        try {
            messageId = transport.sendText(destinationId, text);
        } catch (TransportException e) {
            logger.warn("发送临时提示给 {} 失败: {}", destinationId, e.getMessage());
            return;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(delayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            deleteQuietly(destinationId, messageId);
        }
    }

    /**
     * 异步展示临时提示，不阻塞调用方
     * @return 删除完成（或发送失败）后结束的Future，结果只用于观察
     */
    public CompletableFuture<Void> showEphemeralAsync(String destinationId, String text, long delayMillis) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        try {
            scheduler.execute(() -> {
                String messageId;
                try {
                    messageId = transport.sendText(destinationId, text);
                } catch (Exception e) {
                    logger.warn("发送临时提示给 {} 失败: {}", destinationId, e.getMessage());
                    done.complete(null);
                    return;
                }
                try {
                    scheduler.schedule(() -> {
                        deleteQuietly(destinationId, messageId);
                        done.complete(null);
                    }, delayMillis, TimeUnit.MILLISECONDS);
                } catch (RejectedExecutionException e) {
                    deleteQuietly(destinationId, messageId);
                    done.complete(null);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.warn("调度器已关闭，放弃临时提示: {}", destinationId);
            done.complete(null);
        }
        return done;
    }

    /**
     * 展示正在输入：先发送输入状态（忽略失败），再同步展示输入提示
     */
    public void showTyping(String destinationId, long delayMillis) {
        try {
            transport.showTypingIndicator(destinationId);
        } catch (TransportException e) {
            logger.debug("发送输入状态给 {} 失败: {}", destinationId, e.getMessage());
        }
        showEphemeral(destinationId, TYPING_TEXT, delayMillis);
    }

    private void deleteQuietly(String destinationId, String messageId) {
        try {
            transport.delete(destinationId, messageId);
        } catch (Exception e) {
            logger.debug("删除临时提示 {} 失败: {}", messageId, e.getMessage());
        }
    }
}
