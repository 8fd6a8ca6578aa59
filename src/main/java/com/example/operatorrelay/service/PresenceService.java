package com.example.operatorrelay.service;

import com.example.operatorrelay.model.PresenceState;
import com.example.operatorrelay.model.PresenceTransition;
import com.example.operatorrelay.util.RedisUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * 运营者在线状态服务
 * 所有状态读写都在同一把锁内完成，consumeTransition对并发的用户消息线性一致，一次切换至多被一条消息看到
 * Redis写入在锁内按顺序提交给单线程写入器，锁外执行
 */
@Service
public class PresenceService {

    private static final Logger logger = LoggerFactory.getLogger(PresenceService.class);

    // Redis键前缀
    private static final String REDIS_PREFIX = "relay:presence:";
    private static final String AVAILABLE_KEY = REDIS_PREFIX + "available";
    private static final String PENDING_KEY = REDIS_PREFIX + "pending";

    @Autowired(required = false)
    private RedisUtil redisUtil;

    private final PresenceState state = new PresenceState();

    // 单线程保证写入顺序与状态修改顺序一致
    private final ExecutorService writer =
            Executors.newSingleThreadExecutor(new CustomizableThreadFactory("presence-writer-"));

    /**
     * 启动时从Redis恢复状态
     */
    @PostConstruct
    public void restore() {
        if (redisUtil == null) {
            logger.info("Redis未配置，运营者状态仅保存在本地内存");
            return;
        }
        Boolean available = redisUtil.get(AVAILABLE_KEY, Boolean.class);
        String pending = redisUtil.get(PENDING_KEY, String.class);
        PresenceTransition transition = null;
        if (pending != null) {
            try {
                transition = PresenceTransition.valueOf(pending);
            } catch (IllegalArgumentException e) {
                logger.warn("忽略无法识别的待提示状态: {}", pending);
            }
        }
        synchronized (this) {
            if (available != null) {
                state.setAvailable(available);
            }
            if (transition != null) {
                state.setPendingTransition(transition);
            }
            logger.info("运营者状态已恢复: {}", state);
        }
    }

    @PreDestroy
    public void shutdown() {
        writer.shutdown();
    }

    /**
     * 运营者上线
     */
    public synchronized void setAvailable() {
        state.setAvailable(true);
        state.setPendingTransition(PresenceTransition.BECAME_AVAILABLE);
        persist();
        logger.info("运营者状态切换为可用");
    }

    /**
     * 运营者离开
     */
    public synchronized void setAway() {
        state.setAvailable(false);
        state.setPendingTransition(PresenceTransition.BECAME_AWAY);
        persist();
        logger.info("运营者状态切换为离开");
    }

    /**
     * 取出并清除待展示的状态切换提示
     * @return 切换提示，没有时返回NONE
     */
    public synchronized PresenceTransition consumeTransition() {
        PresenceTransition transition = state.getPendingTransition();
        if (transition == PresenceTransition.NONE) {
            return transition;
        }
        state.setPendingTransition(PresenceTransition.NONE);
        persist();
        logger.debug("状态切换提示 {} 已被消费", transition);
        return transition;
    }

    public synchronized boolean isAvailable() {
        return state.isAvailable();
    }

    /**
     * 当前状态的副本
     */
    public synchronized PresenceState snapshot() {
        return new PresenceState(state.isAvailable(), state.getPendingTransition());
    }

    // 调用方持有锁
    private void persist() {
        if (redisUtil == null) {
            return;
        }
        boolean available = state.isAvailable();
        String pending = state.getPendingTransition().name();
        try {
            writer.execute(() -> {
                boolean saved = redisUtil.set(AVAILABLE_KEY, available)
                        & redisUtil.set(PENDING_KEY, pending);
                if (!saved) {
                    logger.warn("运营者状态写入Redis失败，仅保存在本地内存");
                }
            });
        } catch (RejectedExecutionException e) {
            logger.warn("运营者状态写入器已关闭，状态仅保存在本地内存");
        }
    }
}
