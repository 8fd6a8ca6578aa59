package com.example.operatorrelay.manager;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 单实例的WebSocket连接管理器
 */
@Component
public class DefaultWebSocketConnectionManager implements WebSocketConnectionManager {

    private static final Logger logger = LoggerFactory.getLogger(DefaultWebSocketConnectionManager.class);

    // 本地连接缓存
    private final Map<String, Channel> localConnections = new ConcurrentHashMap<>();

    @Override
    public void addConnection(String userId, Channel channel) {
        Channel previous = localConnections.put(userId, channel);
        if (previous != null && previous != channel) {
            logger.info("用户 {} 建立了新连接，关闭旧连接 {}", userId, previous.remoteAddress());
            previous.close();
        }
        logger.info("用户 {} 已连接，当前在线 {} 人", userId, localConnections.size());
    }

    @Override
    public String removeConnection(Channel channel) {
        for (Map.Entry<String, Channel> entry : localConnections.entrySet()) {
            if (entry.getValue().equals(channel)) {
                String userId = entry.getKey();
                // 只移除与该通道对应的登记，避免误删重连后的新连接
                if (localConnections.remove(userId, channel)) {
                    logger.info("用户 {} 已断开连接", userId);
                    return userId;
                }
            }
        }
        return null;
    }

    @Override
    public boolean isOnline(String userId) {
        Channel channel = localConnections.get(userId);
        return channel != null && channel.isActive();
    }

    @Override
    public boolean sendMessage(String userId, String message) {
        Channel channel = localConnections.get(userId);
        if (channel == null || !channel.isActive()) {
            logger.debug("用户 {} 不在线，消息未发送", userId);
            return false;
        }
        channel.writeAndFlush(new TextWebSocketFrame(message))
                .addListener((ChannelFutureListener) future -> {
                    if (!future.isSuccess()) {
                        logger.warn("向用户 {} 写出消息失败", userId, future.cause());
                    }
                });
        return true;
    }

    @Override
    public int getOnlineCount() {
        return localConnections.size();
    }
}
