package com.example.operatorrelay.manager;

import io.netty.channel.Channel;

/**
 * WebSocket连接管理器接口
 */
public interface WebSocketConnectionManager {

    /**
     * 添加连接，同一用户的旧连接会被替换
     * @param userId 用户ID
     * @param channel WebSocket通道
     */
    void addConnection(String userId, Channel channel);

    /**
     * 移除连接
     * @param channel WebSocket通道
     * @return 该通道对应的用户ID，未登记时返回null
     */
    String removeConnection(Channel channel);

    /**
     * 判断用户是否在线
     * @param userId 用户ID
     * @return 是否在线
     */
    boolean isOnline(String userId);

    /**
     * 向指定用户发送消息
     * @param userId 用户ID
     * @param message 消息内容
     * @return 是否已写出，用户不在线时返回false
     */
    boolean sendMessage(String userId, String message);

    /**
     * 获取在线用户数量
     * @return 在线用户数量
     */
    int getOnlineCount();
}
