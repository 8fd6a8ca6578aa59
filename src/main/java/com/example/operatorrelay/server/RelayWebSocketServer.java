package com.example.operatorrelay.server;

import com.example.operatorrelay.handler.WebSocketHandler;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;

/**
 * 转发服务的WebSocket服务器，用户和运营者都通过它连接
 * 随Spring容器启动和关闭，端口绑定失败时应用启动失败
 */
@Component
public class RelayWebSocketServer {

    private static final Logger logger = LoggerFactory.getLogger(RelayWebSocketServer.class);

    @Value("${netty.websocket.port:8081}")
    private int port;

    @Value("${netty.websocket.bossGroupThreads:1}")
    private int bossGroupThreads;

    @Value("${netty.websocket.workerGroupThreads:8}")
    private int workerGroupThreads;

    @Value("${netty.websocket.backlog:128}")
    private int backlog;

    @Autowired
    private NettyServerInitializer serverInitializer;

    // 接收连接
    private EventLoopGroup bossGroup;

    // 连接的IO读写，业务处理不在这里执行
    private EventLoopGroup workerGroup;

    private Channel serverChannel;

    @PostConstruct
    public void start() {
        bossGroup = new NioEventLoopGroup(bossGroupThreads);
        workerGroup = new NioEventLoopGroup(workerGroupThreads);

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, backlog)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(serverInitializer);

        try {
            serverChannel = bootstrap.bind(port).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new IllegalStateException("启动WebSocket服务器被中断", e);
        } catch (Exception e) {
            stop();
            throw new IllegalStateException("WebSocket服务器绑定端口失败: " + port, e);
        }
        logger.info("WebSocket服务器已启动: ws://0.0.0.0:{}{}", port, WebSocketHandler.WEBSOCKET_PATH);
    }

    @PreDestroy
    public void stop() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
            serverChannel = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        logger.info("WebSocket服务器已关闭");
    }
}
