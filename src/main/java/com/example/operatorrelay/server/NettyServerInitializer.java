package com.example.operatorrelay.server;

import com.example.operatorrelay.handler.WebSocketHandler;
import com.example.operatorrelay.manager.WebSocketConnectionManager;
import com.example.operatorrelay.security.TokenService;
import com.example.operatorrelay.service.ConversationDispatcher;
import com.example.operatorrelay.service.RelayRouter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.stream.ChunkedWriteHandler;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;

/**
 * Netty服务器初始化器，用于配置ChannelPipeline
 */
@Component
public class NettyServerInitializer extends ChannelInitializer<SocketChannel> {

    @Autowired
    private WebSocketConnectionManager connectionManager;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TokenService tokenService;

    @Autowired
    private RelayRouter relayRouter;

    @Autowired
    private ConversationDispatcher dispatcher;

    @Value("${netty.websocket.maxFramePayloadLength:65536}")
    private int maxFramePayloadLength;

    // 连接空闲超时时间（秒）
    @Value("${netty.websocket.idleTimeout:180}")
    private int idleTimeout;

    // 业务线程数，只执行握手鉴权和帧解析；转发、文本生成和提示等待在relayWorkers上执行
    @Value("${netty.websocket.businessThreads:16}")
    private int businessThreads;

    private EventExecutorGroup businessGroup;

    @PostConstruct
    public void init() {
        businessGroup = new DefaultEventExecutorGroup(businessThreads);
    }

    @PreDestroy
    public void destroy() {
        if (businessGroup != null) {
            businessGroup.shutdownGracefully();
        }
    }

    @Override
    protected void initChannel(SocketChannel ch) throws Exception {
        ChannelPipeline pipeline = ch.pipeline();

        // 读空闲超时
        pipeline.addLast(new IdleStateHandler(idleTimeout, 0, 0));
        // HTTP编解码器
        pipeline.addLast(new HttpServerCodec());
        // 块写入处理器
        pipeline.addLast(new ChunkedWriteHandler());
        // HTTP对象聚合器，将HTTP消息的多个部分合并成一个完整的HTTP消息
        pipeline.addLast(new HttpObjectAggregator(65536));

        // 为每个连接创建新的WebSocketHandler实例
        // 因为WebSocketHandler包含每个连接的状态，不能共享同一个实例
        WebSocketHandler webSocketHandler = new WebSocketHandler();
        webSocketHandler.setConnectionManager(connectionManager);
        webSocketHandler.setObjectMapper(objectMapper);
        webSocketHandler.setTokenService(tokenService);
        webSocketHandler.setRelayRouter(relayRouter);
        webSocketHandler.setDispatcher(dispatcher);
        webSocketHandler.setIdleTimeout(idleTimeout);
        webSocketHandler.setMaxFramePayloadLength(maxFramePayloadLength);

        // token校验可能访问Redis，不放在IO线程上
        pipeline.addLast(businessGroup, webSocketHandler);
    }
}
