package com.example.operatorrelay.handler;

import com.example.operatorrelay.manager.WebSocketConnectionManager;
import com.example.operatorrelay.model.RelayMessage;
import com.example.operatorrelay.security.TokenService;
import com.example.operatorrelay.service.ConversationDispatcher;
import com.example.operatorrelay.service.RelayRouter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshakerFactory;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.util.CharsetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;

/**
 * WebSocket消息处理器
 * 每个连接一个实例，保存该连接的用户身份
 * 握手和帧解析在业务线程组上执行，消息路由交给ConversationDispatcher按会话串行执行
 */
public class WebSocketHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketHandler.class);

    public static final String WEBSOCKET_PATH = "/websocket";

    private WebSocketServerHandshaker handshaker;

    private WebSocketConnectionManager connectionManager;

    private ObjectMapper objectMapper;

    private TokenService tokenService;

    private RelayRouter relayRouter;

    private ConversationDispatcher dispatcher;

    // 空闲超时时间（秒）
    private int idleTimeout;

    private int maxFramePayloadLength = 65536;

    // 存储当前连接的用户ID
    private String userId;

    // 用户显示名称
    private String displayName;

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        logger.info("客户端连接成功: {}", ctx.channel().remoteAddress());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        logger.info("客户端断开连接: {}", ctx.channel().remoteAddress());
        connectionManager.removeConnection(ctx.channel());
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) throws Exception {
        // 处理HTTP请求，WebSocket握手
        if (msg instanceof FullHttpRequest) {
            handleHttpRequest(ctx, (FullHttpRequest) msg);
        }
        // 处理WebSocket消息
        else if (msg instanceof WebSocketFrame) {
            handleWebSocketFrame(ctx, (WebSocketFrame) msg);
        }
    }

    /**
     * 处理HTTP请求，校验token后完成WebSocket握手
     */
    private void handleHttpRequest(ChannelHandlerContext ctx, FullHttpRequest req) {
        // 要求GET方法
        if (!HttpMethod.GET.equals(req.method())) {
            sendHttpResponse(ctx, new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.FORBIDDEN));
            return;
        }

        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        if (!WEBSOCKET_PATH.equals(decoder.path())) {
            sendHttpResponse(ctx, new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.NOT_FOUND));
            return;
        }

        // 从请求参数中获取token，没有时尝试从请求头获取
        String token = firstParameter(decoder, "token");
        if (token == null) {
            token = req.headers().get(HttpHeaderNames.AUTHORIZATION);
            if (token != null && token.startsWith("Bearer ")) {
                token = token.substring(7);
            }
        }

        String resolvedUserId = tokenService.getUserIdByToken(token);
        if (resolvedUserId == null) {
            logger.warn("WebSocket连接token验证失败: {}", ctx.channel().remoteAddress());
            DefaultFullHttpResponse response = new DefaultFullHttpResponse(
                    HttpVersion.HTTP_1_1, HttpResponseStatus.UNAUTHORIZED);
            response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain");
            response.content().writeBytes("Unauthorized: Invalid token".getBytes(CharsetUtil.UTF_8));
            sendHttpResponse(ctx, response);
            return;
        }

        WebSocketServerHandshakerFactory factory = new WebSocketServerHandshakerFactory(
                getWebSocketLocation(req), null, true, maxFramePayloadLength);
        handshaker = factory.newHandshaker(req);
        if (handshaker == null) {
            WebSocketServerHandshakerFactory.sendUnsupportedVersionResponse(ctx.channel());
            return;
        }

        handshaker.handshake(ctx.channel(), req);
        this.userId = resolvedUserId;
        this.displayName = firstParameter(decoder, "name");

        // 握手成功后，将连接添加到管理器
        connectionManager.addConnection(userId, ctx.channel());

        boolean operator = relayRouter.isOperator(userId);
        sendFrame(ctx, new RelayMessage(RelayMessage.TYPE_SYSTEM,
                operator ? "Connected as operator" : "Connected", "server", userId));
        logger.info("用户 {} WebSocket连接成功，运营者 = {}", userId, operator);
    }

    /**
     * 处理WebSocket帧消息
     */
    private void handleWebSocketFrame(ChannelHandlerContext ctx, WebSocketFrame frame) {
        // 关闭帧
        if (frame instanceof CloseWebSocketFrame) {
            logger.info("用户 {} 请求关闭连接", userId);
            handshaker.close(ctx.channel(), (CloseWebSocketFrame) frame.retain());
            return;
        }

        // Ping帧
        if (frame instanceof PingWebSocketFrame) {
            ctx.channel().writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
            return;
        }

        // 文本帧
        if (frame instanceof TextWebSocketFrame) {
            String text = ((TextWebSocketFrame) frame).text();
            logger.debug("收到用户 {} 的消息: {}", userId, text);

            RelayMessage message;
            try {
                message = objectMapper.readValue(text, RelayMessage.class);
            } catch (JsonProcessingException e) {
                logger.warn("用户 {} 的消息格式错误: {}", userId, e.getOriginalMessage());
                sendFrame(ctx, new RelayMessage(RelayMessage.TYPE_ERROR, "Malformed message", "server", userId));
                return;
            }

            if (message.getType() == null) {
                message.setType(RelayMessage.TYPE_CHAT);
            }
            if (!RelayMessage.TYPE_CHAT.equals(message.getType()) && !RelayMessage.TYPE_MEDIA.equals(message.getType())) {
                sendFrame(ctx, new RelayMessage(RelayMessage.TYPE_ERROR,
                        "Unsupported message type: " + message.getType(), "server", userId));
                return;
            }

            // 发送者身份以连接为准，忽略客户端自填的字段
            message.setSenderId(userId);
            message.setMessageId(UUID.randomUUID().toString());
            message.setForwardedFrom(null);
            String name = displayName;
            dispatcher.dispatch(userId, () -> relayRouter.onInbound(message, name));
            return;
        }

        if (frame instanceof BinaryWebSocketFrame) {
            logger.info("收到二进制消息，长度: {}，已忽略", frame.content().readableBytes());
        }
    }

    /**
     * 发送HTTP响应并关闭连接
     */
    private static void sendHttpResponse(ChannelHandlerContext ctx, DefaultFullHttpResponse res) {
        if (res.status().code() != 200 && res.content().readableBytes() == 0) {
            ByteBuf buf = Unpooled.copiedBuffer(res.status().toString(), CharsetUtil.UTF_8);
            res.content().writeBytes(buf);
            buf.release();
        }
        ctx.channel().writeAndFlush(res).addListener(ChannelFutureListener.CLOSE);
    }

    /**
     * 获取WebSocket地址
     */
    private static String getWebSocketLocation(FullHttpRequest req) {
        return "ws://" + req.headers().get(HttpHeaderNames.HOST) + WEBSOCKET_PATH;
    }

    private static String firstParameter(QueryStringDecoder decoder, String name) {
        List<String> values = decoder.parameters().get(name);
        if (values == null || values.isEmpty() || values.get(0).isEmpty()) {
            return null;
        }
        return values.get(0);
    }

    private void sendFrame(ChannelHandlerContext ctx, RelayMessage message) {
        try {
            ctx.channel().writeAndFlush(new TextWebSocketFrame(objectMapper.writeValueAsString(message)));
        } catch (JsonProcessingException e) {
            logger.error("序列化系统消息失败", e);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
        logger.error("WebSocket异常，用户: {}", userId, cause);
        ctx.close();
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent && ((IdleStateEvent) evt).state() == IdleState.READER_IDLE) {
            // 读空闲超时，关闭连接
            logger.info("用户 {} WebSocket连接空闲超时（{}秒），自动断开连接", userId, idleTimeout);
            ctx.close();
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    // Setter方法，用于手动注入依赖
    public void setConnectionManager(WebSocketConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    public void setObjectMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void setTokenService(TokenService tokenService) {
        this.tokenService = tokenService;
    }

    public void setRelayRouter(RelayRouter relayRouter) {
        this.relayRouter = relayRouter;
    }

    public void setDispatcher(ConversationDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public void setIdleTimeout(int idleTimeout) {
        this.idleTimeout = idleTimeout;
    }

    public void setMaxFramePayloadLength(int maxFramePayloadLength) {
        this.maxFramePayloadLength = maxFramePayloadLength;
    }
}
