package com.example.operatorrelay.controller;

import com.example.operatorrelay.handler.WebSocketHandler;
import com.example.operatorrelay.security.TokenService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 匿名用户token发放控制器
 * 用户先获取token，再携带token连接WebSocket
 */
@RestController
@RequestMapping("/api/tokens")
public class TokenController {

    private static final Logger logger = LoggerFactory.getLogger(TokenController.class);

    @Autowired
    private TokenService tokenService;

    @Value("${netty.websocket.port:8081}")
    private int websocketPort;

    /**
     * 为新会话签发token
     * @param name 可选的显示名称，会拼接到连接地址中
     * @return 会话ID、token和WebSocket连接地址
     */
    @PostMapping
    public Map<String, String> issueToken(@RequestParam(required = false) String name) {
        Map<String, String> result = new HashMap<>();

        String conversationId = "user_" + UUID.randomUUID().toString().replace("-", "");
        String token;
        try {
            token = tokenService.issueToken(conversationId);
        } catch (IllegalArgumentException e) {
            result.put("status", "error");
            result.put("message", e.getMessage());
            return result;
        }

        UriComponentsBuilder url = UriComponentsBuilder.newInstance()
                .scheme("ws")
                .host("localhost")
                .port(websocketPort)
                .path(WebSocketHandler.WEBSOCKET_PATH)
                .queryParam("token", token);
        if (name != null && !name.trim().isEmpty()) {
            url.queryParam("name", name.trim());
        }

        result.put("status", "success");
        result.put("conversationId", conversationId);
        result.put("token", token);
        result.put("websocketUrl", url.encode().toUriString());

        logger.info("签发会话token: conversationId={}", conversationId);
        return result;
    }

    /**
     * 作废token
     */
    @DeleteMapping
    public Map<String, String> removeToken(@RequestParam String token) {
        Map<String, String> result = new HashMap<>();

        if (token.isEmpty()) {
            result.put("status", "error");
            result.put("message", "token不能为空");
            return result;
        }

        tokenService.removeToken(token);
        result.put("status", "success");
        result.put("message", "token已作废");
        return result;
    }
}
