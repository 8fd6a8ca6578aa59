package com.example.operatorrelay.controller;

import com.example.operatorrelay.manager.WebSocketConnectionManager;
import com.example.operatorrelay.model.PresenceState;
import com.example.operatorrelay.service.ConversationService;
import com.example.operatorrelay.service.CorrelationService;
import com.example.operatorrelay.service.PresenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * 存活探测与运行状态查询
 */
@RestController
public class RelayStatusController {

    private static final Logger logger = LoggerFactory.getLogger(RelayStatusController.class);

    public static final String ALIVE_TEXT = "Bot is alive and running!";

    @Autowired
    private PresenceService presenceService;

    @Autowired
    private CorrelationService correlationService;

    @Autowired
    private ConversationService conversationService;

    @Autowired
    private WebSocketConnectionManager connectionManager;

    @Value("${relay.operator-id:operator}")
    private String operatorId = "operator";

    /**
     * 存活探测，供托管平台保活使用
     */
    @GetMapping("/")
    public String alive() {
        return ALIVE_TEXT;
    }

    /**
     * 运营者状态及本地计数
     */
    @GetMapping("/api/relay/status")
    public Map<String, Object> status() {
        Map<String, Object> result = new HashMap<>();
        try {
            PresenceState presence = presenceService.snapshot();
            result.put("status", "success");
            result.put("available", presence.isAvailable());
            result.put("pendingTransition", presence.getPendingTransition());
            result.put("operatorConnected", connectionManager.isOnline(operatorId));
            result.put("onlineCount", connectionManager.getOnlineCount());
            result.put("conversations", conversationService.getConversationCount());
            result.put("relayRecords", correlationService.size());
        } catch (Exception e) {
            logger.error("获取运行状态失败", e);
            result.put("status", "error");
            result.put("message", "获取运行状态失败: " + e.getMessage());
        }
        return result;
    }
}
