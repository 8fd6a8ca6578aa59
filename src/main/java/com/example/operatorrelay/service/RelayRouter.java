package com.example.operatorrelay.service;

import com.example.operatorrelay.exception.CorrelationNotFoundException;
import com.example.operatorrelay.exception.DuplicateCorrelationException;
import com.example.operatorrelay.exception.TransportException;
import com.example.operatorrelay.model.PresenceTransition;
import com.example.operatorrelay.model.RelayMessage;
import com.example.operatorrelay.transport.RelayTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * 转发路由服务，负责用户消息转发给运营者、运营者回复路由回原会话，以及运营者状态命令
 *
 * <p>用户侧的任何失败都不会向上抛出：每条分支要么给用户回复，要么只记录日志。
 * 只有运营者会收到失败提示（找不到来源会话、投递失败）。
 */
@Service
public class RelayRouter {

    private static final Logger logger = LoggerFactory.getLogger(RelayRouter.class);

    // 命令
    public static final String COMMAND_AVAILABLE = "available";
    public static final String COMMAND_AWAY = "away";
    public static final String COMMAND_START = "start";

    // 用户侧提示
    public static final String SENT_ACK = "Message sent ✅";
    public static final String AVAILABLE_NOTICE = "🟢 Admin available.";

    // 运营者侧提示
    public static final String OPERATOR_AVAILABLE_CONFIRM = "🟢 Admin is now available.";
    public static final String OPERATOR_AWAY_CONFIRM = "🔴 Admin is now away.";
    public static final String ORIGIN_NOT_FOUND = "❌ User not found.";
    public static final String DELIVERY_FAILED = "❌ Failed to send.";

    // 参与分类和生成欢迎语的最大文本长度，转发副本保留全文
    public static final int MAX_TEXT_LENGTH = 500;

    @Autowired
    private RateLimiter rateLimiter;

    @Autowired
    private PresenceService presenceService;

    @Autowired
    private CorrelationService correlationService;

    @Autowired
    private EngagementTracker engagementTracker;

    @Autowired
    private ConversationService conversationService;

    @Autowired
    private GreetingService greetingService;

    @Autowired
    private EphemeralNoticeService ephemeralNoticeService;

    @Autowired
    private RelayTransport transport;

    // 运营者身份
    @Value("${relay.operator-id:operator}")
    private String operatorId = "operator";

    // 忙碌提示中承诺的回复时限（小时）
    @Value("${relay.reply-window-hours:48}")
    private int replyWindowHours = 48;

    @Value("${relay.notice.typing-delay-ms:600}")
    private long typingDelayMillis = 600;

    @Value("${relay.notice.ack-delay-ms:3000}")
    private long ackDelayMillis = 3000;

    /**
     * 入站消息入口，按命令、运营者消息、用户消息分类处理
     * @param message 已由传输层填好senderId的消息
     * @param displayName 发送者显示名称，可为null
     */
    public void onInbound(RelayMessage message, String displayName) {
        String senderId = message.getSenderId();
        try {
            // 运营者的回复即使以"/"开头也按回复投递
            if (isOperator(senderId) && message.isReply()) {
                handleOperatorReply(message);
            } else if (message.isCommand()) {
                handleCommand(message, displayName);
            } else if (isOperator(senderId)) {
                handleOperatorReply(message);
            } else {
                handleUserMessage(message, displayName);
            }
        } catch (Exception e) {
            logger.error("处理入站消息失败，发送者: {}", senderId, e);
        }
    }

    /**
     * 处理普通用户消息
     */
    public void handleUserMessage(RelayMessage message, String displayName) {
        String conversationId = message.getSenderId();
        if (isOperator(conversationId)) {
            return;
        }
        if (isBlank(message.getContent()) && !message.hasMedia()) {
            logger.debug("忽略会话 {} 的空消息", conversationId);
            return;
        }

        // 频率限制必须先于任何输出
        if (!rateLimiter.allow(conversationId, System.currentTimeMillis())) {
            return;
        }
        rememberDisplayName(conversationId, displayName);

        String text = truncate(message.getContent());
        if (!message.hasMedia() && greetingService.isGreeting(text)) {
            replyWithGreeting(conversationId, displayName, text);
            return;
        }

        message.setForwardedFromName(displayName);
        relayToOperator(message, conversationId);

        ephemeralNoticeService.showTyping(conversationId, typingDelayMillis);

        PresenceTransition transition = presenceService.consumeTransition();
        if (transition == PresenceTransition.BECAME_AVAILABLE) {
            sendQuietly(conversationId, AVAILABLE_NOTICE);
            return;
        }
        if (transition == PresenceTransition.BECAME_AWAY) {
            sendQuietly(conversationId, busyNotice());
            return;
        }

        if (presenceService.isAvailable()) {
            ephemeralNoticeService.showEphemeralAsync(conversationId, SENT_ACK, ackDelayMillis);
            return;
        }

        if (engagementTracker.markAndCheckFirstContact(conversationId)) {
            sendQuietly(conversationId, busyNotice());
        } else {
            ephemeralNoticeService.showEphemeralAsync(conversationId, SENT_ACK, ackDelayMillis);
        }
    }

    /**
     * 处理运营者对转发副本的回复
     */
    public void handleOperatorReply(RelayMessage message) {
        if (!isOperator(message.getSenderId())) {
            return;
        }
        if (!message.isReply()) {
            logger.debug("运营者消息不是回复，忽略");
            return;
        }

        String origin;
        try {
            origin = correlationService.resolve(message.getReplyToMessageId());
        } catch (CorrelationNotFoundException e) {
            logger.info("运营者回复的消息 {} 没有对应的来源会话", e.getRelayedMessageId());
            sendQuietly(operatorId, ORIGIN_NOT_FOUND);
            return;
        }

        try {
            if (message.hasMedia()) {
                transport.sendMedia(origin, message.getMedia(), message.getContent());
            } else if (!isBlank(message.getContent())) {
                transport.sendText(origin, message.getContent());
            } else {
                logger.debug("运营者回复内容为空，忽略");
                return;
            }
        } catch (TransportException e) {
            logger.warn("运营者回复投递到会话 {} 失败: {}", origin, e.getMessage());
            sendQuietly(operatorId, DELIVERY_FAILED);
            return;
        }

        logger.info("运营者回复已投递到会话 {}", origin);
        ephemeralNoticeService.showEphemeralAsync(operatorId, SENT_ACK, ackDelayMillis);
    }

    /**
     * 处理命令；状态命令仅限运营者，其他人调用时静默忽略
     */
    public void handleCommand(RelayMessage message, String displayName) {
        String senderId = message.getSenderId();
        String command = message.getCommandName();
        if (command == null) {
            return;
        }

        switch (command) {
            case COMMAND_AVAILABLE:
                if (!isOperator(senderId)) {
                    logger.info("非运营者 {} 尝试执行 /{}，已忽略", senderId, command);
                    return;
                }
                presenceService.setAvailable();
                sendQuietly(senderId, OPERATOR_AVAILABLE_CONFIRM);
                break;
            case COMMAND_AWAY:
                if (!isOperator(senderId)) {
                    logger.info("非运营者 {} 尝试执行 /{}，已忽略", senderId, command);
                    return;
                }
                presenceService.setAway();
                sendQuietly(senderId, OPERATOR_AWAY_CONFIRM);
                break;
            case COMMAND_START:
                if (!isOperator(senderId) && !rateLimiter.allow(senderId, System.currentTimeMillis())) {
                    return;
                }
                replyWithGreeting(senderId, displayName, null);
                break;
            default:
                logger.debug("忽略未知命令 /{}，发送者: {}", command, senderId);
                break;
        }
    }

    public boolean isOperator(String senderId) {
        return operatorId != null && operatorId.equals(senderId);
    }

    /**
     * 运营者离开时展示给用户的提示
     */
    public String busyNotice() {
        return "🔴 Admin busy.\nMessage sent ✅\n⏳ Reply within " + replyWindowHours + " hours.";
    }

    private void relayToOperator(RelayMessage message, String conversationId) {
        String relayedMessageId;
        try {
            relayedMessageId = transport.forward(operatorId, message);
        } catch (TransportException e) {
            logger.warn("转发会话 {} 的消息给运营者失败: {}", conversationId, e.getMessage());
            return;
        }
        try {
            correlationService.record(relayedMessageId, conversationId);
        } catch (DuplicateCorrelationException e) {
            logger.error("转发消息ID重复，传输层分配的ID不唯一: {}", relayedMessageId, e);
        }
    }

    private void replyWithGreeting(String conversationId, String displayName, String text) {
        String greeting = greetingService.composeWelcome(displayName, text);
        sendQuietly(conversationId, greeting);
    }

    private void rememberDisplayName(String conversationId, String displayName) {
        if (isBlank(displayName)) {
            return;
        }
        conversationService.updateConversation(conversationId, conversation -> {
            conversation.setDisplayName(displayName);
            return null;
        });
    }

    private void sendQuietly(String destinationId, String text) {
        try {
            transport.sendText(destinationId, text);
        } catch (TransportException e) {
            logger.warn("发送消息给 {} 失败: {}", destinationId, e.getMessage());
        }
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= MAX_TEXT_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_TEXT_LENGTH);
    }

    private static boolean isBlank(String text) {
        return text == null || text.trim().isEmpty();
    }

    public String getOperatorId() {
        return operatorId;
    }

    public void setOperatorId(String operatorId) {
        this.operatorId = operatorId;
    }

    public void setTypingDelayMillis(long typingDelayMillis) {
        this.typingDelayMillis = typingDelayMillis;
    }

    public void setAckDelayMillis(long ackDelayMillis) {
        this.ackDelayMillis = ackDelayMillis;
    }
}
