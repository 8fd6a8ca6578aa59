package com.example.operatorrelay.service;

import com.example.operatorrelay.exception.TransportException;
import com.example.operatorrelay.model.MediaAttachment;
import com.example.operatorrelay.model.PresenceTransition;
import com.example.operatorrelay.model.RelayMessage;
import com.example.operatorrelay.transport.RelayTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * RelayRouter测试类
 * 运营者状态和转发关联使用本地内存实现，其余依赖使用mock
 */
@ExtendWith(MockitoExtension.class)
class RelayRouterTest {

    private static final String OPERATOR = "operator";

    @Mock
    private RelayTransport transport;

    @Mock
    private EphemeralNoticeService ephemeralNoticeService;

    @Mock
    private RateLimiter rateLimiter;

    @Mock
    private EngagementTracker engagementTracker;

    @Mock
    private ConversationService conversationService;

    @Mock
    private GreetingService greetingService;

    @Spy
    private PresenceService presenceService;

    @Spy
    private RedisCorrelationServiceImpl correlationService;

    @InjectMocks
    private RelayRouter relayRouter;

    @BeforeEach
    void setUp() {
        relayRouter.setOperatorId(OPERATOR);
    }

    private static RelayMessage text(String senderId, String content) {
        RelayMessage message = new RelayMessage(RelayMessage.TYPE_CHAT, content, senderId, null);
        message.setMessageId(UUID.randomUUID().toString());
        return message;
    }

    private static RelayMessage reply(String replyTo, String content) {
        RelayMessage message = text(OPERATOR, content);
        message.setReplyToMessageId(replyTo);
        return message;
    }

    private void allowAll() {
        when(rateLimiter.allow(anyString(), anyLong())).thenReturn(true);
    }

    @Test
    void testRateLimitedMessageProducesNoOutput() {
        when(rateLimiter.allow(eq("user_1"), anyLong())).thenReturn(true, false);
        when(transport.forward(eq(OPERATOR), any(RelayMessage.class))).thenReturn("fwd-1");

        relayRouter.onInbound(text("user_1", "first question"), "Ali");
        relayRouter.onInbound(text("user_1", "second question"), "Ali");

        // 第二条被频率限制，静默丢弃
        verify(transport, times(1)).forward(eq(OPERATOR), any(RelayMessage.class));
        verify(ephemeralNoticeService, times(1)).showTyping(eq("user_1"), anyLong());
        verify(greetingService, times(1)).isGreeting(anyString());
        assertEquals(1, correlationService.size());
    }

    @Test
    void testGreetingAnsweredWithoutForwarding() {
        allowAll();
        when(greetingService.isGreeting("Hello!")).thenReturn(true);
        when(greetingService.composeWelcome("Ali", "Hello!")).thenReturn("Welcome Ali 🙂");

        relayRouter.onInbound(text("user_1", "Hello!"), "Ali");

        verify(transport).sendText("user_1", "Welcome Ali 🙂");
        verify(transport, never()).forward(anyString(), any(RelayMessage.class));
        verifyNoInteractions(ephemeralNoticeService);
        assertEquals(0, correlationService.size());
    }

    @Test
    void testDisplayNameRemembered() {
        allowAll();
        when(greetingService.isGreeting("hi")).thenReturn(true);

        relayRouter.onInbound(text("user_1", "hi"), "Ali");

        verify(conversationService).updateConversation(eq("user_1"), any());
    }

    @Test
    void testForwardCarriesSenderNameAndRecordsCorrelation() {
        allowAll();
        when(transport.forward(eq(OPERATOR), any(RelayMessage.class))).thenReturn("fwd-1");

        relayRouter.onInbound(text("user_1", "is the shop open?"), "Ali");

        ArgumentCaptor<RelayMessage> captor = ArgumentCaptor.forClass(RelayMessage.class);
        verify(transport).forward(eq(OPERATOR), captor.capture());
        assertEquals("Ali", captor.getValue().getForwardedFromName());
        assertEquals("is the shop open?", captor.getValue().getContent());
        assertEquals("user_1", correlationService.resolve("fwd-1"));
    }

    @Test
    void testAwayFirstMessageGetsBusyNoticeThenAcks() {
        allowAll();
        when(transport.forward(eq(OPERATOR), any(RelayMessage.class))).thenReturn("fwd-1", "fwd-2");
        when(engagementTracker.markAndCheckFirstContact("user_1")).thenReturn(true, false);

        relayRouter.onInbound(text("user_1", "question one"), "Ali");
        relayRouter.onInbound(text("user_1", "question two"), "Ali");

        verify(transport, times(1)).sendText("user_1", relayRouter.busyNotice());
        verify(ephemeralNoticeService, times(1)).showEphemeralAsync(eq("user_1"), eq(RelayRouter.SENT_ACK), anyLong());
        verify(ephemeralNoticeService, times(2)).showTyping(eq("user_1"), anyLong());
    }

    @Test
    void testBusyNoticeForEachNewConversation() {
        allowAll();
        when(transport.forward(eq(OPERATOR), any(RelayMessage.class))).thenReturn("fwd-1", "fwd-2", "fwd-3");
        when(engagementTracker.markAndCheckFirstContact(anyString())).thenReturn(true);

        relayRouter.onInbound(text("user_1", "question"), "A");
        relayRouter.onInbound(text("user_2", "question"), "B");
        relayRouter.onInbound(text("user_3", "question"), "C");

        String busy = relayRouter.busyNotice();
        verify(transport).sendText("user_1", busy);
        verify(transport).sendText("user_2", busy);
        verify(transport).sendText("user_3", busy);
        assertEquals("user_2", correlationService.resolve("fwd-2"));
    }

    @Test
    void testAvailableTransitionNoticeShownOnce() {
        allowAll();
        when(transport.forward(eq(OPERATOR), any(RelayMessage.class))).thenReturn("fwd-1", "fwd-2");

        relayRouter.onInbound(text(OPERATOR, "/available"), null);
        relayRouter.onInbound(text("user_1", "question"), "A");
        relayRouter.onInbound(text("user_2", "question"), "B");

        verify(transport).sendText(OPERATOR, RelayRouter.OPERATOR_AVAILABLE_CONFIRM);
        verify(transport).sendText("user_1", RelayRouter.AVAILABLE_NOTICE);
        verify(transport, never()).sendText("user_2", RelayRouter.AVAILABLE_NOTICE);
        verify(ephemeralNoticeService).showEphemeralAsync(eq("user_2"), eq(RelayRouter.SENT_ACK), anyLong());
        verify(ephemeralNoticeService, never()).showEphemeralAsync(eq("user_1"), anyString(), anyLong());
        verifyNoInteractions(engagementTracker);
    }

    @Test
    void testAwayTransitionNoticeReplacesFirstContactNotice() {
        allowAll();
        when(transport.forward(eq(OPERATOR), any(RelayMessage.class))).thenReturn("fwd-1");

        relayRouter.onInbound(text(OPERATOR, "/away"), null);
        relayRouter.onInbound(text("user_1", "question"), "A");

        verify(transport).sendText(OPERATOR, RelayRouter.OPERATOR_AWAY_CONFIRM);
        verify(transport, times(1)).sendText("user_1", relayRouter.busyNotice());
        verify(engagementTracker, never()).markAndCheckFirstContact(anyString());
        assertEquals(PresenceTransition.NONE, presenceService.snapshot().getPendingTransition());
    }

    @Test
    void testNonOperatorCannotChangePresence() {
        relayRouter.onInbound(text("user_1", "/available"), "Ali");

        assertFalse(presenceService.isAvailable());
        assertEquals(PresenceTransition.NONE, presenceService.snapshot().getPendingTransition());
        verifyNoInteractions(transport);
    }

    @Test
    void testStartCommandSendsGreeting() {
        allowAll();
        when(greetingService.composeWelcome("Ali", null)).thenReturn("Welcome!");

        relayRouter.onInbound(text("user_1", "/start"), "Ali");

        verify(transport).sendText("user_1", "Welcome!");
        verify(transport, never()).forward(anyString(), any(RelayMessage.class));
    }

    @Test
    void testRepeatedStartCommandIsRateLimited() {
        when(rateLimiter.allow(eq("user_1"), anyLong())).thenReturn(true, false);
        when(greetingService.composeWelcome("Ali", null)).thenReturn("Welcome!");

        for (int i = 0; i < 5; i++) {
            relayRouter.onInbound(text("user_1", "/start"), "Ali");
        }

        verify(greetingService, times(1)).composeWelcome("Ali", null);
        verify(transport, times(1)).sendText("user_1", "Welcome!");
    }

    @Test
    void testOperatorStartCommandNotRateLimited() {
        when(greetingService.composeWelcome(null, null)).thenReturn("Welcome!");

        relayRouter.onInbound(text(OPERATOR, "/start"), null);
        relayRouter.onInbound(text(OPERATOR, "/start"), null);

        verify(transport, times(2)).sendText(OPERATOR, "Welcome!");
        verifyNoInteractions(rateLimiter);
    }

    @Test
    void testOperatorReplyDeliveredToOrigin() {
        correlationService.record("fwd-1", "user_1");

        relayRouter.onInbound(reply("fwd-1", "We open at 9"), null);

        verify(transport).sendText("user_1", "We open at 9");
        verify(ephemeralNoticeService).showEphemeralAsync(eq(OPERATOR), eq(RelayRouter.SENT_ACK), anyLong());
    }

    @Test
    void testOperatorMediaReplyDelivered() {
        correlationService.record("fwd-1", "user_1");
        RelayMessage message = reply("fwd-1", "menu");
        MediaAttachment media = new MediaAttachment("https://cdn.example.com/menu.jpg", "image/jpeg", "menu.jpg");
        message.setMedia(media);

        relayRouter.onInbound(message, null);

        verify(transport).sendMedia("user_1", media, "menu");
        verify(transport, never()).sendText(eq("user_1"), anyString());
    }

    @Test
    void testOperatorReplyToUnknownMessage() {
        relayRouter.onInbound(reply("unknown", "hello?"), null);

        verify(transport).sendText(OPERATOR, RelayRouter.ORIGIN_NOT_FOUND);
        verify(transport, times(1)).sendText(anyString(), anyString());
        verifyNoInteractions(ephemeralNoticeService);
    }

    @Test
    void testOperatorReplyDeliveryFailure() {
        correlationService.record("fwd-1", "user_1");
        when(transport.sendText("user_1", "We open at 9")).thenThrow(new TransportException("offline"));

        relayRouter.onInbound(reply("fwd-1", "We open at 9"), null);

        verify(transport).sendText(OPERATOR, RelayRouter.DELIVERY_FAILED);
        verifyNoInteractions(ephemeralNoticeService);
    }

    @Test
    void testOperatorMessageWithoutReplyIgnored() {
        relayRouter.onInbound(text(OPERATOR, "just chatting"), null);

        verifyNoInteractions(transport);
        verifyNoInteractions(ephemeralNoticeService);
    }

    @Test
    void testOperatorReplyStartingWithSlashDelivered() {
        correlationService.record("fwd-1", "user_1");

        relayRouter.onInbound(reply("fwd-1", "/start is the command you need"), null);

        verify(transport).sendText("user_1", "/start is the command you need");
        verifyNoInteractions(greetingService);
    }

    @Test
    void testForwardFailureDoesNotRecordOrThrow() {
        allowAll();
        when(transport.forward(eq(OPERATOR), any(RelayMessage.class))).thenThrow(new TransportException("operator offline"));

        assertDoesNotThrow(() -> relayRouter.onInbound(text("user_1", "question"), "Ali"));

        assertEquals(0, correlationService.size());
        verify(ephemeralNoticeService).showTyping(eq("user_1"), anyLong());
    }

    @Test
    void testMediaWithGreetingCaptionIsForwarded() {
        allowAll();
        when(transport.forward(eq(OPERATOR), any(RelayMessage.class))).thenReturn("fwd-1");
        RelayMessage message = new RelayMessage(RelayMessage.TYPE_MEDIA, "hi", "user_1", null);
        message.setMedia(new MediaAttachment("https://cdn.example.com/a.png", "image/png", "a.png"));

        relayRouter.onInbound(message, "Ali");

        verify(transport).forward(eq(OPERATOR), same(message));
        verifyNoInteractions(greetingService);
        assertEquals("user_1", correlationService.resolve("fwd-1"));
    }

    @Test
    void testBlankMessageIgnored() {
        relayRouter.onInbound(text("user_1", "   "), "Ali");

        verifyNoInteractions(transport);
        verifyNoInteractions(ephemeralNoticeService);
        verifyNoInteractions(rateLimiter);
    }

    @Test
    void testBusyNoticeText() {
        assertEquals("🔴 Admin busy.\nMessage sent ✅\n⏳ Reply within 48 hours.", relayRouter.busyNotice());
    }
}
