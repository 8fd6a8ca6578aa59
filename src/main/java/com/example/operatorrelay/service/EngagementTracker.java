package com.example.operatorrelay.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 记录会话是否已经看过首次忙碌提示
 */
@Component
public class EngagementTracker {

    @Autowired
    private ConversationService conversationService;

    /**
     * 首次调用返回true并置位，之后始终返回false
     * @param conversationId 会话ID
     */
    public boolean markAndCheckFirstContact(String conversationId) {
        return conversationService.updateConversation(conversationId, conversation -> {
            if (conversation.isFirstContactShown()) {
                return false;
            }
            conversation.setFirstContactShown(true);
            return true;
        });
    }
}
