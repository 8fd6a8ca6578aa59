package com.example.operatorrelay.service;

import com.example.operatorrelay.generator.TextGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 欢迎语服务：识别问候语，调用文本生成服务生成欢迎语，失败时使用固定文本
 */
@Service
public class GreetingService {

    private static final Logger logger = LoggerFactory.getLogger(GreetingService.class);

    public static final String FALLBACK_REPLY = "Message sent ✅";

    public static final String DEFAULT_NAME = "Friend";

    // 问候语词表
    private static final Set<String> GREETINGS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "hi", "hello", "hey", "hlo", "hola", "namaste", "salam", "assalamualaikum")));

    // 孟加拉文字符区间
    private static final Pattern BENGALI = Pattern.compile("[\\u0980-\\u09FF]");

    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\p{Punct}\\s]+$");

    @Autowired
    private TextGenerator textGenerator;

    /**
     * 整条消息是否为问候语，忽略大小写和结尾标点
     * @param text 消息文本
     */
    public boolean isGreeting(String text) {
        if (text == null) {
            return false;
        }
        String normalized = TRAILING_PUNCTUATION.matcher(text.trim()).replaceAll("").toLowerCase(Locale.ROOT);
        return GREETINGS.contains(normalized);
    }

    /**
     * 检测消息语言
     * @return bengali 或 english
     */
    public String detectLanguage(String text) {
        if (text != null && BENGALI.matcher(text).find()) {
            return "bengali";
        }
        return "english";
    }

    /**
     * 生成欢迎语，不会抛出异常
     * @param displayName 用户显示名称，可为空
     * @param text 触发欢迎语的消息文本，可为空
     */
    public String composeWelcome(String displayName, String text) {
        String name = displayName == null || displayName.trim().isEmpty() ? DEFAULT_NAME : displayName.trim();
        String prompt = buildPrompt(name, detectLanguage(text));
        try {
            String reply = textGenerator.complete(prompt);
            if (reply == null || reply.trim().isEmpty()) {
                logger.warn("文本生成结果为空，使用默认欢迎语");
                return FALLBACK_REPLY;
            }
            return reply.trim();
        } catch (Exception e) {
            logger.warn("生成欢迎语失败，使用默认欢迎语: {}", e.getMessage());
            return FALLBACK_REPLY;
        }
    }

    String buildPrompt(String name, String language) {
        return "Make a short friendly welcome message.\n"
                + "Include user's name: " + name + "\n"
                + "Language: " + language + "\n"
                + "Very short (1-2 lines).\n"
                + "Simple Bengali + English mix.\n"
                + "No emojis at start.\n"
                + "Max one emoji at end.\n";
    }
}
