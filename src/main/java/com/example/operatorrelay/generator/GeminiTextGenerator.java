package com.example.operatorrelay.generator;

import com.example.operatorrelay.exception.TextGenerationException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import javax.annotation.PostConstruct;
import java.util.Collections;
import java.util.Map;

/**
 * 调用Gemini generateContent接口的文本生成实现
 */
@Component
public class GeminiTextGenerator implements TextGenerator {

    private static final Logger logger = LoggerFactory.getLogger(GeminiTextGenerator.class);

    @Value("${relay.generator.api-key:}")
    private String apiKey;

    @Value("${relay.generator.model:gemini-2.0-flash}")
    private String model = "gemini-2.0-flash";

    @Value("${relay.generator.base-url:https://generativelanguage.googleapis.com/v1beta}")
    private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";

    // 请求超时时间（毫秒）
    @Value("${relay.generator.timeout:10000}")
    private int timeout = 10000;

    // REST客户端
    private final RestTemplate restTemplate;

    public GeminiTextGenerator() {
        this.restTemplate = new RestTemplate();
    }

    GeminiTextGenerator(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * Spring初始化完成后设置超时时间
     */
    @PostConstruct
    public void init() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);
        restTemplate.setRequestFactory(requestFactory);
        if (!isConfigured()) {
            logger.warn("未配置relay.generator.api-key，欢迎语将使用默认文本");
        }
    }

    @Override
    public String complete(String prompt) {
        if (!isConfigured()) {
            throw new TextGenerationException("文本生成服务未配置");
        }

        String url = baseUrl + "/models/" + model + ":generateContent";
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("x-goog-api-key", apiKey);
        Map<String, Object> body = Collections.singletonMap("contents",
                Collections.singletonList(Collections.singletonMap("parts",
                        Collections.singletonList(Collections.singletonMap("text", prompt)))));

        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), JsonNode.class);
        } catch (RestClientException e) {
            throw new TextGenerationException("调用文本生成接口失败", e);
        }

        JsonNode root = response.getBody();
        if (!response.getStatusCode().is2xxSuccessful() || root == null) {
            throw new TextGenerationException("文本生成接口返回异常: " + response.getStatusCode());
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode part : root.path("candidates").path(0).path("content").path("parts")) {
            text.append(part.path("text").asText(""));
        }
        logger.debug("文本生成完成，长度: {}", text.length());
        return text.toString().trim();
    }

    private boolean isConfigured() {
        return apiKey != null && !apiKey.trim().isEmpty();
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }
}
