package com.example.operatorrelay.generator;

import com.example.operatorrelay.exception.TextGenerationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

/**
 * GeminiTextGenerator测试类
 */
class GeminiTextGeneratorTest {

    private static final String URL =
            "https://generativelanguage.googleapis.com/v1beta/models/gemini-2.0-flash:generateContent";

    private MockRestServiceServer server;

    private GeminiTextGenerator generator;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        generator = new GeminiTextGenerator(restTemplate);
        generator.setApiKey("test-key");
    }

    @Test
    void testCompleteConcatenatesParts() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("x-goog-api-key", "test-key"))
                .andExpect(jsonPath("$.contents[0].parts[0].text").value("say hi"))
                .andRespond(withSuccess("{\"candidates\":[{\"content\":{\"parts\":"
                        + "[{\"text\":\"Hello \"},{\"text\":\"Ali 🙂\\n\"}]}}]}", MediaType.APPLICATION_JSON));

        assertEquals("Hello Ali 🙂", generator.complete("say hi"));
        server.verify();
    }

    @Test
    void testEmptyCandidatesGiveEmptyText() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"candidates\":[]}", MediaType.APPLICATION_JSON));

        assertEquals("", generator.complete("say hi"));
    }

    @Test
    void testServerErrorWrapped() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThrows(TextGenerationException.class, () -> generator.complete("say hi"));
    }

    @Test
    void testNotConfiguredFailsWithoutRequest() {
        generator.setApiKey("");

        assertThrows(TextGenerationException.class, () -> generator.complete("say hi"));
        server.verify();
    }
}
