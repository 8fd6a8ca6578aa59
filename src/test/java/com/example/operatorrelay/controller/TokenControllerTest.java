package com.example.operatorrelay.controller;

import com.example.operatorrelay.security.TokenService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * TokenController测试类
 */
@ExtendWith(MockitoExtension.class)
class TokenControllerTest {

    @Mock
    private TokenService tokenService;

    @InjectMocks
    private TokenController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(controller, "websocketPort", 8081);
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void testIssueToken() throws Exception {
        when(tokenService.issueToken(anyString())).thenReturn("tok123");

        mockMvc.perform(post("/api/tokens").param("name", "Ali"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.token").value("tok123"))
                .andExpect(jsonPath("$.conversationId").value(startsWith("user_")))
                .andExpect(jsonPath("$.websocketUrl").value("ws://localhost:8081/websocket?token=tok123&name=Ali"));
    }

    @Test
    void testIssueTokenWithoutName() throws Exception {
        when(tokenService.issueToken(anyString())).thenReturn("tok456");

        mockMvc.perform(post("/api/tokens"))
                .andExpect(jsonPath("$.websocketUrl").value("ws://localhost:8081/websocket?token=tok456"));
    }

    @Test
    void testRemoveToken() throws Exception {
        mockMvc.perform(delete("/api/tokens").param("token", "tok123"))
                .andExpect(jsonPath("$.status").value("success"));

        verify(tokenService).removeToken("tok123");
    }
}
