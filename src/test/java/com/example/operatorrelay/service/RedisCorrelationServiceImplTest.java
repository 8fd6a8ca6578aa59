package com.example.operatorrelay.service;

import com.example.operatorrelay.exception.CorrelationNotFoundException;
import com.example.operatorrelay.exception.DuplicateCorrelationException;
import com.example.operatorrelay.model.RelayRecord;
import com.example.operatorrelay.util.RedisUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * RedisCorrelationServiceImpl测试类
 * 未打桩的RedisUtil对写入返回null，相当于Redis不可用，只使用本地内存
 */
@ExtendWith(MockitoExtension.class)
class RedisCorrelationServiceImplTest {

    @Mock
    private RedisUtil redisUtil;

    @Spy
    private ObjectMapper objectMapper = new ObjectMapper();

    @InjectMocks
    private RedisCorrelationServiceImpl correlationService;

    @Test
    void testRecordAndResolve() {
        correlationService.record("m1", "user_1");
        correlationService.record("m2", "user_2");

        assertEquals("user_1", correlationService.resolve("m1"));
        assertEquals("user_2", correlationService.resolve("m2"));
        assertEquals(2, correlationService.size());
    }

    @Test
    void testDuplicateRecordRejected() {
        correlationService.record("m1", "user_1");

        DuplicateCorrelationException e = assertThrows(DuplicateCorrelationException.class,
                () -> correlationService.record("m1", "user_2"));

        assertEquals("m1", e.getRelayedMessageId());
        // 原记录不被覆盖
        assertEquals("user_1", correlationService.resolve("m1"));
    }

    @Test
    void testResolveUnknownThrows() {
        CorrelationNotFoundException e = assertThrows(CorrelationNotFoundException.class,
                () -> correlationService.resolve("missing"));

        assertEquals("missing", e.getRelayedMessageId());
    }

    @Test
    void testExpiredRecordNotResolvable() {
        ReflectionTestUtils.setField(correlationService, "retentionHours", 0L);
        correlationService.record("m1", "user_1");

        assertThrows(CorrelationNotFoundException.class, () -> correlationService.resolve("m1"));
        assertEquals(0, correlationService.size());
    }

    @Test
    void testPurgeExpired() {
        correlationService.record("m1", "user_1");
        assertEquals(0, correlationService.purgeExpired());

        ReflectionTestUtils.setField(correlationService, "retentionHours", 0L);

        assertEquals(1, correlationService.purgeExpired());
        assertEquals(0, correlationService.size());
    }

    @Test
    void testRecordWrittenToRedisWithRetention() {
        when(redisUtil.setIfAbsent(eq("relay:record:m1"), anyString(), eq(168L), eq(TimeUnit.HOURS)))
                .thenReturn(true);

        correlationService.record("m1", "user_1");

        verify(redisUtil).setIfAbsent(eq("relay:record:m1"), contains("user_1"), eq(168L), eq(TimeUnit.HOURS));
    }

    @Test
    void testDuplicateDetectedByRedis() {
        // 其他进程或重启前已经写入过同一个ID
        when(redisUtil.setIfAbsent(eq("relay:record:m1"), anyString(), anyLong(), any(TimeUnit.class)))
                .thenReturn(false);

        assertThrows(DuplicateCorrelationException.class, () -> correlationService.record("m1", "user_1"));
        assertEquals(0, correlationService.size());
    }

    @Test
    void testRecordKeptLocallyWhenRedisUnavailable() {
        correlationService.record("m1", "user_1");

        assertEquals("user_1", correlationService.resolve("m1"));
        verify(redisUtil).setIfAbsent(eq("relay:record:m1"), anyString(), eq(168L), eq(TimeUnit.HOURS));
    }

    @Test
    void testResolveFromRedisAfterRestart() throws Exception {
        String json = objectMapper.writeValueAsString(new RelayRecord("m9", "user_9"));
        when(redisUtil.get("relay:record:m9", String.class)).thenReturn(json);

        assertEquals("user_9", correlationService.resolve("m9"));
        assertEquals(1, correlationService.size());
    }
}
