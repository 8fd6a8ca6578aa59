package com.example.operatorrelay.service;

import com.example.operatorrelay.model.PresenceState;
import com.example.operatorrelay.model.PresenceTransition;
import com.example.operatorrelay.util.RedisUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * PresenceService测试类
 */
@ExtendWith(MockitoExtension.class)
class PresenceServiceTest {

    @Mock
    private RedisUtil redisUtil;

    @InjectMocks
    private PresenceService presenceService;

    @AfterEach
    void tearDown() {
        presenceService.shutdown();
    }

    @Test
    void testInitiallyAwayWithoutPendingTransition() {
        PresenceState state = presenceService.snapshot();

        assertFalse(state.isAvailable());
        assertEquals(PresenceTransition.NONE, state.getPendingTransition());
        assertEquals(PresenceTransition.NONE, presenceService.consumeTransition());
    }

    @Test
    void testTransitionConsumedOnce() {
        presenceService.setAvailable();

        assertTrue(presenceService.isAvailable());
        assertEquals(PresenceTransition.BECAME_AVAILABLE, presenceService.consumeTransition());
        assertEquals(PresenceTransition.NONE, presenceService.consumeTransition());
        // 消费提示不改变可用状态
        assertTrue(presenceService.isAvailable());
    }

    @Test
    void testLatestTransitionWins() {
        presenceService.setAvailable();
        presenceService.setAway();

        assertFalse(presenceService.isAvailable());
        assertEquals(PresenceTransition.BECAME_AWAY, presenceService.consumeTransition());
    }

    @Test
    void testRepeatedCommandRearmsTransition() {
        presenceService.setAway();
        presenceService.consumeTransition();

        presenceService.setAway();

        assertEquals(PresenceTransition.BECAME_AWAY, presenceService.consumeTransition());
    }

    @Test
    void testConcurrentConsumeSeesTransitionOnce() throws Exception {
        presenceService.setAvailable();

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<PresenceTransition>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                Callable<PresenceTransition> task = () -> {
                    start.await();
                    return presenceService.consumeTransition();
                };
                results.add(executor.submit(task));
            }
            start.countDown();

            int seen = 0;
            for (Future<PresenceTransition> result : results) {
                if (result.get(5, TimeUnit.SECONDS) == PresenceTransition.BECAME_AVAILABLE) {
                    seen++;
                }
            }
            assertEquals(1, seen);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testStatePersistedToRedis() {
        presenceService.setAvailable();

        // 写入在后台线程执行
        verify(redisUtil, timeout(1000)).set("relay:presence:available", true);
        verify(redisUtil, timeout(1000)).set("relay:presence:pending", "BECAME_AVAILABLE");
    }

    @Test
    void testSlowRedisDoesNotBlockStateChanges() {
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> release.await(5, TimeUnit.SECONDS)).when(redisUtil).set(anyString(), any());
        try {
            assertTimeoutPreemptively(Duration.ofSeconds(1), () -> {
                presenceService.setAvailable();
                assertEquals(PresenceTransition.BECAME_AVAILABLE, presenceService.consumeTransition());
                presenceService.setAway();
                assertFalse(presenceService.isAvailable());
            });
        } finally {
            release.countDown();
        }

        // 三次修改都在锁外写入Redis
        verify(redisUtil, timeout(1000)).set("relay:presence:pending", "BECAME_AWAY");
        verify(redisUtil, timeout(1000).times(3)).set(eq("relay:presence:available"), any());
    }

    @Test
    void testRestoreFromRedis() {
        when(redisUtil.get("relay:presence:available", Boolean.class)).thenReturn(true);
        when(redisUtil.get("relay:presence:pending", String.class)).thenReturn("BECAME_AVAILABLE");

        presenceService.restore();

        assertTrue(presenceService.isAvailable());
        assertEquals(PresenceTransition.BECAME_AVAILABLE, presenceService.consumeTransition());
    }

    @Test
    void testRestoreIgnoresUnknownTransition() {
        when(redisUtil.get("relay:presence:available", Boolean.class)).thenReturn(null);
        when(redisUtil.get("relay:presence:pending", String.class)).thenReturn("SOMETHING_ELSE");

        presenceService.restore();

        assertFalse(presenceService.isAvailable());
        assertEquals(PresenceTransition.NONE, presenceService.consumeTransition());
    }
}
