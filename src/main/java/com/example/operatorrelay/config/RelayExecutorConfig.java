package com.example.operatorrelay.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 线程池配置
 */
@Configuration
public class RelayExecutorConfig {

    /**
     * 入站消息处理线程池，按需扩容，某个会话阻塞（生成欢迎语、输入提示等待）不占用其他会话的线程
     * 同一会话的顺序由ConversationDispatcher保证
     */
    @Bean(name = "relayWorkers", destroyMethod = "shutdown")
    public ExecutorService relayWorkers() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("relay-worker-"));
    }

    /**
     * 临时提示的发送与延迟删除
     */
    @Bean(name = "ephemeralScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService ephemeralScheduler(@Value("${relay.notice.scheduler-threads:2}") int threads) {
        return Executors.newScheduledThreadPool(threads, new CustomizableThreadFactory("ephemeral-"));
    }
}
