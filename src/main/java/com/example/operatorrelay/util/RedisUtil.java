package com.example.operatorrelay.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Redis工具类
 * 所有操作在Redis不可用时返回空值而不抛异常，由调用方回退到本地存储
 */
@Component
public class RedisUtil {

    private static final Logger logger = LoggerFactory.getLogger(RedisUtil.class);

    @Autowired
    private RedisTemplate<String, Object> redisTemplate;

    // 可用性检测结果的缓存时间（毫秒），避免每次操作都ping
    @Value("${relay.redis.availability-cache-ms:5000}")
    private long availabilityCacheMillis = 5000;

    private volatile long lastCheckTime;

    private volatile boolean lastAvailable;

    /**
     * 判断Redis是否可用
     * @return 是否可用
     */
    public boolean isRedisAvailable() {
        long now = System.currentTimeMillis();
        if (lastCheckTime > 0 && now - lastCheckTime < availabilityCacheMillis) {
            return lastAvailable;
        }
        lastAvailable = ping();
        lastCheckTime = now;
        return lastAvailable;
    }

    private boolean ping() {
        if (redisTemplate == null) {
            logger.warn("RedisTemplate为null，Redis不可用");
            return false;
        }

        RedisConnectionFactory connectionFactory = redisTemplate.getConnectionFactory();
        if (connectionFactory == null) {
            logger.warn("Redis连接工厂为null，Redis不可用");
            return false;
        }

        try (RedisConnection connection = connectionFactory.getConnection()) {
            connection.ping();
            logger.debug("Redis连接测试成功");
            return true;
        } catch (Exception e) {
            logger.warn("Redis不可用: {}", e.getMessage());
            return false;
        }
    }

    /**
     * 获取值
     * @param key 键
     * @param clazz 类型
     * @param <T> 泛型
     * @return 值，不存在或Redis不可用时返回null
     */
    public <T> T get(String key, Class<T> clazz) {
        try {
            if (!isRedisAvailable()) {
                return null;
            }
            ValueOperations<String, Object> operations = redisTemplate.opsForValue();
            Object value = operations.get(key);
            if (value != null && clazz.isInstance(value)) {
                return clazz.cast(value);
            }
            return null;
        } catch (Exception e) {
            logger.error("获取Redis值失败，key: {}", key, e);
            return null;
        }
    }

    /**
     * 设置值
     * @param key 键
     * @param value 值
     * @return 是否写入成功
     */
    public boolean set(String key, Object value) {
        try {
            if (!isRedisAvailable()) {
                return false;
            }
            redisTemplate.opsForValue().set(key, value);
            return true;
        } catch (Exception e) {
            logger.error("设置Redis值失败，key: {}", key, e);
            return false;
        }
    }

    /**
     * 设置值并指定过期时间
     * @param key 键
     * @param value 值
     * @param timeout 过期时间
     * @param timeUnit 时间单位
     * @return 是否写入成功
     */
    public boolean set(String key, Object value, long timeout, TimeUnit timeUnit) {
        try {
            if (!isRedisAvailable()) {
                return false;
            }
            redisTemplate.opsForValue().set(key, value, timeout, timeUnit);
            return true;
        } catch (Exception e) {
            logger.error("设置Redis值失败，key: {}", key, e);
            return false;
        }
    }

    /**
     * 键不存在时设置值并指定过期时间
     * @return true表示写入成功，false表示键已存在，null表示Redis不可用
     */
    public Boolean setIfAbsent(String key, Object value, long timeout, TimeUnit timeUnit) {
        try {
            if (!isRedisAvailable()) {
                return null;
            }
            return redisTemplate.opsForValue().setIfAbsent(key, value, timeout, timeUnit);
        } catch (Exception e) {
            logger.error("条件设置Redis值失败，key: {}", key, e);
            return null;
        }
    }

    /**
     * 删除键
     * @param key 键
     */
    public void delete(String key) {
        try {
            if (!isRedisAvailable()) {
                return;
            }
            redisTemplate.delete(key);
        } catch (Exception e) {
            logger.error("删除Redis键失败，key: {}", key, e);
        }
    }
}
