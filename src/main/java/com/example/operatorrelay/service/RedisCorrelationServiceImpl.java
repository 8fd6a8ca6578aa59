package com.example.operatorrelay.service;

import com.example.operatorrelay.exception.CorrelationNotFoundException;
import com.example.operatorrelay.exception.DuplicateCorrelationException;
import com.example.operatorrelay.model.RelayRecord;
import com.example.operatorrelay.util.RedisUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * 基于Redis的转发关联服务实现
 * 本地内存保存当前进程产生的记录，Redis保存跨重启的记录；两处都按保留期限过期
 */
@Service
public class RedisCorrelationServiceImpl implements CorrelationService {

    private static final Logger logger = LoggerFactory.getLogger(RedisCorrelationServiceImpl.class);

    // Redis key前缀
    private static final String RECORD_KEY = "relay:record:";

    @Autowired(required = false)
    private RedisUtil redisUtil;

    @Autowired
    private ObjectMapper objectMapper;

    // 记录保留时长（小时）
    @Value("${relay.correlation.retention-hours:168}")
    private long retentionHours = 168;

    // 本地内存存储
    private final Map<String, RelayRecord> localRecords = new ConcurrentHashMap<>();

    @Override
    public void record(String relayedMessageId, String originConversationId) {
        RelayRecord record = new RelayRecord(relayedMessageId, originConversationId);
        if (localRecords.putIfAbsent(relayedMessageId, record) != null) {
            throw new DuplicateCorrelationException(relayedMessageId);
        }

        if (redisUtil != null) {
            Boolean stored = redisUtil.setIfAbsent(RECORD_KEY + relayedMessageId, toJson(record),
                    retentionHours, TimeUnit.HOURS);
            if (Boolean.FALSE.equals(stored)) {
                localRecords.remove(relayedMessageId, record);
                throw new DuplicateCorrelationException(relayedMessageId);
            }
            if (stored == null) {
                logger.warn("转发记录 {} 未能写入Redis，仅保存在本地内存", relayedMessageId);
            }
        }
        logger.debug("记录转发关联: {} -> {}", relayedMessageId, originConversationId);
    }

    @Override
    public String resolve(String relayedMessageId) {
        RelayRecord record = localRecords.get(relayedMessageId);
        if (record == null && redisUtil != null) {
            String json = redisUtil.get(RECORD_KEY + relayedMessageId, String.class);
            if (json != null) {
                record = fromJson(json);
                if (record != null) {
                    localRecords.putIfAbsent(relayedMessageId, record);
                }
            }
        }

        if (record == null) {
            throw new CorrelationNotFoundException(relayedMessageId);
        }
        if (isExpired(record, System.currentTimeMillis())) {
            localRecords.remove(relayedMessageId, record);
            throw new CorrelationNotFoundException(relayedMessageId);
        }
        return record.getOriginConversationId();
    }

    /**
     * 定时清理本地过期记录，Redis中的记录由TTL自动过期
     */
    @Override
    @Scheduled(fixedDelayString = "${relay.correlation.purge-interval-ms:600000}")
    public int purgeExpired() {
        long now = System.currentTimeMillis();
        int removed = 0;
        Iterator<RelayRecord> iterator = localRecords.values().iterator();
        while (iterator.hasNext()) {
            if (isExpired(iterator.next(), now)) {
                iterator.remove();
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("清理过期转发记录 {} 条，剩余 {} 条", removed, localRecords.size());
        }
        return removed;
    }

    @Override
    public int size() {
        return localRecords.size();
    }

    private boolean isExpired(RelayRecord record, long now) {
        return now - record.getCreatedTime() >= TimeUnit.HOURS.toMillis(retentionHours);
    }

    private String toJson(RelayRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("序列化转发记录失败: " + record.getRelayedMessageId(), e);
        }
    }

    private RelayRecord fromJson(String json) {
        try {
            return objectMapper.readValue(json, RelayRecord.class);
        } catch (JsonProcessingException e) {
            logger.error("解析Redis中的转发记录失败: {}", json, e);
            return null;
        }
    }
}
