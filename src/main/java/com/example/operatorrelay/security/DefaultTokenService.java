package com.example.operatorrelay.security;

import com.example.operatorrelay.util.RedisUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Token验证服务的默认实现
 * 用户token保存在Redis（不可用时回退到本地内存）；运营者token来自配置，常驻内存
 */
@Service
public class DefaultTokenService implements TokenService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultTokenService.class);

    // Redis token存储配置
    @Value("${websocket.security.token.redis.expire-time:2592000}")
    private int tokenExpireTime = 2592000; // token过期时间，单位秒，默认30天

    @Value("${relay.operator-id:operator}")
    private String operatorId = "operator";

    @Value("${relay.operator-token:}")
    private String operatorToken;

    // Redis键前缀
    private static final String REDIS_PREFIX = "relay:token:";
    private static final String TOKEN_USER_KEY = REDIS_PREFIX + "user:";

    // Redis工具类
    @Autowired(required = false)
    private RedisUtil redisUtil;

    // 本地内存存储（当Redis不可用时作为回退方案）
    private final Map<String, String> tokenMap = new ConcurrentHashMap<>();

    /**
     * 检查运营者token配置
     */
    @PostConstruct
    public void init() {
        if (operatorToken == null || operatorToken.trim().isEmpty()) {
            logger.warn("未配置relay.operator-token，运营者将无法连接");
            return;
        }
        logger.info("运营者token已配置，运营者ID: {}", operatorId);
    }

    @Override
    public boolean validateToken(String token) {
        return getUserIdByToken(token) != null;
    }

    @Override
    public String getUserIdByToken(String token) {
        if (token == null || token.isEmpty()) {
            return null;
        }
        if (isOperatorToken(token)) {
            return operatorId;
        }

        // 优先Redis，回退到本地内存
        if (redisUtil != null && redisUtil.isRedisAvailable()) {
            String userId = redisUtil.get(TOKEN_USER_KEY + token, String.class);
            if (userId != null) {
                return userId;
            }
        }
        return tokenMap.get(token);
    }

    @Override
    public String issueToken(String userId) {
        if (userId == null || userId.isEmpty()) {
            throw new IllegalArgumentException("userId不能为空");
        }
        if (userId.equals(operatorId)) {
            throw new IllegalArgumentException("不能为运营者签发token");
        }

        String token = UUID.randomUUID().toString().replace("-", "");
        boolean stored = redisUtil != null
                && redisUtil.set(TOKEN_USER_KEY + token, userId, tokenExpireTime, TimeUnit.SECONDS);
        if (!stored) {
            tokenMap.put(token, userId);
            logger.info("签发token（本地存储）: userId={}", userId);
        } else {
            logger.info("签发token: userId={}, 过期时间={}秒", userId, tokenExpireTime);
        }
        return token;
    }

    @Override
    public void removeToken(String token) {
        if (token == null) {
            return;
        }
        tokenMap.remove(token);
        if (redisUtil != null) {
            redisUtil.delete(TOKEN_USER_KEY + token);
        }
        logger.info("已作废token");
    }

    private boolean isOperatorToken(String token) {
        return operatorToken != null && !operatorToken.trim().isEmpty() && operatorToken.equals(token);
    }
}
