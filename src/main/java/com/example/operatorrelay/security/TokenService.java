package com.example.operatorrelay.security;

/**
 * Token验证服务接口
 * 用于识别WebSocket连接的用户身份
 */
public interface TokenService {

    /**
     * 验证token的有效性
     *
     * @param token 用户token
     * @return 是否有效
     */
    boolean validateToken(String token);

    /**
     * 根据token获取用户ID
     *
     * @param token 用户token
     * @return 用户ID，如果token无效则返回null
     */
    String getUserIdByToken(String token);

    /**
     * 为用户签发新token
     *
     * @param userId 用户ID
     * @return 新token
     */
    String issueToken(String userId);

    /**
     * 作废token
     *
     * @param token 要作废的token
     */
    void removeToken(String token);
}
