package com.example.eventrelay.security;

import java.util.Optional;

/**
 * 从凭据解析调用方身份。
 * 实现不得抛出异常：无效、过期或缺失的凭据一律返回 empty，由调用方决定按匿名处理还是拒绝。
 */
public interface IdentityResolver {

    /**
     * @param credential 原始 token 或 "Bearer &lt;token&gt;"，可为 null
     * @return 解析成功时的身份
     */
    Optional<Identity> resolve(String credential);
}
