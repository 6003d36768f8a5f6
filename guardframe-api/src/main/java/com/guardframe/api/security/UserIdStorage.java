package com.guardframe.api.security;

import com.guardframe.api.exception.IdentityLookupException;

/**
 * 宿主提供 - 用户身份查询能力
 * <p>
 * GuardFrame 只消费此能力，不负责会话与认证。实现可能涉及外部 I/O，
 * 需要重试时应由实现自身完成。
 * </p>
 *
 * @author GuardFrame
 */
public interface UserIdStorage {

    /**
     * 获取当前请求的用户标识
     *
     * @throws IdentityLookupException 如果无法解析用户
     */
    String getUserId() throws IdentityLookupException;
}
