package com.guardframe.api.http;

import com.guardframe.api.exception.HeaderClaimConflictException;

/**
 * 基于声明（claim）的响应头 API
 * <p>
 * 组件必须先声明某个响应头的独占写权限，才能写入它。
 * 同一个响应头在一次响应中只能被声明一次，头名称大小写不敏感。
 * </p>
 *
 * @author GuardFrame
 */
public interface ResponseHeaders {

    /**
     * 声明响应头的独占写权限
     *
     * @param name 响应头名称
     * @return 该响应头的写入器
     * @throws HeaderClaimConflictException 如果该响应头已被声明
     */
    HeaderSetter claim(String name) throws HeaderClaimConflictException;

    /**
     * 响应头是否已被声明
     */
    boolean isClaimed(String name);
}
