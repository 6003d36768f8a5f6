package com.guardframe.api.event;

/**
 * GuardFrame 事件标记接口
 *
 * @author GuardFrame
 */
public interface GuardEvent {
}
