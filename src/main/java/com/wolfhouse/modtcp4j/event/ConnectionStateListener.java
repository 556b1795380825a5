package com.wolfhouse.modtcp4j.event;

import com.wolfhouse.modtcp4j.enums.ConnectionState;

/**
 * 连接状态监听器接口
 *
 * @author Rylin Wolf
 */
@FunctionalInterface
public interface ConnectionStateListener {
    /**
     * 连接状态发生变化时触发，每次变化通知一次，按发生顺序通知
     *
     * @param state 新的连接状态
     */
    void onStateChange(ConnectionState state);
}
