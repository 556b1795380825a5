package com.wolfhouse.modtcp4j.enums;

import java.util.Locale;

/**
 * 传输层连接状态枚举
 *
 * @author Rylin Wolf
 */
public enum ConnectionState {
    /** 正在建立连接 */
    PREPARING,
    /** 连接可用 */
    READY,
    /** 等待网络可用 */
    WAITING,
    /** 连接失败或被对端断开 */
    FAILED,
    /** 连接已被主动关闭 */
    CANCELLED,
    /** 无法识别的传输层状态 */
    UNKNOWN;

    /**
     * 将传输层上报的状态名称映射为连接状态，无法识别时返回 {@link #UNKNOWN} 而不是丢弃
     *
     * @param name 状态名称，不区分大小写
     * @return 对应的连接状态
     */
    public static ConnectionState fromName(String name) {
        if (name == null || name.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
