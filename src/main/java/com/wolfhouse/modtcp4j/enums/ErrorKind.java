package com.wolfhouse.modtcp4j.enums;

/**
 * 单次请求失败的原因分类
 *
 * @author Rylin Wolf
 */
public enum ErrorKind {
    /**
     * 连接、发送或接收失败，包括空响应和超时
     */
    TRANSPORT,

    /**
     * 响应长度不足或数据区字节数为奇数
     */
    MALFORMED,

    /**
     * RTU 报文 CRC 校验失败
     */
    CRC_MISMATCH,

    /**
     * 从站返回的异常响应（功能码最高位置 1）
     */
    EXCEPTION_RESPONSE,

    /**
     * 写入响应确认不匹配
     */
    ACK_MISMATCH,

    /**
     * 当前客户端已有未完成的请求
     */
    BUSY,
}
