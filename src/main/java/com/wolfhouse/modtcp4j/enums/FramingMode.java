package com.wolfhouse.modtcp4j.enums;

/**
 * Modbus 报文帧格式枚举，客户端实例创建后不可变更
 *
 * @author Rylin Wolf
 */
public enum FramingMode {
    /**
     * Modbus TCP，MBAP 报文头 + PDU，无 CRC
     */
    TCP,

    /**
     * RTU 报文（从站地址 + PDU + CRC）通过 TCP 字节流传输
     */
    RTU_OVER_TCP,
}
