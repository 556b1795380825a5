package com.wolfhouse.modtcp4j.conf;

import com.wolfhouse.modtcp4j.enums.FramingMode;
import lombok.Builder;

/**
 * Modbus 客户端配置记录类，未设置的项使用默认值
 *
 * @param framingMode    帧格式，默认 {@link FramingMode#TCP}
 * @param host           设备地址
 * @param port           设备端口，默认 502
 * @param unitId         默认从站 ID，默认 1
 * @param connectTimeout 连接超时时间（毫秒），默认 3000
 * @author Rylin Wolf
 */
@Builder
public record ModbusClientConfig(FramingMode framingMode, String host, Integer port, Integer unitId, Integer connectTimeout) {
    public static final int DEFAULT_PORT            = 502;
    public static final int DEFAULT_UNIT_ID         = 1;
    public static final int DEFAULT_CONNECT_TIMEOUT = 3000;

    public ModbusClientConfig {
        if (framingMode == null) {
            framingMode = FramingMode.TCP;
        }
        if (port == null) {
            port = DEFAULT_PORT;
        }
        if (unitId == null) {
            unitId = DEFAULT_UNIT_ID;
        }
        if (connectTimeout == null) {
            connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        }
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("[modtcp4j-ModbusClientConfig] 端口超出范围: " + port);
        }
        if (unitId < 0 || unitId > 0xFF) {
            throw new IllegalArgumentException("[modtcp4j-ModbusClientConfig] 从站 ID 超出范围: " + unitId);
        }
        if (connectTimeout < 0) {
            throw new IllegalArgumentException("[modtcp4j-ModbusClientConfig] 连接超时时间不能为负数: " + connectTimeout);
        }
    }
}
