package com.wolfhouse.modtcp4j.utils;

/**
 * Modbus 协议相关工具类
 *
 * @author Rylin Wolf
 */
public class ModbusProtocolUtils {
    /** 读保持寄存器 */
    public static final int FUNC_READ_HOLDING_REGISTERS   = 0x03;
    /** 写多个保持寄存器 */
    public static final int FUNC_WRITE_MULTIPLE_REGISTERS = 0x10;
    /** 异常响应标志位 */
    public static final int EXCEPTION_FLAG                = 0x80;

    /** 单次接收的最大字节数 */
    public static final int MAX_RESPONSE_LENGTH = 256;
    /** 单次读取的最大寄存器数量，保证响应不超过 {@link #MAX_RESPONSE_LENGTH} */
    public static final int MAX_READ_QUANTITY   = 123;
    /** 单次写入的最大寄存器数量，字节数字段只有一个字节 */
    public static final int MAX_WRITE_QUANTITY  = 127;

    /**
     * MBAP 报文头中长度字段之前的固定字节数（事务标识 + 协议标识 + 长度）
     */
    public static final int MBAP_PREFIX_LENGTH = 6;

    private ModbusProtocolUtils() {}

    /**
     * 构建读保持寄存器的报文主体：从站 ID + 功能码 + 起始地址 + 数量
     *
     * @param unitId   从站 ID
     * @param address  起始地址
     * @param quantity 寄存器数量
     * @return 6 字节报文主体
     */
    public static byte[] buildReadBody(int unitId, int address, int quantity) {
        byte[] body = new byte[6];
        body[0] = (byte) unitId;
        body[1] = (byte) FUNC_READ_HOLDING_REGISTERS;
        body[2] = (byte) ((address >> 8) & 0xFF);
        body[3] = (byte) (address & 0xFF);
        body[4] = (byte) ((quantity >> 8) & 0xFF);
        body[5] = (byte) (quantity & 0xFF);
        return body;
    }

    /**
     * 构建写多个保持寄存器的报文主体：从站 ID + 功能码 + 起始地址 + 数量 + 字节数 + 寄存器数据
     *
     * @param unitId  从站 ID
     * @param address 起始地址
     * @param values  寄存器值
     * @return 报文主体
     */
    public static byte[] buildWriteBody(int unitId, int address, int[] values) {
        byte[] data = RegisterUtils.toBytes(values);
        byte[] body = new byte[7 + data.length];
        body[0] = (byte) unitId;
        body[1] = (byte) FUNC_WRITE_MULTIPLE_REGISTERS;
        body[2] = (byte) ((address >> 8) & 0xFF);
        body[3] = (byte) (address & 0xFF);
        body[4] = (byte) ((values.length >> 8) & 0xFF);
        body[5] = (byte) (values.length & 0xFF);
        body[6] = (byte) data.length;
        System.arraycopy(data, 0, body, 7, data.length);
        return body;
    }

    /**
     * 为报文主体加上 MBAP 报文头。长度字段由主体长度计算得到
     *
     * @param body 从站 ID 开始的报文主体
     * @return 完整 TCP 报文
     */
    public static byte[] wrapTcpFrame(byte[] body) {
        byte[] frame = new byte[MBAP_PREFIX_LENGTH + body.length];
        // Transaction ID、Protocol ID 固定为 0
        frame[4] = (byte) ((body.length >> 8) & 0xFF);
        frame[5] = (byte) (body.length & 0xFF);
        System.arraycopy(body, 0, frame, MBAP_PREFIX_LENGTH, body.length);
        return frame;
    }

    /**
     * 为报文主体追加 CRC 校验码
     *
     * @param body 从站 ID 开始的报文主体
     * @return 完整 RTU 报文
     */
    public static byte[] wrapRtuFrame(byte[] body) {
        int    crc   = calculateCrc(body);
        byte[] frame = new byte[body.length + 2];
        System.arraycopy(body, 0, frame, 0, body.length);
        // CRC 低位在前，高位在后
        frame[body.length]     = (byte) (crc & 0xFF);
        frame[body.length + 1] = (byte) ((crc >> 8) & 0xFF);
        return frame;
    }

    /**
     * 读取报文末尾两字节的 CRC（低位在前）
     *
     * @param frame 报文，长度至少为 2
     * @return 报文携带的 CRC
     */
    public static int readTrailingCrc(byte[] frame) {
        return (frame[frame.length - 2] & 0xFF) | ((frame[frame.length - 1] & 0xFF) << 8);
    }

    /**
     * 校验报文末尾的 CRC 是否与前面所有字节的 CRC 一致
     *
     * @param frame 报文
     * @return true 表示一致
     */
    public static boolean hasValidCrc(byte[] frame) {
        if (frame.length < 2) {
            return false;
        }
        return readTrailingCrc(frame) == calculateCrc(frame, 0, frame.length - 2);
    }

    /**
     * 计算整个数组的 CRC16 校验码
     *
     * @param data 字节数组
     * @return 计算出的 CRC16 值
     */
    public static int calculateCrc(byte[] data) {
        return calculateCrc(data, 0, data.length);
    }

    /**
     * 计算 CRC16 校验码
     *
     * @param data 字节数组
     * @param off  偏移量
     * @param len  长度
     * @return 计算出的 CRC16 值，空输入为 0xFFFF
     */
    public static int calculateCrc(byte[] data, int off, int len) {
        int crc = 0xFFFF;
        for (int i = off; i < off + len; i++) {
            crc ^= (data[i] & 0xFF);
            for (int j = 0; j < 8; j++) {
                if ((crc & 0x0001) != 0) {
                    crc = (crc >> 1) ^ 0xA001;
                } else {
                    crc >>= 1;
                }
            }
        }
        return crc;
    }
}
