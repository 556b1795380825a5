package com.wolfhouse.modtcp4j.codec;

import com.wolfhouse.modtcp4j.enums.ErrorKind;
import com.wolfhouse.modtcp4j.enums.FramingMode;
import com.wolfhouse.modtcp4j.exception.ModbusFrameException;
import com.wolfhouse.modtcp4j.exception.ModbusSlaveException;
import com.wolfhouse.modtcp4j.utils.RegisterUtils;
import lombok.Getter;

import static com.wolfhouse.modtcp4j.utils.ModbusProtocolUtils.*;

/**
 * Modbus 报文编解码器，根据帧格式构建请求报文，并校验、解析响应报文。
 * <p>
 * 响应报文来自不可信的对端，在提取任何数据之前都会先检查长度、CRC、异常标志与字节数奇偶。
 *
 * @author Rylin Wolf
 */
public class ModbusFrameCodec {
    /** TCP 响应中功能码的偏移 */
    private static final int TCP_FUNCTION_OFFSET = 7;
    /** TCP 响应中字节数字段的偏移 */
    private static final int TCP_COUNT_OFFSET    = 8;
    /** RTU 响应中功能码的偏移 */
    private static final int RTU_FUNCTION_OFFSET = 1;
    /** RTU 响应中字节数字段的偏移 */
    private static final int RTU_COUNT_OFFSET    = 2;

    /** TCP 写入确认的最小长度：MBAP(6) + 从站 ID + 功能码 + 地址(2) + 数量(2) */
    private static final int TCP_WRITE_ACK_LENGTH = 12;
    /** RTU 写入确认的最小长度：从站 ID + 功能码 + 地址(2) + 数量(2) + CRC(2) */
    private static final int RTU_WRITE_ACK_LENGTH = 8;
    /** RTU 异常响应长度：从站 ID + 功能码 + 异常码 + CRC(2) */
    private static final int RTU_MIN_LENGTH       = 5;

    @Getter
    private final FramingMode framingMode;

    public ModbusFrameCodec(FramingMode framingMode) {
        if (framingMode == null) {
            throw new IllegalArgumentException("[modtcp4j] 帧格式不能为空");
        }
        this.framingMode = framingMode;
    }

    /**
     * 构建读保持寄存器（0x03）请求
     *
     * @param unitId   从站 ID
     * @param address  起始地址
     * @param quantity 寄存器数量
     * @return 完整请求报文
     */
    public byte[] buildReadRequest(int unitId, int address, int quantity) {
        checkUnitId(unitId);
        checkAddress(address);
        if (quantity < 0 || quantity > MAX_READ_QUANTITY) {
            throw new IllegalArgumentException("[modtcp4j] 读取数量超出范围 [0, %d]: %d".formatted(MAX_READ_QUANTITY, quantity));
        }
        return wrap(buildReadBody(unitId, address, quantity));
    }

    /**
     * 构建写多个保持寄存器（0x10）请求，不论寄存器数量都使用 0x10
     *
     * @param unitId  从站 ID
     * @param address 起始地址
     * @param values  寄存器值
     * @return 完整请求报文
     */
    public byte[] buildWriteRequest(int unitId, int address, int[] values) {
        checkUnitId(unitId);
        checkAddress(address);
        if (values == null || values.length == 0 || values.length > MAX_WRITE_QUANTITY) {
            throw new IllegalArgumentException("[modtcp4j] 写入数量超出范围 [1, %d]: %s".formatted(
                    MAX_WRITE_QUANTITY, values == null ? "null" : values.length));
        }
        for (int value : values) {
            if (value < 0 || value > 0xFFFF) {
                throw new IllegalArgumentException("[modtcp4j] 寄存器值超出 16 位无符号范围: " + value);
            }
        }
        return wrap(buildWriteBody(unitId, address, values));
    }

    private byte[] wrap(byte[] body) {
        return switch (framingMode) {
            case TCP -> wrapTcpFrame(body);
            case RTU_OVER_TCP -> wrapRtuFrame(body);
        };
    }

    /**
     * 校验并解析读保持寄存器响应
     *
     * @param response 响应报文
     * @return 寄存器值，按地址升序
     * @throws ModbusFrameException 报文不合法或从站返回异常响应
     */
    public int[] decodeReadResponse(byte[] response) throws ModbusFrameException {
        return switch (framingMode) {
            case TCP -> decodeTcpReadResponse(response);
            case RTU_OVER_TCP -> decodeRtuReadResponse(response);
        };
    }

    private int[] decodeTcpReadResponse(byte[] response) {
        if (response.length < TCP_COUNT_OFFSET + 1) {
            throw malformed("TCP 响应长度不足: " + response.length);
        }
        checkExceptionFlag(response, TCP_FUNCTION_OFFSET);
        int byteCount = response[TCP_COUNT_OFFSET] & 0xFF;
        int dataStart = TCP_COUNT_OFFSET + 1;
        if (response.length < dataStart + byteCount) {
            throw malformed("TCP 响应数据区不完整, 声明 %d 字节, 实际 %d 字节".formatted(byteCount, response.length - dataStart));
        }
        checkEven(byteCount);
        return RegisterUtils.fromBytes(response, dataStart, byteCount);
    }

    private int[] decodeRtuReadResponse(byte[] response) {
        if (response.length < RTU_MIN_LENGTH) {
            throw malformed("RTU 响应长度不足: " + response.length);
        }
        checkCrc(response);
        checkExceptionFlag(response, RTU_FUNCTION_OFFSET);
        int byteCount = response[RTU_COUNT_OFFSET] & 0xFF;
        int dataStart = RTU_COUNT_OFFSET + 1;
        if (response.length < dataStart + byteCount + 2) {
            throw malformed("RTU 响应数据区不完整, 声明 %d 字节, 报文长度 %d".formatted(byteCount, response.length));
        }
        checkEven(byteCount);
        return RegisterUtils.fromBytes(response, dataStart, byteCount);
    }

    /**
     * 校验写多个保持寄存器的响应确认，正常返回即表示写入成功
     *
     * @param response 响应报文
     * @throws ModbusFrameException 确认失败
     */
    public void verifyWriteResponse(byte[] response) throws ModbusFrameException {
        switch (framingMode) {
            case TCP -> verifyTcpWriteResponse(response);
            case RTU_OVER_TCP -> verifyRtuWriteResponse(response);
        }
    }

    private void verifyTcpWriteResponse(byte[] response) {
        if (response.length < TCP_WRITE_ACK_LENGTH) {
            if (response.length > TCP_COUNT_OFFSET) {
                checkExceptionFlag(response, TCP_FUNCTION_OFFSET);
            }
            throw malformed("TCP 写入确认长度不足: " + response.length);
        }
        int functionCode = response[TCP_FUNCTION_OFFSET] & 0xFF;
        if (functionCode != FUNC_WRITE_MULTIPLE_REGISTERS) {
            throw new ModbusFrameException(ErrorKind.ACK_MISMATCH,
                                           "[modtcp4j] 写入确认功能码不匹配: 0x%02X".formatted(functionCode));
        }
    }

    private void verifyRtuWriteResponse(byte[] response) {
        if (response.length < RTU_WRITE_ACK_LENGTH) {
            // 异常响应比写入确认短，只在 CRC 正确时才报告为从站异常
            if (response.length >= RTU_MIN_LENGTH && hasValidCrc(response)) {
                checkExceptionFlag(response, RTU_FUNCTION_OFFSET);
            }
            throw malformed("RTU 写入确认长度不足: " + response.length);
        }
        checkCrc(response);
    }

    private static void checkCrc(byte[] response) {
        int received   = readTrailingCrc(response);
        int calculated = calculateCrc(response, 0, response.length - 2);
        if (received != calculated) {
            throw new ModbusFrameException(ErrorKind.CRC_MISMATCH,
                                           "[modtcp4j] CRC 校验失败, 收到: 0x%04X, 计算: 0x%04X".formatted(received, calculated));
        }
    }

    private static void checkExceptionFlag(byte[] response, int functionOffset) {
        int functionCode = response[functionOffset] & 0xFF;
        if ((functionCode & EXCEPTION_FLAG) != 0) {
            throw new ModbusSlaveException(functionCode & ~EXCEPTION_FLAG, response[functionOffset + 1] & 0xFF);
        }
    }

    private static void checkEven(int byteCount) {
        if (byteCount % 2 != 0) {
            throw malformed("数据区字节数异常: " + byteCount);
        }
    }

    private static void checkUnitId(int unitId) {
        if (unitId < 0 || unitId > 0xFF) {
            throw new IllegalArgumentException("[modtcp4j] 从站 ID 超出范围 [0, 255]: " + unitId);
        }
    }

    private static void checkAddress(int address) {
        if (address < 0 || address > 0xFFFF) {
            throw new IllegalArgumentException("[modtcp4j] 寄存器地址超出范围 [0, 65535]: " + address);
        }
    }

    private static ModbusFrameException malformed(String message) {
        return new ModbusFrameException(ErrorKind.MALFORMED, "[modtcp4j] " + message);
    }
}
