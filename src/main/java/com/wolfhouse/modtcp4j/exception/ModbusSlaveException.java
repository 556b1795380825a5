package com.wolfhouse.modtcp4j.exception;

import com.wolfhouse.modtcp4j.enums.ErrorKind;
import lombok.Getter;

/**
 * 从站返回的异常响应
 *
 * @author Rylin Wolf
 */
@Getter
public class ModbusSlaveException extends ModbusFrameException {
    /** 请求的功能码（已去掉异常标志位） */
    private final int functionCode;
    /** 从站返回的异常码 */
    private final int exceptionCode;

    public ModbusSlaveException(int functionCode, int exceptionCode) {
        super(ErrorKind.EXCEPTION_RESPONSE,
              "[modtcp4j] 从站返回异常响应, 功能码: 0x%02X, 异常码: 0x%02X".formatted(functionCode, exceptionCode));
        this.functionCode  = functionCode;
        this.exceptionCode = exceptionCode;
    }
}
