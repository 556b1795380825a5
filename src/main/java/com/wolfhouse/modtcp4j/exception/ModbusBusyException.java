package com.wolfhouse.modtcp4j.exception;

import com.wolfhouse.modtcp4j.enums.ErrorKind;

/**
 * 客户端已有未完成的请求时再次发起请求
 *
 * @author Rylin Wolf
 */
public class ModbusBusyException extends ModbusException {
    public ModbusBusyException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.BUSY;
    }
}
