package com.wolfhouse.modtcp4j.exception;

/**
 * 调用方等待响应超时
 *
 * @author Rylin Wolf
 */
public class ModbusTimeoutException extends ModbusIOException {
    public ModbusTimeoutException(String message) {
        super(message);
    }
}
