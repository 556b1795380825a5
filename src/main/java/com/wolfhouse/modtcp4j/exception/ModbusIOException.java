package com.wolfhouse.modtcp4j.exception;

/**
 * 传输层 IO 异常（连接、发送、接收）
 *
 * @author Rylin Wolf
 */
public class ModbusIOException extends ModbusException {
    public ModbusIOException(String message) {
        super(message);
    }

    public ModbusIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
