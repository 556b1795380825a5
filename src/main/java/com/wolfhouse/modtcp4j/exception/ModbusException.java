package com.wolfhouse.modtcp4j.exception;

import com.wolfhouse.modtcp4j.enums.ErrorKind;

/**
 * Modbus 客户端基础异常
 *
 * @author Rylin Wolf
 */
public class ModbusException extends RuntimeException {
    /**
     * 构造函数
     *
     * @param message 异常详细信息
     */
    public ModbusException(String message) {
        super(message);
    }

    /**
     * 构造函数
     *
     * @param message 异常详细信息
     * @param cause   异常原因
     */
    public ModbusException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 获取失败分类，未细分的异常一律视为传输层失败
     *
     * @return 失败分类
     */
    public ErrorKind getErrorKind() {
        return ErrorKind.TRANSPORT;
    }
}
