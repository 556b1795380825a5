package com.wolfhouse.modtcp4j.exception;

import com.wolfhouse.modtcp4j.enums.ErrorKind;

/**
 * 响应报文校验失败
 *
 * @author Rylin Wolf
 */
public class ModbusFrameException extends ModbusException {
    private final ErrorKind errorKind;

    /**
     * 构造函数
     *
     * @param errorKind 失败分类，只能是报文相关的分类
     * @param message   异常详细信息
     */
    public ModbusFrameException(ErrorKind errorKind, String message) {
        super(message);
        if (errorKind == ErrorKind.TRANSPORT || errorKind == ErrorKind.BUSY) {
            throw new IllegalArgumentException("[modtcp4j] 报文异常不能使用分类: " + errorKind);
        }
        this.errorKind = errorKind;
    }

    @Override
    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
