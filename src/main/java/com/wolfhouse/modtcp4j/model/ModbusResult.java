package com.wolfhouse.modtcp4j.model;

import com.wolfhouse.modtcp4j.enums.ErrorKind;
import com.wolfhouse.modtcp4j.exception.ModbusException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 单次请求的结果封装，成功时携带数据，失败时携带失败分类与原因
 *
 * @param <T> 数据类型
 * @author Rylin Wolf
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ModbusResult<T> {
    private final boolean         success;
    /** 成功时的数据，写入请求为 null */
    private final T               value;
    /** 失败原因，成功时为 null */
    private final ModbusException error;

    public static <T> ModbusResult<T> success(T value) {
        return new ModbusResult<>(true, value, null);
    }

    public static <T> ModbusResult<T> failure(ModbusException error) {
        if (error == null) {
            throw new IllegalArgumentException("[modtcp4j] 失败结果必须携带异常");
        }
        return new ModbusResult<>(false, null, error);
    }

    /**
     * 由异步执行抛出的任意异常构造失败结果，会剥离 {@link CompletionException} 等包装
     *
     * @param throwable 异步执行抛出的异常
     * @param <T>       数据类型
     * @return 失败结果
     */
    public static <T> ModbusResult<T> failure(Throwable throwable) {
        return failure(unwrap(throwable));
    }

    /**
     * 剥离异步包装并转换为 {@link ModbusException}
     *
     * @param throwable 原始异常
     * @return Modbus 异常
     */
    public static ModbusException unwrap(Throwable throwable) {
        Throwable cause = throwable;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ModbusException modbusException) {
            return modbusException;
        }
        return new ModbusException("[modtcp4j] 请求执行失败: " + cause.getMessage(), cause);
    }

    /**
     * 获取失败分类
     *
     * @return 失败分类，成功时为 null
     */
    public ErrorKind getErrorKind() {
        return error == null ? null : error.getErrorKind();
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    @Override
    public String toString() {
        return success ? "ModbusResult[success]" : "ModbusResult[%s: %s]".formatted(getErrorKind(), error.getMessage());
    }
}
