package com.wolfhouse.modtcp4j.transport;

import com.wolfhouse.modtcp4j.event.ConnectionStateListener;
import com.wolfhouse.modtcp4j.exception.ModbusException;
import com.wolfhouse.modtcp4j.exception.ModbusIOException;

import java.util.concurrent.CompletableFuture;

/**
 * 字节流传输层接口，负责连接、发送与接收，不理解 Modbus 报文
 *
 * @author Rylin Wolf
 */
public interface ModbusTransport extends AutoCloseable {
    /**
     * 发起连接。连接过程是异步的，状态变化通过监听器通知
     *
     * @param host     主机地址
     * @param port     端口号
     * @param listener 连接状态监听器 {@link ConnectionStateListener}
     * @throws ModbusException 无法发起连接
     */
    void connect(String host, int port, ConnectionStateListener listener) throws ModbusException;

    /**
     * 发送报文。重复发送相同字节不会破坏传输层状态
     *
     * @param frame 完整报文
     * @throws ModbusIOException 未连接或写入失败
     */
    void send(byte[] frame) throws ModbusIOException;

    /**
     * 接收一次数据，不做报文重组
     *
     * @param minLength 最少字节数
     * @param maxLength 最多字节数
     * @return 完成时包含收到的字节；连接关闭或读取失败时以 {@link ModbusIOException} 异常完成
     */
    CompletableFuture<byte[]> receive(int minLength, int maxLength);

    /**
     * 检查连接是否可用
     *
     * @return true 表示已连接
     */
    boolean isConnected();

    /**
     * 关闭连接，未完成的接收会以异常结束
     */
    @Override
    void close();
}
