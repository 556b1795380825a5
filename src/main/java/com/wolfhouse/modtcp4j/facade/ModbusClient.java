package com.wolfhouse.modtcp4j.facade;

import com.wolfhouse.modtcp4j.codec.ModbusFrameCodec;
import com.wolfhouse.modtcp4j.conf.ModbusClientConfig;
import com.wolfhouse.modtcp4j.enums.FramingMode;
import com.wolfhouse.modtcp4j.event.ConnectionStateListener;
import com.wolfhouse.modtcp4j.exception.ModbusBusyException;
import com.wolfhouse.modtcp4j.exception.ModbusException;
import com.wolfhouse.modtcp4j.exception.ModbusFrameException;
import com.wolfhouse.modtcp4j.exception.ModbusIOException;
import com.wolfhouse.modtcp4j.exception.ModbusTimeoutException;
import com.wolfhouse.modtcp4j.model.ModbusResult;
import com.wolfhouse.modtcp4j.transport.ModbusTransport;
import com.wolfhouse.modtcp4j.transport.SocketModbusTransport;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static com.wolfhouse.modtcp4j.utils.ModbusProtocolUtils.MAX_RESPONSE_LENGTH;

/**
 * Modbus 客户端门面类，对应一台设备的一条连接。
 * <p>
 * 每个操作依次执行：构建请求、发送、接收一次响应、校验解析、回调结果。同一时刻只允许一个未完成的请求，
 * 重叠调用会立即以 {@link com.wolfhouse.modtcp4j.enums.ErrorKind#BUSY} 失败，客户端内部不排队。
 * 回调与异步接口不设超时，需要期限时使用带超时参数的阻塞接口，或自行对返回的 future 设置期限。
 *
 * @author Rylin Wolf
 */
@Slf4j
public class ModbusClient implements AutoCloseable {
    /**
     * 客户端配置
     */
    @Getter
    private final ModbusClientConfig config;

    /**
     * 帧格式，创建后不可变更
     */
    @Getter
    private final FramingMode framingMode;

    private final ModbusFrameCodec          codec;
    private final Supplier<ModbusTransport> transportFactory;

    /**
     * 当前未完成请求的标记，为 null 表示空闲
     */
    private final AtomicReference<Object> pendingExchange = new AtomicReference<>();

    /**
     * 传输层句柄，仅在连接期间存在
     */
    private volatile ModbusTransport transport;

    public ModbusClient(FramingMode framingMode) {
        this(ModbusClientConfig.builder().framingMode(framingMode).build());
    }

    public ModbusClient(ModbusClientConfig config) {
        this(config, () -> new SocketModbusTransport(config.connectTimeout()));
    }

    /**
     * 构造函数
     *
     * @param config           客户端配置 {@link ModbusClientConfig}
     * @param transportFactory 每次连接时创建传输层实例
     */
    public ModbusClient(ModbusClientConfig config, Supplier<ModbusTransport> transportFactory) {
        if (config == null || transportFactory == null) {
            throw new IllegalArgumentException("[modtcp4j] 客户端配置与传输层工厂不能为空");
        }
        this.config           = config;
        this.framingMode      = config.framingMode();
        this.codec            = new ModbusFrameCodec(framingMode);
        this.transportFactory = transportFactory;
    }

    /**
     * 使用配置中的地址与端口连接设备
     *
     * @param onStateChange 连接状态监听器
     * @throws ModbusException 无法发起连接
     */
    public void connect(ConnectionStateListener onStateChange) throws ModbusException {
        if (config.host() == null) {
            throw new IllegalStateException("[modtcp4j] 配置中未设置设备地址");
        }
        connect(config.host(), config.port(), onStateChange);
    }

    /**
     * 连接设备。连接是异步的，每次状态变化都会原样、按顺序转发给监听器
     *
     * @param host          设备地址
     * @param port          设备端口
     * @param onStateChange 连接状态监听器，可以为 null
     * @throws ModbusException 无法发起连接
     */
    public synchronized void connect(String host, int port, ConnectionStateListener onStateChange) throws ModbusException {
        ModbusTransport current = this.transport;
        if (current != null) {
            if (current.isConnected()) {
                log.info("[modtcp4j] 设备已连接，无需重复连接: {}", framingMode);
                return;
            }
            log.info("[modtcp4j] 设备存在未完成的连接，关闭后重新连接: {}:{}", host, port);
            disconnect();
        }
        ModbusTransport next = transportFactory.get();
        this.transport = next;
        next.connect(host, port, state -> {
            log.debug("[modtcp4j] {}:{} 连接状态变化: {}", host, port, state);
            if (onStateChange != null) {
                onStateChange.onStateChange(state);
            }
        });
    }

    /**
     * 断开连接，未完成的请求会以传输层失败结束
     *
     * @throws ModbusIOException 关闭连接时发生异常
     */
    public synchronized void disconnect() throws ModbusIOException {
        ModbusTransport current = this.transport;
        this.transport = null;
        pendingExchange.set(null);
        if (current != null) {
            current.close();
        }
    }

    public boolean isConnected() {
        ModbusTransport current = this.transport;
        return current != null && current.isConnected();
    }

    /**
     * 使用默认从站 ID 读取保持寄存器
     *
     * @see #readHoldingRegisters(int, int, int, Consumer)
     */
    public void readHoldingRegisters(int address, int quantity, Consumer<ModbusResult<int[]>> onResult) {
        readHoldingRegisters(config.unitId(), address, quantity, onResult);
    }

    /**
     * 读取保持寄存器（0x03），结果通过回调恰好通知一次
     *
     * @param unitId   从站 ID
     * @param address  起始地址
     * @param quantity 寄存器数量
     * @param onResult 结果回调，成功时携带按地址升序的寄存器值
     */
    public void readHoldingRegisters(int unitId, int address, int quantity, Consumer<ModbusResult<int[]>> onResult) {
        deliver(readHoldingRegistersAsync(unitId, address, quantity), onResult);
    }

    /**
     * 异步读取保持寄存器
     *
     * @param unitId   从站 ID
     * @param address  起始地址
     * @param quantity 寄存器数量
     * @return CompletableFuture，失败时以 {@link ModbusException} 异常完成
     */
    public CompletableFuture<int[]> readHoldingRegistersAsync(int unitId, int address, int quantity) {
        byte[] request = codec.buildReadRequest(unitId, address, quantity);
        return exchange(request).thenApply(response -> {
            try {
                return codec.decodeReadResponse(response);
            } catch (ModbusFrameException e) {
                log.warn("[modtcp4j] 读取寄存器响应无效 [{}]: {}", e.getErrorKind(), e.getMessage());
                throw e;
            }
        });
    }

    /**
     * 读取保持寄存器并阻塞等待结果
     *
     * @param unitId   从站 ID
     * @param address  起始地址
     * @param quantity 寄存器数量
     * @param timeout  等待期限
     * @param unit     期限单位
     * @return 寄存器值
     * @throws ModbusException 请求失败；超时时为 {@link ModbusTimeoutException}，同时连接会被关闭
     */
    public int[] readHoldingRegisters(int unitId, int address, int quantity, long timeout, TimeUnit unit) throws ModbusException {
        return await(readHoldingRegistersAsync(unitId, address, quantity), timeout, unit);
    }

    /**
     * 使用默认从站 ID 写入保持寄存器
     *
     * @see #writeHoldingRegisters(int, int, int[], Consumer)
     */
    public void writeHoldingRegisters(int address, int[] values, Consumer<ModbusResult<Void>> onResult) {
        writeHoldingRegisters(config.unitId(), address, values, onResult);
    }

    /**
     * 写入多个保持寄存器（0x10），结果通过回调恰好通知一次，{@link ModbusResult#isSuccess()} 即写入是否成功
     *
     * @param unitId   从站 ID
     * @param address  起始地址
     * @param values   寄存器值，1 到 127 个
     * @param onResult 结果回调
     */
    public void writeHoldingRegisters(int unitId, int address, int[] values, Consumer<ModbusResult<Void>> onResult) {
        deliver(writeHoldingRegistersAsync(unitId, address, values), onResult);
    }

    /**
     * 异步写入多个保持寄存器
     *
     * @param unitId  从站 ID
     * @param address 起始地址
     * @param values  寄存器值
     * @return CompletableFuture，写入确认失败时以 {@link ModbusException} 异常完成
     */
    public CompletableFuture<Void> writeHoldingRegistersAsync(int unitId, int address, int[] values) {
        byte[] request = codec.buildWriteRequest(unitId, address, values);
        return exchange(request).thenAccept(response -> {
            try {
                codec.verifyWriteResponse(response);
            } catch (ModbusFrameException e) {
                log.warn("[modtcp4j] 写入寄存器确认失败 [{}]: {}", e.getErrorKind(), e.getMessage());
                throw e;
            }
        });
    }

    /**
     * 写入多个保持寄存器并阻塞等待确认
     *
     * @throws ModbusException 写入失败；超时时为 {@link ModbusTimeoutException}，同时连接会被关闭
     */
    public void writeHoldingRegisters(int unitId, int address, int[] values, long timeout, TimeUnit unit) throws ModbusException {
        await(writeHoldingRegistersAsync(unitId, address, values), timeout, unit);
    }

    /**
     * 发送请求并接收一次响应
     *
     * @param request 请求报文
     * @return 完成时包含非空响应报文
     */
    private CompletableFuture<byte[]> exchange(byte[] request) {
        Object token = new Object();
        if (!pendingExchange.compareAndSet(null, token)) {
            return CompletableFuture.failedFuture(new ModbusBusyException("[modtcp4j] 已有未完成的请求，请等待其完成后再发起"));
        }
        CompletableFuture<byte[]> received;
        try {
            ModbusTransport current = this.transport;
            if (current == null) {
                throw new ModbusIOException("[modtcp4j] 设备未连接");
            }
            current.send(request);
            received = current.receive(1, MAX_RESPONSE_LENGTH);
            if (received == null) {
                throw new ModbusIOException("[modtcp4j] 传输层未返回接收结果");
            }
        } catch (ModbusException e) {
            pendingExchange.compareAndSet(token, null);
            log.warn("[modtcp4j] 发送请求失败: {}", e.getMessage());
            return CompletableFuture.failedFuture(e);
        } catch (RuntimeException e) {
            // 传输层实现抛出的非 Modbus 异常同样按传输层失败处理
            pendingExchange.compareAndSet(token, null);
            log.warn("[modtcp4j] 传输层执行异常: {}", e.getMessage(), e);
            return CompletableFuture.failedFuture(new ModbusIOException("[modtcp4j] 传输层执行异常: " + e.getMessage(), e));
        }
        return received.handle((response, e) -> {
            pendingExchange.compareAndSet(token, null);
            if (e != null) {
                ModbusException cause = ModbusResult.unwrap(e);
                log.warn("[modtcp4j] 接收响应失败: {}", cause.getMessage());
                throw cause;
            }
            if (response == null || response.length == 0) {
                throw new ModbusIOException("[modtcp4j] 收到空响应");
            }
            return response;
        });
    }

    private <T> T await(CompletableFuture<T> future, long timeout, TimeUnit unit) {
        try {
            return future.get(timeout, unit);
        } catch (TimeoutException e) {
            log.warn("[modtcp4j] 等待响应超时 {}ms，关闭连接以结束未完成的请求", unit.toMillis(timeout));
            disconnect();
            throw new ModbusTimeoutException("[modtcp4j] 等待响应超时: " + unit.toMillis(timeout) + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModbusException("[modtcp4j] 等待响应被中断", e);
        } catch (ExecutionException e) {
            throw ModbusResult.unwrap(e);
        }
    }

    private static <T> void deliver(CompletableFuture<T> future, Consumer<ModbusResult<T>> onResult) {
        future.whenComplete((value, e) -> {
            try {
                onResult.accept(e == null ? ModbusResult.success(value) : ModbusResult.failure(e));
            } catch (RuntimeException ce) {
                log.warn("[modtcp4j] 结果回调执行失败: {}", ce.getMessage(), ce);
            }
        });
    }

    @Override
    public void close() {
        disconnect();
    }
}
