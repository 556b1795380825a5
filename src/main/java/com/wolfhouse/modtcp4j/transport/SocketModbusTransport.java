package com.wolfhouse.modtcp4j.transport;

import com.wolfhouse.modtcp4j.enums.ConnectionState;
import com.wolfhouse.modtcp4j.event.ConnectionStateListener;
import com.wolfhouse.modtcp4j.exception.ModbusException;
import com.wolfhouse.modtcp4j.exception.ModbusIOException;
import com.wolfhouse.modtcp4j.utils.HexUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于 {@link Socket} 的传输层实现。
 * <p>
 * 连接与接收都在 I/O 线程中执行，接收不设读超时，等待期限由调用方决定。一个实例只对应一次连接，
 * 关闭后不能再次使用。
 *
 * @author Rylin Wolf
 */
@Slf4j
public class SocketModbusTransport implements ModbusTransport {
    /**
     * 默认连接超时时间 3000ms
     */
    public static final int DEFAULT_CONNECT_TIMEOUT = 3000;

    /**
     * 连接超时时间（毫秒）
     */
    private final int connectTimeout;

    /**
     * 连接与接收使用的 I/O 线程池
     */
    private final ExecutorService ioExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "modtcp4j-io");
        t.setDaemon(true);
        return t;
    });

    /** 是否已被主动关闭 */
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile Socket       socket;
    private volatile InputStream  inputStream;
    private volatile OutputStream outputStream;

    private ConnectionStateListener listener;
    private ConnectionState         state;
    private String                  remote;

    public SocketModbusTransport() {
        this(DEFAULT_CONNECT_TIMEOUT);
    }

    /**
     * 构造函数
     *
     * @param connectTimeout 连接超时时间（毫秒），0 表示不限制
     */
    public SocketModbusTransport(int connectTimeout) {
        if (connectTimeout < 0) {
            throw new IllegalArgumentException("[modtcp4j] 连接超时时间不能为负数: " + connectTimeout);
        }
        this.connectTimeout = connectTimeout;
    }

    @Override
    public void connect(String host, int port, ConnectionStateListener listener) throws ModbusException {
        if (closed.get()) {
            throw new ModbusIOException("[modtcp4j] 传输层已关闭，不能再次连接");
        }
        synchronized (this) {
            if (this.listener != null) {
                throw new ModbusException("[modtcp4j] 传输层已发起过连接: " + remote);
            }
            this.listener = listener == null ? s -> {} : listener;
            this.remote   = host + ":" + port;
        }
        transition(ConnectionState.PREPARING);
        try {
            ioExecutor.execute(() -> doConnect(host, port));
        } catch (RejectedExecutionException e) {
            transition(ConnectionState.FAILED);
            throw new ModbusIOException("[modtcp4j] 无法启动连接线程: " + remote, e);
        }
    }

    private void doConnect(String host, int port) {
        log.info("[modtcp4j] 正在连接: {}", remote);
        Socket s = new Socket();
        // 先登记 socket，连接过程中调用 close() 也能中断连接
        this.socket = s;
        try {
            if (closed.get()) {
                s.close();
                return;
            }
            s.connect(new InetSocketAddress(host, port), connectTimeout);
            s.setTcpNoDelay(true);
            this.inputStream  = s.getInputStream();
            this.outputStream = s.getOutputStream();
            if (closed.get()) {
                s.close();
                return;
            }
        } catch (IOException e) {
            try {
                s.close();
            } catch (IOException ce) {
                e.addSuppressed(ce);
            }
            if (!closed.get()) {
                log.warn("[modtcp4j] 连接失败: {}, 错误: {}", remote, e.getMessage());
                transition(ConnectionState.FAILED);
            }
            return;
        }
        log.info("[modtcp4j] 连接成功: {}", remote);
        transition(ConnectionState.READY);
    }

    @Override
    public void send(byte[] frame) throws ModbusIOException {
        OutputStream out = this.outputStream;
        if (!isConnected() || out == null) {
            throw new ModbusIOException("[modtcp4j] 设备未连接");
        }
        if (log.isDebugEnabled()) {
            log.debug("[modtcp4j] [{}] 发送请求: {}", remote, HexUtils.toHex(frame));
        }
        try {
            synchronized (out) {
                out.write(frame);
                out.flush();
            }
        } catch (IOException e) {
            throw new ModbusIOException("[modtcp4j] 发送失败: " + e.getMessage(), e);
        }
    }

    @Override
    public CompletableFuture<byte[]> receive(int minLength, int maxLength) {
        if (minLength < 1 || maxLength < minLength) {
            throw new IllegalArgumentException("[modtcp4j] 接收长度范围非法: [%d, %d]".formatted(minLength, maxLength));
        }
        InputStream in = this.inputStream;
        if (!isConnected() || in == null) {
            return CompletableFuture.failedFuture(new ModbusIOException("[modtcp4j] 设备未连接"));
        }
        try {
            return CompletableFuture.supplyAsync(() -> readAtLeast(in, minLength, maxLength), ioExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new ModbusIOException("[modtcp4j] 传输层已关闭", e));
        }
    }

    /**
     * 阻塞读取，直到至少读到 minLength 字节，最多 maxLength 字节
     */
    private byte[] readAtLeast(InputStream in, int minLength, int maxLength) {
        byte[] buffer    = new byte[maxLength];
        int    totalRead = 0;
        try {
            while (totalRead < minLength) {
                int read = in.read(buffer, totalRead, maxLength - totalRead);
                if (read == -1) {
                    onPeerClosed();
                    throw new ModbusIOException("[modtcp4j] 连接已关闭，读取数据失败");
                }
                totalRead += read;
            }
        } catch (IOException e) {
            if (closed.get()) {
                throw new ModbusIOException("[modtcp4j] 连接已被关闭，接收中止", e);
            }
            throw new ModbusIOException("[modtcp4j] 接收失败: " + e.getMessage(), e);
        }
        byte[] response = Arrays.copyOf(buffer, totalRead);
        if (log.isDebugEnabled()) {
            log.debug("[modtcp4j] [{}] 收到响应: {}", remote, HexUtils.toHex(response));
        }
        return response;
    }

    private void onPeerClosed() {
        if (closed.get()) {
            return;
        }
        log.warn("[modtcp4j] 对端已断开连接: {}", remote);
        Socket s = this.socket;
        try {
            if (s != null) {
                s.close();
            }
        } catch (IOException e) {
            log.warn("[modtcp4j] 关闭 Socket 异常: {}", e.getMessage());
        }
        transition(ConnectionState.FAILED);
    }

    @Override
    public boolean isConnected() {
        Socket s = this.socket;
        return !closed.get() && s != null && s.isConnected() && !s.isClosed();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("[modtcp4j] 断开连接: {}", remote);
        ModbusIOException firstException = null;
        Socket            s              = this.socket;
        try {
            if (s != null) {
                s.close();
            }
        } catch (IOException e) {
            firstException = new ModbusIOException("[modtcp4j] 关闭 Socket 异常: " + e.getMessage(), e);
        }
        socket       = null;
        inputStream  = null;
        outputStream = null;
        ioExecutor.shutdown();

        boolean started;
        synchronized (this) {
            started = listener != null;
        }
        if (started) {
            transition(ConnectionState.CANCELLED);
        }
        if (firstException != null) {
            throw firstException;
        }
    }

    /**
     * 切换连接状态并通知监听器，相同状态不重复通知
     *
     * @param next 新状态
     */
    private synchronized void transition(ConnectionState next) {
        if (state == next) {
            return;
        }
        state = next;
        log.debug("[modtcp4j] [{}] 连接状态: {}", remote, next);
        try {
            listener.onStateChange(next);
        } catch (RuntimeException e) {
            log.warn("[modtcp4j] 连接状态监听器执行失败: {}", e.getMessage(), e);
        }
    }
}
