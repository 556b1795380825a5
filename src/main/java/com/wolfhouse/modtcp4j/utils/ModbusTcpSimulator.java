package com.wolfhouse.modtcp4j.utils;

import com.wolfhouse.modtcp4j.enums.FramingMode;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

import static com.wolfhouse.modtcp4j.utils.ModbusProtocolUtils.*;

/**
 * Modbus 设备模拟器，用于测试目的。
 * <p>
 * 该模拟器会启动一个 ServerSocket 监听指定端口，按照给定的帧格式应答读保持寄存器（0x03）与
 * 写多个保持寄存器（0x10）请求。寄存器按从站 ID 分表保存，未写入过的寄存器值为 0。
 * 不支持的功能码返回异常码 0x01，地址越界返回异常码 0x02，读取数量超过 125 返回异常码 0x03。
 *
 * @author Rylin Wolf
 */
@Slf4j
public class ModbusTcpSimulator implements AutoCloseable {
    /** 非法功能码 */
    public static final int EX_ILLEGAL_FUNCTION      = 0x01;
    /** 非法数据地址 */
    public static final int EX_ILLEGAL_DATA_ADDRESS  = 0x02;
    /** 非法数据值 */
    public static final int EX_ILLEGAL_DATA_VALUE    = 0x03;
    /** 设备单次可读的最大寄存器数量 */
    public static final int MAX_DEVICE_READ_QUANTITY = 125;

    private final int                                  port;
    private final FramingMode                          framingMode;
    private final ExecutorService                      executorService;
    private final AtomicBoolean                        running   = new AtomicBoolean(false);
    /** 寄存器表, 从站 ID - (寄存器地址 - 寄存器值) */
    private final Map<Integer, Map<Integer, Integer>> registers = new ConcurrentHashMap<>();
    private       ServerSocket                         serverSocket;

    /**
     * 响应拦截器，可以在响应发出前篡改报文，返回 null 表示不响应
     */
    @Setter
    private volatile UnaryOperator<byte[]> responseInterceptor;

    /**
     * 静默模式下只接收请求，从不响应
     */
    @Setter
    @Getter
    private volatile boolean silent;

    /**
     * 构造函数
     *
     * @param port        监听端口，0 表示由系统分配
     * @param framingMode 帧格式
     */
    public ModbusTcpSimulator(int port, FramingMode framingMode) {
        this.port            = port;
        this.framingMode     = framingMode;
        this.executorService = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "modtcp4j-simulator");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 启动模拟器
     *
     * @throws IOException 如果无法启动服务器
     */
    public void start() throws IOException {
        if (running.compareAndSet(false, true)) {
            serverSocket = new ServerSocket(port);
            log.info("[modtcp4j] Modbus {} 模拟器已启动，监听端口: {}", framingMode, getLocalPort());

            executorService.execute(() -> {
                while (running.get()) {
                    try {
                        Socket clientSocket = serverSocket.accept();
                        executorService.execute(() -> handleClient(clientSocket));
                    } catch (IOException e) {
                        if (running.get()) {
                            log.warn("[modtcp4j] 模拟器接受连接异常: {}", e.getMessage());
                        }
                    }
                }
            });
        }
    }

    /**
     * 获取实际监听的端口
     *
     * @return 端口号
     */
    public int getLocalPort() {
        return serverSocket == null ? port : serverSocket.getLocalPort();
    }

    /**
     * 停止模拟器
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            try {
                if (serverSocket != null) {
                    serverSocket.close();
                }
            } catch (IOException e) {
                log.warn("[modtcp4j] 关闭模拟器 ServerSocket 异常: {}", e.getMessage());
            }
            executorService.shutdownNow();
            log.info("[modtcp4j] Modbus 模拟器已停止");
        }
    }

    /**
     * 预置寄存器值
     *
     * @param unitId  从站 ID
     * @param address 起始地址
     * @param values  寄存器值
     */
    public void setRegisters(int unitId, int address, int... values) {
        Map<Integer, Integer> table = registers.computeIfAbsent(unitId, k -> new ConcurrentHashMap<>());
        for (int i = 0; i < values.length; i++) {
            table.put(address + i, values[i] & 0xFFFF);
        }
    }

    /**
     * 读取寄存器当前值
     *
     * @param unitId  从站 ID
     * @param address 寄存器地址
     * @return 寄存器值，未写入过为 0
     */
    public int getRegister(int unitId, int address) {
        Map<Integer, Integer> table = registers.get(unitId);
        return table == null ? 0 : table.getOrDefault(address, 0);
    }

    /**
     * 清除所有寄存器
     */
    public void clearRegisters() {
        registers.clear();
    }

    /**
     * 处理客户端连接
     *
     * @param socket 客户端 Socket
     */
    private void handleClient(Socket socket) {
        try (socket; InputStream is = socket.getInputStream();
             OutputStream os = socket.getOutputStream()) {
            byte[] buffer = new byte[MAX_RESPONSE_LENGTH + 16];
            while (running.get()) {
                int read = is.read(buffer);
                if (read == -1) {
                    break;
                }
                byte[] request = Arrays.copyOf(buffer, read);
                log.debug("[{}] 收到请求: {}", getLocalPort(), HexUtils.toHex(request));
                if (silent) {
                    continue;
                }

                byte[] response = framingMode == FramingMode.TCP ? handleTcpRequest(request) : handleRtuRequest(request);
                UnaryOperator<byte[]> interceptor = responseInterceptor;
                if (response != null && interceptor != null) {
                    response = interceptor.apply(response);
                }
                if (response == null) {
                    log.warn("[{}] 响应为空，可能是请求有误，跳过处理", getLocalPort());
                    continue;
                }
                os.write(response);
                os.flush();
                log.debug("[{}] 发送响应: {}", getLocalPort(), HexUtils.toHex(response));
            }
        } catch (IOException e) {
            if (running.get()) {
                log.info("[modtcp4j] 模拟器处理客户端连接异常: {}", e.getMessage());
            }
        }
    }

    private byte[] handleTcpRequest(byte[] request) {
        // MBAP(6) + 从站 ID + 功能码
        if (request.length < MBAP_PREFIX_LENGTH + 2) {
            return null;
        }
        byte[] body         = Arrays.copyOfRange(request, MBAP_PREFIX_LENGTH, request.length);
        byte[] responseBody = handleBody(body);
        byte[] response     = wrapTcpFrame(responseBody);
        // 回显事务标识与协议标识
        System.arraycopy(request, 0, response, 0, 4);
        return response;
    }

    private byte[] handleRtuRequest(byte[] request) {
        // 从站 ID + 功能码 + CRC(2)
        if (request.length < 4) {
            return null;
        }
        if (!hasValidCrc(request)) {
            log.warn("[modtcp4j] 模拟器收到 CRC 校验错误的报文");
            return null;
        }
        byte[] body = Arrays.copyOf(request, request.length - 2);
        return wrapRtuFrame(handleBody(body));
    }

    /**
     * 处理报文主体（从站 ID 开始），返回响应主体
     */
    private byte[] handleBody(byte[] body) {
        int unitId       = body[0] & 0xFF;
        int functionCode = body[1] & 0xFF;
        if (body.length < 6) {
            return exceptionBody(unitId, functionCode, EX_ILLEGAL_DATA_VALUE);
        }
        int address  = ((body[2] & 0xFF) << 8) | (body[3] & 0xFF);
        int quantity = ((body[4] & 0xFF) << 8) | (body[5] & 0xFF);
        // 数量为 0 时仍按空数据应答
        if (functionCode == FUNC_READ_HOLDING_REGISTERS && quantity > MAX_DEVICE_READ_QUANTITY) {
            return exceptionBody(unitId, functionCode, EX_ILLEGAL_DATA_VALUE);
        }
        if (address + quantity > 0x10000) {
            return exceptionBody(unitId, functionCode, EX_ILLEGAL_DATA_ADDRESS);
        }
        return switch (functionCode) {
            case FUNC_READ_HOLDING_REGISTERS -> readBody(unitId, address, quantity);
            case FUNC_WRITE_MULTIPLE_REGISTERS -> writeBody(body, unitId, address, quantity);
            default -> exceptionBody(unitId, functionCode, EX_ILLEGAL_FUNCTION);
        };
    }

    private byte[] readBody(int unitId, int address, int quantity) {
        int[] values = new int[quantity];
        for (int i = 0; i < quantity; i++) {
            values[i] = getRegister(unitId, address + i);
        }
        byte[] data     = RegisterUtils.toBytes(values);
        byte[] response = new byte[3 + data.length];
        response[0] = (byte) unitId;
        response[1] = (byte) FUNC_READ_HOLDING_REGISTERS;
        response[2] = (byte) data.length;
        System.arraycopy(data, 0, response, 3, data.length);
        return response;
    }

    private byte[] writeBody(byte[] body, int unitId, int address, int quantity) {
        int byteCount = body.length > 6 ? body[6] & 0xFF : -1;
        if (quantity == 0 || byteCount != quantity * 2 || body.length < 7 + byteCount) {
            return exceptionBody(unitId, FUNC_WRITE_MULTIPLE_REGISTERS, EX_ILLEGAL_DATA_VALUE);
        }
        setRegisters(unitId, address, RegisterUtils.fromBytes(body, 7, byteCount));
        // 回显从站 ID、功能码、起始地址与数量
        return Arrays.copyOf(body, 6);
    }

    private static byte[] exceptionBody(int unitId, int functionCode, int exceptionCode) {
        return new byte[]{(byte) unitId, (byte) (functionCode | EXCEPTION_FLAG), (byte) exceptionCode};
    }

    @Override
    public void close() {
        this.stop();
    }
}
