package com.wolfhouse.modtcp4j.utils;

import com.wolfhouse.modtcp4j.enums.FramingMode;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;

/**
 * ModbusTcpSimulator 测试类，直接通过 Socket 发送原始报文
 *
 * @author Rylin Wolf
 */
public class ModbusTcpSimulatorTest {
    ModbusTcpSimulator simulator;
    Socket             socket;

    @Before
    public void setUp() throws IOException {
        simulator = new ModbusTcpSimulator(0, FramingMode.TCP);
        simulator.start();
        socket = new Socket("127.0.0.1", simulator.getLocalPort());
        socket.setSoTimeout(5000);
    }

    @After
    public void tearDown() throws IOException {
        socket.close();
        simulator.stop();
    }

    private byte[] exchange(String request, int responseLength) throws IOException {
        OutputStream os = socket.getOutputStream();
        os.write(HexUtils.parseHexData(request));
        os.flush();
        byte[] response = new byte[responseLength];
        new DataInputStream(socket.getInputStream()).readFully(response);
        return response;
    }

    @Test
    public void testReadQuantityAboveDeviceLimitIsIllegalDataValue() throws IOException {
        // 读取 200 个寄存器
        byte[] response = exchange("00 00 00 00 00 06 01 03 00 00 00 C8", 9);
        Assert.assertArrayEquals(HexUtils.parseHexData("00 00 00 00 00 03 01 83 03"), response);
    }

    @Test
    public void testReadAtDeviceLimitIsAnswered() throws IOException {
        simulator.setRegisters(1, 124, 0x1234);
        byte[] response = exchange("00 00 00 00 00 06 01 03 00 00 00 7D", 9 + 250);
        Assert.assertEquals(0x03, response[7]);
        Assert.assertEquals(250, response[8] & 0xFF);
        Assert.assertEquals(0x12, response[257]);
        Assert.assertEquals(0x34, response[258]);
    }
}
