package com.wolfhouse.modtcp4j.codec;

import com.wolfhouse.modtcp4j.enums.ErrorKind;
import com.wolfhouse.modtcp4j.enums.FramingMode;
import com.wolfhouse.modtcp4j.exception.ModbusFrameException;
import com.wolfhouse.modtcp4j.exception.ModbusSlaveException;
import com.wolfhouse.modtcp4j.utils.HexUtils;
import com.wolfhouse.modtcp4j.utils.ModbusProtocolUtils;
import org.junit.Assert;
import org.junit.Test;

/**
 * ModbusFrameCodec 响应校验与解析测试类
 *
 * @author Rylin Wolf
 */
public class ModbusFrameCodecResponseTest {
    ModbusFrameCodec tcp = new ModbusFrameCodec(FramingMode.TCP);
    ModbusFrameCodec rtu = new ModbusFrameCodec(FramingMode.RTU_OVER_TCP);

    /**
     * 按请求构造一个格式正确的 RTU 读取响应
     */
    private static byte[] rtuReadResponse(int unitId, int... values) {
        byte[] body = new byte[3 + values.length * 2];
        body[0] = (byte) unitId;
        body[1] = 0x03;
        body[2] = (byte) (values.length * 2);
        for (int i = 0; i < values.length; i++) {
            body[3 + i * 2] = (byte) (values[i] >> 8);
            body[4 + i * 2] = (byte) values[i];
        }
        return ModbusProtocolUtils.wrapRtuFrame(body);
    }

    private static ErrorKind kindOf(Runnable action) {
        try {
            action.run();
        } catch (ModbusFrameException e) {
            return e.getErrorKind();
        }
        Assert.fail("应该抛出 ModbusFrameException");
        return null;
    }

    @Test
    public void testTcpReadRoundTrip() {
        byte[] request = tcp.buildReadRequest(1, 100, 3);
        Assert.assertEquals(12, request.length);
        byte[] response = HexUtils.parseHexData("00 00 00 00 00 09 01 03 06 00 01 80 00 FF FF");
        Assert.assertArrayEquals(new int[]{1, 0x8000, 0xFFFF}, tcp.decodeReadResponse(response));
    }

    @Test
    public void testRtuReadRoundTrip() {
        byte[] request = rtu.buildReadRequest(1, 0, 4);
        Assert.assertEquals(8, request.length);
        int[] values = rtu.decodeReadResponse(rtuReadResponse(1, 10, 20, 30, 0xABCD));
        Assert.assertArrayEquals(new int[]{10, 20, 30, 0xABCD}, values);
    }

    @Test
    public void testZeroLengthDataRegionYieldsEmptyResult() {
        Assert.assertEquals(0, tcp.decodeReadResponse(HexUtils.parseHexData("00 00 00 00 00 03 01 03 00")).length);
        Assert.assertEquals(0, rtu.decodeReadResponse(rtuReadResponse(1)).length);
    }

    @Test
    public void testTcpExtraTrailingBytesAreIgnored() {
        byte[] response = HexUtils.parseHexData("00 00 00 00 00 05 01 03 02 00 07 EE EE");
        Assert.assertArrayEquals(new int[]{7}, tcp.decodeReadResponse(response));
    }

    @Test
    public void testTcpShortResponseIsMalformed() {
        Assert.assertEquals(ErrorKind.MALFORMED, kindOf(() -> tcp.decodeReadResponse(HexUtils.parseHexData("00 00 00 00 00 02 01 03"))));
        // 声明 4 字节数据，实际只有 2 字节
        Assert.assertEquals(ErrorKind.MALFORMED, kindOf(() -> tcp.decodeReadResponse(HexUtils.parseHexData("00 00 00 00 00 05 01 03 04 00 01"))));
    }

    @Test
    public void testOddByteCountIsMalformed() {
        Assert.assertEquals(ErrorKind.MALFORMED, kindOf(() -> tcp.decodeReadResponse(HexUtils.parseHexData("00 00 00 00 00 06 01 03 03 00 01 02"))));

        // CRC 正确，但字节数为奇数
        byte[] oddRtu = ModbusProtocolUtils.wrapRtuFrame(HexUtils.parseHexData("01 03 03 00 01 02"));
        Assert.assertTrue(ModbusProtocolUtils.hasValidCrc(oddRtu));
        Assert.assertEquals(ErrorKind.MALFORMED, kindOf(() -> rtu.decodeReadResponse(oddRtu)));
    }

    @Test
    public void testRtuCrcMismatch() {
        byte[] response = rtuReadResponse(1, 0x1234);
        response[3] ^= 0x01;
        Assert.assertEquals(ErrorKind.CRC_MISMATCH, kindOf(() -> rtu.decodeReadResponse(response)));
    }

    @Test
    public void testRtuShortResponseIsMalformed() {
        Assert.assertEquals(ErrorKind.MALFORMED, kindOf(() -> rtu.decodeReadResponse(HexUtils.parseHexData("01 03 00 20"))));
        // CRC 正确，但声明的数据区超过报文长度
        byte[] truncated = ModbusProtocolUtils.wrapRtuFrame(HexUtils.parseHexData("01 03 04 00 01"));
        Assert.assertEquals(ErrorKind.MALFORMED, kindOf(() -> rtu.decodeReadResponse(truncated)));
    }

    @Test
    public void testRtuExceptionResponse() {
        byte[] response = ModbusProtocolUtils.wrapRtuFrame(HexUtils.parseHexData("01 83 02"));
        try {
            rtu.decodeReadResponse(response);
            Assert.fail("异常响应不应被解析为寄存器");
        } catch (ModbusSlaveException e) {
            Assert.assertEquals(ErrorKind.EXCEPTION_RESPONSE, e.getErrorKind());
            Assert.assertEquals(0x03, e.getFunctionCode());
            Assert.assertEquals(0x02, e.getExceptionCode());
        }
    }

    @Test
    public void testRtuExceptionFlagWinsOverConsistentByteCount() {
        // 功能码带异常标志，字节数 2 与数据区、CRC 都一致
        byte[] response = ModbusProtocolUtils.wrapRtuFrame(HexUtils.parseHexData("01 83 02 00 01"));
        Assert.assertEquals(ErrorKind.EXCEPTION_RESPONSE, kindOf(() -> rtu.decodeReadResponse(response)));
    }

    @Test
    public void testTcpExceptionResponse() {
        byte[] response = HexUtils.parseHexData("00 00 00 00 00 03 01 83 02");
        Assert.assertEquals(ErrorKind.EXCEPTION_RESPONSE, kindOf(() -> tcp.decodeReadResponse(response)));
    }

    @Test
    public void testTcpWriteAck() {
        byte[] ack = HexUtils.parseHexData("00 00 00 00 00 06 01 10 00 0A 00 02");
        tcp.verifyWriteResponse(ack);

        for (int value = 0; value < 256; value++) {
            if (value == 0x10) {
                continue;
            }
            byte[] changed = ack.clone();
            changed[7] = (byte) value;
            ErrorKind kind = kindOf(() -> tcp.verifyWriteResponse(changed));
            Assert.assertNotNull(kind);
        }
    }

    @Test
    public void testTcpWriteAckWithWrongFunctionIsAckMismatch() {
        byte[] ack = HexUtils.parseHexData("00 00 00 00 00 06 01 06 00 0A 00 02");
        Assert.assertEquals(ErrorKind.ACK_MISMATCH, kindOf(() -> tcp.verifyWriteResponse(ack)));
    }

    @Test
    public void testTcpWriteAckTooShort() {
        Assert.assertEquals(ErrorKind.MALFORMED, kindOf(() -> tcp.verifyWriteResponse(HexUtils.parseHexData("00 00 00 00 00 05 01 10 00 0A 00"))));
        Assert.assertEquals(ErrorKind.EXCEPTION_RESPONSE, kindOf(() -> tcp.verifyWriteResponse(HexUtils.parseHexData("00 00 00 00 00 03 01 90 02"))));
    }

    @Test
    public void testRtuWriteAck() {
        byte[] ack = ModbusProtocolUtils.wrapRtuFrame(HexUtils.parseHexData("01 10 00 0A 00 02"));
        rtu.verifyWriteResponse(ack);

        // 任意一个 CRC 之前的字节翻转都会导致失败
        for (int i = 0; i < ack.length - 2; i++) {
            byte[] flipped = ack.clone();
            flipped[i] ^= 0x01;
            Assert.assertEquals("offset " + i, ErrorKind.CRC_MISMATCH, kindOf(() -> rtu.verifyWriteResponse(flipped)));
        }
    }

    @Test
    public void testRtuWriteAckTooShort() {
        byte[] exception = ModbusProtocolUtils.wrapRtuFrame(HexUtils.parseHexData("01 90 04"));
        Assert.assertEquals(ErrorKind.EXCEPTION_RESPONSE, kindOf(() -> rtu.verifyWriteResponse(exception)));
        Assert.assertEquals(ErrorKind.MALFORMED, kindOf(() -> rtu.verifyWriteResponse(HexUtils.parseHexData("01 10 00 0A 00 02 00"))));
    }
}
