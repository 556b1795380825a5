package com.wolfhouse.modtcp4j.utils;

/**
 * 寄存器值与大端字节序之间的转换
 *
 * @author Rylin Wolf
 */
public class RegisterUtils {
    private RegisterUtils() {
    }

    /**
     * 将寄存器值按高字节在前的顺序写入字节数组
     *
     * @param values 寄存器值，每个值取低 16 位
     * @return 长度为 2 × values.length 的字节数组
     */
    public static byte[] toBytes(int[] values) {
        byte[] data = new byte[values.length * 2];
        for (int i = 0; i < values.length; i++) {
            data[i * 2]     = (byte) ((values[i] >> 8) & 0xFF);
            data[i * 2 + 1] = (byte) (values[i] & 0xFF);
        }
        return data;
    }

    /**
     * 按两字节一组读取无符号寄存器值。末尾落单的字节会被丢弃
     *
     * @param data 字节数组
     * @param off  数据区起始偏移
     * @param len  数据区长度
     * @return 寄存器值，按地址升序
     */
    public static int[] fromBytes(byte[] data, int off, int len) {
        int[] values = new int[len / 2];
        for (int i = 0; i < values.length; i++) {
            int pos = off + i * 2;
            values[i] = ((data[pos] & 0xFF) << 8) | (data[pos + 1] & 0xFF);
        }
        return values;
    }
}
