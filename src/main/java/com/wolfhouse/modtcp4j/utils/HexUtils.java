package com.wolfhouse.modtcp4j.utils;

/**
 * 十六进制相关工具
 *
 * @author Rylin Wolf
 */
public class HexUtils {
    private HexUtils() {
    }

    /**
     * 将字节数组格式化为以空格分隔的十六进制字符串，用于日志输出
     *
     * @param data 字节数组
     * @return 形如 "01 03 00 00" 的字符串
     */
    public static String toHex(byte[] data) {
        if (data == null) {
            return "null";
        }
        StringBuilder sb = new StringBuilder(data.length * 3);
        for (int i = 0; i < data.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(String.format("%02X", data[i] & 0xFF));
        }
        return sb.toString();
    }

    public static byte[] parseHexData(String text) {
        return parseHexData(text, "\\s+");
    }

    public static byte[] parseHexData(String text, String delimiter) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return new byte[0];
        }
        String[] parts = trimmed.split(delimiter);
        byte[]   data  = new byte[parts.length];
        for (int i = 0; i < parts.length; i++) {
            data[i] = (byte) Integer.parseInt(parts[i], 16);
        }
        return data;
    }
}
