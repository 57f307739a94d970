package com.ngramengine.storage;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * VarInt 变长整数编解码器
 *
 * 每字节 7 位有效数据，最高位为续接标志；临时文件中的记录编号、n-gram 编号与字符串长度都用它编码
 */
public final class VarIntCodec {

    private VarIntCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 写入非负 int
     *
     * @throws IllegalArgumentException value 为负数时抛出
     */
    public static void writeVarInt(OutputStream out, int value) throws IOException {
        if (value < 0) {
            throw new IllegalArgumentException("VarInt不支持负数: " + value);
        }
        writeUnsigned(out, value);
    }

    /**
     * 写入非负 long
     *
     * @throws IllegalArgumentException value 为负数时抛出
     */
    public static void writeVarLong(OutputStream out, long value) throws IOException {
        if (value < 0) {
            throw new IllegalArgumentException("VarLong不支持负数: " + value);
        }
        writeUnsigned(out, value);
    }

    /**
     * 以 ZigZag 方式写入任意 long，负数同样适用
     */
    public static void writeSignedVarLong(OutputStream out, long value) throws IOException {
        writeUnsigned(out, (value << 1) ^ (value >> 63));
    }

    /**
     * 读取 ZigZag 编码的 long
     */
    public static long readSignedVarLong(InputStream in) throws IOException {
        long encoded = readUnsigned(in, 64);
        return (encoded >>> 1) ^ -(encoded & 1);
    }

    /**
     * 读取 VarInt
     *
     * @throws EOFException 流在数值中途结束
     * @throws IOException 数值超过 32 位
     */
    public static int readVarInt(InputStream in) throws IOException {
        long value = readUnsigned(in, 32);
        return (int) value;
    }

    /**
     * 读取 VarLong
     */
    public static long readVarLong(InputStream in) throws IOException {
        return readUnsigned(in, 64);
    }

    /**
     * 计算 long 编码后的字节数
     */
    public static int varLongSize(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("VarLong不支持负数: " + value);
        }
        int size = 1;
        while ((value & ~0x7FL) != 0) {
            size++;
            value >>>= 7;
        }
        return size;
    }

    private static void writeUnsigned(OutputStream out, long value) throws IOException {
        // 还有后续字节时最高位置 1
        while ((value & ~0x7FL) != 0) {
            out.write((int) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        out.write((int) (value & 0x7F));
    }

    private static long readUnsigned(InputStream in, int maxBits) throws IOException {
        long result = 0;
        int shift = 0;
        while (shift < maxBits) {
            int b = in.read();
            if (b == -1) {
                throw new EOFException("读取 VarInt 时遇到 EOF");
            }
            result |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                if (maxBits == 32 && (result >>> 31) != 0) {
                    throw new IOException("VarInt超过32位范围");
                }
                return result;
            }
            shift += 7;
        }
        throw new IOException("VarInt超过" + maxBits + "位范围");
    }
}
