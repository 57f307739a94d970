package com.ngramengine.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * VarIntCodec 单元测试
 */
class CodecTest {

    @Test
    @DisplayName("VarInt边界值编码解码测试")
    void testVarIntBoundaryValues() throws IOException {
        int[] testValues = {0, 1, 127, 128, 16383, 16384, Integer.MAX_VALUE};

        for (int value : testValues) {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            VarIntCodec.writeVarInt(baos, value);

            ByteArrayInputStream bais = new ByteArrayInputStream(baos.toByteArray());
            assertEquals(value, VarIntCodec.readVarInt(bais), "VarInt编解码失败，原值: " + value);
            assertEquals(-1, bais.read(), "流应该有且仅有VarInt数据");
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {0L, 1L, 127L, 128L, 1L << 35, Long.MAX_VALUE})
    @DisplayName("VarLong编码长度与varLongSize一致")
    void testVarLongSize(long value) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        VarIntCodec.writeVarLong(baos, value);

        assertEquals(VarIntCodec.varLongSize(value), baos.size());
        assertEquals(value, VarIntCodec.readVarLong(new ByteArrayInputStream(baos.toByteArray())));
    }

    @ParameterizedTest
    @ValueSource(longs = {0L, -1L, 1L, -64L, 64L, Long.MIN_VALUE, Long.MAX_VALUE})
    @DisplayName("ZigZag编码支持负数且小绝对值只占一个字节")
    void testSignedVarLong(long value) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        VarIntCodec.writeSignedVarLong(baos, value);

        assertEquals(value, VarIntCodec.readSignedVarLong(new ByteArrayInputStream(baos.toByteArray())));
        if (value >= -64L && value <= 63L) {
            assertEquals(1, baos.size());
        }
    }

    @Test
    @DisplayName("负数应该抛出异常")
    void testNegativeValue() {
        assertThrows(IllegalArgumentException.class, () -> VarIntCodec.writeVarInt(new ByteArrayOutputStream(), -1));
        assertThrows(IllegalArgumentException.class, () -> VarIntCodec.writeVarLong(new ByteArrayOutputStream(), -1L));
    }

    @Test
    @DisplayName("数值中途截断应抛出EOFException")
    void testTruncatedValue() {
        byte[] truncated = {(byte) 0x80, (byte) 0x80};
        assertThrows(EOFException.class, () -> VarIntCodec.readVarInt(new ByteArrayInputStream(truncated)));
    }

    @Test
    @DisplayName("超过32位的VarInt应被拒绝")
    void testVarIntOverflow() throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        VarIntCodec.writeVarLong(baos, 1L << 33);

        assertThrows(IOException.class, () -> VarIntCodec.readVarInt(new ByteArrayInputStream(baos.toByteArray())));
    }
}
