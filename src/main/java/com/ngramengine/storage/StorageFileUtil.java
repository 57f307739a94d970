package com.ngramengine.storage;

import com.ngramengine.config.Constants;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.CRC32;
import java.util.zip.CheckedOutputStream;

/**
 * 临时文件读写工具，封装文件头、字符串编码与 CRC32 页脚。
 *
 * 文件布局：magic(int) + version(short) + 记录区 + 记录数(long) + CRC32(int)。
 */
final class StorageFileUtil {
    private static final int TRAILER_BYTES = Long.BYTES + Integer.BYTES;

    private StorageFileUtil() {
    }

    /**
     * 写入 VarInt 长度前缀的 UTF-8 字符串。
     */
    static void writeString(OutputStream out, String value) throws IOException {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        VarIntCodec.writeVarInt(out, bytes.length);
        out.write(bytes);
    }

    /**
     * 读取 VarInt 长度前缀的 UTF-8 字符串。
     */
    static String readString(DataInputStream in) throws IOException {
        int length = VarIntCodec.readVarInt(in);
        byte[] bytes = new byte[length];
        in.readFully(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * 计算指定前缀字节区间的 CRC32。
     *
     * @param randomAccessFile 源文件
     * @param length 参与校验的字节长度
     * @return CRC32 无符号值
     * @throws IOException 读取失败时抛出
     */
    static long computeCrc32(RandomAccessFile randomAccessFile, long length) throws IOException {
        CRC32 crc32 = new CRC32();
        byte[] buffer = new byte[8 * 1024];
        long remainingBytes = length;
        randomAccessFile.seek(0L);
        while (remainingBytes > 0) {
            int chunkSize = (int) Math.min(buffer.length, remainingBytes);
            int readBytes = randomAccessFile.read(buffer, 0, chunkSize);
            if (readBytes < 0) {
                throw new EOFException("计算 CRC32 时遇到 EOF");
            }
            crc32.update(buffer, 0, readBytes);
            remainingBytes -= readBytes;
        }
        return crc32.getValue();
    }

    /**
     * 校验 CRC32 页脚并读取记录数。
     *
     * @param file 源文件
     * @return 记录区之后登记的记录数
     * @throws IOException CRC 不匹配或文件过短时抛出
     */
    static long verifyAndReadEntryCount(Path file) throws IOException {
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(file.toFile(), "r")) {
            long fileLength = randomAccessFile.length();
            if (fileLength < Integer.BYTES + Short.BYTES + TRAILER_BYTES) {
                throw new IOException("文件过短，缺少页脚: " + file.getFileName());
            }
            long dataLength = fileLength - Integer.BYTES;
            randomAccessFile.seek(dataLength);
            long expectedCrc32 = Integer.toUnsignedLong(randomAccessFile.readInt());
            long actualCrc32 = computeCrc32(randomAccessFile, dataLength);
            if (actualCrc32 != expectedCrc32) {
                throw new IOException("CRC32 校验失败: " + file.getFileName()
                    + ", expected=" + expectedCrc32 + ", actual=" + actualCrc32);
            }
            randomAccessFile.seek(fileLength - TRAILER_BYTES);
            long entryCount = randomAccessFile.readLong();
            if (entryCount < 0) {
                throw new IOException("记录数非法: " + entryCount + ", file=" + file.getFileName());
            }
            return entryCount;
        }
    }

    /**
     * 打开写入通道并写入文件头。
     */
    static ChecksummedOutput openOutput(Path file, int magic) throws IOException {
        return new ChecksummedOutput(file, magic);
    }

    /**
     * 校验整个文件后打开顺序读取通道，并验证文件头。
     */
    static ChecksummedInput openInput(Path file, int magic) throws IOException {
        long entryCount = verifyAndReadEntryCount(file);
        DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(file)));
        try {
            int actualMagic = in.readInt();
            if (actualMagic != magic) {
                throw new IOException("文件 magic 不匹配: " + file.getFileName());
            }
            short version = in.readShort();
            if (version != Constants.FORMAT_VERSION) {
                throw new IOException("文件版本不支持: " + version + ", file=" + file.getFileName());
            }
        } catch (IOException exception) {
            in.close();
            throw exception;
        }
        return new ChecksummedInput(in, entryCount);
    }

    /**
     * 带 CRC32 累计的写入通道，{@link #finish(long)} 写入页脚。
     */
    static final class ChecksummedOutput implements Closeable {
        private final OutputStream rawOutput;
        private final CheckedOutputStream checkedOutput;
        private final DataOutputStream dataOutput;

        private ChecksummedOutput(Path file, int magic) throws IOException {
            this.rawOutput = new BufferedOutputStream(Files.newOutputStream(file));
            this.checkedOutput = new CheckedOutputStream(rawOutput, new CRC32());
            this.dataOutput = new DataOutputStream(checkedOutput);
            try {
                dataOutput.writeInt(magic);
                dataOutput.writeShort(Constants.FORMAT_VERSION);
            } catch (IOException exception) {
                rawOutput.close();
                throw exception;
            }
        }

        DataOutputStream data() {
            return dataOutput;
        }

        void finish(long entryCount) throws IOException {
            dataOutput.writeLong(entryCount);
            dataOutput.flush();
            long crc32Value = checkedOutput.getChecksum().getValue();
            // 页脚本身不参与校验，直接写入底层流
            new DataOutputStream(rawOutput).writeInt((int) crc32Value);
            rawOutput.flush();
        }

        @Override
        public void close() throws IOException {
            rawOutput.close();
        }
    }

    /**
     * 已通过校验的顺序读取通道。
     */
    static final class ChecksummedInput implements Closeable {
        private final DataInputStream dataInput;
        private final long entryCount;

        private ChecksummedInput(DataInputStream dataInput, long entryCount) {
            this.dataInput = dataInput;
            this.entryCount = entryCount;
        }

        DataInputStream data() {
            return dataInput;
        }

        long entryCount() {
            return entryCount;
        }

        @Override
        public void close() throws IOException {
            dataInput.close();
        }
    }
}
