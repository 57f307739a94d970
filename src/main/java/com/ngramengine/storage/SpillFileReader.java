package com.ngramengine.storage;

import com.ngramengine.config.Constants;

import java.io.DataInputStream;
import java.io.IOException;
import java.nio.file.Path;

/**
 * 溢写文件顺序读取器。
 *
 * 打开时先完成整文件 CRC 校验，之后以游标方式逐行读取：{@link #advance()} 返回 true 时当前行可用。
 */
public final class SpillFileReader implements AutoCloseable {
    private final StorageFileUtil.ChecksummedInput input;
    private final Path file;
    private long rowsRead;
    private long recordId;
    private int ngramId;
    private String words;
    private boolean closed;

    /**
     * 构造读取器并完成文件头与 CRC 校验。
     *
     * @param file 溢写文件
     * @throws IOException 文件损坏或版本不兼容时抛出
     */
    public SpillFileReader(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("溢写文件不能为空");
        }
        this.file = file;
        this.input = StorageFileUtil.openInput(file, Constants.SPILL_MAGIC);
    }

    /**
     * 移动到下一行。
     *
     * @return 还有数据时返回 true
     * @throws IOException 读取或解码失败时抛出
     */
    public boolean advance() throws IOException {
        ensureOpen();
        if (rowsRead >= input.entryCount()) {
            return false;
        }
        DataInputStream data = input.data();
        recordId = VarIntCodec.readSignedVarLong(data);
        ngramId = VarIntCodec.readVarInt(data);
        words = StorageFileUtil.readString(data);
        rowsRead++;
        return true;
    }

    public long recordId() {
        return recordId;
    }

    public int ngramId() {
        return ngramId;
    }

    public String words() {
        return words;
    }

    /**
     * 文件登记的总行数。
     */
    public long rowCount() {
        return input.entryCount();
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        input.close();
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("SpillFileReader 已关闭: " + file.getFileName());
        }
    }
}
