package com.ngramengine.storage;

import com.ngramengine.config.Constants;

import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Path;

/**
 * 溢写文件写入器，按到达顺序写入 (记录编号, n-gram 编号, n-gram 文本) 并在关闭时追加 CRC32。
 */
public final class SpillFileWriter implements AutoCloseable {
    private final StorageFileUtil.ChecksummedOutput output;
    private final Path file;
    private long rowCount;
    private boolean closed;

    /**
     * 创建溢写文件并写入文件头。
     *
     * @param file 目标文件
     * @throws IOException 初始化失败时抛出
     */
    public SpillFileWriter(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("溢写文件不能为空");
        }
        this.file = file;
        this.output = StorageFileUtil.openOutput(file, Constants.SPILL_MAGIC);
    }

    /**
     * 追加一行。
     */
    public void writeRow(long recordId, int ngramId, String words) throws IOException {
        ensureOpen();
        if (ngramId < 0) {
            throw new IllegalArgumentException("n-gram 编号不能为负数: recordId=" + recordId + ", ngramId=" + ngramId);
        }
        if (words == null) {
            throw new IllegalArgumentException("n-gram 文本不能为空");
        }
        DataOutputStream data = output.data();
        VarIntCodec.writeSignedVarLong(data, recordId);
        VarIntCodec.writeVarInt(data, ngramId);
        StorageFileUtil.writeString(data, words);
        rowCount++;
    }

    public long getRowCount() {
        return rowCount;
    }

    /**
     * 写入记录数与 CRC32 页脚。
     *
     * @throws IOException 关闭失败时抛出
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        try {
            output.finish(rowCount);
        } catch (IOException exception) {
            throw new IOException("关闭溢写文件失败: file=" + file.getFileName() + ", rowCount=" + rowCount, exception);
        } finally {
            output.close();
            closed = true;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("SpillFileWriter 已关闭");
        }
    }
}
