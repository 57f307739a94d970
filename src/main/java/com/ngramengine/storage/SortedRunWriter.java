package com.ngramengine.storage;

import com.ngramengine.config.Constants;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 有序分区文件写入器，要求值按字典序严格递增写入（即分区内已去重）。
 */
public final class SortedRunWriter implements AutoCloseable {
    private final StorageFileUtil.ChecksummedOutput output;
    private final Path file;
    private long valueCount;
    private String lastValue;
    private boolean closed;

    /**
     * 创建分区文件并写入文件头。
     *
     * @param file 目标文件
     * @throws IOException 初始化失败时抛出
     */
    public SortedRunWriter(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("分区文件不能为空");
        }
        this.file = file;
        this.output = StorageFileUtil.openOutput(file, Constants.SORTED_RUN_MAGIC);
    }

    /**
     * 写入一个值，要求严格大于上一个值。
     */
    public void write(String value) throws IOException {
        ensureOpen();
        if (value == null) {
            throw new IllegalArgumentException("分区值不能为空");
        }
        if (lastValue != null && value.compareTo(lastValue) <= 0) {
            throw new IllegalArgumentException("分区值必须严格递增，last=" + lastValue + ", current=" + value);
        }
        StorageFileUtil.writeString(output.data(), value);
        valueCount++;
        lastValue = value;
    }

    public long getValueCount() {
        return valueCount;
    }

    /**
     * 回填值数量并写入 CRC32 页脚。
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        try {
            output.finish(valueCount);
        } catch (IOException exception) {
            throw new IOException("关闭分区写入器失败: file=" + file.getFileName() + ", valueCount=" + valueCount, exception);
        } finally {
            output.close();
            closed = true;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("SortedRunWriter 已关闭");
        }
    }
}
