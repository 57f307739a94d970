package com.ngramengine.storage;

import com.ngramengine.config.Constants;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 有序分区文件的顺序游标，任意时刻只在内存中保留一个当前值。
 */
public final class SortedRunReader implements AutoCloseable {
    private final StorageFileUtil.ChecksummedInput input;
    private final Path file;
    private long valuesRead;
    private String lastValue;
    private boolean closed;

    /**
     * 构造读取器并完成文件头与 CRC 校验。
     *
     * @param file 分区文件
     * @throws IOException 文件损坏或版本不兼容时抛出
     */
    public SortedRunReader(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("分区文件不能为空");
        }
        this.file = file;
        this.input = StorageFileUtil.openInput(file, Constants.SORTED_RUN_MAGIC);
    }

    /**
     * 读取下一个值。
     *
     * @return 下一个值，读完时返回 null
     * @throws IOException 读取失败或值序损坏时抛出
     */
    public String next() throws IOException {
        if (closed) {
            throw new IllegalStateException("SortedRunReader 已关闭: " + file.getFileName());
        }
        if (valuesRead >= input.entryCount()) {
            return null;
        }
        String value = StorageFileUtil.readString(input.data());
        if (lastValue != null && value.compareTo(lastValue) <= 0) {
            throw new IOException("分区值序损坏，未严格递增: " + file.getFileName());
        }
        valuesRead++;
        lastValue = value;
        return value;
    }

    public long valueCount() {
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
}
