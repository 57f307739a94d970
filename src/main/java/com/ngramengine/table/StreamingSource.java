package com.ngramengine.table;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * 总量未知的流式数据源。
 *
 * 顺序读取时只前进底层迭代器；请求的区间早于当前位置时重新打开迭代器并跳过已读部分。
 */
public final class StreamingSource<T> implements SliceableSource<T>, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(StreamingSource.class);

    private final Supplier<? extends Iterator<T>> opener;
    private Iterator<T> iterator;
    private long position;

    public StreamingSource(Supplier<? extends Iterator<T>> opener) {
        if (opener == null) {
            throw new IllegalArgumentException("opener 不能为空");
        }
        this.opener = opener;
    }

    @Override
    public OptionalLong count() {
        return OptionalLong.empty();
    }

    @Override
    public List<T> slice(long offset, int length) {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("非法区间: offset=" + offset + ", length=" + length);
        }
        if (iterator == null || offset < position) {
            reopen();
        }
        while (position < offset && iterator.hasNext()) {
            iterator.next();
            position++;
        }
        List<T> rows = new ArrayList<>(Math.min(length, 1024));
        while (rows.size() < length && iterator.hasNext()) {
            rows.add(iterator.next());
            position++;
        }
        return rows;
    }

    @Override
    public void close() {
        closeIterator();
        iterator = null;
    }

    private void reopen() {
        closeIterator();
        iterator = opener.get();
        position = 0;
    }

    private void closeIterator() {
        if (iterator instanceof AutoCloseable) {
            try {
                ((AutoCloseable) iterator).close();
            } catch (Exception exception) {
                logger.warn("关闭流式数据源失败", exception);
            }
        }
    }
}
