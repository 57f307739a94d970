package com.ngramengine.table;

import java.util.List;
import java.util.OptionalLong;

/**
 * 内存列表数据源。
 */
public final class ListSource<T> implements SliceableSource<T> {
    private final List<T> rows;

    public ListSource(List<T> rows) {
        if (rows == null) {
            throw new IllegalArgumentException("rows 不能为空");
        }
        this.rows = rows;
    }

    @Override
    public OptionalLong count() {
        return OptionalLong.of(rows.size());
    }

    @Override
    public List<T> slice(long offset, int length) {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("非法区间: offset=" + offset + ", length=" + length);
        }
        if (offset >= rows.size()) {
            return List.of();
        }
        int from = (int) offset;
        int to = (int) Math.min(rows.size(), offset + length);
        return List.copyOf(rows.subList(from, to));
    }
}
