package com.ngramengine.table;

import java.util.List;
import java.util.OptionalLong;

/**
 * 基于结果库 message_authors 表的懒读取数据源，每次切片只查询对应区间。
 */
public final class MessageTableSource implements SliceableSource<MessageRecord> {
    private final NgramResultStore store;

    public MessageTableSource(NgramResultStore store) {
        if (store == null) {
            throw new IllegalArgumentException("结果库不能为空");
        }
        this.store = store;
    }

    @Override
    public OptionalLong count() {
        return OptionalLong.of(store.countMessages());
    }

    @Override
    public List<MessageRecord> slice(long offset, int length) {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("非法区间: offset=" + offset + ", length=" + length);
        }
        if (length == 0) {
            return List.of();
        }
        return store.readMessages(offset, length);
    }
}
