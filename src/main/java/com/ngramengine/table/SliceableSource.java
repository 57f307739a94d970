package com.ngramengine.table;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.function.Function;

/**
 * 有序、可按区间懒读取的数据源。
 *
 * @param <T> 行类型
 */
public interface SliceableSource<T> {

    /**
     * 不物化数据的前提下返回总行数；未知（流式来源）时为空。
     */
    OptionalLong count();

    /**
     * 读取 [offset, offset + length) 区间的行；越过末尾时返回更短或空的列表。
     */
    List<T> slice(long offset, int length);

    /**
     * 懒投影：只在读取区间时才对行应用映射。
     */
    default <R> SliceableSource<R> select(Function<? super T, ? extends R> projection) {
        SliceableSource<T> upstream = this;
        return new SliceableSource<>() {
            @Override
            public OptionalLong count() {
                return upstream.count();
            }

            @Override
            public List<R> slice(long offset, int length) {
                List<T> rows = upstream.slice(offset, length);
                List<R> projected = new ArrayList<>(rows.size());
                for (T row : rows) {
                    projected.add(projection.apply(row));
                }
                return projected;
            }
        };
    }
}
