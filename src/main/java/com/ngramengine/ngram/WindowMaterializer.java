package com.ngramengine.ngram;

import com.ngramengine.table.SliceableSource;

import java.util.List;

/**
 * 读取 [offset, offset + size) 窗口并生成其中全部 n-gram。
 */
@FunctionalInterface
public interface WindowMaterializer {

    WindowOutcome materialize(SliceableSource<TokenizedRecord> source, long offset, int size,
                              NgramParams params, NgramDictionary dictionary);

    /**
     * 默认实现：在内存中生成；物化过程中的 {@link OutOfMemoryError} 转为资源错误结果。
     */
    static WindowMaterializer inMemory() {
        return (source, offset, size, params, dictionary) -> {
            try {
                List<TokenizedRecord> records = source.slice(offset, size);
                return WindowOutcome.success(NgramExtractor.extract(records, params, dictionary), records.size());
            } catch (OutOfMemoryError error) {
                return WindowOutcome.resourceError("物化窗口时内存不足: offset=" + offset + ", size=" + size);
            }
        };
    }
}
