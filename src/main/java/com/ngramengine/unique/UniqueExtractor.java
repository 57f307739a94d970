package com.ngramengine.unique;

import com.ngramengine.table.SliceableSource;

import java.util.List;

/**
 * 唯一值提取：返回去重后按字典序升序排列的值（不保留输入顺序）。
 */
public interface UniqueExtractor {

    /** 进度回调中去重阶段的步骤编号 */
    String PROGRESS_STEP = "extract_unique";

    String name();

    List<String> extractUnique(SliceableSource<String> values);
}
