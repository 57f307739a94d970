package com.ngramengine.ngram;

import com.ngramengine.table.SliceableSource;

/**
 * n-gram 生成策略的统一接口。
 *
 * 所有实现对同一输入产生相同的 (记录, n-gram) 序列，并把编号登记到调用方传入的同一个字典中。
 */
public interface NgramGenerator {

    /** 进度回调中生成阶段的步骤编号 */
    String PROGRESS_STEP = "generate_ngrams";

    /**
     * 策略名称，同时用作进度子步骤编号。
     */
    String name();

    /**
     * 生成全部 n-gram。
     *
     * @throws ResourceExhaustedException 资源不足且无法在本策略内恢复时抛出
     */
    GenerationResult generate(SliceableSource<TokenizedRecord> source, NgramParams params, NgramDictionary dictionary);
}
