package com.ngramengine.pipeline;

/**
 * 唯一 n-gram 提取策略。
 */
public enum DedupStrategy {
    IN_MEMORY,
    EXTERNAL_SORT
}
