package com.ngramengine.ngram;

import java.util.List;

/**
 * n-gram 生成结果。
 *
 * @param rows 按记录、位置顺序排列的全部 n-gram 出现
 * @param windowCount 实际处理的窗口数（直接生成为 1）
 * @param recordsProcessed 处理的记录数
 */
public record GenerationResult(List<NgramRow> rows, int windowCount, long recordsProcessed) {
}
