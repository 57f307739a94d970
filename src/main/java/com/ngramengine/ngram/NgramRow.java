package com.ngramengine.ngram;

/**
 * 一次 n-gram 出现：所在记录、n-gram 编号与文本。
 */
public record NgramRow(long recordId, int ngramId, String words) {
}
