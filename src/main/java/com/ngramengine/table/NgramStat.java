package com.ngramengine.table;

/**
 * 出现次数大于 1 的 n-gram 汇总统计。
 */
public record NgramStat(int ngramId, int n, String words, long totalReps, long distinctPosters) {
}
