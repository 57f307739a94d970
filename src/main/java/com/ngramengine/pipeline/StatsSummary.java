package com.ngramengine.pipeline;

/**
 * 统计分析结果。
 *
 * @param statsRows ngram_stats 行数
 * @param fullReportRows ngram_full 行数
 * @param chunkCount 生成完整报告使用的批次数
 * @param chunkSize 每批 n-gram 数
 */
public record StatsSummary(long statsRows, long fullReportRows, int chunkCount, int chunkSize) {
}
