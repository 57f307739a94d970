package com.ngramengine.table;

/**
 * 完整报告中的一行：某 n-gram 在某作者某条消息中的出现。
 */
public record FullReportRow(
    int ngramId,
    int n,
    String words,
    long totalReps,
    long distinctPosters,
    String userId,
    long repsPerUser,
    long surrogateId,
    String messageId,
    String messageText,
    String timestamp
) {
}
