package com.ngramengine.table;

/**
 * 预处理后的一条消息。
 *
 * @param surrogateId 从 1 开始的输入行号，在过滤前分配
 * @param userId 作者
 * @param messageId 原始消息编号，可能为空
 * @param text 消息正文
 * @param timestamp 原始时间戳文本，可能为空
 */
public record MessageRecord(
    long surrogateId,
    String userId,
    String messageId,
    String text,
    String timestamp
) {
}
