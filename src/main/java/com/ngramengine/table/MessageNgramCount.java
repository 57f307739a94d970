package com.ngramengine.table;

/**
 * 某条消息中某个 n-gram 的出现次数。
 */
public record MessageNgramCount(long surrogateId, int ngramId, int count) {
}
