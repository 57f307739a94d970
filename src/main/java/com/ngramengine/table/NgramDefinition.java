package com.ngramengine.table;

/**
 * n-gram 定义：编号、空格连接的词项文本与词项数。
 */
public record NgramDefinition(int ngramId, String words, int n) {
}
