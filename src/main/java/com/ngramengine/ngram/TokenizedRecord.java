package com.ngramengine.ngram;

import java.util.ArrayList;
import java.util.List;

/**
 * 已分词的记录。
 *
 * n-gram 文本以单个空格连接词项，因此空词项被丢弃，含空白字符的词项直接拒绝。
 */
public record TokenizedRecord(long recordId, List<String> tokens) {

    public TokenizedRecord {
        if (tokens == null) {
            throw new IllegalArgumentException("词项列表不能为空: recordId=" + recordId);
        }
        List<String> kept = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            if (token == null || token.isEmpty()) {
                continue;
            }
            if (containsWhitespace(token)) {
                throw new IllegalArgumentException("词项不能包含空白字符: recordId=" + recordId + ", token=" + token);
            }
            kept.add(token);
        }
        tokens = List.copyOf(kept);
    }

    private static boolean containsWhitespace(String token) {
        for (int index = 0; index < token.length(); index++) {
            if (Character.isWhitespace(token.charAt(index))) {
                return true;
            }
        }
        return false;
    }
}
