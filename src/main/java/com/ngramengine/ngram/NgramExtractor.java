package com.ngramengine.ngram;

import java.util.ArrayList;
import java.util.List;

/**
 * 从已分词记录中逐条抽取 n-gram，按记录、起始位置、n 的顺序输出并登记到字典。
 */
public final class NgramExtractor {
    private NgramExtractor() {
        // 工具类，禁止实例化
    }

    /**
     * 抽取一批记录的全部 n-gram。
     */
    public static List<NgramRow> extract(List<TokenizedRecord> records, NgramParams params, NgramDictionary dictionary) {
        List<NgramRow> rows = new ArrayList<>();
        for (TokenizedRecord record : records) {
            appendRecord(record, params, dictionary, rows);
        }
        return rows;
    }

    /**
     * 抽取单条记录的 n-gram 并追加到 sink。
     */
    public static void appendRecord(TokenizedRecord record, NgramParams params, NgramDictionary dictionary,
                                    List<NgramRow> sink) {
        List<String> tokens = record.tokens();
        for (int start = 0; start < tokens.size(); start++) {
            for (int n = params.minN(); n <= params.maxN() && start + n <= tokens.size(); n++) {
                String words = String.join(" ", tokens.subList(start, start + n));
                int ngramId = dictionary.idFor(words);
                sink.add(new NgramRow(record.recordId(), ngramId, dictionary.wordsOf(ngramId)));
            }
        }
    }
}
