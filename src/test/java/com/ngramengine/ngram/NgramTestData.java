package com.ngramengine.ngram;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 生成测试记录。
 */
final class NgramTestData {
    private static final String[] VOCABULARY = {"alpha", "beta", "gamma", "delta", "eps", "zeta"};

    private NgramTestData() {
    }

    /**
     * 按给定词项数生成记录，编号从 1 开始。
     */
    static List<TokenizedRecord> withTokenCounts(int... tokenCounts) {
        List<TokenizedRecord> records = new ArrayList<>();
        for (int index = 0; index < tokenCounts.length; index++) {
            List<String> tokens = new ArrayList<>();
            for (int position = 0; position < tokenCounts[index]; position++) {
                tokens.add(VOCABULARY[(index + position) % VOCABULARY.length]);
            }
            records.add(new TokenizedRecord(index + 1, tokens));
        }
        return records;
    }

    static List<TokenizedRecord> random(long seed, int recordCount, int maxTokens) {
        Random random = new Random(seed);
        List<TokenizedRecord> records = new ArrayList<>();
        for (int index = 0; index < recordCount; index++) {
            int length = random.nextInt(maxTokens + 1);
            List<String> tokens = new ArrayList<>();
            for (int position = 0; position < length; position++) {
                tokens.add(VOCABULARY[random.nextInt(VOCABULARY.length)]);
            }
            records.add(new TokenizedRecord(index + 1, tokens));
        }
        return records;
    }

    /**
     * 大小超过 limit 的窗口报告资源错误，其余窗口正常物化。
     */
    static WindowMaterializer failingAbove(int limit) {
        WindowMaterializer delegate = WindowMaterializer.inMemory();
        return (source, offset, size, params, dictionary) -> size > limit
            ? WindowOutcome.resourceError("simulated OOM at size " + size)
            : delegate.materialize(source, offset, size, params, dictionary);
    }
}
