package com.ngramengine.ngram;

import com.ngramengine.config.Constants;

/**
 * n 的取值范围 [minN, maxN]。
 */
public record NgramParams(int minN, int maxN) {

    public NgramParams {
        if (minN < 1) {
            throw new IllegalArgumentException("minN 必须为正整数: " + minN);
        }
        if (maxN < minN) {
            throw new IllegalArgumentException("maxN 不能小于 minN: minN=" + minN + ", maxN=" + maxN);
        }
        if (maxN > Constants.MAX_NGRAM_LENGTH) {
            throw new IllegalArgumentException("maxN 超过上限 " + Constants.MAX_NGRAM_LENGTH + ": " + maxN);
        }
    }

    /**
     * 一条含 tokenCount 个词项的记录产生的 n-gram 数。
     */
    public long countFor(int tokenCount) {
        long total = 0;
        for (int n = minN; n <= maxN; n++) {
            total += Math.max(0, tokenCount - n + 1);
        }
        return total;
    }
}
