package com.ngramengine.memory;

/**
 * 分块操作类型，不同操作的内存开销系数不同。
 */
public enum OperationKind {
    /** n-gram 生成，开销较高 */
    NGRAM_GENERATION(0.6),
    /** 唯一值提取，开销较低 */
    UNIQUE_EXTRACTION(1.2),
    DEFAULT(1.0);

    private final double factor;

    OperationKind(double factor) {
        this.factor = factor;
    }

    public double factor() {
        return factor;
    }
}
