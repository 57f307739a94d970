package com.ngramengine.memory;

/**
 * 根据当前压力级别决定下一个窗口（或分区）的记录数。
 */
@FunctionalInterface
public interface WindowSizer {

    int windowSize(PressureTier tier);

    /**
     * 按 {@link ChunkSizePolicy} 自适应计算。
     */
    static WindowSizer adaptive(int baseSize, OperationKind operationKind) {
        return tier -> ChunkSizePolicy.effectiveSize(baseSize, operationKind, tier);
    }

    /**
     * 固定大小，不随压力变化。
     */
    static WindowSizer fixed(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("窗口大小必须为正数: " + size);
        }
        return tier -> size;
    }
}
