package com.ngramengine.memory;

import com.ngramengine.config.Constants;

/**
 * 自适应分块大小策略：基准大小 × 压力系数 × 操作系数，并保证不低于下限。
 */
public final class ChunkSizePolicy {
    private ChunkSizePolicy() {
        // 工具类，禁止实例化
    }

    /**
     * 计算当前压力下的有效分块大小。
     *
     * @param baseSize 基准分块大小
     * @param operationKind 操作类型
     * @param tier 当前压力级别
     * @return 有效分块大小，不低于 {@link #floorFor(int)}
     */
    public static int effectiveSize(int baseSize, OperationKind operationKind, PressureTier tier) {
        if (baseSize <= 0) {
            throw new IllegalArgumentException("基准分块大小必须为正数: " + baseSize);
        }
        double scaled = baseSize * tier.chunkFactor() * operationKind.factor();
        long adjusted = (long) scaled;
        return (int) Math.min(Integer.MAX_VALUE, Math.max(floorFor(baseSize), adjusted));
    }

    /**
     * 分块下限：max(1000, baseSize / 10)。
     */
    public static int floorFor(int baseSize) {
        return Math.max(Constants.MIN_CHUNK_SIZE, baseSize / Constants.MIN_CHUNK_DIVISOR);
    }
}
