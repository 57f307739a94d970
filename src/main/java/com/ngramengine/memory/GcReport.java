package com.ngramengine.memory;

/**
 * 一次主动回收的统计：回收前后常驻内存与执行轮数。
 */
public record GcReport(
    long freedBytes,
    long beforeBytes,
    long afterBytes,
    PressureTier tierBefore,
    PressureTier tierAfter,
    int passes
) {
    public double freedMb() {
        return freedBytes / (1024.0 * 1024.0);
    }
}
