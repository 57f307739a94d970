package com.ngramengine.memory;

import com.ngramengine.config.Constants;

/**
 * 监控器实例持有的不可变内存预算。
 *
 * @param budgetBytes 预算字节数
 * @param systemBytes 推导预算时观测到的系统物理内存
 */
public record MemoryBudget(long budgetBytes, long systemBytes) {

    public MemoryBudget {
        if (budgetBytes <= 0) {
            throw new IllegalArgumentException("内存预算必须为正数: " + budgetBytes);
        }
    }

    /**
     * 使用显式预算，系统内存仍通过探针获取以决定溢写阈值。
     */
    public static MemoryBudget explicit(long budgetBytes, MemoryProbe probe) {
        return new MemoryBudget(budgetBytes, safeSystemBytes(probe, budgetBytes));
    }

    /**
     * 按系统内存分档比例推导预算，且不超过进程可用上限。
     */
    public static MemoryBudget autoDetect(MemoryProbe probe) {
        long processLimit = probe.processLimitBytes();
        long systemBytes = safeSystemBytes(probe, processLimit == Long.MAX_VALUE ? Constants.SYSTEM_MEMORY_8_GB : processLimit);
        long tiered = (long) (systemBytes * ratioForSystemMemory(systemBytes));
        return new MemoryBudget(Math.max(1L, Math.min(tiered, processLimit)), systemBytes);
    }

    /**
     * 系统内存越大，可分配给预算的比例越高。
     */
    public static double ratioForSystemMemory(long systemBytes) {
        if (systemBytes >= Constants.SYSTEM_MEMORY_32_GB) {
            return Constants.BUDGET_RATIO_32_GB;
        }
        if (systemBytes >= Constants.SYSTEM_MEMORY_16_GB) {
            return Constants.BUDGET_RATIO_16_GB;
        }
        if (systemBytes >= Constants.SYSTEM_MEMORY_8_GB) {
            return Constants.BUDGET_RATIO_8_GB;
        }
        return Constants.BUDGET_RATIO_SMALL;
    }

    /**
     * 超过该行数时改用磁盘溢写生成或外部排序去重。
     */
    public long spillRowThreshold() {
        if (systemBytes >= Constants.SYSTEM_MEMORY_32_GB) {
            return Constants.SPILL_ROWS_32_GB;
        }
        if (systemBytes >= Constants.SYSTEM_MEMORY_16_GB) {
            return Constants.SPILL_ROWS_16_GB;
        }
        if (systemBytes >= Constants.SYSTEM_MEMORY_8_GB) {
            return Constants.SPILL_ROWS_8_GB;
        }
        return Constants.SPILL_ROWS_SMALL;
    }

    public double budgetMb() {
        return budgetBytes / (1024.0 * 1024.0);
    }

    private static long safeSystemBytes(MemoryProbe probe, long fallback) {
        try {
            long systemBytes = probe.totalSystemBytes();
            return systemBytes > 0 ? systemBytes : fallback;
        } catch (RuntimeException exception) {
            return fallback;
        }
    }
}
