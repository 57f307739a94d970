package com.ngramengine.memory;

import java.time.Clock;

/**
 * 测试用监控器：预算 1,000,000 字节、8GB 系统内存、回收动作为空。
 */
public final class TestMonitors {
    public static final long BUDGET = 1_000_000L;
    public static final long SYSTEM = 8L * 1024 * 1024 * 1024;

    private TestMonitors() {
    }

    public static MemoryMonitor lowPressure() {
        return withProbe(new FakeMemoryProbe(0L, SYSTEM));
    }

    public static MemoryMonitor critical() {
        return withProbe(new FakeMemoryProbe(950_000L, SYSTEM));
    }

    public static MemoryMonitor withProbe(FakeMemoryProbe probe) {
        return new MemoryMonitor(probe, new MemoryBudget(BUDGET, SYSTEM), 0.70, 0.80, 0.90, 10, () -> { },
            Clock.systemUTC());
    }
}
