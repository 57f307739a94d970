package com.ngramengine.memory;

import com.ngramengine.config.EngineConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class MemoryMonitorTest {

    private static final long BUDGET = 1_000_000L;
    private static final long SYSTEM = 8L * 1024 * 1024 * 1024;

    private MemoryMonitor monitorFor(FakeMemoryProbe probe, Runnable gcAction) {
        return new MemoryMonitor(probe, new MemoryBudget(BUDGET, SYSTEM), 0.70, 0.80, 0.90, 10, gcAction,
            Clock.systemUTC());
    }

    @ParameterizedTest
    @CsvSource({
        "0, LOW",
        "699999, LOW",
        "700000, MEDIUM",
        "799999, MEDIUM",
        "800000, HIGH",
        "900000, CRITICAL",
        "2000000, CRITICAL"
    })
    @DisplayName("按使用率划分压力级别")
    void testPressureTierClassification(long resident, PressureTier expected) {
        MemoryMonitor monitor = monitorFor(new FakeMemoryProbe(resident, SYSTEM), () -> { });

        assertEquals(expected, monitor.pressureTier());
        assertEquals(expected, monitor.sample().pressureTier());
    }

    @Test
    @DisplayName("pressureTier 不写入历史，sample 写入历史")
    void testSampleAppendsHistory() {
        FakeMemoryProbe probe = new FakeMemoryProbe(100, SYSTEM);
        MemoryMonitor monitor = monitorFor(probe, () -> { });

        monitor.pressureTier();
        assertTrue(monitor.history().isEmpty());

        MemorySample sample = monitor.sample();
        assertEquals(1, monitor.history().size());
        assertEquals(100, sample.residentBytes());
        assertEquals(200, sample.virtualBytes());
    }

    @Test
    @DisplayName("历史长度有上限，超出时丢弃最旧的采样")
    void testHistoryIsBounded() {
        FakeMemoryProbe probe = new FakeMemoryProbe(0, SYSTEM);
        MemoryMonitor monitor = monitorFor(probe, () -> { });

        for (int index = 1; index <= 25; index++) {
            probe.setResidentBytes(index);
            monitor.sample();
        }

        assertEquals(10, monitor.history().size());
        assertEquals(16, monitor.history().get(0).residentBytes());
        assertEquals(25, monitor.peakResidentBytes());
    }

    @Test
    @DisplayName("趋势：采样不足、上升、下降、平稳")
    void testTrend() {
        FakeMemoryProbe probe = new FakeMemoryProbe(0, SYSTEM);
        MemoryMonitor monitor = monitorFor(probe, () -> { });
        probe.script(10, 20, 30, 40);
        for (int index = 0; index < 4; index++) {
            monitor.sample();
        }
        assertEquals(MemoryTrend.INSUFFICIENT_DATA, monitor.trend());

        probe.script(40);
        monitor.sample();
        assertEquals(MemoryTrend.INCREASING, monitor.trend());

        probe.script(35, 30, 30, 20, 10);
        for (int index = 0; index < 5; index++) {
            monitor.sample();
        }
        assertEquals(MemoryTrend.DECREASING, monitor.trend());

        probe.script(50, 10, 50, 10, 50);
        for (int index = 0; index < 5; index++) {
            monitor.sample();
        }
        assertEquals(MemoryTrend.STABLE, monitor.trend());

        probe.script(7, 7, 7, 7, 7);
        for (int index = 0; index < 5; index++) {
            monitor.sample();
        }
        assertEquals(MemoryTrend.STABLE, monitor.trend());
    }

    @Test
    @DisplayName("GC 触发阈值默认 0.7")
    void testShouldCollectGarbage() {
        FakeMemoryProbe probe = new FakeMemoryProbe(690_000, SYSTEM);
        MemoryMonitor monitor = monitorFor(probe, () -> { });
        assertFalse(monitor.shouldCollectGarbage());
        assertTrue(monitor.shouldCollectGarbage(0.5));

        probe.setResidentBytes(700_000);
        assertTrue(monitor.shouldCollectGarbage());
    }

    @Test
    @DisplayName("回收最多三轮，统计释放量")
    void testCollectGarbageUpToThreePasses() {
        FakeMemoryProbe probe = new FakeMemoryProbe(0, SYSTEM);
        AtomicInteger passes = new AtomicInteger();
        MemoryMonitor monitor = monitorFor(probe, passes::incrementAndGet);
        probe.script(950_000, 900_000, 850_000, 800_000);

        GcReport report = monitor.collectGarbage();

        assertEquals(3, passes.get());
        assertEquals(3, report.passes());
        assertEquals(950_000, report.beforeBytes());
        assertEquals(800_000, report.afterBytes());
        assertEquals(150_000, report.freedBytes());
        assertEquals(PressureTier.CRITICAL, report.tierBefore());
        assertEquals(PressureTier.HIGH, report.tierAfter());
    }

    @Test
    @DisplayName("某一轮未回收内存即提前结束")
    void testCollectGarbageStopsEarly() {
        FakeMemoryProbe probe = new FakeMemoryProbe(0, SYSTEM);
        AtomicInteger passes = new AtomicInteger();
        MemoryMonitor monitor = monitorFor(probe, passes::incrementAndGet);
        probe.script(500_000, 400_000, 400_000);

        GcReport report = monitor.collectGarbage();

        assertEquals(2, passes.get());
        assertEquals(100_000, report.freedBytes());
    }

    @Test
    @DisplayName("回收动作异常不会抛出")
    void testCollectGarbageNeverThrows() {
        FakeMemoryProbe probe = new FakeMemoryProbe(500_000, SYSTEM);
        MemoryMonitor monitor = monitorFor(probe, () -> {
            throw new IllegalStateException("gc failed");
        });

        GcReport report = assertDoesNotThrow(monitor::collectGarbage);
        assertEquals(0, report.freedBytes());
    }

    @Test
    @DisplayName("探针失败时按 LOW 处理")
    void testProbeFailureFailsOpen() {
        FakeMemoryProbe probe = new FakeMemoryProbe(950_000, SYSTEM);
        probe.setFailing(true);
        MemoryMonitor monitor = monitorFor(probe, () -> { });

        assertEquals(PressureTier.LOW, monitor.pressureTier());
        assertEquals(PressureTier.LOW, monitor.sample().pressureTier());
        assertFalse(monitor.shouldCollectGarbage());
    }

    @Test
    @DisplayName("阈值非递增时拒绝构造")
    void testInvalidThresholds() {
        FakeMemoryProbe probe = new FakeMemoryProbe(0, SYSTEM);
        MemoryBudget budget = new MemoryBudget(BUDGET, SYSTEM);
        assertThrows(IllegalArgumentException.class,
            () -> new MemoryMonitor(probe, budget, 0.8, 0.7, 0.9, 10, () -> { }, Clock.systemUTC()));
    }

    @Test
    @DisplayName("按配置构造使用配置中的阈值")
    void testConfigConstructor() {
        EngineConfig config = EngineConfig.defaults();
        config.setMediumThreshold(0.5);
        config.setHighThreshold(0.6);
        config.setCriticalThreshold(0.7);
        MemoryMonitor monitor = new MemoryMonitor(new FakeMemoryProbe(650_000, SYSTEM),
            new MemoryBudget(BUDGET, SYSTEM), config);

        assertEquals(PressureTier.HIGH, monitor.pressureTier());
    }
}
