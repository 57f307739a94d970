package com.ngramengine.pipeline;

import com.ngramengine.config.EngineConfig;
import com.ngramengine.memory.MemoryMonitor;
import com.ngramengine.memory.TestMonitors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class StrategySelectorTest {

    private final EngineConfig config = EngineConfig.defaults();

    @Test
    @DisplayName("小规模输入使用直接生成与内存去重")
    void testSmallInput() {
        StrategySelector selector = new StrategySelector(TestMonitors.lowPressure(), config);

        assertEquals(GenerationStrategy.NORMAL, selector.selectGeneration(OptionalLong.of(1_000), 5_000));
        assertEquals(DedupStrategy.IN_MEMORY, selector.selectDedup(5_000));
    }

    @Test
    @DisplayName("记录数超过阈值或总数未知时分块生成")
    void testChunkedForLargeOrUnknownInput() {
        StrategySelector selector = new StrategySelector(TestMonitors.lowPressure(), config);

        assertEquals(GenerationStrategy.CHUNKED, selector.selectGeneration(OptionalLong.of(100_001), 10_000));
        assertEquals(GenerationStrategy.CHUNKED, selector.selectGeneration(OptionalLong.empty(), 10_000));
    }

    @Test
    @DisplayName("估计行数超过溢写阈值或压力为 CRITICAL 时使用磁盘策略")
    void testDiskStrategies() {
        MemoryMonitor low = TestMonitors.lowPressure();
        long threshold = low.budget().spillRowThreshold();
        StrategySelector selector = new StrategySelector(low, config);

        assertEquals(500_000L, threshold);
        assertEquals(GenerationStrategy.DISK_SPILL, selector.selectGeneration(OptionalLong.of(10), threshold + 1));
        assertEquals(DedupStrategy.EXTERNAL_SORT, selector.selectDedup(threshold + 1));
        assertEquals(DedupStrategy.IN_MEMORY, selector.selectDedup(threshold));

        StrategySelector underPressure = new StrategySelector(TestMonitors.critical(), config);
        assertEquals(GenerationStrategy.DISK_SPILL, underPressure.selectGeneration(OptionalLong.of(10), 10));
        assertEquals(DedupStrategy.EXTERNAL_SORT, underPressure.selectDedup(10));
    }

    @Test
    @DisplayName("配置中指定的策略优先")
    void testForcedStrategies() {
        EngineConfig forced = EngineConfig.defaults();
        forced.setForcedGenerationStrategy(GenerationStrategy.CHUNKED);
        forced.setForcedDedupStrategy(DedupStrategy.EXTERNAL_SORT);
        StrategySelector selector = new StrategySelector(TestMonitors.critical(), forced);

        assertEquals(GenerationStrategy.CHUNKED, selector.selectGeneration(OptionalLong.of(10), 10));
        assertEquals(DedupStrategy.EXTERNAL_SORT, selector.selectDedup(10));
    }

    @Test
    void testLadderOrder() {
        assertEquals(GenerationStrategy.CHUNKED, GenerationStrategy.NORMAL.next());
        assertEquals(GenerationStrategy.DISK_SPILL, GenerationStrategy.CHUNKED.next());
        assertNull(GenerationStrategy.DISK_SPILL.next());
    }
}
