package com.ngramengine.pipeline;

import com.ngramengine.config.Constants;
import com.ngramengine.config.EngineConfig;
import com.ngramengine.memory.MemoryMonitor;
import com.ngramengine.memory.PressureTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalLong;

/**
 * 根据当前内存压力与规模估计选择初始策略。
 */
public class StrategySelector {
    private static final Logger logger = LoggerFactory.getLogger(StrategySelector.class);

    private final MemoryMonitor monitor;
    private final EngineConfig config;

    public StrategySelector(MemoryMonitor monitor, EngineConfig config) {
        this.monitor = monitor;
        this.config = config;
    }

    /**
     * 选择生成策略。
     *
     * @param recordCount 记录总数，流式来源为空
     * @param estimatedRows 估计的 n-gram 行数
     */
    public GenerationStrategy selectGeneration(OptionalLong recordCount, long estimatedRows) {
        if (config.getForcedGenerationStrategy() != null) {
            logger.info("使用指定的生成策略: {}", config.getForcedGenerationStrategy());
            return config.getForcedGenerationStrategy();
        }
        PressureTier tier = monitor.sample().pressureTier();
        GenerationStrategy strategy;
        if (tier == PressureTier.CRITICAL || estimatedRows > monitor.budget().spillRowThreshold()) {
            strategy = GenerationStrategy.DISK_SPILL;
        } else if (recordCount.isEmpty() || recordCount.getAsLong() > Constants.CHUNKED_GENERATION_THRESHOLD) {
            strategy = GenerationStrategy.CHUNKED;
        } else {
            strategy = GenerationStrategy.NORMAL;
        }
        logger.info("生成策略: {} (tier={}, records={}, estimatedRows={})", strategy, tier,
            recordCount.isPresent() ? recordCount.getAsLong() : "unknown", estimatedRows);
        return strategy;
    }

    /**
     * 选择去重策略，与溢写共用同一行数阈值。
     */
    public DedupStrategy selectDedup(long rowCount) {
        if (config.getForcedDedupStrategy() != null) {
            logger.info("使用指定的去重策略: {}", config.getForcedDedupStrategy());
            return config.getForcedDedupStrategy();
        }
        PressureTier tier = monitor.sample().pressureTier();
        DedupStrategy strategy = tier == PressureTier.CRITICAL || rowCount > monitor.budget().spillRowThreshold()
            ? DedupStrategy.EXTERNAL_SORT
            : DedupStrategy.IN_MEMORY;
        logger.info("去重策略: {} (tier={}, rows={})", strategy, tier, rowCount);
        return strategy;
    }
}
