package com.ngramengine.memory;

import com.ngramengine.config.Constants;
import com.ngramengine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 内存监控器：采样进程内存、划分压力级别、决定是否主动回收。
 *
 * 单线程使用；探针读取失败时按 LOW 处理，不阻塞处理流程。
 */
public class MemoryMonitor {
    private static final Logger logger = LoggerFactory.getLogger(MemoryMonitor.class);

    private final MemoryProbe probe;
    private final MemoryBudget budget;
    private final double mediumThreshold;
    private final double highThreshold;
    private final double criticalThreshold;
    private final int maxHistorySize;
    private final Deque<MemorySample> history = new ArrayDeque<>();
    private final Runnable gcAction;
    private final Clock clock;
    private long peakResidentBytes;
    private PressureTier lastLoggedTier = PressureTier.LOW;

    /**
     * 使用默认阈值与 JVM 探针构造监控器。
     */
    public MemoryMonitor(MemoryBudget budget) {
        this(new JvmMemoryProbe(), budget, EngineConfig.defaults());
    }

    /**
     * 使用配置中的阈值与历史长度构造监控器。
     */
    public MemoryMonitor(MemoryProbe probe, MemoryBudget budget, EngineConfig config) {
        this(probe, budget, config.getMediumThreshold(), config.getHighThreshold(),
            config.getCriticalThreshold(), config.getMemoryHistorySize(), System::gc, Clock.systemUTC());
    }

    /**
     * 完整构造：阈值、历史长度、回收动作与时钟均可注入。
     */
    public MemoryMonitor(MemoryProbe probe, MemoryBudget budget, double mediumThreshold, double highThreshold,
                  double criticalThreshold, int maxHistorySize, Runnable gcAction, Clock clock) {
        if (probe == null || budget == null) {
            throw new IllegalArgumentException("探针与预算不能为空");
        }
        if (!(mediumThreshold < highThreshold && highThreshold < criticalThreshold)) {
            throw new IllegalArgumentException("压力阈值必须严格递增");
        }
        this.probe = probe;
        this.budget = budget;
        this.mediumThreshold = mediumThreshold;
        this.highThreshold = highThreshold;
        this.criticalThreshold = criticalThreshold;
        this.maxHistorySize = Math.max(Constants.TREND_WINDOW, maxHistorySize);
        this.gcAction = gcAction;
        this.clock = clock;
    }

    /**
     * 读取一次内存并追加到历史。
     */
    public MemorySample sample() {
        long resident = readResident();
        long virtual;
        try {
            virtual = probe.virtualBytes();
        } catch (RuntimeException exception) {
            virtual = 0L;
        }
        PressureTier tier = classify(resident);
        MemorySample memorySample = new MemorySample(clock.instant(), resident, virtual, tier);
        if (history.size() >= maxHistorySize) {
            history.removeFirst();
        }
        history.addLast(memorySample);
        peakResidentBytes = Math.max(peakResidentBytes, resident);
        if (tier != lastLoggedTier) {
            logger.info("内存压力级别变化: {} -> {}, resident={}MB, budget={}MB",
                lastLoggedTier, tier, String.format("%.1f", memorySample.residentMb()),
                String.format("%.1f", budget.budgetMb()));
            lastLoggedTier = tier;
        }
        return memorySample;
    }

    /**
     * 当前压力级别，不写入历史。
     */
    public PressureTier pressureTier() {
        return classify(readResident());
    }

    /**
     * 当前常驻内存占预算的比例。
     */
    public double usageRatio() {
        return (double) readResident() / budget.budgetBytes();
    }

    public boolean shouldCollectGarbage() {
        return shouldCollectGarbage(Constants.GC_TRIGGER_THRESHOLD);
    }

    public boolean shouldCollectGarbage(double threshold) {
        return usageRatio() >= threshold;
    }

    /**
     * 最多执行三轮 GC，某一轮未回收任何内存即提前结束；从不抛出异常。
     */
    public GcReport collectGarbage() {
        long before = readResident();
        PressureTier tierBefore = classify(before);
        long current = before;
        int passes = 0;
        try {
            while (passes < Constants.MAX_GC_PASSES) {
                gcAction.run();
                passes++;
                long afterPass = readResident();
                long freedThisPass = current - afterPass;
                current = afterPass;
                if (freedThisPass <= 0) {
                    break;
                }
            }
        } catch (RuntimeException exception) {
            logger.warn("主动回收失败，已忽略: passes={}", passes, exception);
        }
        long freed = Math.max(0L, before - current);
        GcReport report = new GcReport(freed, before, current, tierBefore, classify(current), passes);
        logger.debug("主动回收完成: freed={}MB, passes={}, tier {} -> {}",
            String.format("%.1f", report.freedMb()), passes, tierBefore, report.tierAfter());
        return report;
    }

    /**
     * 根据最近 5 次采样判断内存趋势。
     */
    public MemoryTrend trend() {
        if (history.size() < Constants.TREND_WINDOW) {
            return MemoryTrend.INSUFFICIENT_DATA;
        }
        List<MemorySample> samples = new ArrayList<>(history);
        List<MemorySample> recent = samples.subList(samples.size() - Constants.TREND_WINDOW, samples.size());
        boolean nonDecreasing = true;
        boolean nonIncreasing = true;
        for (int index = 1; index < recent.size(); index++) {
            long previous = recent.get(index - 1).residentBytes();
            long next = recent.get(index).residentBytes();
            if (next < previous) {
                nonDecreasing = false;
            }
            if (next > previous) {
                nonIncreasing = false;
            }
        }
        if (nonDecreasing && !nonIncreasing) {
            return MemoryTrend.INCREASING;
        }
        if (nonIncreasing && !nonDecreasing) {
            return MemoryTrend.DECREASING;
        }
        return MemoryTrend.STABLE;
    }

    /**
     * 历史采样快照（按时间升序）。
     */
    public List<MemorySample> history() {
        return List.copyOf(history);
    }

    public MemoryBudget budget() {
        return budget;
    }

    public long peakResidentBytes() {
        return peakResidentBytes;
    }

    PressureTier classify(long residentBytes) {
        double ratio = (double) residentBytes / budget.budgetBytes();
        if (ratio >= criticalThreshold) {
            return PressureTier.CRITICAL;
        }
        if (ratio >= highThreshold) {
            return PressureTier.HIGH;
        }
        if (ratio >= mediumThreshold) {
            return PressureTier.MEDIUM;
        }
        return PressureTier.LOW;
    }

    private long readResident() {
        try {
            return Math.max(0L, probe.residentBytes());
        } catch (RuntimeException exception) {
            logger.warn("读取进程内存失败，按 LOW 压力处理", exception);
            return 0L;
        }
    }
}
