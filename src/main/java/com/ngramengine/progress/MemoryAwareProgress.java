package com.ngramengine.progress;

import com.ngramengine.config.Constants;
import com.ngramengine.memory.GcReport;
import com.ngramengine.memory.MemoryMonitor;
import com.ngramengine.memory.MemorySample;
import com.ngramengine.memory.PressureTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * 带内存感知的进度回调：每次更新同时采样内存，高压时限频告警，必要时主动回收。
 */
public class MemoryAwareProgress implements ProgressReporter {
    private static final Logger logger = LoggerFactory.getLogger(MemoryAwareProgress.class);
    private static final long SIGNIFICANT_FREED_BYTES = 50L * 1024 * 1024;

    private final ProgressReporter delegate;
    private final MemoryMonitor monitor;
    private final Clock clock;
    private Instant lastWarning;
    private int warningCount;

    public MemoryAwareProgress(ProgressReporter delegate, MemoryMonitor monitor) {
        this(delegate, monitor, Clock.systemUTC());
    }

    public MemoryAwareProgress(ProgressReporter delegate, MemoryMonitor monitor, Clock clock) {
        this.delegate = SafeProgressReporter.wrap(delegate);
        this.monitor = monitor;
        this.clock = clock;
    }

    /**
     * 更新步骤进度并检查内存压力。
     *
     * @param context 当前操作描述，写入告警日志
     */
    public void updateStepWithMemory(String stepId, long current, String context) {
        delegate.updateStep(stepId, current);
        checkMemory(stepId, context);
    }

    /**
     * 更新子步骤进度并检查内存压力。
     */
    public void updateSubstepWithMemory(String parentId, String substepId, long current, String context) {
        delegate.updateSubstep(parentId, substepId, current);
        checkMemory(parentId + "/" + substepId, context);
    }

    public int getWarningCount() {
        return warningCount;
    }

    /**
     * 汇总本次运行的内存情况。
     */
    public MemorySummary memorySummary() {
        MemorySample finalSample = monitor.sample();
        return new MemorySummary(
            monitor.peakResidentBytes(),
            monitor.budget().budgetBytes(),
            finalSample.pressureTier(),
            monitor.trend(),
            monitor.history().size());
    }

    /**
     * 以 INFO 级别输出内存汇总并返回。
     */
    public MemorySummary logMemorySummary() {
        MemorySummary summary = memorySummary();
        logger.info("内存汇总: peak={}MB, budget={}MB, finalTier={}, trend={}",
            String.format("%.1f", summary.peakResidentMb()),
            String.format("%.1f", summary.budgetBytes() / (1024.0 * 1024.0)),
            summary.finalTier(), summary.trend());
        return summary;
    }

    @Override
    public void addStep(String stepId, String label, long total) {
        delegate.addStep(stepId, label, total);
    }

    @Override
    public void startStep(String stepId) {
        delegate.startStep(stepId);
    }

    @Override
    public void updateStep(String stepId, long current) {
        updateStepWithMemory(stepId, current, stepId);
    }

    @Override
    public void completeStep(String stepId) {
        delegate.completeStep(stepId);
    }

    @Override
    public void failStep(String stepId, String message) {
        delegate.failStep(stepId, message);
    }

    @Override
    public void addSubstep(String parentId, String substepId, String label, long total) {
        delegate.addSubstep(parentId, substepId, label, total);
    }

    @Override
    public void startSubstep(String parentId, String substepId) {
        delegate.startSubstep(parentId, substepId);
    }

    @Override
    public void updateSubstep(String parentId, String substepId, long current) {
        updateSubstepWithMemory(parentId, substepId, current, parentId + "/" + substepId);
    }

    @Override
    public void completeSubstep(String parentId, String substepId) {
        delegate.completeSubstep(parentId, substepId);
    }

    @Override
    public void failSubstep(String parentId, String substepId, String message) {
        delegate.failSubstep(parentId, substepId, message);
    }

    private void checkMemory(String target, String context) {
        MemorySample sample = monitor.sample();
        logger.debug("进度更新: target={}, resident={}MB, tier={}",
            target, String.format("%.1f", sample.residentMb()), sample.pressureTier());
        if (sample.pressureTier().isAtLeast(PressureTier.HIGH)) {
            warnRateLimited(sample, context);
        }
        if (monitor.shouldCollectGarbage()) {
            GcReport report = monitor.collectGarbage();
            if (report.freedBytes() > SIGNIFICANT_FREED_BYTES) {
                logger.info("主动回收释放 {}MB 内存", String.format("%.1f", report.freedMb()));
            }
        }
    }

    private void warnRateLimited(MemorySample sample, String context) {
        Instant now = clock.instant();
        if (lastWarning != null && now.toEpochMilli() - lastWarning.toEpochMilli() < Constants.MEMORY_WARNING_INTERVAL_MS) {
            return;
        }
        lastWarning = now;
        warningCount++;
        logger.warn("内存压力 {}: resident={}MB, budget={}MB, context={}",
            sample.pressureTier(), String.format("%.1f", sample.residentMb()),
            String.format("%.1f", monitor.budget().budgetMb()), context);
    }
}
