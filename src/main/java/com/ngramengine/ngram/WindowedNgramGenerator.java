package com.ngramengine.ngram;

import com.ngramengine.config.Constants;
import com.ngramengine.memory.MemoryMonitor;
import com.ngramengine.memory.PressureTier;
import com.ngramengine.memory.WindowSizer;
import com.ngramengine.progress.ProgressReporter;
import com.ngramengine.progress.SafeProgressReporter;
import com.ngramengine.table.SliceableSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.OptionalLong;

/**
 * 按窗口逐段生成 n-gram 的公共流程。
 *
 * 每个窗口物化前重新采样内存并计算窗口大小，偏移按实际读取的记录数前进；
 * 物化报告资源错误时把同一窗口缩小到 1/4（不低于 500）重试，仍失败则抛出致命错误。
 * 子类决定每个窗口的结果保存在哪里。
 */
abstract class WindowedNgramGenerator implements NgramGenerator {
    private static final Logger logger = LoggerFactory.getLogger(WindowedNgramGenerator.class);

    protected final MemoryMonitor monitor;
    protected final ProgressReporter reporter;
    private final WindowSizer sizer;
    private final WindowMaterializer materializer;

    protected WindowedNgramGenerator(MemoryMonitor monitor, WindowSizer sizer, WindowMaterializer materializer,
                                     ProgressReporter reporter) {
        if (monitor == null || sizer == null || materializer == null) {
            throw new IllegalArgumentException("monitor、sizer、materializer 不能为空");
        }
        this.monitor = monitor;
        this.sizer = sizer;
        this.materializer = materializer;
        this.reporter = SafeProgressReporter.wrap(reporter);
    }

    /**
     * 进度子步骤的显示名称。
     */
    protected abstract String label();

    /**
     * 运行开始前准备资源。
     */
    protected abstract void beginRun();

    /**
     * 接收一个窗口的结果。
     */
    protected abstract void acceptWindow(int windowIndex, List<NgramRow> rows);

    /**
     * 全部窗口完成后汇总结果。
     */
    protected abstract List<NgramRow> finishRun(NgramDictionary dictionary);

    /**
     * 释放本次运行的资源，在任何退出路径上都会调用，不得抛出异常。
     */
    protected abstract void releaseRun();

    @Override
    public final GenerationResult generate(SliceableSource<TokenizedRecord> source, NgramParams params,
                                           NgramDictionary dictionary) {
        OptionalLong total = source.count();
        int initialSize = sizer.windowSize(monitor.pressureTier());
        long estimatedWindows = total.isPresent() ? (total.getAsLong() + initialSize - 1) / initialSize : 0L;
        reporter.addSubstep(PROGRESS_STEP, name(), label(), estimatedWindows);
        reporter.startSubstep(PROGRESS_STEP, name());

        long offset = 0L;
        int windowIndex = 0;
        try {
            beginRun();
            int emptyWindows = 0;
            while (total.isEmpty() || offset < total.getAsLong()) {
                PressureTier tier = monitor.sample().pressureTier();
                int size = sizer.windowSize(tier);
                if (total.isPresent()) {
                    size = (int) Math.min(size, total.getAsLong() - offset);
                }
                WindowOutcome outcome = materializeWithRetry(source, offset, size, params, dictionary);
                if (outcome.recordsRead() == 0) {
                    if (total.isPresent()) {
                        logger.warn("数据源在 offset={} 处提前结束，登记总数为 {}", offset, total.getAsLong());
                        break;
                    }
                    emptyWindows++;
                    if (emptyWindows >= Constants.MAX_CONSECUTIVE_EMPTY_WINDOWS) {
                        break;
                    }
                    continue;
                }
                emptyWindows = 0;
                acceptWindow(windowIndex, outcome.rows());
                offset += outcome.recordsRead();
                windowIndex++;
                logger.debug("{} 窗口 {} 完成: records={}, rows={}, tier={}, offset={}",
                    name(), windowIndex, outcome.recordsRead(), outcome.rows().size(), tier, offset);
                reporter.updateSubstep(PROGRESS_STEP, name(), windowIndex);
                if (monitor.shouldCollectGarbage()) {
                    monitor.collectGarbage();
                }
            }
            List<NgramRow> rows = finishRun(dictionary);
            reporter.completeSubstep(PROGRESS_STEP, name());
            logger.info("{} 生成完成: windows={}, records={}, rows={}", name(), windowIndex, offset, rows.size());
            return new GenerationResult(rows, windowIndex, offset);
        } catch (RuntimeException exception) {
            reporter.failSubstep(PROGRESS_STEP, name(), String.valueOf(exception.getMessage()));
            throw exception;
        } finally {
            releaseRun();
        }
    }

    private WindowOutcome materializeWithRetry(SliceableSource<TokenizedRecord> source, long offset, int size,
                                               NgramParams params, NgramDictionary dictionary) {
        int attemptSize = size;
        while (true) {
            WindowOutcome outcome = materializer.materialize(source, offset, attemptSize, params, dictionary);
            if (outcome.isSuccess()) {
                return outcome;
            }
            if (attemptSize <= Constants.OOM_MIN_WINDOW) {
                logger.error("{} 窗口缩小到 {} 条仍无法物化: offset={}, cause={}",
                    name(), attemptSize, offset, outcome.errorMessage());
                throw new ResourceExhaustedException("窗口缩小到 " + attemptSize + " 条仍无法物化: offset=" + offset
                    + ", cause=" + outcome.errorMessage());
            }
            int shrunk = Math.max(Constants.OOM_MIN_WINDOW, attemptSize / Constants.OOM_SHRINK_DIVISOR);
            logger.warn("{} 窗口物化失败，缩小后重试: offset={}, size {} -> {}", name(), offset, attemptSize, shrunk);
            monitor.collectGarbage();
            attemptSize = shrunk;
        }
    }
}
