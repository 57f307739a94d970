package com.ngramengine.pipeline;

import com.ngramengine.config.Constants;
import com.ngramengine.progress.ProgressReporter;
import com.ngramengine.progress.SafeProgressReporter;
import com.ngramengine.table.NgramResultStore;
import com.ngramengine.table.NgramStat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 二次分析：重复出现的 n-gram 汇总（ngram_stats）与按作者展开的完整报告（ngram_full）。
 */
public class NgramStatsAnalysis {
    private static final Logger logger = LoggerFactory.getLogger(NgramStatsAnalysis.class);
    private static final String STEP_STATS = "ngram_stats";
    private static final long FULL_REPORT_ROW_TARGET = 100_000L;

    private final ProgressReporter reporter;

    public NgramStatsAnalysis() {
        this(ProgressReporter.NOOP);
    }

    public NgramStatsAnalysis(ProgressReporter reporter) {
        this.reporter = SafeProgressReporter.wrap(reporter);
    }

    public StatsSummary run(NgramResultStore store) {
        reporter.addStep(STEP_STATS, "统计重复 n-gram", 0);
        reporter.startStep(STEP_STATS);
        try {
            long statsRows = store.rebuildStatsSummary();
            int chunkSize = fullReportChunkSize(store.countMessageNgrams(), store.countNgrams());
            long chunkTotal = (statsRows + chunkSize - 1) / chunkSize;
            reporter.addSubstep(STEP_STATS, "full_report", "生成完整报告", chunkTotal);
            reporter.startSubstep(STEP_STATS, "full_report");
            store.resetFullReport();
            int chunkCount = 0;
            for (long offset = 0; offset < statsRows; offset += chunkSize) {
                List<Integer> ids = new ArrayList<>(chunkSize);
                for (NgramStat stat : store.readStats(offset, chunkSize)) {
                    ids.add(stat.ngramId());
                }
                store.appendFullReportChunk(ids);
                chunkCount++;
                reporter.updateSubstep(STEP_STATS, "full_report", chunkCount);
            }
            reporter.completeSubstep(STEP_STATS, "full_report");
            long fullRows = store.countFullReport();
            reporter.completeStep(STEP_STATS);
            logger.info("统计完成: stats={}, fullReport={}, chunks={}, chunkSize={}",
                statsRows, fullRows, chunkCount, chunkSize);
            return new StatsSummary(statsRows, fullRows, chunkCount, chunkSize);
        } catch (RuntimeException exception) {
            reporter.failStep(STEP_STATS, String.valueOf(exception.getMessage()));
            throw exception;
        }
    }

    /**
     * 每批 n-gram 数：使每批展开后约 10 万行，范围 [1, 1000]。
     */
    static int fullReportChunkSize(long messageNgramRows, long ngramCount) {
        long averageRows = Math.max(1L, messageNgramRows / Math.max(1L, ngramCount));
        long size = FULL_REPORT_ROW_TARGET / averageRows;
        return (int) Math.max(1L, Math.min(Constants.FULL_REPORT_MAX_CHUNK, size));
    }
}
