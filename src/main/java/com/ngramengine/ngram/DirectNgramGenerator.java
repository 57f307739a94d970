package com.ngramengine.ngram;

import com.ngramengine.progress.ProgressReporter;
import com.ngramengine.progress.SafeProgressReporter;
import com.ngramengine.table.SliceableSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 直接生成：一次性物化整个数据源。
 */
public class DirectNgramGenerator implements NgramGenerator {
    private static final Logger logger = LoggerFactory.getLogger(DirectNgramGenerator.class);

    private final WindowMaterializer materializer;
    private final ProgressReporter reporter;

    public DirectNgramGenerator() {
        this(WindowMaterializer.inMemory(), ProgressReporter.NOOP);
    }

    public DirectNgramGenerator(WindowMaterializer materializer, ProgressReporter reporter) {
        this.materializer = materializer;
        this.reporter = SafeProgressReporter.wrap(reporter);
    }

    @Override
    public String name() {
        return "direct";
    }

    @Override
    public GenerationResult generate(SliceableSource<TokenizedRecord> source, NgramParams params,
                                     NgramDictionary dictionary) {
        long total = source.count().orElse(Integer.MAX_VALUE);
        if (total > Integer.MAX_VALUE) {
            throw new ResourceExhaustedException("记录数超过直接生成上限: " + total);
        }
        reporter.addSubstep(PROGRESS_STEP, name(), "直接生成 n-gram", 1);
        reporter.startSubstep(PROGRESS_STEP, name());
        WindowOutcome outcome = materializer.materialize(source, 0L, (int) total, params, dictionary);
        if (!outcome.isSuccess()) {
            reporter.failSubstep(PROGRESS_STEP, name(), outcome.errorMessage());
            throw new ResourceExhaustedException(outcome.errorMessage());
        }
        reporter.updateSubstep(PROGRESS_STEP, name(), 1);
        reporter.completeSubstep(PROGRESS_STEP, name());
        logger.debug("直接生成完成: records={}, rows={}", outcome.recordsRead(), outcome.rows().size());
        return new GenerationResult(outcome.rows(), 1, outcome.recordsRead());
    }
}
