package com.ngramengine.pipeline;

import com.ngramengine.config.EngineConfig;
import com.ngramengine.memory.MemoryMonitor;
import com.ngramengine.memory.OperationKind;
import com.ngramengine.memory.WindowSizer;
import com.ngramengine.ngram.ChunkedNgramGenerator;
import com.ngramengine.ngram.DirectNgramGenerator;
import com.ngramengine.ngram.DiskSpillNgramGenerator;
import com.ngramengine.ngram.GenerationResult;
import com.ngramengine.ngram.NgramDictionary;
import com.ngramengine.ngram.NgramGenerator;
import com.ngramengine.ngram.NgramParams;
import com.ngramengine.ngram.NgramRow;
import com.ngramengine.ngram.ResourceExhaustedException;
import com.ngramengine.ngram.TokenizedRecord;
import com.ngramengine.ngram.WindowMaterializer;
import com.ngramengine.progress.ProgressReporter;
import com.ngramengine.progress.SafeProgressReporter;
import com.ngramengine.table.ListSource;
import com.ngramengine.table.SliceableSource;
import com.ngramengine.unique.ExternalSortUniqueExtractor;
import com.ngramengine.unique.InMemoryUniqueExtractor;
import com.ngramengine.unique.UniqueExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.function.Function;

/**
 * 策略编排：生成路径 NORMAL → CHUNKED → DISK_SPILL，去重路径 IN_MEMORY / EXTERNAL_SORT。
 *
 * 一次运行只向更高开销的策略升级，不会回退。升级后的策略从头重放输入并沿用同一个字典，
 * 字典对重复登记幂等，因此升级不会改变任何编号。最后一级策略仍失败时抛出致命错误。
 */
public class NgramOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(NgramOrchestrator.class);
    private static final int ESTIMATE_SAMPLE_SIZE = 1_000;

    private final MemoryMonitor monitor;
    private final StrategySelector selector;
    private final ProgressReporter reporter;
    private final Function<GenerationStrategy, NgramGenerator> generatorFactory;
    private final Function<DedupStrategy, UniqueExtractor> extractorFactory;

    public NgramOrchestrator(EngineConfig config, MemoryMonitor monitor, ProgressReporter reporter) {
        this(config, monitor, reporter, WindowMaterializer.inMemory());
    }

    NgramOrchestrator(EngineConfig config, MemoryMonitor monitor, ProgressReporter reporter,
                      WindowMaterializer materializer) {
        this(monitor, new StrategySelector(monitor, config), reporter,
            strategy -> createGenerator(strategy, config, monitor, materializer, SafeProgressReporter.wrap(reporter)),
            strategy -> createExtractor(strategy, config, monitor, SafeProgressReporter.wrap(reporter)));
    }

    NgramOrchestrator(MemoryMonitor monitor, StrategySelector selector, ProgressReporter reporter,
                      Function<GenerationStrategy, NgramGenerator> generatorFactory,
                      Function<DedupStrategy, UniqueExtractor> extractorFactory) {
        this.monitor = monitor;
        this.selector = selector;
        this.reporter = SafeProgressReporter.wrap(reporter);
        this.generatorFactory = generatorFactory;
        this.extractorFactory = extractorFactory;
    }

    /**
     * 生成全部 n-gram 并提取唯一文本。
     *
     * @throws ResourceExhaustedException 最高级策略仍无法完成时抛出
     */
    public OrchestrationResult run(SliceableSource<TokenizedRecord> source, NgramParams params) {
        NgramDictionary dictionary = new NgramDictionary();
        OptionalLong recordCount = source.count();
        long estimatedRows = estimateRows(source, params);
        GenerationStrategy strategy = selector.selectGeneration(recordCount, estimatedRows);

        reporter.addStep(NgramGenerator.PROGRESS_STEP, "生成 n-gram",
            recordCount.isPresent() ? recordCount.getAsLong() : 0L);
        reporter.startStep(NgramGenerator.PROGRESS_STEP);
        List<GenerationStrategy> strategiesUsed = new ArrayList<>();
        List<Escalation> escalations = new ArrayList<>();
        GenerationResult generation;
        while (true) {
            strategiesUsed.add(strategy);
            try {
                generation = runGenerator(strategy, source, params, dictionary);
                break;
            } catch (ResourceExhaustedException exception) {
                GenerationStrategy next = strategy.next();
                if (next == null) {
                    logger.error("最高级生成策略 {} 仍然失败: {}", strategy, exception.getMessage());
                    reporter.failStep(NgramGenerator.PROGRESS_STEP, exception.getMessage());
                    throw exception;
                }
                logger.info("生成策略升级: {} -> {}, reason={}", strategy, next, exception.getMessage());
                escalations.add(new Escalation(strategy, next, exception.getMessage()));
                monitor.collectGarbage();
                strategy = next;
            } catch (RuntimeException exception) {
                reporter.failStep(NgramGenerator.PROGRESS_STEP, String.valueOf(exception.getMessage()));
                throw exception;
            }
        }
        reporter.completeStep(NgramGenerator.PROGRESS_STEP);

        List<NgramRow> rows = generation.rows();
        DedupStrategy dedupStrategy = selector.selectDedup(rows.size());
        reporter.addStep(UniqueExtractor.PROGRESS_STEP, "提取唯一 n-gram", rows.size());
        reporter.startStep(UniqueExtractor.PROGRESS_STEP);
        List<String> uniqueWords;
        try {
            uniqueWords = extractorFactory.apply(dedupStrategy)
                .extractUnique(new ListSource<>(rows).select(NgramRow::words));
        } catch (RuntimeException exception) {
            reporter.failStep(UniqueExtractor.PROGRESS_STEP, String.valueOf(exception.getMessage()));
            throw exception;
        }
        reporter.completeStep(UniqueExtractor.PROGRESS_STEP);
        logger.info("编排完成: strategy={}, escalations={}, rows={}, unique={}",
            strategy, escalations.size(), rows.size(), uniqueWords.size());
        return new OrchestrationResult(rows, dictionary, uniqueWords, strategiesUsed, escalations, dedupStrategy,
            generation.windowCount(), generation.recordsProcessed());
    }

    /**
     * 执行一个生成策略；策略内任意位置的 {@link OutOfMemoryError} 视为资源错误，部分结果随之丢弃。
     */
    private GenerationResult runGenerator(GenerationStrategy strategy, SliceableSource<TokenizedRecord> source,
                                          NgramParams params, NgramDictionary dictionary) {
        try {
            return generatorFactory.apply(strategy).generate(source, params, dictionary);
        } catch (OutOfMemoryError error) {
            throw new ResourceExhaustedException("生成策略 " + strategy + " 内存不足", error);
        }
    }

    /**
     * 以前若干条记录的平均 n-gram 数推算总行数；总数未知时只统计样本。
     */
    static long estimateRows(SliceableSource<TokenizedRecord> source, NgramParams params) {
        List<TokenizedRecord> sample = source.slice(0L, ESTIMATE_SAMPLE_SIZE);
        if (sample.isEmpty()) {
            return 0L;
        }
        long sampleRows = 0L;
        for (TokenizedRecord record : sample) {
            sampleRows += params.countFor(record.tokens().size());
        }
        OptionalLong total = source.count();
        if (total.isEmpty() || total.getAsLong() <= sample.size()) {
            return sampleRows;
        }
        return (long) ((double) sampleRows / sample.size() * total.getAsLong());
    }

    private static NgramGenerator createGenerator(GenerationStrategy strategy, EngineConfig config,
                                                  MemoryMonitor monitor, WindowMaterializer materializer,
                                                  ProgressReporter reporter) {
        return switch (strategy) {
            case NORMAL -> new DirectNgramGenerator(materializer, reporter);
            case CHUNKED -> new ChunkedNgramGenerator(monitor,
                WindowSizer.adaptive(config.getNgramChunkSize(), OperationKind.NGRAM_GENERATION),
                materializer, reporter);
            case DISK_SPILL -> new DiskSpillNgramGenerator(monitor,
                WindowSizer.adaptive(config.getDiskSpillChunkSize(), OperationKind.NGRAM_GENERATION),
                materializer, reporter, config.getTempDir());
        };
    }

    private static UniqueExtractor createExtractor(DedupStrategy strategy, EngineConfig config, MemoryMonitor monitor,
                                                   ProgressReporter reporter) {
        return switch (strategy) {
            case IN_MEMORY -> new InMemoryUniqueExtractor(reporter);
            case EXTERNAL_SORT -> new ExternalSortUniqueExtractor(monitor,
                WindowSizer.adaptive(config.getExternalSortChunkSize(), OperationKind.UNIQUE_EXTRACTION),
                reporter, config.getTempDir());
        };
    }
}
