package com.ngramengine.pipeline;

import com.ngramengine.config.Constants;
import com.ngramengine.config.EngineConfig;
import com.ngramengine.memory.MemoryMonitor;
import com.ngramengine.ngram.NgramDictionary;
import com.ngramengine.ngram.NgramParams;
import com.ngramengine.ngram.NgramRow;
import com.ngramengine.ngram.TokenizedRecord;
import com.ngramengine.progress.MemoryAwareProgress;
import com.ngramengine.progress.MemorySummary;
import com.ngramengine.progress.ProgressReporter;
import com.ngramengine.table.InputColumns;
import com.ngramengine.table.JsonLinesReader;
import com.ngramengine.table.MessageNgramCount;
import com.ngramengine.table.MessageRecord;
import com.ngramengine.table.MessageTableSource;
import com.ngramengine.table.NgramDefinition;
import com.ngramengine.table.NgramResultStore;
import com.ngramengine.table.SliceableSource;
import com.ngramengine.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 主分析流程：JSON Lines 输入 → 消息表 → n-gram 生成与去重 → 结果表与运行清单。
 */
public class NgramAnalysis {
    private static final Logger logger = LoggerFactory.getLogger(NgramAnalysis.class);

    static final String STEP_LOAD = "load_messages";
    static final String STEP_WRITE = "write_results";

    private final EngineConfig config;
    private final MemoryMonitor monitor;
    private final Tokenizer tokenizer;
    private final MemoryAwareProgress progress;

    public NgramAnalysis(EngineConfig config, MemoryMonitor monitor, Tokenizer tokenizer, ProgressReporter reporter) {
        config.validate();
        this.config = config;
        this.monitor = monitor;
        this.tokenizer = tokenizer;
        this.progress = new MemoryAwareProgress(reporter, monitor);
    }

    /**
     * 执行完整分析并写出结果库与运行清单。
     *
     * @param input JSON Lines 输入文件
     * @param columns 输入列名
     * @param output 结果库路径，已存在时清空重建
     * @return 运行清单
     * @throws IOException 读取输入或写出清单失败时抛出
     */
    public RunManifest run(Path input, InputColumns columns, Path output) throws IOException {
        Instant startedAt = Instant.now();
        long startNanos = System.nanoTime();
        NgramParams params = new NgramParams(config.getMinN(), config.getMaxN());
        logger.info("开始分析: input={}, output={}, n=[{}, {}], budget={}MB", input, output,
            params.minN(), params.maxN(), String.format("%.1f", monitor.budget().budgetMb()));

        try (NgramResultStore store = NgramResultStore.create(output)) {
            long[] loaded = loadMessages(input, columns, store);

            SliceableSource<TokenizedRecord> source = new MessageTableSource(store)
                .select(message -> new TokenizedRecord(message.surrogateId(), tokenizer.tokenize(message.text())));
            OrchestrationResult result = new NgramOrchestrator(config, monitor, progress).run(source, params);

            progress.addStep(STEP_WRITE, "写入结果表", 2);
            progress.startStep(STEP_WRITE);
            int definitions = writeDefinitions(store, result.uniqueWords(), result.dictionary());
            progress.updateStep(STEP_WRITE, 1);
            long messageNgramRows = writeMessageNgrams(store, result.rows());
            progress.updateStep(STEP_WRITE, 2);
            progress.completeStep(STEP_WRITE);

            MemorySummary memory = progress.logMemorySummary();
            long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000L;
            RunManifest manifest = new RunManifest(
                input.toAbsolutePath().toString(),
                output.toAbsolutePath().toString(),
                params.minN(),
                params.maxN(),
                loaded[0],
                loaded[1],
                result.strategiesUsed(),
                result.escalations(),
                result.dedupStrategy(),
                result.rows().size(),
                messageNgramRows,
                definitions,
                memory.budgetBytes(),
                memory.peakResidentBytes(),
                memory.finalTier(),
                startedAt,
                elapsedMs);
            manifest.writeTo(RunManifest.manifestPathFor(output));
            logger.info("分析完成: messages={}, ngrams={}, messageNgrams={}, elapsed={}ms",
                loaded[1], definitions, messageNgramRows, elapsedMs);
            return manifest;
        }
    }

    /**
     * 流式读取输入并分批写入消息表，返回 {读取行数, 保留行数}。
     */
    private long[] loadMessages(Path input, InputColumns columns, NgramResultStore store) throws IOException {
        progress.addStep(STEP_LOAD, "导入消息", 0);
        progress.startStep(STEP_LOAD);
        try (JsonLinesReader reader = JsonLinesReader.open(input, columns)) {
            List<MessageRecord> batch = new ArrayList<>(Constants.TABLE_WRITE_BATCH_SIZE);
            while (reader.hasNext()) {
                batch.add(reader.next());
                if (batch.size() >= Constants.TABLE_WRITE_BATCH_SIZE) {
                    store.appendMessages(batch);
                    batch.clear();
                    progress.updateStep(STEP_LOAD, reader.getRowsKept());
                }
            }
            if (!batch.isEmpty()) {
                store.appendMessages(batch);
            }
            progress.completeStep(STEP_LOAD);
            logger.info("消息导入完成: read={}, kept={}", reader.getRowsRead(), reader.getRowsKept());
            return new long[] {reader.getRowsRead(), reader.getRowsKept()};
        } catch (RuntimeException exception) {
            progress.failStep(STEP_LOAD, String.valueOf(exception.getMessage()));
            throw exception;
        }
    }

    /**
     * 写入 n-gram 定义表，按编号升序。
     */
    static int writeDefinitions(NgramResultStore store, List<String> uniqueWords, NgramDictionary dictionary) {
        List<NgramDefinition> definitions = new ArrayList<>(uniqueWords.size());
        for (String words : uniqueWords) {
            int id = dictionary.lookup(words);
            if (id < 0) {
                throw new IllegalStateException("去重结果中的 n-gram 不在字典中: " + words);
            }
            definitions.add(new NgramDefinition(id, words, tokenCount(words)));
        }
        if (definitions.size() != dictionary.size()) {
            throw new IllegalStateException("唯一 n-gram 数与字典大小不一致: unique=" + definitions.size()
                + ", dictionary=" + dictionary.size());
        }
        definitions.sort(Comparator.comparingInt(NgramDefinition::ngramId));
        for (int from = 0; from < definitions.size(); from += Constants.TABLE_WRITE_BATCH_SIZE) {
            int to = Math.min(definitions.size(), from + Constants.TABLE_WRITE_BATCH_SIZE);
            store.appendNgramDefinitions(definitions.subList(from, to));
        }
        return definitions.size();
    }

    /**
     * 按消息聚合出现次数并写入，行按 (消息, n-gram 编号) 升序；依赖输入行按消息分组。
     */
    static long writeMessageNgrams(NgramResultStore store, List<NgramRow> rows) {
        List<MessageNgramCount> batch = new ArrayList<>(Constants.TABLE_WRITE_BATCH_SIZE);
        Map<Integer, Integer> countsForRecord = new TreeMap<>();
        long currentRecord = Long.MIN_VALUE;
        long written = 0L;
        for (NgramRow row : rows) {
            if (row.recordId() != currentRecord) {
                written += flushRecord(store, currentRecord, countsForRecord, batch);
                currentRecord = row.recordId();
            }
            countsForRecord.merge(row.ngramId(), 1, Integer::sum);
        }
        written += flushRecord(store, currentRecord, countsForRecord, batch);
        if (!batch.isEmpty()) {
            store.appendMessageNgrams(batch);
            batch.clear();
        }
        return written;
    }

    private static int flushRecord(NgramResultStore store, long recordId, Map<Integer, Integer> counts,
                                   List<MessageNgramCount> batch) {
        int flushed = counts.size();
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            batch.add(new MessageNgramCount(recordId, entry.getKey(), entry.getValue()));
            if (batch.size() >= Constants.TABLE_WRITE_BATCH_SIZE) {
                store.appendMessageNgrams(batch);
                batch.clear();
            }
        }
        counts.clear();
        return flushed;
    }

    static int tokenCount(String words) {
        int n = 1;
        for (int index = 0; index < words.length(); index++) {
            if (words.charAt(index) == ' ') {
                n++;
            }
        }
        return n;
    }
}
