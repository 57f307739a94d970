package com.ngramengine.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ngramengine.config.EngineConfig;
import com.ngramengine.memory.JvmMemoryProbe;
import com.ngramengine.memory.MemoryBudget;
import com.ngramengine.memory.MemoryMonitor;
import com.ngramengine.memory.MemoryProbe;
import com.ngramengine.memory.MemorySample;
import com.ngramengine.ngram.ResourceExhaustedException;
import com.ngramengine.pipeline.DedupStrategy;
import com.ngramengine.pipeline.GenerationStrategy;
import com.ngramengine.pipeline.NgramAnalysis;
import com.ngramengine.pipeline.NgramStatsAnalysis;
import com.ngramengine.pipeline.RunManifest;
import com.ngramengine.pipeline.StatsSummary;
import com.ngramengine.progress.ConsoleProgressReporter;
import com.ngramengine.table.InputColumns;
import com.ngramengine.table.NgramResultStore;
import com.ngramengine.text.BasicTokenizer;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "ngram-engine",
    description = "🧮 内存压力自适应的 n-gram 统计引擎",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.AnalyzeSubcommand.class,
        MainCommand.StatsSubcommand.class,
        MainCommand.MemorySubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🧮 内存压力自适应的 n-gram 统计引擎");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    static MemoryMonitor createMonitor(EngineConfig config) {
        MemoryProbe probe = new JvmMemoryProbe();
        MemoryBudget budget = config.getMemoryBudgetBytes() > 0
            ? MemoryBudget.explicit(config.getMemoryBudgetBytes(), probe)
            : MemoryBudget.autoDetect(probe);
        return new MemoryMonitor(probe, budget, config);
    }

    static String formatBytes(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        if (bytes < 1024 * 1024L) {
            return String.format("%.2f KB", bytes / 1024.0);
        }
        if (bytes < 1024 * 1024L * 1024L) {
            return String.format("%.2f MB", bytes / (1024.0 * 1024.0));
        }
        return String.format("%.2f GB", bytes / (1024.0 * 1024.0 * 1024.0));
    }

    @Command(name = "analyze", description = "📥 从 JSON Lines 文件生成 n-gram 结果库")
    static class AnalyzeSubcommand implements Callable<Integer> {

        @Parameters(description = "输入 JSON Lines 文件", arity = "1")
        private Path input;

        @Option(names = {"-o", "--output"}, description = "结果库路径", required = true)
        private Path output;

        @Option(names = {"--config"}, description = "JSON 配置文件")
        private Path configFile;

        @Option(names = {"--min-n"}, description = "最小 n")
        private Integer minN;

        @Option(names = {"--max-n"}, description = "最大 n")
        private Integer maxN;

        @Option(names = {"--memory-budget-mb"}, description = "内存预算（MB），缺省时自动推导")
        private Long memoryBudgetMb;

        @Option(names = {"--generation-strategy"}, description = "强制生成策略: ${COMPLETION-CANDIDATES}")
        private GenerationStrategy generationStrategy;

        @Option(names = {"--dedup-strategy"}, description = "强制去重策略: ${COMPLETION-CANDIDATES}")
        private DedupStrategy dedupStrategy;

        @Option(names = {"--temp-dir"}, description = "临时文件目录")
        private Path tempDir;

        @Option(names = {"--user-column"}, description = "作者列名", defaultValue = "user_id")
        private String userColumn;

        @Option(names = {"--message-id-column"}, description = "消息编号列名", defaultValue = "message_id")
        private String messageIdColumn;

        @Option(names = {"--text-column"}, description = "正文列名", defaultValue = "message_text")
        private String textColumn;

        @Option(names = {"--timestamp-column"}, description = "时间戳列名", defaultValue = "timestamp")
        private String timestampColumn;

        @Option(names = {"--stats"}, description = "同时生成重复 n-gram 统计", defaultValue = "false")
        private boolean withStats;

        @Override
        public Integer call() {
            System.out.println("🚀 开始分析...");
            System.out.println("📂 输入: " + input);
            System.out.println("💾 输出: " + output);
            try {
                EngineConfig config = resolveConfig();
                MemoryMonitor monitor = createMonitor(config);
                System.out.println("🧠 内存预算: " + formatBytes(monitor.budget().budgetBytes()));

                NgramAnalysis analysis = new NgramAnalysis(config, monitor, new BasicTokenizer(),
                    new ConsoleProgressReporter(System.out));
                RunManifest manifest = analysis.run(input,
                    new InputColumns(userColumn, messageIdColumn, textColumn, timestampColumn), output);

                System.out.println("✅ 分析完成！");
                System.out.println("📊 统计:");
                System.out.println("   消息数: " + manifest.messagesKept() + " / " + manifest.rowsRead());
                System.out.println("   n-gram 出现次数: " + manifest.ngramOccurrences());
                System.out.println("   唯一 n-gram: " + manifest.uniqueNgrams());
                System.out.println("   生成策略: " + manifest.strategiesUsed());
                System.out.println("   去重策略: " + manifest.dedupStrategy());
                System.out.println("   峰值内存: " + formatBytes(manifest.peakResidentBytes()));
                System.out.println("   用时: " + manifest.elapsedMs() + "ms");

                if (withStats) {
                    try (NgramResultStore store = NgramResultStore.open(output)) {
                        StatsSummary summary = new NgramStatsAnalysis(new ConsoleProgressReporter(System.out)).run(store);
                        System.out.println("   重复 n-gram: " + summary.statsRows());
                    }
                }
                return 0;
            } catch (ResourceExhaustedException exception) {
                System.err.println("❌ 内存不足，分析中止: " + exception.getMessage());
                return 1;
            } catch (Exception exception) {
                System.err.println("❌ 分析失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }

        private EngineConfig resolveConfig() throws IOException {
            EngineConfig config = configFile != null ? EngineConfig.load(configFile) : EngineConfig.defaults();
            if (minN != null) {
                config.setMinN(minN);
            }
            if (maxN != null) {
                config.setMaxN(maxN);
            }
            if (memoryBudgetMb != null) {
                config.setMemoryBudgetBytes(memoryBudgetMb * 1024L * 1024L);
            }
            if (generationStrategy != null) {
                config.setForcedGenerationStrategy(generationStrategy);
            }
            if (dedupStrategy != null) {
                config.setForcedDedupStrategy(dedupStrategy);
            }
            if (tempDir != null) {
                config.setTempDir(tempDir);
            }
            config.validate();
            return config;
        }
    }

    @Command(name = "stats", description = "📊 统计结果库中重复出现的 n-gram")
    static class StatsSubcommand implements Callable<Integer> {

        @Option(names = {"-o", "--output"}, description = "结果库路径", required = true)
        private Path output;

        @Override
        public Integer call() {
            try (NgramResultStore store = NgramResultStore.open(output)) {
                StatsSummary summary = new NgramStatsAnalysis(new ConsoleProgressReporter(System.out)).run(store);
                System.out.println("📊 统计完成");
                System.out.println("═══════════");
                System.out.println("🔁 重复 n-gram: " + summary.statsRows());
                System.out.println("📄 完整报告行数: " + summary.fullReportRows());
                System.out.println("📦 批次: " + summary.chunkCount() + " x " + summary.chunkSize());
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 统计失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "memory", description = "🧠 查看当前内存预算与压力")
    static class MemorySubcommand implements Callable<Integer> {

        @Option(names = {"--memory-budget-mb"}, description = "内存预算（MB），缺省时自动推导")
        private Long memoryBudgetMb;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @Override
        public Integer call() {
            try {
                EngineConfig config = EngineConfig.defaults();
                if (memoryBudgetMb != null) {
                    config.setMemoryBudgetBytes(memoryBudgetMb * 1024L * 1024L);
                }
                config.validate();
                MemoryMonitor monitor = createMonitor(config);
                MemorySample sample = monitor.sample();
                MemoryBudget budget = monitor.budget();

                if ("json".equalsIgnoreCase(format)) {
                    Map<String, Object> report = new LinkedHashMap<>();
                    report.put("timestamp", sample.timestamp());
                    report.put("residentBytes", sample.residentBytes());
                    report.put("virtualBytes", sample.virtualBytes());
                    report.put("budgetBytes", budget.budgetBytes());
                    report.put("systemBytes", budget.systemBytes());
                    report.put("usageRatio", monitor.usageRatio());
                    report.put("pressureTier", sample.pressureTier());
                    report.put("spillRowThreshold", budget.spillRowThreshold());
                    ObjectMapper mapper = new ObjectMapper()
                        .registerModule(new JavaTimeModule())
                        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
                    System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
                } else {
                    System.out.println("🧠 内存状态");
                    System.out.println("═══════════");
                    System.out.println("💾 常驻内存: " + formatBytes(sample.residentBytes()));
                    System.out.println("📦 预算: " + formatBytes(budget.budgetBytes()));
                    System.out.println("🖥️ 系统内存: " + formatBytes(budget.systemBytes()));
                    System.out.printf("📈 使用率: %.1f%%%n", monitor.usageRatio() * 100);
                    System.out.println("🚦 压力级别: " + sample.pressureTier());
                    System.out.println("💽 溢写阈值: " + budget.spillRowThreshold() + " 行");
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 获取内存状态失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}
