package com.ngramengine.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ngramengine.pipeline.DedupStrategy;
import com.ngramengine.pipeline.GenerationStrategy;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 引擎运行时配置
 *
 * 支持从CLI参数或JSON配置文件注入，覆盖Constants默认值
 */
public class EngineConfig {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private long memoryBudgetBytes;
    private int minN = Constants.DEFAULT_MIN_N;
    private int maxN = Constants.DEFAULT_MAX_N;
    private int ngramChunkSize = Constants.NGRAM_BASE_CHUNK_SIZE;
    private int diskSpillChunkSize = Constants.DISK_SPILL_BASE_CHUNK_SIZE;
    private int externalSortChunkSize = Constants.EXTERNAL_SORT_BASE_CHUNK_SIZE;
    private double mediumThreshold = Constants.MEDIUM_PRESSURE_THRESHOLD;
    private double highThreshold = Constants.HIGH_PRESSURE_THRESHOLD;
    private double criticalThreshold = Constants.CRITICAL_PRESSURE_THRESHOLD;
    private int memoryHistorySize = Constants.MEMORY_HISTORY_SIZE;
    private Path tempDir;
    private GenerationStrategy forcedGenerationStrategy;
    private DedupStrategy forcedDedupStrategy;

    /**
     * 显式内存预算（字节），0 表示按系统内存自动推导
     */
    public long getMemoryBudgetBytes() {
        return memoryBudgetBytes;
    }

    public void setMemoryBudgetBytes(long memoryBudgetBytes) {
        this.memoryBudgetBytes = memoryBudgetBytes;
    }

    public int getMinN() {
        return minN;
    }

    public void setMinN(int minN) {
        this.minN = minN;
    }

    public int getMaxN() {
        return maxN;
    }

    public void setMaxN(int maxN) {
        this.maxN = maxN;
    }

    public int getNgramChunkSize() {
        return ngramChunkSize;
    }

    public void setNgramChunkSize(int ngramChunkSize) {
        this.ngramChunkSize = ngramChunkSize;
    }

    public int getDiskSpillChunkSize() {
        return diskSpillChunkSize;
    }

    public void setDiskSpillChunkSize(int diskSpillChunkSize) {
        this.diskSpillChunkSize = diskSpillChunkSize;
    }

    public int getExternalSortChunkSize() {
        return externalSortChunkSize;
    }

    public void setExternalSortChunkSize(int externalSortChunkSize) {
        this.externalSortChunkSize = externalSortChunkSize;
    }

    public double getMediumThreshold() {
        return mediumThreshold;
    }

    public void setMediumThreshold(double mediumThreshold) {
        this.mediumThreshold = mediumThreshold;
    }

    public double getHighThreshold() {
        return highThreshold;
    }

    public void setHighThreshold(double highThreshold) {
        this.highThreshold = highThreshold;
    }

    public double getCriticalThreshold() {
        return criticalThreshold;
    }

    public void setCriticalThreshold(double criticalThreshold) {
        this.criticalThreshold = criticalThreshold;
    }

    public int getMemoryHistorySize() {
        return memoryHistorySize;
    }

    public void setMemoryHistorySize(int memoryHistorySize) {
        this.memoryHistorySize = memoryHistorySize;
    }

    /**
     * 临时文件目录，为空时使用系统临时目录
     */
    public Path getTempDir() {
        return tempDir;
    }

    public void setTempDir(Path tempDir) {
        this.tempDir = tempDir;
    }

    public GenerationStrategy getForcedGenerationStrategy() {
        return forcedGenerationStrategy;
    }

    public void setForcedGenerationStrategy(GenerationStrategy forcedGenerationStrategy) {
        this.forcedGenerationStrategy = forcedGenerationStrategy;
    }

    public DedupStrategy getForcedDedupStrategy() {
        return forcedDedupStrategy;
    }

    public void setForcedDedupStrategy(DedupStrategy forcedDedupStrategy) {
        this.forcedDedupStrategy = forcedDedupStrategy;
    }

    /**
     * 校验参数组合是否合法
     *
     * @throws IllegalArgumentException 参数非法时抛出
     */
    public void validate() {
        if (minN < 1) {
            throw new IllegalArgumentException("minN 必须为正整数: " + minN);
        }
        if (maxN < minN) {
            throw new IllegalArgumentException("maxN 不能小于 minN: minN=" + minN + ", maxN=" + maxN);
        }
        if (maxN > Constants.MAX_NGRAM_LENGTH) {
            throw new IllegalArgumentException("maxN 超过上限 " + Constants.MAX_NGRAM_LENGTH + ": " + maxN);
        }
        if (memoryBudgetBytes < 0) {
            throw new IllegalArgumentException("内存预算不能为负数: " + memoryBudgetBytes);
        }
        if (ngramChunkSize <= 0 || diskSpillChunkSize <= 0 || externalSortChunkSize <= 0) {
            throw new IllegalArgumentException("分块大小必须为正数");
        }
        if (!(0 < mediumThreshold && mediumThreshold < highThreshold
            && highThreshold < criticalThreshold && criticalThreshold <= 1.0)) {
            throw new IllegalArgumentException("压力阈值必须严格递增且位于 (0, 1]: "
                + mediumThreshold + "/" + highThreshold + "/" + criticalThreshold);
        }
        if (memoryHistorySize < Constants.TREND_WINDOW) {
            throw new IllegalArgumentException("内存历史长度不能小于 " + Constants.TREND_WINDOW + ": " + memoryHistorySize);
        }
    }

    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * 从 JSON 配置文件加载，未出现的字段保持默认值
     *
     * @param file 配置文件
     * @return 加载并校验后的配置
     * @throws IOException 读取或解析失败时抛出
     */
    public static EngineConfig load(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("配置文件不能为空");
        }
        EngineConfig config;
        try {
            config = OBJECT_MAPPER.readValue(file.toFile(), EngineConfig.class);
        } catch (IOException exception) {
            throw new IOException("读取配置文件失败: " + file.toAbsolutePath(), exception);
        }
        config.validate();
        return config;
    }
}
