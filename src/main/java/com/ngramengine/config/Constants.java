package com.ngramengine.config;

/**
 * 全局常量定义
 *
 * 包含临时文件格式魔数、内存压力阈值、分块参数、内存预算分档与 n-gram 参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 临时文件格式魔数 ====================
    /** 溢写文件魔数 "NGSP" */
    public static final int SPILL_MAGIC = 0x4E475350;
    /** 有序分区文件魔数 "NGSR" */
    public static final int SORTED_RUN_MAGIC = 0x4E475352;
    /** 文件格式版本号 */
    public static final short FORMAT_VERSION = 1;

    // ==================== 内存压力阈值 ====================
    /** MEDIUM 压力阈值（占预算比例） */
    public static final double MEDIUM_PRESSURE_THRESHOLD = 0.70;
    /** HIGH 压力阈值 */
    public static final double HIGH_PRESSURE_THRESHOLD = 0.80;
    /** CRITICAL 压力阈值 */
    public static final double CRITICAL_PRESSURE_THRESHOLD = 0.90;
    /** 默认 GC 触发阈值 */
    public static final double GC_TRIGGER_THRESHOLD = 0.70;
    /** 单次回收最多执行的 GC 轮数 */
    public static final int MAX_GC_PASSES = 3;
    /** 内存采样环形历史长度 */
    public static final int MEMORY_HISTORY_SIZE = 100;
    /** 趋势判断使用的最近采样数 */
    public static final int TREND_WINDOW = 5;

    // ==================== 分块参数 ====================
    /** 分块下限的绝对值部分 */
    public static final int MIN_CHUNK_SIZE = 1_000;
    /** 分块下限相对基准大小的除数 */
    public static final int MIN_CHUNK_DIVISOR = 10;
    /** OOM 重试时的缩小除数 */
    public static final int OOM_SHRINK_DIVISOR = 4;
    /** OOM 重试允许的最小窗口 */
    public static final int OOM_MIN_WINDOW = 500;
    /** 未知总量时连续空窗口的终止次数 */
    public static final int MAX_CONSECUTIVE_EMPTY_WINDOWS = 3;
    /** 分块生成的基准窗口记录数 */
    public static final int NGRAM_BASE_CHUNK_SIZE = 50_000;
    /** 磁盘溢写生成的基准窗口记录数 */
    public static final int DISK_SPILL_BASE_CHUNK_SIZE = 5_000;
    /** 外部排序分区的基准行数 */
    public static final int EXTERNAL_SORT_BASE_CHUNK_SIZE = 10_000;
    /** 直接生成切换为分块生成的记录数阈值 */
    public static final long CHUNKED_GENERATION_THRESHOLD = 100_000L;

    // ==================== 内存预算分档 ====================
    private static final long GIB = 1024L * 1024 * 1024;
    /** 32GB 级别系统内存 */
    public static final long SYSTEM_MEMORY_32_GB = 32L * GIB;
    /** 16GB 级别系统内存 */
    public static final long SYSTEM_MEMORY_16_GB = 16L * GIB;
    /** 8GB 级别系统内存 */
    public static final long SYSTEM_MEMORY_8_GB = 8L * GIB;
    /** 各档位自动预算比例：>=32GB / >=16GB / >=8GB / 其他 */
    public static final double BUDGET_RATIO_32_GB = 0.40;
    public static final double BUDGET_RATIO_16_GB = 0.30;
    public static final double BUDGET_RATIO_8_GB = 0.25;
    public static final double BUDGET_RATIO_SMALL = 0.20;
    /** 各档位磁盘溢写/外部排序行数阈值 */
    public static final long SPILL_ROWS_32_GB = 3_000_000L;
    public static final long SPILL_ROWS_16_GB = 1_500_000L;
    public static final long SPILL_ROWS_8_GB = 500_000L;
    public static final long SPILL_ROWS_SMALL = 250_000L;

    // ==================== n-gram 参数 ====================
    /** 默认最小 n */
    public static final int DEFAULT_MIN_N = 3;
    /** 默认最大 n */
    public static final int DEFAULT_MAX_N = 5;
    /** n 的上限 */
    public static final int MAX_NGRAM_LENGTH = 15;
    /** 结果表批量写入行数 */
    public static final int TABLE_WRITE_BATCH_SIZE = 5_000;
    /** 完整报告每批处理的 n-gram 数上限 */
    public static final int FULL_REPORT_MAX_CHUNK = 1_000;
    /** 内存压力警告的最小间隔（毫秒） */
    public static final long MEMORY_WARNING_INTERVAL_MS = 30_000L;
}
