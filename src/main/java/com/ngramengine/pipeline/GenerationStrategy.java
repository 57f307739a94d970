package com.ngramengine.pipeline;

/**
 * n-gram 生成策略，按资源开销从低到高排列；同一次运行中只会向后升级。
 */
public enum GenerationStrategy {
    /** 一次性在内存中生成 */
    NORMAL,
    /** 按自适应窗口在内存中生成 */
    CHUNKED,
    /** 每个窗口溢写到临时文件 */
    DISK_SPILL;

    /**
     * 下一级策略，已是最高级时返回 null。
     */
    public GenerationStrategy next() {
        GenerationStrategy[] values = values();
        return ordinal() + 1 < values.length ? values[ordinal() + 1] : null;
    }
}
