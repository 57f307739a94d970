package com.ngramengine.memory;

/**
 * 进程与系统内存探针。
 */
public interface MemoryProbe {

    /**
     * 当前进程常驻内存字节数。
     */
    long residentBytes();

    /**
     * 当前进程已申请的虚拟内存字节数。
     */
    long virtualBytes();

    /**
     * 系统物理内存总量。
     */
    long totalSystemBytes();

    /**
     * 进程可用内存上限，无上限时返回 {@link Long#MAX_VALUE}。
     */
    default long processLimitBytes() {
        return Long.MAX_VALUE;
    }
}
