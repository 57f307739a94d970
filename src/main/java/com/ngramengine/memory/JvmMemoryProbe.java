package com.ngramengine.memory;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;

/**
 * 基于 JMX 的内存探针：常驻内存取堆与非堆已用量之和，虚拟内存取两者已提交量之和。
 */
public final class JvmMemoryProbe implements MemoryProbe {
    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
    private final OperatingSystemMXBean operatingSystemBean = ManagementFactory.getOperatingSystemMXBean();

    @Override
    public long residentBytes() {
        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        MemoryUsage nonHeap = memoryBean.getNonHeapMemoryUsage();
        return heap.getUsed() + nonHeap.getUsed();
    }

    @Override
    public long virtualBytes() {
        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        MemoryUsage nonHeap = memoryBean.getNonHeapMemoryUsage();
        return heap.getCommitted() + nonHeap.getCommitted();
    }

    @Override
    public long totalSystemBytes() {
        if (operatingSystemBean instanceof com.sun.management.OperatingSystemMXBean) {
            return ((com.sun.management.OperatingSystemMXBean) operatingSystemBean).getTotalMemorySize();
        }
        return Runtime.getRuntime().maxMemory();
    }

    @Override
    public long processLimitBytes() {
        return Runtime.getRuntime().maxMemory();
    }
}
