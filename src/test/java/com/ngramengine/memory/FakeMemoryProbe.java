package com.ngramengine.memory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 可编程的内存探针：常驻内存可直接设置，或预置一串读数依次返回。
 */
public class FakeMemoryProbe implements MemoryProbe {
    private final Deque<Long> scriptedResidents = new ArrayDeque<>();
    private long residentBytes;
    private long totalSystemBytes;
    private long processLimitBytes = Long.MAX_VALUE;
    private boolean failing;

    public FakeMemoryProbe(long residentBytes, long totalSystemBytes) {
        this.residentBytes = residentBytes;
        this.totalSystemBytes = totalSystemBytes;
    }

    public void setResidentBytes(long residentBytes) {
        this.residentBytes = residentBytes;
    }

    /**
     * 预置后续读数；读完后保持最后一个值。
     */
    public void script(long... residents) {
        for (long resident : residents) {
            scriptedResidents.addLast(resident);
        }
    }

    public void setProcessLimitBytes(long processLimitBytes) {
        this.processLimitBytes = processLimitBytes;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    @Override
    public long residentBytes() {
        if (failing) {
            throw new IllegalStateException("probe unavailable");
        }
        if (!scriptedResidents.isEmpty()) {
            residentBytes = scriptedResidents.removeFirst();
        }
        return residentBytes;
    }

    @Override
    public long virtualBytes() {
        return residentBytes * 2;
    }

    @Override
    public long totalSystemBytes() {
        if (failing) {
            throw new IllegalStateException("probe unavailable");
        }
        return totalSystemBytes;
    }

    @Override
    public long processLimitBytes() {
        return processLimitBytes;
    }
}
