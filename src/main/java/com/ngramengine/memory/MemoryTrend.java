package com.ngramengine.memory;

public enum MemoryTrend {
    INSUFFICIENT_DATA,
    INCREASING,
    DECREASING,
    STABLE
}
