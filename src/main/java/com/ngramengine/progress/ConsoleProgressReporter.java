package com.ngramengine.progress;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 控制台进度输出，每个状态变化打印一行。
 */
public class ConsoleProgressReporter implements ProgressReporter {
    private final PrintStream out;
    private final Map<String, String> labels = new LinkedHashMap<>();
    private final Map<String, Long> totals = new LinkedHashMap<>();

    public ConsoleProgressReporter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void addStep(String stepId, String label, long total) {
        labels.put(stepId, label);
        totals.put(stepId, total);
    }

    @Override
    public void startStep(String stepId) {
        out.println("▶️ " + labelOf(stepId));
    }

    @Override
    public void updateStep(String stepId, long current) {
        long total = totals.getOrDefault(stepId, 0L);
        if (total > 0) {
            out.printf("   %s: %d/%d%n", labelOf(stepId), current, total);
        }
    }

    @Override
    public void completeStep(String stepId) {
        out.println("✅ " + labelOf(stepId));
    }

    @Override
    public void failStep(String stepId, String message) {
        out.println("❌ " + labelOf(stepId) + ": " + message);
    }

    @Override
    public void addSubstep(String parentId, String substepId, String label, long total) {
        String key = parentId + "/" + substepId;
        labels.put(key, label);
        totals.put(key, total);
    }

    @Override
    public void updateSubstep(String parentId, String substepId, long current) {
        String key = parentId + "/" + substepId;
        long total = totals.getOrDefault(key, 0L);
        if (total > 0) {
            out.printf("   ↳ %s: %d/%d%n", labelOf(key), current, total);
        } else {
            out.printf("   ↳ %s: %d%n", labelOf(key), current);
        }
    }

    @Override
    public void completeSubstep(String parentId, String substepId) {
        out.println("   ✔ " + labelOf(parentId + "/" + substepId));
    }

    @Override
    public void failSubstep(String parentId, String substepId, String message) {
        out.println("   ⚠️ " + labelOf(parentId + "/" + substepId) + ": " + message);
    }

    private String labelOf(String key) {
        return labels.getOrDefault(key, key);
    }
}
