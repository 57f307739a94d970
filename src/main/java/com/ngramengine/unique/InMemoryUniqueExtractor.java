package com.ngramengine.unique;

import com.ngramengine.progress.ProgressReporter;
import com.ngramengine.progress.SafeProgressReporter;
import com.ngramengine.table.SliceableSource;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * 内存去重：整列读入有序集合。
 */
public class InMemoryUniqueExtractor implements UniqueExtractor {
    private final ProgressReporter reporter;

    public InMemoryUniqueExtractor() {
        this(ProgressReporter.NOOP);
    }

    public InMemoryUniqueExtractor(ProgressReporter reporter) {
        this.reporter = SafeProgressReporter.wrap(reporter);
    }

    @Override
    public String name() {
        return "in_memory";
    }

    @Override
    public List<String> extractUnique(SliceableSource<String> values) {
        reporter.addSubstep(PROGRESS_STEP, name(), "内存去重", 1);
        reporter.startSubstep(PROGRESS_STEP, name());
        long total = values.count().orElse(Integer.MAX_VALUE);
        TreeSet<String> unique = new TreeSet<>(values.slice(0L, (int) Math.min(Integer.MAX_VALUE, total)));
        reporter.updateSubstep(PROGRESS_STEP, name(), 1);
        reporter.completeSubstep(PROGRESS_STEP, name());
        return new ArrayList<>(unique);
    }
}
