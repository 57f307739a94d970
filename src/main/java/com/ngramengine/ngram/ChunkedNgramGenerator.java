package com.ngramengine.ngram;

import com.ngramengine.config.Constants;
import com.ngramengine.memory.MemoryMonitor;
import com.ngramengine.memory.OperationKind;
import com.ngramengine.memory.WindowSizer;
import com.ngramengine.progress.ProgressReporter;

import java.util.ArrayList;
import java.util.List;

/**
 * 分块生成：窗口结果全部保留在内存中，按窗口顺序拼接。
 */
public class ChunkedNgramGenerator extends WindowedNgramGenerator {
    private List<NgramRow> collected = new ArrayList<>();

    public ChunkedNgramGenerator(MemoryMonitor monitor) {
        this(monitor, WindowSizer.adaptive(Constants.NGRAM_BASE_CHUNK_SIZE, OperationKind.NGRAM_GENERATION),
            WindowMaterializer.inMemory(), ProgressReporter.NOOP);
    }

    public ChunkedNgramGenerator(MemoryMonitor monitor, WindowSizer sizer, WindowMaterializer materializer,
                                 ProgressReporter reporter) {
        super(monitor, sizer, materializer, reporter);
    }

    @Override
    public String name() {
        return "chunked";
    }

    @Override
    protected String label() {
        return "分块生成 n-gram";
    }

    @Override
    protected void beginRun() {
        collected = new ArrayList<>();
    }

    @Override
    protected void acceptWindow(int windowIndex, List<NgramRow> rows) {
        collected.addAll(rows);
    }

    @Override
    protected List<NgramRow> finishRun(NgramDictionary dictionary) {
        return collected;
    }

    @Override
    protected void releaseRun() {
        collected = new ArrayList<>();
    }
}
