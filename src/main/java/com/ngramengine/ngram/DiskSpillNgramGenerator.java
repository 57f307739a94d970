package com.ngramengine.ngram;

import com.ngramengine.config.Constants;
import com.ngramengine.memory.MemoryMonitor;
import com.ngramengine.memory.OperationKind;
import com.ngramengine.memory.WindowSizer;
import com.ngramengine.progress.ProgressReporter;
import com.ngramengine.storage.SpillFileReader;
import com.ngramengine.storage.SpillFileWriter;
import com.ngramengine.storage.TempWorkspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 磁盘溢写生成：每个窗口的结果立即写入独立的临时文件。
 *
 * 全部窗口完成后按窗口顺序读回并一次性物化，物化完成后才删除临时文件；
 * 任何异常退出时临时目录同样被删除。
 */
public class DiskSpillNgramGenerator extends WindowedNgramGenerator {
    private static final Logger logger = LoggerFactory.getLogger(DiskSpillNgramGenerator.class);

    private final Path tempParent;
    private TempWorkspace workspace;
    private final List<Path> spillFiles = new ArrayList<>();

    public DiskSpillNgramGenerator(MemoryMonitor monitor, Path tempParent) {
        this(monitor, WindowSizer.adaptive(Constants.DISK_SPILL_BASE_CHUNK_SIZE, OperationKind.NGRAM_GENERATION),
            WindowMaterializer.inMemory(), ProgressReporter.NOOP, tempParent);
    }

    public DiskSpillNgramGenerator(MemoryMonitor monitor, WindowSizer sizer, WindowMaterializer materializer,
                                   ProgressReporter reporter, Path tempParent) {
        super(monitor, sizer, materializer, reporter);
        this.tempParent = tempParent;
    }

    @Override
    public String name() {
        return "disk_spill";
    }

    @Override
    protected String label() {
        return "溢写生成 n-gram";
    }

    @Override
    protected void beginRun() {
        spillFiles.clear();
        try {
            workspace = TempWorkspace.create(tempParent, "ngram-spill-");
        } catch (IOException exception) {
            throw new UncheckedIOException("创建溢写目录失败: parent=" + tempParent, exception);
        }
        logger.info("磁盘溢写已启用: dir={}", workspace.getDirectory());
    }

    @Override
    protected void acceptWindow(int windowIndex, List<NgramRow> rows) {
        try {
            Path spillFile = workspace.newFile("window", ".spill");
            try (SpillFileWriter writer = new SpillFileWriter(spillFile)) {
                for (NgramRow row : rows) {
                    writer.writeRow(row.recordId(), row.ngramId(), row.words());
                }
            }
            spillFiles.add(spillFile);
            logger.debug("窗口 {} 已溢写: file={}, rows={}", windowIndex, spillFile.getFileName(), rows.size());
        } catch (IOException exception) {
            throw new UncheckedIOException("写入溢写文件失败: window=" + windowIndex, exception);
        }
    }

    @Override
    protected List<NgramRow> finishRun(NgramDictionary dictionary) {
        List<NgramRow> rows = new ArrayList<>();
        for (Path spillFile : spillFiles) {
            try (SpillFileReader reader = new SpillFileReader(spillFile)) {
                while (reader.advance()) {
                    String words = dictionary.wordsOf(reader.ngramId());
                    if (!words.equals(reader.words())) {
                        throw new IOException("溢写文件内容与字典不一致: ngramId=" + reader.ngramId());
                    }
                    rows.add(new NgramRow(reader.recordId(), reader.ngramId(), words));
                }
            } catch (IOException exception) {
                throw new UncheckedIOException("读回溢写文件失败: " + spillFile.getFileName(), exception);
            }
        }
        return rows;
    }

    @Override
    protected void releaseRun() {
        if (workspace != null) {
            workspace.close();
            workspace = null;
        }
        spillFiles.clear();
    }
}
