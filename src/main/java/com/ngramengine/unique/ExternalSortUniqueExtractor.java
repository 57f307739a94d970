package com.ngramengine.unique;

import com.ngramengine.config.Constants;
import com.ngramengine.memory.MemoryMonitor;
import com.ngramengine.memory.OperationKind;
import com.ngramengine.memory.WindowSizer;
import com.ngramengine.progress.ProgressReporter;
import com.ngramengine.progress.SafeProgressReporter;
import com.ngramengine.storage.SortedRunReader;
import com.ngramengine.storage.SortedRunWriter;
import com.ngramengine.storage.TempWorkspace;
import com.ngramengine.table.SliceableSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalLong;
import java.util.PriorityQueue;
import java.util.TreeSet;

/**
 * 外部排序去重。
 *
 * 第一阶段按自适应大小切分输入，每个分区在内存中去重排序后写成有序分区文件；
 * 第二阶段为每个分区打开顺序游标，用最小堆做 k 路归并，与上一个输出值相同的值被跳过；
 * 第三阶段无论归并成功与否都删除全部分区文件。任意时刻内存中只有每个分区的当前值。
 */
public class ExternalSortUniqueExtractor implements UniqueExtractor {
    private static final Logger logger = LoggerFactory.getLogger(ExternalSortUniqueExtractor.class);

    private final MemoryMonitor monitor;
    private final WindowSizer sizer;
    private final ProgressReporter reporter;
    private final Path tempParent;
    private final RunOpener runOpener;

    public ExternalSortUniqueExtractor(MemoryMonitor monitor, Path tempParent) {
        this(monitor, WindowSizer.adaptive(Constants.EXTERNAL_SORT_BASE_CHUNK_SIZE, OperationKind.UNIQUE_EXTRACTION),
            ProgressReporter.NOOP, tempParent);
    }

    public ExternalSortUniqueExtractor(MemoryMonitor monitor, WindowSizer sizer, ProgressReporter reporter,
                                       Path tempParent) {
        this(monitor, sizer, reporter, tempParent, SortedRunReader::new);
    }

    ExternalSortUniqueExtractor(MemoryMonitor monitor, WindowSizer sizer, ProgressReporter reporter, Path tempParent,
                                RunOpener runOpener) {
        this.monitor = monitor;
        this.sizer = sizer;
        this.reporter = SafeProgressReporter.wrap(reporter);
        this.tempParent = tempParent;
        this.runOpener = runOpener;
    }

    @Override
    public String name() {
        return "external_sort";
    }

    @Override
    public List<String> extractUnique(SliceableSource<String> values) {
        TempWorkspace workspace;
        try {
            workspace = TempWorkspace.create(tempParent, "ngram-sort-");
        } catch (IOException exception) {
            throw new UncheckedIOException("创建排序临时目录失败: parent=" + tempParent, exception);
        }
        logger.info("外部排序去重已启用: dir={}", workspace.getDirectory());
        try {
            List<Path> partitions = writePartitions(values, workspace);
            return mergePartitions(partitions);
        } finally {
            workspace.close();
        }
    }

    private List<Path> writePartitions(SliceableSource<String> values, TempWorkspace workspace) {
        OptionalLong total = values.count();
        long estimatedPartitions = 0L;
        if (total.isPresent()) {
            int initialSize = sizer.windowSize(monitor.pressureTier());
            estimatedPartitions = (total.getAsLong() + initialSize - 1) / initialSize;
        }
        reporter.addSubstep(PROGRESS_STEP, "partition", "写入有序分区", estimatedPartitions);
        reporter.startSubstep(PROGRESS_STEP, "partition");
        List<Path> partitions = new ArrayList<>();
        long offset = 0L;
        int emptyWindows = 0;
        int partitionIndex = 0;
        while (total.isEmpty() || offset < total.getAsLong()) {
            int size = sizer.windowSize(monitor.sample().pressureTier());
            List<String> slice = values.slice(offset, size);
            if (slice.isEmpty()) {
                if (total.isPresent()) {
                    break;
                }
                emptyWindows++;
                if (emptyWindows >= Constants.MAX_CONSECUTIVE_EMPTY_WINDOWS) {
                    break;
                }
                continue;
            }
            emptyWindows = 0;
            offset += slice.size();
            TreeSet<String> sortedUnique = new TreeSet<>(slice);
            Path partition = null;
            try {
                partition = workspace.newFile("partition", ".run");
                try (SortedRunWriter writer = new SortedRunWriter(partition)) {
                    for (String value : sortedUnique) {
                        writer.write(value);
                    }
                }
                partitions.add(partition);
            } catch (IOException exception) {
                logger.warn("写入分区 {} 失败，已跳过 {} 个值", partitionIndex, sortedUnique.size(), exception);
                if (partition != null) {
                    workspace.delete(partition);
                }
            }
            partitionIndex++;
            reporter.updateSubstep(PROGRESS_STEP, "partition", partitionIndex);
        }
        reporter.completeSubstep(PROGRESS_STEP, "partition");
        logger.debug("分区完成: partitions={}, values={}", partitions.size(), offset);
        return partitions;
    }

    private List<String> mergePartitions(List<Path> partitions) {
        reporter.addSubstep(PROGRESS_STEP, "merge", "归并有序分区", partitions.size());
        reporter.startSubstep(PROGRESS_STEP, "merge");
        List<SortedRunReader> cursors = new ArrayList<>(partitions.size());
        try {
            List<String> result = new ArrayList<>();
            if (partitions.size() == 1) {
                // 单个分区本身已有序去重
                SortedRunReader cursor = runOpener.open(partitions.get(0));
                cursors.add(cursor);
                for (String value = cursor.next(); value != null; value = cursor.next()) {
                    result.add(value);
                }
            } else if (!partitions.isEmpty()) {
                mergeInto(partitions, cursors, result);
            }
            reporter.completeSubstep(PROGRESS_STEP, "merge");
            logger.info("外部排序去重完成: partitions={}, unique={}", partitions.size(), result.size());
            return result;
        } catch (IOException exception) {
            reporter.failSubstep(PROGRESS_STEP, "merge", exception.getMessage());
            throw new UncheckedIOException("归并有序分区失败", exception);
        } finally {
            for (SortedRunReader cursor : cursors) {
                try {
                    cursor.close();
                } catch (IOException exception) {
                    logger.warn("关闭分区游标失败", exception);
                }
            }
        }
    }

    private void mergeInto(List<Path> partitions, List<SortedRunReader> cursors, List<String> result)
        throws IOException {
        PriorityQueue<HeapEntry> heap = new PriorityQueue<>(
            Comparator.comparing(HeapEntry::value).thenComparingInt(HeapEntry::partitionIndex));
        for (int index = 0; index < partitions.size(); index++) {
            SortedRunReader cursor = runOpener.open(partitions.get(index));
            cursors.add(cursor);
            String first = cursor.next();
            if (first != null) {
                heap.add(new HeapEntry(first, index));
            }
        }
        String lastEmitted = null;
        while (!heap.isEmpty()) {
            HeapEntry smallest = heap.poll();
            if (!smallest.value().equals(lastEmitted)) {
                result.add(smallest.value());
                lastEmitted = smallest.value();
            }
            String next = cursors.get(smallest.partitionIndex()).next();
            if (next != null) {
                heap.add(new HeapEntry(next, smallest.partitionIndex()));
            }
        }
    }

    private record HeapEntry(String value, int partitionIndex) {
    }

    /**
     * 打开分区游标。
     */
    @FunctionalInterface
    interface RunOpener {
        SortedRunReader open(Path partition) throws IOException;
    }
}
