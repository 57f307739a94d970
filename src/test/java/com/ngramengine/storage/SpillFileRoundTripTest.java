package com.ngramengine.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 临时文件格式测试，覆盖溢写文件、有序分区文件 round-trip、CRC 防护与临时目录清理。
 */
class SpillFileRoundTripTest {

    @TempDir
    Path tempDir;

    /**
     * 验证溢写文件按写入顺序读回。
     */
    @Test
    void spillFileRoundTrip() throws IOException {
        Path spillFile = tempDir.resolve("window.spill");
        try (SpillFileWriter writer = new SpillFileWriter(spillFile)) {
            writer.writeRow(1L, 0, "a b");
            writer.writeRow(1L, 1, "b c");
            writer.writeRow(300_000L, 0, "a b");
            writer.writeRow(300_001L, 2, "搜 索");
            assertEquals(4, writer.getRowCount());
        }

        List<String> rows = new ArrayList<>();
        try (SpillFileReader reader = new SpillFileReader(spillFile)) {
            assertEquals(4, reader.rowCount());
            while (reader.advance()) {
                rows.add(reader.recordId() + ":" + reader.ngramId() + ":" + reader.words());
            }
            assertFalse(reader.advance());
        }
        assertEquals(List.of("1:0:a b", "1:1:b c", "300000:0:a b", "300001:2:搜 索"), rows);
    }

    /**
     * 记录编号为任意 long，负数与极值同样按原值读回；n-gram 编号仍要求非负。
     */
    @Test
    void spillFileKeepsNegativeRecordIds() throws IOException {
        Path spillFile = tempDir.resolve("signed.spill");
        try (SpillFileWriter writer = new SpillFileWriter(spillFile)) {
            writer.writeRow(-1L, 0, "x");
            writer.writeRow(Long.MIN_VALUE, 1, "y");
            writer.writeRow(Long.MAX_VALUE, 2, "z");
            assertThrows(IllegalArgumentException.class, () -> writer.writeRow(5L, -1, "w"));
        }

        List<Long> recordIds = new ArrayList<>();
        try (SpillFileReader reader = new SpillFileReader(spillFile)) {
            while (reader.advance()) {
                recordIds.add(reader.recordId());
            }
        }
        assertEquals(List.of(-1L, Long.MIN_VALUE, Long.MAX_VALUE), recordIds);
    }

    /**
     * 空溢写文件可以正常读取。
     */
    @Test
    void emptySpillFile() throws IOException {
        Path spillFile = tempDir.resolve("empty.spill");
        new SpillFileWriter(spillFile).close();

        try (SpillFileReader reader = new SpillFileReader(spillFile)) {
            assertEquals(0, reader.rowCount());
            assertFalse(reader.advance());
        }
    }

    /**
     * 有序分区文件顺序读回，并拒绝乱序写入。
     */
    @Test
    void sortedRunRoundTripAndOrdering() throws IOException {
        Path runFile = tempDir.resolve("partition.run");
        try (SortedRunWriter writer = new SortedRunWriter(runFile)) {
            writer.write("alpha");
            writer.write("beta");
            writer.write("gamma");
            assertThrows(IllegalArgumentException.class, () -> writer.write("gamma"));
            assertThrows(IllegalArgumentException.class, () -> writer.write("delta"));
        }

        try (SortedRunReader reader = new SortedRunReader(runFile)) {
            assertEquals(3, reader.valueCount());
            assertEquals("alpha", reader.next());
            assertEquals("beta", reader.next());
            assertEquals("gamma", reader.next());
            assertNull(reader.next());
        }
    }

    /**
     * 任一字节损坏都应在打开时被 CRC 校验发现。
     */
    @Test
    void crcCorruptionShouldThrow() throws IOException {
        Path spillFile = tempDir.resolve("corrupt.spill");
        try (SpillFileWriter writer = new SpillFileWriter(spillFile)) {
            writer.writeRow(7L, 3, "checksum test");
        }
        corruptOneByte(spillFile, 8);
        assertThrows(IOException.class, () -> new SpillFileReader(spillFile));

        Path runFile = tempDir.resolve("corrupt.run");
        try (SortedRunWriter writer = new SortedRunWriter(runFile)) {
            writer.write("checksum");
        }
        corruptOneByte(runFile, 2);
        assertThrows(IOException.class, () -> new SortedRunReader(runFile));
    }

    /**
     * 文件类型不匹配时拒绝读取。
     */
    @Test
    void magicMismatchShouldThrow() throws IOException {
        Path runFile = tempDir.resolve("partition.run");
        try (SortedRunWriter writer = new SortedRunWriter(runFile)) {
            writer.write("value");
        }
        assertThrows(IOException.class, () -> new SpillFileReader(runFile));
    }

    /**
     * 临时目录关闭后不残留任何文件。
     */
    @Test
    void workspaceCloseRemovesEverything() throws IOException {
        TempWorkspace workspace = TempWorkspace.create(tempDir, "spill-");
        Path first = workspace.newFile("window", ".spill");
        Path second = workspace.newFile("window", ".spill");
        Files.writeString(workspace.getDirectory().resolve("stray.tmp"), "x");
        assertTrue(Files.exists(first));
        assertEquals(2, workspace.files().size());

        assertTrue(workspace.delete(first));
        assertEquals(List.of(second), workspace.files());

        workspace.close();
        assertFalse(Files.exists(workspace.getDirectory()));
        assertThrows(IllegalStateException.class, () -> workspace.newFile("late", ".spill"));
    }

    private void corruptOneByte(Path file, long offset) throws IOException {
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(file.toFile(), "rw")) {
            randomAccessFile.seek(offset);
            int origin = randomAccessFile.readUnsignedByte();
            randomAccessFile.seek(offset);
            randomAccessFile.writeByte(origin ^ 0xFF);
        }
    }
}
