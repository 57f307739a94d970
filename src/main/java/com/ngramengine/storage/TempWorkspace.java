package com.ngramengine.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 由单个策略实例独占的临时目录。
 *
 * 所有临时文件都在该目录下创建；{@link #close()} 删除全部文件与目录，删除失败只记录 WARN，不会抛出。
 */
public final class TempWorkspace implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TempWorkspace.class);

    private final Path directory;
    private final Set<Path> files = new LinkedHashSet<>();
    private int sequence;
    private boolean closed;

    private TempWorkspace(Path directory) {
        this.directory = directory;
    }

    /**
     * 在指定父目录（为空时使用系统临时目录）下创建独占工作目录。
     */
    public static TempWorkspace create(Path parent, String prefix) throws IOException {
        Path directory = parent == null
            ? Files.createTempDirectory(prefix)
            : Files.createTempDirectory(Files.createDirectories(parent), prefix);
        logger.debug("创建临时目录: {}", directory);
        return new TempWorkspace(directory);
    }

    /**
     * 在工作目录下分配一个新文件路径（文件已创建为空文件）。
     */
    public Path newFile(String prefix, String suffix) throws IOException {
        if (closed) {
            throw new IllegalStateException("TempWorkspace 已关闭: " + directory);
        }
        Path file = directory.resolve(String.format("%s-%05d%s", prefix, sequence++, suffix));
        Files.createFile(file);
        files.add(file);
        return file;
    }

    /**
     * 尽力删除单个文件。
     *
     * @return 删除成功或文件已不存在时返回 true
     */
    public boolean delete(Path file) {
        try {
            Files.deleteIfExists(file);
            files.remove(file);
            return true;
        } catch (IOException exception) {
            logger.warn("删除临时文件失败: {}", file, exception);
            return false;
        }
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * 当前仍登记在册的文件。
     */
    public List<Path> files() {
        return List.copyOf(files);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (Path file : new ArrayList<>(files)) {
            delete(file);
        }
        // 兜底清理不经 newFile 创建的文件
        try (Stream<Path> leftovers = Files.list(directory)) {
            leftovers.forEach(this::delete);
        } catch (IOException exception) {
            logger.warn("枚举临时目录失败: {}", directory, exception);
        }
        try {
            Files.deleteIfExists(directory);
            logger.debug("已删除临时目录: {}", directory);
        } catch (IOException exception) {
            logger.warn("删除临时目录失败: {}", directory, exception);
        }
    }
}
