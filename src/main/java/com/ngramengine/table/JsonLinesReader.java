package com.ngramengine.table;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * JSON Lines 消息读取器，逐行流式解析，不会把整个文件读入内存。
 *
 * 代理编号为从 1 开始的输入行号，在过滤之前分配；正文或作者为空的行被跳过。
 */
public final class JsonLinesReader implements Iterator<MessageRecord>, AutoCloseable {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final MappingIterator<JsonNode> rows;
    private final InputColumns columns;
    private final Path file;
    private MessageRecord pending;
    private long rowsRead;
    private long rowsKept;

    private JsonLinesReader(MappingIterator<JsonNode> rows, InputColumns columns, Path file) {
        this.rows = rows;
        this.columns = columns;
        this.file = file;
    }

    public static JsonLinesReader open(Path file) throws IOException {
        return open(file, InputColumns.defaults());
    }

    /**
     * 打开 JSON Lines 文件。
     *
     * @throws IOException 文件无法打开时抛出
     */
    public static JsonLinesReader open(Path file, InputColumns columns) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("输入文件不能为空");
        }
        MappingIterator<JsonNode> rows = OBJECT_MAPPER.readerFor(JsonNode.class).readValues(file.toFile());
        return new JsonLinesReader(rows, columns, file);
    }

    /**
     * @throws UncheckedIOException 某一行不是合法 JSON 对象时抛出
     */
    @Override
    public boolean hasNext() {
        while (pending == null) {
            JsonNode node;
            try {
                if (!rows.hasNextValue()) {
                    return false;
                }
                node = rows.nextValue();
            } catch (IOException exception) {
                throw new UncheckedIOException(
                    new IOException("解析输入失败: file=" + file.getFileName() + ", row=" + (rowsRead + 1), exception));
            }
            rowsRead++;
            if (!node.isObject()) {
                throw new UncheckedIOException(
                    new IOException("输入行不是 JSON 对象: file=" + file.getFileName() + ", row=" + rowsRead));
            }
            String userId = textOf(node, columns.userId());
            String text = textOf(node, columns.messageText());
            if (userId == null || userId.isEmpty() || text == null || text.isEmpty()) {
                continue;
            }
            pending = new MessageRecord(rowsRead, userId, textOf(node, columns.messageId()), text,
                textOf(node, columns.timestamp()));
            rowsKept++;
        }
        return true;
    }

    @Override
    public MessageRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        MessageRecord record = pending;
        pending = null;
        return record;
    }

    /**
     * 已读取的输入行数（包括被过滤的行）。
     */
    public long getRowsRead() {
        return rowsRead;
    }

    public long getRowsKept() {
        return rowsKept;
    }

    @Override
    public void close() throws IOException {
        rows.close();
    }

    private static String textOf(JsonNode node, String field) {
        if (field == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
