package com.ngramengine.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ngramengine.memory.PressureTier;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * 一次分析运行的清单，写在结果库旁边（{@code <db>.manifest.json}）。
 */
public record RunManifest(
    String inputFile,
    String outputFile,
    int minN,
    int maxN,
    long rowsRead,
    long messagesKept,
    List<GenerationStrategy> strategiesUsed,
    List<Escalation> escalations,
    DedupStrategy dedupStrategy,
    long ngramOccurrences,
    long messageNgramRows,
    long uniqueNgrams,
    long memoryBudgetBytes,
    long peakResidentBytes,
    PressureTier finalTier,
    Instant startedAt,
    long elapsedMs
) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public RunManifest {
        strategiesUsed = strategiesUsed == null ? List.of() : List.copyOf(strategiesUsed);
        escalations = escalations == null ? List.of() : List.copyOf(escalations);
    }

    /**
     * 结果库对应的清单文件路径。
     */
    public static Path manifestPathFor(Path dbPath) {
        return dbPath.resolveSibling(dbPath.getFileName() + ".manifest.json");
    }

    /**
     * 写入 JSON 文件。
     *
     * @throws IOException 写入失败时抛出
     */
    public void writeTo(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("清单文件不能为空");
        }
        try {
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), this);
        } catch (IOException exception) {
            throw new IOException("写入运行清单失败: " + file.toAbsolutePath(), exception);
        }
    }

    /**
     * 从 JSON 文件读取。
     *
     * @throws IOException 读取或解析失败时抛出
     */
    public static RunManifest readFrom(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("清单文件不能为空");
        }
        try {
            return OBJECT_MAPPER.readValue(file.toFile(), RunManifest.class);
        } catch (IOException exception) {
            throw new IOException("读取运行清单失败: " + file.toAbsolutePath(), exception);
        }
    }
}
