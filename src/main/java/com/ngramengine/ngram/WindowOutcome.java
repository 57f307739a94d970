package com.ngramengine.ngram;

import java.util.List;

/**
 * 物化一个窗口的结果：成功（产出行与实际读取的记录数）或资源错误。
 */
public final class WindowOutcome {
    private final List<NgramRow> rows;
    private final int recordsRead;
    private final String errorMessage;

    private WindowOutcome(List<NgramRow> rows, int recordsRead, String errorMessage) {
        this.rows = rows;
        this.recordsRead = recordsRead;
        this.errorMessage = errorMessage;
    }

    public static WindowOutcome success(List<NgramRow> rows, int recordsRead) {
        return new WindowOutcome(rows, recordsRead, null);
    }

    public static WindowOutcome resourceError(String message) {
        return new WindowOutcome(List.of(), 0, message);
    }

    public boolean isSuccess() {
        return errorMessage == null;
    }

    public List<NgramRow> rows() {
        return rows;
    }

    public int recordsRead() {
        return recordsRead;
    }

    public String errorMessage() {
        return errorMessage;
    }
}
