package com.ngramengine.table;

/**
 * 输入 JSON 对象中各列的字段名。
 */
public record InputColumns(String userId, String messageId, String messageText, String timestamp) {

    public InputColumns {
        if (userId == null || messageText == null) {
            throw new IllegalArgumentException("作者列与正文列不能为空");
        }
    }

    public static InputColumns defaults() {
        return new InputColumns("user_id", "message_id", "message_text", "timestamp");
    }
}
