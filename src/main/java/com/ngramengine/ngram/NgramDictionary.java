package com.ngramengine.ngram;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 单次运行内唯一的 n-gram 文本到编号映射。
 *
 * 编号按首次出现顺序从 0 开始分配；重复登记同一文本返回原编号，因此同一输入从头重放不会改变任何编号。
 * 由编排器独占持有并按引用传给各策略，不允许并发写入。
 */
public final class NgramDictionary {
    private final Map<String, Integer> idsByWords = new HashMap<>();
    private final List<String> wordsById = new ArrayList<>();

    /**
     * 返回文本对应的编号，首次出现时分配新编号。
     */
    public int idFor(String words) {
        if (words == null || words.isEmpty()) {
            throw new IllegalArgumentException("n-gram 文本不能为空");
        }
        Integer existing = idsByWords.get(words);
        if (existing != null) {
            return existing;
        }
        int id = wordsById.size();
        idsByWords.put(words, id);
        wordsById.add(words);
        return id;
    }

    /**
     * 查找已登记文本的编号，未登记时返回 -1。
     */
    public int lookup(String words) {
        Integer id = idsByWords.get(words);
        return id == null ? -1 : id;
    }

    /**
     * 编号对应的文本（与登记时为同一实例）。
     */
    public String wordsOf(int id) {
        if (id < 0 || id >= wordsById.size()) {
            throw new IllegalArgumentException("未知 n-gram 编号: " + id);
        }
        return wordsById.get(id);
    }

    public int size() {
        return wordsById.size();
    }
}
