package com.ngramengine.ngram;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NgramDictionaryTest {

    @Test
    @DisplayName("编号按首次出现顺序从 0 分配，重复登记返回原编号")
    void testInsertionOrderAndIdempotence() {
        NgramDictionary dictionary = new NgramDictionary();

        assertEquals(0, dictionary.idFor("b c"));
        assertEquals(1, dictionary.idFor("a b"));
        assertEquals(0, dictionary.idFor("b c"));
        assertEquals(2, dictionary.size());
        assertEquals("a b", dictionary.wordsOf(1));
        assertEquals(1, dictionary.lookup("a b"));
        assertEquals(-1, dictionary.lookup("missing"));
    }

    @Test
    void testRejectsInvalidInput() {
        NgramDictionary dictionary = new NgramDictionary();

        assertThrows(IllegalArgumentException.class, () -> dictionary.idFor(""));
        assertThrows(IllegalArgumentException.class, () -> dictionary.idFor(null));
        assertThrows(IllegalArgumentException.class, () -> dictionary.wordsOf(0));
    }

    @Test
    @DisplayName("按记录、起始位置、n 的顺序抽取，词项以单个空格连接")
    void testExtractorOrder() {
        NgramDictionary dictionary = new NgramDictionary();
        List<TokenizedRecord> records = List.of(
            new TokenizedRecord(7, List.of("x", "y", "z")),
            new TokenizedRecord(9, List.of("y", "z")));

        List<NgramRow> rows = NgramExtractor.extract(records, new NgramParams(1, 2), dictionary);

        List<String> words = rows.stream().map(NgramRow::words).toList();
        assertEquals(List.of("x", "x y", "y", "y z", "z", "y", "y z", "z"), words);
        assertEquals(7, rows.get(0).recordId());
        assertEquals(9, rows.get(5).recordId());
        assertEquals(rows.get(3).ngramId(), rows.get(6).ngramId());
        assertEquals(5, dictionary.size());
    }

    @Test
    @DisplayName("空词项被丢弃，min_n 为 1 时不会生成空 n-gram")
    void testEmptyTokensDropped() {
        NgramDictionary dictionary = new NgramDictionary();
        TokenizedRecord record = new TokenizedRecord(3, Arrays.asList("", "p", null, "q", ""));

        assertEquals(List.of("p", "q"), record.tokens());
        List<NgramRow> rows = NgramExtractor.extract(List.of(record), new NgramParams(1, 2), dictionary);
        assertEquals(List.of("p", "p q", "q"), rows.stream().map(NgramRow::words).toList());
    }

    @Test
    @DisplayName("含空白的词项会与多词 n-gram 冲突，构造时拒绝")
    void testWhitespaceTokensRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new TokenizedRecord(1, List.of("new york", "city")));
        assertThrows(IllegalArgumentException.class,
            () -> new TokenizedRecord(1, List.of("tab\there")));
        assertThrows(IllegalArgumentException.class, () -> new TokenizedRecord(1, null));
    }

    @Test
    void testParamsValidationAndCount() {
        assertThrows(IllegalArgumentException.class, () -> new NgramParams(0, 2));
        assertThrows(IllegalArgumentException.class, () -> new NgramParams(3, 2));
        assertThrows(IllegalArgumentException.class, () -> new NgramParams(1, 16));

        NgramParams params = new NgramParams(2, 3);
        assertEquals(0, params.countFor(1));
        assertEquals(1, params.countFor(2));
        assertEquals(3 + 2, params.countFor(4));
    }
}
