package com.ngramengine.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenizerTest {

    private final BasicTokenizer tokenizer = new BasicTokenizer();

    @Test
    @DisplayName("BasicTokenizer: 英文统一小写并去除标点")
    void testLowerCaseWords() {
        assertEquals(List.of("hello", "world", "again"), tokenizer.tokenize("Hello, World!  again"));
    }

    @Test
    @DisplayName("BasicTokenizer: 撇号连接的词保持完整")
    void testApostropheWords() {
        assertEquals(List.of("don't", "stop"), tokenizer.tokenize("Don't stop"));
    }

    @Test
    @DisplayName("BasicTokenizer: URL、提及与话题保持原样")
    void testSocialEntitiesPreserved() {
        List<String> tokens = tokenizer.tokenize("See https://Example.com/a?b=1. @Alice #BigNews now");

        assertEquals(List.of("see", "https://Example.com/a?b=1", "@Alice", "#BigNews", "now"), tokens);
    }

    @Test
    @DisplayName("BasicTokenizer: 中文逐字成词")
    void testCjkCharacters() {
        assertEquals(List.of("搜", "索", "引", "擎"), tokenizer.tokenize("搜索引擎"));
    }

    @Test
    @DisplayName("BasicTokenizer: 中英混合保持原文顺序")
    void testMixedScriptOrder() {
        assertEquals(List.of("java", "引", "擎", "v2"), tokenizer.tokenize("Java引擎 v2"));
    }

    @Test
    @DisplayName("BasicTokenizer: 西里尔字母小写")
    void testCyrillicLowerCase() {
        assertEquals(List.of("привет", "мир"), tokenizer.tokenize("Привет МИР"));
    }

    @Test
    @DisplayName("BasicTokenizer: 空文本与空白文本返回空列表")
    void testEmptyInput() {
        assertTrue(tokenizer.tokenize(null).isEmpty());
        assertTrue(tokenizer.tokenize("").isEmpty());
        assertTrue(tokenizer.tokenize("   \t\n").isEmpty());
        assertTrue(tokenizer.tokenize("?!... ,,").isEmpty());
    }

    @Test
    @DisplayName("BasicTokenizer: 相同输入结果确定")
    void testDeterministic() {
        String text = "Same #input, same @output 每次 一样";
        assertEquals(tokenizer.tokenize(text), tokenizer.tokenize(text));
    }

    @Test
    @DisplayName("BasicTokenizer: 词项非空且不含空白")
    void testTokensHaveNoWhitespace() {
        String text = "Visit https://example.com/a?b=1\u2003next ,  @user\u00a0#tag 搜索引擎 don't\tstop";
        for (String token : tokenizer.tokenize(text)) {
            assertTrue(!token.isEmpty() && token.chars().noneMatch(Character::isWhitespace), "非法词项: " + token);
        }
    }
}
