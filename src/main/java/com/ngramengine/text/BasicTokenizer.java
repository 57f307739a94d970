package com.ngramengine.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 面向社交媒体短文本的分词器。
 *
 * URL、@提及、#话题保持原样；普通词统一小写；中日文字符逐字成词。
 */
public class BasicTokenizer implements Tokenizer {

    private static final String CJK = "\\p{IsHan}\\p{IsHiragana}\\p{IsKatakana}";
    private static final String WORD_CHAR = "[\\p{L}\\p{N}\\p{M}&&[^" + CJK + "]]";

    private static final Pattern TOKEN_PATTERN = Pattern.compile(
        "(?<url>(?:https?://|www\\.)[^\\s\\p{Z}\\x1C-\\x1F]+)"
            + "|(?<mention>@[\\p{L}\\p{N}_]+)"
            + "|(?<hashtag>#[\\p{L}\\p{N}_]+)"
            + "|(?<cjk>[" + CJK + "])"
            + "|(?<word>" + WORD_CHAR + "+(?:['’]" + WORD_CHAR + "+)*)"
    );
    private static final String URL_TRAILING_PUNCTUATION = ".,!?;:)]}\"'";

    /**
     * 按出现顺序抽取词项。
     */
    @Override
    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN_PATTERN.matcher(text);
        while (matcher.find()) {
            if (matcher.group("url") != null) {
                String url = stripTrailingPunctuation(matcher.group("url"));
                if (!url.isEmpty()) {
                    tokens.add(url);
                }
            } else if (matcher.group("word") != null) {
                tokens.add(matcher.group("word").toLowerCase(Locale.ROOT));
            } else {
                tokens.add(matcher.group());
            }
        }
        return List.copyOf(tokens);
    }

    private static String stripTrailingPunctuation(String url) {
        int end = url.length();
        while (end > 0 && URL_TRAILING_PUNCTUATION.indexOf(url.charAt(end - 1)) >= 0) {
            end--;
        }
        return url.substring(0, end);
    }
}
