package com.ngramengine.text;

import java.util.List;

public interface Tokenizer {

    /**
     * 将输入文本切分为有序词项列表；相同输入必须得到相同输出。
     *
     * 词项非空且不含空白字符：n-gram 文本以单个空格连接词项，词数按空格计算。
     */
    List<String> tokenize(String text);
}
