package com.ngramengine.pipeline;

import com.ngramengine.ngram.NgramDictionary;
import com.ngramengine.ngram.NgramRow;

import java.util.List;

/**
 * 编排结果。
 *
 * @param rows 按记录、位置顺序排列的全部 n-gram 出现
 * @param dictionary 本次运行的 n-gram 字典
 * @param uniqueWords 去重后按字典序排列的 n-gram 文本
 * @param strategiesUsed 依次尝试过的生成策略，最后一个为成功的策略
 * @param escalations 升级记录
 * @param dedupStrategy 实际使用的去重策略
 * @param windowCount 成功策略处理的窗口数
 * @param recordsProcessed 处理的记录数
 */
public record OrchestrationResult(
    List<NgramRow> rows,
    NgramDictionary dictionary,
    List<String> uniqueWords,
    List<GenerationStrategy> strategiesUsed,
    List<Escalation> escalations,
    DedupStrategy dedupStrategy,
    int windowCount,
    long recordsProcessed
) {
    public OrchestrationResult {
        strategiesUsed = List.copyOf(strategiesUsed);
        escalations = List.copyOf(escalations);
    }

    public GenerationStrategy finalStrategy() {
        return strategiesUsed.get(strategiesUsed.size() - 1);
    }
}
