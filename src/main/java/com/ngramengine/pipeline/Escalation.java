package com.ngramengine.pipeline;

/**
 * 一次策略升级记录。
 *
 * @param from 失败的策略
 * @param to 接替的策略
 * @param reason 失败原因
 */
public record Escalation(GenerationStrategy from, GenerationStrategy to, String reason) {
}
