package com.ngramengine.ngram;

/**
 * 致命资源错误：窗口缩小到下限仍无法物化，或策略阶梯已无可升级的策略。
 */
public class ResourceExhaustedException extends RuntimeException {

    public ResourceExhaustedException(String message) {
        super(message);
    }

    public ResourceExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
