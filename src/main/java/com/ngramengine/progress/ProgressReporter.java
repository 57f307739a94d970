package com.ngramengine.progress;

/**
 * 分层进度回调：步骤与其下的子步骤。
 *
 * 调用方不依赖任何回调的成功与否；实现抛出的异常由 {@link SafeProgressReporter} 吞掉并记录。
 */
public interface ProgressReporter {

    /** 不做任何事的实现 */
    ProgressReporter NOOP = new ProgressReporter() {
    };

    default void addStep(String stepId, String label, long total) {
    }

    default void startStep(String stepId) {
    }

    default void updateStep(String stepId, long current) {
    }

    default void completeStep(String stepId) {
    }

    default void failStep(String stepId, String message) {
    }

    default void addSubstep(String parentId, String substepId, String label, long total) {
    }

    default void startSubstep(String parentId, String substepId) {
    }

    default void updateSubstep(String parentId, String substepId, long current) {
    }

    default void completeSubstep(String parentId, String substepId) {
    }

    default void failSubstep(String parentId, String substepId, String message) {
    }
}
