package com.ngramengine.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 进度回调的保护层：被包装实现的任何运行时异常都只记录 WARN，不会传播给处理流程。
 */
public final class SafeProgressReporter implements ProgressReporter {
    private static final Logger logger = LoggerFactory.getLogger(SafeProgressReporter.class);

    private final ProgressReporter delegate;

    private SafeProgressReporter(ProgressReporter delegate) {
        this.delegate = delegate;
    }

    /**
     * 包装回调；null 视为 {@link ProgressReporter#NOOP}，已包装的实例原样返回。
     */
    public static ProgressReporter wrap(ProgressReporter reporter) {
        if (reporter == null) {
            return NOOP;
        }
        if (reporter == NOOP || reporter instanceof SafeProgressReporter) {
            return reporter;
        }
        return new SafeProgressReporter(reporter);
    }

    @Override
    public void addStep(String stepId, String label, long total) {
        guard("addStep", stepId, () -> delegate.addStep(stepId, label, total));
    }

    @Override
    public void startStep(String stepId) {
        guard("startStep", stepId, () -> delegate.startStep(stepId));
    }

    @Override
    public void updateStep(String stepId, long current) {
        guard("updateStep", stepId, () -> delegate.updateStep(stepId, current));
    }

    @Override
    public void completeStep(String stepId) {
        guard("completeStep", stepId, () -> delegate.completeStep(stepId));
    }

    @Override
    public void failStep(String stepId, String message) {
        guard("failStep", stepId, () -> delegate.failStep(stepId, message));
    }

    @Override
    public void addSubstep(String parentId, String substepId, String label, long total) {
        guard("addSubstep", parentId + "/" + substepId, () -> delegate.addSubstep(parentId, substepId, label, total));
    }

    @Override
    public void startSubstep(String parentId, String substepId) {
        guard("startSubstep", parentId + "/" + substepId, () -> delegate.startSubstep(parentId, substepId));
    }

    @Override
    public void updateSubstep(String parentId, String substepId, long current) {
        guard("updateSubstep", parentId + "/" + substepId, () -> delegate.updateSubstep(parentId, substepId, current));
    }

    @Override
    public void completeSubstep(String parentId, String substepId) {
        guard("completeSubstep", parentId + "/" + substepId, () -> delegate.completeSubstep(parentId, substepId));
    }

    @Override
    public void failSubstep(String parentId, String substepId, String message) {
        guard("failSubstep", parentId + "/" + substepId, () -> delegate.failSubstep(parentId, substepId, message));
    }

    private void guard(String operation, String target, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException exception) {
            logger.warn("进度回调失败，已忽略: operation={}, target={}", operation, target, exception);
        }
    }
}
