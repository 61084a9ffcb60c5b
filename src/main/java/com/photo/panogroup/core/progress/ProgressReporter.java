package com.photo.panogroup.core.progress;

/**
 * 进度回调，渲染方式由实现决定（日志、进度条、推送等）
 * <p>
 * 提取和匹配阶段会在工作线程上回调，实现需要线程安全。
 */
@FunctionalInterface
public interface ProgressReporter {

    ProgressReporter NONE = event -> { };

    void onEvent(ProgressEvent event);
}
