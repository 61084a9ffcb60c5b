package com.photo.panogroup.core.graph;

/**
 * 运行被中断（用户取消或线程中断）。不属于错误，不保存任何中间结果。
 */
public class RunCancelledException extends RuntimeException {

    public RunCancelledException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
