package com.photo.panogroup.core.progress;

/**
 * 流水线进度事件
 */
public class ProgressEvent {

    public enum Stage {
        SCAN,
        EXTRACT,
        MATCH,
        GROUP,
        STITCH
    }

    public enum Type {
        START,
        ADVANCE,
        COMPLETE,
        /** 非致命提示：单张图像失败、检测器降级、分组过大等 */
        NOTICE
    }

    private final Stage stage;
    private final Type type;
    private final int completed;
    private final int total;
    private final String message;

    public ProgressEvent(Stage stage, Type type, int completed, int total, String message) {
        this.stage = stage;
        this.type = type;
        this.completed = completed;
        this.total = total;
        this.message = message;
    }

    public static ProgressEvent start(Stage stage, int total) {
        return new ProgressEvent(stage, Type.START, 0, total, null);
    }

    public static ProgressEvent advance(Stage stage, int completed, int total) {
        return new ProgressEvent(stage, Type.ADVANCE, completed, total, null);
    }

    public static ProgressEvent complete(Stage stage, int total) {
        return new ProgressEvent(stage, Type.COMPLETE, total, total, null);
    }

    public static ProgressEvent notice(Stage stage, String message) {
        return new ProgressEvent(stage, Type.NOTICE, 0, 0, message);
    }

    public Stage getStage() { return stage; }
    public Type getType() { return type; }
    public int getCompleted() { return completed; }
    public int getTotal() { return total; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return type == Type.NOTICE
                ? stage + " notice: " + message
                : stage + " " + type + " " + completed + "/" + total;
    }
}
