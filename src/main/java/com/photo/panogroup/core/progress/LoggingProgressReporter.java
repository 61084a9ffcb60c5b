package com.photo.panogroup.core.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 默认进度输出：写入日志。ADVANCE 事件按步长节流，避免刷屏。
 */
public class LoggingProgressReporter implements ProgressReporter {
    private static final Logger logger = LoggerFactory.getLogger(LoggingProgressReporter.class);

    private static final int ADVANCE_LOG_STEPS = 10;

    @Override
    public void onEvent(ProgressEvent event) {
        switch (event.getType()) {
            case START:
                logger.info("[{}] started ({} item(s))", event.getStage(), event.getTotal());
                break;
            case ADVANCE:
                if (shouldLog(event)) {
                    logger.info("[{}] {}/{}", event.getStage(), event.getCompleted(), event.getTotal());
                } else {
                    logger.debug("[{}] {}/{}", event.getStage(), event.getCompleted(), event.getTotal());
                }
                break;
            case COMPLETE:
                logger.info("[{}] completed ({} item(s))", event.getStage(), event.getTotal());
                break;
            case NOTICE:
                logger.warn("[{}] {}", event.getStage(), event.getMessage());
                break;
            default:
                break;
        }
    }

    private static boolean shouldLog(ProgressEvent event) {
        int total = event.getTotal();
        if (total <= ADVANCE_LOG_STEPS) {
            return true;
        }
        int step = total / ADVANCE_LOG_STEPS;
        return event.getCompleted() % step == 0;
    }
}
