package com.photo.panogroup.core.match;

/**
 * 单对图像匹配失败，只在匹配器内部抛出并就地捕获
 */
public class MatchException extends RuntimeException {

    public MatchException(String message) {
        super(message);
    }

    public MatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
