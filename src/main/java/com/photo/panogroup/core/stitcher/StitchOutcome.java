package com.photo.panogroup.core.stitcher;

import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.util.List;

/**
 * 单个分组的拼接结果
 */
@Getter
@ToString
public final class StitchOutcome {
    private final List<Path> inputs;
    private final Path output;
    private final boolean success;
    private final String message;

    private StitchOutcome(List<Path> inputs, Path output, boolean success, String message) {
        this.inputs = List.copyOf(inputs);
        this.output = output;
        this.success = success;
        this.message = message;
    }

    public static StitchOutcome success(List<Path> inputs, Path output) {
        return new StitchOutcome(inputs, output, true, "ok");
    }

    public static StitchOutcome failure(List<Path> inputs, Path output, String message) {
        return new StitchOutcome(inputs, output, false, message);
    }
}
