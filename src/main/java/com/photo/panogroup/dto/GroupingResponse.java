package com.photo.panogroup.dto;

import com.photo.panogroup.core.graph.ImageGroup;
import com.photo.panogroup.core.stitcher.StitchOutcome;
import com.photo.panogroup.service.GroupingReport;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 分组 / 拼接响应
 */
public class GroupingResponse {
    private String directory;
    private String detector;
    private int imageCount;
    private List<List<String>> groups;
    private List<List<String>> skippedGroups;
    private List<StitchResult> stitched;   // 仅拼接接口返回

    public static GroupingResponse from(GroupingReport report) {
        GroupingResponse response = new GroupingResponse();
        response.directory = report.getRoot().toString();
        response.detector = report.getDetector().name();
        response.imageCount = report.getImageCount();
        response.groups = toPaths(report.getGroups());
        response.skippedGroups = toPaths(report.getSkipped());
        return response;
    }

    public GroupingResponse withStitched(List<StitchOutcome> outcomes) {
        this.stitched = outcomes.stream().map(StitchResult::from).collect(Collectors.toList());
        return this;
    }

    private static List<List<String>> toPaths(List<ImageGroup> groups) {
        return groups.stream()
                .map(g -> g.paths().stream().map(Path::toString).collect(Collectors.toList()))
                .collect(Collectors.toList());
    }

    public String getDirectory() { return directory; }
    public String getDetector() { return detector; }
    public int getImageCount() { return imageCount; }
    public List<List<String>> getGroups() { return groups; }
    public List<List<String>> getSkippedGroups() { return skippedGroups; }
    public List<StitchResult> getStitched() { return stitched; }

    public static class StitchResult {
        private String output;
        private int imageCount;
        private boolean success;
        private String message;

        static StitchResult from(StitchOutcome outcome) {
            StitchResult result = new StitchResult();
            result.output = outcome.getOutput().toString();
            result.imageCount = outcome.getInputs().size();
            result.success = outcome.isSuccess();
            result.message = outcome.getMessage();
            return result;
        }

        public String getOutput() { return output; }
        public int getImageCount() { return imageCount; }
        public boolean isSuccess() { return success; }
        public String getMessage() { return message; }
    }
}
