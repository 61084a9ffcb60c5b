package com.photo.panogroup.dto;

/**
 * 分组请求，未填写的参数使用配置文件中的默认值
 */
public class GroupingRequest {
    private String directory;
    private String detector;         // SIFT / ORB，忽略大小写
    private Integer minMatches;
    private Integer maxGroupSize;    // <= 0 不限制
    private Boolean consecutive;

    public String getDirectory() { return directory; }
    public void setDirectory(String directory) { this.directory = directory; }

    public String getDetector() { return detector; }
    public void setDetector(String detector) { this.detector = detector; }

    public Integer getMinMatches() { return minMatches; }
    public void setMinMatches(Integer minMatches) { this.minMatches = minMatches; }

    public Integer getMaxGroupSize() { return maxGroupSize; }
    public void setMaxGroupSize(Integer maxGroupSize) { this.maxGroupSize = maxGroupSize; }

    public Boolean getConsecutive() { return consecutive; }
    public void setConsecutive(Boolean consecutive) { this.consecutive = consecutive; }
}
