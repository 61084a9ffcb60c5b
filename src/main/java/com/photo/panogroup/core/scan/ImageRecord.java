package com.photo.panogroup.core.scan;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * 待分组的图像：以绝对路径标识
 */
public final class ImageRecord {

    /**
     * 拍摄顺序：拍摄时间优先，相同时按文件名
     */
    public static final Comparator<ImageRecord> CAPTURE_ORDER = Comparator
            .comparing(ImageRecord::getCaptureTime)
            .thenComparing(ImageRecord::getFileName)
            .thenComparing(ImageRecord::getId);

    private final Path path;
    private final Instant lastModified;
    private final Instant captureTime;

    public ImageRecord(Path path, Instant lastModified, Instant captureTime) {
        this.path = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
        this.lastModified = Objects.requireNonNull(lastModified, "lastModified");
        this.captureTime = captureTime != null ? captureTime : lastModified;
    }

    /** 图像标识（绝对路径字符串），也是重叠图中的节点 */
    public String getId() {
        return path.toString();
    }

    public String getFileName() {
        return path.getFileName().toString();
    }

    public Path getPath() { return path; }
    public Instant getLastModified() { return lastModified; }
    public Instant getCaptureTime() { return captureTime; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImageRecord)) return false;
        ImageRecord that = (ImageRecord) o;
        return path.equals(that.path) && lastModified.equals(that.lastModified) && captureTime.equals(that.captureTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, lastModified, captureTime);
    }

    @Override
    public String toString() {
        return "ImageRecord{" + path + ", captured " + captureTime + "}";
    }
}
