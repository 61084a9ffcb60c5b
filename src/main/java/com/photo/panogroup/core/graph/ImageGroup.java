package com.photo.panogroup.core.graph;

import com.photo.panogroup.core.scan.ImageRecord;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 一个连通分量对应的图像组，按拍摄顺序排列（即拼接顺序）
 */
public final class ImageGroup {

    private final List<ImageRecord> images;

    public ImageGroup(Collection<ImageRecord> images) {
        List<ImageRecord> ordered = new ArrayList<>(images);
        ordered.sort(ImageRecord.CAPTURE_ORDER);
        this.images = List.copyOf(ordered);
    }

    public List<ImageRecord> getImages() {
        return images;
    }

    public List<Path> paths() {
        return images.stream().map(ImageRecord::getPath).collect(Collectors.toList());
    }

    public int size() {
        return images.size();
    }

    public ImageRecord first() {
        return images.get(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImageGroup)) return false;
        return images.equals(((ImageGroup) o).images);
    }

    @Override
    public int hashCode() {
        return images.hashCode();
    }

    @Override
    public String toString() {
        return "ImageGroup" + images.stream().map(ImageRecord::getFileName).collect(Collectors.toList());
    }
}
