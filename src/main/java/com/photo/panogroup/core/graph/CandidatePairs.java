package com.photo.panogroup.core.graph;

import com.photo.panogroup.core.scan.ImageRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * 候选图像对选择
 * <p>
 * 全量模式比较所有无序对，共 n(n-1)/2 对；
 * 相邻模式按拍摄时间（相同时按文件名）排序后只比较 (i, i+1)，共 n-1 对。
 */
public final class CandidatePairs {

    private CandidatePairs() {
    }

    public static List<ImagePair> select(List<ImageRecord> images, boolean consecutive) {
        return consecutive ? consecutive(images) : allPairs(images);
    }

    public static List<ImagePair> allPairs(List<ImageRecord> images) {
        List<ImageRecord> ordered = new ArrayList<>(images);
        ordered.sort(ImageRecord.CAPTURE_ORDER);

        int n = ordered.size();
        List<ImagePair> pairs = new ArrayList<>(n * Math.max(0, n - 1) / 2);
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                pairs.add(new ImagePair(ordered.get(i), ordered.get(j)));
            }
        }
        return pairs;
    }

    public static List<ImagePair> consecutive(List<ImageRecord> images) {
        List<ImageRecord> ordered = new ArrayList<>(images);
        ordered.sort(ImageRecord.CAPTURE_ORDER);

        List<ImagePair> pairs = new ArrayList<>(Math.max(0, ordered.size() - 1));
        for (int i = 0; i + 1 < ordered.size(); i++) {
            pairs.add(new ImagePair(ordered.get(i), ordered.get(i + 1)));
        }
        return pairs;
    }

    /**
     * 待比较的一对图像
     */
    public static final class ImagePair {
        private final ImageRecord first;
        private final ImageRecord second;

        public ImagePair(ImageRecord first, ImageRecord second) {
            this.first = first;
            this.second = second;
        }

        public ImageRecord getFirst() { return first; }
        public ImageRecord getSecond() { return second; }

        @Override
        public String toString() {
            return first.getFileName() + " <-> " + second.getFileName();
        }
    }
}
