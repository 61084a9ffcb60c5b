package com.photo.panogroup.core.feature;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.opencv.core.KeyPoint;

/**
 * 关键点（与 OpenCV KeyPoint 字段一一对应，不依赖 native 内存）
 */
@Getter
@ToString
@EqualsAndHashCode
public final class FeaturePoint {
    private final float x;
    private final float y;
    private final float size;
    private final float angle;
    private final float response;
    private final int octave;
    private final int classId;

    @JsonCreator
    public FeaturePoint(@JsonProperty("x") float x,
                        @JsonProperty("y") float y,
                        @JsonProperty("size") float size,
                        @JsonProperty("angle") float angle,
                        @JsonProperty("response") float response,
                        @JsonProperty("octave") int octave,
                        @JsonProperty("classId") int classId) {
        this.x = x;
        this.y = y;
        this.size = size;
        this.angle = angle;
        this.response = response;
        this.octave = octave;
        this.classId = classId;
    }

    public static FeaturePoint at(float x, float y) {
        return new FeaturePoint(x, y, 1f, -1f, 0f, 0, -1);
    }

    public static FeaturePoint fromKeyPoint(KeyPoint kp) {
        return new FeaturePoint((float) kp.pt.x, (float) kp.pt.y, kp.size, kp.angle, kp.response, kp.octave, kp.class_id);
    }

    public KeyPoint toKeyPoint() {
        return new KeyPoint(x, y, size, angle, response, octave, classId);
    }
}
