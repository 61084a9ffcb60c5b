package com.photo.panogroup.core.feature;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * 描述子矩阵（第 i 行对应第 i 个关键点）
 * <p>
 * 以原始字节保存，支持 CV_8U（ORB）和 CV_32F（SIFT，小端序）两种类型。
 */
public final class DescriptorMatrix {

    private final int rows;
    private final int cols;
    private final int type;
    private final byte[] data;

    @JsonCreator
    public DescriptorMatrix(@JsonProperty("rows") int rows,
                            @JsonProperty("cols") int cols,
                            @JsonProperty("type") int type,
                            @JsonProperty("data") byte[] data) {
        if (type != CvType.CV_8U && type != CvType.CV_32F) {
            throw new IllegalArgumentException("Unsupported descriptor type: " + CvType.typeToString(type));
        }
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("Negative descriptor shape: " + rows + "x" + cols);
        }
        long expected = (long) rows * cols * elementSize(type);
        byte[] bytes = data == null ? new byte[0] : data;
        if (bytes.length != expected) {
            throw new IllegalArgumentException("Descriptor data length " + bytes.length + " does not match "
                    + rows + "x" + cols + " " + CvType.typeToString(type));
        }
        this.rows = rows;
        this.cols = cols;
        this.type = type;
        this.data = bytes.clone();
    }

    public static DescriptorMatrix empty(int type) {
        return new DescriptorMatrix(0, 0, type, new byte[0]);
    }

    public static DescriptorMatrix ofFloats(int rows, int cols, float[] values) {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asFloatBuffer().put(values);
        return new DescriptorMatrix(rows, cols, CvType.CV_32F, buffer.array());
    }

    public static DescriptorMatrix ofBytes(int rows, int cols, byte[] values) {
        return new DescriptorMatrix(rows, cols, CvType.CV_8U, values);
    }

    /**
     * 从 OpenCV 描述子复制数据（调用方负责释放 mat）
     */
    public static DescriptorMatrix fromMat(Mat mat) {
        if (mat.empty()) {
            return empty(mat.depth() == CvType.CV_8U ? CvType.CV_8U : CvType.CV_32F);
        }
        int rows = mat.rows();
        int cols = mat.cols();
        if (mat.type() == CvType.CV_8UC1) {
            byte[] values = new byte[rows * cols];
            mat.get(0, 0, values);
            return ofBytes(rows, cols, values);
        }
        Mat floats = mat;
        if (mat.type() != CvType.CV_32FC1) {
            floats = new Mat();
            mat.convertTo(floats, CvType.CV_32F);
        }
        try {
            float[] values = new float[rows * cols];
            floats.get(0, 0, values);
            return ofFloats(rows, cols, values);
        } finally {
            if (floats != mat) floats.release();
        }
    }

    /**
     * 转换为 OpenCV Mat（调用方负责释放）
     */
    public Mat toMat() {
        if (rows == 0) {
            return new Mat();
        }
        Mat mat = new Mat(rows, cols, type);
        if (type == CvType.CV_8U) {
            mat.put(0, 0, data);
        } else {
            float[] values = new float[rows * cols];
            ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer().get(values);
            mat.put(0, 0, values);
        }
        return mat;
    }

    private static int elementSize(int type) {
        return type == CvType.CV_32F ? Float.BYTES : 1;
    }

    public int getRows() { return rows; }
    public int getCols() { return cols; }
    public int getType() { return type; }
    public byte[] getData() { return data.clone(); }

    @JsonIgnore
    public boolean isEmpty() {
        return rows == 0;
    }

    @JsonIgnore
    public boolean isBinary() {
        return type == CvType.CV_8U;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DescriptorMatrix)) return false;
        DescriptorMatrix that = (DescriptorMatrix) o;
        return rows == that.rows && cols == that.cols && type == that.type && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        int result = 31 * rows + cols;
        result = 31 * result + type;
        return 31 * result + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "DescriptorMatrix{" + rows + "x" + cols + " " + (isBinary() ? "CV_8U" : "CV_32F") + "}";
    }
}
