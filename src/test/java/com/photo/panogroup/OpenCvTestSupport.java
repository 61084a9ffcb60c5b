package com.photo.panogroup;

import com.photo.panogroup.config.NativeLibraryLoader;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

import java.nio.file.Path;
import java.util.Random;

import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * 测试用 OpenCV 工具：加载 native 库，生成带纹理的合成图像
 */
public final class OpenCvTestSupport {

    private OpenCvTestSupport() {
    }

    /**
     * native 库无法加载时跳过当前测试
     */
    public static void assumeOpenCv() {
        assumeTrue(NativeLibraryLoader.loadNativeLibraries(), "OpenCV native library not available");
    }

    /**
     * 随机几何图形组成的彩色图像，角点丰富，SIFT / ORB 都能提取到大量特征
     */
    public static Mat texturedImage(int width, int height, long seed) {
        Random random = new Random(seed);
        Mat image = new Mat(height, width, CvType.CV_8UC3, new Scalar(128, 128, 128));
        int shapes = width * height / 2500;
        for (int i = 0; i < shapes; i++) {
            Scalar color = new Scalar(random.nextInt(256), random.nextInt(256), random.nextInt(256));
            int x = random.nextInt(width);
            int y = random.nextInt(height);
            switch (random.nextInt(3)) {
                case 0:
                    Imgproc.rectangle(image, new Point(x, y),
                            new Point(x + 8 + random.nextInt(40), y + 8 + random.nextInt(40)), color, -1);
                    break;
                case 1:
                    Imgproc.circle(image, new Point(x, y), 4 + random.nextInt(20), color, -1);
                    break;
                default:
                    Imgproc.line(image, new Point(x, y),
                            new Point(x + random.nextInt(80) - 40, y + random.nextInt(80) - 40), color, 2);
                    break;
            }
        }
        return image;
    }

    public static Path writeCrop(Mat source, Rect region, Path file) {
        Mat crop = new Mat(source, region).clone();
        try {
            if (!Imgcodecs.imwrite(file.toString(), crop)) {
                throw new IllegalStateException("Failed to write " + file);
            }
            return file;
        } finally {
            crop.release();
        }
    }

    public static Path write(Mat image, Path file) {
        if (!Imgcodecs.imwrite(file.toString(), image)) {
            throw new IllegalStateException("Failed to write " + file);
        }
        return file;
    }
}
