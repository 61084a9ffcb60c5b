package com.photo.panogroup.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Native Library Loader
 * 负责在 Spring 上下文启动前加载 OpenCV 的 JNI 库
 */
public class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static boolean loaded = false;

    /**
     * 预加载 OpenCV native 库，重复调用无副作用
     * 必须在任何使用 OpenCV 的代码之前调用
     *
     * @return 是否加载成功
     */
    public static synchronized boolean loadNativeLibraries() {
        if (loaded) {
            return true;
        }

        // 优先使用 openpnp 自带的库（解压到临时目录后 System.load）
        try {
            nu.pattern.OpenCV.loadLocally();
            logger.info("OpenCV loaded successfully via openpnp");
            loaded = true;
            return true;
        } catch (Throwable e) {
            logger.warn("Failed to load OpenCV via openpnp: {}", e.getMessage());
        }

        // 回退到应用目录或系统库路径
        String libFileName = System.mapLibraryName("opencv_java470");
        File libFile = new File(System.getProperty("user.dir"), libFileName);
        try {
            if (libFile.exists()) {
                System.load(libFile.getAbsolutePath());
                logger.info("OpenCV loaded from: {}", libFile.getAbsolutePath());
            } else {
                System.loadLibrary("opencv_java470");
                logger.info("OpenCV loaded from system library path");
            }
            loaded = true;
        } catch (UnsatisfiedLinkError e) {
            logger.error("Failed to load OpenCV library. Please ensure {} is in the application directory or system library path",
                    libFileName);
        }
        return loaded;
    }

    public static synchronized boolean isLoaded() {
        return loaded;
    }
}
