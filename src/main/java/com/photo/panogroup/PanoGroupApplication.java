package com.photo.panogroup;

import com.photo.panogroup.config.NativeLibraryLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PanoGroupApplication {
    public static void main(String[] args) {
        // 在 Spring 上下文启动前加载 OpenCV，检测器能力探测依赖它
        NativeLibraryLoader.loadNativeLibraries();
        SpringApplication.run(PanoGroupApplication.class, args);
    }
}
