package com.photo.panogroup.core.stitcher;

import java.nio.file.Path;
import java.util.List;

public interface Stitcher {
    /**
     * 将一组重叠图像拼接为全景图
     * @param orderedImages 按拍摄顺序排列的图像（至少 2 张）
     * @param output 输出文件
     * @return 拼接结果，失败时不抛异常而是返回失败结果
     * @throws InterruptedException 等待外部进程时被中断
     */
    StitchOutcome stitch(List<Path> orderedImages, Path output) throws InterruptedException;
}
