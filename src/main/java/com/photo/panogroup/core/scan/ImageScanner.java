package com.photo.panogroup.core.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 递归扫描目录中的图像文件
 * <p>
 * 按扩展名过滤（忽略大小写），跳过以输出前缀命名的文件（之前的拼接结果）。
 */
public class ImageScanner {
    private static final Logger logger = LoggerFactory.getLogger(ImageScanner.class);

    private final Set<String> extensions;
    private final String outputPrefix;
    private final CaptureTimeReader captureTimeReader;

    public ImageScanner(Collection<String> extensions, String outputPrefix, CaptureTimeReader captureTimeReader) {
        this.extensions = extensions.stream()
                .map(e -> e.toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .collect(Collectors.toUnmodifiableSet());
        this.outputPrefix = outputPrefix == null ? "" : outputPrefix;
        this.captureTimeReader = captureTimeReader;
    }

    /**
     * 扫描目录
     *
     * @param root 根目录
     * @return 按路径排序的图像列表
     */
    public List<ImageRecord> scan(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Not a directory: " + root);
        }

        List<ImageRecord> images = new ArrayList<>();
        try (Stream<Path> files = Files.walk(root)) {
            files.filter(Files::isRegularFile)
                    .filter(this::isEligible)
                    .sorted(Comparator.comparing(Path::toString))
                    .forEach(file -> images.add(toRecord(file)));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        logger.info("Found {} image(s) under {}", images.size(), root);
        return images;
    }

    boolean isEligible(Path file) {
        String name = file.getFileName().toString();
        if (!outputPrefix.isEmpty() && name.startsWith(outputPrefix)) {
            return false;
        }
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return false;
        }
        return extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private ImageRecord toRecord(Path file) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            Instant lastModified = attrs.lastModifiedTime().toInstant();
            return new ImageRecord(file, lastModified, captureTimeReader.read(file, lastModified));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
