package com.photo.panogroup.core.scan;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Date;
import java.util.TimeZone;

/**
 * 读取拍摄时间：EXIF DateTimeOriginal → EXIF DateTime → 文件修改时间
 * <p>
 * EXIF 时间不带时区，统一按 UTC 解释，只用于同一目录内的排序。
 */
public class CaptureTimeReader {
    private static final Logger logger = LoggerFactory.getLogger(CaptureTimeReader.class);

    private static final TimeZone EXIF_ZONE = TimeZone.getTimeZone("UTC");

    public Instant read(Path file, Instant lastModified) {
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(file.toFile());

            Instant original = readDate(metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class),
                    ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL);
            if (original != null) {
                return original;
            }
            Instant modified = readDate(metadata.getFirstDirectoryOfType(ExifIFD0Directory.class),
                    ExifIFD0Directory.TAG_DATETIME);
            if (modified != null) {
                return modified;
            }
        } catch (ImageProcessingException | IOException e) {
            logger.debug("No readable EXIF in {}: {}", file, e.getMessage());
        }
        return lastModified;
    }

    private static Instant readDate(Directory directory, int tag) {
        if (directory == null || !directory.containsTag(tag)) {
            return null;
        }
        Date date = directory.getDate(tag, EXIF_ZONE);
        return date != null ? date.toInstant() : null;
    }
}
