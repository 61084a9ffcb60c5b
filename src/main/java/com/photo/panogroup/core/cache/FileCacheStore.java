package com.photo.panogroup.core.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 目录缓存：每个键一个文件，文件名即十六进制摘要
 * <p>
 * 写入先落到同目录临时文件再原子重命名，读到的总是完整条目；
 * 命中时刷新文件修改时间，回收时按修改时间即为最近访问顺序（LRU）。
 */
public class FileCacheStore implements CacheStore {
    private static final Logger logger = LoggerFactory.getLogger(FileCacheStore.class);

    private static final Pattern KEY_PATTERN = Pattern.compile("[0-9a-f]{32}");
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path root;

    public FileCacheStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create cache directory: " + this.root, e);
        }
        logger.info("Feature cache directory: {}", this.root);
    }

    @Override
    public Optional<byte[]> get(String key) {
        Path file = entryPath(key);
        try {
            byte[] bytes = Files.readAllBytes(file);
            touch(file);
            return Optional.of(bytes);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            logger.debug("Cache entry {} unreadable, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, byte[] payload) {
        Path target = entryPath(key);
        Path temp = root.resolve(key + "." + UUID.randomUUID() + TEMP_SUFFIX);
        try {
            Files.write(temp, payload);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            // 写缓存失败不影响本次结果，下次重新计算
            logger.warn("Failed to write cache entry {}: {}", key, e.getMessage());
        } finally {
            deleteQuietly(temp);
        }
    }

    @Override
    public boolean remove(String key) {
        try {
            return Files.deleteIfExists(entryPath(key));
        } catch (IOException e) {
            logger.warn("Failed to remove cache entry {}: {}", key, e.getMessage());
            return false;
        }
    }

    @Override
    public int clear() {
        int removed = 0;
        for (Path file : listEntries()) {
            if (deleteQuietly(file)) {
                removed++;
            }
        }
        logger.info("Cleared {} cache entries from {}", removed, root);
        return removed;
    }

    @Override
    public CacheStats stats() {
        List<Path> entries = listEntries();
        long bytes = 0;
        for (Path file : entries) {
            try {
                bytes += Files.size(file);
            } catch (IOException e) {
                // 统计期间被删除
                logger.trace("Skipping vanished cache entry {}", file);
            }
        }
        return new CacheStats(root.toString(), entries.size(), bytes);
    }

    @Override
    public int prune(EvictionPolicy policy) {
        if (policy == null || policy.isUnbounded()) {
            return 0;
        }

        List<Entry> entries = new ArrayList<>();
        for (Path file : listEntries()) {
            try {
                entries.add(new Entry(file, Files.getLastModifiedTime(file).toInstant()));
            } catch (IOException e) {
                logger.trace("Skipping vanished cache entry {}", file);
            }
        }
        // 最近访问的在前
        entries.sort(Comparator.comparing((Entry e) -> e.lastAccess).reversed());

        Instant cutoff = policy.limitsAge() ? Instant.now().minus(policy.getMaxAge()) : null;
        int removed = 0;
        for (int i = 0; i < entries.size(); i++) {
            Entry entry = entries.get(i);
            boolean expired = cutoff != null && entry.lastAccess.isBefore(cutoff);
            boolean overflow = policy.limitsEntries() && i >= policy.getMaxEntries();
            if ((expired || overflow) && deleteQuietly(entry.file)) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("Pruned {} cache entries ({})", removed, policy);
        }
        return removed;
    }

    public Path getRoot() {
        return root;
    }

    Path entryPath(String key) {
        if (key == null || !KEY_PATTERN.matcher(key).matches()) {
            throw new IllegalArgumentException("Invalid cache key: " + key);
        }
        return root.resolve(key);
    }

    private List<Path> listEntries() {
        try (Stream<Path> files = Files.list(root)) {
            return files.filter(f -> KEY_PATTERN.matcher(f.getFileName().toString()).matches())
                    .filter(Files::isRegularFile)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            logger.warn("Failed to list cache directory {}: {}", root, e.getMessage());
            return List.of();
        }
    }

    private static void touch(Path file) {
        try {
            Files.setLastModifiedTime(file, FileTime.from(Instant.now()));
        } catch (IOException e) {
            logger.trace("Failed to touch cache entry {}: {}", file, e.getMessage());
        }
    }

    private static boolean deleteQuietly(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Failed to delete {}: {}", file, e.getMessage());
            return false;
        }
    }

    private static final class Entry {
        final Path file;
        final Instant lastAccess;

        Entry(Path file, Instant lastAccess) {
            this.file = file;
            this.lastAccess = lastAccess;
        }
    }
}
