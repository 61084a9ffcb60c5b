package com.photo.panogroup.core.cache;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CacheStats {
    private String location;
    private int entries;
    private long totalBytes;
}
