package com.photo.panogroup.controller;

import com.photo.panogroup.config.YamlConfig;
import com.photo.panogroup.core.cache.CacheStats;
import com.photo.panogroup.core.cache.CacheStore;
import com.photo.panogroup.core.cache.EvictionPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CacheControllerTest {

    @Mock
    private CacheStore cacheStore;

    @Spy
    private YamlConfig yamlConfig = new YamlConfig();

    @InjectMocks
    private CacheController controller;

    @Test
    void statsAreReturned() {
        CacheStats stats = new CacheStats("/tmp/cache", 4, 1024);
        when(cacheStore.stats()).thenReturn(stats);

        ResponseEntity<Map<String, Object>> response = controller.stats();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(stats, response.getBody().get("data"));
    }

    @Test
    void clearReportsRemovedEntries() {
        when(cacheStore.clear()).thenReturn(7);

        ResponseEntity<Map<String, Object>> response = controller.clear();

        assertEquals(Map.of("removed", 7), response.getBody().get("data"));
    }

    @Test
    void pruneFallsBackToConfiguredPolicy() {
        yamlConfig.getCache().setMaxEntries(100);
        yamlConfig.getCache().setMaxAge(Duration.ofDays(14));
        when(cacheStore.prune(any())).thenReturn(3);
        when(cacheStore.stats()).thenReturn(new CacheStats("/tmp/cache", 100, 0));

        ResponseEntity<Map<String, Object>> response = controller.prune(null, null);

        ArgumentCaptor<EvictionPolicy> policy = ArgumentCaptor.forClass(EvictionPolicy.class);
        verify(cacheStore).prune(policy.capture());
        assertEquals(100, policy.getValue().getMaxEntries());
        assertEquals(Duration.ofDays(14), policy.getValue().getMaxAge());
        assertEquals(Map.of("removed", 3, "remaining", 100), response.getBody().get("data"));
    }

    @Test
    void explicitPruneParametersWin() {
        when(cacheStore.prune(any())).thenReturn(0);
        when(cacheStore.stats()).thenReturn(new CacheStats("/tmp/cache", 5, 0));

        controller.prune(5, 3600L);

        ArgumentCaptor<EvictionPolicy> policy = ArgumentCaptor.forClass(EvictionPolicy.class);
        verify(cacheStore).prune(policy.capture());
        assertEquals(5, policy.getValue().getMaxEntries());
        assertEquals(Duration.ofHours(1), policy.getValue().getMaxAge());
    }

    @Test
    void negativeLimitIsBadRequest() {
        ResponseEntity<Map<String, Object>> response = controller.prune(-1, null);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        verify(cacheStore, never()).prune(any());
    }
}
