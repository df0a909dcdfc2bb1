package com.record.merge.cache;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CacheConfigTest {

    @Test
    void defaults_areEnabled() {
        CacheConfig config = CacheConfig.defaults();
        assertTrue(config.enabled());
        assertEquals(10_000, config.maxSize());
        assertEquals(600, config.ttlSeconds());
    }

    @Test
    void disabled_isNotEnabled() {
        assertFalse(CacheConfig.disabled().enabled());
    }

    @Test
    void invalidSizes_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 60, true));
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
    }
}
