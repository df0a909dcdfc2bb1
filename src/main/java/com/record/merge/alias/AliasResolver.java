package com.record.merge.alias;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.record.merge.cache.CacheConfig;
import com.record.merge.cache.MergeListener;
import com.record.merge.core.model.CrmRecord;
import com.record.merge.core.model.RecordAlias;
import com.record.merge.core.model.RecordType;
import com.record.merge.metrics.MetricsService;
import com.record.merge.metrics.NoOpMetricsService;
import com.record.merge.store.AliasRepository;
import com.record.merge.store.RecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Finds the record that currently stands for an id, following alias chains left behind by merges.
 * Resolved redirects are cached; the resolver listens for merges to drop redirects that went stale.
 */
public class AliasResolver implements MergeListener {
    private static final Logger log = LoggerFactory.getLogger(AliasResolver.class);

    public static final int DEFAULT_MAX_HOPS = 16;

    private final RecordRepository recordRepository;
    private final AliasRepository aliasRepository;
    private final MetricsService metricsService;
    private final int maxHops;
    private final Cache<RedirectKey, String> redirects;
    // target id -> cached keys redirecting to it
    private final ConcurrentMap<RedirectKey, Set<RedirectKey>> targetIndex = new ConcurrentHashMap<>();

    public AliasResolver(RecordRepository recordRepository, AliasRepository aliasRepository) {
        this(recordRepository, aliasRepository, CacheConfig.defaults(), DEFAULT_MAX_HOPS, new NoOpMetricsService());
    }

    public AliasResolver(RecordRepository recordRepository, AliasRepository aliasRepository,
                         CacheConfig cacheConfig, int maxHops, MetricsService metricsService) {
        if (maxHops <= 0) {
            throw new IllegalArgumentException("maxHops must be > 0");
        }
        this.recordRepository = recordRepository;
        this.aliasRepository = aliasRepository;
        this.metricsService = metricsService;
        this.maxHops = maxHops;
        this.redirects = cacheConfig.enabled()
                ? Caffeine.newBuilder()
                        .maximumSize(cacheConfig.maxSize())
                        .expireAfterWrite(Duration.ofSeconds(cacheConfig.ttlSeconds()))
                        .removalListener((RedirectKey key, String target, RemovalCause cause) -> {
                            if (key != null && target != null) {
                                unindex(key, target);
                            }
                        })
                        .build()
                : null;
        log.info("AliasResolver initialized: cache={}, maxHops={}", cacheConfig.enabled(), maxHops);
    }

    /**
     * Returns the live record for an id: the record itself if it still exists,
     * otherwise the end of its alias chain.
     */
    public Optional<CrmRecord> resolve(RecordType type, String id) {
        Optional<CrmRecord> direct = recordRepository.findById(type, id);
        if (direct.isPresent()) {
            return direct;
        }
        return followAliases(type, id).flatMap(targetId -> recordRepository.findById(type, targetId));
    }

    /**
     * Returns the id of the live record standing for {@code id}, or empty for an unknown id,
     * a broken chain, a cycle or a chain longer than the hop limit.
     */
    public Optional<String> resolveId(RecordType type, String id) {
        if (recordRepository.exists(type, id)) {
            return Optional.of(id);
        }
        return followAliases(type, id);
    }

    private Optional<String> followAliases(RecordType type, String id) {
        RedirectKey key = new RedirectKey(type, id);
        if (redirects != null) {
            String cached = redirects.getIfPresent(key);
            if (cached != null && recordRepository.exists(type, cached)) {
                metricsService.recordAliasCacheHit();
                return Optional.of(cached);
            }
            if (cached != null) {
                redirects.invalidate(key);
            }
            metricsService.recordAliasCacheMiss();
        }

        Set<String> visited = new HashSet<>();
        visited.add(id);
        String current = id;
        for (int hop = 0; hop < maxHops; hop++) {
            Optional<RecordAlias> alias = aliasRepository.findByDestroyedId(type, current);
            if (alias.isEmpty()) {
                log.debug("Alias chain for {} {} ends at {} without a live record", type, id, current);
                return Optional.empty();
            }
            String next = alias.get().targetId();
            if (!visited.add(next)) {
                log.warn("Alias cycle detected for {} {} at {}", type, id, next);
                return Optional.empty();
            }
            if (recordRepository.exists(type, next)) {
                cache(key, next);
                return Optional.of(next);
            }
            current = next;
        }
        log.warn("Alias chain for {} {} exceeds {} hops", type, id, maxHops);
        return Optional.empty();
    }

    private void cache(RedirectKey key, String targetId) {
        if (redirects == null) {
            return;
        }
        redirects.put(key, targetId);
        targetIndex.computeIfAbsent(new RedirectKey(key.type(), targetId), k -> ConcurrentHashMap.newKeySet())
                .add(key);
    }

    private void unindex(RedirectKey key, String targetId) {
        Set<RedirectKey> keys = targetIndex.get(new RedirectKey(key.type(), targetId));
        if (keys != null) {
            keys.remove(key);
        }
    }

    @Override
    public void onMerge(RecordType type, String duplicateId, String masterId) {
        if (redirects == null) {
            return;
        }
        redirects.invalidate(new RedirectKey(type, duplicateId));
        Set<RedirectKey> stale = targetIndex.remove(new RedirectKey(type, duplicateId));
        if (stale != null) {
            redirects.invalidateAll(stale);
            log.debug("Invalidated {} redirects to merged {} {}", stale.size(), type, duplicateId);
        }
    }

    public void invalidateAll() {
        if (redirects != null) {
            redirects.invalidateAll();
        }
        targetIndex.clear();
    }

    /**
     * Number of cached redirects.
     */
    public long cachedRedirects() {
        if (redirects == null) {
            return 0;
        }
        redirects.cleanUp();
        return redirects.estimatedSize();
    }

    record RedirectKey(RecordType type, String id) {}
}
