package com.record.merge.api;

import com.record.merge.cache.CacheConfig;

/**
 * Options for the record merge service.
 * Configures the alias redirect cache, alias chain limits and merge defaults.
 */
public class MergeOptions {

    private static final int DEFAULT_ALIAS_CACHE_SIZE = 10_000;
    private static final int DEFAULT_ALIAS_CACHE_TTL_SECONDS = 600;
    private static final int DEFAULT_MAX_ALIAS_HOPS = 16;
    private static final String DEFAULT_ACTOR = "system";

    private final int aliasCacheSize;
    private final int aliasCacheTtlSeconds;
    private final boolean aliasCacheEnabled;
    private final int maxAliasHops;
    private final String defaultActor;
    private final boolean repointAliases;

    private MergeOptions(Builder builder) {
        this.aliasCacheSize = builder.aliasCacheSize;
        this.aliasCacheTtlSeconds = builder.aliasCacheTtlSeconds;
        this.aliasCacheEnabled = builder.aliasCacheEnabled;
        this.maxAliasHops = builder.maxAliasHops;
        this.defaultActor = builder.defaultActor;
        this.repointAliases = builder.repointAliases;
    }

    public int getAliasCacheSize() {
        return aliasCacheSize;
    }

    public int getAliasCacheTtlSeconds() {
        return aliasCacheTtlSeconds;
    }

    public boolean isAliasCacheEnabled() {
        return aliasCacheEnabled;
    }

    public int getMaxAliasHops() {
        return maxAliasHops;
    }

    /**
     * Actor recorded in the audit trail when a merge request names none.
     */
    public String getDefaultActor() {
        return defaultActor;
    }

    /**
     * Whether aliases that pointed at a merged-away record are moved onto the surviving one.
     */
    public boolean isRepointAliases() {
        return repointAliases;
    }

    public CacheConfig toCacheConfig() {
        return aliasCacheEnabled
                ? new CacheConfig(aliasCacheSize, aliasCacheTtlSeconds, true)
                : CacheConfig.disabled();
    }

    public static MergeOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int aliasCacheSize = DEFAULT_ALIAS_CACHE_SIZE;
        private int aliasCacheTtlSeconds = DEFAULT_ALIAS_CACHE_TTL_SECONDS;
        private boolean aliasCacheEnabled = true;
        private int maxAliasHops = DEFAULT_MAX_ALIAS_HOPS;
        private String defaultActor = DEFAULT_ACTOR;
        private boolean repointAliases = true;

        public Builder aliasCacheSize(int aliasCacheSize) {
            this.aliasCacheSize = aliasCacheSize;
            return this;
        }

        public Builder aliasCacheTtlSeconds(int aliasCacheTtlSeconds) {
            this.aliasCacheTtlSeconds = aliasCacheTtlSeconds;
            return this;
        }

        public Builder aliasCacheEnabled(boolean aliasCacheEnabled) {
            this.aliasCacheEnabled = aliasCacheEnabled;
            return this;
        }

        public Builder maxAliasHops(int maxAliasHops) {
            this.maxAliasHops = maxAliasHops;
            return this;
        }

        public Builder defaultActor(String defaultActor) {
            this.defaultActor = defaultActor;
            return this;
        }

        public Builder repointAliases(boolean repointAliases) {
            this.repointAliases = repointAliases;
            return this;
        }

        public MergeOptions build() {
            if (aliasCacheSize <= 0) {
                throw new IllegalArgumentException("aliasCacheSize must be > 0");
            }
            if (aliasCacheTtlSeconds <= 0) {
                throw new IllegalArgumentException("aliasCacheTtlSeconds must be > 0");
            }
            if (maxAliasHops <= 0) {
                throw new IllegalArgumentException("maxAliasHops must be > 0");
            }
            if (defaultActor == null || defaultActor.isBlank()) {
                throw new IllegalArgumentException("defaultActor is required");
            }
            return new MergeOptions(this);
        }
    }
}
