package com.umitunal.stepflow.config;

/**
 * Configuration for the embedded RocksDB dispatch queue.
 */
public class StorageConfig {
    private final String dataDirectory;
    private final boolean durableWrites;
    private final int memoryBufferSizeMB;
    private final int maxMemoryBuffers;
    private final int backgroundThreads;
    private final int blockCacheSizeMB;
    private final int maxAttempts;
    private final long retryDelayMs;
    private final long maxRetryDelayMs;

    private StorageConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.durableWrites = builder.durableWrites;
        this.memoryBufferSizeMB = builder.memoryBufferSizeMB;
        this.maxMemoryBuffers = builder.maxMemoryBuffers;
        this.backgroundThreads = builder.backgroundThreads;
        this.blockCacheSizeMB = builder.blockCacheSizeMB;
        this.maxAttempts = builder.maxAttempts;
        this.retryDelayMs = builder.retryDelayMs;
        this.maxRetryDelayMs = builder.maxRetryDelayMs;
    }

    public String getDataDirectory() { return dataDirectory; }
    public boolean isDurableWrites() { return durableWrites; }
    public int getMemoryBufferSizeMB() { return memoryBufferSizeMB; }
    public int getMaxMemoryBuffers() { return maxMemoryBuffers; }
    public int getBackgroundThreads() { return backgroundThreads; }
    public int getBlockCacheSizeMB() { return blockCacheSizeMB; }
    public int getMaxAttempts() { return maxAttempts; }
    public long getRetryDelayMs() { return retryDelayMs; }
    public long getMaxRetryDelayMs() { return maxRetryDelayMs; }

    /**
     * Delay before the next attempt of work that failed its {@code attempt}-th
     * try: the retry delay, doubled per further attempt, up to the maximum.
     */
    public long retryDelayAfter(int attempt) {
        long delay = retryDelayMs;
        for (int i = 1; i < attempt && delay < maxRetryDelayMs; i++) {
            delay *= 2;
        }
        return Math.min(delay, maxRetryDelayMs);
    }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(dataDirectory);
    }

    public static class Builder {
        private final String dataDirectory;
        private boolean durableWrites = true;
        private int memoryBufferSizeMB = 32;
        private int maxMemoryBuffers = 3;
        private int backgroundThreads = 2;
        private int blockCacheSizeMB = 64;
        private int maxAttempts = 5;
        private long retryDelayMs = 1000;
        private long maxRetryDelayMs = 300_000;

        private Builder(String dataDirectory) {
            this.dataDirectory = dataDirectory;
        }

        /**
         * Sync every write. Dispatched jobs survive a crash only with this on.
         * Default: true
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Default: 32 MB
         */
        public Builder withMemoryBufferSize(int sizeMB) {
            this.memoryBufferSizeMB = sizeMB;
            return this;
        }

        /**
         * Default: 3
         */
        public Builder withMaxMemoryBuffers(int count) {
            this.maxMemoryBuffers = count;
            return this;
        }

        /**
         * Default: 2
         */
        public Builder withBackgroundThreads(int count) {
            this.backgroundThreads = count;
            return this;
        }

        /**
         * Default: 64 MB
         */
        public Builder withBlockCacheSize(int sizeMB) {
            this.blockCacheSizeMB = sizeMB;
            return this;
        }

        /**
         * Attempts a dispatched job gets before it is marked failed.
         * Each failed attempt goes back to the queue.
         * Default: 5
         */
        public Builder withMaxAttempts(int attempts) {
            if (attempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            this.maxAttempts = attempts;
            return this;
        }

        /**
         * Delay before the first retry of rejected work. Later retries
         * double it.
         * Default: 1 second
         */
        public Builder withRetryDelay(long millis) {
            if (millis < 0) {
                throw new IllegalArgumentException("retryDelay must not be negative");
            }
            this.retryDelayMs = millis;
            return this;
        }

        /**
         * Upper bound of the retry delay.
         * Default: 5 minutes
         */
        public Builder withMaxRetryDelay(long millis) {
            if (millis < 0) {
                throw new IllegalArgumentException("maxRetryDelay must not be negative");
            }
            this.maxRetryDelayMs = millis;
            return this;
        }

        public StorageConfig build() {
            if (dataDirectory == null || dataDirectory.isBlank()) {
                throw new IllegalArgumentException("dataDirectory is required");
            }
            requirePositive("memoryBufferSizeMB", memoryBufferSizeMB);
            requirePositive("maxMemoryBuffers", maxMemoryBuffers);
            requirePositive("backgroundThreads", backgroundThreads);
            requirePositive("blockCacheSizeMB", blockCacheSizeMB);
            return new StorageConfig(this);
        }

        private static void requirePositive(String name, int value) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be positive, was " + value);
            }
        }
    }
}
