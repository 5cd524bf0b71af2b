package io.github.metahealth.config;

import com.google.common.base.Preconditions;

import java.nio.file.Path;

/**
 * Settings of one statistics run.
 *
 * <p>This class uses the builder pattern for configuration and is immutable once constructed.
 * {@link AggregationConfigLoader} fills a builder from properties, YAML and the environment.</p>
 */
public final class AggregationConfig {

    public static final String DEFAULT_REGISTRY_URL = "https://api.datacite.org";
    public static final String DEFAULT_FILE_SUFFIX = ".jsonl.gz";

    private final Path inputDir;
    private final Path outputDir;
    private final Path cacheDir;
    private final int workers;
    private final String fileSuffix;

    private final String registryBaseUrl;
    private final int registryPageSize;
    private final int registryConnectTimeoutMs;
    private final int registryReadTimeoutMs;
    private final int registryMaxRetries;
    private final long registryRetryDelayMs;

    private final int completenessScale;

    private AggregationConfig(Builder builder) {
        this.inputDir = builder.inputDir;
        this.outputDir = builder.outputDir;
        this.cacheDir = builder.cacheDir;
        this.workers = builder.workers;
        this.fileSuffix = builder.fileSuffix;
        this.registryBaseUrl = builder.registryBaseUrl;
        this.registryPageSize = builder.registryPageSize;
        this.registryConnectTimeoutMs = builder.registryConnectTimeoutMs;
        this.registryReadTimeoutMs = builder.registryReadTimeoutMs;
        this.registryMaxRetries = builder.registryMaxRetries;
        this.registryRetryDelayMs = builder.registryRetryDelayMs;
        this.completenessScale = builder.completenessScale;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Worker count used when none is configured: one less than the available processors, at
     * least one.
     */
    public static int defaultWorkers() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    public Path getInputDir() {
        return inputDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    /**
     * Directory for cached registry listings, or null when caching is disabled.
     */
    public Path getCacheDir() {
        return cacheDir;
    }

    public int getWorkers() {
        return workers;
    }

    public String getFileSuffix() {
        return fileSuffix;
    }

    public String getRegistryBaseUrl() {
        return registryBaseUrl;
    }

    public int getRegistryPageSize() {
        return registryPageSize;
    }

    public int getRegistryConnectTimeoutMs() {
        return registryConnectTimeoutMs;
    }

    public int getRegistryReadTimeoutMs() {
        return registryReadTimeoutMs;
    }

    public int getRegistryMaxRetries() {
        return registryMaxRetries;
    }

    public long getRegistryRetryDelayMs() {
        return registryRetryDelayMs;
    }

    public int getCompletenessScale() {
        return completenessScale;
    }

    @Override
    public String toString() {
        return "AggregationConfig[input=" + inputDir + ", output=" + outputDir + ", cache=" + cacheDir
                + ", workers=" + workers + ", registry=" + registryBaseUrl + "]";
    }

    public static final class Builder {
        private Path inputDir;
        private Path outputDir;
        private Path cacheDir;
        private int workers = defaultWorkers();
        private String fileSuffix = DEFAULT_FILE_SUFFIX;

        private String registryBaseUrl = DEFAULT_REGISTRY_URL;
        private int registryPageSize = 1000;
        private int registryConnectTimeoutMs = 10_000;
        private int registryReadTimeoutMs = 60_000;
        private int registryMaxRetries = 3;
        private long registryRetryDelayMs = 1000;

        private int completenessScale = 4;

        private Builder() {
        }

        public Builder inputDir(Path inputDir) {
            this.inputDir = inputDir;
            return this;
        }

        public Builder outputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder cacheDir(Path cacheDir) {
            this.cacheDir = cacheDir;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder fileSuffix(String fileSuffix) {
            this.fileSuffix = fileSuffix;
            return this;
        }

        public Builder registryBaseUrl(String registryBaseUrl) {
            this.registryBaseUrl = registryBaseUrl;
            return this;
        }

        public Builder registryPageSize(int registryPageSize) {
            this.registryPageSize = registryPageSize;
            return this;
        }

        public Builder registryConnectTimeoutMs(int registryConnectTimeoutMs) {
            this.registryConnectTimeoutMs = registryConnectTimeoutMs;
            return this;
        }

        public Builder registryReadTimeoutMs(int registryReadTimeoutMs) {
            this.registryReadTimeoutMs = registryReadTimeoutMs;
            return this;
        }

        public Builder registryMaxRetries(int registryMaxRetries) {
            this.registryMaxRetries = registryMaxRetries;
            return this;
        }

        public Builder registryRetryDelayMs(long registryRetryDelayMs) {
            this.registryRetryDelayMs = registryRetryDelayMs;
            return this;
        }

        public Builder completenessScale(int completenessScale) {
            this.completenessScale = completenessScale;
            return this;
        }

        public AggregationConfig build() {
            Preconditions.checkArgument(workers > 0, "workers must be positive: %s", workers);
            Preconditions.checkArgument(fileSuffix != null && !fileSuffix.isEmpty(), "file suffix must not be empty");
            Preconditions.checkArgument(registryBaseUrl != null && !registryBaseUrl.isBlank(),
                    "registry base URL must not be empty");
            Preconditions.checkArgument(registryPageSize > 0, "registry page size must be positive: %s", registryPageSize);
            Preconditions.checkArgument(registryConnectTimeoutMs > 0 && registryReadTimeoutMs > 0,
                    "registry timeouts must be positive");
            Preconditions.checkArgument(registryMaxRetries > 0, "registry retries must be positive: %s", registryMaxRetries);
            Preconditions.checkArgument(registryRetryDelayMs >= 0, "retry delay must not be negative");
            Preconditions.checkArgument(completenessScale >= 0, "completeness scale must not be negative");
            return new AggregationConfig(this);
        }
    }
}
