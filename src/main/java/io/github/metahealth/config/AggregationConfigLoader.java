package io.github.metahealth.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Fills an {@link AggregationConfig.Builder} from external sources.
 *
 * <p>Sources are applied in increasing precedence: the classpath {@value #DEFAULT_CONFIG_FILE},
 * an optional YAML file, then environment variables. Every source uses the same keys; in the
 * environment a key is upper-cased with dots replaced by underscores
 * ({@code metahealth.cache.dir} becomes {@code METAHEALTH_CACHE_DIR}).</p>
 */
public final class AggregationConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationConfigLoader.class);

    public static final String DEFAULT_CONFIG_FILE = "metahealth.properties";

    static final String INPUT_DIR = "metahealth.input.dir";
    static final String OUTPUT_DIR = "metahealth.output.dir";
    static final String CACHE_DIR = "metahealth.cache.dir";
    static final String WORKERS = "metahealth.workers";
    static final String FILE_SUFFIX = "metahealth.file.suffix";
    static final String REGISTRY_URL = "metahealth.registry.url";
    static final String REGISTRY_PAGE_SIZE = "metahealth.registry.page.size";
    static final String REGISTRY_CONNECT_TIMEOUT = "metahealth.registry.connect.timeout.ms";
    static final String REGISTRY_READ_TIMEOUT = "metahealth.registry.read.timeout.ms";
    static final String REGISTRY_MAX_RETRIES = "metahealth.registry.max.retries";
    static final String REGISTRY_RETRY_DELAY = "metahealth.registry.retry.delay.ms";
    static final String COMPLETENESS_SCALE = "metahealth.completeness.scale";

    private static final String[] KEYS = {
            INPUT_DIR, OUTPUT_DIR, CACHE_DIR, WORKERS, FILE_SUFFIX, REGISTRY_URL, REGISTRY_PAGE_SIZE,
            REGISTRY_CONNECT_TIMEOUT, REGISTRY_READ_TIMEOUT, REGISTRY_MAX_RETRIES, REGISTRY_RETRY_DELAY,
            COMPLETENESS_SCALE
    };

    private AggregationConfigLoader() {
    }

    /**
     * Builder seeded from the classpath defaults, the YAML file (if not null) and the process
     * environment.
     */
    public static AggregationConfig.Builder load(Path yamlFile) throws IOException {
        AggregationConfig.Builder builder = AggregationConfig.builder();
        applyProperties(builder, loadClasspathProperties(DEFAULT_CONFIG_FILE));
        if (yamlFile != null) {
            applyYaml(builder, yamlFile);
        }
        applyEnvironment(builder, System.getenv());
        return builder;
    }

    static Properties loadClasspathProperties(String resource) throws IOException {
        Properties props = new Properties();
        try (InputStream is = AggregationConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                props.load(is);
            } else {
                LOG.debug("No {} on the classpath, using built-in defaults", resource);
            }
        }
        return props;
    }

    public static void applyProperties(AggregationConfig.Builder builder, Properties props) {
        for (String key : KEYS) {
            String value = props.getProperty(key);
            if (value != null && !value.isBlank()) {
                apply(builder, key, value.trim());
            }
        }
    }

    /**
     * Applies a YAML document of flat {@code key: value} pairs using the property keys.
     */
    public static void applyYaml(AggregationConfig.Builder builder, Path yamlFile) throws IOException {
        Object loaded;
        try (Reader reader = Files.newBufferedReader(yamlFile, StandardCharsets.UTF_8)) {
            loaded = new Yaml().load(reader);
        }
        if (loaded == null) {
            return;
        }
        if (!(loaded instanceof Map)) {
            throw new IllegalArgumentException("Configuration file " + yamlFile + " must hold a mapping");
        }
        Map<?, ?> document = (Map<?, ?>) loaded;
        for (String key : KEYS) {
            Object value = document.get(key);
            if (value != null) {
                apply(builder, key, String.valueOf(value).trim());
            }
        }
        LOG.info("Loaded configuration from {}", yamlFile);
    }

    public static void applyEnvironment(AggregationConfig.Builder builder, Map<String, String> env) {
        for (String key : KEYS) {
            String value = env.get(toEnvironmentName(key));
            if (value != null && !value.isBlank()) {
                apply(builder, key, value.trim());
            }
        }
    }

    static String toEnvironmentName(String key) {
        return key.replace('.', '_').toUpperCase(Locale.ROOT);
    }

    private static void apply(AggregationConfig.Builder builder, String key, String value) {
        try {
            switch (key) {
                case INPUT_DIR:
                    builder.inputDir(Paths.get(value));
                    break;
                case OUTPUT_DIR:
                    builder.outputDir(Paths.get(value));
                    break;
                case CACHE_DIR:
                    builder.cacheDir(Paths.get(value));
                    break;
                case WORKERS:
                    builder.workers(Integer.parseInt(value));
                    break;
                case FILE_SUFFIX:
                    builder.fileSuffix(value);
                    break;
                case REGISTRY_URL:
                    builder.registryBaseUrl(value);
                    break;
                case REGISTRY_PAGE_SIZE:
                    builder.registryPageSize(Integer.parseInt(value));
                    break;
                case REGISTRY_CONNECT_TIMEOUT:
                    builder.registryConnectTimeoutMs(Integer.parseInt(value));
                    break;
                case REGISTRY_READ_TIMEOUT:
                    builder.registryReadTimeoutMs(Integer.parseInt(value));
                    break;
                case REGISTRY_MAX_RETRIES:
                    builder.registryMaxRetries(Integer.parseInt(value));
                    break;
                case REGISTRY_RETRY_DELAY:
                    builder.registryRetryDelayMs(Long.parseLong(value));
                    break;
                case COMPLETENESS_SCALE:
                    builder.completenessScale(Integer.parseInt(value));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown configuration key: " + key);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }
}
