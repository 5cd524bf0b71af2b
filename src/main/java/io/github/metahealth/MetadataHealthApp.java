package io.github.metahealth;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import io.github.metahealth.config.AggregationConfig;
import io.github.metahealth.config.AggregationConfigLoader;
import io.github.metahealth.files.DataFileScanner;
import io.github.metahealth.output.StatsOutputWriter;
import io.github.metahealth.pipeline.AggregationDriver;
import io.github.metahealth.pipeline.AggregationMetrics;
import io.github.metahealth.pipeline.EntityCatalog;
import io.github.metahealth.pipeline.FileProcessor;
import io.github.metahealth.registry.DataCiteRegistryClient;
import io.github.metahealth.registry.RegistryClient;
import io.github.metahealth.registry.RegistryEntity;
import io.github.metahealth.schema.MetadataSchema;
import io.github.metahealth.stats.RecordUpdater;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Command-line entry point: computes metadata completeness statistics for every provider and
 * client found in a directory of record dumps.
 *
 * <p>Exit codes: {@code 0} on success, {@code 1} when the run fails, {@code 2} on invalid
 * usage.</p>
 */
@CommandLine.Command(
        name = "metahealth-stats",
        mixinStandardHelpOptions = true,
        version = "metahealth-stats 1.0",
        description = "Computes metadata completeness statistics per provider and client")
public class MetadataHealthApp implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(MetadataHealthApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    @CommandLine.Option(
            names = {"-i", "--input-dir"},
            required = true,
            description = "Directory searched recursively for .jsonl.gz record files")
    Path inputDir;

    @CommandLine.Option(
            names = {"-o", "--output-dir"},
            required = true,
            description = "Directory the JSON documents are written to")
    Path outputDir;

    @CommandLine.Option(
            names = {"-c", "--cache-dir"},
            description = "Directory caching the provider and client listings")
    Path cacheDir;

    @CommandLine.Option(
            names = {"-l", "--log-level"},
            defaultValue = "INFO",
            description = "Log level (default: ${DEFAULT-VALUE})")
    String logLevel;

    @CommandLine.Option(
            names = {"-w", "--workers"},
            description = "Number of files processed in parallel (default: processors - 1)")
    Integer workers;

    @CommandLine.Option(
            names = {"--config"},
            description = "YAML configuration file")
    Path configFile;

    @CommandLine.Option(
            names = {"--registry-url"},
            description = "Base URL of the registry API (default: " + AggregationConfig.DEFAULT_REGISTRY_URL + ")")
    String registryUrl;

    private final Function<AggregationConfig, RegistryClient> registryFactory;

    public MetadataHealthApp() {
        this(DataCiteRegistryClient::new);
    }

    MetadataHealthApp(Function<AggregationConfig, RegistryClient> registryFactory) {
        this.registryFactory = registryFactory;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MetadataHealthApp()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        applyLogLevel(logLevel);
        try {
            return run(buildConfig());
        } catch (MetadataHealthException | IOException | IllegalArgumentException e) {
            LOG.error("Statistics run failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    int run(AggregationConfig config) {
        LOG.info("Starting run with {}", config);

        List<Path> files = new DataFileScanner(config.getFileSuffix()).discover(config.getInputDir());
        if (files.isEmpty()) {
            LOG.error("No input files found in {}", config.getInputDir());
            return EXIT_FAILURE;
        }

        RegistryClient registry = registryFactory.apply(config);
        List<RegistryEntity> providers = registry.listProviders();
        List<RegistryEntity> clients = registry.listClients();

        MetadataSchema schema = MetadataSchema.datacite();
        EntityCatalog catalog = EntityCatalog.fromRegistry(schema, providers, clients);

        AggregationDriver driver = new AggregationDriver(
                new FileProcessor(new RecordUpdater(schema)), config.getWorkers());
        AggregationMetrics metrics = driver.run(files, catalog, config.getCompletenessScale());

        new StatsOutputWriter().write(catalog.getProviders(), catalog.getClients(), config.getOutputDir());
        LOG.info("Finished: {} providers, {} clients, {}",
                catalog.getProviders().size(), catalog.getClients().size(), metrics);
        return EXIT_OK;
    }

    AggregationConfig buildConfig() throws IOException {
        AggregationConfig.Builder builder = AggregationConfigLoader.load(configFile);
        builder.inputDir(inputDir).outputDir(outputDir);
        if (cacheDir != null) {
            builder.cacheDir(cacheDir);
        }
        if (workers != null) {
            builder.workers(workers);
        }
        if (registryUrl != null) {
            builder.registryBaseUrl(registryUrl);
        }
        return builder.build();
    }

    static void applyLogLevel(String level) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext) {
            ((LoggerContext) factory).getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(level, Level.INFO));
        } else {
            LOG.warn("Cannot set log level {}: logging backend is not Logback", level);
        }
    }
}
