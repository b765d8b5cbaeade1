package im.arun.regingest.cli;

import ch.qos.logback.classic.Level;
import im.arun.regingest.config.ConfigLoader;
import im.arun.regingest.config.IngestConfig;
import im.arun.regingest.http.HttpClientFactory;
import im.arun.regingest.index.ElasticsearchSearchStore;
import im.arun.regingest.index.InMemorySearchStore;
import im.arun.regingest.index.SearchStore;
import im.arun.regingest.pagination.LoggingProgressReporter;
import im.arun.regingest.service.IngestionEngine;
import im.arun.regingest.util.ExecutorProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;

/**
 * Command-line entry point. Subcommands share the configuration and store options defined here.
 */
@Command(
    name = "regingest",
    description = "Load parliamentary and FCA register records into a search store",
    mixinStandardHelpOptions = true,
    version = "registry-ingest 1.0",
    subcommands = {
        LoadDataCommand.class,
        ScheduledCommand.class,
        InitStoreCommand.class,
        DeleteStoreCommand.class,
        SearchCommand.class
    }
)
public class RegistryIngestCLI implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(RegistryIngestCLI.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Option(names = {"--config"}, description = "YAML file overriding the bundled ingest.yaml")
    private String configPath;

    @Option(names = {"--log-level"}, description = "Root log level (TRACE, DEBUG, INFO, WARN, ERROR)",
            defaultValue = "INFO")
    private String logLevel;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    IngestConfig loadConfig() {
        applyLogLevel();
        return new ConfigLoader(configPath).load();
    }

    /**
     * Engine over Elasticsearch, or over an in-memory store when {@code dryRun} is set.
     */
    IngestionEngine engine(IngestConfig config, boolean dryRun) {
        return IngestionEngine.create(config, store(config, dryRun), ExecutorProvider.getExecutor(),
                new LoggingProgressReporter(), System.getenv());
    }

    SearchStore store(IngestConfig config, boolean dryRun) {
        if (dryRun) {
            logger.info("Dry run: documents are kept in memory only");
            return new InMemorySearchStore();
        }
        IngestConfig.Store settings = config.getStore();
        return new ElasticsearchSearchStore(
                HttpClientFactory.create(Duration.ofSeconds(config.getHttp().getTimeoutSeconds())),
                settings.baseUrl(), settings.getApiKey(), settings.getIndexPrefix());
    }

    private void applyLogLevel() {
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.toLevel(logLevel, Level.INFO));
        }
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new CommandLine(new RegistryIngestCLI()).execute(args);
        } finally {
            ExecutorProvider.shutdown();
        }
        System.exit(exitCode);
    }
}
