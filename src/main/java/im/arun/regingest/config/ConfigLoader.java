package im.arun.regingest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.regingest.exception.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Loads {@link IngestConfig}: {@code ingest.yaml} from the classpath, then an optional YAML file
 * layered on top, then environment overrides for endpoints and secrets.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_RESOURCE = "ingest.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final IngestConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private IngestConfig loadDefaultConfig(String configPath) {
        IngestConfig config;
        try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (resourceStream != null) {
                config = yamlMapper.readValue(resourceStream, IngestConfig.class);
            } else {
                logger.warn("No {} found on the classpath, using default configuration", DEFAULT_RESOURCE);
                config = new IngestConfig();
            }
        } catch (IOException e) {
            logger.warn("Failed to load {}, using defaults: {}", DEFAULT_RESOURCE, e.getMessage());
            config = new IngestConfig();
        }

        if (configPath != null) {
            Path path = Paths.get(configPath);
            if (!Files.exists(path)) {
                throw new ConfigException("Config file not found: " + configPath);
            }
            try {
                config = yamlMapper.readerForUpdating(config).readValue(path.toFile());
                logger.info("Loaded configuration from {}", path);
            } catch (IOException e) {
                throw new ConfigException("Invalid config file " + configPath + ": " + e.getMessage(), e);
            }
        }
        return config;
    }

    public IngestConfig load() {
        return load(System.getenv());
    }

    /**
     * Returns a fresh copy of the loaded configuration with {@code env} overrides applied.
     */
    public IngestConfig load(Map<String, String> env) {
        IngestConfig config = copyConfig(defaultConfig);

        env.forEach((key, value) -> {
            if (value == null || value.isEmpty()) {
                return;
            }
            switch (key) {
                case "FCA_API_EMAIL":
                    config.getFca().setEmail(value);
                    break;
                case "FCA_API_KEY":
                    config.getFca().setApiKey(value);
                    break;
                case "FCA_API_BASE_URL":
                    config.getFca().setBaseUrl(value);
                    break;
                case "ELASTICSEARCH_HOST":
                    config.getStore().setHost(value);
                    break;
                case "ELASTICSEARCH_PORT":
                    config.getStore().setPort(parsePort(value));
                    break;
                case "ELASTICSEARCH_SCHEME":
                    config.getStore().setScheme(value);
                    break;
                case "ELASTICSEARCH_API_KEY":
                    config.getStore().setApiKey(value);
                    break;
                default:
                    break;
            }
        });

        return config;
    }

    private int parsePort(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException("ELASTICSEARCH_PORT is not a number: " + value, e);
        }
    }

    private IngestConfig copyConfig(IngestConfig source) {
        return yamlMapper.convertValue(source, IngestConfig.class);
    }
}
