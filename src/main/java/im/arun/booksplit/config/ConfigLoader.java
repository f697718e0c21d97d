package im.arun.booksplit.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Loads {@link BookSplitConfig} from YAML and merges per-run overrides on top of it.
 *
 * <p>An explicit file path wins over {@code config.yaml} on the classpath; when neither
 * can be read the built-in defaults are used.</p>
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final BookSplitConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private BookSplitConfig loadDefaultConfig(String configPath) {
        try {
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.info("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), BookSplitConfig.class);
                }
                logger.warn("Config file {} does not exist, trying classpath", path);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream("config.yaml")) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, BookSplitConfig.class);
                }
            }

            logger.warn("No config.yaml found, using default configuration");
            return new BookSplitConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new BookSplitConfig();
        }
    }

    public BookSplitConfig load() {
        return load(null);
    }

    public BookSplitConfig load(Map<String, Object> userOptions) {
        BookSplitConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            try {
                switch (key) {
                    case "output_directory":
                    case "outputDirectory":
                        if (value != null) config.setOutputDirectory(value.toString());
                        break;
                    case "worker_threads":
                    case "workerThreads":
                        config.setWorkerThreads(parseInt(value, config.getWorkerThreads()));
                        break;
                    case "max_filename_length":
                    case "maxFilenameLength":
                        config.setMaxFilenameLength(parseInt(value, config.getMaxFilenameLength()));
                        break;
                    case "min_top_level_entries":
                    case "minTopLevelEntries":
                        config.setMinTopLevelEntries(parseInt(value, config.getMinTopLevelEntries()));
                        break;
                    case "fallback_title":
                    case "fallbackTitle":
                        if (value instanceof String) config.setFallbackTitle((String) value);
                        break;
                    case "use_document_name_for_fallback":
                    case "useDocumentNameForFallback":
                        config.setUseDocumentNameForFallback(parseBoolean(value));
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (Exception e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return config;
    }

    private int parseInt(Object value, int fallback) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            return Integer.parseInt(((String) value).trim());
        }
        return fallback;
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private BookSplitConfig copyConfig(BookSplitConfig source) {
        BookSplitConfig copy = new BookSplitConfig();
        copy.setOutputDirectory(source.getOutputDirectory());
        copy.setWorkerThreads(source.getWorkerThreads());
        copy.setMaxFilenameLength(source.getMaxFilenameLength());
        copy.setMinTopLevelEntries(source.getMinTopLevelEntries());
        copy.setFallbackTitle(source.getFallbackTitle());
        copy.setUseDocumentNameForFallback(source.isUseDocumentNameForFallback());
        return copy;
    }
}
