package im.arun.rptsearch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final RptSearchConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private RptSearchConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), RptSearchConfig.class);
                }
                logger.warn("Config file {} not found, falling back to bundled config.yaml", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream("config.yaml")) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, RptSearchConfig.class);
                }
            }

            logger.warn("No config.yaml found, using default configuration");
            return new RptSearchConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new RptSearchConfig();
        }
    }

    public RptSearchConfig load() {
        return load(null);
    }

    public RptSearchConfig load(Map<String, Object> userOptions) {
        RptSearchConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            try {
                switch (key) {
                    case "catalog_dir":
                    case "catalogDir":
                        config.setCatalogDir(value.toString());
                        break;
                    case "index_dir":
                    case "indexDir":
                        config.setIndexDir(value.toString());
                        break;
                    case "store_dirs":
                    case "storeDirs":
                        config.setStoreDirs(parseList(value));
                        break;
                    case "min_match_score":
                    case "minMatchScore":
                        if (value instanceof Number) config.setMinMatchScore(((Number) value).doubleValue());
                        break;
                    case "default_encoding":
                    case "defaultEncoding":
                        config.setDefaultEncoding(value.toString());
                        break;
                    case "format_probe_sample":
                    case "formatProbeSample":
                        if (value instanceof Integer) config.setFormatProbeSample((Integer) value);
                        break;
                    case "max_field_width":
                    case "maxFieldWidth":
                        if (value instanceof Integer) config.setMaxFieldWidth((Integer) value);
                        break;
                    case "parallel_pages":
                    case "parallelPages":
                        config.setParallelPages(parseBoolean(value));
                        break;
                    case "worker_threads":
                    case "workerThreads":
                        if (value instanceof Integer) config.setWorkerThreads((Integer) value);
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

    private List<String> parseList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                result.add(String.valueOf(item));
            }
        } else {
            result.add(value.toString());
        }
        return result;
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

    private RptSearchConfig copyConfig(RptSearchConfig source) {
        RptSearchConfig copy = new RptSearchConfig();
        copy.setCatalogDir(source.getCatalogDir());
        copy.setIndexDir(source.getIndexDir());
        copy.setStoreDirs(new ArrayList<>(source.getStoreDirs()));
        copy.setMinMatchScore(source.getMinMatchScore());
        copy.setDefaultEncoding(source.getDefaultEncoding());
        copy.setFormatProbeSample(source.getFormatProbeSample());
        copy.setMaxFieldWidth(source.getMaxFieldWidth());
        copy.setParallelPages(source.isParallelPages());
        copy.setWorkerThreads(source.getWorkerThreads());
        return copy;
    }
}
