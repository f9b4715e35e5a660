package im.arun.tokenmap.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.tokenmap.model.ModelConfig;
import im.arun.tokenmap.token.ModelCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String DEFAULT_RESOURCE = "config.yaml";
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final TokenMapConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private TokenMapConfig loadDefaultConfig(String configPath) {
        TokenMapConfig config = readConfig(configPath);
        if (config.getModels() == null || config.getModels().isEmpty()) {
            config.setModels(new ArrayList<>(ModelCatalog.defaultModels()));
        }
        return config;
    }

    private TokenMapConfig readConfig(String configPath) {
        try {
            // An explicit file wins over the bundled resource
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.info("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), TokenMapConfig.class);
                }
                logger.warn("Config file {} not found, falling back to classpath", path);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, TokenMapConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new TokenMapConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new TokenMapConfig();
        }
    }

    public TokenMapConfig load() {
        return load(null);
    }

    public TokenMapConfig load(Map<String, Object> userOptions) {
        TokenMapConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            try {
                switch (key) {
                    case "model":
                        if (value instanceof String) config.setModel((String) value);
                        break;
                    case "basis":
                        if (value instanceof String) config.setBasis((String) value);
                        break;
                    case "aggregation_threshold":
                    case "aggregationThreshold":
                        if (value instanceof Number) config.setAggregationThreshold(((Number) value).doubleValue());
                        break;
                    case "max_visible_nodes":
                    case "maxVisibleNodes":
                        if (value instanceof Integer) config.setMaxVisibleNodes((Integer) value);
                        break;
                    case "max_depth":
                    case "maxDepth":
                        if (value instanceof Integer) config.setMaxDepth((Integer) value);
                        break;
                    case "preview_length":
                    case "previewLength":
                        if (value instanceof Integer) config.setPreviewLength((Integer) value);
                        break;
                    case "streaming_threshold_chars":
                    case "streamingThresholdChars":
                        if (value instanceof Integer) config.setStreamingThresholdChars((Integer) value);
                        break;
                    case "stream_chunk_chars":
                    case "streamChunkChars":
                        if (value instanceof Integer) config.setStreamChunkChars((Integer) value);
                        break;
                    case "preserve_attributes":
                    case "preserveAttributes":
                        config.setPreserveAttributes(parseBoolean(value));
                        break;
                    case "honor_namespaces":
                    case "honorNamespaces":
                        config.setHonorNamespaces(parseBoolean(value));
                        break;
                    case "retain_text":
                    case "retainText":
                        config.setRetainText(parseBoolean(value));
                        break;
                    case "run_log":
                    case "runLog":
                        config.setRunLog(parseBoolean(value));
                        break;
                    case "run_log_dir":
                    case "runLogDir":
                        if (value instanceof String) config.setRunLogDir((String) value);
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

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private TokenMapConfig copyConfig(TokenMapConfig source) {
        TokenMapConfig copy = new TokenMapConfig();
        copy.setModel(source.getModel());
        copy.setBasis(source.getBasis());
        copy.setAggregationThreshold(source.getAggregationThreshold());
        copy.setMaxVisibleNodes(source.getMaxVisibleNodes());
        copy.setMaxDepth(source.getMaxDepth());
        copy.setPreviewLength(source.getPreviewLength());
        copy.setStreamingThresholdChars(source.getStreamingThresholdChars());
        copy.setStreamChunkChars(source.getStreamChunkChars());
        copy.setPreserveAttributes(source.isPreserveAttributes());
        copy.setHonorNamespaces(source.isHonorNamespaces());
        copy.setRetainText(source.isRetainText());
        copy.setRunLog(source.isRunLog());
        copy.setRunLogDir(source.getRunLogDir());

        List<ModelConfig> models = new ArrayList<>();
        for (ModelConfig model : source.getModels()) {
            models.add(new ModelConfig(model.getId(), model.getName(), model.getContextLimit(),
                model.getTokenizer(), model.getOverheadTokens()));
        }
        copy.setModels(models);
        return copy;
    }
}
