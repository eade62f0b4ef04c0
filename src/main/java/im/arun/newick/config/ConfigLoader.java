package im.arun.newick.config;

import com.fasterxml.jackson.databind.ObjectMapper;
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
 * Loads {@link NewickConfig} from a YAML file and merges per-call overrides.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_RESOURCE = "newick.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final NewickConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private NewickConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled resource
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), NewickConfig.class);
                }
                logger.warn("Config file {} not found, trying classpath", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, NewickConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new NewickConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new NewickConfig();
        }
    }

    public NewickConfig load() {
        return load(null);
    }

    public NewickConfig load(Map<String, Object> userOptions) {
        NewickConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            switch (key) {
                case "encoding":
                    if (value instanceof String) config.setEncoding((String) value);
                    break;
                case "strict_trailing_text":
                case "strictTrailingText":
                    config.setStrictTrailingText(parseBoolean(value));
                    break;
                case "strict_ascii":
                case "strictAscii":
                    config.setStrictAscii(parseBoolean(value));
                    break;
                case "show_internal":
                case "showInternal":
                    config.setShowInternal(parseBoolean(value));
                    break;
                case "label_margin":
                case "labelMargin":
                    if (value instanceof Integer) config.setLabelMargin((Integer) value);
                    else logger.error("Config key {} expects an integer, got {}", key, value);
                    break;
                case "preserve_lengths":
                case "preserveLengths":
                    config.setPreserveLengths(parseBoolean(value));
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
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

    private NewickConfig copyConfig(NewickConfig source) {
        NewickConfig copy = new NewickConfig();
        copy.setEncoding(source.getEncoding());
        copy.setStrictTrailingText(source.isStrictTrailingText());
        copy.setStrictAscii(source.isStrictAscii());
        copy.setShowInternal(source.isShowInternal());
        copy.setLabelMargin(source.getLabelMargin());
        copy.setPreserveLengths(source.isPreserveLengths());
        return copy;
    }
}
