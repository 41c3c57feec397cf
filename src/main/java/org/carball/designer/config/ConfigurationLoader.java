package org.carball.designer.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    public static final String MAX_MEMORY_BYTES = "max_memory_bytes";
    public static final String SKEW_INTERVALS = "skew_intervals";
    public static final String ADDRESS_SIZE_BITS = "address_size_bits";
    public static final String NODE_COUNT = "node_count";
    public static final String WEIGHT_NETWORK = "weight_network";
    public static final String WEIGHT_SKEW = "weight_skew";
    public static final String WEIGHT_DISK = "weight_disk";
    public static final String PROFILE = "profile";

    private static final String ENV_PREFIX = "DESIGNER_";

    private final Map<String, String> environment;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: overrides > env vars > YAML file > profile > defaults
     *
     * @param configFile optional YAML file, may be null
     * @param overrides  settings keyed like the YAML file, highest priority
     */
    public CostModelConfig loadConfiguration(Path configFile, Map<String, String> overrides) throws IOException {
        log.debug("Loading cost model configuration");

        CostModelConfig.CostModelConfigBuilder builder = CostModelConfig.builder();

        JsonNode fileSettings = configFile != null ? readYaml(configFile) : null;

        // 1. Profile weights, the most specific source naming one wins
        String profileName = firstNonNull(
                overrides.get(PROFILE),
                environment.get(envName(PROFILE)),
                fileSettings != null && fileSettings.hasNonNull(PROFILE) ? fileSettings.get(PROFILE).asText() : null);
        if (profileName != null) {
            WeightProfile.fromName(profileName).applyTo(builder);
        }

        // 2. YAML file
        if (fileSettings != null) {
            applyFileSettings(builder, fileSettings);
        }

        // 3. Environment variables
        for (String key : new String[]{MAX_MEMORY_BYTES, SKEW_INTERVALS, ADDRESS_SIZE_BITS,
                NODE_COUNT, WEIGHT_NETWORK, WEIGHT_SKEW, WEIGHT_DISK}) {
            String value = environment.get(envName(key));
            if (value != null) {
                applySetting(builder, key, value);
            }
        }

        // 4. Explicit overrides (highest priority)
        overrides.forEach((key, value) -> {
            if (!PROFILE.equals(key)) {
                applySetting(builder, key, value);
            }
        });

        CostModelConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    /**
     * Loads configuration from a YAML file alone.
     */
    public CostModelConfig loadConfiguration(Path configFile) throws IOException {
        return loadConfiguration(configFile, Map.of());
    }

    private JsonNode readYaml(Path configFile) throws IOException {
        if (!Files.exists(configFile)) {
            throw new IOException("Configuration file not found: " + configFile);
        }
        JsonNode root = yamlMapper.readTree(configFile.toFile());
        if (root == null || !root.isObject()) {
            throw new InvalidConfigurationException("Configuration file is not a YAML mapping: " + configFile);
        }
        log.info("Read configuration file {}", configFile);
        return root;
    }

    private void applyFileSettings(CostModelConfig.CostModelConfigBuilder builder, JsonNode settings) {
        Iterator<Map.Entry<String, JsonNode>> fields = settings.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (PROFILE.equals(field.getKey())) {
                continue;
            }
            applySetting(builder, field.getKey(), field.getValue().asText());
        }
    }

    private void applySetting(CostModelConfig.CostModelConfigBuilder builder, String key, String value) {
        try {
            switch (key) {
                case MAX_MEMORY_BYTES:
                    builder.maxMemoryBytes(Long.parseLong(value.trim()));
                    break;
                case SKEW_INTERVALS:
                    builder.skewIntervals(Integer.parseInt(value.trim()));
                    break;
                case ADDRESS_SIZE_BITS:
                    builder.addressSizeBits(Integer.parseInt(value.trim()));
                    break;
                case NODE_COUNT:
                    builder.nodeCount(Integer.parseInt(value.trim()));
                    break;
                case WEIGHT_NETWORK:
                    builder.weightNetwork(Double.parseDouble(value.trim()));
                    break;
                case WEIGHT_SKEW:
                    builder.weightSkew(Double.parseDouble(value.trim()));
                    break;
                case WEIGHT_DISK:
                    builder.weightDisk(Double.parseDouble(value.trim()));
                    break;
                default:
                    log.warn("Ignoring unknown configuration setting: {}", key);
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", key, value);
        }
    }

    private static String envName(String key) {
        return ENV_PREFIX + key.toUpperCase();
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * Returns help text for cost model configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Cost Model Configuration Options:

            YAML keys / overrides:
              max_memory_bytes <num>    Memory budget the design's data must fit in
              skew_intervals <num>      Number of time intervals for skew analysis
              address_size_bits <num>   Address size used for index entry estimates
              node_count <num>          Number of shard nodes in the cluster
              weight_network <num>      Weight of the network cost term
              weight_skew <num>         Weight of the skew cost term
              weight_disk <num>         Weight of the disk cost term
              profile <name>            Weight preset (balanced, network-bound, hotspot-averse, memory-constrained)

            Environment Variables:
              DESIGNER_<KEY>            Same as the key above in upper case, e.g. DESIGNER_NODE_COUNT

            Priority Order (highest to lowest):
              1. Overrides
              2. Environment variables
              3. YAML file
              4. Profile weights or equal weighting
            """;
    }
}
