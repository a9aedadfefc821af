package io.surfworks.graphforge.optimizer.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.graphforge.optimizer.TransformerLevel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Loads and saves OptimizerConfig.
 *
 * <p>A missing config file yields the defaults. A file that cannot be read or parsed is
 * reported as a warning and also yields the defaults; fields absent from a valid file
 * keep their default values.
 */
public final class OptimizerConfigLoader {

    private static final Logger LOG = Logger.getLogger(OptimizerConfigLoader.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    private OptimizerConfigLoader() {
    }

    /**
     * Loads configuration from the default config file.
     */
    public static OptimizerConfig load() {
        return load(OptimizerConfig.configFile());
    }

    /**
     * Loads configuration from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     */
    public static OptimizerConfig load(Path configFile) {
        OptimizerConfig defaults = OptimizerConfig.defaults();
        if (!Files.exists(configFile)) {
            return defaults;
        }
        try {
            return loadFromFile(configFile, defaults);
        } catch (IOException | IllegalArgumentException e) {
            LOG.warning("Ignoring unreadable optimizer config " + configFile + ": " + e.getMessage());
            return defaults;
        }
    }

    /**
     * Saves configuration to the default config file.
     *
     * @throws IOException if saving fails
     */
    public static void save(OptimizerConfig config) throws IOException {
        save(config, OptimizerConfig.configFile());
    }

    /**
     * Saves configuration to a specific file as pretty-printed JSON.
     *
     * @throws IOException if saving fails
     */
    public static void save(OptimizerConfig config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        ObjectNode root = JSON.createObjectNode();
        root.put("optimizationLevel", config.optimizationLevel().name());
        root.put("maxSteps", config.maxSteps());
        putSorted(root.putArray("compatibleProviders"), config.compatibleProviders());
        putSorted(root.putArray("disabledTransformers"), config.disabledTransformers());
        putSorted(root.putArray("disabledRules"), config.disabledRules());

        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), root);
    }

    private static OptimizerConfig loadFromFile(Path configFile, OptimizerConfig base) throws IOException {
        JsonNode root = JSON.readTree(configFile.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("expected a JSON object");
        }

        OptimizerConfig config = base;
        if (root.has("optimizationLevel")) {
            config = config.withOptimizationLevel(TransformerLevel.valueOf(root.get("optimizationLevel").asText()));
        }
        if (root.has("maxSteps")) {
            config = config.withMaxSteps(root.get("maxSteps").asInt());
        }
        if (root.has("compatibleProviders")) {
            config = config.withCompatibleProviders(readStrings(root.get("compatibleProviders")));
        }
        if (root.has("disabledTransformers")) {
            config = config.withDisabledTransformers(readStrings(root.get("disabledTransformers")));
        }
        if (root.has("disabledRules")) {
            config = config.withDisabledRules(readStrings(root.get("disabledRules")));
        }
        return config;
    }

    private static Set<String> readStrings(JsonNode node) throws IOException {
        if (!node.isArray()) {
            throw new IOException("expected an array of strings, got " + node.getNodeType());
        }
        Set<String> values = new TreeSet<>();
        for (JsonNode element : node) {
            values.add(element.asText());
        }
        return values;
    }

    private static void putSorted(ArrayNode array, Set<String> values) {
        for (String value : new TreeSet<>(values)) {
            array.add(value);
        }
    }
}
