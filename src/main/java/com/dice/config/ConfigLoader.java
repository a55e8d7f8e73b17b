package com.dice.config;

import com.dice.eval.DiceEvaluator;
import com.dice.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Loads dice configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String CLASSPATH_PREFIX = "classpath:";

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static DiceConfig load(String path) {
        log.info("Loading dice configuration from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }

        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            return new ClassPathResource(path.substring(CLASSPATH_PREFIX.length()));
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static DiceConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded;
        try {
            loaded = yaml.load(inputStream);
        } catch (RuntimeException e) {
            throw new ConfigurationException("Configuration is not valid YAML: " + e.getMessage(), e);
        }

        if (loaded == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigurationException("Configuration root must be a mapping");
        }

        // The dice section may be at the root or under a 'dice' key
        Map<String, Object> root = (Map<String, Object>) loaded;
        Map<String, Object> diceConfig = root.containsKey("dice")
                ? getMap(root, "dice")
                : root;

        Set<Integer> allowedSides = parseAllowedSides(diceConfig.get("allowed-sides"));

        int maxDice = getInt(diceConfig, "max-dice", DiceEvaluator.DEFAULT_MAX_DICE);
        if (maxDice < 0) {
            throw new ConfigurationException("max-dice must not be negative: " + maxDice);
        }

        Long randomSeed = getLong(diceConfig, "random-seed");

        Map<String, Object> reportConfig = getMap(diceConfig, "report");
        boolean ansiColors = getBoolean(reportConfig, "ansi-colors", false);

        DiceConfig config = new DiceConfig(allowedSides, maxDice, randomSeed, ansiColors);

        log.info("Loaded dice configuration: sides {}, max {} dice, seed: {}, ansi colors: {}",
                new TreeSet<>(allowedSides), maxDice,
                randomSeed != null ? randomSeed : "none", ansiColors);

        return config;
    }

    private static Set<Integer> parseAllowedSides(Object value) {
        if (value == null) {
            return DiceEvaluator.STANDARD_SIDES;
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("allowed-sides must be a list of integers, got: " + value);
        }
        if (list.isEmpty()) {
            throw new ConfigurationException("allowed-sides must not be empty");
        }

        Set<Integer> sides = new TreeSet<>();
        for (Object item : list) {
            if (!(item instanceof Integer side)) {
                throw new ConfigurationException("allowed-sides entry is not an integer: " + item);
            }
            if (side < 1) {
                throw new ConfigurationException("allowed-sides entry must be positive: " + side);
            }
            sides.add(side);
        }
        return sides;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return Map.of();
        if (value instanceof Map) return (Map<String, Object>) value;
        throw new ConfigurationException("'" + key + "' must be a mapping, got: " + value);
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Integer) return (Integer) value;
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got: " + value, e);
        }
    }

    private static Long getLong(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (value instanceof Integer || value instanceof Long) return ((Number) value).longValue();
        try {
            return Long.parseLong(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got: " + value, e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
