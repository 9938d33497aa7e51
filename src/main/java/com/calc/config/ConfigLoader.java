package com.calc.config;

import com.calc.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads calculator configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static CalcConfig load(String path) {
        log.info("Loading calculator configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static CalcConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(inputStream);

        if (loaded == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigurationException("Configuration root must be a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        // Get the calc section (could be at root or under 'calc' key)
        Object section = root.containsKey("calc") ? root.get("calc") : root;
        if (!(section instanceof Map)) {
            throw new ConfigurationException("Section 'calc' must be a mapping");
        }
        Map<String, Object> calcConfig = (Map<String, Object>) section;

        CalcConfig defaults = CalcConfig.defaults();
        String name = getString(calcConfig, "name", defaults.name());
        String prompt = getString(calcConfig, "prompt", defaults.prompt());
        List<String> exitCommands = getCommands(calcConfig, "exit-commands", defaults.exitCommands());
        List<String> helpCommands = getCommands(calcConfig, "help-commands", defaults.helpCommands());
        String usage = getString(calcConfig, "usage", defaults.usage()).stripTrailing();
        String overflowMessage = getString(calcConfig, "overflow-message", defaults.overflowMessage());
        int precision = getInt(calcConfig, "precision", defaults.precision());

        if (precision <= 0) {
            throw new ConfigurationException("precision must be > 0, got " + precision);
        }
        for (String command : exitCommands) {
            if (helpCommands.contains(command)) {
                throw new ConfigurationException("Command '" + command + "' is both an exit and a help command");
            }
        }

        log.debug("Parsed commands: exit={}, help={}", exitCommands, helpCommands);
        log.info("Loaded calculator configuration: {} with precision {}", name, precision);

        return new CalcConfig(name, prompt, exitCommands, helpCommands, usage, overflowMessage, precision);
    }

    private static List<String> getCommands(Map<String, Object> map, String key, List<String> defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("'" + key + "' must be a list of commands");
        }
        List<String> commands = new ArrayList<>();
        for (Object item : list) {
            if (item == null || item.toString().isBlank()) {
                throw new ConfigurationException("'" + key + "' contains a blank command");
            }
            commands.add(item.toString().strip().toLowerCase(Locale.ROOT));
        }
        return commands;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got '" + value + "'", e);
        }
    }
}
