package com.github.rewrite.solidity.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads NamespaceConfiguration from project.yaml or returns defaults.
 * <p>
 * The loader uses a static cache to avoid repeated file reads.
 * This is safe because project.yaml doesn't change during a recipe run.
 * <p>
 * Usage in a Recipe:
 * <pre>
 * NamespaceConfiguration config = NamespaceConfigurationLoader.loadWithInheritance(projectRoot);
 * String prefix = config.getPrefix();
 * </pre>
 */
public class NamespaceConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(NamespaceConfigurationLoader.class);

    private static final String PROJECT_YAML = "project.yaml";

    // Static cache - safe because project.yaml doesn't change during recipe execution
    private static final Map<Path, NamespaceConfiguration> CACHE = new ConcurrentHashMap<>();

    // Inheritance cache - maps module paths to their effective configuration
    private static final Map<Path, NamespaceConfiguration> INHERITANCE_CACHE = new ConcurrentHashMap<>();

    private NamespaceConfigurationLoader() {
    }

    /**
     * Loads the NamespaceConfiguration for the given project root.
     * <p>
     * If project.yaml exists, it is parsed. Otherwise, defaults are returned.
     * Results are cached.
     *
     * @param projectRoot the project root directory
     * @return the NamespaceConfiguration
     * @throws ConfigurationException if project.yaml exists but is invalid
     */
    public static NamespaceConfiguration load(Path projectRoot) {
        if (projectRoot == null) {
            return NamespaceConfiguration.defaults();
        }
        Path normalizedRoot = projectRoot.toAbsolutePath().normalize();
        return CACHE.computeIfAbsent(normalizedRoot, NamespaceConfigurationLoader::loadFromDisk);
    }

    /**
     * Loads the NamespaceConfiguration for the given module root with parent inheritance.
     * <p>
     * The inheritance logic:
     * <ol>
     *   <li>If the module has its own project.yaml, load and return it</li>
     *   <li>Otherwise, walk up parent directories looking for project.yaml</li>
     *   <li>Stop at filesystem root or .git directory (repository boundary)</li>
     *   <li>If no parent config found, return defaults</li>
     * </ol>
     *
     * @param moduleRoot the module root directory (can be a submodule)
     * @return the NamespaceConfiguration (own or inherited from parent)
     */
    public static NamespaceConfiguration loadWithInheritance(Path moduleRoot) {
        if (moduleRoot == null) {
            return NamespaceConfiguration.defaults();
        }
        Path normalizedRoot = moduleRoot.toAbsolutePath().normalize();

        NamespaceConfiguration cached = INHERITANCE_CACHE.get(normalizedRoot);
        if (cached != null) {
            return cached;
        }

        Path current = normalizedRoot;
        while (current != null) {
            if (Files.exists(current.resolve(PROJECT_YAML))) {
                NamespaceConfiguration config = load(current);
                INHERITANCE_CACHE.put(normalizedRoot, config);
                return config;
            }
            // Don't traverse beyond repository root
            if (Files.isDirectory(current.resolve(".git"))) {
                break;
            }
            current = current.getParent();
        }

        log.info("No {} found for {}. Using defaults (namespace.prefix={}).", PROJECT_YAML, normalizedRoot,
                NamespaceConfiguration.DEFAULT_PREFIX);
        NamespaceConfiguration defaults = NamespaceConfiguration.defaults();
        INHERITANCE_CACHE.put(normalizedRoot, defaults);
        return defaults;
    }

    /**
     * Clears the cache. Call this between test runs if needed.
     */
    public static void clearCache() {
        CACHE.clear();
        INHERITANCE_CACHE.clear();
    }

    private static NamespaceConfiguration loadFromDisk(Path projectRoot) {
        Path yamlPath = projectRoot.resolve(PROJECT_YAML);
        if (!Files.exists(yamlPath)) {
            return NamespaceConfiguration.defaults();
        }
        return parseYaml(yamlPath);
    }

    /**
     * Parses the project.yaml file using SnakeYAML.
     */
    @SuppressWarnings("unchecked")
    private static NamespaceConfiguration parseYaml(Path yamlPath) {
        Map<String, Object> root;
        try {
            String content = Files.readString(yamlPath);
            Object loaded = new Yaml().load(content);
            if (loaded != null && !(loaded instanceof Map)) {
                throw new ConfigurationException(yamlPath + " must contain a mapping at the top level");
            }
            root = (Map<String, Object>) loaded;
        } catch (IOException | YAMLException e) {
            throw new ConfigurationException("Failed to read " + yamlPath, e);
        }

        if (root == null || !(root.get("namespace") instanceof Map)) {
            return NamespaceConfiguration.defaults();
        }
        Map<String, Object> namespace = (Map<String, Object>) root.get("namespace");

        String prefix = NamespaceConfiguration.DEFAULT_PREFIX;
        Object prefixObj = namespace.get("prefix");
        if (prefixObj != null) {
            prefix = prefixObj.toString().trim();
        }

        int indent = NamespaceConfiguration.DEFAULT_INDENT;
        Object indentObj = namespace.get("indent");
        if (indentObj != null) {
            try {
                indent = Integer.parseInt(indentObj.toString().trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("namespace.indent must be a number, got '" + indentObj + "'", e);
            }
        }

        NamespaceConfiguration config = new NamespaceConfiguration(prefix, indent);
        log.debug("Loaded {} from {}", config, yamlPath);
        return config;
    }
}
