package com.github.rewrite.solidity.config;

/**
 * Project-specific settings for namespaced storage migration.
 * <p>
 * If no project.yaml exists in the project root, defaults are used.
 * <p>
 * Example project.yaml:
 * <pre>
 * namespace:
 *   prefix: myProject   # namespace ids become myProject.&lt;ContractName&gt;
 *   indent: 4           # spaces per indentation level in generated code
 * </pre>
 */
public class NamespaceConfiguration {

    public static final String DEFAULT_PREFIX = "myProject";
    public static final int DEFAULT_INDENT = 4;

    private final String prefix;
    private final int indent;

    public NamespaceConfiguration(String prefix, int indent) {
        checkPrefix(prefix);
        if (indent < 0) {
            throw new ConfigurationException("namespace.indent must not be negative, got " + indent);
        }
        this.prefix = prefix;
        this.indent = indent;
    }

    public static NamespaceConfiguration defaults() {
        return new NamespaceConfiguration(DEFAULT_PREFIX, DEFAULT_INDENT);
    }

    /**
     * @throws ConfigurationException if {@code prefix} is null, blank or contains whitespace
     */
    public static void checkPrefix(String prefix) {
        if (prefix == null || prefix.isBlank() || prefix.chars().anyMatch(Character::isWhitespace)) {
            throw new ConfigurationException("namespace.prefix must be a non-blank identifier without whitespace, got '" + prefix + "'");
        }
    }

    /**
     * Returns a copy with the given prefix and the same indentation.
     */
    public NamespaceConfiguration withPrefix(String prefix) {
        return new NamespaceConfiguration(prefix, indent);
    }

    /**
     * Returns the namespace id prefix.
     */
    public String getPrefix() {
        return prefix;
    }

    public int getIndent() {
        return indent;
    }

    /**
     * Returns one level of indentation as spaces.
     */
    public String getIndentUnit() {
        return " ".repeat(indent);
    }

    @Override
    public String toString() {
        return "NamespaceConfiguration{prefix='" + prefix + "', indent=" + indent + "}";
    }
}
