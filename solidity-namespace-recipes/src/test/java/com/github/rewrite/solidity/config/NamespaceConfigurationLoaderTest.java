/*
 * Copyright 2021 - 2023 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.rewrite.solidity.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class NamespaceConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        NamespaceConfigurationLoader.clearCache();
    }

    @AfterEach
    void tearDown() {
        NamespaceConfigurationLoader.clearCache();
    }

    @Nested
    @DisplayName("Loading project.yaml")
    class Loading {

        @Test
        @DisplayName("No project.yaml -> defaults")
        void missingFileUsesDefaults() {
            NamespaceConfiguration config = NamespaceConfigurationLoader.load(tempDir);

            assertThat(config.getPrefix()).isEqualTo("myProject");
            assertThat(config.getIndent()).isEqualTo(4);
            assertThat(config.getIndentUnit()).isEqualTo("    ");
        }

        @Test
        @DisplayName("namespace.prefix and namespace.indent are read")
        void readsNamespaceSection() throws IOException {
            Files.writeString(tempDir.resolve("project.yaml"), """
                    namespace:
                      prefix: openzeppelin.storage
                      indent: 2
                    """);

            NamespaceConfiguration config = NamespaceConfigurationLoader.load(tempDir);

            assertThat(config.getPrefix()).isEqualTo("openzeppelin.storage");
            assertThat(config.getIndentUnit()).isEqualTo("  ");
        }

        @Test
        @DisplayName("Missing keys fall back to defaults individually")
        void partialSection() throws IOException {
            Files.writeString(tempDir.resolve("project.yaml"), """
                    namespace:
                      indent: 8
                    """);

            NamespaceConfiguration config = NamespaceConfigurationLoader.load(tempDir);

            assertThat(config.getPrefix()).isEqualTo(NamespaceConfiguration.DEFAULT_PREFIX);
            assertThat(config.getIndent()).isEqualTo(8);
        }

        @Test
        @DisplayName("Other sections are ignored")
        void unrelatedSections() throws IOException {
            Files.writeString(tempDir.resolve("project.yaml"), """
                    sources:
                      main: contracts
                    """);

            assertThat(NamespaceConfigurationLoader.load(tempDir).getPrefix()).isEqualTo("myProject");
        }

        @Test
        @DisplayName("Results are cached until clearCache()")
        void cachesResults() throws IOException {
            Path yaml = tempDir.resolve("project.yaml");
            Files.writeString(yaml, "namespace:\n  prefix: first\n");
            assertThat(NamespaceConfigurationLoader.load(tempDir).getPrefix()).isEqualTo("first");

            Files.writeString(yaml, "namespace:\n  prefix: second\n");
            assertThat(NamespaceConfigurationLoader.load(tempDir).getPrefix()).isEqualTo("first");

            NamespaceConfigurationLoader.clearCache();
            assertThat(NamespaceConfigurationLoader.load(tempDir).getPrefix()).isEqualTo("second");
        }
    }

    @Nested
    @DisplayName("Invalid values")
    class InvalidValues {

        @Test
        @DisplayName("Non-numeric indent -> ConfigurationException")
        void nonNumericIndent() throws IOException {
            Files.writeString(tempDir.resolve("project.yaml"), """
                    namespace:
                      indent: wide
                    """);

            assertThatThrownBy(() -> NamespaceConfigurationLoader.load(tempDir))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("namespace.indent");
        }

        @Test
        @DisplayName("Negative indent -> ConfigurationException")
        void negativeIndent() throws IOException {
            Files.writeString(tempDir.resolve("project.yaml"), """
                    namespace:
                      indent: -2
                    """);

            assertThatThrownBy(() -> NamespaceConfigurationLoader.load(tempDir))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("must not be negative");
        }

        @Test
        @DisplayName("Overriding prefix is validated like the configured one")
        void overridingPrefixIsValidated() {
            NamespaceConfiguration config = new NamespaceConfiguration("box", 2);

            assertThat(config.withPrefix("vault").getPrefix()).isEqualTo("vault");
            assertThat(config.withPrefix("vault").getIndent()).isEqualTo(2);
            assertThatThrownBy(() -> config.withPrefix(""))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("namespace.prefix");
        }

        @Test
        @DisplayName("Prefix with whitespace -> ConfigurationException")
        void prefixWithWhitespace() throws IOException {
            Files.writeString(tempDir.resolve("project.yaml"), """
                    namespace:
                      prefix: "my project"
                    """);

            assertThatThrownBy(() -> NamespaceConfigurationLoader.load(tempDir))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("namespace.prefix");
        }

        @Test
        @DisplayName("Top-level list -> ConfigurationException")
        void topLevelList() throws IOException {
            Files.writeString(tempDir.resolve("project.yaml"), "- a\n- b\n");

            assertThatThrownBy(() -> NamespaceConfigurationLoader.load(tempDir))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Inheritance from parent directories")
    class Inheritance {

        @Test
        @DisplayName("Module without project.yaml inherits the parent's")
        void inheritsFromParent() throws IOException {
            Files.writeString(tempDir.resolve("project.yaml"), "namespace:\n  prefix: parent\n");
            Path module = Files.createDirectories(tempDir.resolve("packages").resolve("token"));

            assertThat(NamespaceConfigurationLoader.loadWithInheritance(module).getPrefix()).isEqualTo("parent");
        }

        @Test
        @DisplayName("Module project.yaml wins over the parent's")
        void moduleOverridesParent() throws IOException {
            Files.writeString(tempDir.resolve("project.yaml"), "namespace:\n  prefix: parent\n");
            Path module = Files.createDirectories(tempDir.resolve("token"));
            Files.writeString(module.resolve("project.yaml"), "namespace:\n  prefix: token\n");

            assertThat(NamespaceConfigurationLoader.loadWithInheritance(module).getPrefix()).isEqualTo("token");
        }

        @Test
        @DisplayName("Search stops at the repository root")
        void stopsAtGitDirectory() throws IOException {
            Files.writeString(tempDir.resolve("project.yaml"), "namespace:\n  prefix: outside\n");
            Path repo = Files.createDirectories(tempDir.resolve("repo"));
            Files.createDirectories(repo.resolve(".git"));
            Path module = Files.createDirectories(repo.resolve("contracts"));

            assertThat(NamespaceConfigurationLoader.loadWithInheritance(module).getPrefix()).isEqualTo("myProject");
        }

        @Test
        @DisplayName("null module root -> defaults")
        void nullRoot() {
            assertThat(NamespaceConfigurationLoader.loadWithInheritance(null))
                    .extracting(NamespaceConfiguration::getPrefix)
                    .isEqualTo("myProject");
        }
    }
}
