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

/**
 * Signals that the namespace settings for a project cannot be used.
 * <p>
 * Raised for a {@code namespace.prefix} that is blank or contains whitespace, whether it
 * comes from project.yaml or from the recipe option, for a {@code namespace.indent} that
 * is negative or not a number, and for a project.yaml that cannot be read or whose top
 * level is not a mapping.
 *
 * @see NamespaceConfiguration#NamespaceConfiguration(String, int)
 * @see NamespaceConfigurationLoader#load(java.nio.file.Path)
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * @param cause the I/O or number format failure behind the rejected setting
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
