package com.github.rewrite.solidity.namespace;

import lombok.Value;

import java.util.List;

/**
 * A namespaced storage container to generate for a contract.
 * <p>
 * The order of {@link #variables} is the field order of the generated struct, which fixes
 * the storage layout.
 */
@Value
public class Namespace {
    String contractName;
    String prefix;
    List<Variable> variables;

    public String getStructName() {
        return contractName + "Storage";
    }

    public String getAccessorName() {
        return "_get" + contractName + "Storage";
    }
}
