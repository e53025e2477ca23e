package com.github.rewrite.solidity.namespace;

import java.util.stream.Collectors;

/**
 * Generates ERC-7201 namespaces: ids of the form {@code <prefix>.<ContractName>} and a
 * template with the tagged struct, the precomputed storage location and a private accessor
 * that points a storage reference at it.
 */
public class Erc7201NamespaceCatalog implements NamespaceCatalog {

    private final String indent;

    public Erc7201NamespaceCatalog() {
        this("    ");
    }

    public Erc7201NamespaceCatalog(String indent) {
        this.indent = indent;
    }

    @Override
    public String getNamespaceId(String prefix, String contractName) {
        return prefix + "." + contractName;
    }

    /**
     * The template replaces a member declaration in place, so its first line carries no
     * indentation and every following line is indented one member level.
     */
    @Override
    public String printTemplate(Namespace namespace) {
        String id = getNamespaceId(namespace.getPrefix(), namespace.getContractName());
        String structName = namespace.getStructName();
        String locationName = structName + "Location";
        String fields = namespace.getVariables().stream()
                .map(variable -> indent + indent + variable.getContent())
                .collect(Collectors.joining("\n"));

        StringBuilder sb = new StringBuilder();
        sb.append("/// ").append(Erc7201.storageLocationAnnotation(id)).append("\n");
        sb.append(indent).append("struct ").append(structName).append(" {\n");
        sb.append(fields).append("\n");
        sb.append(indent).append("}\n");
        sb.append("\n");
        sb.append(indent).append("// keccak256(abi.encode(uint256(keccak256(\"").append(id)
                .append("\")) - 1)) & ~bytes32(uint256(0xff))\n");
        sb.append(indent).append("bytes32 private constant ").append(locationName).append(" = ")
                .append(Erc7201.storageSlot(id)).append(";\n");
        sb.append("\n");
        sb.append(indent).append("function ").append(namespace.getAccessorName()).append("() private pure returns (")
                .append(structName).append(" storage $) {\n");
        sb.append(indent).append(indent).append("assembly {\n");
        sb.append(indent).append(indent).append(indent).append("$.slot := ").append(locationName).append("\n");
        sb.append(indent).append(indent).append("}\n");
        sb.append(indent).append("}");
        return sb.toString();
    }
}
