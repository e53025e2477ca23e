package com.github.rewrite.solidity.namespace;

/**
 * Names namespaces and renders the source of their storage containers.
 */
public interface NamespaceCatalog {

    /**
     * @return the stable identifier of the namespace owned by {@code contractName}
     */
    String getNamespaceId(String prefix, String contractName);

    /**
     * @return ready-to-insert source text declaring the tagged storage struct, its location
     * constant and its accessor function
     */
    String printTemplate(Namespace namespace);
}
