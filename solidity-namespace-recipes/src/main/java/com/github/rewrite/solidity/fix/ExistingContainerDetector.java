package com.github.rewrite.solidity.fix;

import com.github.rewrite.solidity.namespace.Erc7201;
import com.github.rewrite.solidity.namespace.NamespaceCatalog;
import com.github.rewrite.solidity.tree.ContractDefinition;
import com.github.rewrite.solidity.tree.Cursor;
import com.github.rewrite.solidity.tree.TerminalKind;
import com.github.rewrite.solidity.tree.TextRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Decides whether a contract already declares the storage struct of its namespace.
 * <p>
 * The first {@code ///} comment in the contract that carries a
 * {@code @custom:storage-location} tag decides. If its id is the contract's namespace id,
 * the closing brace following the comment is where further fields go. Any other id means
 * the struct belongs to a different namespace and is treated like no struct at all.
 */
public class ExistingContainerDetector {

    private static final Logger log = LoggerFactory.getLogger(ExistingContainerDetector.class);

    private final NamespaceCatalog catalog;

    public ExistingContainerDetector(NamespaceCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * @return the range of the existing struct's closing brace
     */
    public Optional<TextRange> detect(Cursor contractCursor, String prefix, String contractName) {
        ContractDefinition contract = new ContractDefinition(contractCursor.node());
        String expected = Erc7201.storageLocationAnnotation(catalog.getNamespaceId(prefix, contractName));

        Cursor natSpecCursor = contractCursor.spawn();
        while (natSpecCursor.goToNextTerminalWithKind(TerminalKind.SINGLE_LINE_NAT_SPEC_COMMENT)) {
            String comment = natSpecCursor.node().asTerminal().getText();
            if (!comment.contains(Erc7201.STORAGE_LOCATION_TAG)) {
                continue;
            }
            if (!containsAnnotation(comment, expected)) {
                log.debug("Storage location in {} does not match {}: {}", contract.getName(), expected, comment);
                return Optional.empty();
            }
            Cursor structEndCursor = natSpecCursor.copy();
            if (structEndCursor.goToNextTerminalWithKind(TerminalKind.CLOSE_BRACE)) {
                return Optional.of(structEndCursor.textRange());
            }
            return Optional.empty();
        }
        return Optional.empty();
    }

    /**
     * The id must end where the annotation ends, so {@code erc7201:app.Box} does not match
     * inside {@code erc7201:app.BoxV2}.
     */
    static boolean containsAnnotation(String comment, String annotation) {
        int from = 0;
        while (true) {
            int at = comment.indexOf(annotation, from);
            if (at < 0) {
                return false;
            }
            int end = at + annotation.length();
            if (end == comment.length() || Character.isWhitespace(comment.charAt(end))) {
                return true;
            }
            from = at + 1;
        }
    }
}
