package com.github.rewrite.solidity.fix;

import com.github.rewrite.solidity.tree.ContractDefinition;
import com.github.rewrite.solidity.tree.Cursor;
import com.github.rewrite.solidity.tree.NonterminalKind;
import com.github.rewrite.solidity.tree.ParseOutput;
import com.github.rewrite.solidity.tree.SyntaxTreeProvider;
import com.github.rewrite.solidity.tree.TextRange;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Finds the definition of a contract by name.
 * <p>
 * Every contract subtree is reparsed on its own first. A subtree that does not parse in
 * isolation is skipped, so fixes are never computed over a contract whose extent the
 * parser could only guess.
 * <p>
 * When several valid contracts share the name, the one containing {@code anchor} wins,
 * otherwise the first one in the document.
 */
public class ContractLocator {

    private static final Logger log = LoggerFactory.getLogger(ContractLocator.class);

    private final SyntaxTreeProvider parser;

    public ContractLocator(SyntaxTreeProvider parser) {
        this.parser = parser;
    }

    /**
     * @param treeCursor   cursor on the root of the parsed document; it is not advanced
     * @param contractName the contract to find
     * @param anchor       a range inside the wanted contract, used to disambiguate contracts
     *                     sharing a name
     * @return a cursor rooted at the contract definition
     */
    public Optional<Cursor> locate(Cursor treeCursor, String contractName, @Nullable TextRange anchor) {
        Cursor cursor = treeCursor.spawn();
        Cursor first = null;
        Cursor anchored = null;
        int matches = 0;

        while (cursor.goToNextNonterminalWithKind(NonterminalKind.CONTRACT_DEFINITION)) {
            Cursor contractCursor = cursor.spawn();
            ContractDefinition contract = new ContractDefinition(contractCursor.node());

            ParseOutput standalone = parser.parse(NonterminalKind.CONTRACT_DEFINITION, contractCursor.node().unparse());
            if (!standalone.isValid()) {
                log.warn("Skipping contract at {} with syntax errors: {}", contractCursor.textRange(),
                        standalone.getErrors().get(0));
                continue;
            }
            log.debug("Parsing contract: {}", contract.getName());

            if (!contractName.equals(contract.getName())) {
                continue;
            }
            matches++;
            if (first == null) {
                first = contractCursor;
            }
            if (anchored == null && anchor != null && contractCursor.textRange().contains(anchor)) {
                anchored = contractCursor;
            }
        }

        if (matches > 1) {
            log.warn("Found {} contracts named {}; using the one at {}", matches, contractName,
                    (anchored != null ? anchored : first).textRange());
        }
        return Optional.ofNullable(anchored != null ? anchored : first);
    }
}
