package com.github.rewrite.solidity.fix;

import com.github.rewrite.solidity.config.NamespaceConfiguration;
import com.github.rewrite.solidity.namespace.Erc7201NamespaceCatalog;
import com.github.rewrite.solidity.namespace.Namespace;
import com.github.rewrite.solidity.namespace.NamespaceCatalog;
import com.github.rewrite.solidity.namespace.Variable;
import com.github.rewrite.solidity.text.TextDocument;
import com.github.rewrite.solidity.text.TextEdit;
import com.github.rewrite.solidity.tree.AntlrSyntaxTreeProvider;
import com.github.rewrite.solidity.tree.Cursor;
import com.github.rewrite.solidity.tree.NonterminalKind;
import com.github.rewrite.solidity.tree.ParseOutput;
import com.github.rewrite.solidity.tree.SyntaxTreeProvider;
import com.github.rewrite.solidity.tree.TextRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Computes the quick fix moving a contract's state variables into its ERC-7201 namespace.
 * <p>
 * Each call parses the document once and computes every edit against that single
 * snapshot: the namespace struct is created, or extended when the contract already has one
 * for the same namespace id, and every function body using the variables is rewritten to
 * use the accessor. Nothing is cached between calls.
 */
public class NamespaceQuickFix {

    public static final String MOVE_ALL_TITLE = "Move all variables to namespace";

    private static final Logger log = LoggerFactory.getLogger(NamespaceQuickFix.class);

    private final SyntaxTreeProvider parser;
    private final NamespaceCatalog catalog;
    private final ContractLocator locator;
    private final ExistingContainerDetector detector;
    private final FunctionBodyRewriter rewriter;
    private final EditComposer composer;

    public NamespaceQuickFix() {
        this(NamespaceConfiguration.defaults());
    }

    public NamespaceQuickFix(NamespaceConfiguration configuration) {
        this(new AntlrSyntaxTreeProvider(), new Erc7201NamespaceCatalog(configuration.getIndentUnit()),
                configuration.getIndentUnit());
    }

    public NamespaceQuickFix(SyntaxTreeProvider parser, NamespaceCatalog catalog, String indentUnit) {
        this.parser = parser;
        this.catalog = catalog;
        this.locator = new ContractLocator(parser);
        this.detector = new ExistingContainerDetector(catalog);
        this.rewriter = new FunctionBodyRewriter(indentUnit);
        this.composer = new EditComposer(catalog, indentUnit);
    }

    /**
     * @param fixesDiagnostics the diagnostics the fix resolves
     * @param title            the title shown for the fix
     * @param prefix           the namespace id prefix
     * @param contractName     the contract owning the variables
     * @param variables        the variables to move, in declaration order
     * @param document         the document snapshot all ranges refer to
     * @return the fix, or empty when there is nothing to move or the contract cannot be found
     */
    public Optional<CodeFix> moveVariablesToNamespace(List<Diagnostic> fixesDiagnostics, String title, String prefix,
                                                      String contractName, List<Variable> variables,
                                                      TextDocument document) {
        if (variables.isEmpty()) {
            return Optional.empty();
        }

        ParseOutput parseOutput = parser.parse(NonterminalKind.SOURCE_UNIT, document.getText());
        TextRange anchor = document.textRangeOf(variables.get(0).getRange());
        Optional<Cursor> contractCursor = locator.locate(parseOutput.createTreeCursor(), contractName, anchor);
        if (!contractCursor.isPresent()) {
            log.warn("No valid contract named {} in {}", contractName, document.getUri());
            return Optional.empty();
        }

        TextRange existingContainerEnd = detector.detect(contractCursor.get(), prefix, contractName).orElse(null);
        List<TextEdit> bodyEdits = rewriter.rewrite(contractCursor.get(), contractName, variables, document);

        Namespace namespace = new Namespace(contractName, prefix, Collections.unmodifiableList(new ArrayList<>(variables)));
        return composer.compose(title, fixesDiagnostics, namespace, existingContainerEnd, bodyEdits, document);
    }

    public NamespaceCatalog getCatalog() {
        return catalog;
    }
}
