package com.github.rewrite.solidity;

import com.github.rewrite.solidity.config.ConfigurationException;
import com.github.rewrite.solidity.config.NamespaceConfiguration;
import com.github.rewrite.solidity.config.NamespaceConfigurationLoader;
import com.github.rewrite.solidity.diagnostics.ContractCandidates;
import com.github.rewrite.solidity.diagnostics.NamespaceDiagnostics;
import com.github.rewrite.solidity.diagnostics.StateVariableCollector;
import com.github.rewrite.solidity.fix.CodeFix;
import com.github.rewrite.solidity.fix.Diagnostic;
import com.github.rewrite.solidity.fix.NamespaceQuickFix;
import com.github.rewrite.solidity.namespace.Variable;
import com.github.rewrite.solidity.text.TextDocument;
import com.github.rewrite.solidity.tree.AntlrSyntaxTreeProvider;
import lombok.EqualsAndHashCode;
import lombok.Value;
import org.jspecify.annotations.Nullable;
import org.openrewrite.ExecutionContext;
import org.openrewrite.Option;
import org.openrewrite.Recipe;
import org.openrewrite.Tree;
import org.openrewrite.TreeVisitor;
import org.openrewrite.text.PlainText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Moves the state variables of Solidity contracts into ERC-7201 namespaced storage.
 * <p>
 * Works on {@code .sol} files parsed as plain text. For each contract with movable state
 * variables, the variables become fields of a {@code <Contract>Storage} struct annotated with
 * {@code @custom:storage-location erc7201:<prefix>.<Contract>}, and every function body using
 * them reads and writes them through the generated accessor.
 * <p>
 * The namespace prefix is controlled by project.yaml unless overridden:
 * <pre>
 * namespace:
 *   prefix: myProject
 *   indent: 4
 * </pre>
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class MoveStateVariablesToNamespace extends Recipe {

    private static final Logger log = LoggerFactory.getLogger(MoveStateVariablesToNamespace.class);

    private static final String SOLIDITY_EXTENSION = ".sol";
    private static final int MAX_ROUNDS = 1000;

    @Option(displayName = "Namespace prefix",
            description = "Prefix of the namespace id, which becomes `<prefix>.<ContractName>`. " +
                          "If not set, project.yaml (or the default `myProject`) is used.",
            example = "openzeppelin.storage",
            required = false)
    @Nullable
    String prefix;

    @Option(displayName = "Contract name",
            description = "Only migrate the contract with this name. If not set, every contract is migrated.",
            example = "Box",
            required = false)
    @Nullable
    String contractName;

    public MoveStateVariablesToNamespace() {
        this.prefix = null;
        this.contractName = null;
    }

    /**
     * @throws ConfigurationException if {@code prefix} is set but blank or contains whitespace
     */
    public MoveStateVariablesToNamespace(@Nullable String prefix, @Nullable String contractName) {
        if (prefix != null) {
            NamespaceConfiguration.checkPrefix(prefix);
        }
        this.prefix = prefix;
        this.contractName = contractName;
    }

    @Override
    public String getDisplayName() {
        return "Move state variables to namespaced storage";
    }

    @Override
    public String getDescription() {
        return "Moves the state variables of Solidity contracts into an ERC-7201 namespaced storage struct " +
               "and rewrites function bodies to access them through the storage accessor. " +
               "Constants, immutables, transient variables and variables with an initializer are left in place.";
    }

    @Override
    public TreeVisitor<?, ExecutionContext> getVisitor() {
        return new TreeVisitor<Tree, ExecutionContext>() {
            @Override
            public @Nullable Tree visit(@Nullable Tree tree, ExecutionContext ctx) {
                if (!(tree instanceof PlainText)) {
                    return tree;
                }
                PlainText text = (PlainText) tree;
                if (!text.getSourcePath().toString().endsWith(SOLIDITY_EXTENSION)) {
                    return text;
                }
                String migrated = migrate(text.getSourcePath(), text.getText());
                if (migrated.equals(text.getText())) {
                    return text;
                }
                return text.withText(migrated);
            }
        };
    }

    /**
     * Applies the "move all" fix contract by contract, re-collecting after each one so that
     * every fix is computed against the text it is applied to.
     */
    private String migrate(Path sourcePath, String source) {
        NamespaceConfiguration config = NamespaceConfigurationLoader.loadWithInheritance(extractProjectRoot(sourcePath));
        if (prefix != null) {
            config = config.withPrefix(prefix);
        }
        String effectivePrefix = config.getPrefix();
        String uri = sourcePath.toString();

        StateVariableCollector collector = new StateVariableCollector(new AntlrSyntaxTreeProvider());
        NamespaceQuickFix quickFix = new NamespaceQuickFix(config);

        String current = source;
        int skipped = 0;
        // Each round either applies one fix or skips one contract
        for (int round = 0; round < MAX_ROUNDS; round++) {
            TextDocument document = new TextDocument(uri, current);
            List<ContractCandidates> pending = selected(collector.collect(document));
            if (skipped >= pending.size()) {
                break;
            }
            ContractCandidates target = pending.get(skipped);
            List<Diagnostic> diagnostics = new ArrayList<>();
            for (Variable variable : target.getVariables()) {
                diagnostics.add(NamespaceDiagnostics.diagnosticFor(variable));
            }
            Optional<CodeFix> fix = quickFix.moveVariablesToNamespace(diagnostics, NamespaceQuickFix.MOVE_ALL_TITLE,
                    effectivePrefix, target.getContractName(), target.getVariables(), document);
            if (fix.isPresent()) {
                log.info("Moving {} state variables of {} in {} to namespace {}", target.getVariables().size(),
                        target.getContractName(), uri,
                        quickFix.getCatalog().getNamespaceId(effectivePrefix, target.getContractName()));
                current = document.applyEdits(fix.get().getEdits(uri));
            } else {
                skipped++;
            }
        }
        return current;
    }

    private List<ContractCandidates> selected(List<ContractCandidates> all) {
        if (contractName == null) {
            return all;
        }
        List<ContractCandidates> result = new ArrayList<>();
        for (ContractCandidates candidates : all) {
            if (contractName.equals(candidates.getContractName())) {
                result.add(candidates);
            }
        }
        return result;
    }

    private static Path extractProjectRoot(@Nullable Path sourcePath) {
        if (sourcePath == null) {
            return Paths.get(System.getProperty("user.dir"));
        }
        Path current = sourcePath.toAbsolutePath().getParent();
        while (current != null) {
            if (Files.exists(current.resolve("pom.xml")) ||
                Files.exists(current.resolve("foundry.toml")) ||
                Files.exists(current.resolve("hardhat.config.js")) ||
                Files.exists(current.resolve("hardhat.config.ts")) ||
                Files.exists(current.resolve("project.yaml"))) {
                return current;
            }
            current = current.getParent();
        }
        return Paths.get(System.getProperty("user.dir"));
    }
}
