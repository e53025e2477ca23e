package com.github.rewrite.solidity.diagnostics;

import com.github.rewrite.solidity.fix.CodeFix;
import com.github.rewrite.solidity.fix.Diagnostic;
import com.github.rewrite.solidity.fix.DiagnosticSeverity;
import com.github.rewrite.solidity.fix.NamespaceQuickFix;
import com.github.rewrite.solidity.namespace.Variable;
import com.github.rewrite.solidity.text.TextDocument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Reports state variables outside namespaced storage and offers the fixes for them.
 */
public class NamespaceDiagnostics {

    public static final String CODE = "state-variable-not-namespaced";
    public static final String SOURCE = "solidity-namespace";

    private final StateVariableCollector collector;
    private final NamespaceQuickFix quickFix;

    public NamespaceDiagnostics(StateVariableCollector collector, NamespaceQuickFix quickFix) {
        this.collector = collector;
        this.quickFix = quickFix;
    }

    public List<Diagnostic> diagnose(TextDocument document) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (ContractCandidates candidates : collector.collect(document)) {
            for (Variable variable : candidates.getVariables()) {
                diagnostics.add(diagnosticFor(variable));
            }
        }
        return diagnostics;
    }

    /**
     * Returns the fixes for one of the diagnostics produced by {@link #diagnose}: moving the
     * reported variable alone, then moving every candidate of its contract. Diagnostics from
     * other sources, or that no longer match a candidate, get no fixes.
     */
    public List<CodeFix> codeActions(TextDocument document, Diagnostic diagnostic, String prefix) {
        if (!CODE.equals(diagnostic.getCode()) || !SOURCE.equals(diagnostic.getSource())) {
            return Collections.emptyList();
        }
        for (ContractCandidates candidates : collector.collect(document)) {
            for (Variable variable : candidates.getVariables()) {
                if (variable.getRange().equals(diagnostic.getRange())) {
                    return codeActions(document, diagnostic, prefix, candidates, variable);
                }
            }
        }
        return Collections.emptyList();
    }

    private List<CodeFix> codeActions(TextDocument document, Diagnostic diagnostic, String prefix,
                                      ContractCandidates candidates, Variable variable) {
        List<CodeFix> fixes = new ArrayList<>();
        Optional<CodeFix> single = quickFix.moveVariablesToNamespace(Collections.singletonList(diagnostic),
                "Move variable '" + variable.getName() + "' to namespace", prefix,
                candidates.getContractName(), Collections.singletonList(variable), document);
        single.ifPresent(fixes::add);

        if (candidates.getVariables().size() > 1) {
            List<Diagnostic> all = new ArrayList<>();
            for (Variable candidate : candidates.getVariables()) {
                all.add(diagnosticFor(candidate));
            }
            quickFix.moveVariablesToNamespace(all, NamespaceQuickFix.MOVE_ALL_TITLE, prefix,
                    candidates.getContractName(), candidates.getVariables(), document).ifPresent(fixes::add);
        }
        return fixes;
    }

    public static Diagnostic diagnosticFor(Variable variable) {
        return new Diagnostic(variable.getRange(), DiagnosticSeverity.WARNING, CODE,
                "Variable '" + variable.getName() + "' is not in namespaced storage", SOURCE);
    }
}
