package com.github.rewrite.solidity.diagnostics;

import com.github.rewrite.solidity.namespace.Variable;
import com.github.rewrite.solidity.text.TextDocument;
import com.github.rewrite.solidity.tree.ContractDefinition;
import com.github.rewrite.solidity.tree.Node;
import com.github.rewrite.solidity.tree.NonterminalKind;
import com.github.rewrite.solidity.tree.NonterminalNode;
import com.github.rewrite.solidity.tree.ParseOutput;
import com.github.rewrite.solidity.tree.StateVariableDefinition;
import com.github.rewrite.solidity.tree.SyntaxTreeProvider;
import com.github.rewrite.solidity.tree.TextRange;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Finds the state variables of each contract that still live in regular storage.
 * <p>
 * Constants, immutables and transient variables occupy no storage slot and are skipped.
 * Declarations with an initializer cannot be moved without losing the initial value and
 * are skipped as well. Interfaces and libraries never yield candidates.
 */
public class StateVariableCollector {

    private static final Logger log = LoggerFactory.getLogger(StateVariableCollector.class);

    private final SyntaxTreeProvider parser;

    public StateVariableCollector(SyntaxTreeProvider parser) {
        this.parser = parser;
    }

    /**
     * @return one entry per contract with at least one candidate, in source order
     */
    public List<ContractCandidates> collect(TextDocument document) {
        ParseOutput parseOutput = parser.parse(NonterminalKind.SOURCE_UNIT, document.getText());
        if (!parseOutput.isValid()) {
            log.debug("{} has {} syntax errors; collecting from the recovered tree", document.getUri(),
                    parseOutput.getErrors().size());
        }

        List<ContractCandidates> result = new ArrayList<>();
        int offset = 0;
        for (Node child : parseOutput.getTree().getChildren()) {
            if (!child.isTerminal() && ((NonterminalNode) child).is(NonterminalKind.CONTRACT_DEFINITION)) {
                ContractDefinition contract = new ContractDefinition(child);
                String name = contract.getName();
                if (name != null && "contract".equals(contract.getKeyword())) {
                    List<Variable> variables = collectVariables(contract, offset, document);
                    if (!variables.isEmpty()) {
                        result.add(new ContractCandidates(name,
                                new TextRange(offset, offset + child.getTextLength()),
                                Collections.unmodifiableList(variables)));
                    }
                }
            }
            offset += child.getTextLength();
        }
        return result;
    }

    private List<Variable> collectVariables(ContractDefinition contract, int contractOffset, TextDocument document) {
        List<Variable> variables = new ArrayList<>();
        int offset = contractOffset;
        for (Node member : contract.getNode().getChildren()) {
            if (!member.isTerminal() && ((NonterminalNode) member).is(NonterminalKind.STATE_VARIABLE_DEFINITION)) {
                StateVariableDefinition definition = new StateVariableDefinition(member);
                Variable variable = toVariable(definition, offset, contract.getName(), document);
                if (variable != null) {
                    variables.add(variable);
                }
            }
            offset += member.getTextLength();
        }
        return variables;
    }

    private static @Nullable Variable toVariable(StateVariableDefinition definition, int memberOffset, String contractName,
                                       TextDocument document) {
        String name = definition.getName();
        String content = definition.toMemberDeclaration();
        if (name == null || content == null) {
            return null;
        }
        if (definition.hasAttribute("constant") || definition.hasAttribute("immutable")
                || definition.hasAttribute("transient")) {
            return null;
        }
        if (definition.hasInitializer()) {
            log.warn("Variable '{}' in {} has an initializer and cannot be moved to namespaced storage",
                    name, contractName);
            return null;
        }
        TextRange relative = definition.getDeclarationRange();
        TextRange absolute = new TextRange(memberOffset + relative.getStart(), memberOffset + relative.getEnd());
        return new Variable(name, content, document.rangeOf(absolute));
    }
}
