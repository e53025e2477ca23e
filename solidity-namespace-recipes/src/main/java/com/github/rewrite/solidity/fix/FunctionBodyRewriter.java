package com.github.rewrite.solidity.fix;

import com.github.rewrite.solidity.namespace.Variable;
import com.github.rewrite.solidity.text.TextDocument;
import com.github.rewrite.solidity.text.TextEdit;
import com.github.rewrite.solidity.tree.ContractDefinition;
import com.github.rewrite.solidity.tree.Cursor;
import com.github.rewrite.solidity.tree.FunctionDefinition;
import com.github.rewrite.solidity.tree.Node;
import com.github.rewrite.solidity.tree.NonterminalKind;
import com.github.rewrite.solidity.tree.NonterminalNode;
import com.github.rewrite.solidity.tree.TerminalKind;
import com.github.rewrite.solidity.tree.TerminalNode;
import com.github.rewrite.solidity.tree.TextRange;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Rewrites the bodies of a contract's functions, constructors and modifiers so that every
 * reference to a migrated variable goes through the namespace accessor:
 * <pre>
 * function set(uint256 v) public {        function set(uint256 v) public {
 *     a = v;                         -&gt;        BoxStorage storage $ = _getBoxStorage();
 * }                                            $.a = v;
 *                                          }
 * </pre>
 * Only identifier leaves that resolve to the state variable are rewritten. Member names,
 * named-argument keys, parameters or locals that shadow the variable, inline assembly,
 * strings and comments are left alone. Since {@code $.a} is a member access, rewriting
 * an already rewritten body changes nothing.
 */
public class FunctionBodyRewriter {

    private static final Logger log = LoggerFactory.getLogger(FunctionBodyRewriter.class);

    private static final Set<String> DATA_LOCATIONS = new HashSet<>(Arrays.asList(
            "memory", "storage", "calldata", "payable", "transient"
    ));

    private final String indentUnit;

    public FunctionBodyRewriter(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    /**
     * @return the line binding the namespace struct to {@code $}, e.g.
     * {@code BoxStorage storage $ = _getBoxStorage();}
     */
    public static String accessorBinding(String contractName) {
        return contractName + "Storage storage $ = _get" + contractName + "Storage();";
    }

    /**
     * @return one edit per body that references at least one of {@code variables}, each
     * replacing the whole body, in lexical order
     */
    public List<TextEdit> rewrite(Cursor contractCursor, String contractName, List<Variable> variables,
                                  TextDocument document) {
        ContractDefinition contract = new ContractDefinition(contractCursor.node());
        log.debug("Rewriting references to {} variables in {}", variables.size(), contract.getName());
        Set<String> names = new LinkedHashSet<>();
        for (Variable variable : variables) {
            names.add(variable.getName());
        }
        String binding = accessorBinding(contractName);

        List<TextEdit> edits = new ArrayList<>();
        Cursor functionCursor = contractCursor.spawn();
        while (functionCursor.goToNextNonterminalWithKind(NonterminalKind.FUNCTION_DEFINITION)) {
            FunctionDefinition function = new FunctionDefinition(functionCursor.node());
            Cursor bodyCursor = functionCursor.spawn();
            if (function.getBody() == null || !bodyCursor.goToNextNonterminalWithKind(NonterminalKind.FUNCTION_BODY)) {
                continue;
            }
            NonterminalNode body = bodyCursor.node().asNonterminal(NonterminalKind.FUNCTION_BODY);
            String original = body.unparse();

            Set<String> parameters = declaredNames(function.getHeaderTerminals(), names);
            String replacement = rewriteReferences(body, names, parameters);
            if (!replacement.equals(original) && !replacement.contains(binding)) {
                replacement = insertBinding(replacement, binding, bodyCursor.textRange(), document);
            }
            if (!replacement.equals(original)) {
                log.debug("Replacing body of {} {} with: {}", function.getKeyword(), function.getName(), replacement);
                edits.add(TextEdit.replace(document.rangeOf(bodyCursor.textRange()), replacement));
            }
        }
        return edits;
    }

    private static String rewriteReferences(NonterminalNode body, Set<String> names, Set<String> parameters) {
        List<TerminalNode> terminals = new ArrayList<>();
        for (Node child : body.getChildren()) {
            terminals.add(child.asTerminal());
        }

        Deque<Scope> scopes = new ArrayDeque<>();
        scopes.push(new Scope(-1, false));
        scopes.peek().names.addAll(parameters);
        StringBuilder sb = new StringBuilder(body.getTextLength() + 32);
        TerminalNode previous = null;
        boolean assemblyPending = false;
        int assemblyDepth = 0;
        int parenDepth = 0;

        for (int i = 0; i < terminals.size(); i++) {
            TerminalNode terminal = terminals.get(i);
            String text = terminal.getText();

            if (assemblyDepth > 0) {
                if (terminal.is(TerminalKind.OPEN_BRACE)) {
                    assemblyDepth++;
                } else if (terminal.is(TerminalKind.CLOSE_BRACE)) {
                    assemblyDepth--;
                }
                sb.append(text);
                continue;
            }

            Scope current = scopes.peek();
            if (terminal.is(TerminalKind.OPEN_BRACE)) {
                if (assemblyPending) {
                    assemblyPending = false;
                    assemblyDepth = 1;
                } else if (current.opensBodyAt(parenDepth, previous)) {
                    current.awaitingBody = false;
                } else {
                    scopes.push(new Scope(-1, false));
                }
            } else if (terminal.is(TerminalKind.CLOSE_BRACE) && scopes.size() > 1) {
                scopes.pop();
                closeBracelessLoops(scopes, parenDepth);
            } else if (terminal.is(TerminalKind.SEMICOLON)) {
                closeBracelessLoops(scopes, parenDepth);
            } else if (terminal.is(TerminalKind.OPEN_PAREN)) {
                parenDepth++;
            } else if (terminal.is(TerminalKind.CLOSE_PAREN)) {
                parenDepth--;
                if (current.awaitingBody && parenDepth == current.headerDepth) {
                    current.headerClosed = true;
                }
            } else if (terminal.isKeyword("assembly")) {
                assemblyPending = true;
            } else if (terminal.isKeyword("for") || terminal.isKeyword("try") || terminal.isKeyword("catch")) {
                scopes.push(new Scope(parenDepth, terminal.isKeyword("for")));
            } else if (terminal.is(TerminalKind.IDENTIFIER) && names.contains(text)) {
                text = resolve(terminal, previous, nextSignificant(terminals, i), scopes);
            }

            sb.append(text);
            if (!terminal.getKind().isTrivia()) {
                previous = terminal;
            }
        }
        return sb.toString();
    }

    /**
     * Ends the scope of a {@code for} loop whose body is a single statement once that
     * statement is complete.
     */
    private static void closeBracelessLoops(Deque<Scope> scopes, int parenDepth) {
        while (scopes.size() > 1) {
            Scope current = scopes.peek();
            if (!current.loop || !current.awaitingBody || !current.headerClosed || parenDepth != current.headerDepth) {
                return;
            }
            scopes.pop();
        }
    }

    /**
     * @return the text to emit for an identifier that has the name of a migrated variable
     */
    private static String resolve(TerminalNode identifier, @Nullable TerminalNode previous,
                                  @Nullable TerminalNode next, Deque<Scope> scopes) {
        String name = identifier.getText();
        if (previous != null && previous.is(TerminalKind.PERIOD)) {
            return name;
        }
        if (isDeclaration(previous)) {
            scopes.peek().names.add(name);
            return name;
        }
        for (Scope scope : scopes) {
            if (scope.names.contains(name)) {
                return name;
            }
        }
        if (next != null && next.is(TerminalKind.COLON) && previous != null
                && (previous.is(TerminalKind.OPEN_BRACE) || previous.is(TerminalKind.COMMA))) {
            return name;
        }
        return "$." + name;
    }

    /**
     * An identifier directly following a type or a data location is being declared, as in
     * {@code uint256 a}, {@code Token[] memory a} or {@code address payable a}.
     */
    private static boolean isDeclaration(@Nullable TerminalNode previous) {
        if (previous == null) {
            return false;
        }
        if (previous.is(TerminalKind.IDENTIFIER) || previous.is(TerminalKind.CLOSE_BRACKET)) {
            return true;
        }
        return previous.isElementaryType()
                || (previous.is(TerminalKind.KEYWORD) && DATA_LOCATIONS.contains(previous.getText()));
    }

    private static Set<String> declaredNames(List<TerminalNode> header, Set<String> names) {
        Set<String> declared = new HashSet<>();
        TerminalNode previous = null;
        for (TerminalNode terminal : header) {
            if (terminal.getKind().isTrivia()) {
                continue;
            }
            if (terminal.is(TerminalKind.IDENTIFIER) && names.contains(terminal.getText()) && isDeclaration(previous)) {
                declared.add(terminal.getText());
            }
            previous = terminal;
        }
        return declared;
    }

    private static @Nullable TerminalNode nextSignificant(List<TerminalNode> terminals, int index) {
        for (int i = index + 1; i < terminals.size(); i++) {
            if (!terminals.get(i).getKind().isTrivia()) {
                return terminals.get(i);
            }
        }
        return null;
    }

    /**
     * Puts the binding on its own line right after the opening brace, indented like the
     * body's first statement.
     */
    private String insertBinding(String body, String binding, TextRange bodyRange, TextDocument document) {
        String rest = body.substring(1);
        String indent = statementIndent(rest);
        if (indent == null) {
            indent = lineIndent(document.getText(), bodyRange.getStart()) + indentUnit;
        }
        if (rest.startsWith("\r\n")) {
            return "{\r\n" + indent + binding + rest;
        }
        if (rest.startsWith("\n")) {
            return "{\n" + indent + binding + rest;
        }
        return "{\n" + indent + binding + "\n" + indent + rest.stripLeading();
    }

    /**
     * @return the indentation of the first non-blank line after the opening brace, or
     * {@code null} when the body has no such line
     */
    private static @Nullable String statementIndent(String rest) {
        String[] lines = rest.split("\r?\n", -1);
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            String stripped = line.stripLeading();
            if (stripped.startsWith("}")) {
                return null;
            }
            return line.substring(0, line.length() - stripped.length());
        }
        return null;
    }

    /**
     * Names declared in a block. Declarations in a {@code for}, {@code try} or {@code catch}
     * header open the scope at the keyword, and the statement's block continues it.
     */
    private static final class Scope {

        final Set<String> names = new HashSet<>();

        /**
         * Parenthesis depth at the header keyword, or -1 for a plain block.
         */
        final int headerDepth;

        final boolean loop;

        boolean awaitingBody;

        boolean headerClosed;

        Scope(int headerDepth, boolean loop) {
            this.headerDepth = headerDepth;
            this.loop = loop;
            this.awaitingBody = headerDepth >= 0;
        }

        /**
         * The block of a header statement follows the closing parenthesis of the header,
         * or a bare {@code catch}. Any other brace, such as call options, opens its own block.
         */
        boolean opensBodyAt(int parenDepth, @Nullable TerminalNode previous) {
            return awaitingBody && parenDepth == headerDepth && previous != null
                    && (previous.is(TerminalKind.CLOSE_PAREN) || previous.isKeyword("catch"));
        }
    }

    static String lineIndent(String text, int offset) {
        int lineStart = offset;
        while (lineStart > 0 && text.charAt(lineStart - 1) != '\n' && text.charAt(lineStart - 1) != '\r') {
            lineStart--;
        }
        int end = lineStart;
        while (end < text.length() && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
            end++;
        }
        return text.substring(lineStart, end);
    }
}
