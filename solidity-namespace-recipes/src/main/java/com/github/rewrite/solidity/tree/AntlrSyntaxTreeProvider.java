package com.github.rewrite.solidity.tree;

import com.github.rewrite.solidity.tree.grammar.SolidityLexer;
import com.github.rewrite.solidity.tree.grammar.SolidityParser;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link SyntaxTreeProvider} backed by the ANTLR Solidity grammar.
 * <p>
 * The ANTLR parse tree is folded into the concrete syntax tree used by the refactorings:
 * only source unit members, contract members and function bodies become inner nodes, every
 * other rule is flattened into the terminals of its nearest such node. Hidden-channel tokens
 * are kept as trivia in front of the token they precede, so a member owns the comments
 * written above it.
 */
public class AntlrSyntaxTreeProvider implements SyntaxTreeProvider {

    private static final Logger log = LoggerFactory.getLogger(AntlrSyntaxTreeProvider.class);

    @Override
    public ParseOutput parse(NonterminalKind kind, String text) {
        if (kind != NonterminalKind.SOURCE_UNIT && kind != NonterminalKind.CONTRACT_DEFINITION) {
            throw new IllegalArgumentException("Cannot parse " + kind + " as a standalone fragment");
        }
        ErrorCollector errors = new ErrorCollector(text);
        SolidityLexer lexer = new SolidityLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        SolidityParser parser = new SolidityParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        TreeBuilder builder;
        NonterminalNode tree;
        if (kind == NonterminalKind.SOURCE_UNIT) {
            SolidityParser.SourceUnitContext sourceUnit = parser.sourceUnit();
            tokens.fill();
            builder = new TreeBuilder(tokens.getTokens());
            tree = builder.root(kind, sourceUnit);
        } else {
            SolidityParser.ContractUnitContext contractUnit = parser.contractUnit();
            tokens.fill();
            builder = new TreeBuilder(tokens.getTokens());
            tree = builder.root(kind, contractUnit.contractDefinition(), contractUnit.EOF());
        }
        if (!errors.getErrors().isEmpty()) {
            log.debug("Parsed {} with {} syntax error(s), first: {}", kind, errors.getErrors().size(),
                    errors.getErrors().get(0));
        }
        return new ParseOutput(tree, Collections.unmodifiableList(errors.getErrors()));
    }

    private static final class TreeBuilder {

        private final List<Token> tokens;
        private int next;

        TreeBuilder(List<Token> tokens) {
            this.tokens = tokens;
        }

        NonterminalNode root(NonterminalKind kind, @Nullable ParseTree... parts) {
            List<Node> children = new ArrayList<>();
            for (ParseTree part : parts) {
                if (part instanceof ParserRuleContext) {
                    // the root rule is the node itself, so only its children are folded in
                    for (int i = 0; i < part.getChildCount(); i++) {
                        visit(part.getChild(i), kind, children);
                    }
                } else if (part != null) {
                    visit(part, kind, children);
                }
            }
            flush(tokens.size(), children);
            return new NonterminalNode(kind, children);
        }

        private void visit(ParseTree tree, NonterminalKind enclosing, List<Node> out) {
            if (tree instanceof org.antlr.v4.runtime.tree.TerminalNode) {
                Token token = ((org.antlr.v4.runtime.tree.TerminalNode) tree).getSymbol();
                if (token.getTokenIndex() < next) {
                    // conjured by error recovery, or already emitted
                    return;
                }
                flush(token.getTokenIndex(), out);
                if (token.getType() != Token.EOF) {
                    out.add(terminal(token, tree.getParent() instanceof SolidityParser.IdentifierContext));
                }
                next = token.getTokenIndex() + 1;
                return;
            }

            ParserRuleContext context = (ParserRuleContext) tree;
            NonterminalKind kind = kindOf(context, enclosing);
            if (kind == null) {
                for (int i = 0; i < context.getChildCount(); i++) {
                    visit(context.getChild(i), enclosing, out);
                }
                return;
            }
            if (kind == NonterminalKind.FUNCTION_BODY && context.getStart() != null) {
                // whitespace before the opening brace stays with the definition
                flush(context.getStart().getTokenIndex(), out);
            }
            List<Node> children = new ArrayList<>();
            for (int i = 0; i < context.getChildCount(); i++) {
                visit(context.getChild(i), kind, children);
            }
            if (!children.isEmpty()) {
                out.add(new NonterminalNode(kind, children));
            }
        }

        /**
         * Emits the tokens from the last emitted one up to {@code end}, exclusive: hidden
         * trivia and any tokens the parser skipped while recovering from an error.
         */
        private void flush(int end, List<Node> out) {
            for (; next < end && next < tokens.size(); next++) {
                Token token = tokens.get(next);
                if (token.getType() != Token.EOF) {
                    out.add(terminal(token, false));
                }
            }
        }
    }

    private static @Nullable NonterminalKind kindOf(ParserRuleContext context, NonterminalKind enclosing) {
        int rule = context.getRuleIndex();
        switch (enclosing) {
            case SOURCE_UNIT:
                if (rule == SolidityParser.RULE_pragmaDirective) {
                    return NonterminalKind.PRAGMA_DIRECTIVE;
                }
                if (rule == SolidityParser.RULE_importDirective) {
                    return NonterminalKind.IMPORT_DIRECTIVE;
                }
                if (rule == SolidityParser.RULE_contractDefinition) {
                    return NonterminalKind.CONTRACT_DEFINITION;
                }
                return memberKind(rule);
            case CONTRACT_DEFINITION:
                return memberKind(rule);
            case FUNCTION_DEFINITION:
                return rule == SolidityParser.RULE_block ? NonterminalKind.FUNCTION_BODY : null;
            default:
                return null;
        }
    }

    private static @Nullable NonterminalKind memberKind(int rule) {
        switch (rule) {
            case SolidityParser.RULE_functionDefinition:
            case SolidityParser.RULE_constructorDefinition:
            case SolidityParser.RULE_modifierDefinition:
            case SolidityParser.RULE_fallbackFunctionDefinition:
            case SolidityParser.RULE_receiveFunctionDefinition:
                return NonterminalKind.FUNCTION_DEFINITION;
            case SolidityParser.RULE_structDefinition:
                return NonterminalKind.STRUCT_DEFINITION;
            case SolidityParser.RULE_enumDefinition:
                return NonterminalKind.ENUM_DEFINITION;
            case SolidityParser.RULE_stateVariableDeclaration:
                return NonterminalKind.STATE_VARIABLE_DEFINITION;
            case SolidityParser.RULE_eventDefinition:
            case SolidityParser.RULE_errorDefinition:
            case SolidityParser.RULE_usingDirective:
            case SolidityParser.RULE_userDefinedValueTypeDefinition:
                return NonterminalKind.OTHER_DEFINITION;
            default:
                return null;
        }
    }

    private static TerminalNode terminal(Token token, boolean inIdentifier) {
        String text = token.getText();
        return new TerminalNode(inIdentifier ? TerminalKind.IDENTIFIER : terminalKind(token.getType(), text), text);
    }

    private static TerminalKind terminalKind(int type, String text) {
        switch (type) {
            case SolidityLexer.Identifier:
                return TerminalKind.IDENTIFIER;
            case SolidityLexer.StringLiteral:
            case SolidityLexer.HexString:
                return TerminalKind.STRING_LITERAL;
            case SolidityLexer.DecimalNumber:
            case SolidityLexer.HexNumber:
                return TerminalKind.NUMBER_LITERAL;
            case SolidityLexer.WS:
                return TerminalKind.WHITESPACE;
            case SolidityLexer.EOL:
                return TerminalKind.END_OF_LINE;
            case SolidityLexer.LINE_COMMENT:
                return text.startsWith("///") && !text.startsWith("////")
                        ? TerminalKind.SINGLE_LINE_NAT_SPEC_COMMENT : TerminalKind.SINGLE_LINE_COMMENT;
            case SolidityLexer.COMMENT:
                return text.startsWith("/**") && !text.startsWith("/***") && !text.equals("/**/")
                        ? TerminalKind.MULTI_LINE_NAT_SPEC_COMMENT : TerminalKind.MULTI_LINE_COMMENT;
            case SolidityLexer.UNRECOGNIZED:
                return TerminalKind.UNRECOGNIZED;
            default:
                return punctuationOrKeyword(text);
        }
    }

    private static TerminalKind punctuationOrKeyword(String text) {
        switch (text) {
            case "{":
                return TerminalKind.OPEN_BRACE;
            case "}":
                return TerminalKind.CLOSE_BRACE;
            case "(":
                return TerminalKind.OPEN_PAREN;
            case ")":
                return TerminalKind.CLOSE_PAREN;
            case "[":
                return TerminalKind.OPEN_BRACKET;
            case "]":
                return TerminalKind.CLOSE_BRACKET;
            case ";":
                return TerminalKind.SEMICOLON;
            case ",":
                return TerminalKind.COMMA;
            case ".":
                return TerminalKind.PERIOD;
            case ":":
                return TerminalKind.COLON;
            default:
                return Character.isLetter(text.charAt(0)) ? TerminalKind.KEYWORD : TerminalKind.OPERATOR;
        }
    }

    /**
     * Collects lexer and parser errors with ranges in UTF-16 offsets of the parsed text.
     */
    private static final class ErrorCollector extends BaseErrorListener {

        private final String text;
        private final int codePoints;
        private final List<ParseError> errors = new ArrayList<>();

        ErrorCollector(String text) {
            this.text = text;
            this.codePoints = text.codePointCount(0, text.length());
        }

        List<ParseError> getErrors() {
            return errors;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, @Nullable Object offendingSymbol, int line,
                                int charPositionInLine, String msg, @Nullable RecognitionException e) {
            int start;
            int end;
            if (offendingSymbol instanceof Token) {
                Token token = (Token) offendingSymbol;
                start = token.getStartIndex();
                end = Math.max(start, token.getStopIndex() + 1);
            } else {
                start = recognizer.getInputStream().index();
                end = start;
            }
            errors.add(new ParseError(msg, new TextRange(offset(start), offset(end))));
        }

        private int offset(int codePoint) {
            return text.offsetByCodePoints(0, Math.max(0, Math.min(codePoint, codePoints)));
        }
    }
}
