package org.marionette.compiler.frontend.parser;

import org.marionette.compiler.api.CompilerErrorCode;
import org.marionette.compiler.api.InterpolatedString;
import org.marionette.compiler.diagnostics.DiagnosticsEngine;
import org.marionette.compiler.frontend.lexer.InterpolationSplitter;
import org.marionette.compiler.frontend.lexer.Token;
import org.marionette.compiler.frontend.lexer.TokenType;
import org.marionette.compiler.frontend.parser.ast.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The parser for manifest source. It consumes a list of tokens from the
 * {@link org.marionette.compiler.frontend.lexer.Lexer} and produces an Abstract Syntax Tree (AST)
 * of resource declarations and relationship chains.
 * <p>
 * One token of lookahead decides the statement shape: {@code Type {} starts a declaration,
 * {@code Type[} or {@code [} starts a chain. After an error the parser reports it, skips to the
 * next statement boundary and continues, so all syntax errors are reported in one pass.
 */
public class Parser {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private int current = 0;
    private int declarationCounter = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by {@link TokenType#END_OF_FILE}.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the entire token stream and returns a list of top-level AST nodes.
     * Statements that failed to parse are omitted.
     * @return A list of parsed {@link AstNode}s.
     */
    public List<AstNode> parse() {
        List<AstNode> statements = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.SEMICOLON)) {
                continue;
            }
            AstNode statement = statement();
            if (statement != null) {
                statements.add(statement);
            }
        }
        return statements;
    }

    /**
     * Parses a single statement: a resource declaration or a relationship chain.
     * @return The parsed {@link AstNode}, or null if an error occurs.
     */
    public AstNode statement() {
        try {
            if (check(TokenType.IDENTIFIER) && checkNext(TokenType.LEFT_BRACE)) {
                return resourceDeclaration();
            }
            if (check(TokenType.LEFT_BRACKET) || (check(TokenType.IDENTIFIER) && checkNext(TokenType.LEFT_BRACKET))) {
                return chain();
            }
            Token unexpected = advance();
            throw error(CompilerErrorCode.UNEXPECTED_TOKEN,
                    "Expected a resource declaration or a relationship chain, but got " + describe(unexpected) + ".", unexpected);
        } catch (SyntaxError ex) {
            synchronize();
            return null;
        }
    }

    private ResourceDeclarationNode resourceDeclaration() {
        Token type = advance();
        advance(); // the '{'

        List<ResourceBodyNode> bodies = new ArrayList<>();
        do {
            if (check(TokenType.RIGHT_BRACE)) {
                break;
            }
            bodies.add(resourceBody());
        } while (match(TokenType.SEMICOLON));

        if (bodies.isEmpty()) {
            throw error(CompilerErrorCode.MISSING_TITLE,
                    "Declaration of '" + type.text() + "' has no resource title.", peek());
        }
        consume(TokenType.RIGHT_BRACE, CompilerErrorCode.MISSING_CLOSING_BRACE,
                "Expected '}' to close the declaration of '" + type.text() + "', but got " + describe(peek()) + ".");
        return new ResourceDeclarationNode(type, bodies);
    }

    private ResourceBodyNode resourceBody() {
        Token titleToken;
        InterpolatedString title;
        if (check(TokenType.STRING)) {
            titleToken = advance();
            title = InterpolationSplitter.split(titleToken);
        } else if (check(TokenType.IDENTIFIER) && checkNext(TokenType.COLON)) {
            titleToken = advance();
            title = InterpolatedString.literal(titleToken.text());
        } else {
            throw error(CompilerErrorCode.MISSING_TITLE,
                    "Expected a resource title, but got " + describe(peek()) + ".", peek());
        }
        consume(TokenType.COLON, CompilerErrorCode.MISSING_COLON,
                "Expected ':' after resource title " + titleToken.text() + ".");

        List<AttributeNode> attributes = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        while (check(TokenType.IDENTIFIER)) {
            Token name = advance();
            consume(TokenType.FAT_ARROW, CompilerErrorCode.INVALID_ATTRIBUTE,
                    "Expected '=>' after attribute name '" + name.text() + "'.");
            ValueNode value = value();
            if (seen.add(name.text())) {
                attributes.add(new AttributeNode(name, value));
            } else {
                diagnostics.reportError(CompilerErrorCode.DUPLICATE_ATTRIBUTE,
                        "Attribute '" + name.text() + "' is specified more than once for " + titleToken.text() + ".",
                        name.sourceInfo());
            }
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        return new ResourceBodyNode(titleToken, title, attributes, declarationCounter++);
    }

    /**
     * Parses an attribute value: a string, a number, a reference, a bare word or an array of values.
     * @return The parsed value node.
     */
    public ValueNode value() {
        if (check(TokenType.STRING)) {
            Token token = advance();
            return new StringLiteralNode(token, InterpolationSplitter.split(token));
        }
        if (match(TokenType.NUMBER)) {
            return new NumberLiteralNode(previous());
        }
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.LEFT_BRACKET)) {
            return reference();
        }
        if (match(TokenType.IDENTIFIER)) {
            return new BareWordNode(previous());
        }
        if (match(TokenType.LEFT_BRACKET)) {
            Token open = previous();
            List<ValueNode> elements = new ArrayList<>();
            while (!check(TokenType.RIGHT_BRACKET)) {
                elements.add(value());
                if (!match(TokenType.COMMA)) {
                    break;
                }
            }
            consume(TokenType.RIGHT_BRACKET, CompilerErrorCode.INVALID_ATTRIBUTE,
                    "Expected ']' to close the array, but got " + describe(peek()) + ".");
            return new ArrayLiteralNode(open, elements);
        }
        throw error(CompilerErrorCode.INVALID_ATTRIBUTE,
                "Expected an attribute value, but got " + describe(peek()) + ".", peek());
    }

    private ChainNode chain() {
        List<ChainOperandNode> operands = new ArrayList<>();
        List<Token> operators = new ArrayList<>();
        operands.add(chainOperand());
        while (peek().type().isChainOperator()) {
            operators.add(advance());
            operands.add(chainOperand());
        }
        if (operators.isEmpty()) {
            throw error(CompilerErrorCode.UNEXPECTED_TOKEN,
                    "Expected a relationship operator (->, ~>, <-, <~) after the reference, but got " + describe(peek()) + ".", previous());
        }
        return new ChainNode(operands, operators);
    }

    private ChainOperandNode chainOperand() {
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.LEFT_BRACKET)) {
            return reference();
        }
        if (match(TokenType.LEFT_BRACKET)) {
            Token open = previous();
            List<ResourceReferenceNode> references = new ArrayList<>();
            while (!check(TokenType.RIGHT_BRACKET)) {
                if (!(check(TokenType.IDENTIFIER) && checkNext(TokenType.LEFT_BRACKET))) {
                    throw error(CompilerErrorCode.INVALID_RELATIONSHIP_OPERAND,
                            "Expected a resource reference inside the array, but got " + describe(peek()) + ".", peek());
                }
                references.add(reference());
                if (!match(TokenType.COMMA)) {
                    break;
                }
            }
            consume(TokenType.RIGHT_BRACKET, CompilerErrorCode.INVALID_RELATIONSHIP_OPERAND,
                    "Expected ']' to close the reference array, but got " + describe(peek()) + ".");
            return new ReferenceArrayNode(open, references);
        }
        throw error(CompilerErrorCode.INVALID_RELATIONSHIP_OPERAND,
                "Expected a resource reference or an array of references, but got " + describe(peek()) + ".", peek());
    }

    private ResourceReferenceNode reference() {
        Token type = advance();
        advance(); // the '['
        Token title = consume(TokenType.STRING, CompilerErrorCode.INVALID_REFERENCE,
                "Expected a quoted title in the reference to '" + type.text() + "', but got " + describe(peek()) + ".");
        consume(TokenType.RIGHT_BRACKET, CompilerErrorCode.INVALID_REFERENCE,
                "Expected ']' after the title of the reference to '" + type.text() + "', but got " + describe(peek()) + ".");
        return new ResourceReferenceNode(type, title, InterpolationSplitter.split(title));
    }

    private void synchronize() {
        while (!isAtEnd()) {
            if (current > 0 && (previous().type() == TokenType.RIGHT_BRACE || previous().type() == TokenType.SEMICOLON)) {
                return;
            }
            if (check(TokenType.IDENTIFIER) && checkNext(TokenType.LEFT_BRACE)) {
                return;
            }
            // A reference that does not continue a chain starts the next chain.
            if (check(TokenType.IDENTIFIER) && checkNext(TokenType.LEFT_BRACKET) && current > 0 && !continuesChain(previous())) {
                return;
            }
            advance();
        }
    }

    private static boolean continuesChain(Token token) {
        return token.type().isChainOperator()
                || token.type() == TokenType.LEFT_BRACKET
                || token.type() == TokenType.COMMA
                || token.type() == TokenType.FAT_ARROW;
    }

    private SyntaxError error(CompilerErrorCode code, String message, Token at) {
        diagnostics.reportError(code, message, at.sourceInfo());
        return new SyntaxError(message);
    }

    private static String describe(Token token) {
        return token.type() == TokenType.END_OF_FILE ? "end of input" : "'" + token.text() + "'";
    }

    /**
     * Consumes the current token if it matches any of the given types.
     * @param types The token types to match.
     * @return true if a token was consumed.
     */
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    /**
     * Checks the type of the current token without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type.
     */
    public boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    /**
     * Checks the type of the next token without consuming it.
     * @param type The token type to check.
     * @return true if the next token is of the given type, false otherwise.
     */
    public boolean checkNext(TokenType type) {
        if (isAtEnd() || current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, CompilerErrorCode code, String errorMessage) {
        if (check(type)) return advance();
        throw error(code, errorMessage, peek());
    }

    /**
     * Unwinds the parser to the enclosing statement after an error has been reported.
     */
    private static final class SyntaxError extends RuntimeException {
        SyntaxError(String message) {
            super(message, null, false, false);
        }
    }
}
