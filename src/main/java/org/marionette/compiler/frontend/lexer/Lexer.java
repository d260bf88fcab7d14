package org.marionette.compiler.frontend.lexer;

import org.marionette.compiler.api.CompilerErrorCode;
import org.marionette.compiler.api.SourceInfo;
import org.marionette.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * manifest source text into a sequence of tokens.
 * <p>
 * Whitespace and comments are skipped. Errors are reported to the {@link DiagnosticsEngine}
 * and scanning continues after the offending character, so one pass reports all lexical errors.
 */
public class Lexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the manifest being scanned, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, always terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column, logicalFileName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ':': addToken(TokenType.COLON); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '=':
                if (match('>')) {
                    addToken(TokenType.FAT_ARROW);
                } else {
                    unexpected(c);
                }
                break;
            case '-':
                if (match('>')) {
                    addToken(TokenType.BEFORE_ARROW);
                } else if (isDigit(peek())) {
                    number();
                } else {
                    unexpected(c);
                }
                break;
            case '~':
                if (match('>')) {
                    addToken(TokenType.NOTIFY_ARROW);
                } else {
                    unexpected(c);
                }
                break;
            case '<':
                if (match('-')) {
                    addToken(TokenType.REQUIRE_ARROW);
                } else if (match('~')) {
                    addToken(TokenType.SUBSCRIBE_ARROW);
                } else {
                    unexpected(c);
                }
                break;
            case '#':
                // A comment goes until the end of the line.
                while (peek() != '\n' && !isAtEnd()) advance();
                break;
            case '/':
                if (match('*')) {
                    blockComment();
                } else {
                    unexpected(c);
                }
                break;
            case '\'': singleQuotedString(); break;
            case '"': doubleQuotedString(); break;
            // Ignore whitespace
            case ' ', '\r', '\t', '\n':
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    unexpected(c);
                }
                break;
        }
    }

    private void identifier() {
        while (true) {
            while (isIdentifierPart(peek())) advance();
            if (peek() == ':' && peekNext() == ':' && isIdentifierStart(peekAt(2))) {
                advance();
                advance();
                continue;
            }
            break;
        }
        addToken(TokenType.IDENTIFIER);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // consume the '.'
            while (isDigit(peek())) advance();
        }
        String text = source.substring(start, current);
        addToken(TokenType.NUMBER, text);
    }

    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            advance();
        }
        error(CompilerErrorCode.UNTERMINATED_COMMENT, "Unterminated block comment.", startPosition());
    }

    private void singleQuotedString() {
        StringBuilder value = new StringBuilder();
        while (peek() != '\'' && !isAtEnd()) {
            char c = advance();
            if (c == '\\' && (peek() == '\\' || peek() == '\'')) {
                value.append(advance());
            } else {
                value.append(c);
            }
        }

        if (isAtEnd()) {
            error(CompilerErrorCode.UNTERMINATED_STRING, "Unterminated string.", startPosition());
            return;
        }

        // The closing '
        advance();
        addToken(TokenType.STRING, new StringLiteral(value.toString(), false, List.of()));
    }

    private void doubleQuotedString() {
        int contentStart = current;
        List<InterpolationSpan> spans = new ArrayList<>();
        while (peek() != '"' && !isAtEnd()) {
            int dollarLine = line;
            int dollarColumn = column;
            char c = advance();
            if (c == '\\') {
                if (!isAtEnd()) advance();
            } else if (c == '$') {
                InterpolationSpan span = interpolation(contentStart, new SourceInfo(logicalFileName, dollarLine, dollarColumn));
                if (span != null) {
                    spans.add(span);
                }
            }
        }

        if (isAtEnd()) {
            error(CompilerErrorCode.UNTERMINATED_STRING, "Unterminated string.", startPosition());
            return;
        }

        String content = source.substring(contentStart, current);
        // The closing "
        advance();
        addToken(TokenType.STRING, new StringLiteral(content, true, spans));
    }

    /**
     * Scans the remainder of an interpolation whose '$' was just consumed.
     * Returns null if the '$' does not start an interpolation or the interpolation is malformed.
     */
    private InterpolationSpan interpolation(int contentStart, SourceInfo dollarPosition) {
        int spanStart = current - 1 - contentStart;
        if (peek() == '{') {
            advance();
            int expressionStart = current;
            int depth = 1;
            while (!isAtEnd() && peek() != '"') {
                char c = peek();
                if (c == '{') {
                    depth++;
                } else if (c == '}' && --depth == 0) {
                    break;
                }
                advance();
            }
            if (isAtEnd() || peek() == '"') {
                error(CompilerErrorCode.UNTERMINATED_INTERPOLATION, "Unterminated interpolation '${'.", dollarPosition);
                return null;
            }
            String expression = source.substring(expressionStart, current).trim();
            advance(); // the closing }
            if (expression.isEmpty()) {
                error(CompilerErrorCode.EMPTY_INTERPOLATION, "Empty interpolation '${}'.", dollarPosition);
                return null;
            }
            return new InterpolationSpan(spanStart, current - contentStart, expression);
        }

        boolean topScope = peek() == ':' && peekNext() == ':' && isIdentifierPart(peekAt(2));
        if (!topScope && !isIdentifierPart(peek())) {
            // A lone '$' is literal text.
            return null;
        }
        int nameStart = current;
        if (topScope) {
            advance();
            advance();
        }
        while (true) {
            while (isIdentifierPart(peek())) advance();
            if (peek() == ':' && peekNext() == ':' && isIdentifierPart(peekAt(2))) {
                advance();
                advance();
                continue;
            }
            break;
        }
        return new InterpolationSpan(spanStart, current - contentStart, source.substring(nameStart, current));
    }

    private void unexpected(char c) {
        error(CompilerErrorCode.UNEXPECTED_CHARACTER, "Unexpected character: " + c, startPosition());
    }

    private void error(CompilerErrorCode code, String message, SourceInfo position) {
        diagnostics.reportError(code, message, position);
    }

    private SourceInfo startPosition() {
        return new SourceInfo(logicalFileName, startLine, startColumn);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn, logicalFileName));
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        if (current + offset >= source.length()) return '\0';
        return source.charAt(current + offset);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
