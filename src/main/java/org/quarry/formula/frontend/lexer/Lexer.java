package org.quarry.formula.frontend.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer converts a formula source string into a flat sequence of tokens.
 * <p>
 * Tokenization is total: characters the lexer does not understand are emitted as single-character
 * {@link TokenType#PUNCTUATION} tokens so the parser can reject them with a source position.
 */
public class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new Lexer.
     * @param source The formula source.
     */
    public Lexer(String source) {
        this.source = source == null ? "" : source;
    }

    /**
     * Tokenizes a formula in one call.
     * @param source The formula source.
     * @return The tokens, always terminated by an {@link TokenType#END_OF_FILE} token.
     */
    public static List<Token> tokenize(String source) {
        return new Lexer(source).scanTokens();
    }

    /**
     * Performs the tokenization of the entire source.
     * @return A list of the recognized tokens.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\r', '\t', '\n':
                break;
            case '"', '\'':
                string(c);
                break;
            case '@':
                if (isAlpha(peek())) {
                    mention();
                } else {
                    addToken(TokenType.PUNCTUATION);
                }
                break;
            case '=':
                match('=');
                addToken(TokenType.OPERATOR);
                break;
            case '!':
                addToken(match('=') ? TokenType.OPERATOR : TokenType.PUNCTUATION);
                break;
            case '<':
                if (!match('=')) match('>');
                addToken(TokenType.OPERATOR);
                break;
            case '>':
                match('=');
                addToken(TokenType.OPERATOR);
                break;
            case '+', '-', '*', '/', '%':
                addToken(TokenType.OPERATOR);
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    // ( ) , . [ ] ? : and anything unknown
                    addToken(TokenType.PUNCTUATION);
                }
                break;
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void mention() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.MENTION, source.substring(start + 1, current));
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // consume the '.'
            while (isDigit(peek())) advance();
        }
        addToken(TokenType.NUMBER, Double.parseDouble(source.substring(start, current)));
    }

    private void string(char quote) {
        StringBuilder value = new StringBuilder();
        int scan = current;
        while (scan < source.length() && source.charAt(scan) != quote) {
            char c = source.charAt(scan);
            if (c == '\\' && scan + 1 < source.length()) {
                value.append(unescape(source.charAt(scan + 1)));
                scan += 2;
            } else {
                value.append(c);
                scan++;
            }
        }

        if (scan >= source.length()) {
            // Unterminated: emit only the quote and let the parser report it.
            addToken(TokenType.PUNCTUATION);
            return;
        }

        current = scan + 1;
        addToken(TokenType.STRING, value.toString());
    }

    private char unescape(char escaped) {
        return switch (escaped) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            default -> escaped;
        };
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object value) {
        tokens.add(new Token(type, source.substring(start, current), value, start));
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
