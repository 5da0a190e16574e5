package org.quarry.formula.frontend.lexer;

/**
 * Represents a single token extracted from a formula by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source.
 * @param value The processed value of the token: a {@link Double} for numbers, the unescaped content
 *              for strings, the bare name for mentions, otherwise {@code null}.
 * @param position The 0-based character offset where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int position
) {
    /**
     * Checks whether this token is the given operator or punctuation symbol.
     * @param symbol The symbol text, e.g. {@code "+"} or {@code "("}.
     * @return true if the token is an operator or punctuation with exactly this text.
     */
    public boolean is(String symbol) {
        return (type == TokenType.OPERATOR || type == TokenType.PUNCTUATION) && text.equals(symbol);
    }
}
