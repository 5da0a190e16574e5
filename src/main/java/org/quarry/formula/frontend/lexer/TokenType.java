package org.quarry.formula.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** A numeric literal, integer or decimal. */
    NUMBER,
    /** A single- or double-quoted string literal. */
    STRING,
    /** A field or function name. */
    IDENTIFIER,
    /** A mention such as {@code @Paris}. */
    MENTION,

    // Symbols.
    /** An arithmetic or comparison operator. */
    OPERATOR,
    /** Parentheses, brackets, comma, dot, and any character the lexer does not recognize. */
    PUNCTUATION,

    // Miscellaneous.
    /** Represents the end of the formula. */
    END_OF_FILE
}
