package org.quarry.formula.frontend;

import org.quarry.formula.frontend.lexer.Lexer;
import org.quarry.formula.frontend.lexer.Token;
import org.quarry.formula.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that formula text is split into the expected tokens with correct positions.
 */
@Tag("unit")
public class LexerTest {

    @Test
    void testIdentifierOperatorAndNumber() {
        // Act
        List<Token> tokens = Lexer.tokenize("price * 1.5");

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.NUMBER, TokenType.END_OF_FILE);
        assertThat(tokens).extracting(Token::position).containsExactly(0, 6, 8, 11);
        assertThat(tokens.get(2).value()).isEqualTo(1.5);
    }

    @Test
    void testIntegerLiteralIsDouble() {
        List<Token> tokens = Lexer.tokenize("42");

        assertThat(tokens.get(0).type()).isEqualTo(TokenType.NUMBER);
        assertThat(tokens.get(0).value()).isEqualTo(42.0);
    }

    @Test
    void testNumberFollowedByDotWithoutDigits() {
        List<Token> tokens = Lexer.tokenize("12.");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.NUMBER, TokenType.PUNCTUATION, TokenType.END_OF_FILE);
        assertThat(tokens.get(0).value()).isEqualTo(12.0);
    }

    @Test
    void testStringsWithBothQuoteStylesAndEscapes() {
        List<Token> tokens = Lexer.tokenize("\"say \\\"hi\\\"\" + 'it\\'s' + \"a\\nb\"");

        assertThat(tokens).filteredOn(t -> t.type() == TokenType.STRING)
                .extracting(Token::value)
                .containsExactly("say \"hi\"", "it's", "a\nb");
    }

    @Test
    void testMentionIsSingleToken() {
        List<Token> tokens = Lexer.tokenize("@Paris.latitude");

        assertThat(tokens.get(0).type()).isEqualTo(TokenType.MENTION);
        assertThat(tokens.get(0).text()).isEqualTo("@Paris");
        assertThat(tokens.get(0).value()).isEqualTo("Paris");
        assertThat(tokens.get(1).is(".")).isTrue();
        assertThat(tokens.get(2).text()).isEqualTo("latitude");
    }

    @Test
    void testTwoCharacterOperators() {
        List<Token> tokens = Lexer.tokenize("a <= b <> c == d != e >= f");

        assertThat(tokens).filteredOn(t -> t.type() == TokenType.OPERATOR)
                .extracting(Token::text)
                .containsExactly("<=", "<>", "==", "!=", ">=");
    }

    @Test
    void testSingleCharacterOperatorsAndPunctuation() {
        List<Token> tokens = Lexer.tokenize("(a+b)-c*d/e%f=g<h>i, [x] ? y : z");

        assertThat(tokens).filteredOn(t -> t.type() == TokenType.OPERATOR)
                .extracting(Token::text)
                .containsExactly("+", "-", "*", "/", "%", "=", "<", ">");
        assertThat(tokens).filteredOn(t -> t.type() == TokenType.PUNCTUATION)
                .extracting(Token::text)
                .containsExactly("(", ")", ",", "[", "]", "?", ":");
    }

    @Test
    void testLoneAtAndBangArePunctuation() {
        List<Token> tokens = Lexer.tokenize("@ !");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.PUNCTUATION, TokenType.PUNCTUATION, TokenType.END_OF_FILE);
        assertThat(tokens.get(1).position()).isEqualTo(2);
    }

    @Test
    void testUnterminatedStringEmitsOnlyTheQuote() {
        List<Token> tokens = Lexer.tokenize("\"abc");

        assertThat(tokens.get(0).type()).isEqualTo(TokenType.PUNCTUATION);
        assertThat(tokens.get(0).text()).isEqualTo("\"");
        assertThat(tokens.get(1).type()).isEqualTo(TokenType.IDENTIFIER);
        assertThat(tokens.get(1).text()).isEqualTo("abc");
    }

    @Test
    void testEmptySourceYieldsOnlyEndOfFile() {
        List<Token> tokens = Lexer.tokenize("");

        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0).type()).isEqualTo(TokenType.END_OF_FILE);
        assertThat(tokens.get(0).position()).isZero();
    }

    @Test
    void testWhitespaceIsSkipped() {
        List<Token> tokens = Lexer.tokenize(" \t a \n");

        assertThat(tokens).extracting(Token::type).containsExactly(TokenType.IDENTIFIER, TokenType.END_OF_FILE);
        assertThat(tokens.get(0).position()).isEqualTo(3);
        assertThat(tokens.get(1).position()).isEqualTo(6);
    }
}
