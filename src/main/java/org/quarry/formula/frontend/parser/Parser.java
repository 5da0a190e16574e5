package org.quarry.formula.frontend.parser;

import org.quarry.formula.api.FormulaErrorCode;
import org.quarry.formula.api.FormulaException;
import org.quarry.formula.api.ParsedFormula;
import org.quarry.formula.frontend.lexer.Lexer;
import org.quarry.formula.frontend.lexer.Token;
import org.quarry.formula.frontend.lexer.TokenType;
import org.quarry.formula.frontend.parser.ast.ArrayLiteralNode;
import org.quarry.formula.frontend.parser.ast.AstNode;
import org.quarry.formula.frontend.parser.ast.BinaryNode;
import org.quarry.formula.frontend.parser.ast.CallNode;
import org.quarry.formula.frontend.parser.ast.ConditionalNode;
import org.quarry.formula.frontend.parser.ast.IdentifierNode;
import org.quarry.formula.frontend.parser.ast.LiteralNode;
import org.quarry.formula.frontend.parser.ast.MemberNode;
import org.quarry.formula.frontend.parser.ast.MentionNode;
import org.quarry.formula.frontend.parser.ast.UnaryNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for formulas. It consumes the tokens of the {@link Lexer} and produces
 * an immutable syntax tree together with the references the formula depends on.
 * <p>
 * Precedence, from lowest to highest: conditional {@code ?:}, comparison, additive,
 * multiplicative, unary minus, member access, primary. All binary tiers are left-associative.
 * Parsing fails fast on the first error, and rejects formulas nested deeper than
 * {@link #MAX_NESTING_DEPTH} levels.
 */
public class Parser {

    private static final Set<String> COMPARISON_OPERATORS = Set.of("=", "==", "!=", "<>", "<", ">", "<=", ">=");
    private static final Set<String> ADDITIVE_OPERATORS = Set.of("+", "-");
    private static final Set<String> MULTIPLICATIVE_OPERATORS = Set.of("*", "/", "%");

    /** Maximum nesting of parentheses, brackets, calls, conditionals and unary minus. */
    public static final int MAX_NESTING_DEPTH = 200;

    private final String source;
    private final List<Token> tokens;
    private int current = 0;
    private int depth = 0;

    /**
     * Constructs a new Parser for the given formula source.
     * @param source The formula text.
     */
    public Parser(String source) {
        this.source = source == null ? "" : source;
        this.tokens = Lexer.tokenize(this.source);
    }

    /**
     * Parses a formula in one call.
     * @param source The formula text.
     * @return The parsed formula.
     * @throws FormulaException with code {@link FormulaErrorCode#PARSE_ERROR} if the formula is malformed.
     */
    public static ParsedFormula parseFormula(String source) throws FormulaException {
        return new Parser(source).parse();
    }

    /**
     * Parses the whole token stream as a single expression.
     * @return The parsed formula with its AST and dependencies.
     * @throws FormulaException with code {@link FormulaErrorCode#PARSE_ERROR} if the formula is malformed.
     */
    public ParsedFormula parse() throws FormulaException {
        if (isAtEnd()) {
            throw error("Formula is empty", 0);
        }

        AstNode ast = expression();

        if (!isAtEnd()) {
            Token trailing = peek();
            throw error("Unexpected '" + trailing.text() + "' after end of expression", trailing.position());
        }

        DependencyCollector collector = new DependencyCollector().collect(ast);
        return new ParsedFormula(ast, collector.fields(), collector.mentions(), source);
    }

    private AstNode expression() throws FormulaException {
        return conditional();
    }

    private AstNode conditional() throws FormulaException {
        enterNesting();
        try {
            AstNode condition = comparison();
            if (matchSymbol("?")) {
                AstNode whenTrue = conditional();
                consumeSymbol(":", "Expected ':' in conditional expression");
                AstNode whenFalse = conditional();
                return new ConditionalNode(condition, whenTrue, whenFalse, condition.position());
            }
            return condition;
        } finally {
            depth--;
        }
    }

    private AstNode comparison() throws FormulaException {
        AstNode left = additive();
        while (checkOperator(COMPARISON_OPERATORS)) {
            Token operator = advance();
            AstNode right = additive();
            left = new BinaryNode(operator.text(), left, right, operator.position());
        }
        return left;
    }

    private AstNode additive() throws FormulaException {
        AstNode left = multiplicative();
        while (checkOperator(ADDITIVE_OPERATORS)) {
            Token operator = advance();
            AstNode right = multiplicative();
            left = new BinaryNode(operator.text(), left, right, operator.position());
        }
        return left;
    }

    private AstNode multiplicative() throws FormulaException {
        AstNode left = unary();
        while (checkOperator(MULTIPLICATIVE_OPERATORS)) {
            Token operator = advance();
            AstNode right = unary();
            left = new BinaryNode(operator.text(), left, right, operator.position());
        }
        return left;
    }

    private AstNode unary() throws FormulaException {
        if (check(TokenType.OPERATOR) && peek().text().equals("-")) {
            Token operator = advance();
            enterNesting();
            try {
                return new UnaryNode(operator.text(), unary(), operator.position());
            } finally {
                depth--;
            }
        }
        return postfix();
    }

    private AstNode postfix() throws FormulaException {
        AstNode expression = primary();
        while (matchSymbol(".")) {
            Token property = consume(TokenType.IDENTIFIER, "Expected property name after '.'");
            expression = new MemberNode(expression, property.text(), expression.position());
        }
        return expression;
    }

    private AstNode primary() throws FormulaException {
        Token token = peek();
        switch (token.type()) {
            case NUMBER, STRING:
                advance();
                return new LiteralNode(token.value(), token.position());
            case MENTION:
                advance();
                return new MentionNode((String) token.value(), token.position());
            case IDENTIFIER:
                advance();
                if (checkSymbol("(")) {
                    return call(token);
                }
                return new IdentifierNode(token.text(), token.position());
            case END_OF_FILE:
                throw error("Unexpected end of formula, expected an operand", token.position());
            case OPERATOR:
                throw error("Unexpected operator '" + token.text() + "', expected an operand", token.position());
            default:
                break;
        }

        if (matchSymbol("(")) {
            AstNode inner = expression();
            consumeSymbol(")", "Expected ')' to close '(' opened at position " + token.position());
            return inner;
        }

        if (matchSymbol("[")) {
            List<AstNode> elements = new ArrayList<>();
            if (!checkSymbol("]")) {
                do {
                    elements.add(expression());
                } while (matchSymbol(","));
            }
            consumeSymbol("]", "Expected ']' to close '[' opened at position " + token.position());
            return new ArrayLiteralNode(elements, token.position());
        }

        throw error("Unexpected character '" + token.text() + "'", token.position());
    }

    private AstNode call(Token name) throws FormulaException {
        Token open = advance(); // consume '('
        List<AstNode> arguments = new ArrayList<>();
        if (!checkSymbol(")")) {
            do {
                arguments.add(expression());
            } while (matchSymbol(","));
        }
        consumeSymbol(")", "Expected ')' to close call of " + name.text() + " opened at position " + open.position());
        return new CallNode(name.text(), arguments, name.position());
    }

    private void enterNesting() throws FormulaException {
        if (++depth > MAX_NESTING_DEPTH) {
            depth--;
            throw error("Formula is nested too deeply (more than " + MAX_NESTING_DEPTH + " levels)", peek().position());
        }
    }

    // --- Token stream helpers ---

    private boolean checkOperator(Set<String> operators) {
        return check(TokenType.OPERATOR) && operators.contains(peek().text());
    }

    private boolean checkSymbol(String symbol) {
        return check(TokenType.PUNCTUATION) && peek().text().equals(symbol);
    }

    private boolean matchSymbol(String symbol) {
        if (checkSymbol(symbol)) {
            advance();
            return true;
        }
        return false;
    }

    private void consumeSymbol(String symbol, String message) throws FormulaException {
        if (!matchSymbol(symbol)) {
            throw error(message + ", found " + describe(peek()), peek().position());
        }
    }

    private Token consume(TokenType type, String message) throws FormulaException {
        if (check(type)) return advance();
        throw error(message + ", found " + describe(peek()), peek().position());
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
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

    private String describe(Token token) {
        return token.type() == TokenType.END_OF_FILE ? "end of formula" : "'" + token.text() + "'";
    }

    private FormulaException error(String message, int position) {
        return new FormulaException(message + " at position " + position, FormulaErrorCode.PARSE_ERROR, position);
    }
}
