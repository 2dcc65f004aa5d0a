package org.flowvault.filter.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.flowvault.filter.FilterField;
import org.flowvault.filter.FilterNode;

/**
 * Recursive-descent parser for filter expressions.
 * <p>
 * Grammar, from lowest to highest precedence:
 * <pre>
 * expression := conjunction ( "|" conjunction )*
 * conjunction := unary ( "&amp;"? unary )*
 * unary      := "!" unary | primary
 * primary    := "(" expression ")" | FLAG argument? | WORD | STRING
 * </pre>
 * Adjacent operands without an operator are AND-ed with the same precedence as {@code &amp;},
 * so {@code ~marked ~c 200 | ~c 201} means {@code (~marked & ~c 200) | ~c 201}. A word or
 * string outside a flag argument is a URL regex. Nested conjunctions and disjunctions are
 * flattened into one node.
 * <p>
 * Regex arguments are compiled once here so that an invalid pattern is reported as a parse
 * error instead of failing later inside the database.
 */
public class FilterParser {

    private final List<Token> tokens;
    private int current = 0;

    private FilterParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a filter expression.
     *
     * @param expression the expression text
     * @return the filter tree
     * @throws FilterParseException if the expression is empty or malformed
     */
    public static FilterNode parse(String expression) throws FilterParseException {
        List<Token> tokens = new FilterLexer(expression).scanTokens();
        FilterParser parser = new FilterParser(tokens);
        if (parser.isAtEnd()) {
            throw new FilterParseException("Empty filter expression", 0);
        }
        FilterNode node = parser.expression();
        if (!parser.isAtEnd()) {
            throw new FilterParseException("Unexpected '" + parser.peek().text() + "'", parser.peek().position());
        }
        return node;
    }

    // ========================================================================
    // Grammar rules
    // ========================================================================

    private FilterNode expression() throws FilterParseException {
        List<FilterNode> operands = new ArrayList<>();
        addFlattened(operands, conjunction(), FilterNode.Or.class);
        while (match(TokenType.OR)) {
            addFlattened(operands, conjunction(), FilterNode.Or.class);
        }
        return operands.size() == 1 ? operands.get(0) : new FilterNode.Or(operands);
    }

    private FilterNode conjunction() throws FilterParseException {
        List<FilterNode> operands = new ArrayList<>();
        addFlattened(operands, unary(), FilterNode.And.class);
        while (true) {
            if (match(TokenType.AND)) {
                addFlattened(operands, unary(), FilterNode.And.class);
            } else if (startsOperand()) {
                addFlattened(operands, unary(), FilterNode.And.class);
            } else {
                break;
            }
        }
        return operands.size() == 1 ? operands.get(0) : new FilterNode.And(operands);
    }

    private FilterNode unary() throws FilterParseException {
        if (match(TokenType.NOT)) {
            return new FilterNode.Not(unary());
        }
        return primary();
    }

    private FilterNode primary() throws FilterParseException {
        if (match(TokenType.LEFT_PAREN)) {
            FilterNode inner = expression();
            consume(TokenType.RIGHT_PAREN, "Expected ')'");
            return inner;
        }
        if (match(TokenType.FLAG)) {
            return flag(previous());
        }
        if (match(TokenType.WORD, TokenType.STRING)) {
            Token pattern = previous();
            return new FilterNode.RegexMatch(FilterField.URL, validRegex(pattern));
        }
        Token token = peek();
        String found = token.type() == TokenType.END ? "end of expression" : "'" + token.text() + "'";
        throw new FilterParseException("Expected a filter but found " + found, token.position());
    }

    private FilterNode flag(Token flagToken) throws FilterParseException {
        FilterField field = FilterField.byCode(flagToken.text())
            .orElseThrow(() -> new FilterParseException("Unknown filter ~" + flagToken.text(), flagToken.position()));

        return switch (field.arity()) {
            case NONE -> new FilterNode.Unary(field);
            case REGEX -> {
                Token argument = argument(flagToken, field);
                yield new FilterNode.RegexMatch(field, validRegex(argument));
            }
            case INTEGER -> {
                Token argument = argument(flagToken, field);
                yield new FilterNode.IntCompare(field, validInteger(argument));
            }
        };
    }

    private Token argument(Token flagToken, FilterField field) throws FilterParseException {
        if (!match(TokenType.WORD, TokenType.STRING)) {
            throw new FilterParseException("~" + flagToken.text() + " requires an argument ("
                + field.help() + ")", peek().position());
        }
        return previous();
    }

    private static String validRegex(Token token) throws FilterParseException {
        try {
            Pattern.compile(token.text());
            return token.text();
        } catch (PatternSyntaxException e) {
            throw new FilterParseException("Invalid regular expression '" + token.text() + "': "
                + e.getDescription(), token.position());
        }
    }

    private static long validInteger(Token token) throws FilterParseException {
        String text = token.text();
        if (text.isEmpty() || !text.chars().allMatch(Character::isDigit)) {
            throw new FilterParseException("Expected an integer but found '" + text + "'", token.position());
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new FilterParseException("Integer out of range: " + text, token.position());
        }
    }

    private static void addFlattened(List<FilterNode> operands, FilterNode node, Class<? extends FilterNode> type) {
        if (type == FilterNode.And.class && node instanceof FilterNode.And and) {
            operands.addAll(and.children());
        } else if (type == FilterNode.Or.class && node instanceof FilterNode.Or or) {
            operands.addAll(or.children());
        } else {
            operands.add(node);
        }
    }

    // ========================================================================
    // Token stream
    // ========================================================================

    private boolean startsOperand() {
        TokenType type = peek().type();
        return type == TokenType.NOT || type == TokenType.LEFT_PAREN || type == TokenType.FLAG
            || type == TokenType.WORD || type == TokenType.STRING;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            current++;
        }
        return previous();
    }

    private Token consume(TokenType type, String errorMessage) throws FilterParseException {
        if (check(type)) {
            return advance();
        }
        throw new FilterParseException(errorMessage, peek().position());
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END;
    }
}
