package org.flowvault.filter.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a filter expression into tokens.
 * <p>
 * Whitespace separates tokens and is otherwise ignored. {@code ! & | ( )} are single-character
 * operators. A flag is {@code ~} followed by its name, which ends at the next whitespace,
 * operator or quote; the name is later looked up as a whole, so {@code ~hq} is never read as
 * {@code ~h} followed by {@code q}. Strings are quoted with {@code '} or {@code "}; inside
 * them a backslash escapes the quote character and itself, and is kept verbatim before any
 * other character so regex escapes such as {@code \d} pass through unchanged. Any other run
 * of characters is a word.
 */
public class FilterLexer {

    private final String source;
    private int current = 0;

    public FilterLexer(String source) {
        this.source = source;
    }

    /**
     * Tokenizes the whole expression.
     *
     * @return the tokens, terminated by a {@link TokenType#END} token
     * @throws FilterParseException if a string is not terminated
     */
    public List<Token> scanTokens() throws FilterParseException {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (isAtEnd()) {
                break;
            }
            int start = current;
            char c = source.charAt(current++);
            switch (c) {
                case '!' -> tokens.add(new Token(TokenType.NOT, "!", start));
                case '&' -> tokens.add(new Token(TokenType.AND, "&", start));
                case '|' -> tokens.add(new Token(TokenType.OR, "|", start));
                case '(' -> tokens.add(new Token(TokenType.LEFT_PAREN, "(", start));
                case ')' -> tokens.add(new Token(TokenType.RIGHT_PAREN, ")", start));
                case '~' -> tokens.add(new Token(TokenType.FLAG, readWord(), start));
                case '"', '\'' -> tokens.add(new Token(TokenType.STRING, readString(c, start), start));
                default -> {
                    current--;
                    tokens.add(new Token(TokenType.WORD, readWord(), start));
                }
            }
        }
        tokens.add(new Token(TokenType.END, "", source.length()));
        return tokens;
    }

    private String readWord() {
        int start = current;
        while (!isAtEnd() && !isWordBoundary(source.charAt(current))) {
            current++;
        }
        return source.substring(start, current);
    }

    private String readString(char quote, int start) throws FilterParseException {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd()) {
            char c = source.charAt(current++);
            if (c == quote) {
                return value.toString();
            }
            if (c == '\\' && !isAtEnd()) {
                char next = source.charAt(current);
                if (next == quote || next == '\\') {
                    value.append(next);
                    current++;
                    continue;
                }
            }
            value.append(c);
        }
        throw new FilterParseException("Unterminated string", start);
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(source.charAt(current))) {
            current++;
        }
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private static boolean isWordBoundary(char c) {
        return Character.isWhitespace(c)
            || c == '!' || c == '&' || c == '|' || c == '(' || c == ')'
            || c == '~' || c == '"' || c == '\'';
    }
}
