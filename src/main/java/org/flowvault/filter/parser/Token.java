package org.flowvault.filter.parser;

/**
 * A lexical token of a filter expression.
 *
 * @param type     what kind of token this is
 * @param text     flag name, word, or unescaped string content; the operator itself otherwise
 * @param position zero-based offset of the token's first character in the expression
 */
public record Token(TokenType type, String text, int position) {}
