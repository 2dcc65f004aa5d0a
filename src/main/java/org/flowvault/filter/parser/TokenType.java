package org.flowvault.filter.parser;

/**
 * Token types of the filter language.
 */
public enum TokenType {
    NOT,
    AND,
    OR,
    LEFT_PAREN,
    RIGHT_PAREN,
    /** {@code ~name}; the token text is the name without the tilde. */
    FLAG,
    /** Unquoted word. */
    WORD,
    /** Quoted string; the token text is the unescaped content. */
    STRING,
    END
}
