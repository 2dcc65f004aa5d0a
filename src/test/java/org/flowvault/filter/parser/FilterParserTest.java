package org.flowvault.filter.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.flowvault.filter.FilterField;
import org.flowvault.filter.FilterNode;
import org.flowvault.filter.FilterNode.And;
import org.flowvault.filter.FilterNode.IntCompare;
import org.flowvault.filter.FilterNode.Not;
import org.flowvault.filter.FilterNode.Or;
import org.flowvault.filter.FilterNode.RegexMatch;
import org.flowvault.filter.FilterNode.Unary;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link FilterParser} and {@link FilterLexer}.
 */
@Tag("unit")
class FilterParserTest {

    private static final FilterNode MARKED = new Unary(FilterField.MARKED);
    private static final FilterNode C200 = new IntCompare(FilterField.STATUS_CODE, 200);
    private static final FilterNode C201 = new IntCompare(FilterField.STATUS_CODE, 201);

    // ========================================================================
    // Atoms
    // ========================================================================

    @Test
    void parse_unaryFlag() throws Exception {
        assertThat(FilterParser.parse("~marked")).isEqualTo(MARKED);
    }

    @Test
    void parse_regexFlag() throws Exception {
        assertThat(FilterParser.parse("~marker foo"))
            .isEqualTo(new RegexMatch(FilterField.MARKER, "foo"));
    }

    @Test
    void parse_integerFlag() throws Exception {
        assertThat(FilterParser.parse("~c 200")).isEqualTo(C200);
    }

    @Test
    void parse_bareWordIsUrlRegex() throws Exception {
        assertThat(FilterParser.parse("example\\.com/api"))
            .isEqualTo(new RegexMatch(FilterField.URL, "example\\.com/api"));
    }

    @Test
    void parse_longerFlagIsNotShadowedByPrefix() throws Exception {
        assertThat(FilterParser.parse("~hq ee")).isEqualTo(new RegexMatch(FilterField.REQUEST_HEADER, "ee"));
        assertThat(FilterParser.parse("~h ee")).isEqualTo(new RegexMatch(FilterField.HEADER, "ee"));
        assertThat(FilterParser.parse("~replayq")).isEqualTo(new Unary(FilterField.REPLAY_REQUEST));
        assertThat(FilterParser.parse("~replay")).isEqualTo(new Unary(FilterField.REPLAY));
        assertThat(FilterParser.parse("~marker x")).isEqualTo(new RegexMatch(FilterField.MARKER, "x"));
    }

    @Test
    void parse_quotedArgumentKeepsSpacesAndOperators() throws Exception {
        assertThat(FilterParser.parse("~h \"Content-Type: a|b (x)\""))
            .isEqualTo(new RegexMatch(FilterField.HEADER, "Content-Type: a|b (x)"));
    }

    @Test
    void parse_quotedEscapes() throws Exception {
        assertThat(FilterParser.parse("~b \"say \\\"hi\\\"\""))
            .isEqualTo(new RegexMatch(FilterField.BODY, "say \"hi\""));
        assertThat(FilterParser.parse("~b 'a\\\\b'"))
            .isEqualTo(new RegexMatch(FilterField.BODY, "a\\b"));
        // other escapes reach the regex unchanged
        assertThat(FilterParser.parse("~u '\\d+'"))
            .isEqualTo(new RegexMatch(FilterField.URL, "\\d+"));
    }

    // ========================================================================
    // Operators and precedence
    // ========================================================================

    @Test
    void parse_adjacentAtomsAreAnded() throws Exception {
        assertThat(FilterParser.parse("~marked ~c 200")).isEqualTo(new And(List.of(MARKED, C200)));
    }

    @Test
    void parse_explicitAndEqualsImplicitAnd() throws Exception {
        assertThat(FilterParser.parse("~marked & ~c 200")).isEqualTo(FilterParser.parse("~marked ~c 200"));
    }

    @Test
    void parse_orBindsLooserThanImplicitAnd() throws Exception {
        assertThat(FilterParser.parse("~marked ~c 200 | ~c 201"))
            .isEqualTo(new Or(List.of(new And(List.of(MARKED, C200)), C201)));
    }

    @Test
    void parse_notBindsTightest() throws Exception {
        assertThat(FilterParser.parse("! ~marked ~c 200"))
            .isEqualTo(new And(List.of(new Not(MARKED), C200)));
        assertThat(FilterParser.parse("!~marked"))
            .isEqualTo(new Not(MARKED));
    }

    @Test
    void parse_parenthesesOverridePrecedence() throws Exception {
        assertThat(FilterParser.parse("~marked (~c 200 | ~c 201)"))
            .isEqualTo(new And(List.of(MARKED, new Or(List.of(C200, C201)))));
        assertThat(FilterParser.parse("!(~marked | ~c 200)"))
            .isEqualTo(new Not(new Or(List.of(MARKED, C200))));
    }

    @Test
    void parse_chainsAreFlattened() throws Exception {
        FilterNode e = new Unary(FilterField.ERROR);

        assertThat(FilterParser.parse("~marked & ~c 200 & ~e")).isEqualTo(new And(List.of(MARKED, C200, e)));
        assertThat(FilterParser.parse("~marked | ~c 200 | ~e")).isEqualTo(new Or(List.of(MARKED, C200, e)));
        assertThat(FilterParser.parse("(~marked ~c 200) ~e")).isEqualTo(new And(List.of(MARKED, C200, e)));
    }

    @Test
    void parse_doubleNegation() throws Exception {
        assertThat(FilterParser.parse("!!~marked")).isEqualTo(new Not(new Not(MARKED)));
    }

    // ========================================================================
    // Errors
    // ========================================================================

    @Test
    void parse_emptyExpression_fails() {
        assertThatThrownBy(() -> FilterParser.parse("   "))
            .isInstanceOf(FilterParseException.class)
            .hasMessageContaining("Empty");
    }

    @Test
    void parse_unknownFlag_fails() {
        assertThatThrownBy(() -> FilterParser.parse("~marked ~nope"))
            .isInstanceOf(FilterParseException.class)
            .hasMessageContaining("~nope")
            .satisfies(e -> assertThat(((FilterParseException) e).getPosition()).isEqualTo(8));
    }

    @Test
    void parse_missingArgument_fails() {
        assertThatThrownBy(() -> FilterParser.parse("~h"))
            .isInstanceOf(FilterParseException.class)
            .hasMessageContaining("~h requires an argument (Header)");
        assertThatThrownBy(() -> FilterParser.parse("~c | ~marked"))
            .isInstanceOf(FilterParseException.class);
    }

    @Test
    void parse_nonNumericStatus_fails() {
        assertThatThrownBy(() -> FilterParser.parse("~c 2xx"))
            .isInstanceOf(FilterParseException.class)
            .hasMessageContaining("integer");
    }

    @Test
    void parse_invalidRegex_fails() {
        assertThatThrownBy(() -> FilterParser.parse("~u '[unclosed'"))
            .isInstanceOf(FilterParseException.class)
            .hasMessageContaining("regular expression");
    }

    @Test
    void parse_unterminatedQuote_fails() {
        assertThatThrownBy(() -> FilterParser.parse("~b \"abc"))
            .isInstanceOf(FilterParseException.class)
            .hasMessageContaining("Unterminated")
            .satisfies(e -> assertThat(((FilterParseException) e).getPosition()).isEqualTo(3));
    }

    @Test
    void parse_unbalancedParentheses_fail() {
        assertThatThrownBy(() -> FilterParser.parse("(~marked"))
            .isInstanceOf(FilterParseException.class)
            .hasMessageContaining("')'");
        assertThatThrownBy(() -> FilterParser.parse("~marked)"))
            .isInstanceOf(FilterParseException.class)
            .hasMessageContaining("Unexpected");
    }

    @Test
    void parse_danglingOperator_fails() {
        assertThatThrownBy(() -> FilterParser.parse("~marked |"))
            .isInstanceOf(FilterParseException.class)
            .hasMessageContaining("end of expression");
    }

    // ========================================================================
    // Lexer
    // ========================================================================

    @Test
    void lexer_splitsOperatorsWithoutWhitespace() throws Exception {
        List<Token> tokens = new FilterLexer("!~marked&(~c 200|x)").scanTokens();

        assertThat(tokens).extracting(Token::type).containsExactly(
            TokenType.NOT, TokenType.FLAG, TokenType.AND, TokenType.LEFT_PAREN, TokenType.FLAG,
            TokenType.WORD, TokenType.OR, TokenType.WORD, TokenType.RIGHT_PAREN, TokenType.END);
        assertThat(tokens.get(1).text()).isEqualTo("marked");
        assertThat(tokens.get(1).position()).isEqualTo(1);
    }
}
