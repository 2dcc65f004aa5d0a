package org.flowvault.filter;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The flags of the filter language and the SQL each one compiles to.
 * <p>
 * Templates are boolean expressions over the flow view aliased as {@code v}. Regex and
 * integer flags contain exactly one {@code ?} placeholder, bound to the flag's argument.
 * Regex evaluation goes through the {@code SEARCH} functions; their last argument is the
 * flag set (1 ignore case, 2 multiline, 4 dot-all).
 * <p>
 * Every template yields TRUE or FALSE, never NULL, so negation behaves as in two-valued logic.
 * <p>
 * Only HTTP flows are stored, so {@code ~http} matches everything and the other protocol
 * flags match nothing.
 */
public enum FilterField {

    // ---- flags without argument ----
    ALL("all", Arity.NONE, "TRUE", "All flows"),
    HTTP("http", Arity.NONE, "TRUE", "Match HTTP flows"),
    TCP("tcp", Arity.NONE, "FALSE", "Match TCP flows"),
    UDP("udp", Arity.NONE, "FALSE", "Match UDP flows"),
    DNS("dns", Arity.NONE, "FALSE", "Match DNS flows"),
    MARKED("marked", Arity.NONE, "v.marked <> ''", "Match marked flows"),
    REQUEST_ONLY("q", Arity.NONE, "NOT v.has_response", "Match request with no response"),
    HAS_RESPONSE("s", Arity.NONE, "v.has_response", "Match response"),
    ERROR("e", Arity.NONE, "v.has_error", "Match error"),
    ASSET("a", Arity.NONE,
        "SEARCH('^(text/javascript|application/x-javascript|application/javascript|text/css|image/.*|font/.*|application/font.*)', "
            + "v.response_content_type, 1)",
        "Match asset in response: CSS, JavaScript, images, fonts"),
    REPLAY("replay", Arity.NONE, "v.is_replay IS NOT NULL", "Match replayed flows"),
    REPLAY_REQUEST("replayq", Arity.NONE, "COALESCE(v.is_replay = 'request', FALSE)", "Match replayed client request"),
    REPLAY_RESPONSE("replays", Arity.NONE, "COALESCE(v.is_replay = 'response', FALSE)", "Match replayed server response"),

    // ---- flags with regex argument ----
    URL("u", Arity.REGEX, "SEARCH(?, v.url, 0)", "URL"),
    METHOD("m", Arity.REGEX, "SEARCH(?, v.method, 1)", "Method"),
    DOMAIN("d", Arity.REGEX, "SEARCH(?, v.host, 1)", "Domain"),
    HEADER("h", Arity.REGEX,
        "v.flow_id IN (SELECT h.flow_id FROM flow_header h WHERE SEARCH(?, h.lines, 2))",
        "Header"),
    REQUEST_HEADER("hq", Arity.REGEX,
        "v.flow_id IN (SELECT h.flow_id FROM flow_header h WHERE h.side = 'request' AND SEARCH(?, h.lines, 2))",
        "Request header"),
    RESPONSE_HEADER("hs", Arity.REGEX,
        "v.flow_id IN (SELECT h.flow_id FROM flow_header h WHERE h.side = 'response' AND SEARCH(?, h.lines, 2))",
        "Response header"),
    CONTENT_TYPE("t", Arity.REGEX,
        "SEARCH(?, CONCAT_WS(CHAR(10), v.request_content_type, v.response_content_type), 3)",
        "Content-type header"),
    REQUEST_CONTENT_TYPE("tq", Arity.REGEX, "SEARCH(?, v.request_content_type, 1)",
        "Request Content-Type header"),
    RESPONSE_CONTENT_TYPE("ts", Arity.REGEX, "SEARCH(?, v.response_content_type, 1)",
        "Response Content-Type header"),
    BODY("b", Arity.REGEX,
        "v.flow_id IN (SELECT b.flow_id FROM chunk b WHERE b.kind IN ('request_content', 'response_content') "
            + "AND SEARCH_BYTES(?, b.payload, 4))",
        "Body"),
    REQUEST_BODY("bq", Arity.REGEX,
        "v.flow_id IN (SELECT b.flow_id FROM chunk b WHERE b.kind = 'request_content' "
            + "AND SEARCH_BYTES(?, b.payload, 4))",
        "Request body"),
    RESPONSE_BODY("bs", Arity.REGEX,
        "v.flow_id IN (SELECT b.flow_id FROM chunk b WHERE b.kind = 'response_content' "
            + "AND SEARCH_BYTES(?, b.payload, 4))",
        "Response body"),
    COMMENT("comment", Arity.REGEX, "SEARCH(?, v.comment, 0)", "Flow comment"),
    MARKER("marker", Arity.REGEX, "SEARCH(?, v.marked, 0)", "Match marked flows with specified marker"),
    SOURCE("src", Arity.REGEX, "SEARCH(?, v.client_address, 0)", "Match source address"),
    DESTINATION("dst", Arity.REGEX, "SEARCH(?, v.server_address, 0)", "Match destination address"),

    // ---- flags with integer argument ----
    STATUS_CODE("c", Arity.INTEGER, "(v.status_code IS NOT NULL AND v.status_code = ?)", "HTTP response code");

    /** Kind of argument a flag takes. */
    public enum Arity {
        NONE,
        REGEX,
        INTEGER
    }

    private static final Map<String, FilterField> BY_CODE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(FilterField::code, Function.identity()));

    private final String code;
    private final Arity arity;
    private final String sql;
    private final String help;

    FilterField(String code, Arity arity, String sql, String help) {
        this.code = code;
        this.arity = arity;
        this.sql = sql;
        this.help = help;
    }

    /** The flag name as written after {@code ~}. */
    public String code() {
        return code;
    }

    public Arity arity() {
        return arity;
    }

    /** SQL template; contains one placeholder unless the arity is {@link Arity#NONE}. */
    public String sql() {
        return sql;
    }

    /** Short description of what the flag matches, used in diagnostics. */
    public String help() {
        return help;
    }

    /**
     * Looks up a flag by its whole name, so {@code h} never matches {@code hq}.
     *
     * @param code flag name without {@code ~}
     * @return the flag, or empty if there is none with that exact name
     */
    public static Optional<FilterField> byCode(String code) {
        return Optional.ofNullable(BY_CODE.get(code));
    }
}
