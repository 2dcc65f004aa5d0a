package org.flowvault.codec;

/**
 * Field names and schema versions of the JSON chunk payloads.
 * <p>
 * The derived view layer extracts fields from stored documents by these names, so renaming
 * one requires a new payload version and a derived schema rebuild.
 */
public final class PayloadFields {

    /** Version written by the current codec. */
    public static final int CURRENT_VERSION = 2;

    /** Documents without a version field: binary values stored as UTF-8 text. */
    public static final int LEGACY_VERSION = 1;

    public static final String VERSION = "v";

    // http_flow
    public static final String ID = "id";
    public static final String TYPE = "type";
    public static final String MARKED = "marked";
    public static final String COMMENT = "comment";
    public static final String IS_REPLAY = "is_replay";
    public static final String TIMESTAMP_CREATED = "timestamp_created";
    public static final String LIVE = "live";
    public static final String ERROR = "error";
    public static final String ERROR_MSG = "msg";
    public static final String ERROR_TIMESTAMP = "timestamp";
    public static final String REQUEST = "request";
    public static final String RESPONSE = "response";

    // request / response
    public static final String HOST = "host";
    public static final String PORT = "port";
    public static final String METHOD = "method";
    public static final String SCHEME = "scheme";
    public static final String AUTHORITY = "authority";
    public static final String PATH = "path";
    public static final String HTTP_VERSION = "http_version";
    public static final String STATUS_CODE = "status_code";
    public static final String REASON = "reason";
    public static final String HEADERS = "headers";
    public static final String TIMESTAMP_START = "timestamp_start";
    public static final String TIMESTAMP_END = "timestamp_end";

    // connections
    public static final String ADDRESS = "address";
    public static final String PEERNAME = "peername";
    public static final String SOCKNAME = "sockname";
    public static final String TLS_ESTABLISHED = "tls_established";
    public static final String SNI = "sni";
    public static final String TLS_VERSION = "tls_version";
    public static final String CIPHER = "cipher";
    public static final String ALPN = "alpn";
    public static final String CERTIFICATE_LIST = "certificate_list";
    public static final String TIMESTAMP_TCP_SETUP = "timestamp_tcp_setup";
    public static final String TIMESTAMP_TLS_SETUP = "timestamp_tls_setup";

    private PayloadFields() {
    }
}
