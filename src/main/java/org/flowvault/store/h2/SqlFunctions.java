package org.flowvault.store.h2;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

/**
 * Static Java functions registered in H2 via {@code CREATE ALIAS}.
 * <p>
 * H2 has neither a general regex predicate with the semantics the filter language needs nor
 * JSON path extraction, so both are provided here and called from SQL during row evaluation.
 * The aliases are derived schema objects: {@link DerivedSchema} drops and re-registers them on
 * every rebuild.
 * <p>
 * All functions are deterministic and tolerate {@code NULL} input by returning {@code NULL}
 * (or {@code FALSE} for predicates). Documents are the UTF-8 JSON payloads of the metadata
 * chunks; paths are dot-separated member names such as {@code request.headers}.
 * <p>
 * <strong>Thread Safety:</strong> H2 may evaluate these from several sessions at once; the only
 * shared state is the Caffeine pattern cache, which is thread-safe.
 */
public final class SqlFunctions {

    /** {@code SEARCH} flag: case-insensitive matching. */
    public static final int IGNORE_CASE = 1;
    /** {@code SEARCH} flag: {@code ^} and {@code $} match at line boundaries. */
    public static final int MULTILINE = 2;
    /** {@code SEARCH} flag: {@code .} matches line terminators. */
    public static final int DOTALL = 4;

    private static final int DEFAULT_PATTERN_CACHE_SIZE = 256;

    private static final Cache<PatternKey, Pattern> PATTERNS = Caffeine.newBuilder()
        .maximumSize(DEFAULT_PATTERN_CACHE_SIZE)
        .build();

    private SqlFunctions() {
    }

    /**
     * Resizes the compiled pattern cache.
     * <p>
     * H2 calls aliases as static methods, so there is one cache per JVM, shared by all open
     * databases.
     *
     * @param maximumSize maximum number of cached patterns
     */
    public static void setPatternCacheSize(long maximumSize) {
        PATTERNS.policy().eviction().ifPresent(eviction -> eviction.setMaximum(maximumSize));
    }

    // ========================================================================
    // Pattern matching
    // ========================================================================

    /**
     * {@code SEARCH(pattern, text, flags)}: true if the regex is found anywhere in the text.
     */
    public static Boolean search(String pattern, String text, int flags) {
        if (pattern == null || text == null) {
            return Boolean.FALSE;
        }
        return compile(pattern, flags).matcher(text).find();
    }

    /**
     * {@code SEARCH_BYTES(pattern, data, flags)}: like {@link #search} over binary content.
     * <p>
     * Bytes are mapped one-to-one onto chars (ISO-8859-1), so ASCII patterns match ASCII and
     * UTF-8 encoded bodies alike.
     */
    public static Boolean searchBytes(String pattern, byte[] data, int flags) {
        if (pattern == null || data == null) {
            return Boolean.FALSE;
        }
        return search(pattern, new String(data, StandardCharsets.ISO_8859_1), flags);
    }

    private static Pattern compile(String pattern, int flags) {
        return PATTERNS.get(new PatternKey(pattern, flags), key -> Pattern.compile(key.pattern(), toJavaFlags(key.flags())));
    }

    private static int toJavaFlags(int flags) {
        int javaFlags = 0;
        if ((flags & IGNORE_CASE) != 0) {
            javaFlags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        }
        if ((flags & MULTILINE) != 0) {
            javaFlags |= Pattern.MULTILINE;
        }
        if ((flags & DOTALL) != 0) {
            javaFlags |= Pattern.DOTALL;
        }
        return javaFlags;
    }

    private record PatternKey(String pattern, int flags) {}

    // ========================================================================
    // JSON extraction
    // ========================================================================

    /**
     * {@code JSON_PATH_TEXT(doc, path)}: the string form of a scalar member, or NULL.
     */
    public static String jsonPathText(byte[] doc, String path) {
        JsonElement element = resolve(doc, path);
        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }
        return element.getAsString();
    }

    /**
     * {@code JSON_PATH_NUMBER(doc, path)}: a numeric member as double, or NULL.
     */
    public static Double jsonPathNumber(byte[] doc, String path) {
        JsonElement element = resolve(doc, path);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            return null;
        }
        return element.getAsDouble();
    }

    /**
     * {@code JSON_PATH_EXISTS(doc, path)}: true if the member exists and is not JSON null.
     */
    public static Boolean jsonPathExists(byte[] doc, String path) {
        return resolve(doc, path) != null;
    }

    /**
     * {@code HEADER_LINES(doc, path)}: a header list flattened to {@code name=value} lines.
     * <p>
     * Merging all headers of a message into one string lets a header filter run one regex
     * evaluation per message instead of one per header. Entries that are not a pair of
     * strings are skipped.
     */
    public static String headerLines(byte[] doc, String path) {
        JsonElement element = resolve(doc, path);
        if (element == null || !element.isJsonArray()) {
            return null;
        }
        StringBuilder lines = new StringBuilder();
        for (JsonElement entry : element.getAsJsonArray()) {
            String name = pairText(entry, 0);
            String value = pairText(entry, 1);
            if (name == null || value == null) {
                continue;
            }
            if (lines.length() > 0) {
                lines.append('\n');
            }
            lines.append(name).append('=').append(value);
        }
        return lines.toString();
    }

    /**
     * {@code MEDIA_TYPE(doc, path)}: the first {@code Content-Type} of a header list without
     * parameters, lower-cased, or NULL.
     */
    public static String mediaType(byte[] doc, String path) {
        JsonElement element = resolve(doc, path);
        if (element == null || !element.isJsonArray()) {
            return null;
        }
        for (JsonElement entry : element.getAsJsonArray()) {
            String value = pairText(entry, 1);
            if (value != null && "content-type".equalsIgnoreCase(pairText(entry, 0))) {
                int semicolon = value.indexOf(';');
                if (semicolon >= 0) {
                    value = value.substring(0, semicolon);
                }
                return value.trim().toLowerCase(Locale.ROOT);
            }
        }
        return null;
    }

    /**
     * {@code ADDRESS_TEXT(doc, path)}: a {@code [host, port]} pair as {@code host:port}, or NULL
     * if the pair or its host is missing.
     */
    public static String addressText(byte[] doc, String path) {
        JsonElement element = resolve(doc, path);
        String host = pairText(element, 0);
        if (host == null) {
            return null;
        }
        JsonElement port = element.getAsJsonArray().size() > 1 ? element.getAsJsonArray().get(1) : null;
        return isNumber(port) ? host + ":" + port.getAsInt() : host;
    }

    /**
     * {@code REQUEST_URL(doc)}: the full request URL of an {@code http_flow} document.
     * <p>
     * The port is omitted when it is the scheme's default or missing, the path when it is
     * missing. Without scheme or host there is no URL and the result is NULL.
     */
    public static String requestUrl(byte[] doc) {
        JsonElement element = resolve(doc, "request");
        if (element == null || !element.isJsonObject()) {
            return null;
        }
        JsonObject request = element.getAsJsonObject();
        String scheme = memberText(request, "scheme");
        String host = memberText(request, "host");
        if (scheme == null || host == null) {
            return null;
        }
        JsonElement port = request.get("port");
        String path = memberText(request, "path");

        StringBuilder url = new StringBuilder(scheme).append("://");
        if (host.indexOf(':') >= 0) {
            url.append('[').append(host).append(']');
        } else {
            url.append(host);
        }
        if (isNumber(port)) {
            int portNumber = port.getAsInt();
            boolean defaultPort = ("http".equals(scheme) && portNumber == 80)
                || ("https".equals(scheme) && portNumber == 443);
            if (!defaultPort) {
                url.append(':').append(portNumber);
            }
        }
        if (path != null) {
            url.append(path);
        }
        return url.toString();
    }

    private static String memberText(JsonObject object, String member) {
        JsonElement element = object.get(member);
        return element != null && element.isJsonPrimitive() ? element.getAsString() : null;
    }

    private static String pairText(JsonElement pair, int index) {
        if (pair == null || !pair.isJsonArray() || pair.getAsJsonArray().size() <= index) {
            return null;
        }
        JsonElement element = pair.getAsJsonArray().get(index);
        return element.isJsonPrimitive() ? element.getAsString() : null;
    }

    private static boolean isNumber(JsonElement element) {
        return element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber();
    }

    private static JsonElement resolve(byte[] doc, String path) {
        if (doc == null || path == null) {
            return null;
        }
        JsonElement current = JsonParser.parseString(new String(doc, StandardCharsets.UTF_8));
        for (String member : path.split("\\.")) {
            if (current == null || !current.isJsonObject()) {
                return null;
            }
            current = current.getAsJsonObject().get(member);
        }
        return current == null || current.isJsonNull() ? null : current;
    }
}
