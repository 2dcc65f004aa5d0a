package org.flowvault.codec;

import static org.flowvault.codec.PayloadFields.*;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.flowvault.api.flow.Address;
import org.flowvault.api.flow.ClientConnection;
import org.flowvault.api.flow.Flow;
import org.flowvault.api.flow.FlowError;
import org.flowvault.api.flow.Header;
import org.flowvault.api.flow.HttpFlow;
import org.flowvault.api.flow.HttpRequest;
import org.flowvault.api.flow.HttpResponse;
import org.flowvault.api.flow.ServerConnection;
import org.flowvault.api.store.Chunk;
import org.flowvault.api.store.ChunkKind;
import org.flowvault.api.store.FlowDecodeException;
import org.flowvault.api.store.RawChunk;
import org.flowvault.api.store.UnsupportedFlowTypeException;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

/**
 * Maps a flow to the chunks it is persisted as, and back.
 * <p>
 * An HTTP flow is split into up to five chunks:
 * <pre>
 * request_content    raw request body      (absent if the body is null)
 * response_content   raw response body     (absent without response or body)
 * client_conn        JSON client connection
 * server_conn        JSON server connection
 * http_flow          JSON of everything else (method, URL, headers, status, timing, flags)
 * </pre>
 * Bodies stay binary so the relational store can measure them without parsing; the metadata
 * chunks are JSON so the derived view layer can extract fields from them in-database.
 * <p>
 * <strong>Decoding:</strong> chunks may arrive in any order. They are first collected per kind
 * into a reconstruction context, and the payload version of each JSON document is read before
 * any of its binary values are re-expanded. Decoding a fixed chunk set always yields an equal
 * flow.
 * <p>
 * <strong>Thread Safety:</strong> stateless apart from an immutable {@link Gson}; safe to share.
 */
public class ChunkCodec {

    private final Gson gson = new GsonBuilder()
        .serializeNulls()
        .disableHtmlEscaping()
        .create();

    // ========================================================================
    // Encoding
    // ========================================================================

    /**
     * Splits a flow into its chunks.
     *
     * @param flow the flow snapshot
     * @return the chunks, {@code http_flow} last
     * @throws UnsupportedFlowTypeException if the flow kind has no chunk layout
     */
    public List<Chunk> encode(Flow flow) throws UnsupportedFlowTypeException {
        return switch (flow.kind()) {
            case HTTP -> {
                if (!(flow instanceof HttpFlow httpFlow)) {
                    throw new UnsupportedFlowTypeException(flow.id(), flow.kind());
                }
                yield encodeHttp(httpFlow);
            }
            case TCP, UDP, DNS -> throw new UnsupportedFlowTypeException(flow.id(), flow.kind());
        };
    }

    /**
     * Returns the chunk kinds that an earlier snapshot of the flow may have stored and that
     * this snapshot invalidates.
     * <p>
     * A flow without a response loses its response body. A null body on a present message
     * retracts nothing: the body of a streamed message may have been stored earlier.
     *
     * @param flow the flow snapshot
     * @return kinds to delete for this flow, possibly empty
     */
    public Set<ChunkKind> retractedKinds(Flow flow) {
        if (flow instanceof HttpFlow httpFlow && httpFlow.response() == null) {
            return EnumSet.of(ChunkKind.RESPONSE_CONTENT);
        }
        return EnumSet.noneOf(ChunkKind.class);
    }

    private List<Chunk> encodeHttp(HttpFlow flow) {
        List<Chunk> chunks = new ArrayList<>(5);
        String id = flow.id();

        if (flow.request().content() != null) {
            chunks.add(new Chunk(id, ChunkKind.REQUEST_CONTENT, flow.request().content()));
        }
        if (flow.response() != null && flow.response().content() != null) {
            chunks.add(new Chunk(id, ChunkKind.RESPONSE_CONTENT, flow.response().content()));
        }
        chunks.add(new Chunk(id, ChunkKind.CLIENT_CONN, toBytes(encodeClient(flow.clientConnection()))));
        chunks.add(new Chunk(id, ChunkKind.SERVER_CONN, toBytes(encodeServer(flow.serverConnection()))));
        chunks.add(new Chunk(id, ChunkKind.HTTP_FLOW, toBytes(encodeFlow(flow))));
        return chunks;
    }

    private JsonObject encodeFlow(HttpFlow flow) {
        JsonObject json = new JsonObject();
        json.addProperty(VERSION, CURRENT_VERSION);
        json.addProperty(ID, flow.id());
        json.addProperty(TYPE, "http");
        json.addProperty(MARKED, flow.marked());
        json.addProperty(COMMENT, flow.comment());
        json.addProperty(IS_REPLAY, flow.isReplay());
        json.addProperty(TIMESTAMP_CREATED, flow.timestampCreated());
        json.addProperty(LIVE, flow.live());

        if (flow.error() != null) {
            JsonObject error = new JsonObject();
            error.addProperty(ERROR_MSG, flow.error().msg());
            error.addProperty(ERROR_TIMESTAMP, flow.error().timestamp());
            json.add(ERROR, error);
        } else {
            json.add(ERROR, JsonNull.INSTANCE);
        }

        HttpRequest request = flow.request();
        JsonObject req = new JsonObject();
        req.addProperty(HOST, request.host());
        req.addProperty(PORT, request.port());
        req.addProperty(METHOD, request.method());
        req.addProperty(SCHEME, request.scheme());
        req.addProperty(AUTHORITY, request.authority());
        req.addProperty(PATH, request.path());
        req.addProperty(HTTP_VERSION, request.httpVersion());
        req.add(HEADERS, encodeHeaders(request.headers()));
        req.addProperty(TIMESTAMP_START, request.timestampStart());
        req.addProperty(TIMESTAMP_END, request.timestampEnd());
        json.add(REQUEST, req);

        HttpResponse response = flow.response();
        if (response != null) {
            JsonObject resp = new JsonObject();
            resp.addProperty(HTTP_VERSION, response.httpVersion());
            resp.addProperty(STATUS_CODE, response.statusCode());
            resp.addProperty(REASON, response.reason());
            resp.add(HEADERS, encodeHeaders(response.headers()));
            resp.addProperty(TIMESTAMP_START, response.timestampStart());
            resp.addProperty(TIMESTAMP_END, response.timestampEnd());
            json.add(RESPONSE, resp);
        } else {
            json.add(RESPONSE, JsonNull.INSTANCE);
        }
        return json;
    }

    private JsonObject encodeClient(ClientConnection conn) {
        JsonObject json = new JsonObject();
        json.addProperty(VERSION, CURRENT_VERSION);
        json.addProperty(ID, conn.id());
        json.add(PEERNAME, encodeAddress(conn.peername()));
        json.add(SOCKNAME, encodeAddress(conn.sockname()));
        json.addProperty(TLS_ESTABLISHED, conn.tlsEstablished());
        json.addProperty(SNI, conn.sni());
        json.addProperty(TLS_VERSION, conn.tlsVersion());
        json.addProperty(CIPHER, conn.cipher());
        json.addProperty(ALPN, ByteText.toText(conn.alpn()));
        json.addProperty(TIMESTAMP_START, conn.timestampStart());
        json.addProperty(TIMESTAMP_TLS_SETUP, conn.timestampTlsSetup());
        json.addProperty(TIMESTAMP_END, conn.timestampEnd());
        return json;
    }

    private JsonObject encodeServer(ServerConnection conn) {
        JsonObject json = new JsonObject();
        json.addProperty(VERSION, CURRENT_VERSION);
        json.addProperty(ID, conn.id());
        json.add(ADDRESS, encodeAddress(conn.address()));
        json.add(PEERNAME, encodeAddress(conn.peername()));
        json.add(SOCKNAME, encodeAddress(conn.sockname()));
        json.addProperty(TLS_ESTABLISHED, conn.tlsEstablished());
        json.addProperty(SNI, conn.sni());
        json.addProperty(TLS_VERSION, conn.tlsVersion());
        json.addProperty(ALPN, ByteText.toText(conn.alpn()));
        JsonArray certs = new JsonArray();
        for (byte[] cert : conn.certificateList()) {
            certs.add(ByteText.toBase64(cert));
        }
        json.add(CERTIFICATE_LIST, certs);
        json.addProperty(TIMESTAMP_START, conn.timestampStart());
        json.addProperty(TIMESTAMP_TCP_SETUP, conn.timestampTcpSetup());
        json.addProperty(TIMESTAMP_TLS_SETUP, conn.timestampTlsSetup());
        json.addProperty(TIMESTAMP_END, conn.timestampEnd());
        return json;
    }

    private static JsonArray encodeHeaders(List<Header> headers) {
        JsonArray array = new JsonArray(headers.size());
        for (Header header : headers) {
            JsonArray pair = new JsonArray(2);
            pair.add(ByteText.toText(header.name()));
            pair.add(ByteText.toText(header.value()));
            array.add(pair);
        }
        return array;
    }

    private static JsonElement encodeAddress(Address address) {
        if (address == null) {
            return JsonNull.INSTANCE;
        }
        JsonArray pair = new JsonArray(2);
        pair.add(address.host());
        pair.add(address.port());
        return pair;
    }

    private byte[] toBytes(JsonObject json) {
        return gson.toJson(json).getBytes(StandardCharsets.UTF_8);
    }

    // ========================================================================
    // Decoding
    // ========================================================================

    /**
     * Decodes chunk rows as read from the store, resolving their kind names first.
     *
     * @param flowId id of the flow the rows belong to
     * @param rows   all rows stored for that flow
     * @return the reconstructed flow
     * @throws FlowDecodeException if a kind is unknown or the chunk set is incomplete or corrupt
     */
    public HttpFlow decodeRows(String flowId, Collection<RawChunk> rows) throws FlowDecodeException {
        List<Chunk> chunks = new ArrayList<>(rows.size());
        for (RawChunk row : rows) {
            ChunkKind kind;
            try {
                kind = ChunkKind.fromWireName(row.kind());
            } catch (IllegalArgumentException e) {
                throw new FlowDecodeException(flowId, "Chunk kind '" + row.kind() + "' cannot be resolved");
            }
            chunks.add(new Chunk(row.flowId(), kind, row.payload()));
        }
        return decode(chunks);
    }

    /**
     * Reconstructs a flow from its complete chunk set.
     *
     * @param chunks all chunks of one flow, in any order
     * @return the reconstructed flow
     * @throws FlowDecodeException if the {@code http_flow} chunk is missing, chunks of different
     *                             flows are mixed, or a payload is malformed
     */
    public HttpFlow decode(Collection<Chunk> chunks) throws FlowDecodeException {
        if (chunks.isEmpty()) {
            throw new FlowDecodeException(null, "Cannot decode an empty chunk set");
        }

        String flowId = null;
        Map<ChunkKind, byte[]> context = new EnumMap<>(ChunkKind.class);
        for (Chunk chunk : chunks) {
            if (flowId == null) {
                flowId = chunk.flowId();
            } else if (!flowId.equals(chunk.flowId())) {
                throw new FlowDecodeException(flowId, "Chunk set mixes flows " + flowId + " and " + chunk.flowId());
            }
            context.put(chunk.kind(), chunk.payload());
        }

        if (!context.containsKey(ChunkKind.HTTP_FLOW)) {
            throw new FlowDecodeException(flowId, "Missing http_flow chunk for flow " + flowId);
        }

        try {
            return decodeHttp(flowId, context);
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException
                 | IndexOutOfBoundsException | IllegalArgumentException e) {
            throw new FlowDecodeException(flowId, "Malformed payload for flow " + flowId + ": " + e.getMessage(), e);
        }
    }

    private HttpFlow decodeHttp(String flowId, Map<ChunkKind, byte[]> context) throws FlowDecodeException {
        JsonObject flowJson = parse(flowId, ChunkKind.HTTP_FLOW, context.get(ChunkKind.HTTP_FLOW));
        int flowVersion = version(flowId, flowJson);

        JsonObject reqJson = object(flowJson, REQUEST);
        if (reqJson == null) {
            throw new FlowDecodeException(flowId, "http_flow chunk of flow " + flowId + " has no request");
        }
        HttpRequest request = new HttpRequest(
            string(reqJson, HOST),
            required(flowId, reqJson, PORT).getAsInt(),
            string(reqJson, METHOD),
            string(reqJson, SCHEME),
            string(reqJson, AUTHORITY),
            string(reqJson, PATH),
            string(reqJson, HTTP_VERSION),
            decodeHeaders(reqJson, flowVersion),
            context.get(ChunkKind.REQUEST_CONTENT),
            required(flowId, reqJson, TIMESTAMP_START).getAsDouble(),
            nullableDouble(reqJson, TIMESTAMP_END));

        JsonObject respJson = object(flowJson, RESPONSE);
        HttpResponse response = null;
        if (respJson != null) {
            response = new HttpResponse(
                string(respJson, HTTP_VERSION),
                required(flowId, respJson, STATUS_CODE).getAsInt(),
                string(respJson, REASON),
                decodeHeaders(respJson, flowVersion),
                context.get(ChunkKind.RESPONSE_CONTENT),
                required(flowId, respJson, TIMESTAMP_START).getAsDouble(),
                nullableDouble(respJson, TIMESTAMP_END));
        } else if (context.containsKey(ChunkKind.RESPONSE_CONTENT)) {
            throw new FlowDecodeException(flowId, "Flow " + flowId + " has response content but no response");
        }

        JsonObject errorJson = object(flowJson, ERROR);
        FlowError error = errorJson == null
            ? null
            : new FlowError(string(errorJson, ERROR_MSG), required(flowId, errorJson, ERROR_TIMESTAMP).getAsDouble());

        ClientConnection client = decodeClient(flowId, context.get(ChunkKind.CLIENT_CONN));
        ServerConnection server = decodeServer(flowId, context.get(ChunkKind.SERVER_CONN));

        String marked = string(flowJson, MARKED);
        String comment = string(flowJson, COMMENT);
        JsonElement live = flowJson.get(LIVE);
        return new HttpFlow(
            flowId,
            request,
            response,
            error,
            client,
            server,
            marked == null ? "" : marked,
            comment == null ? "" : comment,
            string(flowJson, IS_REPLAY),
            required(flowId, flowJson, TIMESTAMP_CREATED).getAsDouble(),
            live != null && !live.isJsonNull() && live.getAsBoolean());
    }

    private ClientConnection decodeClient(String flowId, byte[] payload) throws FlowDecodeException {
        if (payload == null) {
            throw new FlowDecodeException(flowId, "Missing client_conn chunk for flow " + flowId);
        }
        JsonObject json = parse(flowId, ChunkKind.CLIENT_CONN, payload);
        int connVersion = version(flowId, json);
        return new ClientConnection(
            requiredString(flowId, json, ID),
            decodeAddress(json.get(PEERNAME)),
            decodeAddress(json.get(SOCKNAME)),
            required(flowId, json, TLS_ESTABLISHED).getAsBoolean(),
            string(json, SNI),
            string(json, TLS_VERSION),
            string(json, CIPHER),
            decodeText(string(json, ALPN), connVersion),
            required(flowId, json, TIMESTAMP_START).getAsDouble(),
            nullableDouble(json, TIMESTAMP_TLS_SETUP),
            nullableDouble(json, TIMESTAMP_END));
    }

    private ServerConnection decodeServer(String flowId, byte[] payload) throws FlowDecodeException {
        if (payload == null) {
            throw new FlowDecodeException(flowId, "Missing server_conn chunk for flow " + flowId);
        }
        JsonObject json = parse(flowId, ChunkKind.SERVER_CONN, payload);
        int connVersion = version(flowId, json);

        List<byte[]> certificates = new ArrayList<>();
        JsonElement certs = json.get(CERTIFICATE_LIST);
        if (certs != null && !certs.isJsonNull()) {
            for (JsonElement cert : certs.getAsJsonArray()) {
                certificates.add(connVersion == LEGACY_VERSION
                    ? ByteText.fromLegacyText(cert.getAsString())
                    : ByteText.fromBase64(cert.getAsString()));
            }
        }

        return new ServerConnection(
            requiredString(flowId, json, ID),
            decodeAddress(json.get(ADDRESS)),
            decodeAddress(json.get(PEERNAME)),
            decodeAddress(json.get(SOCKNAME)),
            required(flowId, json, TLS_ESTABLISHED).getAsBoolean(),
            string(json, SNI),
            string(json, TLS_VERSION),
            decodeText(string(json, ALPN), connVersion),
            certificates,
            nullableDouble(json, TIMESTAMP_START),
            nullableDouble(json, TIMESTAMP_TCP_SETUP),
            nullableDouble(json, TIMESTAMP_TLS_SETUP),
            nullableDouble(json, TIMESTAMP_END));
    }

    private static List<Header> decodeHeaders(JsonObject message, int payloadVersion) {
        JsonElement element = message.get(HEADERS);
        if (element == null || element.isJsonNull()) {
            return List.of();
        }
        JsonArray array = element.getAsJsonArray();
        List<Header> headers = new ArrayList<>(array.size());
        for (JsonElement entry : array) {
            JsonArray pair = entry.getAsJsonArray();
            headers.add(new Header(
                decodeText(pair.get(0).getAsString(), payloadVersion),
                decodeText(pair.get(1).getAsString(), payloadVersion)));
        }
        return headers;
    }

    private static byte[] decodeText(String text, int payloadVersion) {
        return payloadVersion == LEGACY_VERSION ? ByteText.fromLegacyText(text) : ByteText.fromText(text);
    }

    private static Address decodeAddress(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        JsonArray pair = element.getAsJsonArray();
        JsonElement host = pair.get(0);
        return new Address(host.isJsonNull() ? null : host.getAsString(), pair.get(1).getAsInt());
    }

    private static JsonObject parse(String flowId, ChunkKind kind, byte[] payload) throws FlowDecodeException {
        JsonElement element = JsonParser.parseString(new String(payload, StandardCharsets.UTF_8));
        if (!element.isJsonObject()) {
            throw new FlowDecodeException(flowId, kind.wireName() + " chunk of flow " + flowId + " is not a JSON object");
        }
        return element.getAsJsonObject();
    }

    private static int version(String flowId, JsonObject json) throws FlowDecodeException {
        JsonElement v = json.get(VERSION);
        if (v == null || v.isJsonNull()) {
            return LEGACY_VERSION;
        }
        int version = v.getAsInt();
        if (version < LEGACY_VERSION || version > CURRENT_VERSION) {
            throw new FlowDecodeException(flowId,
                "Unsupported payload version " + version + " for flow " + flowId + " (max " + CURRENT_VERSION + ")");
        }
        return version;
    }

    private static JsonObject object(JsonObject json, String name) {
        JsonElement element = json.get(name);
        return element == null || element.isJsonNull() ? null : element.getAsJsonObject();
    }

    private static String string(JsonObject json, String name) {
        JsonElement element = json.get(name);
        return element == null || element.isJsonNull() ? null : element.getAsString();
    }

    private static String requiredString(String flowId, JsonObject json, String name) throws FlowDecodeException {
        String value = string(json, name);
        if (value == null) {
            throw new FlowDecodeException(flowId, "Required field '" + name + "' missing for flow " + flowId);
        }
        return value;
    }

    private static JsonElement required(String flowId, JsonObject json, String name) throws FlowDecodeException {
        JsonElement element = json.get(name);
        if (element == null || element.isJsonNull()) {
            throw new FlowDecodeException(flowId, "Required field '" + name + "' missing for flow " + flowId);
        }
        return element;
    }

    private static Double nullableDouble(JsonObject json, String name) {
        JsonElement element = json.get(name);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        return primitive.getAsDouble();
    }
}
