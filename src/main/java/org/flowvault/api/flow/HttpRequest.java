package org.flowvault.api.flow;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Request half of an HTTP flow.
 *
 * @param host           Target host.
 * @param port           Target port.
 * @param method         Request method, e.g. {@code GET}.
 * @param scheme         {@code http} or {@code https}.
 * @param authority      Authority form from the request line or {@code :authority}, may be empty.
 * @param path           Request path including query string.
 * @param httpVersion    Protocol version, e.g. {@code HTTP/1.1}.
 * @param headers        Header fields in wire order.
 * @param content        Request body, or null if the body was streamed or not yet received.
 * @param timestampStart Epoch seconds of the first request byte.
 * @param timestampEnd   Epoch seconds of the last request byte, null while in progress.
 */
public record HttpRequest(String host,
                          int port,
                          String method,
                          String scheme,
                          String authority,
                          String path,
                          String httpVersion,
                          List<Header> headers,
                          byte[] content,
                          double timestampStart,
                          Double timestampEnd) {

    public HttpRequest {
        headers = List.copyOf(headers);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HttpRequest other)) {
            return false;
        }
        return port == other.port
            && Double.compare(timestampStart, other.timestampStart) == 0
            && Objects.equals(host, other.host)
            && Objects.equals(method, other.method)
            && Objects.equals(scheme, other.scheme)
            && Objects.equals(authority, other.authority)
            && Objects.equals(path, other.path)
            && Objects.equals(httpVersion, other.httpVersion)
            && Objects.equals(headers, other.headers)
            && Arrays.equals(content, other.content)
            && Objects.equals(timestampEnd, other.timestampEnd);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(host, port, method, scheme, authority, path, httpVersion, headers,
            timestampStart, timestampEnd);
        return 31 * result + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return method + " " + scheme + "://" + host + ":" + port + path;
    }
}
