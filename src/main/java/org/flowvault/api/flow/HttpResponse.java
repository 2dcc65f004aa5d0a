package org.flowvault.api.flow;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Response half of an HTTP flow.
 *
 * @param httpVersion    Protocol version.
 * @param statusCode     Status code, e.g. 200.
 * @param reason         Reason phrase, may be empty.
 * @param headers        Header fields in wire order.
 * @param content        Response body, or null if the body was streamed or not yet received.
 * @param timestampStart Epoch seconds of the first response byte.
 * @param timestampEnd   Epoch seconds of the last response byte, null while in progress.
 */
public record HttpResponse(String httpVersion,
                           int statusCode,
                           String reason,
                           List<Header> headers,
                           byte[] content,
                           double timestampStart,
                           Double timestampEnd) {

    public HttpResponse {
        headers = List.copyOf(headers);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HttpResponse other)) {
            return false;
        }
        return statusCode == other.statusCode
            && Double.compare(timestampStart, other.timestampStart) == 0
            && Objects.equals(httpVersion, other.httpVersion)
            && Objects.equals(reason, other.reason)
            && Objects.equals(headers, other.headers)
            && Arrays.equals(content, other.content)
            && Objects.equals(timestampEnd, other.timestampEnd);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(httpVersion, statusCode, reason, headers, timestampStart, timestampEnd);
        return 31 * result + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return httpVersion + " " + statusCode + " " + reason;
    }
}
