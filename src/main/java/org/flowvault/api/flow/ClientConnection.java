package org.flowvault.api.flow;

import java.util.Arrays;
import java.util.Objects;

/**
 * Connection between the client and the proxy.
 *
 * @param id                Connection id assigned by the capture engine.
 * @param peername          Remote client address.
 * @param sockname          Local proxy address the client connected to.
 * @param tlsEstablished    Whether a TLS handshake completed.
 * @param sni               Server name indication sent by the client, may be null.
 * @param tlsVersion        Negotiated TLS version, may be null.
 * @param cipher            Negotiated cipher suite, may be null.
 * @param alpn              Negotiated ALPN protocol as raw bytes, may be null.
 * @param timestampStart    Epoch seconds when the connection was accepted.
 * @param timestampTlsSetup Epoch seconds when TLS was set up, may be null.
 * @param timestampEnd      Epoch seconds when the connection closed, may be null.
 */
public record ClientConnection(String id,
                               Address peername,
                               Address sockname,
                               boolean tlsEstablished,
                               String sni,
                               String tlsVersion,
                               String cipher,
                               byte[] alpn,
                               double timestampStart,
                               Double timestampTlsSetup,
                               Double timestampEnd) {

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ClientConnection other)) {
            return false;
        }
        return tlsEstablished == other.tlsEstablished
            && Double.compare(timestampStart, other.timestampStart) == 0
            && Objects.equals(id, other.id)
            && Objects.equals(peername, other.peername)
            && Objects.equals(sockname, other.sockname)
            && Objects.equals(sni, other.sni)
            && Objects.equals(tlsVersion, other.tlsVersion)
            && Objects.equals(cipher, other.cipher)
            && Arrays.equals(alpn, other.alpn)
            && Objects.equals(timestampTlsSetup, other.timestampTlsSetup)
            && Objects.equals(timestampEnd, other.timestampEnd);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, peername, sockname, tlsEstablished, sni, tlsVersion, cipher,
            timestampStart, timestampTlsSetup, timestampEnd);
        return 31 * result + Arrays.hashCode(alpn);
    }
}
