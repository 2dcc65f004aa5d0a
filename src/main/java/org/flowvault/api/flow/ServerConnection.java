package org.flowvault.api.flow;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Connection between the proxy and the upstream server.
 *
 * @param id                Connection id assigned by the capture engine.
 * @param address           Upstream address the proxy was asked to connect to.
 * @param peername          Resolved remote address, may be null if never connected.
 * @param sockname          Local address of the upstream socket, may be null.
 * @param tlsEstablished    Whether a TLS handshake completed.
 * @param sni               Server name indication sent upstream, may be null.
 * @param tlsVersion        Negotiated TLS version, may be null.
 * @param alpn              Negotiated ALPN protocol as raw bytes, may be null.
 * @param certificateList   Server certificate chain in DER encoding, leaf first.
 * @param timestampStart    Epoch seconds when the connection attempt started, may be null.
 * @param timestampTcpSetup Epoch seconds when TCP was established, may be null.
 * @param timestampTlsSetup Epoch seconds when TLS was established, may be null.
 * @param timestampEnd      Epoch seconds when the connection closed, may be null.
 */
public record ServerConnection(String id,
                               Address address,
                               Address peername,
                               Address sockname,
                               boolean tlsEstablished,
                               String sni,
                               String tlsVersion,
                               byte[] alpn,
                               List<byte[]> certificateList,
                               Double timestampStart,
                               Double timestampTcpSetup,
                               Double timestampTlsSetup,
                               Double timestampEnd) {

    public ServerConnection {
        certificateList = List.copyOf(certificateList);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ServerConnection other)) {
            return false;
        }
        return tlsEstablished == other.tlsEstablished
            && Objects.equals(id, other.id)
            && Objects.equals(address, other.address)
            && Objects.equals(peername, other.peername)
            && Objects.equals(sockname, other.sockname)
            && Objects.equals(sni, other.sni)
            && Objects.equals(tlsVersion, other.tlsVersion)
            && Arrays.equals(alpn, other.alpn)
            && certificatesEqual(certificateList, other.certificateList)
            && Objects.equals(timestampStart, other.timestampStart)
            && Objects.equals(timestampTcpSetup, other.timestampTcpSetup)
            && Objects.equals(timestampTlsSetup, other.timestampTlsSetup)
            && Objects.equals(timestampEnd, other.timestampEnd);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, address, peername, sockname, tlsEstablished, sni, tlsVersion,
            timestampStart, timestampTcpSetup, timestampTlsSetup, timestampEnd);
        result = 31 * result + Arrays.hashCode(alpn);
        for (byte[] cert : certificateList) {
            result = 31 * result + Arrays.hashCode(cert);
        }
        return result;
    }

    private static boolean certificatesEqual(List<byte[]> a, List<byte[]> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!Arrays.equals(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }
}
