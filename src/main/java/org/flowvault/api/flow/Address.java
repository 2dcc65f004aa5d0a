package org.flowvault.api.flow;

/**
 * A network endpoint.
 *
 * @param host Host name or IP literal.
 * @param port TCP/UDP port.
 */
public record Address(String host, int port) {

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
