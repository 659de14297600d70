/*
 * Copyright 2024 The Netty Project
 *
 * The Netty Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.netty.contrib.dnsrelay;

/**
 * The transports a DNS server address may name through its scheme, e.g. {@code tls://9.9.9.9}.
 */
public enum DnsTransport {
    DNS("dns", 53),
    TLS("tls", 853),
    GRPC("grpc", 443),
    HTTPS("https", 443),
    /**
     * DNS-over-QUIC. Port 8853 is the port early DoQ deployments settled on.
     */
    QUIC("quic", 8853),
    /**
     * DNS-over-QUIC carried over the SCION network.
     */
    SQUIC("squic", 8853);

    /**
     * The ALPN token of DNS over QUIC.
     */
    public static final String DOQ_ALPN = "doq";

    private final String scheme;
    private final int defaultPort;

    DnsTransport(String scheme, int defaultPort) {
        this.scheme = scheme;
        this.defaultPort = defaultPort;
    }

    public String scheme() {
        return scheme;
    }

    public int defaultPort() {
        return defaultPort;
    }

    /**
     * Returns {@code true} for the DNS-over-QUIC transports.
     */
    public boolean isQuic() {
        return this == QUIC || this == SQUIC;
    }

    /**
     * Returns the transport for the given scheme, or {@code null} if the scheme is unknown.
     */
    public static DnsTransport forScheme(String scheme) {
        for (DnsTransport transport : values()) {
            if (transport.scheme.equalsIgnoreCase(scheme)) {
                return transport;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return scheme;
    }
}
