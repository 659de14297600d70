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

import java.net.InetSocketAddress;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.netty.util.internal.ObjectUtil.checkNonEmpty;

/**
 * The address of an upstream DNS server as written in configuration.
 * <p>
 * Accepted forms:
 * <ul>
 *     <li>{@code host}, {@code host:port}, {@code [v6]:port} or a bare IPv6 literal</li>
 *     <li>any of the above prefixed by a scheme, e.g. {@code tls://1.1.1.1} or {@code dns://8.8.8.8:5353}</li>
 *     <li>a SCION address {@code ISD-AS,IP:port} or {@code ISD-AS,[IP]:port}, optionally prefixed by a scheme</li>
 * </ul>
 * A missing port defaults to the port of the scheme, or 53 without a scheme.
 */
public final class UpstreamAddress {

    private static final String SCHEME_SEPARATOR = "://";
    private static final Pattern SCION_ADDRESS = Pattern.compile(
            "^(\\d+-[0-9a-fA-F_:]+),\\[?([^\\[\\]]+?)\\]?:(\\d+)$");

    private final String text;
    private final DnsTransport transport;
    private final String isdAs;
    private final String host;
    private final int port;

    private UpstreamAddress(String text, DnsTransport transport, String isdAs, String host, int port) {
        this.text = text;
        this.transport = transport;
        this.isdAs = isdAs;
        this.host = host;
        this.port = port;
    }

    /**
     * Parses an upstream address.
     *
     * @throws IllegalArgumentException if the scheme is unknown or the port is not a valid port number
     */
    public static UpstreamAddress parse(String address) {
        checkNonEmpty(address, "address");
        String rest = address.trim();
        DnsTransport transport = null;
        int idx = rest.indexOf(SCHEME_SEPARATOR);
        if (idx >= 0) {
            String scheme = rest.substring(0, idx);
            transport = DnsTransport.forScheme(scheme);
            if (transport == null) {
                throw new IllegalArgumentException("unknown scheme '" + scheme + "' in " + address);
            }
            rest = rest.substring(idx + SCHEME_SEPARATOR.length());
        }
        int defaultPort = transport == null ? DnsTransport.DNS.defaultPort() : transport.defaultPort();

        Matcher scion = SCION_ADDRESS.matcher(rest);
        if (scion.matches()) {
            return new UpstreamAddress(address, transport, scion.group(1), scion.group(2),
                    parsePort(scion.group(3), address));
        }

        String host;
        int port = defaultPort;
        if (rest.startsWith("[")) {
            int end = rest.indexOf(']');
            if (end < 0) {
                throw new IllegalArgumentException("unterminated IPv6 literal in " + address);
            }
            host = rest.substring(1, end);
            String tail = rest.substring(end + 1);
            if (tail.startsWith(":")) {
                port = parsePort(tail.substring(1), address);
            } else if (!tail.isEmpty()) {
                throw new IllegalArgumentException("unexpected characters after IPv6 literal in " + address);
            }
        } else {
            int colon = rest.indexOf(':');
            if (colon >= 0 && colon == rest.lastIndexOf(':')) {
                host = rest.substring(0, colon);
                port = parsePort(rest.substring(colon + 1), address);
            } else {
                // No colon at all, or a bare IPv6 literal.
                host = rest;
            }
        }
        if (host.isEmpty()) {
            throw new IllegalArgumentException("missing host in " + address);
        }
        return new UpstreamAddress(address, transport, null, host, port);
    }

    private static int parsePort(String port, String address) {
        try {
            int value = Integer.parseInt(port);
            if (value > 0 && value <= 0xFFFF) {
                return value;
            }
        } catch (NumberFormatException ignore) {
            // reported below
        }
        throw new IllegalArgumentException("invalid port '" + port + "' in " + address);
    }

    /**
     * Returns the transport named by the scheme, or {@code null} if the address carries no scheme.
     */
    public DnsTransport transport() {
        return transport;
    }

    /**
     * Returns {@code true} if this is a SCION address.
     */
    public boolean isScion() {
        return isdAs != null;
    }

    /**
     * Returns the ISD-AS part of a SCION address, or {@code null}.
     */
    public String isdAs() {
        return isdAs;
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    /**
     * Returns the IP endpoint of this address. The host is left unresolved so it is resolved
     * when connecting.
     */
    public InetSocketAddress socketAddress() {
        return InetSocketAddress.createUnresolved(host, port);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UpstreamAddress)) {
            return false;
        }
        return text.equals(((UpstreamAddress) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
