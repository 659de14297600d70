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
package io.netty.contrib.dnsrelay.request;

import io.netty.contrib.dnsrelay.DnsProtocol;
import io.netty.contrib.dnsrelay.codec.DnsFraming;
import io.netty.contrib.dnsrelay.codec.EdnsOptions;
import io.netty.handler.codec.dns.DnsQuery;
import io.netty.handler.codec.dns.DnsQuestion;
import io.netty.handler.codec.dns.DnsSection;

import java.net.SocketAddress;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * A query received from a client, together with how it was received.
 * <p>
 * The request does not own the query; whoever created the request releases it.
 */
public final class DnsRequest {

    /**
     * The smallest UDP payload size every DNS client must accept.
     */
    public static final int MIN_UDP_SIZE = 512;

    private final DnsQuery query;
    private final DnsProtocol protocol;
    private final SocketAddress localAddress;
    private final SocketAddress remoteAddress;

    /**
     * @param protocol {@link DnsProtocol#UDP} if the client sent the query in a datagram (QUIC included),
     *                 {@link DnsProtocol#TCP} if it used a stream
     */
    public DnsRequest(DnsQuery query, DnsProtocol protocol, SocketAddress localAddress,
                      SocketAddress remoteAddress) {
        this.query = checkNotNull(query, "query");
        this.protocol = checkNotNull(protocol, "protocol");
        this.localAddress = localAddress;
        this.remoteAddress = remoteAddress;
    }

    public DnsQuery query() {
        return query;
    }

    public int id() {
        return query.id();
    }

    /**
     * The protocol the client used.
     */
    public DnsProtocol protocol() {
        return protocol;
    }

    public SocketAddress localAddress() {
        return localAddress;
    }

    public SocketAddress remoteAddress() {
        return remoteAddress;
    }

    /**
     * Returns the first question of the query, or {@code null}.
     */
    public DnsQuestion question() {
        if (query.count(DnsSection.QUESTION) == 0) {
            return null;
        }
        return query.recordAt(DnsSection.QUESTION, 0);
    }

    /**
     * Returns the largest response the client accepts: the maximum message size on streams,
     * otherwise the advertised EDNS(0) payload size but at least {@value #MIN_UDP_SIZE}.
     */
    public int size() {
        if (protocol.isStream()) {
            return DnsFraming.MAX_MESSAGE_SIZE;
        }
        int size = EdnsOptions.udpPayloadSize(query);
        return size < MIN_UDP_SIZE ? MIN_UDP_SIZE : size;
    }

    @Override
    public String toString() {
        return "DnsRequest(" + protocol + ", " + remoteAddress + ", " + query + ')';
    }
}
