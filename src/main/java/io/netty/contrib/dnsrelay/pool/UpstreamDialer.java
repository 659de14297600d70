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
package io.netty.contrib.dnsrelay.pool;

import io.netty.channel.Channel;
import io.netty.contrib.dnsrelay.DnsProtocol;
import io.netty.contrib.dnsrelay.UpstreamAddress;
import io.netty.handler.ssl.SslContext;
import io.netty.util.concurrent.Future;

/**
 * Opens new connections to an upstream server.
 * <p>
 * The pipeline of a dialed channel must end with an {@link UpstreamResponseHandler}, preceded by
 * whatever turns inbound traffic into one buffer per DNS message (without length prefix);
 * {@link UpstreamChannelInitializer} sets that up. For {@link DnsProtocol#QUIC} the dialed channel is
 * the {@link io.netty.incubator.codec.quic.QuicChannel}, and the same applies to the streams
 * {@link PooledConnection} opens on it.
 * <p>
 * Dialers resolve the transport address of an {@link UpstreamAddress}; SCION paths are plugged in by
 * overriding that step.
 */
public interface UpstreamDialer {

    /**
     * Connects to {@code address}.
     *
     * @param sslContext    the TLS context, only used with {@link DnsProtocol#TCP_TLS} and
     *                      {@link DnsProtocol#QUIC}
     * @param timeoutMillis the time the connection, handshakes included, may take to establish
     * @return a future that completes with the channel once it is ready to carry queries
     */
    Future<Channel> dial(UpstreamAddress address, DnsProtocol protocol, SslContext sslContext, long timeoutMillis);
}
