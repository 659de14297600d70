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
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.contrib.dnsrelay.DnsProtocol;
import io.netty.contrib.dnsrelay.UpstreamAddress;
import io.netty.contrib.dnsrelay.codec.DnsFraming;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Sets up the pipeline of a connection to an upstream server.
 */
public class UpstreamChannelInitializer extends ChannelInitializer<Channel> {

    private final DnsProtocol protocol;
    private final UpstreamAddress address;
    private final SslContext sslContext;
    private final long handshakeTimeoutMillis;

    public UpstreamChannelInitializer(DnsProtocol protocol) {
        this(protocol, null, null, 0);
    }

    public UpstreamChannelInitializer(DnsProtocol protocol, UpstreamAddress address, SslContext sslContext,
                                      long handshakeTimeoutMillis) {
        this.protocol = checkNotNull(protocol, "protocol");
        if (protocol == DnsProtocol.TCP_TLS) {
            checkNotNull(sslContext, "sslContext");
            checkNotNull(address, "address");
        }
        this.address = address;
        this.sslContext = sslContext;
        this.handshakeTimeoutMillis = handshakeTimeoutMillis;
    }

    @Override
    protected void initChannel(Channel ch) throws Exception {
        ChannelPipeline p = ch.pipeline();
        if (protocol == DnsProtocol.TCP_TLS) {
            SslHandler sslHandler = sslContext.newHandler(ch.alloc(), address.host(), address.port());
            if (handshakeTimeoutMillis > 0) {
                sslHandler.setHandshakeTimeoutMillis(handshakeTimeoutMillis);
            }
            p.addLast(sslHandler);
        }
        if (protocol.isStream()) {
            p.addLast(new LengthFieldBasedFrameDecoder(DnsFraming.MAX_MESSAGE_SIZE + DnsFraming.LENGTH_FIELD_LENGTH,
                    0, DnsFraming.LENGTH_FIELD_LENGTH, 0, DnsFraming.LENGTH_FIELD_LENGTH));
        }
        p.addLast(new UpstreamResponseHandler());
    }
}
