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

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.contrib.dnsrelay.DnsProtocol;
import io.netty.contrib.dnsrelay.UpstreamAddress;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.GenericFutureListener;
import io.netty.util.concurrent.Promise;

import java.net.InetSocketAddress;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Dials upstream servers over their IP endpoint with a {@link Bootstrap} on NIO channels.
 * <p>
 * Datagram channels are connected so that only traffic from the upstream reaches them. TLS channels
 * are reported ready once the handshake succeeded; the handshake has to finish within the dial timeout.
 * {@link DnsProtocol#QUIC} is not supported, see {@link QuicUpstreamDialer}.
 */
public class BootstrapUpstreamDialer implements UpstreamDialer {

    private final EventLoopGroup group;

    public BootstrapUpstreamDialer(EventLoopGroup group) {
        this.group = checkNotNull(group, "group");
    }

    @Override
    public Future<Channel> dial(UpstreamAddress address, DnsProtocol protocol, SslContext sslContext,
                                long timeoutMillis) {
        checkNotNull(address, "address");
        checkNotNull(protocol, "protocol");
        if (protocol == DnsProtocol.QUIC) {
            throw new IllegalArgumentException("cannot dial " + protocol + " with " + getClass().getSimpleName());
        }
        Bootstrap b = new Bootstrap().group(group);
        if (protocol == DnsProtocol.UDP) {
            b.channel(NioDatagramChannel.class);
        } else {
            b.channel(NioSocketChannel.class)
             .option(ChannelOption.TCP_NODELAY, true);
        }
        if (timeoutMillis > 0) {
            b.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeoutMillis, Integer.MAX_VALUE));
        }
        b.handler(newInitializer(address, protocol, sslContext, timeoutMillis));

        final boolean tls = protocol == DnsProtocol.TCP_TLS;
        ChannelFuture connectFuture = b.connect(remoteAddress(address));
        final Promise<Channel> ready = connectFuture.channel().eventLoop().newPromise();
        connectFuture.addListener(new ChannelFutureListener() {
            @Override
            public void operationComplete(ChannelFuture future) {
                if (!future.isSuccess()) {
                    ready.tryFailure(future.cause());
                    return;
                }
                final Channel ch = future.channel();
                if (!tls) {
                    ready.trySuccess(ch);
                    return;
                }
                SslHandler sslHandler = ch.pipeline().get(SslHandler.class);
                sslHandler.handshakeFuture().addListener(new GenericFutureListener<Future<Channel>>() {
                    @Override
                    public void operationComplete(Future<Channel> handshake) {
                        if (handshake.isSuccess()) {
                            ready.trySuccess(ch);
                        } else {
                            ch.close();
                            ready.tryFailure(handshake.cause());
                        }
                    }
                });
            }
        });
        return ready;
    }

    /**
     * Returns the handler installed on new channels.
     */
    protected UpstreamChannelInitializer newInitializer(UpstreamAddress address, DnsProtocol protocol,
                                                        SslContext sslContext, long handshakeTimeoutMillis) {
        return new UpstreamChannelInitializer(protocol, address, sslContext, handshakeTimeoutMillis);
    }

    /**
     * Returns the endpoint to connect to, resolved by the bootstrap. SCION addresses map to their IP
     * endpoint.
     */
    protected InetSocketAddress remoteAddress(UpstreamAddress address) {
        return address.socketAddress();
    }
}
