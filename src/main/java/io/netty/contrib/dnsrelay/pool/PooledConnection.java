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
import io.netty.channel.ChannelFuture;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.contrib.dnsrelay.DnsProtocol;
import io.netty.incubator.codec.quic.QuicChannel;
import io.netty.incubator.codec.quic.QuicStreamChannel;
import io.netty.incubator.codec.quic.QuicStreamType;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.Promise;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * A connection to an upstream server that can be reused by later queries.
 * <p>
 * A connection handed out by {@link UpstreamTransport#dial(DnsProtocol)} belongs to the caller until
 * it is either given back through {@link UpstreamTransport#yield(PooledConnection)} after a successful
 * exchange, or closed.
 * <p>
 * Every exchange runs on the channel returned by {@link #openExchange()}: the connection itself, or a
 * new bidirectional stream of a {@link DnsProtocol#QUIC} connection.
 */
public final class PooledConnection {

    private final Channel channel;
    private final DnsProtocol protocol;
    private volatile boolean cached;
    // Only accessed by the coordinator of the owning transport.
    private long idleSinceNanos;

    PooledConnection(Channel channel, DnsProtocol protocol) {
        this.channel = checkNotNull(channel, "channel");
        this.protocol = checkNotNull(protocol, "protocol");
        if (protocol == DnsProtocol.QUIC) {
            if (!(channel instanceof QuicChannel)) {
                throw new IllegalArgumentException("not a QUIC connection: " + channel);
            }
        } else {
            responseHandler(channel);
        }
    }

    public Channel channel() {
        return channel;
    }

    public DnsProtocol protocol() {
        return protocol;
    }

    /**
     * Returns the {@link UpstreamResponseHandler} of {@code ch}, a channel returned by
     * {@link #openExchange()}.
     */
    public static UpstreamResponseHandler responseHandler(Channel ch) {
        UpstreamResponseHandler handler = ch.pipeline().get(UpstreamResponseHandler.class);
        if (handler == null) {
            throw new IllegalArgumentException("no " + UpstreamResponseHandler.class.getSimpleName()
                    + " in the pipeline of " + ch);
        }
        return handler;
    }

    /**
     * Returns the channel that carries the next exchange. It belongs to the exchange; for QUIC it has
     * to be closed once the exchange is over.
     */
    public Future<Channel> openExchange() {
        if (protocol != DnsProtocol.QUIC) {
            return channel.eventLoop().newSucceededFuture(channel);
        }
        final Promise<Channel> promise = channel.eventLoop().newPromise();
        ((QuicChannel) channel).createStream(QuicStreamType.BIDIRECTIONAL, new UpstreamChannelInitializer(protocol))
                .addListener(new FutureListener<QuicStreamChannel>() {
                    @Override
                    public void operationComplete(Future<QuicStreamChannel> future) {
                        if (future.isSuccess()) {
                            promise.trySuccess(future.getNow());
                        } else {
                            promise.tryFailure(future.cause());
                        }
                    }
                });
        return promise;
    }

    /**
     * Returns {@code true} if this connection was taken from the idle cache rather than freshly dialed
     * for the current exchange.
     */
    public boolean isCached() {
        return cached;
    }

    void cached(boolean cached) {
        this.cached = cached;
    }

    long idleSinceNanos() {
        return idleSinceNanos;
    }

    void idleSinceNanos(long idleSinceNanos) {
        this.idleSinceNanos = idleSinceNanos;
    }

    public boolean isActive() {
        return channel.isActive();
    }

    /**
     * Sizes the receive buffer for the largest response the current client accepts. Only datagram
     * connections need this; streams are reassembled by length.
     */
    public void receiveBufferSize(int size) {
        if (protocol == DnsProtocol.UDP) {
            channel.config().setRecvByteBufAllocator(new FixedRecvByteBufAllocator(size));
        }
    }

    public ChannelFuture close() {
        return channel.close();
    }

    @Override
    public String toString() {
        return "PooledConnection(" + protocol + ", " + channel + (cached ? ", cached)" : ")");
    }
}
