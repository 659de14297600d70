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
package io.netty.contrib.dnsrelay.server;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.contrib.dnsrelay.DnsTransport;
import io.netty.contrib.dnsrelay.RelayMetrics;
import io.netty.incubator.codec.quic.InsecureQuicTokenHandler;
import io.netty.incubator.codec.quic.QuicServerCodecBuilder;
import io.netty.incubator.codec.quic.QuicSslContext;
import io.netty.incubator.codec.quic.QuicSslContextBuilder;
import io.netty.incubator.codec.quic.QuicStreamChannel;
import io.netty.incubator.codec.quic.QuicStreamType;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.internal.SystemPropertyUtil;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.io.Closeable;
import java.net.SocketAddress;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.concurrent.TimeUnit;

import static io.netty.util.internal.ObjectUtil.checkNotNull;
import static io.netty.util.internal.ObjectUtil.checkPositive;

/**
 * A DNS over QUIC server (RFC 9250): one query and one response per bidirectional stream.
 * <p>
 * The server moves from idle to listening on {@link #listen(SocketAddress)} and is done after
 * {@link #close()}. The packet channel comes from a {@link PacketChannelProvider}, so the same server
 * runs over plain UDP or any other packet network. TLS is mandatory.
 */
public final class DnsOverQuicServer implements Closeable {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(DnsOverQuicServer.class);

    /**
     * The ALPN token of DNS over QUIC.
     */
    public static final String ALPN = DnsTransport.DOQ_ALPN;

    static final long DEFAULT_IDLE_TIMEOUT_MILLIS =
            SystemPropertyUtil.getLong("io.netty.contrib.dnsrelay.quicIdleTimeoutMillis", 300000);

    // Flow control windows, large enough for a framed message of maximum size in each direction.
    private static final long STREAM_WINDOW = 2 * DnsBufferPool.BUFFER_SIZE;
    private static final long CONNECTION_WINDOW = 64 * STREAM_WINDOW;
    private static final long MAX_STREAMS = 256;

    private enum State {
        IDLE,
        LISTENING,
        CLOSED
    }

    private final QuicSslContext sslContext;
    private final long idleTimeoutMillis;
    private final DnsQueryHandler handler;
    private final PacketChannelProvider packetChannelProvider;
    private final EventLoopGroup group;
    private final EventExecutorGroup executorGroup;
    private final DnsBufferPool bufferPool;
    private final DnsTransport transport;
    private final RelayMetrics metrics;

    private State state = State.IDLE;
    private Channel channel;
    private volatile SocketAddress localAddress;

    DnsOverQuicServer(Builder builder) {
        sslContext = builder.sslContext;
        idleTimeoutMillis = builder.idleTimeoutMillis;
        handler = checkNotNull(builder.handler, "handler");
        packetChannelProvider = builder.packetChannelProvider;
        group = checkNotNull(builder.group, "group");
        executorGroup = builder.executorGroup;
        bufferPool = builder.bufferPool != null ? builder.bufferPool : new DnsBufferPool();
        transport = builder.transport;
        metrics = builder.metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    public DnsTransport transport() {
        return transport;
    }

    /**
     * The address the server is bound to, or {@code null} if it is not listening.
     */
    public SocketAddress localAddress() {
        return localAddress;
    }

    public long idleTimeoutMillis() {
        return idleTimeoutMillis;
    }

    /**
     * Binds the server.
     *
     * @throws IllegalStateException if no TLS context is configured, or the server already listens or
     *                               was closed
     */
    public synchronized ChannelFuture listen(final SocketAddress address) {
        checkNotNull(address, "address");
        if (sslContext == null) {
            throw new IllegalStateException("cannot run a QUIC server without TLS config");
        }
        if (state != State.IDLE) {
            throw new IllegalStateException("server is " + state.name().toLowerCase());
        }
        state = State.LISTENING;

        ChannelHandler codec = new QuicServerCodecBuilder()
                .sslContext(sslContext)
                .maxIdleTimeout(idleTimeoutMillis, TimeUnit.MILLISECONDS)
                .initialMaxData(CONNECTION_WINDOW)
                .initialMaxStreamDataBidirectionalLocal(STREAM_WINDOW)
                .initialMaxStreamDataBidirectionalRemote(STREAM_WINDOW)
                .initialMaxStreamsBidirectional(MAX_STREAMS)
                .tokenHandler(InsecureQuicTokenHandler.INSTANCE)
                .handler(DoqSessionHandler.INSTANCE)
                .streamOption(ChannelOption.ALLOW_HALF_CLOSURE, true)
                .streamHandler(new ChannelInitializer<QuicStreamChannel>() {
                    @Override
                    protected void initChannel(QuicStreamChannel ch) {
                        if (ch.type() != QuicStreamType.BIDIRECTIONAL || ch.isLocalCreated()) {
                            logger.debug("{} Closing stream not opened by the client as bidirectional", ch);
                            ch.close();
                            return;
                        }
                        DoqStreamHandler streamHandler =
                                new DoqStreamHandler(handler, transport, localAddress, bufferPool, metrics);
                        if (executorGroup != null) {
                            ch.pipeline().addLast(executorGroup, streamHandler);
                        } else {
                            ch.pipeline().addLast(streamHandler);
                        }
                    }
                })
                .build();

        ChannelFuture future = packetChannelProvider.bind(group, codec, address);
        channel = future.channel();
        future.addListener(new ChannelFutureListener() {
            @Override
            public void operationComplete(ChannelFuture future) {
                if (future.isSuccess()) {
                    localAddress = future.channel().localAddress();
                    logger.info("DNS over QUIC ({}) listening on {}", packetChannelProvider.name(), localAddress);
                } else {
                    logger.warn("Failed to bind DNS over QUIC server to {}", address, future.cause());
                }
            }
        });
        return future;
    }

    /**
     * Stops listening. Established sessions end with the packet channel.
     */
    @Override
    public synchronized void close() {
        if (state == State.CLOSED) {
            return;
        }
        state = State.CLOSED;
        localAddress = null;
        if (channel != null) {
            channel.close();
            channel = null;
            logger.info("DNS over QUIC server closed");
        }
        bufferPool.clear();
    }

    public static final class Builder {

        private QuicSslContext sslContext;
        private long idleTimeoutMillis = DEFAULT_IDLE_TIMEOUT_MILLIS;
        private DnsQueryHandler handler;
        private PacketChannelProvider packetChannelProvider = UdpPacketChannelProvider.INSTANCE;
        private EventLoopGroup group;
        private EventExecutorGroup executorGroup;
        private DnsBufferPool bufferPool;
        private DnsTransport transport = DnsTransport.QUIC;
        private RelayMetrics metrics = RelayMetrics.NOOP;

        Builder() {
        }

        /**
         * The TLS context. It must offer the {@value #ALPN} application protocol.
         */
        public Builder sslContext(QuicSslContext sslContext) {
            this.sslContext = sslContext;
            return this;
        }

        /**
         * Creates the TLS context from a key and its certificate chain.
         */
        public Builder sslContext(PrivateKey key, X509Certificate... certChain) {
            return sslContext(QuicSslContextBuilder.forServer(key, null, certChain)
                    .applicationProtocols(ALPN)
                    .build());
        }

        public Builder idleTimeout(long timeout, TimeUnit unit) {
            this.idleTimeoutMillis = unit.toMillis(checkPositive(timeout, "timeout"));
            return this;
        }

        public Builder handler(DnsQueryHandler handler) {
            this.handler = checkNotNull(handler, "handler");
            return this;
        }

        public Builder packetChannelProvider(PacketChannelProvider packetChannelProvider) {
            this.packetChannelProvider = checkNotNull(packetChannelProvider, "packetChannelProvider");
            return this;
        }

        public Builder group(EventLoopGroup group) {
            this.group = checkNotNull(group, "group");
            return this;
        }

        /**
         * Runs the stream handlers, and so the query handler, on {@code executorGroup} instead of the
         * I/O threads.
         */
        public Builder executorGroup(EventExecutorGroup executorGroup) {
            this.executorGroup = executorGroup;
            return this;
        }

        public Builder bufferPool(DnsBufferPool bufferPool) {
            this.bufferPool = checkNotNull(bufferPool, "bufferPool");
            return this;
        }

        /**
         * The transport reported to handlers, {@link DnsTransport#QUIC} or {@link DnsTransport#SQUIC}.
         */
        public Builder transport(DnsTransport transport) {
            checkNotNull(transport, "transport");
            if (!transport.isQuic()) {
                throw new IllegalArgumentException("transport: " + transport + " (expected: quic or squic)");
            }
            this.transport = transport;
            return this;
        }

        public Builder metrics(RelayMetrics metrics) {
            this.metrics = checkNotNull(metrics, "metrics");
            return this;
        }

        public DnsOverQuicServer build() {
            return new DnsOverQuicServer(this);
        }
    }
}
