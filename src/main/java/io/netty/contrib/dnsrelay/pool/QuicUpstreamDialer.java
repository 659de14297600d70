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
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ConnectTimeoutException;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.contrib.dnsrelay.DnsProtocol;
import io.netty.contrib.dnsrelay.UpstreamAddress;
import io.netty.contrib.dnsrelay.codec.DnsFraming;
import io.netty.handler.ssl.SslContext;
import io.netty.incubator.codec.quic.QuicChannel;
import io.netty.incubator.codec.quic.QuicClientCodecBuilder;
import io.netty.incubator.codec.quic.QuicSslContext;
import io.netty.incubator.codec.quic.QuicStreamChannel;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.ScheduledFuture;
import io.netty.util.internal.SystemPropertyUtil;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

import static io.netty.util.internal.ObjectUtil.checkNotNull;
import static io.netty.util.internal.ObjectUtil.checkPositive;

/**
 * Dials DNS-over-QUIC upstream servers (RFC 9250).
 * <p>
 * Every dial binds its own datagram channel, connected to the upstream, and completes with the
 * {@link QuicChannel} once the QUIC handshake succeeded. The datagram channel is closed with the QUIC
 * connection. Queries are not sent on the connection itself; {@link PooledConnection#openExchange()}
 * opens one bidirectional stream per query. Streams opened by the server are refused.
 * <p>
 * The TLS context has to be a {@link QuicSslContext} offering the {@code doq} application protocol.
 */
public class QuicUpstreamDialer implements UpstreamDialer {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(QuicUpstreamDialer.class);

    static final long DEFAULT_MAX_IDLE_TIMEOUT_MILLIS =
            SystemPropertyUtil.getLong("io.netty.contrib.dnsrelay.upstreamQuicIdleTimeoutMillis", 30000);

    // Enough for a framed message of maximum size in each direction.
    private static final long STREAM_WINDOW = 2 * (DnsFraming.LENGTH_FIELD_LENGTH + DnsFraming.MAX_MESSAGE_SIZE);
    private static final long CONNECTION_WINDOW = 64 * STREAM_WINDOW;

    private static final ChannelHandler REFUSE_PEER_STREAMS = new ChannelInitializer<QuicStreamChannel>() {
        @Override
        protected void initChannel(QuicStreamChannel ch) {
            logger.debug("{} Closing stream opened by the upstream", ch);
            ch.close();
        }
    };

    private final EventLoopGroup group;
    private final long maxIdleTimeoutMillis;

    public QuicUpstreamDialer(EventLoopGroup group) {
        this(group, DEFAULT_MAX_IDLE_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
    }

    /**
     * @param maxIdleTimeout the QUIC idle timeout announced to the upstream
     */
    public QuicUpstreamDialer(EventLoopGroup group, long maxIdleTimeout, TimeUnit unit) {
        this.group = checkNotNull(group, "group");
        this.maxIdleTimeoutMillis = unit.toMillis(checkPositive(maxIdleTimeout, "maxIdleTimeout"));
    }

    @Override
    public Future<Channel> dial(final UpstreamAddress address, DnsProtocol protocol, SslContext sslContext,
                                final long timeoutMillis) {
        checkNotNull(address, "address");
        checkNotNull(protocol, "protocol");
        if (protocol != DnsProtocol.QUIC) {
            throw new IllegalArgumentException("cannot dial " + protocol + " with " + getClass().getSimpleName());
        }
        if (!(sslContext instanceof QuicSslContext)) {
            throw new IllegalArgumentException("sslContext: " + sslContext + " (expected: QuicSslContext)");
        }
        ChannelHandler codec = new QuicClientCodecBuilder()
                .sslContext((QuicSslContext) sslContext)
                .maxIdleTimeout(maxIdleTimeoutMillis, TimeUnit.MILLISECONDS)
                .initialMaxData(CONNECTION_WINDOW)
                .initialMaxStreamDataBidirectionalLocal(STREAM_WINDOW)
                .build();

        ChannelFuture connectFuture = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .handler(codec)
                .connect(remoteAddress(address));
        final Channel udp = connectFuture.channel();
        final Promise<Channel> ready = udp.eventLoop().newPromise();
        connectFuture.addListener(new ChannelFutureListener() {
            @Override
            public void operationComplete(ChannelFuture future) {
                if (future.isSuccess()) {
                    handshake(udp, address, timeoutMillis, ready);
                } else {
                    ready.tryFailure(future.cause());
                }
            }
        });
        return ready;
    }

    private static void handshake(final Channel udp, final UpstreamAddress address, final long timeoutMillis,
                                  final Promise<Channel> ready) {
        final ScheduledFuture<?> timeoutFuture;
        if (timeoutMillis > 0) {
            timeoutFuture = udp.eventLoop().schedule(new Runnable() {
                @Override
                public void run() {
                    if (ready.tryFailure(new ConnectTimeoutException(
                            "QUIC handshake with " + address + " timed out after " + timeoutMillis + " ms"))) {
                        udp.close();
                    }
                }
            }, timeoutMillis, TimeUnit.MILLISECONDS);
        } else {
            timeoutFuture = null;
        }

        QuicChannel.newBootstrap(udp)
                .streamHandler(REFUSE_PEER_STREAMS)
                .remoteAddress(udp.remoteAddress())
                .connect()
                .addListener(new FutureListener<QuicChannel>() {
                    @Override
                    public void operationComplete(Future<QuicChannel> future) {
                        if (timeoutFuture != null) {
                            timeoutFuture.cancel(false);
                        }
                        if (!future.isSuccess()) {
                            udp.close();
                            ready.tryFailure(future.cause());
                            return;
                        }
                        QuicChannel quic = future.getNow();
                        quic.closeFuture().addListener(new ChannelFutureListener() {
                            @Override
                            public void operationComplete(ChannelFuture closed) {
                                udp.close();
                            }
                        });
                        if (!ready.trySuccess(quic)) {
                            quic.close();
                        }
                    }
                });
    }

    /**
     * Returns the endpoint to connect to, resolved by the bootstrap. SCION addresses map to their IP
     * endpoint; a SCION-capable packet channel plugs in here.
     */
    protected InetSocketAddress remoteAddress(UpstreamAddress address) {
        return address.socketAddress();
    }
}
