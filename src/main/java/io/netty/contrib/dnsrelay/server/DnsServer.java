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

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.contrib.dnsrelay.RelayMetrics;
import io.netty.contrib.dnsrelay.codec.DnsFraming;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.Promise;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.io.Closeable;
import java.net.InetSocketAddress;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * A plain DNS server listening on UDP and TCP on the same address.
 */
public final class DnsServer implements Closeable {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(DnsServer.class);

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final DnsQueryHandler handler;
    private final RelayMetrics metrics;

    private Channel udpChannel;
    private Channel tcpChannel;
    private boolean closed;

    public DnsServer(EventLoopGroup group, DnsQueryHandler handler) {
        this(group, group, handler, RelayMetrics.NOOP);
    }

    public DnsServer(EventLoopGroup bossGroup, EventLoopGroup workerGroup, DnsQueryHandler handler,
                     RelayMetrics metrics) {
        this.bossGroup = checkNotNull(bossGroup, "bossGroup");
        this.workerGroup = checkNotNull(workerGroup, "workerGroup");
        this.handler = checkNotNull(handler, "handler");
        this.metrics = checkNotNull(metrics, "metrics");
    }

    /**
     * Binds UDP to {@code address}, then TCP to the same address and port. With port {@code 0} the
     * TCP socket uses the port the UDP socket was given.
     */
    public synchronized Future<Void> bind(final InetSocketAddress address) {
        checkNotNull(address, "address");
        if (closed || udpChannel != null) {
            throw new IllegalStateException("server already bound or closed");
        }
        final Promise<Void> promise = workerGroup.next().newPromise();
        ChannelFuture udpFuture = new Bootstrap()
                .group(workerGroup)
                .channel(NioDatagramChannel.class)
                .handler(new DatagramDnsServerHandler(handler, metrics))
                .bind(address);
        udpChannel = udpFuture.channel();
        udpFuture.addListener(new ChannelFutureListener() {
            @Override
            public void operationComplete(ChannelFuture future) {
                if (!future.isSuccess()) {
                    promise.tryFailure(future.cause());
                    return;
                }
                InetSocketAddress bound = (InetSocketAddress) future.channel().localAddress();
                bindTcp(new InetSocketAddress(address.getAddress(), bound.getPort()), promise);
            }
        });
        promise.addListener(new FutureListener<Void>() {
            @Override
            public void operationComplete(Future<Void> future) {
                if (future.isSuccess()) {
                    logger.info("DNS server listening on {}", localAddress());
                } else {
                    logger.warn("Failed to bind DNS server to {}", address, future.cause());
                    close();
                }
            }
        });
        return promise;
    }

    private synchronized void bindTcp(InetSocketAddress address, final Promise<Void> promise) {
        if (closed) {
            promise.tryFailure(new IllegalStateException("server closed"));
            return;
        }
        ChannelFuture tcpFuture = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new LengthFieldBasedFrameDecoder(
                                DnsFraming.MAX_MESSAGE_SIZE + DnsFraming.LENGTH_FIELD_LENGTH,
                                0, DnsFraming.LENGTH_FIELD_LENGTH, 0, DnsFraming.LENGTH_FIELD_LENGTH));
                        p.addLast(new StreamDnsServerHandler(handler, metrics));
                    }
                })
                .bind(address);
        tcpChannel = tcpFuture.channel();
        tcpFuture.addListener(new ChannelFutureListener() {
            @Override
            public void operationComplete(ChannelFuture future) {
                if (future.isSuccess()) {
                    promise.trySuccess(null);
                } else {
                    promise.tryFailure(future.cause());
                }
            }
        });
    }

    /**
     * Returns the address the UDP socket is bound to, or {@code null}.
     */
    public synchronized InetSocketAddress localAddress() {
        return udpChannel != null ? (InetSocketAddress) udpChannel.localAddress() : null;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (udpChannel != null) {
            udpChannel.close();
        }
        if (tcpChannel != null) {
            tcpChannel.close();
        }
    }
}
