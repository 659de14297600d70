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
package io.netty.contrib.dnsrelay.proxy;

import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.EventLoop;
import io.netty.contrib.dnsrelay.DnsProtocol;
import io.netty.contrib.dnsrelay.codec.DnsFraming;
import io.netty.contrib.dnsrelay.codec.DnsMessageCodec;
import io.netty.contrib.dnsrelay.pool.PooledConnection;
import io.netty.contrib.dnsrelay.pool.UpstreamResponseHandler;
import io.netty.contrib.dnsrelay.request.DnsRequest;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.WriteTimeoutException;
import io.netty.incubator.codec.quic.QuicStreamChannel;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.ScheduledFuture;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.nio.channels.ClosedChannelException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * One query sent over one {@link PooledConnection}, from the write to the matching response.
 * <p>
 * The query goes out under a freshly generated ID, or ID 0 over QUIC, and only a response carrying
 * that ID is accepted; it is handed back with the client's ID. Every step runs on the event loop of
 * the connection. Over QUIC the exchange owns a stream of its own, which is finished after the query
 * and closed afterwards. The connection goes back to the idle cache only after a successful exchange and is closed on any
 * failure.
 */
final class UpstreamExchange implements UpstreamResponseHandler.Listener {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(UpstreamExchange.class);

    private final DnsProxy proxy;
    private final PooledConnection connection;
    private final DnsRequest request;
    private final Promise<DnsResponse> promise;
    private final long startNanos;

    private Channel ch;
    private UpstreamResponseHandler responseHandler;
    private int upstreamId;
    private ScheduledFuture<?> timeoutFuture;
    private boolean done;

    UpstreamExchange(DnsProxy proxy, PooledConnection connection, DnsRequest request,
                     Promise<DnsResponse> promise, long startNanos) {
        this.proxy = proxy;
        this.connection = connection;
        this.request = request;
        this.promise = promise;
        this.startNanos = startNanos;
    }

    void start() {
        EventLoop loop = connection.channel().eventLoop();
        if (loop.inEventLoop()) {
            start0();
        } else {
            loop.execute(new Runnable() {
                @Override
                public void run() {
                    start0();
                }
            });
        }
    }

    private void start0() {
        if (promise.isDone()) {
            // Cancelled before the exchange started, the connection is still clean.
            proxy.transport().yield(connection);
            return;
        }
        promise.addListener(new FutureListener<DnsResponse>() {
            @Override
            public void operationComplete(Future<DnsResponse> future) {
                if (future.isCancelled()) {
                    connection.channel().eventLoop().execute(new Runnable() {
                        @Override
                        public void run() {
                            abandon();
                        }
                    });
                }
            }
        });

        connection.openExchange().addListener(new FutureListener<Channel>() {
            @Override
            public void operationComplete(Future<Channel> future) {
                if (!future.isSuccess()) {
                    failAndClose(future.cause());
                    return;
                }
                if (done) {
                    // Abandoned while the stream was opening.
                    if (future.getNow() != connection.channel()) {
                        future.getNow().close();
                    }
                    return;
                }
                send(future.getNow());
            }
        });
    }

    private void send(Channel exchangeChannel) {
        ch = exchangeChannel;
        connection.receiveBufferSize(Math.max(request.size(), DnsRequest.MIN_UDP_SIZE));

        // DNS-over-QUIC requires ID 0; the stream already ties the response to the query.
        upstreamId = connection.protocol() == DnsProtocol.QUIC ? 0 : ThreadLocalRandom.current().nextInt(0x10000);
        final ByteBuf out;
        try {
            responseHandler = PooledConnection.responseHandler(ch);
            ByteBuf encoded = DnsMessageCodec.encode(ch.alloc(), request.query());
            // The client's query keeps its ID, only the copy on the wire carries the upstream ID.
            encoded.setShort(encoded.readerIndex(), upstreamId);
            if (connection.protocol().isStream()) {
                try {
                    out = DnsFraming.frame(ch.alloc(), encoded);
                } finally {
                    encoded.release();
                }
            } else {
                out = encoded;
            }
        } catch (Throwable cause) {
            // Nothing was written, the connection can be reused.
            done = true;
            closeStream();
            proxy.transport().yield(connection);
            promise.tryFailure(cause);
            return;
        }

        responseHandler.listener(this);
        timeoutFuture = ch.eventLoop().schedule(new Runnable() {
            @Override
            public void run() {
                failAndClose(WriteTimeoutException.INSTANCE);
            }
        }, proxy.writeTimeoutMillis(), TimeUnit.MILLISECONDS);

        ch.writeAndFlush(out).addListener(new ChannelFutureListener() {
            @Override
            public void operationComplete(ChannelFuture future) {
                if (done) {
                    return;
                }
                if (!future.isSuccess()) {
                    failAndClose(future.cause());
                    return;
                }
                if (future.channel() instanceof QuicStreamChannel) {
                    // The server answers once the query stream is finished.
                    ((QuicStreamChannel) future.channel()).shutdownOutput();
                }
                cancelTimeout();
                timeoutFuture = future.channel().eventLoop().schedule(new Runnable() {
                    @Override
                    public void run() {
                        failAndClose(ReadTimeoutException.INSTANCE);
                    }
                }, proxy.readTimeoutMillis(), TimeUnit.MILLISECONDS);
            }
        });
    }

    @Override
    public int expectedId() {
        return upstreamId;
    }

    @Override
    public void onResponse(DnsResponse response) {
        if (done || response.id() != upstreamId) {
            response.release();
            return;
        }
        done = true;
        cancelTimeout();
        responseHandler.listener(null);
        closeStream();
        response.setId(request.id());
        proxy.transport().yield(connection);
        proxy.metrics().requestCompleted(proxy.address(), response.code(), System.nanoTime() - startNanos);
        if (!promise.trySuccess(response)) {
            response.release();
        }
    }

    @Override
    public void onMalformedResponse(Throwable cause) {
        if (connection.protocol() == DnsProtocol.UDP) {
            // A forged or broken datagram, the real response may still arrive.
            logger.debug("{} Ignoring malformed datagram", ch, cause);
            return;
        }
        failAndClose(cause);
    }

    @Override
    public void onError(Throwable cause) {
        failAndClose(cause);
    }

    @Override
    public void onClosed() {
        failAndClose(new ClosedChannelException());
    }

    private void failAndClose(Throwable cause) {
        if (done) {
            return;
        }
        done = true;
        cancelTimeout();
        clearListener();
        connection.close();
        if (cause instanceof ClosedChannelException && connection.isCached()) {
            cause = new StaleConnectionException(cause);
        }
        logger.debug("{} Exchange with {} failed", ch != null ? ch : connection.channel(), proxy.address(), cause);
        promise.tryFailure(cause);
    }

    private void abandon() {
        if (done) {
            return;
        }
        done = true;
        cancelTimeout();
        clearListener();
        connection.close();
    }

    private void clearListener() {
        if (responseHandler != null) {
            responseHandler.listener(null);
        }
        closeStream();
    }

    private void closeStream() {
        if (ch != null && ch != connection.channel()) {
            ch.close();
        }
    }

    private void cancelTimeout() {
        if (timeoutFuture != null) {
            timeoutFuture.cancel(false);
            timeoutFuture = null;
        }
    }
}
