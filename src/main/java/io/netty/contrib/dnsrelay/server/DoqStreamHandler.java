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

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import io.netty.channel.socket.DuplexChannel;
import io.netty.contrib.dnsrelay.DnsProtocol;
import io.netty.contrib.dnsrelay.DnsTransport;
import io.netty.contrib.dnsrelay.RelayMetrics;
import io.netty.contrib.dnsrelay.codec.DnsFraming;
import io.netty.contrib.dnsrelay.codec.DnsMessageCodec;
import io.netty.contrib.dnsrelay.codec.EdnsOptions;
import io.netty.contrib.dnsrelay.request.DnsRequest;
import io.netty.handler.codec.dns.DnsQuery;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.incubator.codec.quic.QuicChannel;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.net.SocketAddress;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Serves the single query carried by one DNS over QUIC stream.
 * <p>
 * The query is collected into a pooled buffer until the client finishes its side of the stream,
 * then validated, decoded and handed to the {@link DnsQueryHandler}. The response, if any, is written
 * framed, after which the stream is finished and closed. Malformed exchanges are dropped without an
 * answer. A query carrying the EDNS TCP keepalive option aborts the whole QUIC connection.
 * <p>
 * The stream channel must run with {@link io.netty.channel.ChannelOption#ALLOW_HALF_CLOSURE} enabled.
 */
public class DoqStreamHandler extends ChannelInboundHandlerAdapter {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(DoqStreamHandler.class);

    /**
     * The DoQ error code for a peer violating the protocol.
     */
    public static final int DOQ_PROTOCOL_ERROR = 0x2;

    private final DnsQueryHandler handler;
    private final DnsTransport transport;
    private final SocketAddress localAddress;
    private final DnsBufferPool bufferPool;
    private final RelayMetrics metrics;

    private ByteBuf buffer;
    private boolean received;

    public DoqStreamHandler(DnsQueryHandler handler, DnsTransport transport, SocketAddress localAddress,
                            DnsBufferPool bufferPool, RelayMetrics metrics) {
        this.handler = checkNotNull(handler, "handler");
        this.transport = checkNotNull(transport, "transport");
        this.localAddress = localAddress;
        this.bufferPool = checkNotNull(bufferPool, "bufferPool");
        this.metrics = checkNotNull(metrics, "metrics");
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        buffer = bufferPool.acquire();
    }

    @Override
    public void handlerRemoved(ChannelHandlerContext ctx) {
        releaseBuffer();
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        try {
            if (received || buffer == null || !(msg instanceof ByteBuf)) {
                return;
            }
            ByteBuf in = (ByteBuf) msg;
            if (in.readableBytes() > buffer.writableBytes()) {
                logger.debug("{} Dropping oversized query", ctx.channel());
                drop(ctx);
                return;
            }
            buffer.writeBytes(in);
        } finally {
            ReferenceCountUtil.release(msg);
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt == ChannelInputShutdownEvent.INSTANCE) {
            if (!received && buffer != null) {
                received = true;
                processQuery(ctx);
            }
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    private void processQuery(ChannelHandlerContext ctx) {
        ByteBuf payload = DnsFraming.unframe(buffer);
        if (payload == null) {
            logger.debug("{} Dropping malformed query of {} bytes", ctx.channel(), buffer.readableBytes());
            drop(ctx);
            return;
        }

        final DnsQuery query;
        // Decoded records may keep slices of their input, which must outlive the pooled buffer.
        ByteBuf copy = ctx.alloc().buffer(payload.readableBytes()).writeBytes(payload);
        try {
            query = DnsMessageCodec.decodeQuery(copy);
        } catch (Exception e) {
            logger.debug("{} Dropping undecodable query", ctx.channel(), e);
            drop(ctx);
            return;
        } finally {
            copy.release();
            releaseBuffer();
        }

        if (EdnsOptions.containsOption(query, EdnsOptions.TCP_KEEPALIVE)) {
            query.release();
            logger.info("{} Aborting session: client sent the EDNS TCP keepalive option", ctx.channel());
            abortSession(ctx);
            return;
        }

        DnsRequest request = new DnsRequest(query, DnsProtocol.UDP, localAddress, clientAddress(ctx.channel()));
        DnsServerContext serverContext = new DnsServerContext(transport, localAddress, ctx.executor());
        final Channel ch = ctx.channel();
        QueryDispatch.dispatch(handler, serverContext, request, new QueryDispatch.ResponseSink() {
            @Override
            public void send(DnsResponse response) {
                if (response == null) {
                    finish(ch);
                    return;
                }
                writeResponse(ch, response);
            }
        });
    }

    private static void writeResponse(final Channel ch, DnsResponse response) {
        final ByteBuf framed;
        try {
            ByteBuf encoded = DnsMessageCodec.encode(ch.alloc(), response);
            try {
                framed = DnsFraming.frame(ch.alloc(), encoded);
            } finally {
                encoded.release();
            }
        } catch (Exception e) {
            logger.warn("{} Failed to encode response", ch, e);
            ch.close();
            return;
        }
        ch.writeAndFlush(framed).addListener(new ChannelFutureListener() {
            @Override
            public void operationComplete(ChannelFuture future) {
                if (future.isSuccess()) {
                    finish(ch);
                } else {
                    logger.debug("{} Failed to write response", ch, future.cause());
                    ch.close();
                }
            }
        });
    }

    private static void finish(Channel ch) {
        if (ch instanceof DuplexChannel && ch.isActive()) {
            ((DuplexChannel) ch).shutdownOutput().addListener(ChannelFutureListener.CLOSE);
        } else {
            ch.close();
        }
    }

    private void drop(ChannelHandlerContext ctx) {
        received = true;
        metrics.malformedExchangeDropped(transport);
        releaseBuffer();
        ctx.close();
    }

    private void releaseBuffer() {
        if (buffer != null) {
            bufferPool.release(buffer);
            buffer = null;
        }
    }

    private static SocketAddress clientAddress(Channel ch) {
        Channel parent = ch.parent();
        if (parent instanceof QuicChannel) {
            return ((QuicChannel) parent).remoteSocketAddress();
        }
        return ch.remoteAddress();
    }

    /**
     * Tears down the QUIC connection the stream belongs to, with {@link #DOQ_PROTOCOL_ERROR}.
     */
    protected void abortSession(ChannelHandlerContext ctx) {
        Channel parent = ctx.channel().parent();
        if (parent instanceof QuicChannel) {
            ((QuicChannel) parent).close(true, DOQ_PROTOCOL_ERROR, Unpooled.EMPTY_BUFFER);
        } else {
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.debug("{} Closing stream after an error", ctx.channel(), cause);
        releaseBuffer();
        ctx.close();
    }
}
