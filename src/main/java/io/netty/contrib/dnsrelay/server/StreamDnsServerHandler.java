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
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.contrib.dnsrelay.DnsProtocol;
import io.netty.contrib.dnsrelay.DnsTransport;
import io.netty.contrib.dnsrelay.RelayMetrics;
import io.netty.contrib.dnsrelay.codec.DnsFraming;
import io.netty.contrib.dnsrelay.codec.DnsMessageCodec;
import io.netty.contrib.dnsrelay.request.DnsRequest;
import io.netty.handler.codec.dns.DnsQuery;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Serves queries arriving on a TCP connection. Expects one buffer per message with the length prefix
 * already stripped, as produced by a {@link io.netty.handler.codec.LengthFieldBasedFrameDecoder}.
 * A connection may carry any number of queries; responses are written framed in the order they
 * complete.
 */
public class StreamDnsServerHandler extends SimpleChannelInboundHandler<ByteBuf> {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(StreamDnsServerHandler.class);

    private final DnsQueryHandler handler;
    private final RelayMetrics metrics;

    public StreamDnsServerHandler(DnsQueryHandler handler, RelayMetrics metrics) {
        this.handler = checkNotNull(handler, "handler");
        this.metrics = checkNotNull(metrics, "metrics");
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, ByteBuf msg) {
        final DnsQuery query;
        try {
            query = DnsMessageCodec.decodeQuery(msg);
        } catch (Exception e) {
            logger.debug("{} Closing connection after a malformed query", ctx.channel(), e);
            metrics.malformedExchangeDropped(DnsTransport.DNS);
            ctx.close();
            return;
        }
        DnsRequest request = new DnsRequest(
                query, DnsProtocol.TCP, ctx.channel().localAddress(), ctx.channel().remoteAddress());
        DnsServerContext serverContext =
                new DnsServerContext(DnsTransport.DNS, ctx.channel().localAddress(), ctx.executor());
        QueryDispatch.dispatch(handler, serverContext, request, new QueryDispatch.ResponseSink() {
            @Override
            public void send(DnsResponse response) {
                if (response != null) {
                    writeResponse(ctx, response);
                }
            }
        });
    }

    private static void writeResponse(ChannelHandlerContext ctx, DnsResponse response) {
        final ByteBuf framed;
        try {
            ByteBuf encoded = DnsMessageCodec.encode(ctx.alloc(), response);
            try {
                framed = DnsFraming.frame(ctx.alloc(), encoded);
            } finally {
                encoded.release();
            }
        } catch (Exception e) {
            logger.warn("{} Failed to encode response", ctx.channel(), e);
            return;
        }
        ctx.writeAndFlush(framed);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.debug("{} Closing connection after an error", ctx.channel(), cause);
        ctx.close();
    }
}
