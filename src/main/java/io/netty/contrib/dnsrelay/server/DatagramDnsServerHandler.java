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
import io.netty.channel.socket.DatagramPacket;
import io.netty.contrib.dnsrelay.DnsProtocol;
import io.netty.contrib.dnsrelay.DnsTransport;
import io.netty.contrib.dnsrelay.RelayMetrics;
import io.netty.contrib.dnsrelay.codec.DnsMessageCodec;
import io.netty.contrib.dnsrelay.codec.DnsResponses;
import io.netty.contrib.dnsrelay.request.DnsRequest;
import io.netty.handler.codec.dns.DnsQuery;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.net.InetSocketAddress;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Serves queries arriving as datagrams. A response larger than the client accepts is replaced by a
 * truncated one, so the client retries over TCP.
 */
public class DatagramDnsServerHandler extends SimpleChannelInboundHandler<DatagramPacket> {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(DatagramDnsServerHandler.class);

    private final DnsQueryHandler handler;
    private final RelayMetrics metrics;

    public DatagramDnsServerHandler(DnsQueryHandler handler, RelayMetrics metrics) {
        this.handler = checkNotNull(handler, "handler");
        this.metrics = checkNotNull(metrics, "metrics");
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, DatagramPacket packet) {
        final InetSocketAddress sender = packet.sender();
        final DnsQuery query;
        try {
            query = DnsMessageCodec.decodeQuery(packet.content());
        } catch (Exception e) {
            logger.debug("{} Dropping malformed query from {}", ctx.channel(), sender, e);
            metrics.malformedExchangeDropped(DnsTransport.DNS);
            return;
        }
        final DnsRequest request = new DnsRequest(query, DnsProtocol.UDP, packet.recipient(), sender);
        DnsServerContext serverContext =
                new DnsServerContext(DnsTransport.DNS, ctx.channel().localAddress(), ctx.executor());
        QueryDispatch.dispatch(handler, serverContext, request, new QueryDispatch.ResponseSink() {
            @Override
            public void send(DnsResponse response) {
                if (response != null) {
                    writeResponse(ctx, sender, request.size(), response);
                }
            }
        });
    }

    private static void writeResponse(ChannelHandlerContext ctx, InetSocketAddress recipient, int maxSize,
                                      DnsResponse response) {
        ByteBuf encoded;
        try {
            encoded = DnsMessageCodec.encode(ctx.alloc(), response);
            if (encoded.readableBytes() > maxSize) {
                encoded.release();
                DnsResponse truncated = DnsResponses.truncated(response);
                try {
                    encoded = DnsMessageCodec.encode(ctx.alloc(), truncated);
                } finally {
                    truncated.release();
                }
            }
        } catch (Exception e) {
            logger.warn("{} Failed to encode response to {}", ctx.channel(), recipient, e);
            return;
        }
        ctx.writeAndFlush(new DatagramPacket(encoded, recipient));
    }
}
