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

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.socket.DatagramPacket;
import io.netty.contrib.dnsrelay.codec.DnsMessageCodec;
import io.netty.contrib.dnsrelay.codec.WireDnsResponse;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

/**
 * Decodes responses arriving on an upstream connection and hands them to the exchange that
 * currently owns the connection.
 * <p>
 * A message whose header carries another ID than the one the exchange waits for is dropped without
 * being decoded. Accepted responses are {@link WireDnsResponse}s, so they are relayed with the bytes
 * the upstream sent.
 * <p>
 * Accepts {@link DatagramPacket}s and {@link ByteBuf}s, each holding exactly one message. Traffic
 * arriving while no exchange listens is dropped. Must only be touched from the channel's event loop.
 */
public final class UpstreamResponseHandler extends ChannelInboundHandlerAdapter {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(UpstreamResponseHandler.class);

    /**
     * Receives the events of the upstream connection, always on its event loop.
     */
    public interface Listener {

        /**
         * Returns the ID of the response the listener waits for.
         */
        int expectedId();

        /**
         * A response carrying the {@linkplain #expectedId() expected ID} was decoded. The listener
         * owns it.
         */
        void onResponse(DnsResponse response);

        /**
         * A message arrived but could not be decoded.
         */
        void onMalformedResponse(Throwable cause);

        /**
         * The channel reported an error.
         */
        void onError(Throwable cause);

        /**
         * The channel was closed, by the peer or locally.
         */
        void onClosed();
    }

    private Listener listener;

    /**
     * Sets the listener events are delivered to, or {@code null} to drop them.
     */
    public void listener(Listener listener) {
        this.listener = listener;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        final ByteBuf content;
        if (msg instanceof DatagramPacket) {
            content = ((DatagramPacket) msg).content();
        } else if (msg instanceof ByteBuf) {
            content = (ByteBuf) msg;
        } else {
            ctx.fireChannelRead(msg);
            return;
        }
        try {
            Listener listener = this.listener;
            if (listener == null) {
                logger.debug("{} Dropping {} bytes received while idle", ctx.channel(), content.readableBytes());
                return;
            }
            if (content.readableBytes() >= DnsMessageCodec.HEADER_LENGTH) {
                int id = content.getUnsignedShort(content.readerIndex());
                if (id != listener.expectedId()) {
                    logger.debug("{} Ignoring response with ID {}, expected {}",
                            ctx.channel(), id, listener.expectedId());
                    return;
                }
            }
            final DnsResponse response;
            try {
                response = DnsMessageCodec.decodeWireResponse(content);
            } catch (Exception e) {
                listener.onMalformedResponse(e);
                return;
            }
            listener.onResponse(response);
        } finally {
            ReferenceCountUtil.release(msg);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) throws Exception {
        Listener listener = this.listener;
        if (listener != null) {
            listener.onError(cause);
        } else {
            logger.debug("{} Closing idle upstream connection after an error", ctx.channel(), cause);
            ctx.close();
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        Listener listener = this.listener;
        if (listener != null) {
            listener.onClosed();
        }
        ctx.fireChannelInactive();
    }
}
