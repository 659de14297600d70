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
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import io.netty.contrib.dnsrelay.CountingRelayMetrics;
import io.netty.contrib.dnsrelay.DnsProtocol;
import io.netty.contrib.dnsrelay.DnsTransport;
import io.netty.contrib.dnsrelay.TestMessages;
import io.netty.contrib.dnsrelay.codec.DnsFraming;
import io.netty.contrib.dnsrelay.codec.DnsMessageCodec;
import io.netty.contrib.dnsrelay.codec.EdnsOptions;
import io.netty.handler.codec.dns.DnsQuery;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.handler.codec.dns.DnsSection;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DoqStreamHandlerTest {

    private static final InetSocketAddress LOCAL = new InetSocketAddress("127.0.0.1", 8853);

    private final RecordingQueryHandler queryHandler = new RecordingQueryHandler();
    private final DnsBufferPool bufferPool = new DnsBufferPool(4);
    private final CountingRelayMetrics metrics = new CountingRelayMetrics();
    private boolean aborted;

    private EmbeddedChannel newChannel() {
        return new EmbeddedChannel(new DoqStreamHandler(
                queryHandler, DnsTransport.QUIC, LOCAL, bufferPool, metrics) {
            @Override
            protected void abortSession(ChannelHandlerContext ctx) {
                aborted = true;
                super.abortSession(ctx);
            }
        });
    }

    private static void finishInput(EmbeddedChannel ch) {
        ch.pipeline().fireUserEventTriggered(ChannelInputShutdownEvent.INSTANCE);
        ch.runPendingTasks();
    }

    @Test
    public void testAnswersAfterInputShutdown() {
        EmbeddedChannel ch = newChannel();
        ByteBuf frame = TestMessages.encodeFramed(TestMessages.query(321, "example.com."));
        ch.writeInbound(frame.readRetainedSlice(7));
        ch.writeInbound(frame);
        assertEquals(0, queryHandler.calls());
        assertTrue(ch.isOpen());

        finishInput(ch);
        assertEquals(1, queryHandler.calls());
        assertEquals(DnsProtocol.UDP, queryHandler.protocols.get(0));
        assertSame(DnsTransport.QUIC, queryHandler.contexts.get(0).transport());
        assertSame(LOCAL, queryHandler.contexts.get(0).localAddress());

        ByteBuf out = ch.readOutbound();
        assertNotNull(out);
        try {
            ByteBuf payload = DnsFraming.unframe(out);
            assertNotNull(payload);
            DnsResponse response = DnsMessageCodec.decodeResponse(payload);
            assertEquals(321, response.id());
            assertEquals(1, response.count(DnsSection.ANSWER));
            response.release();
        } finally {
            out.release();
        }
        assertFalse(ch.isOpen());
        assertEquals(1, bufferPool.available());
        assertEquals(0, metrics.malformedExchanges(DnsTransport.QUIC));
    }

    @Test
    public void testNoResponse() {
        queryHandler.respond = false;
        EmbeddedChannel ch = newChannel();
        ch.writeInbound(TestMessages.encodeFramed(TestMessages.query(1, "example.com.")));
        finishInput(ch);

        assertEquals(1, queryHandler.calls());
        assertNull(ch.readOutbound());
        assertFalse(ch.isOpen());
    }

    @Test
    public void testTooShortInputIsDropped() {
        EmbeddedChannel ch = newChannel();
        ch.writeInbound(Unpooled.wrappedBuffer(new byte[] { 0, 3, 1, 2, 3 }));
        finishInput(ch);

        assertEquals(0, queryHandler.calls());
        assertNull(ch.readOutbound());
        assertFalse(ch.isOpen());
        assertEquals(1, metrics.malformedExchanges(DnsTransport.QUIC));
        assertEquals(1, bufferPool.available());
    }

    @Test
    public void testEmptyStreamIsDropped() {
        EmbeddedChannel ch = newChannel();
        finishInput(ch);
        assertEquals(0, queryHandler.calls());
        assertFalse(ch.isOpen());
    }

    @Test
    public void testLengthMismatchIsDropped() {
        EmbeddedChannel ch = newChannel();
        ByteBuf frame = TestMessages.encodeFramed(TestMessages.query(1, "example.com."));
        frame.setShort(0, frame.readableBytes());
        ch.writeInbound(frame);
        finishInput(ch);

        assertEquals(0, queryHandler.calls());
        assertNull(ch.readOutbound());
        assertFalse(ch.isOpen());
        assertEquals(1, metrics.malformedExchanges(DnsTransport.QUIC));
    }

    @Test
    public void testUndecodableQueryIsDropped() {
        EmbeddedChannel ch = newChannel();
        // A response where a query is expected.
        ch.writeInbound(TestMessages.encodeFramed(TestMessages.response(1, "example.com.")));
        finishInput(ch);

        assertEquals(0, queryHandler.calls());
        assertNull(ch.readOutbound());
        assertFalse(ch.isOpen());
        assertEquals(1, metrics.malformedExchanges(DnsTransport.QUIC));
    }

    @Test
    public void testOversizedInputIsDropped() {
        EmbeddedChannel ch = newChannel();
        ch.writeInbound(Unpooled.buffer(DnsBufferPool.BUFFER_SIZE + 1).writeZero(DnsBufferPool.BUFFER_SIZE + 1));
        assertFalse(ch.isOpen());
        finishInput(ch);
        assertEquals(0, queryHandler.calls());
    }

    @Test
    public void testTcpKeepaliveAbortsSession() {
        EmbeddedChannel ch = newChannel();
        DnsQuery query = TestMessages.query(1, "example.com.");
        query.addRecord(DnsSection.ADDITIONAL, TestMessages.opt(1232, EdnsOptions.TCP_KEEPALIVE));
        ch.writeInbound(TestMessages.encodeFramed(query));
        finishInput(ch);

        assertTrue(aborted);
        assertEquals(0, queryHandler.calls());
        assertNull(ch.readOutbound());
    }

    @Test
    public void testOtherEdnsOptionsAreServed() {
        EmbeddedChannel ch = newChannel();
        DnsQuery query = TestMessages.query(1, "example.com.");
        query.addRecord(DnsSection.ADDITIONAL, TestMessages.opt(1232, 10));
        ch.writeInbound(TestMessages.encodeFramed(query));
        finishInput(ch);

        assertFalse(aborted);
        assertEquals(1, queryHandler.calls());
        ByteBuf out = ch.readOutbound();
        assertNotNull(out);
        out.release();
    }
}
