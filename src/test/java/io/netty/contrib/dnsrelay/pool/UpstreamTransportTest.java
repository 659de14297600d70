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

import io.netty.contrib.dnsrelay.CountingRelayMetrics;
import io.netty.contrib.dnsrelay.DnsProtocol;
import io.netty.contrib.dnsrelay.UpstreamAddress;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.incubator.codec.quic.Quic;
import io.netty.incubator.codec.quic.QuicSslContextBuilder;
import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.ImmediateEventExecutor;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class UpstreamTransportTest {

    private static final UpstreamAddress ADDRESS = UpstreamAddress.parse("192.0.2.53:53");

    private final EmbeddedUpstreamDialer dialer = new EmbeddedUpstreamDialer();
    private final CountingRelayMetrics metrics = new CountingRelayMetrics();

    private UpstreamTransport newTransport(SslContext sslContext, long expireNanos, int maxIdle,
                                           EventExecutor coordinator) {
        return new UpstreamTransport(ADDRESS, dialer, sslContext, coordinator,
                new AdaptiveDialTimeout(1, 30, TimeUnit.SECONDS, 4), expireNanos, maxIdle, metrics);
    }

    private UpstreamTransport newTransport() {
        return newTransport(null, TimeUnit.SECONDS.toNanos(10), 16, ImmediateEventExecutor.INSTANCE);
    }

    private static PooledConnection dial(UpstreamTransport transport, DnsProtocol protocol) {
        Future<PooledConnection> future = transport.dial(protocol);
        assertTrue(future.isSuccess(), String.valueOf(future.cause()));
        return future.getNow();
    }

    @Test
    public void testMissThenHit() {
        UpstreamTransport transport = newTransport();
        PooledConnection first = dial(transport, DnsProtocol.UDP);
        assertFalse(first.isCached());
        assertEquals(DnsProtocol.UDP, first.protocol());
        assertEquals(1, metrics.cacheMisses(ADDRESS, DnsProtocol.UDP));

        transport.yield(first);
        assertEquals(1, transport.idleCount(DnsProtocol.UDP));

        PooledConnection second = dial(transport, DnsProtocol.UDP);
        assertSame(first, second);
        assertTrue(second.isCached());
        assertEquals(1, metrics.cacheHits(ADDRESS, DnsProtocol.UDP));
        assertEquals(1, dialer.dials());
        assertEquals(0, transport.idleCount(DnsProtocol.UDP));
    }

    @Test
    public void testIdleConnectionsArePerProtocol() {
        UpstreamTransport transport = newTransport();
        transport.yield(dial(transport, DnsProtocol.UDP));

        PooledConnection tcp = dial(transport, DnsProtocol.TCP);
        assertFalse(tcp.isCached());
        assertEquals(DnsProtocol.TCP, tcp.protocol());
        assertEquals(2, dialer.dials());
        assertEquals(1, transport.idleCount(DnsProtocol.UDP));
    }

    @Test
    public void testMostRecentlyUsedFirst() {
        UpstreamTransport transport = newTransport();
        PooledConnection a = dial(transport, DnsProtocol.TCP);
        PooledConnection b = dial(transport, DnsProtocol.TCP);
        transport.yield(a);
        transport.yield(b);
        assertSame(b, dial(transport, DnsProtocol.TCP));
        assertSame(a, dial(transport, DnsProtocol.TCP));
    }

    @Test
    public void testTlsIsForced() throws Exception {
        SslContext sslContext = SslContextBuilder.forClient().build();
        UpstreamTransport transport = newTransport(
                sslContext, TimeUnit.SECONDS.toNanos(10), 16, ImmediateEventExecutor.INSTANCE);
        assertTrue(transport.isSecure());
        PooledConnection connection = dial(transport, DnsProtocol.UDP);
        assertEquals(DnsProtocol.TCP_TLS, connection.protocol());
        assertEquals(DnsProtocol.TCP_TLS, dialer.protocol(0));
    }

    @Test
    public void testQuicContextSelectsQuic() {
        assumeTrue(Quic.isAvailable());
        SslContext sslContext = QuicSslContextBuilder.forClient().applicationProtocols("doq").build();
        UpstreamTransport transport = newTransport(
                sslContext, TimeUnit.SECONDS.toNanos(10), 16, ImmediateEventExecutor.INSTANCE);
        assertTrue(transport.isSecure());
        assertEquals(DnsProtocol.QUIC, transport.effectiveProtocol(DnsProtocol.UDP));
        assertEquals(DnsProtocol.QUIC, transport.effectiveProtocol(DnsProtocol.TCP));

        // A QUIC dial must yield a QUIC connection.
        Future<PooledConnection> future = transport.dial(DnsProtocol.UDP);
        assertEquals(DnsProtocol.QUIC, dialer.protocol(0));
        assertInstanceOf(IllegalArgumentException.class, future.cause());
        assertFalse(dialer.last().isOpen());
    }

    @Test
    public void testClosedIdleConnectionIsSkipped() {
        UpstreamTransport transport = newTransport();
        PooledConnection first = dial(transport, DnsProtocol.TCP);
        transport.yield(first);
        first.channel().close();

        PooledConnection second = dial(transport, DnsProtocol.TCP);
        assertNotSame(first, second);
        assertFalse(second.isCached());
        assertEquals(2, dialer.dials());
    }

    @Test
    public void testYieldingClosedConnectionDiscardsIt() {
        UpstreamTransport transport = newTransport();
        PooledConnection connection = dial(transport, DnsProtocol.TCP);
        connection.channel().close();
        transport.yield(connection);
        assertEquals(0, transport.idleCount(DnsProtocol.TCP));
    }

    @Test
    public void testExpiredConnectionIsNotReused() throws Exception {
        UpstreamTransport transport = newTransport(
                null, TimeUnit.MILLISECONDS.toNanos(1), 16, ImmediateEventExecutor.INSTANCE);
        PooledConnection first = dial(transport, DnsProtocol.UDP);
        transport.yield(first);
        Thread.sleep(10);

        PooledConnection second = dial(transport, DnsProtocol.UDP);
        assertNotSame(first, second);
        assertFalse(first.isActive());
    }

    @Test
    public void testCleanupClosesExpiredConnections() {
        UpstreamTransport transport = newTransport();
        PooledConnection a = dial(transport, DnsProtocol.UDP);
        PooledConnection b = dial(transport, DnsProtocol.TCP);
        transport.yield(a);
        transport.yield(b);

        transport.expireIdle(System.nanoTime());
        assertEquals(1, transport.idleCount(DnsProtocol.UDP));

        transport.expireIdle(System.nanoTime() + TimeUnit.SECONDS.toNanos(11));
        assertEquals(0, transport.idleCount(DnsProtocol.UDP));
        assertEquals(0, transport.idleCount(DnsProtocol.TCP));
        assertFalse(a.isActive());
        assertFalse(b.isActive());
    }

    @Test
    public void testIdleConnectionsAreBounded() {
        UpstreamTransport transport = newTransport(
                null, TimeUnit.SECONDS.toNanos(10), 2, ImmediateEventExecutor.INSTANCE);
        PooledConnection a = dial(transport, DnsProtocol.UDP);
        PooledConnection b = dial(transport, DnsProtocol.UDP);
        PooledConnection c = dial(transport, DnsProtocol.UDP);
        transport.yield(a);
        transport.yield(b);
        transport.yield(c);

        assertEquals(2, transport.idleCount(DnsProtocol.UDP));
        assertFalse(a.isActive());
        assertTrue(b.isActive());
        assertTrue(c.isActive());
    }

    @Test
    public void testDialFailure() {
        UpstreamTransport transport = newTransport();
        ConnectException cause = new ConnectException("refused");
        dialer.fail(cause);
        Future<PooledConnection> future = transport.dial(DnsProtocol.TCP);
        assertSame(cause, future.cause());
        assertEquals(1, metrics.cacheMisses(ADDRESS, DnsProtocol.TCP));
    }

    @Test
    public void testClose() {
        UpstreamTransport transport = newTransport();
        PooledConnection idle = dial(transport, DnsProtocol.UDP);
        PooledConnection busy = dial(transport, DnsProtocol.UDP);
        transport.yield(idle);

        transport.close();
        assertFalse(idle.isActive());
        assertInstanceOf(IllegalStateException.class, transport.dial(DnsProtocol.UDP).cause());

        transport.yield(busy);
        assertFalse(busy.isActive());
        assertEquals(0, transport.idleCount(DnsProtocol.UDP));
    }

    @Test
    public void testConnectionIsNeverSharedConcurrently() throws Exception {
        DefaultEventExecutor coordinator = new DefaultEventExecutor();
        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            final UpstreamTransport transport =
                    newTransport(null, TimeUnit.SECONDS.toNanos(10), 64, coordinator);
            final Set<PooledConnection> inUse =
                    Collections.newSetFromMap(new ConcurrentHashMap<PooledConnection, Boolean>());
            final AtomicInteger violations = new AtomicInteger();
            List<java.util.concurrent.Future<Void>> results = new ArrayList<java.util.concurrent.Future<Void>>();
            for (int i = 0; i < 8; i++) {
                results.add(callers.submit(new Callable<Void>() {
                    @Override
                    public Void call() throws Exception {
                        for (int j = 0; j < 200; j++) {
                            PooledConnection connection = transport.dial(DnsProtocol.UDP).get();
                            if (!inUse.add(connection)) {
                                violations.incrementAndGet();
                            }
                            Thread.yield();
                            inUse.remove(connection);
                            transport.yield(connection);
                        }
                        return null;
                    }
                }));
            }
            for (java.util.concurrent.Future<Void> result : results) {
                result.get(30, TimeUnit.SECONDS);
            }
            assertEquals(0, violations.get());
            assertTrue(dialer.dials() <= 8, "dialed " + dialer.dials() + " connections for 8 callers");
        } finally {
            callers.shutdownNow();
            coordinator.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        }
    }
}
