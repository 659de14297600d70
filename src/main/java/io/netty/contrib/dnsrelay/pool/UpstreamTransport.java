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

import io.netty.channel.Channel;
import io.netty.contrib.dnsrelay.DnsProtocol;
import io.netty.contrib.dnsrelay.RelayMetrics;
import io.netty.contrib.dnsrelay.UpstreamAddress;
import io.netty.handler.ssl.SslContext;
import io.netty.incubator.codec.quic.QuicSslContext;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.ScheduledFuture;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.io.Closeable;
import java.util.ArrayDeque;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static io.netty.util.internal.ObjectUtil.checkNotNull;
import static io.netty.util.internal.ObjectUtil.checkPositive;
import static io.netty.util.internal.ObjectUtil.checkPositiveOrZero;

/**
 * Keeps reusable connections to one upstream server.
 * <p>
 * Every access to the idle cache runs on a single {@link EventExecutor}, the coordinator. Callers on
 * other threads hand their request to the coordinator and get the result back through a future, so
 * the cache never sees two writers while the network I/O of the connections stays on their own event
 * loops. Idle connections are kept per protocol, most recently used first, and closed once they have
 * been idle for longer than the expiry.
 * <p>
 * When the transport has an {@link SslContext}, every dial uses {@link DnsProtocol#TCP_TLS} whatever
 * the caller asked for, or {@link DnsProtocol#QUIC} if it is a {@link QuicSslContext}. A QUIC
 * connection is cached like any other; each exchange opens its own stream on it.
 */
public final class UpstreamTransport implements Closeable {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(UpstreamTransport.class);

    private final UpstreamAddress address;
    private final UpstreamDialer dialer;
    private final SslContext sslContext;
    private final EventExecutor coordinator;
    private final AdaptiveDialTimeout dialTimeout;
    private final long expireNanos;
    private final int maxIdleConnections;
    private final RelayMetrics metrics;

    // Only accessed by the coordinator.
    private final Map<DnsProtocol, ArrayDeque<PooledConnection>> idle =
            new EnumMap<DnsProtocol, ArrayDeque<PooledConnection>>(DnsProtocol.class);
    private ScheduledFuture<?> cleanupFuture;
    private boolean closed;

    private final Runnable cleanupTask = new Runnable() {
        @Override
        public void run() {
            expireIdle(System.nanoTime());
        }
    };

    /**
     * @param sslContext         the TLS context, or {@code null} to dial as asked
     * @param coordinator        the single-threaded executor owning the idle cache
     * @param expireNanos        how long a connection may stay idle, {@code 0} to keep it forever
     * @param maxIdleConnections how many idle connections to keep per protocol
     */
    public UpstreamTransport(UpstreamAddress address, UpstreamDialer dialer, SslContext sslContext,
                             EventExecutor coordinator, AdaptiveDialTimeout dialTimeout, long expireNanos,
                             int maxIdleConnections, RelayMetrics metrics) {
        this.address = checkNotNull(address, "address");
        this.dialer = checkNotNull(dialer, "dialer");
        this.sslContext = sslContext;
        this.coordinator = checkNotNull(coordinator, "coordinator");
        this.dialTimeout = checkNotNull(dialTimeout, "dialTimeout");
        this.expireNanos = checkPositiveOrZero(expireNanos, "expireNanos");
        this.maxIdleConnections = checkPositive(maxIdleConnections, "maxIdleConnections");
        this.metrics = checkNotNull(metrics, "metrics");
        for (DnsProtocol protocol : DnsProtocol.values()) {
            idle.put(protocol, new ArrayDeque<PooledConnection>());
        }
    }

    public UpstreamAddress address() {
        return address;
    }

    public EventExecutor coordinator() {
        return coordinator;
    }

    public AdaptiveDialTimeout dialTimeout() {
        return dialTimeout;
    }

    /**
     * Returns {@code true} if every connection of this transport uses TLS, over TCP or within QUIC.
     */
    public boolean isSecure() {
        return sslContext != null;
    }

    /**
     * Returns the protocol a dial for {@code requested} will actually use.
     */
    public DnsProtocol effectiveProtocol(DnsProtocol requested) {
        checkNotNull(requested, "requested");
        if (sslContext instanceof QuicSslContext) {
            return DnsProtocol.QUIC;
        }
        return sslContext != null ? DnsProtocol.TCP_TLS : requested;
    }

    /**
     * Starts the periodic removal of expired idle connections.
     */
    public void start() {
        if (expireNanos == 0) {
            return;
        }
        execute(new Runnable() {
            @Override
            public void run() {
                if (!closed && cleanupFuture == null) {
                    cleanupFuture = coordinator.scheduleAtFixedRate(
                            cleanupTask, expireNanos, expireNanos, TimeUnit.NANOSECONDS);
                }
            }
        });
    }

    /**
     * Obtains a connection for {@code protocol}, reusing an idle one if possible. The connection
     * belongs to the caller until it is {@linkplain #yield(PooledConnection) yielded} or closed.
     * {@link PooledConnection#isCached()} tells whether it was reused.
     */
    public Future<PooledConnection> dial(DnsProtocol protocol) {
        final DnsProtocol proto = effectiveProtocol(protocol);
        final Promise<PooledConnection> promise = coordinator.newPromise();
        execute(new Runnable() {
            @Override
            public void run() {
                dial0(proto, promise);
            }
        });
        return promise;
    }

    private void dial0(final DnsProtocol protocol, final Promise<PooledConnection> promise) {
        if (closed) {
            promise.tryFailure(new IllegalStateException("transport to " + address + " is closed"));
            return;
        }
        PooledConnection connection = pollIdle(protocol, System.nanoTime());
        if (connection != null) {
            metrics.connectionCacheHit(address, protocol);
            connection.cached(true);
            if (!promise.trySuccess(connection)) {
                // Cancelled meanwhile, keep the connection for the next caller.
                yield0(connection);
            }
            return;
        }
        metrics.connectionCacheMiss(address, protocol);

        final long start = System.nanoTime();
        final Future<Channel> dialFuture;
        try {
            dialFuture = dialer.dial(address, protocol, sslContext, dialTimeout.timeoutMillis());
        } catch (Throwable cause) {
            dialTimeout.record(System.nanoTime() - start);
            promise.tryFailure(cause);
            return;
        }
        dialFuture.addListener(new FutureListener<Channel>() {
            @Override
            public void operationComplete(Future<Channel> future) {
                dialTimeout.record(System.nanoTime() - start);
                if (!future.isSuccess()) {
                    promise.tryFailure(future.cause());
                    return;
                }
                Channel ch = future.getNow();
                final PooledConnection connection;
                try {
                    connection = new PooledConnection(ch, protocol);
                } catch (Throwable cause) {
                    ch.close();
                    promise.tryFailure(cause);
                    return;
                }
                if (!promise.trySuccess(connection)) {
                    connection.close();
                }
            }
        });
    }

    private PooledConnection pollIdle(DnsProtocol protocol, long now) {
        ArrayDeque<PooledConnection> stack = idle.get(protocol);
        PooledConnection connection;
        while ((connection = stack.pollLast()) != null) {
            if (isExpired(connection, now)) {
                // Everything below the top of the stack has been idle even longer.
                connection.close();
                closeAll(stack);
                return null;
            }
            if (connection.isActive()) {
                return connection;
            }
            logger.debug("Discarding closed idle connection {}", connection);
        }
        return null;
    }

    /**
     * Gives a connection back for reuse. Must only be called after a fully successful exchange; a
     * connection that saw an error is closed instead.
     */
    public void yield(final PooledConnection connection) {
        checkNotNull(connection, "connection");
        execute(new Runnable() {
            @Override
            public void run() {
                yield0(connection);
            }
        });
    }

    private void yield0(PooledConnection connection) {
        if (closed || !connection.isActive()) {
            connection.close();
            return;
        }
        ArrayDeque<PooledConnection> stack = idle.get(connection.protocol());
        if (stack.size() >= maxIdleConnections) {
            PooledConnection oldest = stack.pollFirst();
            if (oldest != null) {
                oldest.close();
            }
        }
        connection.cached(false);
        connection.idleSinceNanos(System.nanoTime());
        stack.addLast(connection);
    }

    private boolean isExpired(PooledConnection connection, long now) {
        return expireNanos > 0 && now - connection.idleSinceNanos() >= expireNanos;
    }

    void expireIdle(long now) {
        for (ArrayDeque<PooledConnection> stack : idle.values()) {
            PooledConnection oldest;
            while ((oldest = stack.peekFirst()) != null && isExpired(oldest, now)) {
                stack.pollFirst().close();
            }
        }
    }

    /**
     * Returns the number of idle connections for {@code protocol}. Must be called from the coordinator.
     */
    int idleCount(DnsProtocol protocol) {
        assert coordinator.inEventLoop();
        return idle.get(protocol).size();
    }

    /**
     * Closes every idle connection. Later dials fail and later yields close the yielded connection.
     */
    @Override
    public void close() {
        execute(new Runnable() {
            @Override
            public void run() {
                if (closed) {
                    return;
                }
                closed = true;
                if (cleanupFuture != null) {
                    cleanupFuture.cancel(false);
                    cleanupFuture = null;
                }
                for (ArrayDeque<PooledConnection> stack : idle.values()) {
                    closeAll(stack);
                }
            }
        });
    }

    private static void closeAll(ArrayDeque<PooledConnection> stack) {
        PooledConnection connection;
        while ((connection = stack.pollFirst()) != null) {
            connection.close();
        }
    }

    private void execute(Runnable task) {
        if (coordinator.inEventLoop()) {
            task.run();
        } else {
            coordinator.execute(task);
        }
    }

    @Override
    public String toString() {
        return "UpstreamTransport(" + address + ')';
    }
}
