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

import io.netty.channel.EventLoopGroup;
import io.netty.contrib.dnsrelay.DnsProtocol;
import io.netty.contrib.dnsrelay.DnsTransport;
import io.netty.contrib.dnsrelay.RelayMetrics;
import io.netty.contrib.dnsrelay.UpstreamAddress;
import io.netty.contrib.dnsrelay.pool.AdaptiveDialTimeout;
import io.netty.contrib.dnsrelay.pool.BootstrapUpstreamDialer;
import io.netty.contrib.dnsrelay.pool.PooledConnection;
import io.netty.contrib.dnsrelay.pool.QuicUpstreamDialer;
import io.netty.contrib.dnsrelay.pool.UpstreamDialer;
import io.netty.contrib.dnsrelay.pool.UpstreamTransport;
import io.netty.contrib.dnsrelay.request.DnsRequest;
import io.netty.handler.codec.dns.DefaultDnsQuery;
import io.netty.handler.codec.dns.DefaultDnsQuestion;
import io.netty.handler.codec.dns.DnsOpCode;
import io.netty.handler.codec.dns.DnsQuery;
import io.netty.handler.codec.dns.DnsRecordType;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.handler.codec.dns.DnsSection;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.incubator.codec.quic.QuicSslContext;
import io.netty.incubator.codec.quic.QuicSslContextBuilder;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.Promise;
import io.netty.util.internal.SystemPropertyUtil;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import javax.net.ssl.SSLException;
import java.io.Closeable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static io.netty.util.internal.ObjectUtil.checkNotNull;
import static io.netty.util.internal.ObjectUtil.checkPositive;
import static io.netty.util.internal.ObjectUtil.checkPositiveOrZero;

/**
 * Relays client queries to one upstream DNS server over pooled connections.
 * <p>
 * Each {@link #connect(DnsRequest, RelayOptions)} picks the protocol, borrows a connection from the
 * {@link UpstreamTransport}, sends the query under a fresh ID and completes with the first response
 * carrying that ID, restored to the client's ID. A failure on a connection that came from the idle
 * cache and was found closed by the upstream is reported as {@link StaleConnectionException}.
 * <p>
 * Plain and {@code tls://} upstreams are reached over UDP, TCP or TLS, {@code quic://} and
 * {@code squic://} upstreams over DNS-over-QUIC. {@code https://} and {@code grpc://} are not supported.
 */
public final class DnsProxy implements Closeable {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(DnsProxy.class);

    static final long DEFAULT_MIN_DIAL_TIMEOUT_MILLIS =
            SystemPropertyUtil.getLong("io.netty.contrib.dnsrelay.minDialTimeoutMillis", 1000);
    static final long DEFAULT_MAX_DIAL_TIMEOUT_MILLIS =
            SystemPropertyUtil.getLong("io.netty.contrib.dnsrelay.maxDialTimeoutMillis", 30000);
    static final int DEFAULT_DIAL_TIMEOUT_WEIGHT =
            SystemPropertyUtil.getInt("io.netty.contrib.dnsrelay.dialTimeoutWeight", 4);
    static final long DEFAULT_WRITE_TIMEOUT_MILLIS =
            SystemPropertyUtil.getLong("io.netty.contrib.dnsrelay.writeTimeoutMillis", 2000);
    static final long DEFAULT_READ_TIMEOUT_MILLIS =
            SystemPropertyUtil.getLong("io.netty.contrib.dnsrelay.readTimeoutMillis", 2000);
    static final long DEFAULT_EXPIRE_MILLIS =
            SystemPropertyUtil.getLong("io.netty.contrib.dnsrelay.expireMillis", 10000);
    static final int DEFAULT_MAX_IDLE_CONNECTIONS =
            SystemPropertyUtil.getInt("io.netty.contrib.dnsrelay.maxIdleConnections", 16);

    private final UpstreamAddress address;
    private final UpstreamTransport transport;
    private final long writeTimeoutMillis;
    private final long readTimeoutMillis;
    private final RelayMetrics metrics;
    private final AtomicInteger fails = new AtomicInteger();

    DnsProxy(UpstreamAddress address, UpstreamTransport transport, long writeTimeoutMillis,
             long readTimeoutMillis, RelayMetrics metrics) {
        this.address = address;
        this.transport = transport;
        this.writeTimeoutMillis = writeTimeoutMillis;
        this.readTimeoutMillis = readTimeoutMillis;
        this.metrics = metrics;
    }

    public static Builder builder(String address) {
        return new Builder(address);
    }

    public UpstreamAddress address() {
        return address;
    }

    public UpstreamTransport transport() {
        return transport;
    }

    RelayMetrics metrics() {
        return metrics;
    }

    long writeTimeoutMillis() {
        return writeTimeoutMillis;
    }

    long readTimeoutMillis() {
        return readTimeoutMillis;
    }

    /**
     * Starts the periodic cleanup of idle connections.
     */
    public void start() {
        transport.start();
    }

    /**
     * Returns the protocol used towards the upstream for {@code request}.
     */
    public DnsProtocol selectProtocol(DnsRequest request, RelayOptions options) {
        DnsProtocol protocol;
        if (options.forceTcp()) {
            protocol = DnsProtocol.TCP;
        } else if (options.preferUdp()) {
            protocol = DnsProtocol.UDP;
        } else {
            protocol = request.protocol();
        }
        DnsTransport scheme = address.transport();
        if (scheme == DnsTransport.TLS) {
            protocol = DnsProtocol.TCP_TLS;
        } else if (scheme != null && scheme.isQuic()) {
            protocol = DnsProtocol.QUIC;
        }
        return transport.effectiveProtocol(protocol);
    }

    /**
     * Relays {@code request} to the upstream. The returned future completes on the coordinator of
     * the transport. The caller keeps ownership of the request and owns the response.
     */
    public Future<DnsResponse> connect(DnsRequest request, RelayOptions options) {
        return connect(request, options, transport.coordinator().<DnsResponse>newPromise());
    }

    public Future<DnsResponse> connect(final DnsRequest request, RelayOptions options,
                                       final Promise<DnsResponse> promise) {
        checkNotNull(request, "request");
        checkNotNull(options, "options");
        checkNotNull(promise, "promise");
        final long start = System.nanoTime();
        transport.dial(selectProtocol(request, options)).addListener(new FutureListener<PooledConnection>() {
            @Override
            public void operationComplete(Future<PooledConnection> future) {
                if (!future.isSuccess()) {
                    promise.tryFailure(future.cause());
                    return;
                }
                new UpstreamExchange(DnsProxy.this, future.getNow(), request, promise, start).start();
            }
        });
        return promise;
    }

    /**
     * Sends a {@code . IN NS} query without recursion. A response resets the failure count, a failure
     * increments it.
     */
    public Future<Void> healthCheck() {
        final DnsQuery query = new DefaultDnsQuery(0, DnsOpCode.QUERY);
        query.setRecursionDesired(false);
        query.addRecord(DnsSection.QUESTION, new DefaultDnsQuestion(".", DnsRecordType.NS));
        final Promise<Void> result = transport.coordinator().newPromise();
        connect(new DnsRequest(query, DnsProtocol.UDP, null, null), RelayOptions.DEFAULT)
                .addListener(new FutureListener<DnsResponse>() {
                    @Override
                    public void operationComplete(Future<DnsResponse> future) {
                        query.release();
                        if (future.isSuccess()) {
                            future.getNow().release();
                            fails.set(0);
                            result.trySuccess(null);
                        } else {
                            int count = fails.incrementAndGet();
                            logger.warn("Health check of {} failed ({} in a row)", address, count, future.cause());
                            result.tryFailure(future.cause());
                        }
                    }
                });
        return result;
    }

    /**
     * Returns the number of consecutive failed health checks.
     */
    public int fails() {
        return fails.get();
    }

    /**
     * Returns {@code true} if more than {@code maxFails} health checks failed in a row. A
     * {@code maxFails} of {@code 0} disables the check.
     */
    public boolean isDown(int maxFails) {
        return maxFails != 0 && fails.get() > maxFails;
    }

    /**
     * Closes all idle connections. Exchanges in flight complete on their own.
     */
    @Override
    public void close() {
        transport.close();
    }

    @Override
    public String toString() {
        return "DnsProxy(" + address + ')';
    }

    /**
     * Builds a {@link DnsProxy}. Either a {@linkplain #group(EventLoopGroup) group} or a
     * {@linkplain #dialer(UpstreamDialer) dialer} must be set.
     */
    public static final class Builder {

        private final UpstreamAddress address;
        private EventLoopGroup group;
        private UpstreamDialer dialer;
        private EventExecutor coordinator;
        private SslContext sslContext;
        private RelayMetrics metrics = RelayMetrics.NOOP;
        private long minDialTimeoutMillis = DEFAULT_MIN_DIAL_TIMEOUT_MILLIS;
        private long maxDialTimeoutMillis = DEFAULT_MAX_DIAL_TIMEOUT_MILLIS;
        private int dialTimeoutWeight = DEFAULT_DIAL_TIMEOUT_WEIGHT;
        private long writeTimeoutMillis = DEFAULT_WRITE_TIMEOUT_MILLIS;
        private long readTimeoutMillis = DEFAULT_READ_TIMEOUT_MILLIS;
        private long expireMillis = DEFAULT_EXPIRE_MILLIS;
        private int maxIdleConnections = DEFAULT_MAX_IDLE_CONNECTIONS;

        Builder(String address) {
            this.address = UpstreamAddress.parse(address);
            DnsTransport transport = this.address.transport();
            if (transport == DnsTransport.HTTPS || transport == DnsTransport.GRPC) {
                throw new IllegalArgumentException("unsupported upstream transport: " + address);
            }
        }

        /**
         * The event loops new connections are registered with, used by the default dialer and as
         * default coordinator.
         */
        public Builder group(EventLoopGroup group) {
            this.group = group;
            return this;
        }

        public Builder dialer(UpstreamDialer dialer) {
            this.dialer = dialer;
            return this;
        }

        /**
         * The single-threaded executor owning the idle cache. Defaults to one event loop of the group.
         */
        public Builder coordinator(EventExecutor coordinator) {
            this.coordinator = coordinator;
            return this;
        }

        /**
         * Uses TLS for every connection. Defaults to a client context trusting the system roots for
         * {@code tls://} addresses. A {@link QuicSslContext} makes every connection DNS-over-QUIC;
         * {@code quic://} and {@code squic://} addresses require one and default to a context offering
         * the {@value DnsTransport#DOQ_ALPN} application protocol.
         */
        public Builder sslContext(SslContext sslContext) {
            this.sslContext = sslContext;
            return this;
        }

        public Builder metrics(RelayMetrics metrics) {
            this.metrics = checkNotNull(metrics, "metrics");
            return this;
        }

        public Builder dialTimeout(long min, long max, TimeUnit unit) {
            this.minDialTimeoutMillis = unit.toMillis(min);
            this.maxDialTimeoutMillis = unit.toMillis(max);
            return this;
        }

        public Builder dialTimeoutWeight(int weight) {
            this.dialTimeoutWeight = checkPositive(weight, "weight");
            return this;
        }

        public Builder writeTimeout(long timeout, TimeUnit unit) {
            this.writeTimeoutMillis = unit.toMillis(checkPositive(timeout, "timeout"));
            return this;
        }

        public Builder readTimeout(long timeout, TimeUnit unit) {
            this.readTimeoutMillis = unit.toMillis(checkPositive(timeout, "timeout"));
            return this;
        }

        /**
         * How long an idle connection is kept, {@code 0} to keep it until it is closed.
         */
        public Builder expire(long expire, TimeUnit unit) {
            this.expireMillis = unit.toMillis(checkPositiveOrZero(expire, "expire"));
            return this;
        }

        public Builder maxIdleConnections(int maxIdleConnections) {
            this.maxIdleConnections = checkPositive(maxIdleConnections, "maxIdleConnections");
            return this;
        }

        public DnsProxy build() {
            boolean quic = address.transport() != null && address.transport().isQuic();
            UpstreamDialer dialer = this.dialer;
            EventExecutor coordinator = this.coordinator;
            if (dialer == null) {
                if (group == null) {
                    throw new IllegalStateException("either group or dialer must be set");
                }
                dialer = quic ? new QuicUpstreamDialer(group) : new BootstrapUpstreamDialer(group);
            }
            if (coordinator == null) {
                if (group == null) {
                    throw new IllegalStateException("either group or coordinator must be set");
                }
                coordinator = group.next();
            }
            SslContext sslContext = this.sslContext;
            if (quic) {
                if (sslContext == null) {
                    sslContext = QuicSslContextBuilder.forClient()
                            .applicationProtocols(DnsTransport.DOQ_ALPN)
                            .build();
                } else if (!(sslContext instanceof QuicSslContext)) {
                    throw new IllegalStateException("a QuicSslContext is required for " + address);
                }
            } else if (sslContext == null && address.transport() == DnsTransport.TLS) {
                try {
                    sslContext = SslContextBuilder.forClient().build();
                } catch (SSLException e) {
                    throw new IllegalStateException("cannot create the default TLS context", e);
                }
            }
            AdaptiveDialTimeout dialTimeout = new AdaptiveDialTimeout(
                    minDialTimeoutMillis, maxDialTimeoutMillis, TimeUnit.MILLISECONDS, dialTimeoutWeight);
            UpstreamTransport transport = new UpstreamTransport(address, dialer, sslContext, coordinator,
                    dialTimeout, TimeUnit.MILLISECONDS.toNanos(expireMillis), maxIdleConnections, metrics);
            return new DnsProxy(address, transport, writeTimeoutMillis, readTimeoutMillis, metrics);
        }
    }
}
