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
package io.netty.contrib.dnsrelay;

import io.netty.handler.codec.dns.DnsResponseCode;

/**
 * Receives the events a metrics backend would count. Implementations must be thread-safe and must
 * not block, as they are called from I/O threads.
 */
public interface RelayMetrics {

    /**
     * Discards every event.
     */
    RelayMetrics NOOP = new RelayMetrics() {
        @Override
        public void connectionCacheHit(UpstreamAddress upstream, DnsProtocol protocol) { }

        @Override
        public void connectionCacheMiss(UpstreamAddress upstream, DnsProtocol protocol) { }

        @Override
        public void requestCompleted(UpstreamAddress upstream, DnsResponseCode code, long durationNanos) { }

        @Override
        public void malformedExchangeDropped(DnsTransport transport) { }
    };

    /**
     * An idle connection to {@code upstream} was reused.
     */
    void connectionCacheHit(UpstreamAddress upstream, DnsProtocol protocol);

    /**
     * No idle connection to {@code upstream} was available and a new one is dialed.
     */
    void connectionCacheMiss(UpstreamAddress upstream, DnsProtocol protocol);

    /**
     * A relayed query received its response.
     */
    void requestCompleted(UpstreamAddress upstream, DnsResponseCode code, long durationNanos);

    /**
     * An incoming exchange was dropped without a response because it was not a valid DNS message.
     */
    void malformedExchangeDropped(DnsTransport transport);
}
