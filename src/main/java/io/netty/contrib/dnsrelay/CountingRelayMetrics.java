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
import io.netty.util.internal.PlatformDependent;

import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * {@link RelayMetrics} that keeps in-memory counters.
 */
public final class CountingRelayMetrics implements RelayMetrics {

    private final ConcurrentMap<String, LongAdder> counters = PlatformDependent.newConcurrentHashMap();

    @Override
    public void connectionCacheHit(UpstreamAddress upstream, DnsProtocol protocol) {
        increment("hit " + upstream + ' ' + protocol);
    }

    @Override
    public void connectionCacheMiss(UpstreamAddress upstream, DnsProtocol protocol) {
        increment("miss " + upstream + ' ' + protocol);
    }

    @Override
    public void requestCompleted(UpstreamAddress upstream, DnsResponseCode code, long durationNanos) {
        increment("request " + upstream);
        increment("rcode " + upstream + ' ' + code.intValue());
    }

    @Override
    public void malformedExchangeDropped(DnsTransport transport) {
        increment("malformed " + transport);
    }

    public long cacheHits(UpstreamAddress upstream, DnsProtocol protocol) {
        return get("hit " + upstream + ' ' + protocol);
    }

    public long cacheMisses(UpstreamAddress upstream, DnsProtocol protocol) {
        return get("miss " + upstream + ' ' + protocol);
    }

    public long requests(UpstreamAddress upstream) {
        return get("request " + upstream);
    }

    public long responses(UpstreamAddress upstream, DnsResponseCode code) {
        return get("rcode " + upstream + ' ' + code.intValue());
    }

    public long malformedExchanges(DnsTransport transport) {
        return get("malformed " + transport);
    }

    private void increment(String key) {
        LongAdder counter = counters.get(key);
        if (counter == null) {
            LongAdder newCounter = new LongAdder();
            counter = counters.putIfAbsent(key, newCounter);
            if (counter == null) {
                counter = newCounter;
            }
        }
        counter.increment();
    }

    private long get(String key) {
        LongAdder counter = counters.get(key);
        return counter == null ? 0 : counter.sum();
    }
}
