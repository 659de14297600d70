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

import io.netty.contrib.dnsrelay.DnsTransport;
import io.netty.util.concurrent.EventExecutor;

import java.net.SocketAddress;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * Identifies the server a query was received by.
 */
public final class DnsServerContext {

    private final DnsTransport transport;
    private final SocketAddress localAddress;
    private final EventExecutor executor;

    public DnsServerContext(DnsTransport transport, SocketAddress localAddress, EventExecutor executor) {
        this.transport = checkNotNull(transport, "transport");
        this.localAddress = localAddress;
        this.executor = checkNotNull(executor, "executor");
    }

    public DnsTransport transport() {
        return transport;
    }

    public SocketAddress localAddress() {
        return localAddress;
    }

    /**
     * The executor handling the exchange. Handlers may use it to create their futures.
     */
    public EventExecutor executor() {
        return executor;
    }

    @Override
    public String toString() {
        return "DnsServerContext(" + transport + ", " + localAddress + ')';
    }
}
