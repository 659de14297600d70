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
package io.netty.contrib.dnsrelay.request;

import io.netty.handler.codec.dns.DnsResponse;
import io.netty.util.ReferenceCountUtil;

import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A {@link DnsResponseWriter} that does not send anything but keeps what was written, so the
 * caller can inspect it afterwards.
 * <p>
 * This class is thread-safe.
 */
public final class CapturingResponseWriter implements DnsResponseWriter {

    private final SocketAddress localAddress;
    private final SocketAddress remoteAddress;
    private final List<DnsResponse> messages = new ArrayList<DnsResponse>(1);

    public CapturingResponseWriter(SocketAddress localAddress, SocketAddress remoteAddress) {
        this.localAddress = localAddress;
        this.remoteAddress = remoteAddress;
    }

    @Override
    public SocketAddress localAddress() {
        return localAddress;
    }

    @Override
    public SocketAddress remoteAddress() {
        return remoteAddress;
    }

    @Override
    public synchronized void writeMessage(DnsResponse response) {
        messages.add(response);
    }

    /**
     * Returns the first message written, or {@code null} if nothing was written. The writer keeps
     * ownership of the message.
     */
    public synchronized DnsResponse message() {
        return messages.isEmpty() ? null : messages.get(0);
    }

    /**
     * Returns every message written so far.
     */
    public synchronized List<DnsResponse> messages() {
        return Collections.unmodifiableList(new ArrayList<DnsResponse>(messages));
    }

    /**
     * Releases every captured message.
     */
    public synchronized void release() {
        for (DnsResponse message : messages) {
            ReferenceCountUtil.release(message);
        }
        messages.clear();
    }
}
