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

/**
 * The concrete wire protocol of a connection to an upstream server.
 */
public enum DnsProtocol {
    /**
     * Plain DNS over datagrams, one message per datagram.
     */
    UDP("udp"),
    /**
     * Plain DNS over a stream, every message prefixed by its 2-byte length.
     */
    TCP("tcp"),
    /**
     * Like {@link #TCP}, wrapped in TLS.
     */
    TCP_TLS("tcp-tls"),
    /**
     * DNS-over-QUIC: one length-prefixed message each way on a fresh bidirectional stream of a
     * QUIC connection.
     */
    QUIC("quic");

    private final String text;

    DnsProtocol(String text) {
        this.text = text;
    }

    /**
     * Returns {@code true} if messages on this protocol are length prefixed.
     */
    public boolean isStream() {
        return this != UDP;
    }

    @Override
    public String toString() {
        return text;
    }
}
