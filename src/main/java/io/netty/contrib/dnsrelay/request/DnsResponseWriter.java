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

import java.net.SocketAddress;

/**
 * Where a query handler puts its answer.
 */
public interface DnsResponseWriter {

    /**
     * The address the query was received on.
     */
    SocketAddress localAddress();

    /**
     * The address of the client.
     */
    SocketAddress remoteAddress();

    /**
     * Writes {@code response}. The writer takes ownership of the response.
     */
    void writeMessage(DnsResponse response);
}
