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

import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandler;
import io.netty.channel.EventLoopGroup;

import java.net.SocketAddress;

/**
 * Opens the packet channel a {@link DnsOverQuicServer} runs its QUIC codec on.
 * <p>
 * The default provider binds a plain UDP socket. Other network stacks, a SCION endpoint for example,
 * plug in here and reuse the rest of the server.
 */
public interface PacketChannelProvider {

    /**
     * Binds a packet channel to {@code localAddress} with {@code codec} as its handler.
     */
    ChannelFuture bind(EventLoopGroup group, ChannelHandler codec, SocketAddress localAddress);

    /**
     * The transport name servers using this provider report.
     */
    String name();
}
