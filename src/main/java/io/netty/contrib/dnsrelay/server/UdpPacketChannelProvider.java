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

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandler;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.nio.NioDatagramChannel;

import java.net.SocketAddress;

/**
 * Binds a {@link NioDatagramChannel}.
 */
public final class UdpPacketChannelProvider implements PacketChannelProvider {

    public static final UdpPacketChannelProvider INSTANCE = new UdpPacketChannelProvider();

    private UdpPacketChannelProvider() {
    }

    @Override
    public ChannelFuture bind(EventLoopGroup group, ChannelHandler codec, SocketAddress localAddress) {
        return new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .handler(codec)
                .bind(localAddress);
    }

    @Override
    public String name() {
        return "udp";
    }
}
