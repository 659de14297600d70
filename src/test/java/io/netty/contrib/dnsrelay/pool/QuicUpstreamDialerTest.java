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

import io.netty.channel.DefaultEventLoopGroup;
import io.netty.channel.EventLoopGroup;
import io.netty.contrib.dnsrelay.DnsProtocol;
import io.netty.contrib.dnsrelay.UpstreamAddress;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class QuicUpstreamDialerTest {

    private static final UpstreamAddress ADDRESS = UpstreamAddress.parse("quic://192.0.2.53");

    private final EventLoopGroup group = new DefaultEventLoopGroup(1);

    @AfterEach
    public void tearDown() {
        group.shutdownGracefully(0, 0, TimeUnit.SECONDS).syncUninterruptibly();
    }

    @Test
    public void testOnlyDialsQuic() {
        final QuicUpstreamDialer dialer = new QuicUpstreamDialer(group);
        assertThrows(IllegalArgumentException.class, new Executable() {
            @Override
            public void execute() {
                dialer.dial(ADDRESS, DnsProtocol.TCP_TLS, null, 1000);
            }
        });
    }

    @Test
    public void testRequiresQuicSslContext() throws Exception {
        final QuicUpstreamDialer dialer = new QuicUpstreamDialer(group);
        final SslContext tls = SslContextBuilder.forClient().build();
        assertThrows(IllegalArgumentException.class, new Executable() {
            @Override
            public void execute() {
                dialer.dial(ADDRESS, DnsProtocol.QUIC, tls, 1000);
            }
        });
    }

    @Test
    public void testBootstrapDialerRejectsQuic() {
        final BootstrapUpstreamDialer dialer = new BootstrapUpstreamDialer(group);
        assertThrows(IllegalArgumentException.class, new Executable() {
            @Override
            public void execute() {
                dialer.dial(ADDRESS, DnsProtocol.QUIC, null, 1000);
            }
        });
    }

    @Test
    public void testRejectsNonPositiveIdleTimeout() {
        assertThrows(IllegalArgumentException.class, new Executable() {
            @Override
            public void execute() {
                new QuicUpstreamDialer(group, 0, TimeUnit.SECONDS);
            }
        });
    }
}
