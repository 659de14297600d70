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
package io.netty.contrib.dnsrelay.codec;

import io.netty.buffer.ByteBuf;
import io.netty.handler.codec.dns.DefaultDnsResponse;
import io.netty.handler.codec.dns.DnsOpCode;
import io.netty.handler.codec.dns.DnsResponseCode;

import static io.netty.util.internal.ObjectUtil.checkNotNull;

/**
 * A {@link io.netty.handler.codec.dns.DnsResponse} decoded from the wire that keeps the bytes it
 * was decoded from.
 * <p>
 * Netty's record decoder leaves the data of most record types as raw bytes, compression pointers
 * included, and its encoder never compresses names. Re-encoding such a message would move the
 * targets of those pointers, so {@link DnsMessageCodec#encode} writes the kept bytes instead and
 * only replaces the ID with {@link #id()}. Changes to the flags or records of this object are not
 * written out.
 */
public final class WireDnsResponse extends DefaultDnsResponse {

    private final ByteBuf wire;

    /**
     * @param wire the encoded message, owned by the new response
     */
    public WireDnsResponse(int id, DnsOpCode opCode, DnsResponseCode code, ByteBuf wire) {
        super(id, opCode, code);
        this.wire = checkNotNull(wire, "wire");
    }

    /**
     * Returns the message as received. The buffer is shared and must not be modified or released.
     */
    public ByteBuf wire() {
        return wire;
    }

    @Override
    protected void deallocate() {
        try {
            super.deallocate();
        } finally {
            wire.release();
        }
    }
}
