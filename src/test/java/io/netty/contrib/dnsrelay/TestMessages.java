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

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.buffer.UnpooledByteBufAllocator;
import io.netty.contrib.dnsrelay.codec.DnsFraming;
import io.netty.contrib.dnsrelay.codec.DnsMessageCodec;
import io.netty.handler.codec.dns.DefaultDnsQuery;
import io.netty.handler.codec.dns.DefaultDnsQuestion;
import io.netty.handler.codec.dns.DefaultDnsRawRecord;
import io.netty.handler.codec.dns.DefaultDnsResponse;
import io.netty.handler.codec.dns.DnsMessage;
import io.netty.handler.codec.dns.DnsQuery;
import io.netty.handler.codec.dns.DnsRecord;
import io.netty.handler.codec.dns.DnsRecordType;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.handler.codec.dns.DnsSection;
import io.netty.util.CharsetUtil;

/**
 * Builds DNS messages for tests.
 */
public final class TestMessages {

    /**
     * Offset of the {@code alias} label inside {@link #compressedMxResponse(int)}.
     */
    public static final int ALIAS_OFFSET = 41;

    private TestMessages() {
    }

    public static DnsQuery query(int id, String name) {
        return query(id, name, DnsRecordType.A);
    }

    public static DnsQuery query(int id, String name, DnsRecordType type) {
        DnsQuery query = new DefaultDnsQuery(id);
        query.setRecursionDesired(true);
        query.addRecord(DnsSection.QUESTION, new DefaultDnsQuestion(name, type));
        return query;
    }

    /**
     * Returns the wire form of a response to {@code example.com. IN MX} as a name server compresses
     * it: {@code example.com. CNAME alias.example.com.} followed by
     * {@code example.com. MX 10 alias.example.com.}, where the MX exchange is a single pointer to
     * {@link #ALIAS_OFFSET}.
     */
    public static ByteBuf compressedMxResponse(int id) {
        ByteBuf buf = Unpooled.buffer();
        buf.writeShort(id);
        buf.writeShort(0x8180);
        buf.writeShort(1).writeShort(2).writeShort(0).writeShort(0);
        // Question at offset 12.
        buf.writeByte(7).writeBytes("example".getBytes(CharsetUtil.US_ASCII));
        buf.writeByte(3).writeBytes("com".getBytes(CharsetUtil.US_ASCII));
        buf.writeByte(0);
        buf.writeShort(DnsRecordType.MX.intValue()).writeShort(1);
        // CNAME at offset 29, its data at offset 41.
        buf.writeShort(0xc00c);
        buf.writeShort(DnsRecordType.CNAME.intValue()).writeShort(1).writeInt(60);
        buf.writeShort(8);
        buf.writeByte(5).writeBytes("alias".getBytes(CharsetUtil.US_ASCII));
        buf.writeShort(0xc00c);
        // MX pointing at the CNAME data.
        buf.writeShort(0xc00c);
        buf.writeShort(DnsRecordType.MX.intValue()).writeShort(1).writeInt(60);
        buf.writeShort(4);
        buf.writeShort(10);
        buf.writeShort(0xc000 | ALIAS_OFFSET);
        return buf;
    }

    /**
     * Returns an OPT record advertising {@code udpPayloadSize} and carrying empty options with the
     * given codes.
     */
    public static DnsRecord opt(int udpPayloadSize, int... optionCodes) {
        ByteBuf rdata = Unpooled.buffer();
        for (int code : optionCodes) {
            rdata.writeShort(code);
            rdata.writeShort(0);
        }
        return new DefaultDnsRawRecord("", DnsRecordType.OPT, udpPayloadSize, 0, rdata);
    }

    /**
     * Returns a response with one A record of 192.0.2.1 for {@code name}.
     */
    public static DnsResponse response(int id, String name) {
        return response(id, name, 1);
    }

    public static DnsResponse response(int id, String name, int answers) {
        DnsResponse response = new DefaultDnsResponse(id);
        response.setRecursionDesired(true);
        response.setRecursionAvailable(true);
        response.addRecord(DnsSection.QUESTION, new DefaultDnsQuestion(name, DnsRecordType.A));
        for (int i = 0; i < answers; i++) {
            response.addRecord(DnsSection.ANSWER, new DefaultDnsRawRecord(name, DnsRecordType.A, 60,
                    Unpooled.wrappedBuffer(new byte[] { (byte) 192, 0, 2, (byte) (i + 1) })));
        }
        return response;
    }

    /**
     * Encodes and releases {@code message}.
     */
    public static ByteBuf encode(DnsMessage message) {
        try {
            return DnsMessageCodec.encode(UnpooledByteBufAllocator.DEFAULT, message);
        } finally {
            message.release();
        }
    }

    /**
     * Encodes, frames and releases {@code message}.
     */
    public static ByteBuf encodeFramed(DnsMessage message) {
        ByteBuf encoded = encode(message);
        try {
            return DnsFraming.frame(UnpooledByteBufAllocator.DEFAULT, encoded);
        } finally {
            encoded.release();
        }
    }
}
