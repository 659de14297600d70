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
import io.netty.handler.codec.dns.DnsMessage;
import io.netty.handler.codec.dns.DnsOptEcsRecord;
import io.netty.handler.codec.dns.DnsRawRecord;
import io.netty.handler.codec.dns.DnsRecord;
import io.netty.handler.codec.dns.DnsRecordType;
import io.netty.handler.codec.dns.DnsSection;

/**
 * Reads EDNS(0) information from the OPT pseudo-record of a message.
 */
public final class EdnsOptions {

    /**
     * {@code edns-client-subnet}.
     */
    public static final int CLIENT_SUBNET = 8;

    /**
     * {@code edns-tcp-keepalive}. Any message carrying it on a DNS-over-QUIC connection is a fatal
     * error for that connection.
     */
    public static final int TCP_KEEPALIVE = 11;

    private EdnsOptions() {
    }

    /**
     * Returns the OPT pseudo-record of {@code message}, or {@code null}.
     */
    public static DnsRecord optRecord(DnsMessage message) {
        int count = message.count(DnsSection.ADDITIONAL);
        for (int i = 0; i < count; i++) {
            DnsRecord record = message.recordAt(DnsSection.ADDITIONAL, i);
            if (record.type() == DnsRecordType.OPT) {
                return record;
            }
        }
        return null;
    }

    /**
     * Returns the UDP payload size advertised by {@code message}, or {@code -1} if it carries no
     * OPT record.
     */
    public static int udpPayloadSize(DnsMessage message) {
        DnsRecord opt = optRecord(message);
        return opt == null ? -1 : opt.dnsClass();
    }

    /**
     * Returns {@code true} if the OPT record of {@code message} carries an option with the given code.
     */
    public static boolean containsOption(DnsMessage message, int code) {
        DnsRecord opt = optRecord(message);
        if (opt instanceof DnsRawRecord) {
            return containsOption(((DnsRawRecord) opt).content(), code);
        }
        if (opt instanceof DnsOptEcsRecord) {
            return code == CLIENT_SUBNET;
        }
        return false;
    }

    private static boolean containsOption(ByteBuf rdata, int code) {
        int idx = rdata.readerIndex();
        int end = rdata.writerIndex();
        // code(2) length(2) data(length)
        while (end - idx >= 4) {
            if (rdata.getUnsignedShort(idx) == code) {
                return true;
            }
            idx += 4 + rdata.getUnsignedShort(idx + 2);
        }
        return false;
    }
}
