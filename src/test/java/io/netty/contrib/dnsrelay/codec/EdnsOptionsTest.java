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
import io.netty.contrib.dnsrelay.TestMessages;
import io.netty.handler.codec.dns.DefaultDnsOptEcsRecord;
import io.netty.handler.codec.dns.DnsQuery;
import io.netty.handler.codec.dns.DnsSection;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EdnsOptionsTest {

    @Test
    public void testNoOptRecord() {
        DnsQuery query = TestMessages.query(1, "example.com.");
        try {
            assertNull(EdnsOptions.optRecord(query));
            assertEquals(-1, EdnsOptions.udpPayloadSize(query));
            assertFalse(EdnsOptions.containsOption(query, EdnsOptions.TCP_KEEPALIVE));
        } finally {
            query.release();
        }
    }

    @Test
    public void testUdpPayloadSize() {
        DnsQuery query = TestMessages.query(1, "example.com.");
        query.addRecord(DnsSection.ADDITIONAL, TestMessages.opt(4096));
        try {
            assertEquals(4096, EdnsOptions.udpPayloadSize(query));
        } finally {
            query.release();
        }
    }

    @Test
    public void testContainsOption() {
        DnsQuery query = TestMessages.query(1, "example.com.");
        query.addRecord(DnsSection.ADDITIONAL, TestMessages.opt(1232, 10, EdnsOptions.TCP_KEEPALIVE));
        try {
            assertTrue(EdnsOptions.containsOption(query, EdnsOptions.TCP_KEEPALIVE));
            assertTrue(EdnsOptions.containsOption(query, 10));
            assertFalse(EdnsOptions.containsOption(query, EdnsOptions.CLIENT_SUBNET));
        } finally {
            query.release();
        }
    }

    @Test
    public void testContainsOptionAfterDecoding() {
        DnsQuery original = TestMessages.query(1, "example.com.");
        original.addRecord(DnsSection.ADDITIONAL, TestMessages.opt(1232, EdnsOptions.TCP_KEEPALIVE));
        ByteBuf encoded = TestMessages.encode(original);
        try {
            DnsQuery query = DnsMessageCodec.decodeQuery(encoded);
            try {
                assertEquals(1232, EdnsOptions.udpPayloadSize(query));
                assertTrue(EdnsOptions.containsOption(query, EdnsOptions.TCP_KEEPALIVE));
            } finally {
                query.release();
            }
        } finally {
            encoded.release();
        }
    }

    @Test
    public void testClientSubnetRecord() {
        DnsQuery query = TestMessages.query(1, "example.com.");
        query.addRecord(DnsSection.ADDITIONAL, new DefaultDnsOptEcsRecord(1232, 24, new byte[] { 10, 0, 0, 0 }));
        try {
            assertTrue(EdnsOptions.containsOption(query, EdnsOptions.CLIENT_SUBNET));
            assertFalse(EdnsOptions.containsOption(query, EdnsOptions.TCP_KEEPALIVE));
        } finally {
            query.release();
        }
    }
}
