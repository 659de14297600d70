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

import io.netty.contrib.dnsrelay.DnsProtocol;
import io.netty.contrib.dnsrelay.TestMessages;
import io.netty.handler.codec.dns.DnsQuery;
import io.netty.handler.codec.dns.DnsSection;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class DnsRequestTest {

    @Test
    public void testSizeWithoutEdns() {
        DnsQuery query = TestMessages.query(1, "example.com.");
        try {
            assertEquals(DnsRequest.MIN_UDP_SIZE, new DnsRequest(query, DnsProtocol.UDP, null, null).size());
        } finally {
            query.release();
        }
    }

    @Test
    public void testSizeFromEdns() {
        DnsQuery query = TestMessages.query(1, "example.com.");
        query.addRecord(DnsSection.ADDITIONAL, TestMessages.opt(1232));
        try {
            assertEquals(1232, new DnsRequest(query, DnsProtocol.UDP, null, null).size());
        } finally {
            query.release();
        }
    }

    @Test
    public void testSizeIsFlooredAtMinimum() {
        DnsQuery query = TestMessages.query(1, "example.com.");
        query.addRecord(DnsSection.ADDITIONAL, TestMessages.opt(100));
        try {
            assertEquals(DnsRequest.MIN_UDP_SIZE, new DnsRequest(query, DnsProtocol.UDP, null, null).size());
        } finally {
            query.release();
        }
    }

    @Test
    public void testSizeOnStream() {
        DnsQuery query = TestMessages.query(1, "example.com.");
        query.addRecord(DnsSection.ADDITIONAL, TestMessages.opt(1232));
        try {
            assertEquals(0xFFFF, new DnsRequest(query, DnsProtocol.TCP, null, null).size());
        } finally {
            query.release();
        }
    }

    @Test
    public void testQuestion() {
        DnsQuery query = TestMessages.query(42, "example.com.");
        try {
            DnsRequest request = new DnsRequest(query, DnsProtocol.UDP, null, null);
            assertEquals(42, request.id());
            assertEquals("example.com.", request.question().name());
        } finally {
            query.release();
        }
    }
}
