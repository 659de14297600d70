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

import io.netty.contrib.dnsrelay.TestMessages;
import io.netty.handler.codec.dns.DnsQuery;
import io.netty.handler.codec.dns.DnsQuestion;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.handler.codec.dns.DnsResponseCode;
import io.netty.handler.codec.dns.DnsSection;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DnsResponsesTest {

    @Test
    public void testServerFailure() {
        DnsQuery query = TestMessages.query(77, "example.org.");
        DnsResponse response = DnsResponses.serverFailure(query);
        try {
            assertEquals(77, response.id());
            assertEquals(DnsResponseCode.SERVFAIL, response.code());
            assertEquals(query.opCode(), response.opCode());
            assertTrue(response.isRecursionDesired());
            assertEquals(1, response.count(DnsSection.QUESTION));
            DnsQuestion question = response.recordAt(DnsSection.QUESTION);
            assertEquals("example.org.", question.name());
            assertEquals(0, response.count(DnsSection.ANSWER));
        } finally {
            response.release();
            query.release();
        }
    }

    @Test
    public void testTruncated() {
        DnsResponse full = TestMessages.response(5, "example.org.", 3);
        DnsResponse truncated = DnsResponses.truncated(full);
        try {
            assertEquals(5, truncated.id());
            assertTrue(truncated.isTruncated());
            assertTrue(truncated.isRecursionAvailable());
            assertEquals(1, truncated.count(DnsSection.QUESTION));
            assertEquals(0, truncated.count(DnsSection.ANSWER));
            assertEquals(3, full.count(DnsSection.ANSWER));
        } finally {
            truncated.release();
            full.release();
        }
    }
}
