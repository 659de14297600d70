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

import io.netty.handler.codec.dns.DefaultDnsQuestion;
import io.netty.handler.codec.dns.DefaultDnsResponse;
import io.netty.handler.codec.dns.DnsMessage;
import io.netty.handler.codec.dns.DnsQuestion;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.handler.codec.dns.DnsResponseCode;
import io.netty.handler.codec.dns.DnsSection;

/**
 * Factory methods for responses a server synthesizes itself.
 */
public final class DnsResponses {

    private DnsResponses() {
    }

    /**
     * Returns an empty response to {@code request} with the given code, echoing the ID, opcode,
     * RD flag and question section of the request.
     */
    public static DnsResponse reply(DnsMessage request, DnsResponseCode code) {
        DnsResponse response = new DefaultDnsResponse(request.id(), request.opCode(), code);
        response.setRecursionDesired(request.isRecursionDesired());
        copyQuestions(request, response);
        return response;
    }

    /**
     * Returns a SERVFAIL response to {@code request}.
     */
    public static DnsResponse serverFailure(DnsMessage request) {
        return reply(request, DnsResponseCode.SERVFAIL);
    }

    /**
     * Returns a copy of the header and question section of {@code response} with the TC bit set,
     * telling the client to retry over a stream transport.
     */
    public static DnsResponse truncated(DnsResponse response) {
        DnsResponse truncated = new DefaultDnsResponse(response.id(), response.opCode(), response.code());
        truncated.setRecursionDesired(response.isRecursionDesired());
        truncated.setRecursionAvailable(response.isRecursionAvailable());
        truncated.setAuthoritativeAnswer(response.isAuthoritativeAnswer());
        truncated.setTruncated(true);
        copyQuestions(response, truncated);
        return truncated;
    }

    private static void copyQuestions(DnsMessage from, DnsMessage to) {
        int count = from.count(DnsSection.QUESTION);
        for (int i = 0; i < count; i++) {
            DnsQuestion question = from.recordAt(DnsSection.QUESTION, i);
            to.addRecord(DnsSection.QUESTION,
                    new DefaultDnsQuestion(question.name(), question.type(), question.dnsClass()));
        }
    }
}
