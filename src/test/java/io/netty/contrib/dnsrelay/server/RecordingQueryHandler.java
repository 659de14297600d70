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

import io.netty.contrib.dnsrelay.DnsProtocol;
import io.netty.contrib.dnsrelay.TestMessages;
import io.netty.contrib.dnsrelay.request.DnsRequest;
import io.netty.contrib.dnsrelay.request.DnsResponseWriter;
import io.netty.util.concurrent.Future;

import java.util.ArrayList;
import java.util.List;

/**
 * Answers every query with a fixed number of A records and remembers what it served.
 */
final class RecordingQueryHandler implements DnsQueryHandler {

    final List<DnsProtocol> protocols = new ArrayList<DnsProtocol>();
    final List<DnsServerContext> contexts = new ArrayList<DnsServerContext>();
    int answers = 1;
    boolean respond = true;

    @Override
    public Future<Void> serveDns(DnsServerContext ctx, DnsResponseWriter writer, DnsRequest request) {
        protocols.add(request.protocol());
        contexts.add(ctx);
        if (respond) {
            writer.writeMessage(TestMessages.response(request.id(), request.question().name(), answers));
        }
        return ctx.executor().newSucceededFuture(null);
    }

    int calls() {
        return protocols.size();
    }
}
