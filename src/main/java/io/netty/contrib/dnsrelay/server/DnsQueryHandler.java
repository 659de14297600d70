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

import io.netty.contrib.dnsrelay.request.DnsRequest;
import io.netty.contrib.dnsrelay.request.DnsResponseWriter;
import io.netty.util.concurrent.Future;

/**
 * Answers queries received by a DNS server.
 * <p>
 * A handler answers through the writer, at most once, and completes the returned future when it is
 * done. Not writing anything is a valid answer; the server then sends no response. The request and
 * its query stay owned by the server and must not be used after the future completed.
 */
public interface DnsQueryHandler {

    Future<Void> serveDns(DnsServerContext ctx, DnsResponseWriter writer, DnsRequest request);
}
