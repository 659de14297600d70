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
package io.netty.contrib.dnsrelay.proxy;

import io.netty.contrib.dnsrelay.codec.DnsResponses;
import io.netty.contrib.dnsrelay.request.DnsRequest;
import io.netty.contrib.dnsrelay.request.DnsResponseWriter;
import io.netty.contrib.dnsrelay.server.DnsQueryHandler;
import io.netty.contrib.dnsrelay.server.DnsServerContext;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.Promise;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import static io.netty.util.internal.ObjectUtil.checkNotNull;
import static io.netty.util.internal.ObjectUtil.checkPositive;

/**
 * Answers every query by relaying it through a {@link DnsProxy}.
 * <p>
 * A query failing on a stale cached connection is retried, up to {@code maxAttempts} tries in total.
 * Any other failure answers SERVFAIL and starts a health check of the upstream in the background.
 */
public class ForwardingQueryHandler implements DnsQueryHandler {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(ForwardingQueryHandler.class);

    private final DnsProxy proxy;
    private final RelayOptions options;
    private final int maxAttempts;

    public ForwardingQueryHandler(DnsProxy proxy) {
        this(proxy, RelayOptions.DEFAULT, 2);
    }

    public ForwardingQueryHandler(DnsProxy proxy, RelayOptions options, int maxAttempts) {
        this.proxy = checkNotNull(proxy, "proxy");
        this.options = checkNotNull(options, "options");
        this.maxAttempts = checkPositive(maxAttempts, "maxAttempts");
    }

    @Override
    public Future<Void> serveDns(DnsServerContext ctx, DnsResponseWriter writer, DnsRequest request) {
        Promise<Void> promise = ctx.executor().newPromise();
        relay(writer, request, 1, promise);
        return promise;
    }

    private void relay(final DnsResponseWriter writer, final DnsRequest request, final int attempt,
                       final Promise<Void> promise) {
        proxy.connect(request, options).addListener(new FutureListener<DnsResponse>() {
            @Override
            public void operationComplete(Future<DnsResponse> future) {
                if (future.isSuccess()) {
                    writer.writeMessage(future.getNow());
                    promise.trySuccess(null);
                    return;
                }
                Throwable cause = future.cause();
                if (cause instanceof StaleConnectionException && attempt < maxAttempts) {
                    logger.debug("Retrying {} on a new connection to {}", request, proxy.address());
                    relay(writer, request, attempt + 1, promise);
                    return;
                }
                logger.debug("Failed to relay {} to {}", request, proxy.address(), cause);
                proxy.healthCheck();
                writer.writeMessage(DnsResponses.serverFailure(request.query()));
                promise.trySuccess(null);
            }
        });
    }
}
