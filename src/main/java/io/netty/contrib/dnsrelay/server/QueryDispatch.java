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

import io.netty.contrib.dnsrelay.request.CapturingResponseWriter;
import io.netty.contrib.dnsrelay.request.DnsRequest;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

/**
 * Runs a {@link DnsQueryHandler} for one request and hands the captured response to the transport.
 */
final class QueryDispatch {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(QueryDispatch.class);

    /**
     * Sends the response of one exchange back to the client.
     */
    interface ResponseSink {

        /**
         * Called once on the executor of the exchange, with the first response the handler wrote or
         * {@code null} if there is none. The response is released once this method returns, so it
         * must be encoded before.
         */
        void send(DnsResponse response);
    }

    private QueryDispatch() {
    }

    /**
     * Serves {@code request} and takes ownership of its query, which is released after
     * {@code sink} was called.
     */
    static void dispatch(DnsQueryHandler handler, final DnsServerContext ctx, final DnsRequest request,
                         final ResponseSink sink) {
        final CapturingResponseWriter writer =
                new CapturingResponseWriter(ctx.localAddress(), request.remoteAddress());
        final Future<Void> future;
        try {
            future = handler.serveDns(ctx, writer, request);
        } catch (Throwable cause) {
            logger.warn("{} failed to serve {}", handler, request, cause);
            complete(writer, request, sink, false);
            return;
        }
        future.addListener(new FutureListener<Void>() {
            @Override
            public void operationComplete(final Future<Void> future) {
                EventExecutor executor = ctx.executor();
                if (executor.inEventLoop()) {
                    complete(writer, request, sink, isSuccess(future, request));
                } else {
                    executor.execute(new Runnable() {
                        @Override
                        public void run() {
                            complete(writer, request, sink, isSuccess(future, request));
                        }
                    });
                }
            }
        });
    }

    private static boolean isSuccess(Future<Void> future, DnsRequest request) {
        if (future.isSuccess()) {
            return true;
        }
        logger.debug("Failed to serve {}", request, future.cause());
        return false;
    }

    private static void complete(CapturingResponseWriter writer, DnsRequest request, ResponseSink sink,
                                 boolean success) {
        try {
            sink.send(success ? writer.message() : null);
        } finally {
            writer.release();
            request.query().release();
        }
    }
}
