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
import io.netty.buffer.ByteBufAllocator;

/**
 * The 2-byte big-endian length prefix that delimits one DNS message on stream transports
 * (TCP, TLS and QUIC streams).
 */
public final class DnsFraming {

    /**
     * Length of the prefix.
     */
    public static final int LENGTH_FIELD_LENGTH = 2;

    /**
     * The smallest input {@link #unframe(ByteBuf)} accepts: a 12-byte header and a 5-byte question
     * for the root name.
     */
    public static final int MIN_MESSAGE_SIZE = 12 + 5;

    /**
     * The largest DNS message a length prefix can describe.
     */
    public static final int MAX_MESSAGE_SIZE = 0xFFFF;

    private DnsFraming() {
    }

    /**
     * Returns a new buffer holding the length prefix followed by the readable bytes of
     * {@code payload}. The reader index and reference count of {@code payload} are left untouched.
     */
    public static ByteBuf frame(ByteBufAllocator alloc, ByteBuf payload) {
        int length = payload.readableBytes();
        ByteBuf frame = alloc.buffer(LENGTH_FIELD_LENGTH + length);
        frame.writeShort(length);
        frame.writeBytes(payload, payload.readerIndex(), length);
        return frame;
    }

    /**
     * Validates the length prefix at the reader index of {@code frame} and returns a slice of the
     * message it announces, or {@code null} if the input is shorter than {@link #MIN_MESSAGE_SIZE}
     * or the announced length does not equal the number of bytes following the prefix. The slice
     * shares content and reference count with {@code frame}.
     */
    public static ByteBuf unframe(ByteBuf frame) {
        int readable = frame.readableBytes();
        if (readable < MIN_MESSAGE_SIZE) {
            return null;
        }
        int length = frame.getUnsignedShort(frame.readerIndex());
        if (length != readable - LENGTH_FIELD_LENGTH) {
            return null;
        }
        return frame.slice(frame.readerIndex() + LENGTH_FIELD_LENGTH, length);
    }
}
