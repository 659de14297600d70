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

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.contrib.dnsrelay.codec.DnsFraming;
import io.netty.util.internal.MathUtil;
import io.netty.util.internal.PlatformDependent;
import io.netty.util.internal.SystemPropertyUtil;

import java.util.Queue;

import static io.netty.util.internal.ObjectUtil.checkPositive;

/**
 * A bounded free-list of buffers large enough for one framed DNS message.
 * <p>
 * {@link #acquire()} never blocks: when the list is empty a new buffer is allocated. {@link #release(ByteBuf)}
 * keeps at most {@link #maxPooled()} buffers and lets the others go. The bound given to the constructor is
 * rounded up to a power of two, and is at least two. This class is thread-safe.
 */
public final class DnsBufferPool {

    /**
     * The capacity of every buffer, the length prefix plus the largest DNS message.
     */
    public static final int BUFFER_SIZE = DnsFraming.LENGTH_FIELD_LENGTH + DnsFraming.MAX_MESSAGE_SIZE;

    static final int DEFAULT_MAX_POOLED =
            SystemPropertyUtil.getInt("io.netty.contrib.dnsrelay.maxPooledBuffers", 256);

    private final Queue<ByteBuf> free;
    private final int maxPooled;

    public DnsBufferPool() {
        this(DEFAULT_MAX_POOLED);
    }

    public DnsBufferPool(int maxPooled) {
        this.maxPooled = Math.max(2, MathUtil.safeFindNextPositivePowerOfTwo(checkPositive(maxPooled, "maxPooled")));
        free = PlatformDependent.newFixedMpmcQueue(this.maxPooled);
    }

    /**
     * Returns the most buffers this pool keeps.
     */
    public int maxPooled() {
        return maxPooled;
    }

    /**
     * Returns an empty buffer of {@link #BUFFER_SIZE} bytes owned by the caller until it is
     * {@linkplain #release(ByteBuf) released}.
     */
    public ByteBuf acquire() {
        ByteBuf buf = free.poll();
        if (buf == null) {
            return Unpooled.buffer(BUFFER_SIZE, BUFFER_SIZE);
        }
        return buf;
    }

    /**
     * Gives {@code buf} back. The caller must not use it afterwards.
     */
    public void release(ByteBuf buf) {
        if (buf.capacity() != BUFFER_SIZE || buf.refCnt() != 1) {
            buf.release();
            return;
        }
        buf.clear();
        if (!free.offer(buf)) {
            buf.release();
        }
    }

    /**
     * Returns the number of buffers ready to be handed out without allocation.
     */
    public int available() {
        return free.size();
    }

    /**
     * Drops every pooled buffer.
     */
    public void clear() {
        ByteBuf buf;
        while ((buf = free.poll()) != null) {
            buf.release();
        }
    }
}
