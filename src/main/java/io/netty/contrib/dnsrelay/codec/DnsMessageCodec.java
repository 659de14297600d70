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
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.EncoderException;
import io.netty.handler.codec.dns.DefaultDnsQuery;
import io.netty.handler.codec.dns.DefaultDnsResponse;
import io.netty.handler.codec.dns.DnsMessage;
import io.netty.handler.codec.dns.DnsOpCode;
import io.netty.handler.codec.dns.DnsQuery;
import io.netty.handler.codec.dns.DnsQuestion;
import io.netty.handler.codec.dns.DnsRecord;
import io.netty.handler.codec.dns.DnsRecordDecoder;
import io.netty.handler.codec.dns.DnsRecordEncoder;
import io.netty.handler.codec.dns.DnsResponse;
import io.netty.handler.codec.dns.DnsResponseCode;
import io.netty.handler.codec.dns.DnsSection;

/**
 * Converts whole DNS messages from and to their wire format, without any framing.
 * <p>
 * Decoded records may retain a slice of the input buffer, so the decoded message must be released
 * once it is no longer used, and the input must not be recycled while the message is alive.
 */
public final class DnsMessageCodec {

    /**
     * The length of the fixed DNS header.
     */
    public static final int HEADER_LENGTH = 12;

    private DnsMessageCodec() {
    }

    /**
     * Encodes {@code message} into a new buffer. A {@link DnsResponse} is encoded with the QR bit set.
     * A {@link WireDnsResponse} is written as it was received, with only its ID replaced.
     *
     * @throws EncoderException if a record cannot be encoded
     */
    public static ByteBuf encode(ByteBufAllocator alloc, DnsMessage message) {
        return encode(alloc, message, DnsRecordEncoder.DEFAULT);
    }

    public static ByteBuf encode(ByteBufAllocator alloc, DnsMessage message, DnsRecordEncoder encoder) {
        if (message instanceof WireDnsResponse) {
            return encodeWire(alloc, (WireDnsResponse) message);
        }
        ByteBuf buf = alloc.buffer(512);
        boolean success = false;
        try {
            encodeHeader(message, buf);
            encodeQuestions(encoder, message, buf);
            encodeRecords(encoder, message, DnsSection.ANSWER, buf);
            encodeRecords(encoder, message, DnsSection.AUTHORITY, buf);
            encodeRecords(encoder, message, DnsSection.ADDITIONAL, buf);
            success = true;
            return buf;
        } catch (EncoderException e) {
            throw e;
        } catch (Exception e) {
            throw new EncoderException(e);
        } finally {
            if (!success) {
                buf.release();
            }
        }
    }

    private static ByteBuf encodeWire(ByteBufAllocator alloc, WireDnsResponse response) {
        ByteBuf wire = response.wire();
        int length = wire.readableBytes();
        ByteBuf buf = alloc.buffer(length);
        buf.writeBytes(wire, wire.readerIndex(), length);
        buf.setShort(0, response.id());
        return buf;
    }

    /**
     * Decodes the readable bytes of {@code buf} as a query.
     *
     * @throws CorruptedFrameException if the message is a response or is truncated
     * @throws DecoderException if a record cannot be decoded
     */
    public static DnsQuery decodeQuery(ByteBuf buf) {
        return decodeQuery(buf, DnsRecordDecoder.DEFAULT);
    }

    public static DnsQuery decodeQuery(ByteBuf buf, DnsRecordDecoder decoder) {
        checkHeader(buf);
        int id = buf.readUnsignedShort();
        int flags = buf.readUnsignedShort();
        if (flags >> 15 == 1) {
            throw new CorruptedFrameException("not a query");
        }
        DnsQuery query = new DefaultDnsQuery(id, opCode(flags));
        query.setRecursionDesired((flags >> 8 & 1) == 1);
        query.setZ(flags >> 4 & 0x7);
        return decodeSections(decoder, query, buf);
    }

    /**
     * Decodes the readable bytes of {@code buf} as a response.
     *
     * @throws CorruptedFrameException if the message is a query or is truncated
     * @throws DecoderException if a record cannot be decoded
     */
    public static DnsResponse decodeResponse(ByteBuf buf) {
        return decodeResponse(buf, DnsRecordDecoder.DEFAULT);
    }

    public static DnsResponse decodeResponse(ByteBuf buf, DnsRecordDecoder decoder) {
        int flags = checkResponseHeader(buf);
        DnsResponse response = new DefaultDnsResponse(buf.readUnsignedShort(), opCode(flags), responseCode(flags));
        buf.skipBytes(2);
        return decodeSections(decoder, applyResponseFlags(response, flags), buf);
    }

    /**
     * Decodes the readable bytes of {@code buf} as a response that keeps a copy of its wire form, so
     * it can be relayed byte for byte. {@code buf} is not retained.
     *
     * @throws CorruptedFrameException if the message is a query or is truncated
     * @throws DecoderException if a record cannot be decoded
     */
    public static WireDnsResponse decodeWireResponse(ByteBuf buf) {
        int flags = checkResponseHeader(buf);
        ByteBuf wire = buf.copy();
        WireDnsResponse response = new WireDnsResponse(
                wire.getUnsignedShort(wire.readerIndex()), opCode(flags), responseCode(flags), wire);
        ByteBuf in = wire.duplicate();
        in.skipBytes(4);
        return decodeSections(DnsRecordDecoder.DEFAULT, applyResponseFlags(response, flags), in);
    }

    private static int checkResponseHeader(ByteBuf buf) {
        checkHeader(buf);
        int flags = buf.getUnsignedShort(buf.readerIndex() + 2);
        if (flags >> 15 == 0) {
            throw new CorruptedFrameException("not a response");
        }
        return flags;
    }

    private static DnsOpCode opCode(int flags) {
        return DnsOpCode.valueOf((byte) (flags >> 11 & 0xf));
    }

    private static DnsResponseCode responseCode(int flags) {
        return DnsResponseCode.valueOf((byte) (flags & 0xf));
    }

    private static <R extends DnsResponse> R applyResponseFlags(R response, int flags) {
        response.setRecursionDesired((flags >> 8 & 1) == 1);
        response.setAuthoritativeAnswer((flags >> 10 & 1) == 1);
        response.setTruncated((flags >> 9 & 1) == 1);
        response.setRecursionAvailable((flags >> 7 & 1) == 1);
        response.setZ(flags >> 4 & 0x7);
        return response;
    }

    private static void checkHeader(ByteBuf buf) {
        if (buf.readableBytes() < HEADER_LENGTH) {
            throw new CorruptedFrameException("message too short: " + buf.readableBytes() + " bytes");
        }
    }

    private static <M extends DnsMessage> M decodeSections(DnsRecordDecoder decoder, M message, ByteBuf buf) {
        boolean success = false;
        try {
            int questionCount = buf.readUnsignedShort();
            int answerCount = buf.readUnsignedShort();
            int authorityRecordCount = buf.readUnsignedShort();
            int additionalRecordCount = buf.readUnsignedShort();

            for (int i = questionCount; i > 0; --i) {
                message.addRecord(DnsSection.QUESTION, decoder.decodeQuestion(buf));
            }
            decodeRecords(decoder, message, DnsSection.ANSWER, buf, answerCount);
            decodeRecords(decoder, message, DnsSection.AUTHORITY, buf, authorityRecordCount);
            decodeRecords(decoder, message, DnsSection.ADDITIONAL, buf, additionalRecordCount);
            success = true;
            return message;
        } catch (DecoderException e) {
            throw e;
        } catch (Exception e) {
            throw new CorruptedFrameException(e);
        } finally {
            if (!success) {
                message.release();
            }
        }
    }

    private static void decodeRecords(DnsRecordDecoder decoder, DnsMessage message, DnsSection section,
                                      ByteBuf buf, int count) throws Exception {
        for (int i = count; i > 0; --i) {
            DnsRecord r = decoder.decodeRecord(buf);
            if (r == null) {
                throw new CorruptedFrameException("truncated " + section + " section");
            }
            message.addRecord(section, r);
        }
    }

    private static void encodeHeader(DnsMessage message, ByteBuf buf) {
        buf.writeShort(message.id());
        int flags = (message.opCode().byteValue() & 0xf) << 11;
        if (message.isRecursionDesired()) {
            flags |= 1 << 8;
        }
        flags |= (message.z() & 0x7) << 4;
        if (message instanceof DnsResponse) {
            DnsResponse response = (DnsResponse) message;
            flags |= 1 << 15;
            if (response.isAuthoritativeAnswer()) {
                flags |= 1 << 10;
            }
            if (response.isTruncated()) {
                flags |= 1 << 9;
            }
            if (response.isRecursionAvailable()) {
                flags |= 1 << 7;
            }
            flags |= response.code().intValue() & 0xf;
        }
        buf.writeShort(flags);
        buf.writeShort(message.count(DnsSection.QUESTION));
        buf.writeShort(message.count(DnsSection.ANSWER));
        buf.writeShort(message.count(DnsSection.AUTHORITY));
        buf.writeShort(message.count(DnsSection.ADDITIONAL));
    }

    private static void encodeQuestions(DnsRecordEncoder encoder, DnsMessage message, ByteBuf buf)
            throws Exception {
        int count = message.count(DnsSection.QUESTION);
        for (int i = 0; i < count; ++i) {
            encoder.encodeQuestion((DnsQuestion) message.recordAt(DnsSection.QUESTION, i), buf);
        }
    }

    private static void encodeRecords(DnsRecordEncoder encoder, DnsMessage message, DnsSection section,
                                      ByteBuf buf) throws Exception {
        int count = message.count(section);
        for (int i = 0; i < count; ++i) {
            encoder.encodeRecord(message.recordAt(section, i), buf);
        }
    }
}
