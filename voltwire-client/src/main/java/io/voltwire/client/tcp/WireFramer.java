/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.voltwire.client.tcp;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;

/**
 * Write side of the VoltDB framing. Every frame is {@code [length:4 BE][payload:N]} where
 * the length counts the payload only. The login frame carries two extra version bytes
 * ahead of its payload, counted in the length.
 */
final class WireFramer {

    static final int LENGTH_FIELD_SIZE = 4;
    static final byte PROTOCOL_VERSION = 1;
    // 1 = SHA-256, matching BytesSerializer.serializeLoginMessage
    static final byte PASSWORD_HASH_VERSION = 1;
    private static final int LOGIN_HEADER_SIZE = 2;

    private WireFramer() {}

    /**
     * Builds a frame around the payload and releases the payload.
     *
     * @param alloc the channel allocator
     * @param payload the serialized message
     * @return the framed message, ready to be written
     */
    static ByteBuf frame(ByteBufAllocator alloc, ByteBuf payload) {
        try {
            int payloadSize = payload.readableBytes();
            ByteBuf frame = alloc.buffer(LENGTH_FIELD_SIZE + payloadSize);
            frame.writeInt(payloadSize);
            frame.writeBytes(payload, payload.readerIndex(), payloadSize);
            return frame;
        } finally {
            payload.release();
        }
    }

    static ByteBuf loginFrame(ByteBufAllocator alloc, ByteBuf payload) {
        try {
            int payloadSize = payload.readableBytes();
            ByteBuf frame = alloc.buffer(LENGTH_FIELD_SIZE + LOGIN_HEADER_SIZE + payloadSize);
            frame.writeInt(LOGIN_HEADER_SIZE + payloadSize);
            frame.writeByte(PROTOCOL_VERSION);
            frame.writeByte(PASSWORD_HASH_VERSION);
            frame.writeBytes(payload, payload.readerIndex(), payloadSize);
            return frame;
        } finally {
            payload.release();
        }
    }
}
