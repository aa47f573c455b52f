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
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.CorruptedFrameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Read side of the VoltDB framing.
 * Frame format: [4-byte length BE] [payload]; emits the payload only.
 */
public class VoltFrameDecoder extends ByteToMessageDecoder {
    private static final Logger log = LoggerFactory.getLogger(VoltFrameDecoder.class);

    private final int maxFrameLength;

    public VoltFrameDecoder(int maxFrameLength) {
        this.maxFrameLength = maxFrameLength;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (in.readableBytes() < WireFramer.LENGTH_FIELD_SIZE) {
            return;
        }

        int length = in.getInt(in.readerIndex());
        if (length < 0 || length > maxFrameLength) {
            // the stream cannot be resynchronized after a bad length
            in.skipBytes(in.readableBytes());
            throw new CorruptedFrameException("Invalid frame length " + length + " (max " + maxFrameLength + ")");
        }

        if (in.readableBytes() < WireFramer.LENGTH_FIELD_SIZE + length) {
            return;
        }

        in.skipBytes(WireFramer.LENGTH_FIELD_SIZE);
        log.trace("Decoded frame with length={}", length);
        out.add(in.readRetainedSlice(length));
    }
}
