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
import io.netty.channel.SimpleChannelInboundHandler;
import io.voltwire.client.PendingFuture;
import io.voltwire.client.Resolution;
import io.voltwire.exception.ConnectionLostException;
import io.voltwire.exception.VoltProtocolException;
import io.voltwire.response.ClientResponse;
import io.voltwire.serde.BytesDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sole reader of a connection. Runs on the connection's event loop thread, decodes each
 * response frame and delivers it to the future registered under its handle.
 *
 * <p>When the channel goes inactive, for whatever reason, every future still registered
 * is resolved with {@link ConnectionLostException} before termination is signalled.
 */
class NetworkListener extends SimpleChannelInboundHandler<ByteBuf> {
    private static final Logger log = LoggerFactory.getLogger(NetworkListener.class);

    private final HandleRegistry registry;
    private final AtomicLong orphanedResponses = new AtomicLong();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile ChannelHandlerContext context;

    NetworkListener(HandleRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        this.context = ctx;
        log.debug("Network listener started for {}", ctx.channel().remoteAddress());
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame) {
        Optional<Long> handle = BytesDeserializer.peekHandle(frame);
        ClientResponse response;
        try {
            response = BytesDeserializer.readClientResponse(frame);
        } catch (VoltProtocolException e) {
            Optional<PendingFuture<?>> future = handle.flatMap(registry::take);
            if (future.isPresent()) {
                log.warn("Malformed response for handle {}", handle.get(), e);
                future.get().resolveError(e);
            } else {
                log.error("Malformed response without a registered handle, closing connection", e);
                ctx.close();
            }
            return;
        }

        Optional<PendingFuture<?>> future = registry.take(response.clientHandle());
        if (future.isEmpty()) {
            long count = orphanedResponses.incrementAndGet();
            log.warn(
                    "Dropping response for unknown handle {} (status {}), {} dropped so far",
                    response.clientHandle(),
                    response.voltStatus(),
                    count);
            return;
        }
        log.trace("Delivering response for handle {} with status {}", response.clientHandle(), response.voltStatus());
        future.get().deliver(response);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Network listener failed, closing connection to {}", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        try {
            failPending(String.valueOf(ctx.channel().remoteAddress()));
        } finally {
            terminated.countDown();
        }
        super.channelInactive(ctx);
    }

    /**
     * Stops reading from the channel. Responses already buffered may still be delivered;
     * the channel itself is left open for the connection to close.
     */
    void stop() {
        ChannelHandlerContext ctx = context;
        if (ctx != null) {
            ctx.channel().config().setAutoRead(false);
        }
    }

    /**
     * Blocks until the listener has failed every pending future and will not touch the
     * registry again. Only meaningful once the channel has been closed.
     */
    void awaitTermination() {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    terminated.await();
                    return;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    boolean isTerminated() {
        return terminated.getCount() == 0;
    }

    long orphanedResponses() {
        return orphanedResponses.get();
    }

    private void failPending(String remoteAddress) {
        List<PendingFuture<?>> pending = registry.seal();
        if (!pending.isEmpty()) {
            log.debug("Connection to {} lost with {} request(s) in flight", remoteAddress, pending.size());
        }
        for (PendingFuture<?> future : pending) {
            var error = new ConnectionLostException(
                    "Connection to " + remoteAddress + " lost before response for handle " + future.handle());
            if (future.tryResolveError(error) == Resolution.ALREADY_RESOLVED) {
                log.error("Registered future {} was already resolved", future);
            }
        }
    }
}
