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
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.EventLoopGroup;
import io.voltwire.client.ExecFuture;
import io.voltwire.client.FanIn;
import io.voltwire.client.HandleAllocator;
import io.voltwire.client.PendingFuture;
import io.voltwire.client.QueryFuture;
import io.voltwire.exception.ConnectionClosedException;
import io.voltwire.exception.SendException;
import io.voltwire.response.LoginResponse;
import io.voltwire.response.VoltResult;
import io.voltwire.response.VoltRows;
import io.voltwire.serde.BytesSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.LongFunction;
import java.util.stream.Collectors;

/**
 * A single logged-in TCP connection to a VoltDB server.
 *
 * <p>Every call allocates a handle, registers a pending future under it and writes the
 * invocation on the caller's own thread. The blocking variants then wait on that future;
 * the async variants return it and keep it in the connection's outstanding set until the
 * caller observes its outcome through {@link PendingFuture#get()} or {@link #drain}.
 * Responses are delivered by the connection's network listener in whatever order the
 * server completes them.
 *
 * <p>A failed write is reported synchronously with {@link SendException} and never
 * through a future. If the connection is lost, or closed with requests in flight, every
 * pending future is resolved with {@link io.voltwire.exception.ConnectionLostException}.
 *
 * <p>Calls must not be made from the listener thread, for example from a callback
 * running on a future's completion.
 */
public class VoltTcpConnection implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(VoltTcpConnection.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Channel channel;
    private final EventLoopGroup eventLoopGroup;
    private final LoginResponse loginResponse;
    private final HandleAllocator handleAllocator;
    private final HandleRegistry registry;
    private final NetworkListener listener;
    private final Set<QueryFuture> outstandingQueries = ConcurrentHashMap.newKeySet();
    private final Set<ExecFuture> outstandingExecs = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean open = new AtomicBoolean(true);

    VoltTcpConnection(
            Channel channel,
            EventLoopGroup eventLoopGroup,
            LoginResponse loginResponse,
            HandleAllocator handleAllocator,
            HandleRegistry registry,
            NetworkListener listener) {
        this.channel = channel;
        this.eventLoopGroup = eventLoopGroup;
        this.loginResponse = loginResponse;
        this.handleAllocator = handleAllocator;
        this.registry = registry;
        this.listener = listener;
    }

    /**
     * Creates a new builder for configuring and opening a connection.
     *
     * @return a new builder
     */
    public static VoltTcpConnectionBuilder builder() {
        return new VoltTcpConnectionBuilder();
    }

    /**
     * Opens a connection with empty credentials.
     *
     * @param address the server address as {@code host:port}
     * @return an open connection
     */
    public static VoltTcpConnection open(String address) {
        return builder().address(address).open();
    }

    /**
     * Calls a procedure and blocks until its result tables arrive.
     *
     * @param procedure the procedure name
     * @param args the procedure parameters
     * @return the returned tables
     * @throws ConnectionClosedException if the connection is closed
     * @throws SendException if the invocation could not be written
     * @throws io.voltwire.exception.VoltWireException the error the call resolved with
     */
    public VoltRows call(String procedure, Object... args) {
        QueryFuture future = submit(procedure, args, QueryFuture::new, registry::registerQuery, withdrawn -> {});
        return future.get();
    }

    /**
     * Calls a procedure without waiting for its result.
     *
     * @param procedure the procedure name
     * @param args the procedure parameters
     * @return the pending result, also tracked in {@link #outstandingQueries()}
     * @throws ConnectionClosedException if the connection is closed
     * @throws SendException if the invocation could not be written
     */
    public QueryFuture callAsync(String procedure, Object... args) {
        return submitTracked(
                procedure,
                args,
                handle -> new QueryFuture(handle, outstandingQueries::remove),
                registry::registerQuery,
                outstandingQueries);
    }

    public VoltResult exec(String procedure, Object... args) {
        ExecFuture future = submit(procedure, args, ExecFuture::new, registry::registerExec, withdrawn -> {});
        return future.get();
    }

    /**
     * Runs a procedure for its side effects without waiting for the result.
     *
     * <p>The returned future stays in {@link #outstandingExecs()} until the caller
     * observes it through {@link PendingFuture#get()}, {@link #drain} or
     * {@link #drainAllExecs()}, even after its response has arrived. Callers that issue
     * execs and never look at them should drain periodically.
     *
     * @param procedure the procedure name
     * @param args the procedure parameters
     * @return the pending result
     * @throws ConnectionClosedException if the connection is closed
     * @throws SendException if the invocation could not be written
     */
    public ExecFuture execAsync(String procedure, Object... args) {
        return submitTracked(
                procedure,
                args,
                handle -> new ExecFuture(handle, outstandingExecs::remove),
                registry::registerExec,
                outstandingExecs);
    }

    /**
     * Blocks until every given future is resolved. Individual failures stay in their
     * futures and do not interrupt the wait.
     *
     * @param futures futures issued by this connection
     */
    public void drain(Collection<? extends PendingFuture<?>> futures) {
        FanIn.awaitAll(futures);
    }

    /**
     * Drains every outstanding async query.
     *
     * @return the drained futures, in the order they were issued
     */
    public List<QueryFuture> drainAll() {
        List<QueryFuture> snapshot = outstandingQueries.stream()
                .sorted(Comparator.comparingLong(QueryFuture::handle))
                .collect(Collectors.toList());
        drain(snapshot);
        return snapshot;
    }

    /**
     * Drains every outstanding async exec.
     *
     * @return the drained futures, in the order they were issued
     */
    public List<ExecFuture> drainAllExecs() {
        List<ExecFuture> snapshot = outstandingExecs.stream()
                .sorted(Comparator.comparingLong(ExecFuture::handle))
                .collect(Collectors.toList());
        drain(snapshot);
        return snapshot;
    }

    /**
     * Returns a snapshot of the async queries whose outcome the caller has not observed yet.
     *
     * @return a copy of the outstanding set; the futures themselves are shared
     */
    public Set<QueryFuture> outstandingQueries() {
        return Set.copyOf(outstandingQueries);
    }

    public Set<ExecFuture> outstandingExecs() {
        return Set.copyOf(outstandingExecs);
    }

    public LoginResponse loginResponse() {
        return loginResponse;
    }

    public boolean isOpen() {
        return open.get() && channel.isActive();
    }

    /**
     * Returns how many responses arrived for handles with no pending future.
     *
     * @return the number of dropped responses
     */
    public long orphanedResponses() {
        return listener.orphanedResponses();
    }

    /**
     * Stops the network listener, closes the socket and waits for the listener to
     * terminate. Requests still in flight end with a connection-lost error. Calling close
     * again has no effect.
     */
    @Override
    public void close() {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        log.debug("Closing connection {} to {}", loginResponse.connectionId(), channel.remoteAddress());
        listener.stop();
        ChannelFuture closeFuture = channel.close().awaitUninterruptibly();
        listener.awaitTermination();
        if (eventLoopGroup != null) {
            eventLoopGroup
                    .shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                    .awaitUninterruptibly();
        }
        if (!closeFuture.isSuccess()) {
            log.warn("Failed to close channel to {}", channel.remoteAddress(), closeFuture.cause());
        }
    }

    private <F extends PendingFuture<?>> F submitTracked(
            String procedure, Object[] args, LongFunction<F> factory, Consumer<F> register, Set<F> outstanding) {
        return submit(
                procedure,
                args,
                factory,
                future -> {
                    register.accept(future);
                    outstanding.add(future);
                },
                outstanding::remove);
    }

    private <F extends PendingFuture<?>> F submit(
            String procedure,
            Object[] args,
            LongFunction<F> factory,
            Consumer<F> register,
            Consumer<F> withdraw) {
        ensureOpen();
        long handle = handleAllocator.next();
        ByteBuf payload = BytesSerializer.serializeStatement(procedure, handle, args);
        F future = factory.apply(handle);
        try {
            register.accept(future);
        } catch (ConnectionClosedException e) {
            payload.release();
            throw e;
        }

        ChannelFuture write = channel.writeAndFlush(WireFramer.frame(channel.alloc(), payload))
                .awaitUninterruptibly();
        if (!write.isSuccess()) {
            registry.remove(handle);
            withdraw.accept(future);
            log.warn("Failed to send {} with handle {}", procedure, handle, write.cause());
            throw new SendException(handle, write.cause());
        }
        log.trace("Sent {} with handle {}", procedure, handle);
        return future;
    }

    private void ensureOpen() {
        if (!open.get()) {
            throw new ConnectionClosedException();
        }
        if (!channel.isActive()) {
            throw new ConnectionClosedException("Connection to " + channel.remoteAddress() + " was lost");
        }
    }
}
