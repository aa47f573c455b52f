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

package io.voltwire.testing;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.GlobalEventExecutor;
import io.voltwire.client.tcp.VoltFrameDecoder;
import io.voltwire.serde.BytesDeserializer;
import io.voltwire.table.VoltTable;
import io.voltwire.testing.ServerWire.Invocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * In-process VoltDB stand-in that speaks the client wire protocol over loopback TCP.
 */
public final class FakeVoltServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FakeVoltServer.class);

    public static final int HOST_ID = 0;
    public static final long CLUSTER_START = 1_700_000_000_000L;
    public static final int LEADER_ADDRESS = 0x7F000001;
    public static final String BUILD = "fake-volt-13.0";

    private final ProcedureHandler handler;
    private final EventLoopGroup group = new NioEventLoopGroup(2);
    private final ChannelGroup children = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
    private final List<Invocation> invocations = new CopyOnWriteArrayList<>();
    private final List<String> logins = new CopyOnWriteArrayList<>();
    private int authResult;
    private boolean silentLogin;
    private int heldResponses;
    private long nextConnectionId = 1;
    private Channel serverChannel;

    public FakeVoltServer(ProcedureHandler handler) {
        this.handler = handler;
    }

    /** Rejects every login with the given non-zero auth result. */
    public FakeVoltServer rejectLogins(int authResult) {
        this.authResult = authResult;
        return this;
    }

    /** Never answers the login handshake. */
    public FakeVoltServer silentLogin() {
        this.silentLogin = true;
        return this;
    }

    /**
     * Buffers responses until {@code count} of them are pending on a connection, then
     * sends them in reverse order.
     */
    public FakeVoltServer holdResponses(int count) {
        this.heldResponses = count;
        return this;
    }

    public FakeVoltServer start() {
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        children.add(ch);
                        ch.pipeline()
                                .addLast(new VoltFrameDecoder(1024 * 1024))
                                .addLast(new ServerHandler(nextConnectionId()));
                    }
                });
        serverChannel = bootstrap.bind("127.0.0.1", 0).syncUninterruptibly().channel();
        log.debug("Fake VoltDB server listening on {}", serverChannel.localAddress());
        return this;
    }

    public int port() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public String address() {
        return "127.0.0.1:" + port();
    }

    public List<Invocation> invocations() {
        return List.copyOf(invocations);
    }

    public List<String> logins() {
        return List.copyOf(logins);
    }

    /** Closes every accepted client connection from the server side. */
    public void dropConnections() {
        children.close().awaitUninterruptibly();
    }

    @Override
    public void close() {
        if (serverChannel != null) {
            serverChannel.close().awaitUninterruptibly();
        }
        children.close().awaitUninterruptibly();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
    }

    private synchronized long nextConnectionId() {
        return nextConnectionId++;
    }

    @FunctionalInterface
    public interface ProcedureHandler {
        Reply handle(Invocation invocation);
    }

    public record Reply(byte status, String statusString, List<VoltTable> tables) {

        public static Reply success(VoltTable... tables) {
            return new Reply((byte) 1, null, List.of(tables));
        }

        public static Reply failure(byte status, String statusString) {
            return new Reply(status, statusString, List.of());
        }
    }

    private final class ServerHandler extends SimpleChannelInboundHandler<ByteBuf> {

        private final long connectionId;
        private final List<ByteBuf> held = new ArrayList<>();
        private boolean loggedIn;

        ServerHandler(long connectionId) {
            this.connectionId = connectionId;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame) {
            if (!loggedIn) {
                loggedIn = true;
                login(ctx, frame);
                return;
            }
            Invocation invocation = ServerWire.readInvocation(frame);
            invocations.add(invocation);
            Reply reply = handler.handle(invocation);
            ByteBuf response = ServerWire.frame(ServerWire.clientResponse(
                    invocation.handle(), reply.status(), reply.statusString(), reply.tables()));
            if (heldResponses <= 0) {
                ctx.writeAndFlush(response);
                return;
            }
            held.add(response);
            if (held.size() >= heldResponses) {
                Collections.reverse(held);
                held.forEach(ctx::write);
                held.clear();
                ctx.flush();
            }
        }

        private void login(ChannelHandlerContext ctx, ByteBuf frame) {
            frame.skipBytes(2); // protocol and password hash versions
            BytesDeserializer.readString(frame); // service
            logins.add(BytesDeserializer.readString(frame));
            if (silentLogin) {
                return;
            }
            ctx.writeAndFlush(ServerWire.frame(ServerWire.loginResponse(
                    authResult, HOST_ID, connectionId, CLUSTER_START, LEADER_ADDRESS, BUILD)));
            if (authResult != 0) {
                ctx.close();
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            held.forEach(ByteBuf::release);
            held.clear();
            ctx.fireChannelInactive();
        }
    }
}
