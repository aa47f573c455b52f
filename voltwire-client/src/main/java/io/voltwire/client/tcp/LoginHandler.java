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
import io.voltwire.exception.VoltConnectException;
import io.voltwire.exception.VoltProtocolException;
import io.voltwire.exception.VoltWireException;
import io.voltwire.response.LoginResponse;
import io.voltwire.serde.BytesDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Consumes the login response, the first frame of every connection. On success it hands
 * the pipeline over to the network listener by replacing itself.
 */
class LoginHandler extends SimpleChannelInboundHandler<ByteBuf> {
    private static final Logger log = LoggerFactory.getLogger(LoginHandler.class);

    static final String LISTENER_NAME = "networkListener";

    private final CompletableFuture<LoginResponse> loginFuture;
    private final NetworkListener listener;

    LoginHandler(CompletableFuture<LoginResponse> loginFuture, NetworkListener listener) {
        this.loginFuture = loginFuture;
        this.listener = listener;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame) {
        LoginResponse response;
        try {
            response = BytesDeserializer.readLoginResponse(frame);
        } catch (VoltWireException e) {
            loginFuture.completeExceptionally(e);
            ctx.close();
            return;
        }
        log.debug(
                "Logged in to host {} as connection {}, server build {}",
                response.hostId(),
                response.connectionId(),
                response.buildString());
        ctx.pipeline().replace(this, LISTENER_NAME, listener);
        loginFuture.complete(response);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        loginFuture.completeExceptionally(new VoltProtocolException("Login handshake failed", cause));
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        loginFuture.completeExceptionally(new VoltConnectException("Connection closed during login handshake"));
        super.channelInactive(ctx);
    }
}
