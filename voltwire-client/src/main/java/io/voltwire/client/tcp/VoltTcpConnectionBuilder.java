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

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.voltwire.VoltWire;
import io.voltwire.client.HandleAllocator;
import io.voltwire.exception.VoltConnectException;
import io.voltwire.exception.VoltInvalidArgumentException;
import io.voltwire.exception.VoltWireException;
import io.voltwire.response.LoginResponse;
import io.voltwire.serde.BytesSerializer;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Builder for opening configured {@link VoltTcpConnection} instances.
 *
 * <p>Example usage:
 * <pre>{@code
 * // Unsecured server on the default port
 * var connection = VoltTcpConnection.open("localhost:21212");
 *
 * // Explicit configuration
 * var connection = VoltTcpConnection.builder()
 *     .host("volt.example.com")
 *     .port(21212)
 *     .credentials("operator", "secret")
 *     .connectionTimeout(Duration.ofSeconds(5))
 *     .open();
 * }</pre>
 *
 * @see VoltTcpConnection#builder()
 */
public final class VoltTcpConnectionBuilder {
    private static final Logger log = LoggerFactory.getLogger(VoltTcpConnectionBuilder.class);

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 21212;
    public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_FRAME_LENGTH = 50 * 1024 * 1024;

    static final String FRAME_DECODER_NAME = "frameDecoder";
    static final String LOGIN_HANDLER_NAME = "loginHandler";

    private String host = DEFAULT_HOST;
    private Integer port = DEFAULT_PORT;
    private String username = "";
    private String password = "";
    private Duration connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
    private int maxFrameLength = DEFAULT_MAX_FRAME_LENGTH;
    private HandleAllocator handleAllocator = HandleAllocator.processWide();

    VoltTcpConnectionBuilder() {}

    /**
     * Sets the host address of the VoltDB server.
     *
     * @param host the host address
     * @return this builder
     */
    public VoltTcpConnectionBuilder host(String host) {
        this.host = host;
        return this;
    }

    /**
     * Sets the client port of the VoltDB server.
     *
     * @param port the port number
     * @return this builder
     */
    public VoltTcpConnectionBuilder port(Integer port) {
        this.port = port;
        return this;
    }

    /**
     * Sets host and port from a {@code host:port} string. The port may be omitted, in which
     * case the default client port is used. IPv6 hosts are written in brackets.
     *
     * @param address the server address
     * @return this builder
     * @throws VoltInvalidArgumentException if the address is blank or the port is not a number
     */
    public VoltTcpConnectionBuilder address(String address) {
        if (StringUtils.isBlank(address)) {
            throw new VoltInvalidArgumentException("Address cannot be null or empty");
        }
        String trimmed = address.trim();
        int portSeparator = trimmed.lastIndexOf(':');
        boolean bracketed = trimmed.startsWith("[");
        if (portSeparator < 0 || (bracketed && portSeparator < trimmed.indexOf(']'))) {
            this.host = StringUtils.strip(trimmed, "[]");
            this.port = DEFAULT_PORT;
            return this;
        }
        String portPart = trimmed.substring(portSeparator + 1);
        if (!NumberUtils.isDigits(portPart)) {
            throw new VoltInvalidArgumentException("Invalid port in address " + address);
        }
        this.host = StringUtils.strip(trimmed.substring(0, portSeparator), "[]");
        this.port = NumberUtils.toInt(portPart, -1);
        return this;
    }

    /**
     * Sets the credentials sent in the login handshake.
     *
     * @param username the username
     * @param password the clear text password, hashed before it is sent
     * @return this builder
     */
    public VoltTcpConnectionBuilder credentials(String username, String password) {
        this.username = username;
        this.password = password;
        return this;
    }

    /**
     * Sets the time allowed for connecting and for the login handshake each.
     *
     * @param connectionTimeout the timeout
     * @return this builder
     */
    public VoltTcpConnectionBuilder connectionTimeout(Duration connectionTimeout) {
        this.connectionTimeout = connectionTimeout;
        return this;
    }

    public VoltTcpConnectionBuilder maxFrameLength(int maxFrameLength) {
        this.maxFrameLength = maxFrameLength;
        return this;
    }

    /**
     * Sets the allocator for client handles. Connections that share an allocator never
     * reuse each other's handles. Defaults to {@link HandleAllocator#processWide()}.
     *
     * @param handleAllocator the allocator
     * @return this builder
     */
    public VoltTcpConnectionBuilder handleAllocator(HandleAllocator handleAllocator) {
        this.handleAllocator = handleAllocator;
        return this;
    }

    /**
     * Connects, logs in and starts the network listener.
     *
     * @return an open connection
     * @throws VoltInvalidArgumentException if the configuration is invalid
     * @throws VoltConnectException if the server cannot be reached, rejects the login, or
     *         does not answer the handshake in time
     * @throws io.voltwire.exception.VoltProtocolException if the login response cannot be decoded
     */
    public VoltTcpConnection open() {
        validate();
        var address = new InetSocketAddress(host, port);
        if (address.isUnresolved()) {
            throw new VoltConnectException("Error resolving " + host + ":" + port);
        }
        log.debug("Opening connection to {} with voltwire {}", address, VoltWire.version());

        EventLoopGroup eventLoopGroup = new NioEventLoopGroup(1);
        var registry = new HandleRegistry();
        var listener = new NetworkListener(registry);
        var loginFuture = new CompletableFuture<LoginResponse>();
        try {
            Channel channel = connect(eventLoopGroup, address, loginFuture, listener);
            ByteBuf login = WireFramer.loginFrame(
                    channel.alloc(), BytesSerializer.serializeLoginMessage(username, password));
            channel.writeAndFlush(login).addListener((ChannelFutureListener) writeFuture -> {
                if (!writeFuture.isSuccess()) {
                    loginFuture.completeExceptionally(
                            new VoltConnectException("Failed to send login to " + address, writeFuture.cause()));
                }
            });
            LoginResponse loginResponse = awaitLogin(loginFuture, address);
            log.info(
                    "Connected to {} (host {}, connection {}, leader {})",
                    address,
                    loginResponse.hostId(),
                    loginResponse.connectionId(),
                    loginResponse.leaderAddressString());
            return new VoltTcpConnection(channel, eventLoopGroup, loginResponse, handleAllocator, registry, listener);
        } catch (VoltWireException e) {
            eventLoopGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            throw e;
        }
    }

    private Channel connect(
            EventLoopGroup eventLoopGroup,
            InetSocketAddress address,
            CompletableFuture<LoginResponse> loginFuture,
            NetworkListener listener) {
        var bootstrap = new Bootstrap()
                .group(eventLoopGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectionTimeout.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(FRAME_DECODER_NAME, new VoltFrameDecoder(maxFrameLength));
                        pipeline.addLast(LOGIN_HANDLER_NAME, new LoginHandler(loginFuture, listener));
                    }
                });

        ChannelFuture connectFuture = bootstrap.connect(address).awaitUninterruptibly();
        if (!connectFuture.isSuccess()) {
            throw new VoltConnectException("Failed to connect to " + address, connectFuture.cause());
        }
        return connectFuture.channel();
    }

    private LoginResponse awaitLogin(CompletableFuture<LoginResponse> loginFuture, InetSocketAddress address) {
        try {
            return loginFuture.get(connectionTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof VoltWireException) {
                throw (VoltWireException) e.getCause();
            }
            throw new VoltConnectException("Login to " + address + " failed", e.getCause());
        } catch (TimeoutException e) {
            throw new VoltConnectException("Timed out waiting for login response from " + address, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VoltConnectException("Interrupted while logging in to " + address, e);
        }
    }

    private void validate() {
        if (StringUtils.isBlank(host)) {
            throw new VoltInvalidArgumentException("Host cannot be null or empty");
        }
        if (port == null || port <= 0 || port > 0xFFFF) {
            throw new VoltInvalidArgumentException("Port must be between 1 and 65535");
        }
        if (connectionTimeout == null || connectionTimeout.isNegative() || connectionTimeout.isZero()) {
            throw new VoltInvalidArgumentException("Connection timeout must be positive");
        }
        if (maxFrameLength <= 0) {
            throw new VoltInvalidArgumentException("Max frame length must be positive");
        }
        if (handleAllocator == null) {
            throw new VoltInvalidArgumentException("Handle allocator cannot be null");
        }
    }
}
