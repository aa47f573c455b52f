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

/**
 * Netty-based TCP implementation of the VoltDB connection.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link io.voltwire.client.tcp.VoltTcpConnection}: a logged-in connection with
 *       blocking and async call entry points, drain and close</li>
 *   <li>{@link io.voltwire.client.tcp.VoltTcpConnectionBuilder}: fluent builder that
 *       connects and performs the login handshake</li>
 *   <li>{@link io.voltwire.client.tcp.VoltFrameDecoder}: splits the inbound byte stream
 *       into frames</li>
 * </ul>
 *
 * <h2>Protocol Details</h2>
 * <ul>
 *   <li><strong>Frame:</strong> {@code [length:4 BE][payload:N]}</li>
 *   <li><strong>Login frame:</strong> {@code [length:4 BE][protocol version:1][hash version:1][payload:N]}</li>
 * </ul>
 * <p>Each invocation carries a client handle that the server echoes in its response, so
 * responses are matched to requests by handle and may arrive in any order. Each
 * connection has its own single-threaded event loop, which is the only reader of its
 * socket.
 */
package io.voltwire.client.tcp;
