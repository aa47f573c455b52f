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

package io.voltwire.response;

/**
 * Session identity returned once by the server during the login handshake.
 *
 * @param hostId id of the host that accepted the connection
 * @param connectionId server-side id of this connection
 * @param clusterStartTimestamp cluster start time in milliseconds since the epoch
 * @param leaderAddress IPv4 address of the cluster leader, as a big-endian int
 * @param buildString server build description
 */
public record LoginResponse(
        int hostId, long connectionId, long clusterStartTimestamp, int leaderAddress, String buildString) {

    /**
     * Returns the leader address in dotted notation.
     *
     * @return the leader address, e.g. {@code 127.0.0.1}
     */
    public String leaderAddressString() {
        return ((leaderAddress >>> 24) & 0xFF) + "." + ((leaderAddress >>> 16) & 0xFF) + "."
                + ((leaderAddress >>> 8) & 0xFF) + "." + (leaderAddress & 0xFF);
    }
}
