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

package io.voltwire.client;

import io.voltwire.response.ClientResponse;
import io.voltwire.response.VoltRows;

import java.util.function.Consumer;

/**
 * Pending result of a query call.
 */
public final class QueryFuture extends PendingFuture<VoltRows> {

    public QueryFuture(long handle, Consumer<PendingFuture<?>> reconciler) {
        super(handle, reconciler);
    }

    public QueryFuture(long handle) {
        this(handle, future -> {});
    }

    /**
     * Returns the query result, blocking while the call is in flight.
     *
     * @return the returned tables
     */
    public VoltRows rows() {
        return get();
    }

    @Override
    protected VoltRows decode(ClientResponse response) {
        return new VoltRows(response.tables());
    }
}
