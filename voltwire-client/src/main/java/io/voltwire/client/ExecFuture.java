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
import io.voltwire.response.VoltResult;

import java.util.function.Consumer;

/**
 * Pending result of an exec call.
 */
public final class ExecFuture extends PendingFuture<VoltResult> {

    public ExecFuture(long handle, Consumer<PendingFuture<?>> reconciler) {
        super(handle, reconciler);
    }

    public ExecFuture(long handle) {
        this(handle, future -> {});
    }

    public VoltResult result() {
        return get();
    }

    @Override
    protected VoltResult decode(ClientResponse response) {
        return new VoltResult(response.tables());
    }
}
