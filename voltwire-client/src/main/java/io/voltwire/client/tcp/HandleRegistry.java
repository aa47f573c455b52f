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

import io.voltwire.client.ExecFuture;
import io.voltwire.client.PendingFuture;
import io.voltwire.client.QueryFuture;
import io.voltwire.exception.ConnectionClosedException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Handle to future maps shared by the calling threads, which register and withdraw
 * handles, and the network listener, which takes them on delivery. All access goes
 * through one lock.
 *
 * <p>Once the listener terminates the registry is sealed: everything still registered is
 * handed back for failure and later registrations are refused, so no future can be
 * registered after the last chance to resolve it.
 */
final class HandleRegistry {

    private final Object lock = new Object();
    private final Map<Long, QueryFuture> queries = new HashMap<>();
    private final Map<Long, ExecFuture> execs = new HashMap<>();
    private boolean sealed;

    void registerQuery(QueryFuture future) {
        synchronized (lock) {
            ensureNotSealed();
            queries.put(future.handle(), future);
        }
    }

    void registerExec(ExecFuture future) {
        synchronized (lock) {
            ensureNotSealed();
            execs.put(future.handle(), future);
        }
    }

    /**
     * Removes and returns the future registered under the handle.
     *
     * @param handle the client handle
     * @return the future, or empty if the handle is not registered
     */
    Optional<PendingFuture<?>> take(long handle) {
        synchronized (lock) {
            PendingFuture<?> future = queries.remove(handle);
            if (future == null) {
                future = execs.remove(handle);
            }
            return Optional.ofNullable(future);
        }
    }

    boolean remove(long handle) {
        return take(handle).isPresent();
    }

    boolean contains(long handle) {
        synchronized (lock) {
            return queries.containsKey(handle) || execs.containsKey(handle);
        }
    }

    int size() {
        synchronized (lock) {
            return queries.size() + execs.size();
        }
    }

    List<PendingFuture<?>> seal() {
        synchronized (lock) {
            sealed = true;
            List<PendingFuture<?>> pending = new ArrayList<>(queries.size() + execs.size());
            pending.addAll(queries.values());
            pending.addAll(execs.values());
            queries.clear();
            execs.clear();
            return pending;
        }
    }

    private void ensureNotSealed() {
        if (sealed) {
            throw new ConnectionClosedException("Connection was lost, request not sent");
        }
    }
}
