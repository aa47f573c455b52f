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

import io.voltwire.exception.DuplicateResolutionException;
import io.voltwire.exception.VoltWireException;
import io.voltwire.response.ClientResponse;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;

/**
 * One-shot result cell for a request, correlated by its client handle.
 *
 * <p>A future starts {@link FutureState#ACTIVE} and is resolved exactly once, with a value
 * or with a {@link VoltWireException}. Resolving it again is a programming error:
 * {@link #resolveSuccess(Object)} and {@link #resolveError(VoltWireException)} throw
 * {@link DuplicateResolutionException}, while the {@code tryResolve} variants report
 * {@link Resolution#ALREADY_RESOLVED} to callers that prefer to check.
 *
 * <p>{@link #get()} blocks only the calling thread, and only while the future is active.
 * Once resolved, every call returns the same value or throws the same exception.
 *
 * @param <T> the decoded payload type
 */
public abstract class PendingFuture<T> {

    private final long handle;
    private final CompletableFuture<T> cell = new CompletableFuture<>();
    private final Consumer<PendingFuture<?>> reconciler;

    /**
     * Creates an active future.
     *
     * @param handle the client handle of the request
     * @param reconciler invoked each time the caller observes the outcome, used by the
     *        owning connection to drop the future from its outstanding set
     */
    protected PendingFuture(long handle, Consumer<PendingFuture<?>> reconciler) {
        this.handle = handle;
        this.reconciler = reconciler;
    }

    public long handle() {
        return handle;
    }

    public boolean isActive() {
        return !cell.isDone();
    }

    public FutureState state() {
        if (!cell.isDone()) {
            return FutureState.ACTIVE;
        }
        return cell.isCompletedExceptionally() ? FutureState.RESOLVED_ERROR : FutureState.RESOLVED_SUCCESS;
    }

    /**
     * Returns the result, blocking while the future is active.
     *
     * @return the decoded payload
     * @throws VoltWireException the error the future was resolved with
     */
    public T get() {
        try {
            return cell.join();
        } catch (CompletionException e) {
            throw (VoltWireException) e.getCause();
        } finally {
            reconcile();
        }
    }

    public Resolution tryResolveSuccess(T value) {
        return cell.complete(value) ? Resolution.RESOLVED : Resolution.ALREADY_RESOLVED;
    }

    public Resolution tryResolveError(VoltWireException error) {
        return cell.completeExceptionally(error) ? Resolution.RESOLVED : Resolution.ALREADY_RESOLVED;
    }

    public void resolveSuccess(T value) {
        if (tryResolveSuccess(value) == Resolution.ALREADY_RESOLVED) {
            throw new DuplicateResolutionException(handle);
        }
    }

    public void resolveError(VoltWireException error) {
        if (tryResolveError(error) == Resolution.ALREADY_RESOLVED) {
            throw new DuplicateResolutionException(handle);
        }
    }

    /**
     * Resolves this future from the server response for its handle. Called by the
     * network listener.
     *
     * @param response the decoded response
     * @throws DuplicateResolutionException if the future was already resolved
     */
    public void deliver(ClientResponse response) {
        if (!response.isSuccess()) {
            resolveError(response.toException());
            return;
        }
        T value;
        try {
            value = decode(response);
        } catch (VoltWireException e) {
            resolveError(e);
            return;
        }
        resolveSuccess(value);
    }

    /**
     * Converts a successful response into this future's payload type.
     *
     * @param response a response with status SUCCESS
     * @return the payload
     */
    protected abstract T decode(ClientResponse response);

    void whenResolved(Runnable action) {
        cell.whenComplete((value, error) -> action.run());
    }

    void reconcile() {
        reconciler.accept(this);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{handle=" + handle + ", state=" + state() + "}";
    }
}
