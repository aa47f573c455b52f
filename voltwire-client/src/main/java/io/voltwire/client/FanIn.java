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

import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Waits for a dynamically sized set of pending futures.
 *
 * <p>Every active future forwards its own completion into one shared queue, and the
 * waiting thread takes completions from that queue until none remain. Completions arrive
 * in whatever order the server answers.
 */
public final class FanIn {

    private FanIn() {}

    /**
     * Blocks until every future in the collection is resolved. Each future is reconciled
     * as it resolves: its outcome stays readable through {@link PendingFuture#get()} and
     * it leaves its connection's outstanding set. Futures that are already resolved are
     * reconciled without waiting. A failed future does not stop the wait for the others.
     *
     * @param futures the futures to wait for; duplicates are waited for once
     */
    public static void awaitAll(Collection<? extends PendingFuture<?>> futures) {
        Set<PendingFuture<?>> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
        distinct.addAll(futures);

        BlockingQueue<PendingFuture<?>> completions = new LinkedBlockingQueue<>();
        int remaining = 0;
        for (PendingFuture<?> future : distinct) {
            if (future.isActive()) {
                remaining++;
                future.whenResolved(() -> completions.add(future));
            } else {
                future.reconcile();
            }
        }

        boolean interrupted = false;
        try {
            while (remaining > 0) {
                try {
                    completions.take().reconcile();
                    remaining--;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
