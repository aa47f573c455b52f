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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of client handles, the 64-bit keys that correlate a response with its request.
 *
 * <p>Handles are strictly increasing and never reused. Connections that share an
 * allocator never see colliding handles, including connections opened one after another.
 * {@link #processWide()} is the allocator connections use unless one is injected.
 */
public final class HandleAllocator {

    private static final HandleAllocator PROCESS_WIDE = new HandleAllocator();

    private final AtomicLong lastHandle;

    public HandleAllocator() {
        this(0);
    }

    /**
     * Creates an allocator whose first handle is {@code initialHandle + 1}.
     *
     * @param initialHandle the handle value preceding the first one returned
     */
    public HandleAllocator(long initialHandle) {
        this.lastHandle = new AtomicLong(initialHandle);
    }

    public static HandleAllocator processWide() {
        return PROCESS_WIDE;
    }

    /**
     * Returns the next handle. Safe for concurrent callers.
     *
     * @return a handle greater than every handle previously returned by this allocator
     */
    public long next() {
        return lastHandle.incrementAndGet();
    }
}
