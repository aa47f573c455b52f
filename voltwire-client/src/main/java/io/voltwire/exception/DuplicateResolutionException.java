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

package io.voltwire.exception;

/**
 * Exception thrown when a pending future is resolved a second time.
 *
 * <p>A handle is delivered to exactly once, so this always indicates a driver or
 * protocol bug rather than a condition to recover from.
 */
public class DuplicateResolutionException extends VoltWireException {

    private final long handle;

    public DuplicateResolutionException(long handle) {
        super("Pending future for handle " + handle + " is already resolved");
        this.handle = handle;
    }

    public long getHandle() {
        return handle;
    }
}
