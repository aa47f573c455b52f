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
 * Exception thrown synchronously when a request could not be written to the server.
 * The handle allocated for the request has already been released when this is thrown,
 * so no pending future is left behind.
 */
public class SendException extends VoltWireException {

    private final long handle;

    public SendException(long handle, Throwable cause) {
        super("Failed to send request with handle " + handle, cause);
        this.handle = handle;
    }

    /**
     * Returns the handle of the request that could not be sent.
     *
     * @return the handle
     */
    public long getHandle() {
        return handle;
    }
}
