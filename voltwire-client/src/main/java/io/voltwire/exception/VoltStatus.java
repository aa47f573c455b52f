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

import java.util.HashMap;
import java.util.Map;

/**
 * Status codes carried in a VoltDB procedure response.
 */
public enum VoltStatus {
    SUCCESS(1),
    USER_ABORT(-1),
    GRACEFUL_FAILURE(-2),
    UNEXPECTED_FAILURE(-3),
    CONNECTION_LOST(-4),
    SERVER_UNAVAILABLE(-5),
    CONNECTION_TIMEOUT(-6),
    RESPONSE_UNKNOWN(-7),
    TXN_RESTART(-8),
    OPERATIONAL_FAILURE(-9),

    // Unknown status code
    UNKNOWN(Byte.MIN_VALUE);

    private static final Map<Integer, VoltStatus> CODE_MAP = new HashMap<>();

    static {
        for (VoltStatus status : values()) {
            CODE_MAP.put(status.code, status);
        }
    }

    private final int code;

    VoltStatus(int code) {
        this.code = code;
    }

    /**
     * Returns the numeric status code.
     *
     * @return the status code
     */
    public int getCode() {
        return code;
    }

    /**
     * Returns the VoltStatus for the given numeric code.
     *
     * @param code the numeric status code
     * @return the corresponding VoltStatus, or UNKNOWN if not found
     */
    public static VoltStatus fromCode(int code) {
        return CODE_MAP.getOrDefault(code, UNKNOWN);
    }
}
