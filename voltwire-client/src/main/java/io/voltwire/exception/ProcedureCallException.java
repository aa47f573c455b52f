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

import org.apache.commons.lang3.StringUtils;

import java.util.Optional;

/**
 * Exception stored in a pending future when the server answered the procedure call
 * with a status other than {@link VoltStatus#SUCCESS}.
 */
public class ProcedureCallException extends VoltWireException {

    private final VoltStatus status;
    private final int rawStatus;
    private final Optional<String> statusString;
    private final int appStatus;
    private final Optional<String> appStatusString;

    /**
     * Constructs a new ProcedureCallException.
     *
     * @param rawStatus the raw status byte from the response
     * @param statusString the optional status description sent by the server
     * @param appStatus the application status byte set by the procedure
     * @param appStatusString the optional application status description
     */
    public ProcedureCallException(
            int rawStatus, Optional<String> statusString, int appStatus, Optional<String> appStatusString) {
        super(buildMessage(VoltStatus.fromCode(rawStatus), rawStatus, statusString, appStatusString));
        this.status = VoltStatus.fromCode(rawStatus);
        this.rawStatus = rawStatus;
        this.statusString = statusString;
        this.appStatus = appStatus;
        this.appStatusString = appStatusString;
    }

    public VoltStatus getStatus() {
        return status;
    }

    public int getRawStatus() {
        return rawStatus;
    }

    public Optional<String> getStatusString() {
        return statusString;
    }

    public int getAppStatus() {
        return appStatus;
    }

    public Optional<String> getAppStatusString() {
        return appStatusString;
    }

    private static String buildMessage(
            VoltStatus status, int rawStatus, Optional<String> statusString, Optional<String> appStatusString) {
        StringBuilder sb = new StringBuilder();
        sb.append("Procedure call failed [status=").append(rawStatus);
        if (status != VoltStatus.UNKNOWN) {
            sb.append(" (").append(status.name()).append(")");
        }
        sb.append("]");
        statusString.filter(StringUtils::isNotBlank).ifPresent(s -> sb.append(": ").append(s));
        appStatusString.filter(StringUtils::isNotBlank).ifPresent(s -> sb.append(" [app: ").append(s).append("]"));
        return sb.toString();
    }
}
