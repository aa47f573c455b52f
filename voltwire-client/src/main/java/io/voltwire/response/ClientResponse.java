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

package io.voltwire.response;

import io.voltwire.exception.ProcedureCallException;
import io.voltwire.exception.VoltStatus;
import io.voltwire.table.VoltTable;

import java.util.List;
import java.util.Optional;

/**
 * A decoded procedure response, correlated to its request by {@code clientHandle}.
 */
public record ClientResponse(
        long clientHandle,
        byte status,
        Optional<String> statusString,
        byte appStatus,
        Optional<String> appStatusString,
        int clusterRoundTripTime,
        List<VoltTable> tables) {

    public ClientResponse {
        tables = List.copyOf(tables);
    }

    public VoltStatus voltStatus() {
        return VoltStatus.fromCode(status);
    }

    public boolean isSuccess() {
        return status == VoltStatus.SUCCESS.getCode();
    }

    public ProcedureCallException toException() {
        return new ProcedureCallException(status, statusString, appStatus, appStatusString);
    }
}
