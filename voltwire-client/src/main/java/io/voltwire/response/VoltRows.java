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

import io.voltwire.exception.VoltInvalidArgumentException;
import io.voltwire.table.VoltTable;

import java.util.List;

/**
 * Result of a query call: the tables returned by the procedure, in order.
 */
public record VoltRows(List<VoltTable> tables) {

    public VoltRows {
        tables = List.copyOf(tables);
    }

    public int tableCount() {
        return tables.size();
    }

    public VoltTable table(int index) {
        if (index < 0 || index >= tables.size()) {
            throw new VoltInvalidArgumentException("Table index " + index + " out of range, response has " + tables.size());
        }
        return tables.get(index);
    }
}
