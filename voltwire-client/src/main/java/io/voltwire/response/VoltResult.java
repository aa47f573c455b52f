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

import io.voltwire.table.VoltTable;

import java.util.List;

/**
 * Result of an exec call. Each DML statement of the procedure reports its modified
 * tuple count in the first cell of its result table.
 */
public record VoltResult(List<VoltTable> tables) {

    public VoltResult {
        tables = List.copyOf(tables);
    }

    /**
     * Returns the total number of rows modified by the procedure.
     *
     * @return the sum of the modification counts of all result tables
     */
    public long rowsAffected() {
        long total = 0;
        for (VoltTable table : tables) {
            if (table.rowCount() > 0 && table.columnCount() > 0) {
                Object count = table.row(0).get(0);
                if (count instanceof Number) {
                    total += ((Number) count).longValue();
                }
            }
        }
        return total;
    }
}
