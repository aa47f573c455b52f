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

package io.voltwire.table;

import io.voltwire.exception.VoltInvalidArgumentException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A decoded VoltDB result table. Rows hold Java values per column type; SQL nulls are
 * represented as {@code null} entries.
 */
public final class VoltTable {

    private final byte status;
    private final List<VoltColumn> columns;
    private final List<List<Object>> rows;

    public VoltTable(byte status, List<VoltColumn> columns, List<List<Object>> rows) {
        this.status = status;
        this.columns = List.copyOf(columns);
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            if (row.size() != columns.size()) {
                throw new VoltInvalidArgumentException(
                        "Row has " + row.size() + " values but table has " + columns.size() + " columns");
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public byte status() {
        return status;
    }

    public List<VoltColumn> columns() {
        return columns;
    }

    public int columnCount() {
        return columns.size();
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * Returns the index of the named column, compared case-insensitively as VoltDB
     * upper-cases column names.
     *
     * @param name the column name
     * @return the column index, if present
     */
    public Optional<Integer> columnIndex(String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equalsIgnoreCase(name)) {
                return Optional.of(i);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns an accessor for the row at the given position.
     *
     * @param index the zero-based row index
     * @return the row
     * @throws VoltInvalidArgumentException if the index is out of range
     */
    public VoltTableRow row(int index) {
        if (index < 0 || index >= rows.size()) {
            throw new VoltInvalidArgumentException("Row index " + index + " out of range, table has " + rows.size());
        }
        return new VoltTableRow(this, rows.get(index));
    }

    public List<VoltTableRow> rows() {
        List<VoltTableRow> result = new ArrayList<>(rows.size());
        for (List<Object> values : rows) {
            result.add(new VoltTableRow(this, values));
        }
        return result;
    }

    @Override
    public String toString() {
        return "VoltTable{columns=" + columns + ", rowCount=" + rows.size() + "}";
    }
}
