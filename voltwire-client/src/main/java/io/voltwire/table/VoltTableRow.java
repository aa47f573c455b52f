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

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Read access to one row of a {@link VoltTable}, by column index or by column name.
 */
public final class VoltTableRow {

    private final VoltTable table;
    private final List<Object> values;

    VoltTableRow(VoltTable table, List<Object> values) {
        this.table = table;
        this.values = values;
    }

    public Object get(int columnIndex) {
        if (columnIndex < 0 || columnIndex >= values.size()) {
            throw new VoltInvalidArgumentException("Column index " + columnIndex + " out of range");
        }
        return values.get(columnIndex);
    }

    public Object get(String columnName) {
        return get(indexOf(columnName));
    }

    public boolean isNull(String columnName) {
        return get(columnName) == null;
    }

    public String getString(String columnName) {
        return typed(columnName, String.class);
    }

    /**
     * Returns an integral column value widened to {@code long}.
     *
     * @param columnName the column name
     * @return the value, or null for a SQL null
     * @throws VoltInvalidArgumentException if the column is not an integer type
     */
    public Long getLong(String columnName) {
        int index = indexOf(columnName);
        Object value = values.get(index);
        if (value == null) {
            return null;
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        throw wrongType(index, Long.class);
    }

    public Double getDouble(String columnName) {
        return typed(columnName, Double.class);
    }

    public BigDecimal getDecimal(String columnName) {
        return typed(columnName, BigDecimal.class);
    }

    public Instant getTimestamp(String columnName) {
        return typed(columnName, Instant.class);
    }

    public byte[] getVarbinary(String columnName) {
        return typed(columnName, byte[].class);
    }

    public List<Object> values() {
        return values;
    }

    private <T> T typed(String columnName, Class<T> type) {
        int index = indexOf(columnName);
        Object value = values.get(index);
        if (value == null || type.isInstance(value)) {
            return type.cast(value);
        }
        throw wrongType(index, type);
    }

    private VoltInvalidArgumentException wrongType(int index, Class<?> requested) {
        VoltColumn column = table.columns().get(index);
        return new VoltInvalidArgumentException("Column " + column.name() + " is " + column.type()
                + ", cannot be read as " + requested.getSimpleName());
    }

    private int indexOf(String columnName) {
        return table.columnIndex(columnName)
                .orElseThrow(() -> new VoltInvalidArgumentException("No column named " + columnName));
    }
}
