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
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VoltTableTest {

    private static final List<VoltColumn> COLUMNS =
            List.of(new VoltColumn("HELLO", VoltType.STRING), new VoltColumn("COUNT", VoltType.INTEGER));

    @Test
    void shouldLookUpColumnsCaseInsensitively() {
        // given
        var table = new VoltTable((byte) 0, COLUMNS, List.of(List.<Object>of("Hi", 3)));

        // when / then
        assertThat(table.columnIndex("hello")).contains(0);
        assertThat(table.columnIndex("Count")).contains(1);
        assertThat(table.columnIndex("missing")).isEmpty();
        assertThat(table.row(0).getString("hello")).isEqualTo("Hi");
        assertThat(table.row(0).getLong("count")).isEqualTo(3L);
    }

    @Test
    void shouldKeepNullValues() {
        // given
        var table = new VoltTable((byte) 0, COLUMNS, List.of(Arrays.<Object>asList("Hi", null)));

        // when
        VoltTableRow row = table.row(0);

        // then
        assertThat(row.isNull("COUNT")).isTrue();
        assertThat(row.getLong("COUNT")).isNull();
    }

    @Test
    void shouldRejectRowWithWrongArity() {
        assertThatThrownBy(() -> new VoltTable((byte) 0, COLUMNS, List.of(List.<Object>of("Hi"))))
                .isInstanceOf(VoltInvalidArgumentException.class);
    }

    @Test
    void shouldRejectRowIndexOutOfRange() {
        var table = new VoltTable((byte) 0, COLUMNS, List.of());

        assertThat(table.rowCount()).isZero();
        assertThatThrownBy(() -> table.row(0)).isInstanceOf(VoltInvalidArgumentException.class);
    }

    @Test
    void shouldRejectUnknownColumnName() {
        var table = new VoltTable((byte) 0, COLUMNS, List.of(List.<Object>of("Hi", 3)));

        assertThatThrownBy(() -> table.row(0).get("WORLD"))
                .isInstanceOf(VoltInvalidArgumentException.class)
                .hasMessageContaining("WORLD");
    }

    @Test
    void shouldNameColumnAndTypeWhenReadAsWrongType() {
        // given
        var row = new VoltTable((byte) 0, COLUMNS, List.of(List.<Object>of("Hi", 3))).row(0);

        // when / then
        assertThatThrownBy(() -> row.getTimestamp("COUNT"))
                .isInstanceOf(VoltInvalidArgumentException.class)
                .hasMessageContaining("COUNT")
                .hasMessageContaining("INTEGER");
        assertThatThrownBy(() -> row.getLong("HELLO"))
                .isInstanceOf(VoltInvalidArgumentException.class)
                .hasMessageContaining("HELLO")
                .hasMessageContaining("STRING");
        assertThatThrownBy(() -> row.getString("count")).isInstanceOf(VoltInvalidArgumentException.class);
        assertThatThrownBy(() -> row.getVarbinary("hello")).isInstanceOf(VoltInvalidArgumentException.class);
    }

    @Test
    void shouldReadNullOfAnyTypeThroughTypedAccessors() {
        var row = new VoltTable((byte) 0, COLUMNS, List.of(Arrays.<Object>asList(null, null))).row(0);

        assertThat(row.getDecimal("HELLO")).isNull();
        assertThat(row.getDouble("COUNT")).isNull();
    }

    @Test
    void shouldResolveTypesFromWireCodes() {
        assertThat(VoltType.fromCode((byte) 9)).isEqualTo(VoltType.STRING);
        assertThat(VoltType.fromCode((byte) 22)).isEqualTo(VoltType.DECIMAL);
        assertThatThrownBy(() -> VoltType.fromCode((byte) 99)).isInstanceOf(IllegalArgumentException.class);
    }
}
