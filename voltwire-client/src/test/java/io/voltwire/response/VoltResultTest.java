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
import io.voltwire.table.VoltColumn;
import io.voltwire.table.VoltTable;
import io.voltwire.table.VoltType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VoltResultTest {

    private static VoltTable count(long value) {
        return new VoltTable(
                (byte) 0, List.of(new VoltColumn("modified_tuples", VoltType.BIGINT)), List.of(List.<Object>of(value)));
    }

    @Test
    void shouldSumModificationCountsAcrossTables() {
        var result = new VoltResult(List.of(count(2), count(3)));

        assertThat(result.rowsAffected()).isEqualTo(5);
    }

    @Test
    void shouldIgnoreEmptyTables() {
        var empty = new VoltTable((byte) 0, List.of(new VoltColumn("modified_tuples", VoltType.BIGINT)), List.of());
        var result = new VoltResult(List.of(empty, count(1)));

        assertThat(result.rowsAffected()).isEqualTo(1);
    }

    @Test
    void shouldRejectTableIndexOutOfRange() {
        var rows = new VoltRows(List.of(count(1)));

        assertThat(rows.tableCount()).isEqualTo(1);
        assertThatThrownBy(() -> rows.table(1)).isInstanceOf(VoltInvalidArgumentException.class);
    }
}
