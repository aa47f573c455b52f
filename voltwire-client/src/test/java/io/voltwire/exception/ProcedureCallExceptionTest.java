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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ProcedureCallExceptionTest {

    @Test
    void shouldFormatStatusAndDescriptions() {
        // when
        var exception = new ProcedureCallException(
                -2, Optional.of("Constraint violation"), 4, Optional.of("duplicate greeting"));

        // then
        assertThat(exception)
                .hasMessage("Procedure call failed [status=-2 (GRACEFUL_FAILURE)]: Constraint violation"
                        + " [app: duplicate greeting]");
        assertThat(exception.getStatus()).isEqualTo(VoltStatus.GRACEFUL_FAILURE);
        assertThat(exception.getAppStatus()).isEqualTo(4);
        assertThat(exception).isInstanceOf(VoltWireException.class);
    }

    @Test
    void shouldKeepRawCodeForUnknownStatus() {
        // when
        var exception = new ProcedureCallException(-42, Optional.empty(), 0, Optional.empty());

        // then
        assertThat(exception).hasMessage("Procedure call failed [status=-42]");
        assertThat(exception.getStatus()).isEqualTo(VoltStatus.UNKNOWN);
        assertThat(exception.getRawStatus()).isEqualTo(-42);
    }

    @ParameterizedTest
    @EnumSource(value = VoltStatus.class, mode = EnumSource.Mode.EXCLUDE, names = "UNKNOWN")
    void shouldRoundTripStatusCodes(VoltStatus status) {
        assertThat(VoltStatus.fromCode(status.getCode())).isEqualTo(status);
    }

    @Test
    void shouldMapUnlistedCodeToUnknown() {
        assertThat(VoltStatus.fromCode(7)).isEqualTo(VoltStatus.UNKNOWN);
    }
}
