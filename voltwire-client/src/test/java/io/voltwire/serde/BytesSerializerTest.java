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

package io.voltwire.serde;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.voltwire.exception.VoltInvalidArgumentException;
import io.voltwire.table.VoltType;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BytesSerializerTest {

    @Nested
    class Login {

        @Test
        void shouldSerializeServiceUserAndPasswordHash() {
            // when
            ByteBuf login = BytesSerializer.serializeLoginMessage("admin", "secret");

            // then
            assertThat(BytesDeserializer.readString(login)).isEqualTo("database");
            assertThat(BytesDeserializer.readString(login)).isEqualTo("admin");
            byte[] hash = new byte[32];
            login.readBytes(hash);
            assertThat(hash).isEqualTo(BytesSerializer.sha256("secret"));
            assertThat(login.readableBytes()).isZero();
        }

        @Test
        void shouldTreatNullCredentialsAsEmpty() {
            // when
            ByteBuf login = BytesSerializer.serializeLoginMessage(null, null);

            // then
            BytesDeserializer.readString(login);
            assertThat(BytesDeserializer.readString(login)).isEmpty();
            assertThat(login.readableBytes()).isEqualTo(32);
        }

        @Test
        void shouldHashEmptyPasswordWithSha256() {
            // SHA-256 of the empty string
            assertThat(BytesSerializer.sha256(""))
                    .startsWith((byte) 0xe3, (byte) 0xb0, (byte) 0xc4, (byte) 0x42)
                    .hasSize(32);
        }
    }

    @Nested
    class Statement {

        @Test
        void shouldSerializeInvocationHeader() {
            // when
            ByteBuf statement = BytesSerializer.serializeStatement("HELLOWORLD.select", 77L, "French");

            // then
            assertThat(statement.readByte()).isEqualTo(BytesSerializer.INVOCATION_VERSION);
            assertThat(BytesDeserializer.readString(statement)).isEqualTo("HELLOWORLD.select");
            assertThat(statement.readLong()).isEqualTo(77L);
            assertThat(statement.readShort()).isEqualTo((short) 1);
            assertThat(statement.readByte()).isEqualTo(VoltType.STRING.asCode());
            assertThat(BytesDeserializer.readString(statement)).isEqualTo("French");
            assertThat(statement.readableBytes()).isZero();
        }

        @Test
        void shouldSerializeStatementWithoutParameters() {
            // when
            ByteBuf statement = BytesSerializer.serializeStatement("@Ping", 1L);

            // then
            statement.skipBytes(1 + 4 + "@Ping".length() + 8);
            assertThat(statement.readShort()).isZero();
        }

        @Test
        void shouldRejectBlankProcedureName() {
            assertThatThrownBy(() -> BytesSerializer.serializeStatement(" ", 1L))
                    .isInstanceOf(VoltInvalidArgumentException.class);
        }
    }

    @Nested
    class Parameters {

        @Test
        void shouldEncodeNullAsNullType() {
            ByteBuf bytes = BytesSerializer.toBytes(null);

            assertThat(bytes.readByte()).isEqualTo(VoltType.NULL.asCode());
            assertThat(bytes.readableBytes()).isZero();
        }

        @Test
        void shouldEncodeIntegersWithTheirWidth() {
            ByteBuf tiny = BytesSerializer.toBytes((byte) 3);
            ByteBuf small = BytesSerializer.toBytes((short) 300);
            ByteBuf integer = BytesSerializer.toBytes(70_000);
            ByteBuf big = BytesSerializer.toBytes(5_000_000_000L);

            assertThat(tiny.readByte()).isEqualTo(VoltType.TINYINT.asCode());
            assertThat(tiny.readByte()).isEqualTo((byte) 3);
            assertThat(small.readByte()).isEqualTo(VoltType.SMALLINT.asCode());
            assertThat(small.readShort()).isEqualTo((short) 300);
            assertThat(integer.readByte()).isEqualTo(VoltType.INTEGER.asCode());
            assertThat(integer.readInt()).isEqualTo(70_000);
            assertThat(big.readByte()).isEqualTo(VoltType.BIGINT.asCode());
            assertThat(big.readLong()).isEqualTo(5_000_000_000L);
        }

        @Test
        void shouldEncodeBooleanAsTinyint() {
            ByteBuf bytes = BytesSerializer.toBytes(Boolean.TRUE);

            assertThat(bytes.readByte()).isEqualTo(VoltType.TINYINT.asCode());
            assertThat(bytes.readByte()).isEqualTo((byte) 1);
        }

        @Test
        void shouldEncodeFloatsAsDouble() {
            ByteBuf bytes = BytesSerializer.toBytes(1.5f);

            assertThat(bytes.readByte()).isEqualTo(VoltType.FLOAT.asCode());
            assertThat(bytes.readDouble()).isEqualTo(1.5d);
        }

        @Test
        void shouldEncodeStringAsUtf8() {
            ByteBuf bytes = BytesSerializer.toBytes("Grüß");

            assertThat(bytes.readByte()).isEqualTo(VoltType.STRING.asCode());
            assertThat(bytes.readInt()).isEqualTo("Grüß".getBytes(StandardCharsets.UTF_8).length);
        }

        @Test
        void shouldEncodeTimestampsAsEpochMicros() {
            Instant instant = Instant.ofEpochSecond(1, 2_000);
            ByteBuf fromInstant = BytesSerializer.toBytes(instant);
            ByteBuf fromDate = BytesSerializer.toBytes(new Date(1_500));

            assertThat(fromInstant.readByte()).isEqualTo(VoltType.TIMESTAMP.asCode());
            assertThat(fromInstant.readLong()).isEqualTo(1_000_002L);
            assertThat(fromDate.readByte()).isEqualTo(VoltType.TIMESTAMP.asCode());
            assertThat(fromDate.readLong()).isEqualTo(1_500_000L);
        }

        @Test
        void shouldEncodeDecimalAsScaledInt128() {
            ByteBuf bytes = BytesSerializer.toBytes(new BigDecimal("-1.5"));

            assertThat(bytes.readByte()).isEqualTo(VoltType.DECIMAL.asCode());
            byte[] raw = new byte[VoltType.DECIMAL_LENGTH];
            bytes.readBytes(raw);
            assertThat(new BigInteger(raw)).isEqualTo(new BigInteger("-1500000000000"));
        }

        @Test
        void shouldRejectDecimalOutOfRange() {
            assertThatThrownBy(() -> BytesSerializer.toBytes(new BigDecimal("1e30")))
                    .isInstanceOf(VoltInvalidArgumentException.class);
        }

        @Test
        void shouldEncodeVarbinaryWithLength() {
            ByteBuf bytes = BytesSerializer.toBytes(new byte[] {1, 2});

            assertThat(bytes.readByte()).isEqualTo(VoltType.VARBINARY.asCode());
            assertThat(bytes.readInt()).isEqualTo(2);
            assertThat(bytes.readShort()).isEqualTo((short) 0x0102);
        }

        @Test
        void shouldRejectUnsupportedParameterType() {
            assertThatThrownBy(() -> BytesSerializer.toBytes(new Object()))
                    .isInstanceOf(VoltInvalidArgumentException.class)
                    .hasMessageContaining("java.lang.Object");
        }

        @Test
        void shouldWriteNullStringAsMinusOneLength() {
            ByteBuf buffer = Unpooled.buffer();

            BytesSerializer.writeString(buffer, null);

            assertThat(buffer.readInt()).isEqualTo(-1);
        }
    }
}
