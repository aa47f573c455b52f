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
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

/**
 * Serialization of login messages and procedure invocations to ByteBuf according to the
 * VoltDB wire protocol. All multi-byte values are big-endian.
 */
public final class BytesSerializer {

    public static final byte INVOCATION_VERSION = 0;
    public static final String SERVICE = "database";

    private BytesSerializer() {}

    /**
     * Serializes the login message body. The protocol and password hash version bytes
     * belong to the login frame and are not part of this payload.
     *
     * @param username the user name, empty for an unsecured server
     * @param password the clear text password, hashed with SHA-256 before sending
     * @return the login payload
     */
    public static ByteBuf serializeLoginMessage(String username, String password) {
        var buffer = Unpooled.buffer();
        writeString(buffer, SERVICE);
        writeString(buffer, StringUtils.defaultString(username));
        buffer.writeBytes(sha256(StringUtils.defaultString(password)));
        return buffer;
    }

    /**
     * Serializes a stored procedure invocation.
     *
     * @param procedure the procedure name
     * @param handle the client handle that correlates the response
     * @param args the procedure parameters
     * @return the invocation payload
     * @throws VoltInvalidArgumentException if the procedure name is blank or a parameter
     *         has no wire representation
     */
    public static ByteBuf serializeStatement(String procedure, long handle, Object... args) {
        if (StringUtils.isBlank(procedure)) {
            throw new VoltInvalidArgumentException("Procedure name cannot be blank");
        }
        Object[] params = args == null ? new Object[0] : args;
        if (params.length > Short.MAX_VALUE) {
            throw new VoltInvalidArgumentException("Too many parameters: " + params.length);
        }
        var buffer = Unpooled.buffer();
        buffer.writeByte(INVOCATION_VERSION);
        writeString(buffer, procedure);
        buffer.writeLong(handle);
        buffer.writeShort(params.length);
        for (Object param : params) {
            buffer.writeBytes(toBytes(param));
        }
        return buffer;
    }

    /**
     * Serializes one procedure parameter as its type code followed by its value.
     *
     * @param param the parameter, possibly null
     * @return the encoded parameter
     */
    public static ByteBuf toBytes(Object param) {
        var buffer = Unpooled.buffer();
        if (param == null) {
            buffer.writeByte(VoltType.NULL.asCode());
        } else if (param instanceof Byte) {
            buffer.writeByte(VoltType.TINYINT.asCode());
            buffer.writeByte((Byte) param);
        } else if (param instanceof Boolean) {
            buffer.writeByte(VoltType.TINYINT.asCode());
            buffer.writeByte((Boolean) param ? 1 : 0);
        } else if (param instanceof Short) {
            buffer.writeByte(VoltType.SMALLINT.asCode());
            buffer.writeShort((Short) param);
        } else if (param instanceof Integer) {
            buffer.writeByte(VoltType.INTEGER.asCode());
            buffer.writeInt((Integer) param);
        } else if (param instanceof Long) {
            buffer.writeByte(VoltType.BIGINT.asCode());
            buffer.writeLong((Long) param);
        } else if (param instanceof Float || param instanceof Double) {
            buffer.writeByte(VoltType.FLOAT.asCode());
            buffer.writeDouble(((Number) param).doubleValue());
        } else if (param instanceof String) {
            buffer.writeByte(VoltType.STRING.asCode());
            writeString(buffer, (String) param);
        } else if (param instanceof Instant) {
            buffer.writeByte(VoltType.TIMESTAMP.asCode());
            buffer.writeLong(toMicros((Instant) param));
        } else if (param instanceof Date) {
            buffer.writeByte(VoltType.TIMESTAMP.asCode());
            buffer.writeLong(toMicros(((Date) param).toInstant()));
        } else if (param instanceof BigDecimal) {
            buffer.writeByte(VoltType.DECIMAL.asCode());
            writeDecimal(buffer, (BigDecimal) param);
        } else if (param instanceof byte[]) {
            buffer.writeByte(VoltType.VARBINARY.asCode());
            writeBytes(buffer, (byte[]) param);
        } else {
            throw new VoltInvalidArgumentException(
                    "Unsupported parameter type: " + param.getClass().getName());
        }
        return buffer;
    }

    public static void writeString(ByteBuf buffer, String value) {
        if (value == null) {
            buffer.writeInt(VoltType.NULL_STRING_LENGTH);
            return;
        }
        writeBytes(buffer, value.getBytes(StandardCharsets.UTF_8));
    }

    public static void writeBytes(ByteBuf buffer, byte[] value) {
        if (value == null) {
            buffer.writeInt(VoltType.NULL_STRING_LENGTH);
            return;
        }
        buffer.writeInt(value.length);
        buffer.writeBytes(value);
    }

    public static void writeDecimal(ByteBuf buffer, BigDecimal value) {
        BigDecimal scaled = value.setScale(VoltType.DECIMAL_SCALE, RoundingMode.HALF_UP);
        if (scaled.abs().compareTo(VoltType.MAX_DECIMAL) > 0) {
            throw new VoltInvalidArgumentException("Decimal out of range: " + value);
        }
        writeInt128(buffer, scaled.unscaledValue());
    }

    static void writeInt128(ByteBuf buffer, BigInteger value) {
        byte[] raw = value.toByteArray();
        byte pad = value.signum() < 0 ? (byte) 0xFF : 0;
        for (int i = raw.length; i < VoltType.DECIMAL_LENGTH; i++) {
            buffer.writeByte(pad);
        }
        buffer.writeBytes(raw);
    }

    static long toMicros(Instant instant) {
        return ChronoUnit.MICROS.between(Instant.EPOCH, instant);
    }

    static byte[] sha256(String password) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(password.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
