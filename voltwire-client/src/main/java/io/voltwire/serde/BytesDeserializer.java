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
import io.voltwire.exception.VoltAuthenticationException;
import io.voltwire.exception.VoltProtocolException;
import io.voltwire.response.ClientResponse;
import io.voltwire.response.LoginResponse;
import io.voltwire.table.VoltColumn;
import io.voltwire.table.VoltTable;
import io.voltwire.table.VoltType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Deserialization of ByteBuf frames to login and procedure responses according to the
 * VoltDB wire protocol.
 */
public final class BytesDeserializer {

    static final int STATUS_STRING_PRESENT = 0x20;
    static final int EXCEPTION_PRESENT = 0x40;
    static final int APP_STATUS_STRING_PRESENT = 0x80;

    private static final int HANDLE_OFFSET = 1;

    private BytesDeserializer() {}

    /**
     * Reads the login response frame.
     *
     * @param response the frame payload
     * @return the session identity
     * @throws VoltAuthenticationException if the server rejected the credentials
     * @throws VoltProtocolException if the frame is truncated
     */
    public static LoginResponse readLoginResponse(ByteBuf response) {
        try {
            response.readByte(); // version
            var authResult = response.readByte();
            if (authResult != 0) {
                throw new VoltAuthenticationException(authResult);
            }
            var hostId = response.readInt();
            var connectionId = response.readLong();
            var clusterStartTimestamp = response.readLong();
            var leaderAddress = response.readInt();
            var buildString = readString(response);
            return new LoginResponse(hostId, connectionId, clusterStartTimestamp, leaderAddress, buildString);
        } catch (IndexOutOfBoundsException e) {
            throw new VoltProtocolException("Truncated login response", e);
        }
    }

    /**
     * Reads a procedure response frame.
     *
     * @param response the frame payload
     * @return the decoded response
     * @throws VoltProtocolException if the frame is truncated or carries an unknown column type
     */
    public static ClientResponse readClientResponse(ByteBuf response) {
        try {
            response.readByte(); // version
            var clientHandle = response.readLong();
            var fieldsPresent = response.readUnsignedByte();
            var status = response.readByte();
            Optional<String> statusString = Optional.empty();
            if ((fieldsPresent & STATUS_STRING_PRESENT) != 0) {
                statusString = Optional.ofNullable(readString(response));
            }
            var appStatus = response.readByte();
            Optional<String> appStatusString = Optional.empty();
            if ((fieldsPresent & APP_STATUS_STRING_PRESENT) != 0) {
                appStatusString = Optional.ofNullable(readString(response));
            }
            var clusterRoundTripTime = response.readInt();
            if ((fieldsPresent & EXCEPTION_PRESENT) != 0) {
                // serialized server-side exception, reported through the status string
                response.skipBytes(response.readInt());
            }
            var tableCount = response.readShort();
            if (tableCount < 0) {
                throw new VoltProtocolException("Negative table count " + tableCount);
            }
            List<VoltTable> tables = new ArrayList<>(tableCount);
            for (int i = 0; i < tableCount; i++) {
                tables.add(readTable(response));
            }
            return new ClientResponse(
                    clientHandle, status, statusString, appStatus, appStatusString, clusterRoundTripTime, tables);
        } catch (IndexOutOfBoundsException | IllegalArgumentException e) {
            throw new VoltProtocolException("Malformed procedure response", e);
        }
    }

    /**
     * Reads the client handle of a procedure response without consuming the buffer.
     *
     * @param response the frame payload
     * @return the handle, if the frame is long enough to carry one
     */
    public static Optional<Long> peekHandle(ByteBuf response) {
        int index = response.readerIndex() + HANDLE_OFFSET;
        if (response.writerIndex() < index + Long.BYTES) {
            return Optional.empty();
        }
        return Optional.of(response.getLong(index));
    }

    public static VoltTable readTable(ByteBuf response) {
        var totalLength = response.readInt();
        if (totalLength < 0 || totalLength > response.readableBytes()) {
            throw new VoltProtocolException("Invalid table length " + totalLength);
        }
        response.readInt(); // metadata length
        var status = response.readByte();
        var columnCount = response.readShort();
        if (columnCount < 0) {
            throw new VoltProtocolException("Negative column count " + columnCount);
        }
        var types = new VoltType[columnCount];
        for (int i = 0; i < columnCount; i++) {
            types[i] = VoltType.fromCode(response.readByte());
        }
        List<VoltColumn> columns = new ArrayList<>(columnCount);
        for (int i = 0; i < columnCount; i++) {
            columns.add(new VoltColumn(readString(response), types[i]));
        }
        var rowCount = response.readInt();
        if (rowCount < 0) {
            throw new VoltProtocolException("Negative row count " + rowCount);
        }
        // every row carries at least its 4-byte length
        if (rowCount > response.readableBytes() / Integer.BYTES) {
            throw new VoltProtocolException(
                    "Row count " + rowCount + " exceeds the " + response.readableBytes() + " bytes left");
        }
        List<List<Object>> rows = new ArrayList<>(rowCount);
        for (int r = 0; r < rowCount; r++) {
            response.readInt(); // row length
            List<Object> row = new ArrayList<>(columnCount);
            for (VoltType type : types) {
                row.add(readValue(response, type));
            }
            rows.add(row);
        }
        return new VoltTable(status, columns, rows);
    }

    /**
     * Reads one column value, mapping the type's null sentinel to {@code null}.
     *
     * @param buffer the buffer positioned at the value
     * @param type the column type
     * @return the value, or null for a SQL null
     */
    public static Object readValue(ByteBuf buffer, VoltType type) {
        switch (type) {
            case NULL:
                return null;
            case TINYINT: {
                byte value = buffer.readByte();
                return value == VoltType.NULL_TINYINT ? null : value;
            }
            case SMALLINT: {
                short value = buffer.readShort();
                return value == VoltType.NULL_SMALLINT ? null : value;
            }
            case INTEGER: {
                int value = buffer.readInt();
                return value == VoltType.NULL_INTEGER ? null : value;
            }
            case BIGINT: {
                long value = buffer.readLong();
                return value == VoltType.NULL_BIGINT ? null : value;
            }
            case FLOAT: {
                double value = buffer.readDouble();
                return value <= VoltType.NULL_FLOAT ? null : value;
            }
            case STRING:
                return readString(buffer);
            case TIMESTAMP: {
                long micros = buffer.readLong();
                return micros == VoltType.NULL_TIMESTAMP ? null : Instant.EPOCH.plus(micros, ChronoUnit.MICROS);
            }
            case DECIMAL:
                return readDecimal(buffer);
            case VARBINARY:
                return readBytes(buffer);
            default:
                throw new VoltProtocolException("Unsupported column type " + type);
        }
    }

    public static String readString(ByteBuf buffer) {
        var length = buffer.readInt();
        if (length == VoltType.NULL_STRING_LENGTH) {
            return null;
        }
        checkLength(buffer, length, "string");
        return buffer.readCharSequence(length, StandardCharsets.UTF_8).toString();
    }

    public static byte[] readBytes(ByteBuf buffer) {
        var length = buffer.readInt();
        if (length == VoltType.NULL_STRING_LENGTH) {
            return null;
        }
        checkLength(buffer, length, "varbinary");
        byte[] bytes = new byte[length];
        buffer.readBytes(bytes);
        return bytes;
    }

    public static BigDecimal readDecimal(ByteBuf buffer) {
        byte[] bytes = new byte[VoltType.DECIMAL_LENGTH];
        buffer.readBytes(bytes);
        var unscaled = new BigInteger(bytes);
        if (unscaled.equals(VoltType.NULL_DECIMAL)) {
            return null;
        }
        return new BigDecimal(unscaled, VoltType.DECIMAL_SCALE);
    }

    private static void checkLength(ByteBuf buffer, int length, String kind) {
        if (length < 0 || length > buffer.readableBytes()) {
            throw new VoltProtocolException(
                    "Invalid " + kind + " length " + length + " with " + buffer.readableBytes() + " bytes left");
        }
    }
}
