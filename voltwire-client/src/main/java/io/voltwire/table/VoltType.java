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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Value types of the VoltDB wire format, with their type codes and null sentinels.
 */
public enum VoltType {
    NULL(1),
    TINYINT(3),
    SMALLINT(4),
    INTEGER(5),
    BIGINT(6),
    FLOAT(8),
    STRING(9),
    TIMESTAMP(11),
    DECIMAL(22),
    VARBINARY(25);

    public static final byte NULL_TINYINT = Byte.MIN_VALUE;
    public static final short NULL_SMALLINT = Short.MIN_VALUE;
    public static final int NULL_INTEGER = Integer.MIN_VALUE;
    public static final long NULL_BIGINT = Long.MIN_VALUE;
    public static final double NULL_FLOAT = -1.7E+308;
    public static final long NULL_TIMESTAMP = Long.MIN_VALUE;
    public static final int NULL_STRING_LENGTH = -1;

    /** Decimals are fixed point with this scale, carried as a 16 byte two's complement integer. */
    public static final int DECIMAL_SCALE = 12;

    public static final int DECIMAL_LENGTH = 16;

    public static final BigInteger NULL_DECIMAL = BigInteger.ONE.shiftLeft(127).negate();

    public static final BigDecimal MAX_DECIMAL = new BigDecimal("99999999999999999999999999.999999999999");

    private static final Map<Byte, VoltType> CODE_MAP = new HashMap<>();

    static {
        for (VoltType type : values()) {
            CODE_MAP.put(type.code, type);
        }
    }

    private final byte code;

    VoltType(int code) {
        this.code = (byte) code;
    }

    public byte asCode() {
        return code;
    }

    /**
     * Returns the VoltType for the given wire code.
     *
     * @param code the type code
     * @return the corresponding VoltType
     * @throws IllegalArgumentException if the code is not a supported type
     */
    public static VoltType fromCode(byte code) {
        VoltType type = CODE_MAP.get(code);
        if (type == null) {
            throw new IllegalArgumentException("Unsupported column type code: " + code);
        }
        return type;
    }
}
