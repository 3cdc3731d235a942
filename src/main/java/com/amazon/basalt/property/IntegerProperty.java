/*
 * Copyright 2006 Amazon Technologies, Inc. or its affiliates.
 * Amazon, Amazon.com and Basalt are trademarks or registered trademarks
 * of Amazon Technologies, Inc. or its affiliates.  All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.amazon.basalt.property;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Integer property, standardized to a {@code Long}. Numbers are truncated
 * towards zero, booleans become 0 or 1, and text is parsed as a decimal
 * integer. Numbers outside the range of a {@code long} are rejected.
 */
public class IntegerProperty extends Property<Long> {
    public IntegerProperty() {
        this(null);
    }

    public IntegerProperty(PropertyOptions options) {
        super(options);
    }

    @Override
    protected Long coerce(Object value) {
        if (value instanceof Long) {
            return (Long) value;
        }
        if (value instanceof Number) {
            Number n = (Number) value;
            if (!fitsLong(n)) {
                throw typeError(value, "a number in the range of a long");
            }
            return n.longValue();
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1L : 0L;
        }
        if (value instanceof CharSequence) {
            try {
                return Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                throw typeError(value, "integer text", e);
            }
        }
        throw typeError(value, "an integer, a number, a boolean or integer text");
    }

    @Override
    protected boolean isInDomain(Object value) {
        if (value instanceof Number) {
            return fitsLong((Number) value);
        }
        if (value instanceof Boolean) {
            return true;
        }
        if (value instanceof CharSequence) {
            try {
                Long.parseLong(value.toString().trim());
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return false;
    }

    /**
     * Returns true if the number, truncated towards zero, is a long value.
     */
    static boolean fitsLong(Number n) {
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return true;
        }
        if (n instanceof BigInteger) {
            return ((BigInteger) n).bitLength() < 64;
        }
        if (n instanceof BigDecimal) {
            return ((BigDecimal) n).toBigInteger().bitLength() < 64;
        }
        double d = n.doubleValue();
        // Long.MIN_VALUE is exact as a double, Long.MAX_VALUE is not.
        return d >= -0x1p63 && d < 0x1p63;
    }
}
