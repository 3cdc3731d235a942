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

package com.amazon.basalt.constraint;

import java.util.Arrays;

import com.amazon.basalt.MalformedPropertyException;

import com.amazon.basalt.property.Validator;

/**
 * Limits a numeric value to a range, optionally also to a specific set. The
 * value may be any {@link Number} or numeric text. Null is accepted, and
 * anything else is rejected.
 *
 * <p>Example:<pre>
 * IntegerProperty age = new IntegerProperty
 *     (PropertyOptions.defaults().withValidator(RangeValidator.between(0, 120)));
 * </pre>
 *
 * @see LengthValidator
 * @see TextValidator
 */
public class RangeValidator implements Validator {
    public static RangeValidator between(long min, long max) {
        return new RangeValidator(min, max, null, null);
    }

    public static RangeValidator oneOf(long... allowed) {
        return new RangeValidator(Long.MIN_VALUE, Long.MAX_VALUE, allowed, null);
    }

    private final long mMinValue;
    private final long mMaxValue;

    /** Disallowed values, sorted for binary search. */
    private final long[] mDisallowed;

    /** Allowed values, sorted for binary search. */
    private final long[] mAllowed;

    /**
     * @param min minimum allowed value
     * @param max maximum allowed value
     * @param allowed optional set of allowed values
     * @param disallowed optional set of disallowed values
     * @throws MalformedPropertyException if range is illegal or an allowed
     * value is out of range or disallowed
     */
    public RangeValidator(long min, long max, long[] allowed, long[] disallowed) {
        mMinValue = min;
        mMaxValue = max;
        if (mMaxValue < mMinValue) {
            throw new MalformedPropertyException("Illegal range for range validator: " +
                                                 rangeString());
        }

        if (disallowed == null || disallowed.length == 0) {
            disallowed = null;
        } else {
            disallowed = disallowed.clone();
            Arrays.sort(disallowed);
        }

        if (allowed == null || allowed.length == 0) {
            allowed = null;
        } else {
            allowed = allowed.clone();
            Arrays.sort(allowed);
            for (long value : allowed) {
                if (value < mMinValue || value > mMaxValue ||
                    (disallowed != null && Arrays.binarySearch(disallowed, value) >= 0)) {
                    throw new MalformedPropertyException
                        ("Allowed value contradiction for range validator: " + value);
                }
            }

            // No need to have a set of disallowed values.
            disallowed = null;
        }

        mDisallowed = disallowed;
        mAllowed = allowed;
    }

    public boolean isValid(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double || value instanceof Float) {
            return isValid(((Number) value).doubleValue());
        }
        if (value instanceof Number) {
            return isValid(((Number) value).longValue());
        }
        if (value instanceof CharSequence) {
            String str = value.toString().trim();
            try {
                return isValid(Long.parseLong(str));
            } catch (NumberFormatException e) {
                try {
                    return isValid(Double.parseDouble(str));
                } catch (NumberFormatException e2) {
                    return false;
                }
            }
        }
        return false;
    }

    public boolean isValid(long value) {
        if (value < mMinValue || value > mMaxValue) {
            return false;
        }
        if (mDisallowed != null && Arrays.binarySearch(mDisallowed, value) >= 0) {
            return false;
        }
        return mAllowed == null || Arrays.binarySearch(mAllowed, value) >= 0;
    }

    public boolean isValid(double value) {
        if (Double.isNaN(value) || value < mMinValue || value > mMaxValue) {
            return false;
        }
        long longValue = (long) value;
        if (mDisallowed != null && longValue == value &&
            Arrays.binarySearch(mDisallowed, longValue) >= 0) {
            return false;
        }
        if (mAllowed != null) {
            return longValue == value && Arrays.binarySearch(mAllowed, longValue) >= 0;
        }
        return true;
    }

    @Override
    public String toString() {
        return "RangeValidator " + rangeString();
    }

    private String rangeString() {
        StringBuilder b = new StringBuilder();
        b.append('[');
        if (mMinValue != Long.MIN_VALUE) {
            b.append(mMinValue);
        }
        b.append("..");
        if (mMaxValue != Long.MAX_VALUE) {
            b.append(mMaxValue);
        }
        b.append(']');
        return b.toString();
    }
}
