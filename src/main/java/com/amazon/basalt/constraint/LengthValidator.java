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

import java.lang.reflect.Array;

import java.util.Collection;
import java.util.Map;

import com.amazon.basalt.MalformedPropertyException;

import com.amazon.basalt.property.Validator;

/**
 * Limits the length of text, collections, maps and arrays. Null is accepted,
 * and any other kind of value is rejected.
 *
 * @see RangeValidator
 */
public class LengthValidator implements Validator {
    private final int mMinLength;
    private final int mMaxLength;

    /**
     * @param min minimum allowed length
     * @param max maximum allowed length
     * @throws MalformedPropertyException if min is negative or max is less than min
     */
    public LengthValidator(int min, int max) {
        mMinLength = min;
        mMaxLength = max;
        if (mMinLength < 0 || mMaxLength < mMinLength) {
            throw new MalformedPropertyException("Illegal length validator: " + rangeString());
        }
    }

    /**
     * Accepts lengths of at least min.
     */
    public LengthValidator(int min) {
        this(min, Integer.MAX_VALUE);
    }

    public boolean isValid(Object value) {
        if (value == null) {
            return true;
        }
        int length;
        if (value instanceof CharSequence) {
            length = ((CharSequence) value).length();
        } else if (value instanceof Collection) {
            length = ((Collection<?>) value).size();
        } else if (value instanceof Map) {
            length = ((Map<?, ?>) value).size();
        } else if (value.getClass().isArray()) {
            length = Array.getLength(value);
        } else {
            return false;
        }
        return mMinLength <= length && length <= mMaxLength;
    }

    @Override
    public String toString() {
        return "LengthValidator " + rangeString();
    }

    private String rangeString() {
        StringBuilder b = new StringBuilder();
        b.append('[');
        b.append(mMinLength);
        b.append("..");
        if (mMaxLength != Integer.MAX_VALUE) {
            b.append(mMaxLength);
        }
        b.append(']');
        return b.toString();
    }
}
