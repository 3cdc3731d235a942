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
 * Limits text to be a member of a specific set, or to not be a member of
 * another. The value may be any CharSequence, Character or character array.
 * Null is accepted, and anything else is rejected.
 */
public class TextValidator implements Validator {
    public static TextValidator oneOf(String... allowed) {
        return new TextValidator(allowed, null);
    }

    public static TextValidator noneOf(String... disallowed) {
        return new TextValidator(null, disallowed);
    }

    /** Allowed values, sorted for binary search. */
    private final String[] mAllowed;

    /** Disallowed values, sorted for binary search. */
    private final String[] mDisallowed;

    /**
     * @param allowed optional set of allowed values
     * @param disallowed optional set of disallowed values
     * @throws MalformedPropertyException if an allowed value is also disallowed
     */
    public TextValidator(String[] allowed, String[] disallowed) {
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
            if (disallowed != null) {
                for (String value : allowed) {
                    if (Arrays.binarySearch(disallowed, value) >= 0) {
                        throw new MalformedPropertyException
                            ("Allowed value contradiction for text validator: " + value);
                    }
                }

                // No need to have a set of disallowed values.
                disallowed = null;
            }
        }

        mDisallowed = disallowed;
        mAllowed = allowed;
    }

    public boolean isValid(Object value) {
        if (value == null) {
            return true;
        }
        String str;
        if (value instanceof CharSequence || value instanceof Character) {
            str = value.toString();
        } else if (value instanceof char[]) {
            str = new String((char[]) value);
        } else {
            return false;
        }
        if (mDisallowed != null && Arrays.binarySearch(mDisallowed, str) >= 0) {
            return false;
        }
        return mAllowed == null || Arrays.binarySearch(mAllowed, str) >= 0;
    }

    @Override
    public String toString() {
        if (mAllowed != null) {
            return "TextValidator allowed=" + Arrays.toString(mAllowed);
        }
        if (mDisallowed != null) {
            return "TextValidator disallowed=" + Arrays.toString(mDisallowed);
        }
        return "TextValidator";
    }
}
