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

package com.amazon.basalt;

/**
 * Thrown when a property is given a value of a type it cannot coerce. Type
 * errors are never recovered internally; the caller decides whether to reject
 * the assignment or abort the save.
 */
public class PropertyTypeException extends MalformedArgumentException {

    private static final long serialVersionUID = 1L;

    private static String describe(String propertyName, Object value, String expected) {
        StringBuilder b = new StringBuilder();
        if (propertyName == null) {
            b.append("Property");
        } else {
            b.append("Property \"").append(propertyName).append('"');
        }
        b.append(" accepts ").append(expected).append(", not ");
        if (value == null) {
            b.append("null");
        } else {
            b.append('"').append(String.valueOf(value)).append("\" of type ");
            b.append(value.getClass().getName());
        }
        return b.toString();
    }

    private final String mPropertyName;
    private final transient Object mValue;

    /**
     * @param propertyName name of property, or null if not bound yet
     * @param value rejected value
     * @param expected description of the accepted types
     */
    public PropertyTypeException(String propertyName, Object value, String expected) {
        super(describe(propertyName, value, expected));
        mPropertyName = propertyName;
        mValue = value;
    }

    public PropertyTypeException(String propertyName, Object value, String expected,
                                 Throwable cause)
    {
        super(describe(propertyName, value, expected), cause);
        mPropertyName = propertyName;
        mValue = value;
    }

    /**
     * @return property name, or null if not known
     */
    public String getPropertyName() {
        return mPropertyName;
    }

    public Object getRejectedValue() {
        return mValue;
    }
}
