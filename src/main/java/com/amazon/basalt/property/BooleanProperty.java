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

import java.lang.reflect.Array;

import java.util.Collection;
import java.util.Map;

/**
 * Boolean property. Every value has a boolean form, and so validation only
 * consults the configured validators.
 *
 * <p>Numbers are true when non-zero, and collections, maps and arrays when
 * non-empty. Text is read leniently: 'T', 't', 'Y', 'y', '1', "true" and "yes"
 * are true, while 'F', 'f', 'N', 'n', '0', "false", "no" and the empty string
 * are false. Any other text is true. All other objects are true.
 */
public class BooleanProperty extends Property<Boolean> {
    public BooleanProperty() {
        this(null);
    }

    public BooleanProperty(PropertyOptions options) {
        super(options);
    }

    @Override
    protected Boolean coerce(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0.0;
        }
        if (value instanceof Character) {
            return adaptToBoolean(value.toString());
        }
        if (value instanceof CharSequence) {
            return adaptToBoolean(value.toString());
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return !((Map<?, ?>) value).isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) != 0;
        }
        return true;
    }

    private static boolean adaptToBoolean(String text) {
        String str = text.trim();
        switch (str.length()) {
        case 0:
            return false;
        case 1:
            switch (str.charAt(0)) {
            case 'F': case 'f': case 'N': case 'n': case '0':
                return false;
            default:
                return true;
            }
        default:
            return !(str.equalsIgnoreCase("false") || str.equalsIgnoreCase("no"));
        }
    }
}
