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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Property holding a list of storage-safe values. Lists are kept as given,
 * other collections and arrays are copied into a new list.
 */
public class ListProperty extends Property<List<Object>> {
    /**
     * Copies a collection or array into a new list.
     *
     * @return null if value is neither
     */
    static List<Object> toList(Object value) {
        if (value instanceof Collection) {
            return new ArrayList<Object>((Collection<?>) value);
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> list = new ArrayList<Object>(length);
            for (int i=0; i<length; i++) {
                list.add(Array.get(value, i));
            }
            return list;
        }
        return null;
    }

    public ListProperty() {
        this(null);
    }

    public ListProperty(PropertyOptions options) {
        super(options);
    }

    @Override
    @SuppressWarnings("unchecked")
    protected List<Object> coerce(Object value) {
        if (value instanceof List) {
            return (List<Object>) value;
        }
        List<Object> list = toList(value);
        if (list == null) {
            throw typeError(value, "a list");
        }
        return list;
    }

    @Override
    protected List<Object> coerceDefault(Object value) {
        List<Object> list = toList(value);
        if (list == null) {
            throw typeError(value, "a list");
        }
        return list;
    }

    @Override
    protected List<Object> emptyValue() {
        return new ArrayList<Object>();
    }
}
