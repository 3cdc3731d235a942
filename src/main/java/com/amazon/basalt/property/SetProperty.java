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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Property holding a set of distinct values, in first-seen order. Sets are
 * stored as lists, since storage has no set type. Collections, arrays and
 * other iterables are accepted, and a map contributes its keys. Text is not
 * treated as a sequence of characters and is rejected.
 */
public class SetProperty extends Property<Set<Object>> {
    public SetProperty() {
        this(null);
    }

    public SetProperty(PropertyOptions options) {
        super(options);
    }

    @Override
    @SuppressWarnings("unchecked")
    protected Set<Object> coerce(Object value) {
        if (value instanceof Set) {
            return (Set<Object>) value;
        }
        Set<Object> set = toSet(value);
        if (set == null) {
            throw typeError(value, "a collection");
        }
        return set;
    }

    @Override
    protected Set<Object> coerceDefault(Object value) {
        return new LinkedHashSet<Object>(coerce(value));
    }

    @Override
    protected boolean isInDomain(Object value) {
        return !(value instanceof CharSequence)
            && (value instanceof Iterable || value instanceof Map
                || value.getClass().isArray());
    }

    @Override
    protected Object toStorage(Object value) {
        return new ArrayList<Object>(coerce(value));
    }

    @Override
    protected Set<Object> emptyValue() {
        return new LinkedHashSet<Object>();
    }

    private static Set<Object> toSet(Object value) {
        if (value instanceof CharSequence) {
            return null;
        }
        if (value instanceof Map) {
            return new LinkedHashSet<Object>(((Map<?, ?>) value).keySet());
        }
        if (value instanceof Iterable) {
            Set<Object> set = new LinkedHashSet<Object>();
            for (Object element : (Iterable<?>) value) {
                set.add(element);
            }
            return set;
        }
        List<Object> list = ListProperty.toList(value);
        return list == null ? null : new LinkedHashSet<Object>(list);
    }
}
