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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.amazon.basalt.MalformedPropertyException;

/**
 * Property restricted to a fixed list of text labels. Labels are stored by
 * their index in the list, and so labels may be renamed freely but must never
 * be reordered or removed.
 *
 * <p>Standardizing an integer maps it to the label at that index. Labels are
 * passed through as-is, even when unknown, leaving rejection to {@link
 * #validate}.
 */
public class EnumProperty extends Property<String> {
    private final List<String> mLabels;
    private final Map<String, Integer> mIndexes;

    public EnumProperty(String... labels) {
        this(labels == null ? null : Arrays.asList(labels), null);
    }

    /**
     * @param labels allowed labels, in storage order
     * @throws MalformedPropertyException if labels are empty, null or duplicated
     */
    public EnumProperty(List<String> labels, PropertyOptions options) {
        super(options);
        if (labels == null || labels.isEmpty()) {
            throw new MalformedPropertyException("Enum property requires at least one label");
        }
        List<String> copy = new ArrayList<String>(labels.size());
        Map<String, Integer> indexes = new HashMap<String, Integer>(labels.size() * 2);
        for (String label : labels) {
            if (label == null) {
                throw new MalformedPropertyException("Enum label must not be null");
            }
            if (indexes.put(label, copy.size()) != null) {
                throw new MalformedPropertyException("Duplicate enum label: " + label);
            }
            copy.add(label);
        }
        mLabels = Collections.unmodifiableList(copy);
        mIndexes = indexes;
    }

    /**
     * @return non-null, unmodifiable list of labels in storage order
     */
    public List<String> getLabels() {
        return mLabels;
    }

    @Override
    protected String coerce(Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        if (isIntegral(value)) {
            return labelAt(((Number) value).longValue());
        }
        throw typeError(value, "a label or a label index");
    }

    @Override
    protected boolean isInDomain(Object value) {
        return mIndexes.containsKey(value);
    }

    @Override
    protected Object toStorage(Object value) {
        if (!(value instanceof String)) {
            throw typeError(value, "a label");
        }
        Integer index = mIndexes.get(value);
        if (index == null) {
            throw new IllegalArgumentException
                ("Value for \"" + getName() + "\" is not allowed: " + value);
        }
        return index;
    }

    @Override
    protected String fromStorage(Object dbValue) {
        if (isIntegral(dbValue)) {
            return labelAt(((Number) dbValue).longValue());
        }
        throw typeError(dbValue, "a stored label index");
    }

    private String labelAt(long index) {
        if (index < 0 || index >= mLabels.size()) {
            throw new IllegalArgumentException
                ("No label for \"" + getName() + "\" at index " + index +
                 "; labels are " + mLabels);
        }
        return mLabels.get((int) index);
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long ||
            value instanceof Short || value instanceof Byte;
    }
}
