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

import java.util.Map;

import com.amazon.basalt.container.DotDict;

/**
 * Property holding a map with text keys, presented as a {@link DotDict}.
 * Nested maps are stored as-is, since a dot dictionary is already a plain map.
 */
public class DictProperty extends Property<DotDict> {
    public DictProperty() {
        this(null);
    }

    public DictProperty(PropertyOptions options) {
        super(options);
    }

    @Override
    protected DotDict coerce(Object value) {
        if (value instanceof DotDict) {
            return (DotDict) value;
        }
        if (value instanceof Map) {
            return new DotDict((Map<?, ?>) value);
        }
        throw typeError(value, "a map");
    }

    @Override
    protected DotDict coerceDefault(Object value) {
        return new DotDict(coerce(value));
    }

    @Override
    protected boolean isInDomain(Object value) {
        return value instanceof Map;
    }

    @Override
    protected DotDict fromStorage(Object dbValue) {
        if (dbValue instanceof Map) {
            return new DotDict((Map<?, ?>) dbValue);
        }
        throw typeError(dbValue, "a stored map");
    }

    @Override
    protected DotDict emptyValue() {
        return new DotDict();
    }
}
