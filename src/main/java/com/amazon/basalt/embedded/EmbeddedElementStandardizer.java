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

package com.amazon.basalt.embedded;

import java.util.Map;

import com.amazon.basalt.EmbeddedDocument;
import com.amazon.basalt.PropertyTypeException;

import com.amazon.basalt.container.ElementStandardizer;

/**
 * Accepts an instance of an embedded document class, constructs one from a
 * map of fields, or passes null. Anything else is a type error.
 *
 * @param <E> embedded document type
 */
public class EmbeddedElementStandardizer<E extends EmbeddedDocument>
    implements ElementStandardizer<E>
{
    private final EmbeddedType<E> mType;
    private final String mPropertyName;

    /**
     * @param propertyName name reported in type errors, which may be null
     */
    public EmbeddedElementStandardizer(EmbeddedType<E> type, String propertyName) {
        if (type == null) {
            throw new IllegalArgumentException("Null embedded type");
        }
        mType = type;
        mPropertyName = propertyName;
    }

    public EmbeddedType<E> getType() {
        return mType;
    }

    @SuppressWarnings("unchecked")
    public E standardize(Object element) {
        if (element == null) {
            return null;
        }
        Class<E> clazz = mType.getDocumentClass();
        if (clazz.isInstance(element)) {
            return clazz.cast(element);
        }
        if (element instanceof Map) {
            return mType.newInstance((Map<String, ?>) element);
        }
        throw new PropertyTypeException
            (mPropertyName, element, "a " + clazz.getSimpleName() + " or a map of its fields");
    }
}
