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

import java.util.LinkedHashMap;
import java.util.Map;

import com.amazon.basalt.EmbeddedDocument;

import com.amazon.basalt.property.Property;
import com.amazon.basalt.property.PropertyOptions;

/**
 * Property holding a map of text keys to embedded documents, stored as a map
 * of maps. Null is standardized into an empty map.
 *
 * @param <E> embedded document type
 */
public class EmbeddedDocumentsDictProperty<E extends EmbeddedDocument>
    extends Property<EmbeddedDocumentMap<E>>
{
    private final EmbeddedType<E> mType;

    public EmbeddedDocumentsDictProperty(Class<E> documentClass) {
        this(BeanEmbeddedType.forClass(documentClass), null);
    }

    public EmbeddedDocumentsDictProperty(EmbeddedType<E> type, PropertyOptions options) {
        super(options);
        if (type == null) {
            throw new IllegalArgumentException("Null embedded type");
        }
        mType = type;
    }

    public EmbeddedType<E> getType() {
        return mType;
    }

    @Override
    protected EmbeddedDocumentMap<E> coerce(Object value) {
        if (value instanceof EmbeddedDocumentMap
            && ((EmbeddedDocumentMap<?>) value).getType() == mType)
        {
            @SuppressWarnings("unchecked")
            EmbeddedDocumentMap<E> map = (EmbeddedDocumentMap<E>) value;
            return map;
        }
        if (value instanceof Map) {
            return new EmbeddedDocumentMap<E>(mType, getName(), (Map<?, ?>) value);
        }
        throw typeError(value, "a map of " + mType.getDocumentClass().getSimpleName());
    }

    @Override
    protected EmbeddedDocumentMap<E> coerceDefault(Object value) {
        if (value instanceof Map) {
            return new EmbeddedDocumentMap<E>(mType, getName(), (Map<?, ?>) value);
        }
        return coerce(value);
    }

    @Override
    protected EmbeddedDocumentMap<E> coerceNull() {
        return emptyValue();
    }

    @Override
    protected boolean isInDomain(Object value) {
        if (!(value instanceof Map)) {
            return false;
        }
        Class<E> clazz = mType.getDocumentClass();
        for (Object element : ((Map<?, ?>) value).values()) {
            if (element != null && !clazz.isInstance(element) && !(element instanceof Map)) {
                return false;
            }
        }
        return true;
    }

    @Override
    protected Object toStorage(Object value) {
        EmbeddedDocumentMap<E> map = coerce(value);
        Map<String, Object> serialized = new LinkedHashMap<String, Object>(map.size() * 2);
        for (Map.Entry<String, E> entry : map.entrySet()) {
            E element = entry.getValue();
            serialized.put(entry.getKey(), element == null ? null : element.serialize());
        }
        return serialized;
    }

    @Override
    protected Object toStorageNull() {
        return new LinkedHashMap<String, Object>();
    }

    @Override
    @SuppressWarnings("unchecked")
    protected EmbeddedDocumentMap<E> fromStorage(Object dbValue) {
        if (!(dbValue instanceof Map)) {
            throw typeError(dbValue, "a stored map");
        }
        EmbeddedDocumentMap<E> map = emptyValue();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) dbValue).entrySet()) {
            Object element = entry.getValue();
            String key = String.valueOf(entry.getKey());
            if (element == null) {
                map.put(key, null);
            } else if (element instanceof Map) {
                map.put(key, mType.constructObject((Map<String, ?>) element));
            } else {
                throw typeError(element, "a stored map");
            }
        }
        return map;
    }

    @Override
    protected EmbeddedDocumentMap<E> emptyValue() {
        return new EmbeddedDocumentMap<E>(mType, getName(), null);
    }
}
